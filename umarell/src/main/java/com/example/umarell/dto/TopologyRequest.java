package com.example.umarell.dto;

public record TopologyRequest(
        String category,
        String floor,
        String nameContains,
        Long timeoutMs
) {}
