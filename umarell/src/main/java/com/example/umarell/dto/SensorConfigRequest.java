package com.example.umarell.dto;

public record SensorConfigRequest(
        String roomName,
        Long timeoutMs
) {}
