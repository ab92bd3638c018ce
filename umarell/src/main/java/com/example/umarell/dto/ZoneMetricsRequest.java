package com.example.umarell.dto;

import com.fasterxml.jackson.annotation.JsonAlias;

public record ZoneMetricsRequest(
        String zone,
        @JsonAlias("type") String sensorType,
        String goal,        // report, max, min, avg
        String timeRange,   // Flux duration, e.g. -1h
        Long timeoutMs
) {}
