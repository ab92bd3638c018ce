package com.example.umarell.dto;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.util.List;

/**
 * Answer of a zone inspection. {@code configured} vs {@code contributing} tells the caller
 * how much of the zone the answer is actually based on.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ZoneMetricsResult(
        String zone,
        String sensorType,
        String goal,
        String timeRange,
        int rooms,
        int configured,
        int contributing,
        List<String> silentSensors,
        Double value,
        String unit,
        String label,
        ZoneReading reading,          // max / min
        List<ZoneReading> readings    // report
) {}
