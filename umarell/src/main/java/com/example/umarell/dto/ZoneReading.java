package com.example.umarell.dto;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.time.Instant;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record ZoneReading(
        String roomId,
        String roomName,
        String floor,
        String sensorType,
        String sensorId,
        Double value,
        String unit,
        Instant time,
        String label,
        String status       // ok | no_data
) {
    public static final String OK = "ok";
    public static final String NO_DATA = "no_data";
}
