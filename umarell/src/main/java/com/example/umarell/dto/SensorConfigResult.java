package com.example.umarell.dto;

import com.example.umarell.models.Element;
import com.fasterxml.jackson.annotation.JsonInclude;

import java.util.List;
import java.util.Map;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record SensorConfigResult(
        Element element,
        Map<String, String> sensors,     // type -> sensor id, empty when the room has none
        Map<String, String> units,       // type -> unit, for types listed in sensor_types
        boolean ambiguous,
        int matchCount,
        List<String> candidates          // only set when ambiguous
) {}
