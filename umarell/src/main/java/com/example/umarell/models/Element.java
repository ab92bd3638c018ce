package com.example.umarell.models;

import java.util.Map;

/**
 * A room/space node of the topology graph. {@code id} is the node's {@code room_key},
 * the same key used in {@code room_to_sensor_map}.
 */
public record Element(
        String id,
        String name,
        String longName,
        String storey,
        String categoryIt,
        String categoryEn,
        Double area,
        Map<String, Object> properties
) {
    /** Name to show a person: long name when the short one is missing. */
    public String displayName() {
        if (name != null && !name.isBlank()) return name;
        if (longName != null && !longName.isBlank()) return longName;
        return id;
    }
}
