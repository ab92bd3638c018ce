package com.example.umarell.config;

import com.example.umarell.errors.ErrorKind;
import com.example.umarell.errors.InspectorException;
import com.fasterxml.jackson.databind.JsonNode;

import java.nio.file.Path;
import java.util.Collections;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.TreeMap;

/**
 * Parsed {@code sensor_config.json}: the canonical room mapping plus the sensor type table.
 */
public record SensorConfig(SensorMapping mapping, Map<String, SensorTypeSpec> sensorTypes, Path source) {

    public static final String ROOM_TO_SENSOR_MAP = "room_to_sensor_map";
    public static final String SENSOR_TYPES = "sensor_types";

    /** Type metadata, matched case-insensitively; null when the type is not configured. */
    public SensorTypeSpec typeSpec(String type) {
        return type == null ? null : sensorTypes.get(type);
    }

    public String unitOf(String type) {
        SensorTypeSpec spec = typeSpec(type);
        return spec == null ? null : spec.unit();
    }

    public static SensorConfig fromJson(JsonNode root, Path source) {
        JsonNode map = root.get(ROOM_TO_SENSOR_MAP);
        if (map == null || map.isNull()) {
            throw new InspectorException(ErrorKind.CONFIG_MALFORMED,
                    "Missing top-level key '" + ROOM_TO_SENSOR_MAP + "' in " + source);
        }
        if (!map.isObject()) {
            throw new InspectorException(ErrorKind.CONFIG_MALFORMED,
                    "'" + ROOM_TO_SENSOR_MAP + "' must be an object in " + source);
        }

        Map<String, SensorEntry> raw = new LinkedHashMap<>();
        Iterator<Map.Entry<String, JsonNode>> it = map.fields();
        while (it.hasNext()) {
            Map.Entry<String, JsonNode> e = it.next();
            raw.put(e.getKey(), SensorEntry.fromJson(e.getKey(), e.getValue()));
        }

        return new SensorConfig(SensorMapping.normalize(raw), parseTypes(root.get(SENSOR_TYPES), source), source);
    }

    private static Map<String, SensorTypeSpec> parseTypes(JsonNode types, Path source) {
        Map<String, SensorTypeSpec> out = new TreeMap<>(String.CASE_INSENSITIVE_ORDER);
        if (types == null || types.isNull()) {
            return Collections.unmodifiableMap(out);
        }
        if (!types.isObject()) {
            throw new InspectorException(ErrorKind.CONFIG_MALFORMED,
                    "'" + SENSOR_TYPES + "' must be an object in " + source);
        }

        Iterator<Map.Entry<String, JsonNode>> it = types.fields();
        while (it.hasNext()) {
            Map.Entry<String, JsonNode> e = it.next();
            String name = e.getKey();
            JsonNode spec = e.getValue();
            String unit = textOrNull(spec.get("unit"));

            Thresholds thresholds = null;
            JsonNode th = spec.get("thresholds");
            if (th != null && th.isObject()) {
                thresholds = Thresholds.withDefaults(name,
                        numberOrNull(name, th.get("low")),
                        numberOrNull(name, th.get("high")),
                        textOrNull(th.get("low_label")),
                        textOrNull(th.get("high_label")),
                        textOrNull(th.get("ok_label")));
            }
            out.put(name, new SensorTypeSpec(name, unit, thresholds));
        }
        return Collections.unmodifiableMap(out);
    }

    private static String textOrNull(JsonNode n) {
        return (n == null || n.isNull()) ? null : n.asText();
    }

    private static Double numberOrNull(String type, JsonNode n) {
        if (n == null || n.isNull()) return null;
        if (!n.isNumber()) {
            throw new InspectorException(ErrorKind.CONFIG_MALFORMED,
                    "Threshold for sensor type '" + type + "' must be a number, got " + n);
        }
        return n.asDouble();
    }
}
