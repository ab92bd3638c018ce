package com.example.umarell.config;

import com.example.umarell.errors.ErrorKind;
import com.example.umarell.errors.InspectorException;
import com.fasterxml.jackson.databind.JsonNode;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * One raw {@code room_to_sensor_map} value. The file allows three shapes; each has its own
 * case here and {@link #normalize()} turns all of them into type -> sensor id.
 */
public interface SensorEntry {

    Map<String, String> normalize();

    /** {@code "sensor_001_temp"} */
    record SingleSensor(String sensorId) implements SensorEntry {
        @Override
        public Map<String, String> normalize() {
            Map<String, String> out = new LinkedHashMap<>();
            out.put(SensorMapping.DEFAULT_TYPE, sensorId);
            return out;
        }
    }

    /**
     * {@code ["s1", "s2", "s3"]}: the first id is the primary ("default") sensor,
     * the others become extra_1, extra_2, ... in list order. Duplicates are kept.
     */
    record SensorList(List<String> sensorIds) implements SensorEntry {
        @Override
        public Map<String, String> normalize() {
            Map<String, String> out = new LinkedHashMap<>();
            for (int i = 0; i < sensorIds.size(); i++) {
                out.put(i == 0 ? SensorMapping.DEFAULT_TYPE : SensorMapping.EXTRA_PREFIX + i, sensorIds.get(i));
            }
            return out;
        }
    }

    /** {@code {"temperature": "s1", "co2": "s2"}}, copied as-is. */
    record TypedSensors(Map<String, String> sensorsByType) implements SensorEntry {
        @Override
        public Map<String, String> normalize() {
            return new LinkedHashMap<>(sensorsByType);
        }
    }

    static SensorEntry fromJson(String elementId, JsonNode node) {
        if (node == null || node.isNull()) {
            return new TypedSensors(Collections.emptyMap());
        }
        if (node.isTextual() || node.isNumber()) {
            return new SingleSensor(node.asText());
        }
        if (node.isArray()) {
            List<String> ids = new ArrayList<>();
            for (JsonNode item : node) {
                if (!(item.isTextual() || item.isNumber())) {
                    throw malformed(elementId, "list items must be sensor id strings");
                }
                ids.add(item.asText());
            }
            return new SensorList(ids);
        }
        if (node.isObject()) {
            Map<String, String> typed = new LinkedHashMap<>();
            Iterator<Map.Entry<String, JsonNode>> it = node.fields();
            while (it.hasNext()) {
                Map.Entry<String, JsonNode> e = it.next();
                JsonNode v = e.getValue();
                if (v == null || v.isNull()) {
                    continue;
                }
                if (!(v.isTextual() || v.isNumber())) {
                    throw malformed(elementId, "sensor '" + e.getKey() + "' must map to a sensor id string");
                }
                typed.put(e.getKey(), v.asText());
            }
            return new TypedSensors(typed);
        }
        throw malformed(elementId, "expected a string, a list or an object, got " + node.getNodeType());
    }

    private static InspectorException malformed(String elementId, String detail) {
        return new InspectorException(ErrorKind.CONFIG_MALFORMED,
                "room_to_sensor_map entry '" + elementId + "': " + detail);
    }
}
