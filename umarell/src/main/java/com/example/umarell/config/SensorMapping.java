package com.example.umarell.config;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

/**
 * Canonical room -> (sensor type -> sensor id) mapping. Untyped sensors live under {@value #DEFAULT_TYPE}.
 */
public final class SensorMapping {

    public static final String DEFAULT_TYPE = "default";
    public static final String EXTRA_PREFIX = "extra_";

    private final Map<String, Map<String, String>> byElement;

    private SensorMapping(Map<String, Map<String, String>> byElement) {
        this.byElement = byElement;
    }

    public static SensorMapping normalize(Map<String, ? extends SensorEntry> raw) {
        Map<String, Map<String, String>> out = new LinkedHashMap<>();
        raw.forEach((elementId, entry) ->
                out.put(elementId, Collections.unmodifiableMap(entry.normalize())));
        return new SensorMapping(Collections.unmodifiableMap(out));
    }

    /** List entries ({@value #DEFAULT_TYPE}, extra_1, extra_2, ...) are one untyped kind of sensor. */
    public static boolean isUntyped(String type) {
        return DEFAULT_TYPE.equalsIgnoreCase(type)
                || (type != null && type.startsWith(EXTRA_PREFIX));
    }

    /** The type a sensor counts as when types are compared: untyped sensors all share {@value #DEFAULT_TYPE}. */
    public static String typeGroup(String type) {
        return isUntyped(type) ? DEFAULT_TYPE : type;
    }

    /** Sensors configured for the element; empty when the element has no entry. */
    public Map<String, String> sensorsFor(String elementId) {
        if (elementId == null) {
            return Collections.emptyMap();
        }
        return byElement.getOrDefault(elementId, Collections.emptyMap());
    }

    public boolean contains(String elementId) {
        return byElement.containsKey(elementId);
    }

    public Set<String> elementIds() {
        return byElement.keySet();
    }

    public int size() {
        return byElement.size();
    }

    public Map<String, Map<String, String>> asMap() {
        return byElement;
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof SensorMapping other && byElement.equals(other.byElement);
    }

    @Override
    public int hashCode() {
        return byElement.hashCode();
    }

    @Override
    public String toString() {
        return "SensorMapping" + byElement;
    }
}
