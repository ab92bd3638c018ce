package com.example.umarell.importer;

import java.util.Map;

/**
 * An IfcSpace as handed over by the model extractor: attributes plus its property sets.
 */
public record SpaceRecord(
        String globalId,
        String name,
        String longName,
        String objectType,
        String containerStorey,
        Map<String, Map<String, Object>> psets
) {
    public Map<String, Object> pset(String name) {
        if (psets == null) return Map.of();
        Map<String, Object> p = psets.get(name);
        return p == null ? Map.of() : p;
    }
}
