package com.example.umarell.services;

import com.example.umarell.errors.InspectorException;

import java.util.Locale;

public enum Goal {
    REPORT,
    MAX,
    MIN,
    AVG;

    public static Goal parse(String raw) {
        if (raw == null || raw.isBlank()) {
            return REPORT;
        }
        String g = raw.trim().toLowerCase(Locale.ROOT);
        return switch (g) {
            case "report", "list" -> REPORT;
            case "max", "maximum", "highest" -> MAX;
            case "min", "minimum", "lowest" -> MIN;
            case "avg", "average", "mean" -> AVG;
            default -> throw InspectorException.invalidInput(
                    "Unknown goal '" + raw + "'. Use one of: report, max, min, avg");
        };
    }

    public String code() {
        return name().toLowerCase(Locale.ROOT);
    }
}
