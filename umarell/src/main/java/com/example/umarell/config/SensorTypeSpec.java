package com.example.umarell.config;

/** Unit and optional thresholds for one entry of {@code sensor_types}. */
public record SensorTypeSpec(String name, String unit, Thresholds thresholds) {

    /** Qualitative label for a value, or null when no thresholds are configured. */
    public String label(Double value) {
        if (value == null || thresholds == null) {
            return null;
        }
        return thresholds.label(value);
    }
}
