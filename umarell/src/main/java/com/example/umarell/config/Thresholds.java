package com.example.umarell.config;

import java.util.Locale;

/**
 * Comfort bounds for one sensor type and the words used to describe a value against them.
 */
public record Thresholds(
        Double low,
        Double high,
        String lowLabel,
        String highLabel,
        String okLabel
) {

    /**
     * Fills in the labels that were not configured, using the built-in wording for
     * well-known types (temperature, co2, humidity).
     */
    public static Thresholds withDefaults(String type, Double low, Double high,
                                          String lowLabel, String highLabel, String okLabel) {
        String t = type == null ? "" : type.toLowerCase(Locale.ROOT);
        String[] d = switch (t) {
            case "temperature", "temp" -> new String[]{"too cold", "wasteful", "acceptable"};
            case "co2" -> new String[]{"good air quality", "poor air quality", "good air quality"};
            case "humidity" -> new String[]{"too dry", "too humid", "comfortable"};
            default -> new String[]{"below range", "above range", "within range"};
        };
        return new Thresholds(low, high,
                blank(lowLabel) ? d[0] : lowLabel,
                blank(highLabel) ? d[1] : highLabel,
                blank(okLabel) ? d[2] : okLabel);
    }

    /** Strictly above high is high, strictly below low is low, anything else is ok. */
    public String label(double value) {
        if (high != null && value > high) return highLabel;
        if (low != null && value < low) return lowLabel;
        return okLabel;
    }

    private static boolean blank(String s) {
        return s == null || s.isBlank();
    }
}
