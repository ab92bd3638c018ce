package com.example.umarell.models;

import java.time.Instant;

/** One value returned by the time-series store. Never stored. */
public record Reading(String sensorId, String field, Object value, Instant time) {

    /** The value as a double, or null for strings, booleans and missing values. */
    public Double numericValue() {
        if (value instanceof Number n) {
            double d = n.doubleValue();
            return Double.isNaN(d) ? null : d;
        }
        return null;
    }
}
