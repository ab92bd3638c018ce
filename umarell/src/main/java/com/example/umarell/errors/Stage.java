package com.example.umarell.errors;

/** Which external store a failure came from. */
public enum Stage {
    CONFIG("config"),
    TOPOLOGY("topology"),
    TIME_SERIES("time_series");

    private final String code;

    Stage(String code) {
        this.code = code;
    }

    public String code() {
        return code;
    }
}
