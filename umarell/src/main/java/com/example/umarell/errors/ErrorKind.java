package com.example.umarell.errors;

/**
 * Machine-readable failure kinds returned to callers as {@code kind}.
 */
public enum ErrorKind {
    CONFIG_NOT_FOUND("ConfigNotFound"),
    CONFIG_MALFORMED("ConfigMalformed"),
    INVALID_INPUT("InvalidInput"),
    ROOM_NOT_FOUND("RoomNotFound"),
    NO_SENSORS_CONFIGURED("NoSensorsConfigured"),
    QUERY_EXECUTION_ERROR("QueryExecutionError"),
    DEPENDENCY_UNAVAILABLE("DependencyUnavailable"),
    INTERNAL_ERROR("InternalError");

    private final String code;

    ErrorKind(String code) {
        this.code = code;
    }

    public String code() {
        return code;
    }
}
