package com.example.umarell.dto;

import com.example.umarell.errors.ErrorKind;
import com.example.umarell.errors.InspectorException;
import com.fasterxml.jackson.annotation.JsonInclude;

/**
 * Structured error returned by every operation instead of an exception.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ErrorResponse(
        String kind,
        String message,
        String stage,
        Boolean timeout
) {
    public static ErrorResponse of(InspectorException e) {
        return new ErrorResponse(
                e.getKind().code(),
                e.getMessage(),
                e.getStage() == null ? null : e.getStage().code(),
                e.isTimeout() ? Boolean.TRUE : null);
    }

    public static ErrorResponse of(ErrorKind kind, String message) {
        return new ErrorResponse(kind.code(), message, null, null);
    }
}
