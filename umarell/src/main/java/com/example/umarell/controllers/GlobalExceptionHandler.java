package com.example.umarell.controllers;

import com.example.umarell.dto.ErrorResponse;
import com.example.umarell.errors.ErrorKind;
import com.example.umarell.errors.InspectorException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

/**
 * Nothing leaves the API as a stack trace: every failure becomes an {@link ErrorResponse}.
 */
@RestControllerAdvice
public class GlobalExceptionHandler {

    private static final Logger log = LoggerFactory.getLogger(GlobalExceptionHandler.class);

    @ExceptionHandler(InspectorException.class)
    public ResponseEntity<ErrorResponse> handleInspector(InspectorException e) {
        HttpStatus status = statusOf(e);
        if (status.is5xxServerError()) {
            log.warn("{} [{}]: {}", e.getKind().code(),
                    e.getStage() == null ? "-" : e.getStage().code(), e.getMessage());
        } else {
            log.debug("{}: {}", e.getKind().code(), e.getMessage());
        }
        return ResponseEntity.status(status).body(ErrorResponse.of(e));
    }

    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<ErrorResponse> handleUnreadable(HttpMessageNotReadableException e) {
        return ResponseEntity.badRequest()
                .body(ErrorResponse.of(ErrorKind.INVALID_INPUT, "Request body is not valid JSON for this operation"));
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ErrorResponse> handleUnexpected(Exception e) {
        log.error("Unexpected error", e);
        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
                .body(ErrorResponse.of(ErrorKind.INTERNAL_ERROR, "Unexpected error: " + e.getClass().getSimpleName()));
    }

    static HttpStatus statusOf(InspectorException e) {
        return switch (e.getKind()) {
            case INVALID_INPUT -> HttpStatus.BAD_REQUEST;
            case ROOM_NOT_FOUND -> HttpStatus.NOT_FOUND;
            case NO_SENSORS_CONFIGURED -> HttpStatus.UNPROCESSABLE_ENTITY;
            case CONFIG_NOT_FOUND, DEPENDENCY_UNAVAILABLE -> HttpStatus.SERVICE_UNAVAILABLE;
            case QUERY_EXECUTION_ERROR -> e.isTimeout() ? HttpStatus.GATEWAY_TIMEOUT : HttpStatus.BAD_GATEWAY;
            case CONFIG_MALFORMED, INTERNAL_ERROR -> HttpStatus.INTERNAL_SERVER_ERROR;
        };
    }
}
