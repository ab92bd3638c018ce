package com.example.umarell.errors;

/**
 * Every failure that crosses a public operation carries a kind, and store
 * failures also carry the stage that failed.
 */
public class InspectorException extends RuntimeException {

    private final ErrorKind kind;
    private final Stage stage;
    private final boolean timeout;

    public InspectorException(ErrorKind kind, String message) {
        this(kind, null, false, message, null);
    }

    public InspectorException(ErrorKind kind, Stage stage, boolean timeout, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
        this.stage = stage;
        this.timeout = timeout;
    }

    public static InspectorException invalidInput(String message) {
        return new InspectorException(ErrorKind.INVALID_INPUT, message);
    }

    public static InspectorException queryFailed(Stage stage, String message, Throwable cause) {
        return new InspectorException(ErrorKind.QUERY_EXECUTION_ERROR, stage, false, message, cause);
    }

    public static InspectorException timedOut(Stage stage, String message) {
        return new InspectorException(ErrorKind.QUERY_EXECUTION_ERROR, stage, true, message, null);
    }

    public static InspectorException unavailable(Stage stage, String message) {
        return new InspectorException(ErrorKind.DEPENDENCY_UNAVAILABLE, stage, false, message, null);
    }

    public ErrorKind getKind() {
        return kind;
    }

    public Stage getStage() {
        return stage;
    }

    public boolean isTimeout() {
        return timeout;
    }
}
