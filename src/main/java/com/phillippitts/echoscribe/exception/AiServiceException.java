package com.phillippitts.echoscribe.exception;

/**
 * Thrown when an AI operation (transcription, sentiment, summary, ...) fails.
 */
public class AiServiceException extends EchoScribeException {

    private final String operation;

    public AiServiceException(String message) {
        super(message);
        this.operation = "unknown";
    }

    public AiServiceException(String message, String operation) {
        super(message + " (operation: " + operation + ")");
        this.operation = operation;
    }

    public AiServiceException(String message, String operation, Throwable cause) {
        super(message + " (operation: " + operation + ")", cause);
        this.operation = operation;
    }

    public String getOperation() {
        return operation;
    }
}
