package com.phillippitts.echoscribe.exception;

/**
 * Thrown when request input (e.g. transcript text) does not meet minimum requirements.
 */
public class InvalidInputException extends EchoScribeException {

    private final String reason;

    public InvalidInputException(String reason) {
        super("Invalid input: " + reason);
        this.reason = reason;
    }

    public String getReason() {
        return reason;
    }
}
