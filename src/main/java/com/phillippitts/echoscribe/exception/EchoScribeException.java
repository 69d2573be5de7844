package com.phillippitts.echoscribe.exception;

/**
 * Base exception for all EchoScribe application-specific errors.
 * All domain exceptions extend this class so the web layer can handle them in one place.
 */
public class EchoScribeException extends RuntimeException {

    public EchoScribeException(String message) {
        super(message);
    }

    public EchoScribeException(String message, Throwable cause) {
        super(message, cause);
    }
}
