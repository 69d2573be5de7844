package com.phillippitts.echoscribe.exception;

/**
 * Thrown when a retry sequence was cancelled or timed out before it finished.
 * Distinct from {@link RetryExhaustedException}: attempts may remain unused.
 */
public class RetryCancelledException extends AiServiceException {

    public RetryCancelledException(String message, String operation) {
        super(message, operation);
    }

    public RetryCancelledException(String message, String operation, Throwable cause) {
        super(message, operation, cause);
    }
}
