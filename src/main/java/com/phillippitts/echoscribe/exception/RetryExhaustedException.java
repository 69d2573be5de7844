package com.phillippitts.echoscribe.exception;

/**
 * Thrown when every attempt of a retried operation failed.
 *
 * <p>The last underlying failure is kept both as {@link #getLastCause()} and as the
 * Java cause, and its message is folded into this exception's message so the
 * operator sees the root cause without reading logs.
 */
public class RetryExhaustedException extends AiServiceException {

    private final int attempts;
    private final Throwable lastCause;

    public RetryExhaustedException(String operation, int attempts, Throwable lastCause) {
        super("Service failed after " + attempts + " attempts: " + describe(lastCause), operation, lastCause);
        this.attempts = attempts;
        this.lastCause = lastCause;
    }

    public int getAttempts() {
        return attempts;
    }

    public Throwable getLastCause() {
        return lastCause;
    }

    private static String describe(Throwable cause) {
        if (cause == null) {
            return "unknown error";
        }
        String msg = cause.getMessage();
        return msg == null || msg.isBlank() ? cause.getClass().getSimpleName() : msg;
    }
}
