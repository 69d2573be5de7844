package com.phillippitts.echoscribe.service.retry;

import java.time.Duration;
import java.util.Objects;

/**
 * Bounded exponential-backoff policy, supplied per invocation.
 *
 * <p>Delays double after each failed attempt: {@code baseDelay, 2*baseDelay, 4*baseDelay, ...}.
 * A zero or negative base delay means no waiting between attempts.
 *
 * @param maxAttempts total attempts including the first one (at least 1)
 * @param baseDelay   delay before the first retry
 */
public record RetryPolicy(int maxAttempts, Duration baseDelay) {

    /** Growth factor between consecutive delays. */
    public static final double BACKOFF_MULTIPLIER = 2.0;

    public RetryPolicy {
        if (maxAttempts < 1) {
            throw new IllegalArgumentException("maxAttempts must be at least 1, got: " + maxAttempts);
        }
        Objects.requireNonNull(baseDelay, "baseDelay");
    }

    public static RetryPolicy of(int maxAttempts, Duration baseDelay) {
        return new RetryPolicy(maxAttempts, baseDelay);
    }

    /** A policy that tries exactly once. */
    public static RetryPolicy once() {
        return new RetryPolicy(1, Duration.ZERO);
    }

    public double backoffMultiplier() {
        return BACKOFF_MULTIPLIER;
    }

    /**
     * Delay to wait after the given failed attempt before the next one.
     *
     * @param attempt zero-based index of the attempt that just failed
     * @return {@code baseDelay * 2^attempt}, or {@link Duration#ZERO} for non-positive base delays
     */
    public Duration delayBeforeRetry(int attempt) {
        if (attempt < 0) {
            throw new IllegalArgumentException("attempt must not be negative, got: " + attempt);
        }
        if (baseDelay.isZero() || baseDelay.isNegative()) {
            return Duration.ZERO;
        }
        double factor = Math.pow(BACKOFF_MULTIPLIER, attempt);
        return Duration.ofNanos((long) Math.min(Long.MAX_VALUE, baseDelay.toNanos() * factor));
    }
}
