package com.phillippitts.echoscribe.service.retry;

import java.time.Duration;
import java.util.concurrent.CompletableFuture;

/**
 * Schedules backoff waits without blocking the caller.
 *
 * <p>Abstraction enables deterministic tests that record requested delays
 * instead of waiting for them.
 */
public interface DelayScheduler {

    /**
     * Returns a future that completes once {@code delay} has elapsed.
     * Cancelling the returned future abandons the wait.
     *
     * @param delay time to wait; zero completes immediately
     */
    CompletableFuture<Void> delay(Duration delay);
}
