package com.phillippitts.echoscribe.service.retry;

import java.time.Duration;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionStage;
import java.util.function.Supplier;

/**
 * Runs an asynchronous unit of work under a {@link RetryPolicy}.
 *
 * <p>Retried work must be idempotent: no at-most-once guarantee is given for side effects.
 *
 * @see DefaultRetryExecutor
 */
public interface RetryExecutor {

    /** Operation name used when the caller does not supply one. */
    String DEFAULT_OPERATION = "operation";

    /**
     * Starts the retry sequence and returns immediately.
     *
     * <p>The returned future completes with the first successful value, or exceptionally with
     * {@link com.phillippitts.echoscribe.exception.RetryExhaustedException} once all attempts
     * failed. Cancelling it, or completing it early (e.g. via {@code orTimeout}), stops any
     * further attempts.
     *
     * @param operation name used in logs, metrics and error messages
     * @param work      produces a new attempt each time it is called
     * @param policy    attempt budget and backoff
     */
    <T> CompletableFuture<T> execute(String operation,
                                     Supplier<? extends CompletionStage<T>> work,
                                     RetryPolicy policy);

    default <T> CompletableFuture<T> execute(Supplier<? extends CompletionStage<T>> work, RetryPolicy policy) {
        return execute(DEFAULT_OPERATION, work, policy);
    }

    /**
     * Blocking variant for synchronous callers.
     *
     * @param timeout overall deadline for the whole sequence; {@code null} waits indefinitely
     * @return the successful value
     * @throws com.phillippitts.echoscribe.exception.RetryExhaustedException if all attempts failed
     * @throws com.phillippitts.echoscribe.exception.RetryCancelledException on timeout,
     *         interruption or cancellation
     */
    <T> T executeAndWait(String operation,
                         Supplier<? extends CompletionStage<T>> work,
                         RetryPolicy policy,
                         Duration timeout);
}
