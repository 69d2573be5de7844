package com.phillippitts.echoscribe.service.retry;

import com.phillippitts.echoscribe.exception.AiServiceException;
import com.phillippitts.echoscribe.exception.RetryCancelledException;
import com.phillippitts.echoscribe.exception.RetryExhaustedException;
import com.phillippitts.echoscribe.service.metrics.RetryMetrics;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.CompletionStage;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Supplier;

/**
 * Default {@link RetryExecutor} with bounded exponential backoff.
 *
 * <p>Algorithm, per invocation:
 * <ol>
 *   <li>Invoke the work and time the attempt.</li>
 *   <li>On success, complete immediately. No further attempts, no delay.</li>
 *   <li>On failure, if this was attempt {@code maxAttempts}, fail with
 *       {@link RetryExhaustedException} carrying the attempt count and last cause.</li>
 *   <li>Otherwise wait {@code baseDelay * 2^attempt} via {@link DelayScheduler} and try again.</li>
 * </ol>
 *
 * <p><b>Thread Model:</b> Waiting never blocks a thread; the next attempt is started from the
 * scheduler's completion, or from the current loop when the wait is already over. Each invocation owns its own result future, so unrelated invocations
 * share no mutable state.
 *
 * <p><b>Cancellation:</b> Once the result future is done (cancelled by the caller, completed by
 * {@code orTimeout}, ...) no attempt is started, the in-flight attempt is cancelled and the
 * pending backoff wait is abandoned.
 */
@Service
public class DefaultRetryExecutor implements RetryExecutor {

    private static final Logger LOG = LogManager.getLogger(DefaultRetryExecutor.class);

    private final DelayScheduler scheduler;
    private final RetryMetrics metrics;

    public DefaultRetryExecutor(DelayScheduler scheduler, RetryMetrics metrics) {
        this.scheduler = Objects.requireNonNull(scheduler, "scheduler");
        this.metrics = Objects.requireNonNull(metrics, "metrics");
    }

    @Override
    public <T> CompletableFuture<T> execute(String operation,
                                            Supplier<? extends CompletionStage<T>> work,
                                            RetryPolicy policy) {
        Objects.requireNonNull(operation, "operation");
        Objects.requireNonNull(work, "work");
        Objects.requireNonNull(policy, "policy");

        CompletableFuture<T> result = new CompletableFuture<>();
        new Sequence<>(operation, work, policy, result).start(0);
        return result;
    }

    @Override
    public <T> T executeAndWait(String operation,
                                Supplier<? extends CompletionStage<T>> work,
                                RetryPolicy policy,
                                Duration timeout) {
        CompletableFuture<T> future = execute(operation, work, policy);
        try {
            if (timeout == null) {
                return future.get();
            }
            return future.get(timeout.toNanos(), TimeUnit.NANOSECONDS);
        } catch (TimeoutException te) {
            future.cancel(true);
            LOG.warn("Operation {} timed out after {} ms; retries cancelled", operation, timeout.toMillis());
            throw new RetryCancelledException("Timed out after " + timeout.toMillis() + " ms", operation, te);
        } catch (InterruptedException ie) {
            Thread.currentThread().interrupt();
            future.cancel(true);
            throw new RetryCancelledException("Interrupted while waiting for result", operation, ie);
        } catch (CancellationException ce) {
            throw new RetryCancelledException("Cancelled before completion", operation, ce);
        } catch (ExecutionException ee) {
            Throwable cause = ee.getCause();
            if (cause instanceof TimeoutException) {
                throw new RetryCancelledException("Timed out before completion", operation, cause);
            }
            if (cause instanceof RuntimeException re) {
                throw re;
            }
            throw new AiServiceException("Unexpected failure", operation, cause);
        }
    }

    /**
     * One retry sequence. Attempts that complete synchronously (an already-failed stage and a
     * zero backoff) are run from a loop instead of nested callbacks, so the stack depth stays
     * constant however many attempts the policy allows.
     */
    private final class Sequence<T> {

        private final String operation;
        private final Supplier<? extends CompletionStage<T>> work;
        private final RetryPolicy policy;
        private final CompletableFuture<T> result;
        private final AtomicInteger wip = new AtomicInteger();
        private volatile int nextAttempt;

        Sequence(String operation, Supplier<? extends CompletionStage<T>> work, RetryPolicy policy,
                 CompletableFuture<T> result) {
            this.operation = operation;
            this.work = work;
            this.policy = policy;
            this.result = result;
        }

        void start(int attempt) {
            nextAttempt = attempt;
            if (wip.getAndIncrement() != 0) {
                // The thread already draining will pick the attempt up
                return;
            }
            do {
                attemptOnce(nextAttempt);
            } while (wip.decrementAndGet() != 0);
        }

        private void attemptOnce(int attempt) {
            int attemptNumber = attempt + 1;
            if (result.isDone()) {
                LOG.info("Operation {} cancelled before attempt {}/{}", operation, attemptNumber, policy.maxAttempts());
                return;
            }

            long t0 = System.nanoTime();
            CompletableFuture<T> inFlight = invoke(work);
            // Propagate caller cancellation/timeout into the running attempt
            result.whenComplete((v, ex) -> {
                if (ex != null) {
                    inFlight.cancel(true);
                }
            });

            inFlight.whenComplete((value, error) -> {
                long elapsedNanos = System.nanoTime() - t0;
                long elapsedMs = TimeUnit.NANOSECONDS.toMillis(elapsedNanos);
                if (error == null) {
                    metrics.recordAttempt(operation, "success", elapsedNanos);
                    LOG.info("Operation {} attempt {}/{} succeeded in {} ms",
                            operation, attemptNumber, policy.maxAttempts(), elapsedMs);
                    result.complete(value);
                    return;
                }

                Throwable cause = unwrap(error);
                metrics.recordAttempt(operation, "failure", elapsedNanos);
                if (result.isDone()) {
                    LOG.debug("Operation {} attempt {} ended after cancellation: {}", operation, attemptNumber,
                            cause.toString());
                    return;
                }
                LOG.warn("Operation {} attempt {}/{} failed after {} ms: {}",
                        operation, attemptNumber, policy.maxAttempts(), elapsedMs, cause.toString());

                if (attemptNumber >= policy.maxAttempts()) {
                    metrics.incrementExhausted(operation);
                    LOG.error("Operation {}: all {} attempts failed; last error: {}",
                            operation, policy.maxAttempts(), cause.toString());
                    result.completeExceptionally(new RetryExhaustedException(operation, policy.maxAttempts(), cause));
                    return;
                }

                Duration delay = policy.delayBeforeRetry(attempt);
                metrics.incrementRetry(operation);
                LOG.debug("Operation {} retrying in {} ms", operation, delay.toMillis());
                scheduleNext(attempt + 1, delay);
            });
        }

        private void scheduleNext(int attempt, Duration delay) {
            CompletableFuture<Void> timer;
            try {
                timer = scheduler.delay(delay);
            } catch (RuntimeException e) {
                timer = CompletableFuture.failedFuture(e);
            }
            CompletableFuture<Void> pending = timer;
            result.whenComplete((v, ex) -> pending.cancel(false));
            pending.whenComplete((ignored, timerError) -> {
                if (timerError != null) {
                    if (!result.isDone()) {
                        result.completeExceptionally(new RetryCancelledException(
                                "Backoff wait was cancelled", operation, unwrap(timerError)));
                    }
                    return;
                }
                start(attempt);
            });
        }
    }

    private static <T> CompletableFuture<T> invoke(Supplier<? extends CompletionStage<T>> work) {
        try {
            CompletionStage<T> stage = work.get();
            if (stage == null) {
                return CompletableFuture.failedFuture(new NullPointerException("work returned null"));
            }
            return stage.toCompletableFuture();
        } catch (RuntimeException e) {
            return CompletableFuture.failedFuture(e);
        }
    }

    private static Throwable unwrap(Throwable t) {
        Throwable current = t;
        while ((current instanceof CompletionException || current instanceof ExecutionException)
                && current.getCause() != null) {
            current = current.getCause();
        }
        return current;
    }
}
