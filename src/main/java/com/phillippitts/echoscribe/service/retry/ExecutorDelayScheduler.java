package com.phillippitts.echoscribe.service.retry;

import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.concurrent.TimeUnit;

/**
 * {@link DelayScheduler} backed by {@link CompletableFuture#delayedExecutor}. Work after the
 * delay runs on the AI service pool, so no thread sleeps while waiting.
 */
@Component
class ExecutorDelayScheduler implements DelayScheduler {

    private final Executor executor;

    ExecutorDelayScheduler(@Qualifier("aiServiceExecutor") Executor executor) {
        this.executor = Objects.requireNonNull(executor, "executor");
    }

    @Override
    public CompletableFuture<Void> delay(Duration delay) {
        if (delay.isZero() || delay.isNegative()) {
            return CompletableFuture.completedFuture(null);
        }
        Executor delayed = CompletableFuture.delayedExecutor(delay.toNanos(), TimeUnit.NANOSECONDS, executor);
        return CompletableFuture.runAsync(() -> { }, delayed);
    }
}
