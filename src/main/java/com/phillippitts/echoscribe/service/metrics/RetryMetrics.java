package com.phillippitts.echoscribe.service.metrics;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.stereotype.Component;

import java.util.concurrent.TimeUnit;

/**
 * Micrometer instrumentation for retried AI operations.
 *
 * <p>Provides:
 * <ul>
 *   <li>Per-attempt latency, tagged by operation and outcome (success, failure)</li>
 *   <li>Retry counts (attempts scheduled after a failure)</li>
 *   <li>Exhaustion counts (operations that used up every attempt)</li>
 * </ul>
 *
 * <p>Exposed through the actuator metrics endpoint.
 */
@Component
public class RetryMetrics {

    private static final String METRIC_PREFIX = "echoscribe.retry";

    private final MeterRegistry registry;

    public RetryMetrics(MeterRegistry registry) {
        this.registry = registry;
    }

    /**
     * Records the duration of one attempt.
     *
     * @param operation     operation name (e.g. summary, sentiment)
     * @param outcome       {@code success} or {@code failure}
     * @param durationNanos duration in nanoseconds
     */
    public void recordAttempt(String operation, String outcome, long durationNanos) {
        Timer.builder(METRIC_PREFIX + ".attempt")
                .description("Duration of a single attempt of a retried operation")
                .tag("operation", operation)
                .tag("outcome", outcome)
                .register(registry)
                .record(durationNanos, TimeUnit.NANOSECONDS);
    }

    public void incrementRetry(String operation) {
        Counter.builder(METRIC_PREFIX + ".retries")
                .description("Number of retries scheduled after a failed attempt")
                .tag("operation", operation)
                .register(registry)
                .increment();
    }

    public void incrementExhausted(String operation) {
        Counter.builder(METRIC_PREFIX + ".exhausted")
                .description("Number of operations that failed on every attempt")
                .tag("operation", operation)
                .register(registry)
                .increment();
    }
}
