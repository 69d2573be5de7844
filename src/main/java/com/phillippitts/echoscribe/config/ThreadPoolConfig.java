package com.phillippitts.echoscribe.config;

import com.phillippitts.echoscribe.config.properties.ThreadPoolProperties;
import org.apache.logging.log4j.ThreadContext;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.task.TaskDecorator;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.util.Map;
import java.util.concurrent.Executor;
import java.util.concurrent.ThreadPoolExecutor;

/**
 * Configuration for the thread pool that runs AI operations.
 *
 * <p>Pool sizes are configured via {@link ThreadPoolProperties} and can be tuned
 * in application.yml based on hardware and workload.
 */
@Configuration
public class ThreadPoolConfig {

    private final ThreadPoolProperties threadPoolProperties;

    public ThreadPoolConfig(ThreadPoolProperties threadPoolProperties) {
        this.threadPoolProperties = threadPoolProperties;
    }

    /**
     * Creates the bounded pool used by AI operations and by retry backoff continuations.
     *
     * <p>Pool sizing configured via {@code threadpool.ai.*} properties:
     * <ul>
     *   <li>Core pool: default 4</li>
     *   <li>Max pool: default 8</li>
     *   <li>Queue: default 100 tasks - prevents unbounded memory growth</li>
     * </ul>
     *
     * <p>Rejection policy: {@link ThreadPoolExecutor.CallerRunsPolicy}
     * When the pool and queue are full, the submitting thread runs the task,
     * providing backpressure instead of failing.
     *
     * <p>MDC propagation: copies the Log4j2 ThreadContext of the submitting thread to the
     * worker so request IDs survive the hop into retried attempts.
     *
     * @return executor for AI operations
     */
    @Bean(name = "aiServiceExecutor")
    public Executor aiServiceExecutor() {
        ThreadPoolProperties.AiPoolProperties aiProps = threadPoolProperties.getAi();

        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(aiProps.getCorePoolSize());
        executor.setMaxPoolSize(aiProps.getMaxPoolSize());
        executor.setQueueCapacity(aiProps.getQueueCapacity());
        executor.setThreadNamePrefix(aiProps.getThreadNamePrefix());
        executor.setKeepAliveSeconds(aiProps.getKeepAliveSeconds());
        executor.setRejectedExecutionHandler(new ThreadPoolExecutor.CallerRunsPolicy());
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.setAwaitTerminationSeconds(aiProps.getAwaitTerminationSeconds());
        executor.setTaskDecorator(mdcPropagatingDecorator());
        executor.initialize();
        return executor;
    }

    static TaskDecorator mdcPropagatingDecorator() {
        return runnable -> {
            Map<String, String> contextMap = ThreadContext.getImmutableContext();
            return () -> {
                Map<String, String> previous = ThreadContext.getImmutableContext();
                try {
                    ThreadContext.clearMap();
                    if (contextMap != null && !contextMap.isEmpty()) {
                        ThreadContext.putAll(contextMap);
                    }
                    runnable.run();
                } finally {
                    ThreadContext.clearMap();
                    if (previous != null && !previous.isEmpty()) {
                        ThreadContext.putAll(previous);
                    }
                }
            };
        };
    }
}
