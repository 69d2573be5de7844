package com.phillippitts.echoscribe.config.settings;

import com.phillippitts.echoscribe.service.retry.RetryPolicy;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotNull;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.convert.DurationUnit;
import org.springframework.util.unit.DataSize;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;
import java.time.temporal.ChronoUnit;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Immutable snapshot of the AI services configuration. Binds to properties prefixed with "ai".
 *
 * <p>Values come from environment variables (or a local {@code .env} file); the mapping from
 * variable names such as {@code OPENAI_API_KEY} to properties lives in {@code application.yml}.
 * Spring constructs this object once at startup and injects it wherever it is needed.
 *
 * <p>Only structural constraints are enforced at bind time. Semantic checks (key formats,
 * ranges, cross-field rules) are reported by
 * {@link com.phillippitts.echoscribe.service.validation.ConfigValidator} with
 * {@link AiServiceRules#DEFAULT} so every problem surfaces in one report.
 *
 * @param environment deployment environment (development, staging, production)
 * @param debug       enables verbose diagnostics
 * @param openai      OpenAI client settings
 * @param huggingface Hugging Face client settings
 * @param server      HTTP server settings
 * @param analysis    analysis thresholds
 * @param audio       accepted audio input
 * @param cache       result cache settings
 * @param monitoring  error tracking and metrics settings
 */
@Validated
@ConfigurationProperties(prefix = "ai")
public record AiServiceSettings(
        String environment,
        boolean debug,
        @Valid @NotNull OpenAi openai,
        @Valid @NotNull HuggingFace huggingface,
        @Valid @NotNull Server server,
        @Valid @NotNull Analysis analysis,
        @Valid @NotNull Audio audio,
        @Valid @NotNull Cache cache,
        @Valid @NotNull Monitoring monitoring
) {

    /**
     * @param retryDelay base delay before the first retry (plain numbers are seconds)
     */
    public record OpenAi(
            String apiKey,
            String model,
            String whisperModel,
            int maxTokens,
            double temperature,
            int timeoutSeconds,
            int maxRetries,
            @DurationUnit(ChronoUnit.SECONDS) Duration retryDelay
    ) {
        /**
         * Retry policy for OpenAI-backed operations. A non-positive retry count is
         * treated as a single attempt; the rule table reports it as a configuration error.
         */
        public RetryPolicy retryPolicy() {
            return RetryPolicy.of(Math.max(1, maxRetries), retryDelay == null ? Duration.ZERO : retryDelay);
        }
    }

    public record HuggingFace(
            String apiKey,
            String sentimentModel,
            String cacheDir,
            int timeoutSeconds,
            int maxRetries
    ) {
    }

    /**
     * @param requestTimeoutSeconds overall deadline for one AI operation, retries included
     */
    public record Server(
            int port,
            int workers,
            int requestTimeoutSeconds,
            List<String> corsOrigins
    ) {
    }

    public record Analysis(
            double sentimentThreshold,
            int summaryMaxLength,
            int summaryMinLength,
            double actionItemConfidence,
            int keywordExtractionLimit
    ) {
    }

    public record Audio(
            DataSize maxSize,
            List<String> supportedFormats,
            int sampleRate
    ) {
    }

    /**
     * @param ttl lifetime of cached results (plain numbers are seconds)
     */
    public record Cache(
            String redisUrl,
            @DurationUnit(ChronoUnit.SECONDS) Duration ttl,
            String prefix,
            boolean enableResultCaching
    ) {
    }

    public record Monitoring(
            String sentryDsn,
            String sentryEnvironment,
            boolean enableMetrics
    ) {
    }

    /**
     * Non-sensitive summary for startup logs and diagnostics. Credentials are reported
     * only as present/absent.
     */
    public Map<String, Object> describe() {
        Map<String, Object> info = new LinkedHashMap<>();
        info.put("environment", environment);
        info.put("debug", debug);
        info.put("port", server.port());
        info.put("workers", server.workers());
        info.put("hasOpenAiKey", isPresent(openai.apiKey()));
        info.put("hasHuggingFaceKey", isPresent(huggingface.apiKey()));
        info.put("hasRedisConfig", isPresent(cache.redisUrl()));
        info.put("hasSentryConfig", isPresent(monitoring.sentryDsn()));
        info.put("openaiModel", openai.model());
        info.put("whisperModel", openai.whisperModel());
        info.put("sentimentModel", huggingface.sentimentModel());
        info.put("corsOrigins", server.corsOrigins());
        info.put("maxAudioSize", audio.maxSize());
        info.put("supportedFormats", audio.supportedFormats());
        info.put("enableCaching", cache.enableResultCaching());
        info.put("enableMetrics", monitoring.enableMetrics());
        return info;
    }

    static boolean isPresent(String value) {
        return value != null && !value.isBlank();
    }
}
