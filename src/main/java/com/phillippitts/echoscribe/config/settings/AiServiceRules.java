package com.phillippitts.echoscribe.config.settings;

import com.phillippitts.echoscribe.service.validation.CrossFieldCheck;
import com.phillippitts.echoscribe.service.validation.RuleSet;
import com.phillippitts.echoscribe.service.validation.ValidationRule;

import java.util.List;
import java.util.Set;

/**
 * Declarative rule table for {@link AiServiceSettings}.
 *
 * <p>Entries are reported in the order they are declared here.
 */
public final class AiServiceRules {

    static final Set<String> ENVIRONMENTS = Set.of("development", "staging", "production");

    static final String OPENAI_KEYS_URL = "https://platform.openai.com/api-keys";
    static final String HUGGINGFACE_TOKENS_URL = "https://huggingface.co/settings/tokens";

    public static final RuleSet<AiServiceSettings> DEFAULT = new RuleSet<>(
            List.of(
                    ValidationRule.required("OPENAI_API_KEY",
                            s -> s.openai().apiKey(),
                            v -> v.startsWith("sk-"),
                            "OpenAI API key for AI transcription and analysis (get from " + OPENAI_KEYS_URL + ")",
                            "OPENAI_API_KEY must start with \"sk-\". Get your API key from " + OPENAI_KEYS_URL),
                    ValidationRule.optional("HUGGINGFACE_API_KEY",
                            s -> s.huggingface().apiKey(),
                            v -> v.length() > 10,
                            "Hugging Face API key for sentiment analysis features (get from "
                                    + HUGGINGFACE_TOKENS_URL + ")",
                            "HUGGINGFACE_API_KEY appears to be invalid. Get your API key from "
                                    + HUGGINGFACE_TOKENS_URL),
                    ValidationRule.optional("REDIS_URL",
                            s -> s.cache().redisUrl(),
                            v -> v.startsWith("redis://"),
                            "Redis URL for caching (improves performance)",
                            "REDIS_URL must start with \"redis://\""),
                    ValidationRule.optional("SENTRY_DSN",
                            s -> s.monitoring().sentryDsn(),
                            v -> v.startsWith("https://"),
                            "Sentry DSN for error tracking",
                            "SENTRY_DSN must be a valid HTTPS URL")
            ),
            List.of(
                    CrossFieldCheck.of(s -> ENVIRONMENTS.contains(s.environment()),
                            "ENVIRONMENT must be one of: development, staging, production"),
                    CrossFieldCheck.of(s -> s.server().port() >= 1 && s.server().port() <= 65535,
                            "PORT must be between 1 and 65535"),
                    CrossFieldCheck.of(s -> s.server().workers() >= 1,
                            "WORKERS must be at least 1"),
                    CrossFieldCheck.of(s -> s.openai().temperature() >= 0.0 && s.openai().temperature() <= 2.0,
                            "OPENAI_TEMPERATURE must be between 0.0 and 2.0"),
                    CrossFieldCheck.of(s -> s.openai().maxTokens() > 0,
                            "OPENAI_MAX_TOKENS must be greater than 0"),
                    CrossFieldCheck.of(s -> s.openai().timeoutSeconds() > 0,
                            "OPENAI_TIMEOUT must be greater than 0"),
                    CrossFieldCheck.of(s -> s.analysis().sentimentThreshold() >= 0.0
                                    && s.analysis().sentimentThreshold() <= 1.0,
                            "SENTIMENT_THRESHOLD must be between 0.0 and 1.0"),
                    CrossFieldCheck.of(s -> s.analysis().summaryMinLength() < s.analysis().summaryMaxLength(),
                            "SUMMARY_MIN_LENGTH must be less than SUMMARY_MAX_LENGTH"),
                    CrossFieldCheck.of(s -> s.openai().maxRetries() >= 1,
                            "OPENAI_MAX_RETRIES must be at least 1")
            )
    );

    private AiServiceRules() {
    }
}
