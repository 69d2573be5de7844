package com.phillippitts.echoscribe.config.settings;

import com.phillippitts.echoscribe.service.validation.ConfigValidator;
import com.phillippitts.echoscribe.service.validation.ValidationResult;
import org.junit.jupiter.api.Test;

import java.time.Duration;

import static com.phillippitts.echoscribe.testutil.SettingsFixtures.OPENAI_KEY;
import static com.phillippitts.echoscribe.testutil.SettingsFixtures.openai;
import static com.phillippitts.echoscribe.testutil.SettingsFixtures.valid;
import static com.phillippitts.echoscribe.testutil.SettingsFixtures.withAnalysis;
import static com.phillippitts.echoscribe.testutil.SettingsFixtures.withEnvironment;
import static com.phillippitts.echoscribe.testutil.SettingsFixtures.withHuggingFaceKey;
import static com.phillippitts.echoscribe.testutil.SettingsFixtures.withOpenAi;
import static com.phillippitts.echoscribe.testutil.SettingsFixtures.withOpenAiKey;
import static com.phillippitts.echoscribe.testutil.SettingsFixtures.withRedisUrl;
import static com.phillippitts.echoscribe.testutil.SettingsFixtures.withSentryDsn;
import static com.phillippitts.echoscribe.testutil.SettingsFixtures.withServer;
import static org.assertj.core.api.Assertions.assertThat;

class AiServiceRulesTest {

    private final ConfigValidator validator = new ConfigValidator();

    private ValidationResult validate(AiServiceSettings settings) {
        return validator.validate(settings, AiServiceRules.DEFAULT);
    }

    @Test
    void defaultFixtureIsValid() {
        ValidationResult result = validate(valid());

        assertThat(result.success()).isTrue();
        assertThat(result.errors()).isEmpty();
        assertThat(result.warnings()).isEmpty();
        assertThat(result.missingOptional()).isEmpty();
    }

    @Test
    void missingOpenAiKeyIsMissingRequiredWithHelpUrl() {
        ValidationResult result = validate(withOpenAiKey(valid(), null));

        assertThat(result.success()).isFalse();
        assertThat(result.missingRequiredKeys()).containsExactly("OPENAI_API_KEY");
        assertThat(result.missingRequired().get(0)).contains("https://platform.openai.com/api-keys");
        assertThat(result.errors()).isEmpty();
    }

    @Test
    void malformedOpenAiKeyIsAnError() {
        ValidationResult result = validate(withOpenAiKey(valid(), "pk-live-123"));

        assertThat(result.success()).isFalse();
        assertThat(result.errors()).containsExactly(
                "OPENAI_API_KEY must start with \"sk-\". Get your API key from https://platform.openai.com/api-keys");
    }

    @Test
    void optionalKeysOnlyWarn() {
        AiServiceSettings settings = withSentryDsn(withRedisUrl(withHuggingFaceKey(valid(), "short"),
                "localhost:6379"), "http://sentry.example.com");

        ValidationResult result = validate(settings);

        assertThat(result.success()).isTrue();
        assertThat(result.warnings()).containsExactly(
                "HUGGINGFACE_API_KEY appears to be invalid. Get your API key from https://huggingface.co/settings/tokens",
                "REDIS_URL must start with \"redis://\"",
                "SENTRY_DSN must be a valid HTTPS URL");
    }

    @Test
    void absentOptionalKeysAreListedInOrder() {
        AiServiceSettings settings = withSentryDsn(withRedisUrl(withHuggingFaceKey(valid(), ""), null), null);

        ValidationResult result = validate(settings);

        assertThat(result.success()).isTrue();
        assertThat(result.missingOptional()).hasSize(3);
        assertThat(result.missingOptional().get(0)).startsWith("HUGGINGFACE_API_KEY: ");
        assertThat(result.missingOptional().get(1)).startsWith("REDIS_URL: ");
        assertThat(result.missingOptional().get(2)).startsWith("SENTRY_DSN: ");
    }

    @Test
    void unknownEnvironmentIsAnError() {
        ValidationResult result = validate(withEnvironment(valid(), "qa"));

        assertThat(result.errors()).containsExactly("ENVIRONMENT must be one of: development, staging, production");
    }

    @Test
    void portBoundariesAreInclusive() {
        assertThat(validate(withServer(valid(), s -> new AiServiceSettings.Server(1, 1, 300, s.corsOrigins())))
                .success()).isTrue();
        assertThat(validate(withServer(valid(), s -> new AiServiceSettings.Server(65535, 1, 300, s.corsOrigins())))
                .success()).isTrue();
        assertThat(validate(withServer(valid(), s -> new AiServiceSettings.Server(0, 1, 300, s.corsOrigins())))
                .errors()).containsExactly("PORT must be between 1 and 65535");
        assertThat(validate(withServer(valid(), s -> new AiServiceSettings.Server(65536, 1, 300, s.corsOrigins())))
                .errors()).containsExactly("PORT must be between 1 and 65535");
    }

    @Test
    void summaryMinMustBeStrictlyBelowMax() {
        ValidationResult result = validate(withAnalysis(valid(), new AiServiceSettings.Analysis(0.7, 100, 100, 0.8, 20)));

        assertThat(result.errors()).containsExactly("SUMMARY_MIN_LENGTH must be less than SUMMARY_MAX_LENGTH");
    }

    @Test
    void sentimentThresholdMustBeAProbability() {
        ValidationResult result = validate(withAnalysis(valid(), new AiServiceSettings.Analysis(1.5, 500, 100, 0.8, 20)));

        assertThat(result.errors()).containsExactly("SENTIMENT_THRESHOLD must be between 0.0 and 1.0");
    }

    @Test
    void openAiNumericChecksAreReportedInDeclarationOrder() {
        AiServiceSettings.OpenAi broken = new AiServiceSettings.OpenAi(OPENAI_KEY, "gpt-4", "whisper-1",
                0, 2.5, 0, 0, Duration.ofSeconds(1));

        ValidationResult result = validate(withOpenAi(valid(), broken));

        assertThat(result.errors()).containsExactly(
                "OPENAI_TEMPERATURE must be between 0.0 and 2.0",
                "OPENAI_MAX_TOKENS must be greater than 0",
                "OPENAI_TIMEOUT must be greater than 0",
                "OPENAI_MAX_RETRIES must be at least 1");
    }

    @Test
    void keyErrorsComeBeforeCrossFieldErrors() {
        AiServiceSettings settings = withEnvironment(withOpenAi(valid(), openai("bad", 3, Duration.ZERO)), "local");

        ValidationResult result = validate(settings);

        assertThat(result.errors()).hasSize(2);
        assertThat(result.errors().get(0)).startsWith("OPENAI_API_KEY");
        assertThat(result.errors().get(1)).startsWith("ENVIRONMENT");
    }

    @Test
    void zeroWorkersIsAnError() {
        ValidationResult result = validate(withServer(valid(), s -> new AiServiceSettings.Server(8001, 0, 300, s.corsOrigins())));

        assertThat(result.errors()).containsExactly("WORKERS must be at least 1");
    }
}
