package com.phillippitts.echoscribe.service.validation;

import com.phillippitts.echoscribe.exception.ConfigurationValidationException;
import com.phillippitts.echoscribe.testutil.InMemoryAppender;
import org.apache.logging.log4j.Level;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ConfigValidatorTest {

    /** Minimal snapshot for exercising the engine without the full settings tree. */
    record TestConfig(String apiKey, String cacheUrl, int min, int max) {
    }

    private static final ValidationRule<TestConfig> API_KEY = ValidationRule.required("API_KEY",
            TestConfig::apiKey, v -> v.startsWith("sk-"), "Key for the upstream API",
            "API_KEY must start with \"sk-\"");

    private static final ValidationRule<TestConfig> CACHE_URL = ValidationRule.optional("CACHE_URL",
            TestConfig::cacheUrl, v -> v.startsWith("redis://"), "Cache location",
            "CACHE_URL must start with \"redis://\"");

    private static final CrossFieldCheck<TestConfig> MIN_BELOW_MAX =
            CrossFieldCheck.of(c -> c.min() < c.max(), "MIN must be less than MAX");

    private static final RuleSet<TestConfig> RULES =
            new RuleSet<>(List.of(API_KEY, CACHE_URL), List.of(MIN_BELOW_MAX));

    private ConfigValidator validator;
    private InMemoryAppender appender;

    @BeforeEach
    void setUp() {
        validator = new ConfigValidator();
        appender = InMemoryAppender.attachTo(ConfigValidator.class);
    }

    @AfterEach
    void tearDown() {
        appender.detach();
    }

    @Test
    void validConfigurationSucceedsWithEmptyLists() {
        ValidationResult result = validator.validate(new TestConfig("sk-123", "redis://x", 1, 2), RULES);

        assertThat(result.success()).isTrue();
        assertThat(result.errors()).isEmpty();
        assertThat(result.warnings()).isEmpty();
        assertThat(result.missingRequired()).isEmpty();
        assertThat(result.missingOptional()).isEmpty();
    }

    @Test
    void missingRequiredKeyFailsWithoutRecordingAnError() {
        ValidationResult result = validator.validate(new TestConfig(null, "redis://x", 1, 2), RULES);

        assertThat(result.success()).isFalse();
        assertThat(result.missingRequired()).containsExactly("API_KEY: Key for the upstream API");
        assertThat(result.missingOptional()).isEmpty();
        assertThat(result.errors()).isEmpty();
        assertThat(result.warnings()).isEmpty();
    }

    @Test
    void blankValueCountsAsMissing() {
        ValidationResult result = validator.validate(new TestConfig("   ", "", 1, 2), RULES);

        assertThat(result.missingRequiredKeys()).containsExactly("API_KEY");
        assertThat(result.missingOptional()).containsExactly("CACHE_URL: Cache location");
        assertThat(result.errors()).isEmpty();
        assertThat(result.warnings()).isEmpty();
    }

    @Test
    void invalidRequiredValueIsAnErrorNotMissing() {
        ValidationResult result = validator.validate(new TestConfig("pk-123", null, 1, 2), RULES);

        assertThat(result.success()).isFalse();
        assertThat(result.errors()).containsExactly("API_KEY must start with \"sk-\"");
        assertThat(result.missingRequired()).isEmpty();
    }

    @Test
    void onlyOptionalProblemsStillSucceed() {
        ValidationResult missing = validator.validate(new TestConfig("sk-1", null, 1, 2), RULES);
        ValidationResult invalid = validator.validate(new TestConfig("sk-1", "http://x", 1, 2), RULES);

        assertThat(missing.success()).isTrue();
        assertThat(missing.missingOptional()).containsExactly("CACHE_URL: Cache location");

        assertThat(invalid.success()).isTrue();
        assertThat(invalid.warnings()).containsExactly("CACHE_URL must start with \"redis://\"");
        assertThat(invalid.missingOptional()).isEmpty();
    }

    @Test
    void failingCrossFieldCheckIsAnError() {
        ValidationResult equal = validator.validate(new TestConfig("sk-1", null, 5, 5), RULES);
        ValidationResult inverted = validator.validate(new TestConfig("sk-1", null, 6, 5), RULES);

        assertThat(equal.success()).isFalse();
        assertThat(equal.errors()).containsExactly("MIN must be less than MAX");
        assertThat(inverted.errors()).containsExactly("MIN must be less than MAX");
    }

    @Test
    void requiredErrorsPrecedeCrossFieldErrorsInDeclarationOrder() {
        ValidationRule<TestConfig> second = ValidationRule.required("SECOND_KEY",
                c -> "bad", v -> false, "Another key", "SECOND_KEY is invalid");
        CrossFieldCheck<TestConfig> alwaysFails = CrossFieldCheck.of(c -> false, "always fails");
        RuleSet<TestConfig> rules = new RuleSet<>(
                List.of(CACHE_URL, API_KEY, second), List.of(MIN_BELOW_MAX, alwaysFails));

        ValidationResult result = validator.validate(new TestConfig("bad", null, 9, 1), rules);

        assertThat(result.errors()).containsExactly(
                "API_KEY must start with \"sk-\"",
                "SECOND_KEY is invalid",
                "MIN must be less than MAX",
                "always fails");
    }

    @Test
    void throwingPredicateCountsAsFailure() {
        ValidationRule<TestConfig> exploding = ValidationRule.required("API_KEY", TestConfig::apiKey,
                v -> {
                    throw new IllegalStateException("boom");
                }, "Key", "API_KEY is invalid");
        CrossFieldCheck<TestConfig> explodingCheck = CrossFieldCheck.of(c -> {
            throw new ArithmeticException("/ by zero");
        }, "ratio check failed");

        ValidationResult result = validator.validate(new TestConfig("sk-1", null, 1, 2),
                new RuleSet<>(List.of(exploding), List.of(explodingCheck)));

        assertThat(result.success()).isFalse();
        assertThat(result.errors()).containsExactly("API_KEY is invalid", "ratio check failed");
    }

    @Test
    void throwingAccessorCountsAsMissing() {
        ValidationRule<TestConfig> rule = ValidationRule.required("NESTED",
                c -> {
                    throw new NullPointerException("section absent");
                }, null, "Nested value", null);

        ValidationResult result = validator.validate(new TestConfig("sk-1", null, 1, 2), RuleSet.of(List.of(rule)));

        assertThat(result.missingRequiredKeys()).containsExactly("NESTED");
    }

    @Test
    void ruleWithoutValidatorOnlyChecksPresence() {
        ValidationRule<TestConfig> rule = ValidationRule.required("API_KEY", TestConfig::apiKey, null,
                "Key", null);

        ValidationResult result = validator.validate(new TestConfig("anything", null, 1, 2),
                RuleSet.of(List.of(rule)));

        assertThat(result.success()).isTrue();
    }

    @Test
    void defaultErrorMessageNamesTheKey() {
        ValidationRule<TestConfig> rule = ValidationRule.optional("CACHE_URL", TestConfig::cacheUrl,
                v -> false, "Cache", null);

        ValidationResult result = validator.validate(new TestConfig("sk-1", "x", 1, 2),
                RuleSet.of(List.of(rule)));

        assertThat(result.warnings()).containsExactly("Invalid value for CACHE_URL");
    }

    @Test
    void emptyRuleSetAlwaysSucceeds() {
        ValidationResult result = validator.validate(new TestConfig(null, null, 9, 1), new RuleSet<>(null, null));

        assertThat(result.success()).isTrue();
    }

    @Test
    void resultListsAreImmutable() {
        ValidationResult result = validator.validate(new TestConfig(null, null, 9, 1), RULES);

        assertThatThrownBy(() -> result.errors().add("x")).isInstanceOf(UnsupportedOperationException.class);
        assertThatThrownBy(() -> result.missingRequired().clear())
                .isInstanceOf(UnsupportedOperationException.class);
    }

    @Test
    void requireValidReturnsSnapshotWhenValid() {
        TestConfig config = new TestConfig("sk-1", null, 1, 2);

        assertThat(validator.requireValid(config, RULES)).isSameAs(config);
    }

    @Test
    void requireValidThrowsWithErrorsAndMissingKeyNames() {
        TestConfig config = new TestConfig(null, "redis://x", 3, 1);

        assertThatThrownBy(() -> validator.requireValid(config, RULES))
                .isInstanceOf(ConfigurationValidationException.class)
                .hasMessage("Environment validation failed: MIN must be less than MAX. "
                        + "Missing required variables: API_KEY")
                .satisfies(ex -> {
                    ValidationResult result = ((ConfigurationValidationException) ex).getResult();
                    assertThat(result.success()).isFalse();
                    assertThat(result.missingRequiredKeys()).containsExactly("API_KEY");
                });
    }

    @Test
    void logsOneErrorLinePerMissingRequiredItem() {
        RuleSet<TestConfig> rules = RuleSet.of(List.of(API_KEY,
                ValidationRule.<TestConfig>required("OTHER_KEY", c -> null, null, "Other", null)));

        validator.validate(new TestConfig(null, null, 1, 2), rules);

        List<String> errors = appender.messagesAt(Level.ERROR);
        assertThat(errors).contains("  - API_KEY: Key for the upstream API", "  - OTHER_KEY: Other");
        assertThat(errors).last().isEqualTo("Environment validation failed");
    }

    @Test
    void logsErrorsAsOneBlockAndWarningsPerLine() {
        RuleSet<TestConfig> rules = new RuleSet<>(List.of(API_KEY, CACHE_URL),
                List.of(MIN_BELOW_MAX, CrossFieldCheck.of(c -> false, "second problem")));

        validator.validate(new TestConfig("bad", "http://x", 2, 1), rules);

        List<String> errorBlocks = appender.messagesAt(Level.ERROR).stream()
                .filter(m -> m.startsWith("Environment validation errors:"))
                .toList();
        assertThat(errorBlocks).hasSize(1);
        assertThat(errorBlocks.get(0))
                .contains("API_KEY must start with \"sk-\"", "MIN must be less than MAX", "second problem");
        assertThat(appender.messagesAt(Level.WARN)).containsExactly("CACHE_URL must start with \"redis://\"");
    }

    @Test
    void logsMissingOptionalAsSingleWarningBlock() {
        validator.validate(new TestConfig("sk-1", null, 1, 2), RULES);

        List<String> warnings = appender.messagesAt(Level.WARN);
        assertThat(warnings).hasSize(1);
        assertThat(warnings.get(0))
                .startsWith("Missing optional environment variables:")
                .contains("CACHE_URL: Cache location");
        assertThat(appender.messagesAt(Level.INFO)).containsExactly("Environment validation completed successfully");
        assertThat(appender.messagesAt(Level.ERROR)).isEmpty();
    }
}
