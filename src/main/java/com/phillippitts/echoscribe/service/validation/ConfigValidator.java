package com.phillippitts.echoscribe.service.validation;

import com.phillippitts.echoscribe.exception.ConfigurationValidationException;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.function.Predicate;

/**
 * Evaluates a configuration snapshot against a {@link RuleSet} and aggregates every
 * problem into one {@link ValidationResult}.
 *
 * <p>Three independent passes run in declaration order:
 * <ol>
 *   <li>required rules: absent values go to {@code missingRequired}, invalid values to {@code errors}</li>
 *   <li>optional rules: absent values go to {@code missingOptional}, invalid values to {@code warnings}</li>
 *   <li>cross-field checks: each failing check goes to {@code errors}</li>
 * </ol>
 * A value that is {@code null} or blank counts as absent. A present value is never
 * reported as missing.
 *
 * <p>{@link #validate} never throws. {@link #requireValid} is the only place a failed
 * validation becomes an exception.
 *
 * <p>Stateless and safe for concurrent use.
 */
@Component
public class ConfigValidator {

    private static final Logger LOG = LogManager.getLogger(ConfigValidator.class);

    /**
     * Validates {@code config} against {@code rules}.
     *
     * @param config snapshot to inspect (must not be null)
     * @param rules  rules and checks to apply (must not be null)
     * @param <C>    snapshot type
     * @return a fresh, immutable result
     */
    public <C> ValidationResult validate(C config, RuleSet<C> rules) {
        Objects.requireNonNull(config, "config");
        Objects.requireNonNull(rules, "rules");

        List<String> errors = new ArrayList<>();
        List<String> warnings = new ArrayList<>();
        List<String> missingRequired = new ArrayList<>();
        List<String> missingOptional = new ArrayList<>();

        for (ValidationRule<C> rule : rules.rules()) {
            if (rule.required()) {
                checkRule(rule, config, missingRequired, errors);
            }
        }
        for (ValidationRule<C> rule : rules.rules()) {
            if (!rule.required()) {
                checkRule(rule, config, missingOptional, warnings);
            }
        }
        for (CrossFieldCheck<C> check : rules.checks()) {
            if (!passes(check.predicate(), config)) {
                errors.add(check.errorMessage());
            }
        }

        ValidationResult result = ValidationResult.of(errors, warnings, missingRequired, missingOptional);
        logResult(result);
        return result;
    }

    /**
     * Validates {@code config} and returns it unchanged when valid.
     *
     * @throws ConfigurationValidationException listing the errors and missing required keys
     */
    public <C> C requireValid(C config, RuleSet<C> rules) {
        ValidationResult result = validate(config, rules);
        if (!result.success()) {
            throw new ConfigurationValidationException(summarize(result), result);
        }
        return config;
    }

    /**
     * Builds the single-line operator message for a failed result.
     */
    static String summarize(ValidationResult result) {
        StringBuilder sb = new StringBuilder("Environment validation failed");
        if (!result.errors().isEmpty()) {
            sb.append(": ").append(String.join("; ", result.errors()));
        }
        if (!result.missingRequired().isEmpty()) {
            sb.append(". Missing required variables: ")
                    .append(String.join(", ", result.missingRequiredKeys()));
        }
        return sb.toString();
    }

    private <C> void checkRule(ValidationRule<C> rule, C config, List<String> missing, List<String> invalid) {
        String raw = readValue(rule, config);
        if (raw == null || raw.isBlank()) {
            missing.add(rule.missingEntry());
            return;
        }
        Predicate<String> validator = rule.validator();
        if (validator != null && !passes(validator, raw)) {
            invalid.add(rule.errorMessage());
        }
    }

    private <C> String readValue(ValidationRule<C> rule, C config) {
        try {
            return rule.value().apply(config);
        } catch (RuntimeException e) {
            LOG.debug("Could not read value for {}: {}", rule.key(), e.toString());
            return null;
        }
    }

    // A predicate that throws is treated as a failed check
    private static <T> boolean passes(Predicate<? super T> predicate, T value) {
        try {
            return predicate.test(value);
        } catch (RuntimeException e) {
            LOG.debug("Validation predicate threw: {}", e.toString());
            return false;
        }
    }

    private static void logResult(ValidationResult result) {
        if (!result.missingRequired().isEmpty()) {
            LOG.error("Missing required environment variables:");
            for (String missing : result.missingRequired()) {
                LOG.error("  - {}", missing);
            }
            LOG.error("Please check your .env file and ensure all required variables are set.");
        }
        if (!result.errors().isEmpty()) {
            StringBuilder block = new StringBuilder("Environment validation errors:");
            for (String error : result.errors()) {
                block.append(System.lineSeparator()).append("  - ").append(error);
            }
            LOG.error(block.toString());
        }
        if (!result.missingOptional().isEmpty()) {
            StringBuilder block = new StringBuilder("Missing optional environment variables:");
            for (String missing : result.missingOptional()) {
                block.append(System.lineSeparator()).append("  - ").append(missing);
            }
            block.append(System.lineSeparator())
                    .append("Some AI features may not be available without these variables.");
            LOG.warn(block.toString());
        }
        for (String warning : result.warnings()) {
            LOG.warn(warning);
        }
        if (result.success()) {
            LOG.info("Environment validation completed successfully");
        } else {
            LOG.error("Environment validation failed");
        }
    }
}
