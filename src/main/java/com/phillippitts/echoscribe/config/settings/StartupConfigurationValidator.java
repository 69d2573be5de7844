package com.phillippitts.echoscribe.config.settings;

import com.phillippitts.echoscribe.service.validation.ConfigValidator;
import com.phillippitts.echoscribe.service.validation.RuleSet;
import com.phillippitts.echoscribe.service.validation.ValidationResult;
import jakarta.annotation.PostConstruct;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

/**
 * Validates {@link AiServiceSettings} once at startup.
 *
 * <p>With {@code failure-policy=ABORT} an invalid configuration throws
 * {@link com.phillippitts.echoscribe.exception.ConfigurationValidationException} and the
 * application context fails to start. With {@code WARN} the problems are logged and the
 * application keeps running; the configuration health indicator reports DOWN.
 */
@Component
@ConditionalOnProperty(name = "echoscribe.validation.enabled", havingValue = "true", matchIfMissing = true)
class StartupConfigurationValidator {

    private static final Logger LOG = LogManager.getLogger(StartupConfigurationValidator.class);

    private final AiServiceSettings settings;
    private final StartupValidationProperties props;
    private final ConfigValidator validator;
    private final RuleSet<AiServiceSettings> rules;

    @Autowired
    StartupConfigurationValidator(AiServiceSettings settings,
                                  StartupValidationProperties props,
                                  ConfigValidator validator) {
        this(settings, props, validator, AiServiceRules.DEFAULT);
    }

    // Visible for tests
    StartupConfigurationValidator(AiServiceSettings settings,
                                  StartupValidationProperties props,
                                  ConfigValidator validator,
                                  RuleSet<AiServiceSettings> rules) {
        this.settings = settings;
        this.props = props;
        this.validator = validator;
        this.rules = rules;
    }

    @PostConstruct
    void validateOnStartup() {
        LOG.info("Validating AI services configuration: environment={}, failurePolicy={}",
                settings.environment(), props.failurePolicy());

        ApiKeyDiagnostics.evaluate(settings).forEach((service, status) -> {
            if (!status.valid()) {
                LOG.warn("API key check failed for {}:{}{}", service, System.lineSeparator(), status.error());
            }
        });

        if (props.failurePolicy() == StartupValidationProperties.FailurePolicy.ABORT) {
            validator.requireValid(settings, rules);
        } else {
            ValidationResult result = validator.validate(settings, rules);
            if (!result.success()) {
                LOG.error("Continuing with invalid configuration (failure-policy=WARN): errors={}, missingRequired={}",
                        result.errors(), result.missingRequiredKeys());
            }
        }

        LOG.info("Environment configuration: {}", settings.describe());
    }
}
