package com.phillippitts.echoscribe.service.health;

import com.phillippitts.echoscribe.config.settings.AiServiceRules;
import com.phillippitts.echoscribe.config.settings.AiServiceSettings;
import com.phillippitts.echoscribe.config.settings.ApiKeyDiagnostics;
import com.phillippitts.echoscribe.service.validation.ConfigValidator;
import com.phillippitts.echoscribe.service.validation.ValidationResult;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Health indicator reporting whether the current configuration passes validation.
 *
 * <ul>
 *   <li>UP: no errors and no missing required keys (warnings are listed but do not degrade)</li>
 *   <li>DOWN: at least one error or missing required key</li>
 * </ul>
 *
 * <p>Re-runs validation on each call and never aborts the process. Exposed via
 * {@code /actuator/health}. The {@code services} detail lists each API key's validity and,
 * for invalid keys, the instructions for fixing it.
 */
@Component
public class ConfigurationHealthIndicator implements HealthIndicator {

    private final AiServiceSettings settings;
    private final ConfigValidator validator;

    public ConfigurationHealthIndicator(AiServiceSettings settings, ConfigValidator validator) {
        this.settings = settings;
        this.validator = validator;
    }

    @Override
    public Health health() {
        ValidationResult result = validator.validate(settings, AiServiceRules.DEFAULT);

        Health.Builder builder = result.success() ? Health.up() : Health.down();
        builder.withDetail("environment", String.valueOf(settings.environment()));
        if (!result.errors().isEmpty()) {
            builder.withDetail("errors", result.errors());
        }
        if (!result.missingRequired().isEmpty()) {
            builder.withDetail("missingRequired", result.missingRequiredKeys());
        }
        if (!result.warnings().isEmpty()) {
            builder.withDetail("warnings", result.warnings());
        }
        if (!result.missingOptional().isEmpty()) {
            builder.withDetail("missingOptional", result.missingOptional());
        }

        Map<String, Map<String, Object>> services = new LinkedHashMap<>();
        ApiKeyDiagnostics.evaluate(settings).forEach((name, status) -> services.put(name, describe(status)));
        builder.withDetail("services", services);

        return builder.build();
    }

    // error carries the "how to fix" text; omitted for valid keys
    private static Map<String, Object> describe(ApiKeyDiagnostics.KeyStatus status) {
        Map<String, Object> detail = new LinkedHashMap<>();
        detail.put("valid", status.valid());
        if (status.error() != null) {
            detail.put("error", status.error());
        }
        return detail;
    }
}
