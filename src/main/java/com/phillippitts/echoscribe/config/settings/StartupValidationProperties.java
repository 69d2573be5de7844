package com.phillippitts.echoscribe.config.settings;

import jakarta.validation.constraints.NotNull;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;
import org.springframework.validation.annotation.Validated;

/**
 * Controls what happens when the configuration check at startup fails.
 * Binds to properties prefixed with "echoscribe.validation".
 *
 * <p>Example application.yml:
 * <pre>
 * echoscribe:
 *   validation:
 *     enabled: true
 *     failure-policy: abort
 * </pre>
 *
 * @param enabled       run the check at startup at all
 * @param failurePolicy {@link FailurePolicy#ABORT} stops startup, {@link FailurePolicy#WARN} logs and continues
 */
@Validated
@ConfigurationProperties(prefix = "echoscribe.validation")
public record StartupValidationProperties(
        @DefaultValue("true") boolean enabled,
        @NotNull @DefaultValue("ABORT") FailurePolicy failurePolicy
) {

    public enum FailurePolicy { ABORT, WARN }
}
