package com.phillippitts.echoscribe.exception;

import com.phillippitts.echoscribe.service.validation.ValidationResult;

import java.util.Objects;

/**
 * Aggregate configuration failure raised when a validation run did not succeed and
 * the caller asked for a hard stop. Carries the full {@link ValidationResult}.
 */
public class ConfigurationValidationException extends EchoScribeException {

    private final transient ValidationResult result;

    public ConfigurationValidationException(String message, ValidationResult result) {
        super(message);
        this.result = Objects.requireNonNull(result, "result");
    }

    public ValidationResult getResult() {
        return result;
    }
}
