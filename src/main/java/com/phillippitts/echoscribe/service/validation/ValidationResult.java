package com.phillippitts.echoscribe.service.validation;

import java.util.List;

/**
 * Immutable outcome of one validation run.
 *
 * <p>{@code success} is derived: it is {@code true} exactly when {@code errors} and
 * {@code missingRequired} are both empty. Warnings and missing optional keys never
 * affect it.
 *
 * @param success         whether the configuration is usable
 * @param errors          present-but-invalid required values and failed cross-field checks
 * @param warnings        present-but-invalid optional values
 * @param missingRequired {@code "KEY: description"} for each absent required key
 * @param missingOptional {@code "KEY: description"} for each absent optional key
 */
public record ValidationResult(
        boolean success,
        List<String> errors,
        List<String> warnings,
        List<String> missingRequired,
        List<String> missingOptional
) {

    public ValidationResult {
        errors = List.copyOf(errors);
        warnings = List.copyOf(warnings);
        missingRequired = List.copyOf(missingRequired);
        missingOptional = List.copyOf(missingOptional);
        if (success != (errors.isEmpty() && missingRequired.isEmpty())) {
            throw new IllegalArgumentException(
                    "success must be true exactly when there are no errors and no missing required keys");
        }
    }

    public static ValidationResult of(List<String> errors, List<String> warnings,
                                      List<String> missingRequired, List<String> missingOptional) {
        return new ValidationResult(errors.isEmpty() && missingRequired.isEmpty(),
                errors, warnings, missingRequired, missingOptional);
    }

    /**
     * Returns the key names of missing required entries (the part before the first colon).
     */
    public List<String> missingRequiredKeys() {
        return missingRequired.stream()
                .map(entry -> {
                    int idx = entry.indexOf(':');
                    return idx < 0 ? entry : entry.substring(0, idx);
                })
                .toList();
    }
}
