package com.phillippitts.echoscribe.service.validation;

import java.util.Objects;
import java.util.function.Function;
import java.util.function.Predicate;

/**
 * Declarative description of how one configuration key is checked.
 *
 * @param key          configuration key as the operator knows it (e.g. {@code OPENAI_API_KEY})
 * @param required     whether absence fails validation
 * @param value        reads the raw value for this key from a configuration snapshot
 * @param validator    format predicate over the raw value; {@code null} means presence is enough
 * @param description  what the key is for, reported when it is missing
 * @param errorMessage reported when the value is present but fails {@code validator}
 * @param <C>          configuration snapshot type
 */
public record ValidationRule<C>(
        String key,
        boolean required,
        Function<? super C, String> value,
        Predicate<String> validator,
        String description,
        String errorMessage
) {

    public ValidationRule {
        Objects.requireNonNull(key, "key");
        Objects.requireNonNull(value, "value");
        Objects.requireNonNull(description, "description");
        if (errorMessage == null) {
            errorMessage = "Invalid value for " + key;
        }
    }

    public static <C> ValidationRule<C> required(String key, Function<? super C, String> value,
                                                 Predicate<String> validator,
                                                 String description, String errorMessage) {
        return new ValidationRule<>(key, true, value, validator, description, errorMessage);
    }

    public static <C> ValidationRule<C> optional(String key, Function<? super C, String> value,
                                                 Predicate<String> validator,
                                                 String description, String errorMessage) {
        return new ValidationRule<>(key, false, value, validator, description, errorMessage);
    }

    /** Formats the entry reported when this key is missing. */
    String missingEntry() {
        return key + ": " + description;
    }
}
