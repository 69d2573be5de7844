package com.phillippitts.echoscribe.service.validation;

import java.util.Objects;
import java.util.function.Predicate;

/**
 * A boolean check over the whole snapshot (numeric range, enumeration membership,
 * ordering between two fields). A failing check is always an error.
 *
 * @param predicate    returns {@code true} when the snapshot is acceptable
 * @param errorMessage reported when {@code predicate} returns {@code false}
 * @param <C>          configuration snapshot type
 */
public record CrossFieldCheck<C>(Predicate<? super C> predicate, String errorMessage) {

    public CrossFieldCheck {
        Objects.requireNonNull(predicate, "predicate");
        Objects.requireNonNull(errorMessage, "errorMessage");
    }

    public static <C> CrossFieldCheck<C> of(Predicate<? super C> predicate, String errorMessage) {
        return new CrossFieldCheck<>(predicate, errorMessage);
    }
}
