package com.phillippitts.echoscribe.service.validation;

import java.util.List;

/**
 * Ordered key rules plus ordered cross-field checks. Declaration order is reporting order.
 *
 * @param <C> configuration snapshot type
 */
public record RuleSet<C>(List<ValidationRule<C>> rules, List<CrossFieldCheck<C>> checks) {

    public RuleSet {
        rules = rules == null ? List.of() : List.copyOf(rules);
        checks = checks == null ? List.of() : List.copyOf(checks);
    }

    public static <C> RuleSet<C> of(List<ValidationRule<C>> rules) {
        return new RuleSet<>(rules, List.of());
    }
}
