package com.inboxflow.model.flow;

import java.util.Locale;
import java.util.Optional;

/**
 * Predicates a Condition node can apply.
 * String operators compare case-insensitively; GREATER_THAN / LESS_THAN are numeric.
 */
public enum ConditionOperator {
    EQUALS,
    CONTAINS,
    STARTS_WITH,
    ENDS_WITH,
    GREATER_THAN,
    LESS_THAN;

    /** Accepts the builder's snake_case value, e.g. "starts_with". */
    public static Optional<ConditionOperator> fromValue(String value) {
        if (value == null) {
            return Optional.empty();
        }
        try {
            return Optional.of(ConditionOperator.valueOf(value.trim().toUpperCase(Locale.ROOT)));
        } catch (IllegalArgumentException e) {
            return Optional.empty();
        }
    }
}
