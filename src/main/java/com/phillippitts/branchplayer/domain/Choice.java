package com.phillippitts.branchplayer.domain;

import java.util.Locale;

/**
 * Operator decision made after a question clip finishes.
 */
public enum Choice {
    SUCCESS(Phase.OUTCOME_SUCCESS),
    FAILURE(Phase.OUTCOME_FAILURE);

    private final Phase outcome;

    Choice(Phase outcome) {
        this.outcome = outcome;
    }

    /**
     * @return the outcome phase this choice selects
     */
    public Phase outcome() {
        return outcome;
    }

    /**
     * Parses a path or property value such as {@code success} or {@code FAILURE}.
     *
     * @throws IllegalArgumentException if the value names no choice
     */
    public static Choice fromValue(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("Choice must not be blank");
        }
        try {
            return Choice.valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Unknown choice '" + value + "'. Allowed: success, failure", e);
        }
    }
}
