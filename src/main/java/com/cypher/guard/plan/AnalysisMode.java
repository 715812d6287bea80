package com.cypher.guard.plan;

import java.util.Locale;

/**
 * How a query plan is obtained. {@code EXPLAIN} plans without executing; {@code PROFILE}
 * executes the query and records runtime statistics per operator.
 */
public enum AnalysisMode {
    EXPLAIN,
    PROFILE;

    public String keyword() {
        return name();
    }

    /**
     * Parses a mode name case-insensitively. {@code null} or blank means {@link #EXPLAIN}.
     */
    public static AnalysisMode fromString(String value) {
        if (value == null || value.isBlank()) {
            return EXPLAIN;
        }
        try {
            return valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Invalid analysis mode: " + value + ". Use 'explain' or 'profile'", e);
        }
    }
}
