package com.cypher.guard.complexity;

import java.util.List;

/**
 * Verdict of a complexity check.
 *
 * @param allowed  whether the query may run
 * @param score    the computed score
 * @param error    rejection message enumerating bottlenecks, {@code null} when allowed
 * @param warnings non-fatal findings
 */
public record ComplexityCheck(boolean allowed, ComplexityScore score, String error, List<String> warnings) {

    public ComplexityCheck {
        warnings = warnings != null ? List.copyOf(warnings) : List.of();
    }
}
