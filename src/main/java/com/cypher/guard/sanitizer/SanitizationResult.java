package com.cypher.guard.sanitizer;

import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Verdict of {@link QuerySanitizer#sanitize}. Rejection is reported here, never thrown.
 *
 * @param safe      whether the query may proceed
 * @param violation the rule that rejected the query, {@code null} when safe
 * @param error     human-readable rejection reason, {@code null} when safe
 * @param warnings  non-fatal findings, collected regardless of the verdict
 */
public record SanitizationResult(
        boolean safe,
        ViolationType violation,
        String error,
        List<String> warnings
) {
    public SanitizationResult {
        warnings = warnings != null ? List.copyOf(warnings) : List.of();
        if (!safe) {
            Objects.requireNonNull(violation, "violation is required for a rejected query");
            Objects.requireNonNull(error, "error is required for a rejected query");
        }
    }

    public static SanitizationResult passed(List<String> warnings) {
        return new SanitizationResult(true, null, null, warnings);
    }

    public static SanitizationResult rejected(ViolationType violation, String error, List<String> warnings) {
        return new SanitizationResult(false, violation, error, warnings);
    }

    public Optional<ViolationType> violationType() {
        return Optional.ofNullable(violation);
    }
}
