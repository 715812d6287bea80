package com.cypher.guard.complexity;

import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Structural risk score of a query.
 *
 * @param total       the score, always within [0, {@value #MAX_SCORE}]
 * @param riskLevel   the band the total falls into
 * @param breakdown   points per factor; values always sum to {@code total}
 * @param bottlenecks human-readable descriptions of the main contributors
 */
public record ComplexityScore(
        int total,
        RiskLevel riskLevel,
        Map<ComplexityFactor, Integer> breakdown,
        List<String> bottlenecks
) {
    public static final int MAX_SCORE = 1000;

    public ComplexityScore {
        Objects.requireNonNull(riskLevel, "riskLevel is required");
        breakdown = breakdown == null || breakdown.isEmpty()
                ? Map.of()
                : Collections.unmodifiableMap(new EnumMap<>(breakdown));
        bottlenecks = bottlenecks != null ? List.copyOf(bottlenecks) : List.of();
        if (total < 0 || total > MAX_SCORE) {
            throw new IllegalArgumentException("total must be within [0, " + MAX_SCORE + "]: " + total);
        }
        int sum = breakdown.values().stream().mapToInt(Integer::intValue).sum();
        if (sum != total) {
            throw new IllegalArgumentException("breakdown sums to " + sum + " but total is " + total);
        }
    }

    public static ComplexityScore zero() {
        return new ComplexityScore(0, RiskLevel.SAFE, Map.of(), List.of());
    }

    public int points(ComplexityFactor factor) {
        return breakdown.getOrDefault(factor, 0);
    }
}
