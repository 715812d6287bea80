package com.cypher.guard.plan.analysis;

import java.util.Objects;

/**
 * An optimization suggestion derived from a bottleneck.
 */
public record Recommendation(
        String title,
        String category,
        BottleneckSeverity severity,
        String exampleRemediation,
        String expectedImpact
) {
    public Recommendation {
        Objects.requireNonNull(title, "title is required");
        Objects.requireNonNull(severity, "severity is required");
        category = category != null ? category : "general";
        exampleRemediation = exampleRemediation != null ? exampleRemediation : "";
        expectedImpact = expectedImpact != null ? expectedImpact : "";
    }
}
