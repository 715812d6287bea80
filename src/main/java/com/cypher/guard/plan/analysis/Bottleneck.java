package com.cypher.guard.plan.analysis;

import java.util.Objects;

/**
 * A performance problem found at one plan operator.
 *
 * @param type        what kind of problem
 * @param severity    how bad it is
 * @param operator    operator name, e.g. {@code NodeByLabelScan}
 * @param depth       operator depth in the plan
 * @param description human-readable explanation
 * @param remediation concrete fix, e.g. a {@code CREATE INDEX} statement, may be empty
 */
public record Bottleneck(
        BottleneckType type,
        BottleneckSeverity severity,
        String operator,
        int depth,
        String description,
        String remediation
) {
    public Bottleneck {
        Objects.requireNonNull(type, "type is required");
        Objects.requireNonNull(severity, "severity is required");
        Objects.requireNonNull(operator, "operator is required");
        description = description != null ? description : "";
        remediation = remediation != null ? remediation : "";
    }
}
