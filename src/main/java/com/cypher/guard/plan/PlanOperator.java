package com.cypher.guard.plan;

import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * A node of a parsed execution plan.
 *
 * <p>Runtime statistics ({@code dbHits}, {@code rows}, {@code timeMillis}, {@code memoryBytes})
 * are zero for plans obtained with {@link AnalysisMode#EXPLAIN}.</p>
 *
 * @param name          operator name without the planner suffix, e.g. {@code NodeByLabelScan}
 * @param depth         distance from the root, which has depth 0
 * @param details       the operator's details argument, e.g. {@code n:Person}
 * @param identifiers   variables the operator introduces or carries
 * @param estimatedRows planner row estimate
 * @param rows          actual rows produced
 * @param dbHits        storage accesses
 * @param timeMillis    elapsed time
 * @param memoryBytes   memory allocated
 * @param arguments     remaining planner arguments rendered as strings
 * @param children      child operators
 */
public record PlanOperator(
        String name,
        int depth,
        String details,
        List<String> identifiers,
        double estimatedRows,
        long rows,
        long dbHits,
        long timeMillis,
        long memoryBytes,
        Map<String, String> arguments,
        List<PlanOperator> children
) {
    public PlanOperator {
        Objects.requireNonNull(name, "name is required");
        details = details != null ? details : "";
        identifiers = identifiers != null ? List.copyOf(identifiers) : List.of();
        arguments = arguments != null ? Map.copyOf(arguments) : Map.of();
        children = children != null ? List.copyOf(children) : List.of();
    }
}
