package com.cypher.guard.graph;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Driver-neutral plan tree as returned by the database.
 *
 * @param operatorType engine operator name, possibly with a planner suffix
 * @param arguments    planner arguments as plain Java values
 * @param identifiers  variables in scope at this operator
 * @param children     child operators
 * @param profiled     whether runtime statistics are present
 * @param dbHits       storage accesses, 0 unless profiled
 * @param rows         rows produced, 0 unless profiled
 * @param timeMillis   time spent in the operator, 0 unless profiled
 */
public record PlanNode(
        String operatorType,
        Map<String, Object> arguments,
        List<String> identifiers,
        List<PlanNode> children,
        boolean profiled,
        long dbHits,
        long rows,
        long timeMillis
) {
    public PlanNode {
        Objects.requireNonNull(operatorType, "operatorType is required");
        arguments = arguments != null
                ? Collections.unmodifiableMap(new LinkedHashMap<>(arguments)) : Map.of();
        identifiers = identifiers != null ? List.copyOf(identifiers) : List.of();
        children = children != null ? List.copyOf(children) : List.of();
    }

    /**
     * Plan node without runtime statistics.
     */
    public static PlanNode explained(String operatorType, Map<String, Object> arguments,
                                     List<String> identifiers, List<PlanNode> children) {
        return new PlanNode(operatorType, arguments, identifiers, children, false, 0, 0, 0);
    }
}
