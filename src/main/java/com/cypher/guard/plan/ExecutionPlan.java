package com.cypher.guard.plan;

import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * A parsed execution plan: the operator tree, its depth-first flattening and totals.
 * Request-scoped and read-only.
 *
 * @param mode  how the plan was obtained
 * @param root  the root operator, {@code null} when the engine returned no plan
 * @param steps operators in depth-first order
 * @param totals aggregates across all operators
 */
public record ExecutionPlan(AnalysisMode mode, PlanOperator root, List<PlanStep> steps, PlanTotals totals) {

    public ExecutionPlan {
        Objects.requireNonNull(mode, "mode is required");
        steps = steps != null ? List.copyOf(steps) : List.of();
        totals = totals != null ? totals : PlanTotals.empty();
    }

    public static ExecutionPlan empty(AnalysisMode mode) {
        return new ExecutionPlan(mode, null, List.of(), PlanTotals.empty());
    }

    public Optional<PlanOperator> rootOperator() {
        return Optional.ofNullable(root);
    }

    public boolean hasRuntimeStatistics() {
        return mode == AnalysisMode.PROFILE && root != null;
    }

    public List<PlanStep> stepsNamed(String operatorPrefix) {
        return steps.stream().filter(s -> s.operator().startsWith(operatorPrefix)).toList();
    }
}
