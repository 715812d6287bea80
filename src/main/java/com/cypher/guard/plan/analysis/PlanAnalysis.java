package com.cypher.guard.plan.analysis;

import com.cypher.guard.plan.AnalysisMode;
import com.cypher.guard.plan.ExecutionPlan;

import java.util.List;
import java.util.Objects;

/**
 * Result of analyzing a query plan.
 *
 * @param query           the analyzed query, without any EXPLAIN/PROFILE prefix
 * @param mode            how the plan was obtained
 * @param plan            the parsed plan
 * @param bottlenecks     problems found, most severe first
 * @param recommendations fixes, most severe first
 * @param cost            relative cost estimate
 * @param summary         one-line overview
 */
public record PlanAnalysis(
        String query,
        AnalysisMode mode,
        ExecutionPlan plan,
        List<Bottleneck> bottlenecks,
        List<Recommendation> recommendations,
        CostEstimate cost,
        String summary
) {
    public PlanAnalysis {
        Objects.requireNonNull(mode, "mode is required");
        Objects.requireNonNull(plan, "plan is required");
        bottlenecks = bottlenecks != null ? List.copyOf(bottlenecks) : List.of();
        recommendations = recommendations != null ? List.copyOf(recommendations) : List.of();
        cost = cost != null ? cost : CostEstimate.none();
    }

    public long criticalCount() {
        return bottlenecks.stream().filter(b -> b.severity() == BottleneckSeverity.CRITICAL).count();
    }
}
