package com.cypher.guard.plan.analysis;

import com.cypher.guard.complexity.RiskLevel;
import com.cypher.guard.plan.ExecutionPlan;
import com.cypher.guard.plan.PlanOperators;
import com.cypher.guard.plan.PlanStep;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Estimates a relative execution cost from per-operator weights scaled by row counts.
 *
 * <p>Each operator costs its weight times {@code max(1, rows / 100)}, using actual rows for
 * profiled plans and planner estimates otherwise. The sum is mapped logarithmically onto
 * 0..100, where a total of 100000 units or more scores 100.</p>
 */
public class CostEstimator {

    static final int DEFAULT_WEIGHT = 50;
    private static final double SCORE_CEILING = 100_000;

    private static final Map<String, Integer> WEIGHTS = Map.ofEntries(
            Map.entry("AllNodesScan", 150),
            Map.entry("NodeByLabelScan", 100),
            Map.entry("NodeIndexSeek", 10),
            Map.entry("NodeUniqueIndexSeek", 5),
            Map.entry("NodeIndexScan", 50),
            Map.entry("NodeIndexContainsScan", 60),
            Map.entry("NodeByIdSeek", 2),
            Map.entry("Expand(All)", 80),
            Map.entry("Expand(Into)", 40),
            Map.entry("VarLengthExpand(All)", 200),
            Map.entry("VarLengthExpand(Into)", 200),
            Map.entry("VarLengthExpand(Pruning)", 150),
            Map.entry("NodeHashJoin", 150),
            Map.entry("ValueHashJoin", 150),
            Map.entry("CartesianProduct", 1000),
            Map.entry("Filter", 20),
            Map.entry("Projection", 15),
            Map.entry("Sort", 60),
            Map.entry("Top", 40),
            Map.entry("Limit", 5),
            Map.entry("Skip", 10),
            Map.entry("Distinct", 50),
            Map.entry("EagerAggregation", 90),
            Map.entry("OrderedAggregation", 70),
            Map.entry("Eager", 100),
            Map.entry("Apply", 120),
            Map.entry("SemiApply", 100),
            Map.entry("AntiSemiApply", 100),
            Map.entry("ProduceResults", 1)
    );

    public CostEstimate estimate(ExecutionPlan plan) {
        if (plan.steps().isEmpty()) {
            return CostEstimate.none();
        }
        boolean actual = plan.hasRuntimeStatistics();
        double total = 0;
        double maxRows = 0;
        List<String> riskFactors = new ArrayList<>();
        for (PlanStep step : plan.steps()) {
            double rows = actual ? step.rows() : step.estimatedRows();
            maxRows = Math.max(maxRows, rows);
            total += weight(step.operator()) * Math.max(1, rows / 100);
            if (PlanOperators.isCartesianProduct(step.operator())
                    && !riskFactors.contains("Cartesian product in plan")) {
                riskFactors.add("Cartesian product in plan");
            }
            if (PlanOperators.isUnindexedScan(step.operator())
                    && !riskFactors.contains("Unindexed scan in plan")) {
                riskFactors.add("Unindexed scan in plan");
            }
        }
        int score = score(total);
        RiskLevel risk = riskLevel(score);
        if (riskFactors.contains("Cartesian product in plan") && !risk.isAtLeast(RiskLevel.HIGH)) {
            risk = RiskLevel.HIGH;
        }
        if (score >= 75) {
            riskFactors.add(0, "Very high estimated cost");
        } else if (score >= 50) {
            riskFactors.add(0, "High estimated cost");
        }
        return new CostEstimate(total, score, risk, maxRows, riskFactors);
    }

    static int weight(String operator) {
        Integer exact = WEIGHTS.get(operator);
        if (exact != null) {
            return exact;
        }
        int paren = operator.indexOf('(');
        if (paren > 0) {
            Integer base = WEIGHTS.get(operator.substring(0, paren));
            if (base != null) {
                return base;
            }
        }
        return DEFAULT_WEIGHT;
    }

    static int score(double totalCost) {
        if (totalCost <= 0) {
            return 0;
        }
        double scaled = 100 * Math.log10(1 + totalCost) / Math.log10(1 + SCORE_CEILING);
        return (int) Math.min(100, Math.round(scaled));
    }

    static RiskLevel riskLevel(int score) {
        if (score >= 75) {
            return RiskLevel.CRITICAL;
        }
        if (score >= 50) {
            return RiskLevel.HIGH;
        }
        if (score >= 25) {
            return RiskLevel.MODERATE;
        }
        return RiskLevel.SAFE;
    }
}
