package com.cypher.guard.plan.analysis;

import com.cypher.guard.complexity.RiskLevel;

import java.util.List;

/**
 * Relative cost of executing a plan.
 *
 * @param totalCost     weighted operator cost in abstract units
 * @param costScore     cost on a 0..100 scale
 * @param riskLevel     risk band of the score, raised by dangerous operators
 * @param estimatedRows largest row count of any operator, actual when profiled
 * @param riskFactors   reasons behind the risk level
 */
public record CostEstimate(double totalCost, int costScore, RiskLevel riskLevel, double estimatedRows,
                           List<String> riskFactors) {

    public CostEstimate {
        if (costScore < 0 || costScore > 100) {
            throw new IllegalArgumentException("costScore must be within [0, 100]");
        }
        riskFactors = riskFactors != null ? List.copyOf(riskFactors) : List.of();
    }

    public static CostEstimate none() {
        return new CostEstimate(0, 0, RiskLevel.SAFE, 0, List.of());
    }
}
