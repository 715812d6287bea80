package com.cypher.guard.plan;

/**
 * Aggregates over every operator of a plan.
 *
 * @param operatorCount number of operators
 * @param maxDepth      deepest operator depth
 * @param dbHits        total storage accesses
 * @param rows          total rows produced across operators
 * @param estimatedRows row estimate of the root operator
 * @param timeMillis    total elapsed time
 * @param memoryBytes   total memory allocated
 */
public record PlanTotals(
        int operatorCount,
        int maxDepth,
        long dbHits,
        long rows,
        double estimatedRows,
        long timeMillis,
        long memoryBytes
) {
    public static PlanTotals empty() {
        return new PlanTotals(0, 0, 0, 0, 0, 0, 0);
    }
}
