package com.cypher.guard.plan;

/**
 * One operator of a flattened plan, in depth-first order.
 */
public record PlanStep(
        String operator,
        int depth,
        String details,
        long dbHits,
        long rows,
        double estimatedRows,
        long timeMillis,
        long memoryBytes
) {
    static PlanStep of(PlanOperator operator) {
        return new PlanStep(operator.name(), operator.depth(), operator.details(), operator.dbHits(),
                operator.rows(), operator.estimatedRows(), operator.timeMillis(), operator.memoryBytes());
    }
}
