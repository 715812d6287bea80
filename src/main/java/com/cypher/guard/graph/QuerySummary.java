package com.cypher.guard.graph;

import java.util.Optional;

/**
 * What the database reports once a result has been consumed.
 *
 * @param plan the plan tree, {@code null} unless the query was run with EXPLAIN or PROFILE
 * @param resultAvailableAfterMillis time until the first record was available, -1 if unknown
 */
public record QuerySummary(PlanNode plan, long resultAvailableAfterMillis) {

    public static QuerySummary withoutPlan() {
        return new QuerySummary(null, -1);
    }

    public Optional<PlanNode> planTree() {
        return Optional.ofNullable(plan);
    }
}
