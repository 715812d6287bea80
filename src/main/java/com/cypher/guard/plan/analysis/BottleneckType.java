package com.cypher.guard.plan.analysis;

/**
 * Kinds of plan bottlenecks and the recommendation category they belong to.
 */
public enum BottleneckType {
    MISSING_INDEX("indexing"),
    CARTESIAN_PRODUCT("query_structure"),
    VARIABLE_LENGTH_EXPANSION("pattern_optimization"),
    EAGER_OPERATION("operation_optimization");

    private final String category;

    BottleneckType(String category) {
        this.category = category;
    }

    public String category() {
        return category;
    }
}
