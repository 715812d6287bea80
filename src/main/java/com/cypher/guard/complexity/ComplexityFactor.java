package com.cypher.guard.complexity;

/**
 * Structural factors contributing to a complexity score, with their per-item points and cap.
 * Points for {@link #VARIABLE_LENGTH_PATHS} depend on the hop bound and are computed by the analyzer.
 */
public enum ComplexityFactor {
    PATTERN_CLAUSES(5, 50),
    VARIABLE_LENGTH_PATHS(0, 300),
    CARTESIAN_PRODUCT(200, 200),
    AGGREGATIONS(5, 50),
    SUBQUERIES(20, 100),
    UNIONS(15, 60),
    OPTIONAL_MATCHES(10, 50),
    PROJECTIONS(5, 40),
    MISSING_INDEX(40, 120);

    private final int points;
    private final int cap;

    ComplexityFactor(int points, int cap) {
        this.points = points;
        this.cap = cap;
    }

    public int points() {
        return points;
    }

    public int cap() {
        return cap;
    }

    int capped(int raw) {
        return Math.max(0, Math.min(cap, raw));
    }
}
