package com.cypher.guard.plan;

import java.util.Set;

/**
 * Classification of engine operator names.
 */
public final class PlanOperators {

    private static final Set<String> UNINDEXED_SCANS = Set.of(
            "AllNodesScan",
            "NodeByLabelScan",
            "AllRelationshipsScan",
            "DirectedAllRelationshipsScan",
            "UndirectedAllRelationshipsScan",
            "RelationshipTypeScan",
            "DirectedRelationshipTypeScan",
            "UndirectedRelationshipTypeScan"
    );

    private PlanOperators() {
        // utility class
    }

    /**
     * Strips the planner suffix ({@code NodeByLabelScan@neo4j} becomes {@code NodeByLabelScan}).
     */
    public static String normalize(String operatorType) {
        if (operatorType == null) {
            return "Unknown";
        }
        int at = operatorType.indexOf('@');
        return at >= 0 ? operatorType.substring(0, at) : operatorType;
    }

    public static boolean isUnindexedScan(String operator) {
        return UNINDEXED_SCANS.contains(operator);
    }

    public static boolean isLabelScan(String operator) {
        return "NodeByLabelScan".equals(operator);
    }

    public static boolean isCartesianProduct(String operator) {
        return "CartesianProduct".equals(operator);
    }

    public static boolean isVarLengthExpand(String operator) {
        return operator.startsWith("VarLengthExpand") || operator.startsWith("Repeat");
    }

    public static boolean isEager(String operator) {
        return "Eager".equals(operator);
    }
}
