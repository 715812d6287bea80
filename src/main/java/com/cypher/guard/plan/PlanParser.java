package com.cypher.guard.plan;

import com.cypher.guard.graph.PlanNode;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.regex.Pattern;

/**
 * Turns a database plan tree into an {@link ExecutionPlan}.
 */
public final class PlanParser {

    static final String DETAILS = "Details";
    static final String ESTIMATED_ROWS = "EstimatedRows";
    static final String MEMORY = "Memory";
    private static final Pattern NUMERIC = Pattern.compile("-?\\d+(\\.\\d+)?([eE][-+]?\\d+)?");

    private PlanParser() {
        // utility class
    }

    public static ExecutionPlan parse(AnalysisMode mode, PlanNode node) {
        Objects.requireNonNull(mode, "mode is required");
        if (node == null) {
            return ExecutionPlan.empty(mode);
        }
        PlanOperator root = toOperator(node, 0);
        List<PlanStep> steps = new ArrayList<>();
        flatten(root, steps);
        return new ExecutionPlan(mode, root, steps, totals(root, steps));
    }

    private static PlanOperator toOperator(PlanNode node, int depth) {
        List<PlanOperator> children = new ArrayList<>();
        for (PlanNode child : node.children()) {
            children.add(toOperator(child, depth + 1));
        }
        Map<String, String> arguments = new LinkedHashMap<>();
        node.arguments().forEach((key, value) -> {
            if (!DETAILS.equals(key) && value != null) {
                arguments.put(key, String.valueOf(value));
            }
        });
        Object details = node.arguments().get(DETAILS);
        return new PlanOperator(
                PlanOperators.normalize(node.operatorType()),
                depth,
                details != null ? String.valueOf(details) : "",
                node.identifiers(),
                number(node.arguments().get(ESTIMATED_ROWS)),
                node.rows(),
                node.dbHits(),
                node.timeMillis(),
                (long) number(node.arguments().get(MEMORY)),
                arguments,
                children);
    }

    private static void flatten(PlanOperator operator, List<PlanStep> steps) {
        steps.add(PlanStep.of(operator));
        for (PlanOperator child : operator.children()) {
            flatten(child, steps);
        }
    }

    private static PlanTotals totals(PlanOperator root, List<PlanStep> steps) {
        int maxDepth = 0;
        long dbHits = 0;
        long rows = 0;
        long time = 0;
        long memory = 0;
        for (PlanStep step : steps) {
            maxDepth = Math.max(maxDepth, step.depth());
            dbHits += step.dbHits();
            rows += step.rows();
            time += step.timeMillis();
            memory += step.memoryBytes();
        }
        return new PlanTotals(steps.size(), maxDepth, dbHits, rows, root.estimatedRows(), time, memory);
    }

    private static double number(Object value) {
        if (value instanceof Number n) {
            return n.doubleValue();
        }
        if (value instanceof String s && NUMERIC.matcher(s.trim()).matches()) {
            return Double.parseDouble(s.trim());
        }
        return 0;
    }
}
