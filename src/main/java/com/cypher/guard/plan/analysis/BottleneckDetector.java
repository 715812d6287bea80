package com.cypher.guard.plan.analysis;

import com.cypher.guard.plan.ExecutionPlan;
import com.cypher.guard.plan.PlanOperators;
import com.cypher.guard.plan.PlanStep;
import com.cypher.guard.query.CypherText;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Finds known slow operators in a parsed plan.
 *
 * <ul>
 *   <li>unindexed scans: HIGH, with a {@code CREATE INDEX} statement for the scanned label and
 *       the property the query filters on</li>
 *   <li>{@code CartesianProduct}: CRITICAL</li>
 *   <li>variable-length expansion: HIGH when unbounded or above the hop bound, MEDIUM otherwise</li>
 *   <li>{@code Eager}: MEDIUM</li>
 * </ul>
 */
public class BottleneckDetector {

    private static final Pattern LABELLED = Pattern.compile("^\\s*`?(\\w+)`?\\s*:\\s*`?(\\w+)`?");
    private static final Pattern REL_TYPE = Pattern.compile("\\[\\s*`?(\\w+)`?\\s*:\\s*`?(\\w+)`?");
    private static final Pattern STAR_RANGE = Pattern.compile("\\*\\s*(\\d*)\\s*(\\.\\.\\s*(\\d*))?");
    private static final Pattern QUANTIFIER = Pattern.compile("\\{\\s*(\\d*)\\s*,\\s*(\\d*)\\s*}");

    private final int maxVariablePathLength;

    public BottleneckDetector(int maxVariablePathLength) {
        if (maxVariablePathLength < 1) {
            throw new IllegalArgumentException("maxVariablePathLength must be at least 1");
        }
        this.maxVariablePathLength = maxVariablePathLength;
    }

    /**
     * @param plan  the parsed plan
     * @param query the query text, used to find filtered properties for index suggestions
     * @return bottlenecks, most severe first, plan order within a severity
     */
    public List<Bottleneck> detect(ExecutionPlan plan, String query) {
        String code = query != null ? CypherText.maskLiteralsAndComments(query) : "";
        List<Bottleneck> found = new ArrayList<>();
        for (PlanStep step : plan.steps()) {
            String operator = step.operator();
            if (PlanOperators.isUnindexedScan(operator)) {
                found.add(missingIndex(step, code));
            } else if (PlanOperators.isCartesianProduct(operator)) {
                found.add(new Bottleneck(BottleneckType.CARTESIAN_PRODUCT, BottleneckSeverity.CRITICAL,
                        operator, step.depth(),
                        "Cartesian product combines every row of one pattern with every row of another",
                        "Connect the patterns with a relationship or a join predicate in WHERE"));
            } else if (PlanOperators.isVarLengthExpand(operator)) {
                found.add(variableLength(step));
            } else if (PlanOperators.isEager(operator)) {
                found.add(new Bottleneck(BottleneckType.EAGER_OPERATION, BottleneckSeverity.MEDIUM,
                        operator, step.depth(),
                        "Eager operator materializes all intermediate rows before continuing",
                        "Split reads and writes of the same data, or batch the update"));
            }
        }
        found.sort(Comparator.comparing(Bottleneck::severity).reversed());
        return found;
    }

    private Bottleneck missingIndex(PlanStep step, String code) {
        String operator = step.operator();
        String details = step.details();
        if (PlanOperators.isLabelScan(operator)) {
            Matcher labelled = LABELLED.matcher(details);
            if (labelled.find()) {
                String variable = labelled.group(1);
                String label = labelled.group(2);
                String property = filteredProperty(code, variable).orElse("property");
                return new Bottleneck(BottleneckType.MISSING_INDEX, BottleneckSeverity.HIGH, operator, step.depth(),
                        "Label scan reads every :" + label + " node" + (property.equals("property")
                                ? "" : " to filter on " + property),
                        "CREATE INDEX FOR (" + variable + ":" + label + ") ON (" + variable + "." + property + ")");
            }
        }
        Matcher relType = REL_TYPE.matcher(details);
        if (operator.contains("Relationship") && relType.find()) {
            String variable = relType.group(1);
            String property = filteredProperty(code, variable).orElse("property");
            return new Bottleneck(BottleneckType.MISSING_INDEX, BottleneckSeverity.HIGH, operator, step.depth(),
                    "Relationship scan reads every :" + relType.group(2) + " relationship",
                    "CREATE INDEX FOR ()-[" + variable + ":" + relType.group(2) + "]-() ON ("
                            + variable + "." + property + ")");
        }
        return new Bottleneck(BottleneckType.MISSING_INDEX, BottleneckSeverity.HIGH, operator, step.depth(),
                operator + " reads the whole graph" + (details.isBlank() ? "" : " (" + details + ")"),
                "Add a label or relationship type to the pattern and index the filtered property");
    }

    private Bottleneck variableLength(PlanStep step) {
        String details = step.details();
        Integer upper = null;
        boolean known = false;
        Matcher star = STAR_RANGE.matcher(details);
        Matcher quantifier = QUANTIFIER.matcher(details);
        if (star.find()) {
            known = true;
            String bound = star.group(2) != null ? star.group(3) : star.group(1);
            upper = bound == null || bound.isEmpty() ? null : parseHops(bound);
        } else if (quantifier.find()) {
            known = true;
            upper = quantifier.group(2).isEmpty() ? null : parseHops(quantifier.group(2));
        }
        if (known && upper == null) {
            return new Bottleneck(BottleneckType.VARIABLE_LENGTH_EXPANSION, BottleneckSeverity.HIGH,
                    step.operator(), step.depth(),
                    "Unbounded variable-length expansion can traverse the entire graph",
                    "Bound the pattern, e.g. [*1..4], or use shortestPath()");
        }
        if (known && upper > maxVariablePathLength) {
            return new Bottleneck(BottleneckType.VARIABLE_LENGTH_EXPANSION, BottleneckSeverity.HIGH,
                    step.operator(), step.depth(),
                    "Variable-length expansion of up to " + upper + " hops exceeds the bound of "
                            + maxVariablePathLength,
                    "Reduce the upper bound to " + maxVariablePathLength + " hops or fewer");
        }
        return new Bottleneck(BottleneckType.VARIABLE_LENGTH_EXPANSION, BottleneckSeverity.MEDIUM,
                step.operator(), step.depth(),
                "Variable-length expansion" + (known ? " of up to " + upper + " hops" : ""),
                "Keep the hop range as small as the question allows");
    }

    /**
     * The first property of {@code variable} the query refers to, e.g. {@code name} for
     * {@code WHERE n.name = $name} or {@code (n:Person {name: $name})}.
     */
    static Optional<String> filteredProperty(String code, String variable) {
        Matcher inline = Pattern.compile("\\(\\s*" + Pattern.quote(variable)
                + "\\s*(?::\\s*`?\\w+`?\\s*)*\\{\\s*`?(\\w+)`?\\s*:").matcher(code);
        if (inline.find()) {
            return Optional.of(inline.group(1));
        }
        Matcher dotted = Pattern.compile("(?<![\\w.])" + Pattern.quote(variable) + "\\s*\\.\\s*`?(\\w+)`?")
                .matcher(code);
        if (dotted.find()) {
            return Optional.of(dotted.group(1));
        }
        return Optional.empty();
    }

    private static int parseHops(String digits) {
        return digits.length() > 9 ? Integer.MAX_VALUE : Integer.parseInt(digits);
    }
}
