package com.cypher.guard.complexity;

import com.cypher.guard.plan.ExecutionPlan;
import com.cypher.guard.plan.PlanOperators;
import com.cypher.guard.plan.PlanStep;
import com.cypher.guard.query.CypherText;
import com.cypher.guard.query.LimitClauses;
import com.cypher.guard.query.LimitRewrite;
import com.cypher.guard.query.QueryTokens;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Heuristic structural scoring of Cypher queries, used to refuse or flag queries likely to
 * exhaust the database before they run.
 *
 * <p>Each {@link ComplexityFactor} is scored and capped on its own; the capped values are
 * summed and clamped to [0, {@value ComplexityScore#MAX_SCORE}]. When clamping is needed,
 * points are removed from the largest factors so the breakdown still sums to the total.</p>
 */
public class ComplexityAnalyzer {
    private static final Logger log = LoggerFactory.getLogger(ComplexityAnalyzer.class);

    private static final Pattern VARIABLE_LENGTH = Pattern.compile(
            "-\\s*\\[[^\\[\\]]*?\\*\\s*(\\d*)\\s*(\\.\\.\\s*(\\d*))?\\s*]");

    private static final Pattern QUANTIFIER = Pattern.compile(
            "\\)\\s*\\{\\s*(\\d*)\\s*(,\\s*(\\d*))?\\s*}");

    private static final Pattern AGGREGATE = Pattern.compile(
            "(?<![.\\w])(count|sum|avg|min|max|collect|stdev|stdevp|percentileCont|percentileDisc)\\s*\\(",
            Pattern.CASE_INSENSITIVE);

    private final ComplexityConfig config;

    public ComplexityAnalyzer(ComplexityConfig config) {
        this.config = Objects.requireNonNull(config, "config is required");
    }

    public ComplexityConfig config() {
        return config;
    }

    /**
     * Scores a query from its text alone.
     */
    public ComplexityScore score(String query) {
        return score(query, null);
    }

    /**
     * Scores a query, adding plan-based factors when a plan is available.
     *
     * @param query the query text
     * @param plan  an execution plan for the query, may be {@code null}
     */
    public ComplexityScore score(String query, ExecutionPlan plan) {
        if (query == null || query.isBlank()) {
            return ComplexityScore.zero();
        }
        String masked = CypherText.mask(query);
        Map<ComplexityFactor, Integer> raw = new EnumMap<>(ComplexityFactor.class);
        List<String> bottlenecks = new ArrayList<>();

        countClauses(masked, raw);
        raw.put(ComplexityFactor.AGGREGATIONS, count(AGGREGATE, masked) * ComplexityFactor.AGGREGATIONS.points());
        scoreVariableLengthPaths(masked, raw, bottlenecks);

        List<List<String>> groups = CartesianDetector.disconnectedGroups(masked);
        if (!groups.isEmpty()) {
            raw.put(ComplexityFactor.CARTESIAN_PRODUCT, ComplexityFactor.CARTESIAN_PRODUCT.points());
            bottlenecks.add("Cartesian product between disconnected patterns: " + describe(groups));
        }

        if (plan != null) {
            int scans = 0;
            for (PlanStep step : plan.steps()) {
                if (PlanOperators.isUnindexedScan(step.operator())) {
                    scans++;
                    bottlenecks.add("Unindexed scan " + step.operator()
                            + (step.details().isBlank() ? "" : " (" + step.details() + ")"));
                }
            }
            raw.put(ComplexityFactor.MISSING_INDEX, scans * ComplexityFactor.MISSING_INDEX.points());
        }

        Map<ComplexityFactor, Integer> breakdown = new EnumMap<>(ComplexityFactor.class);
        raw.forEach((factor, points) -> {
            int capped = factor.capped(points);
            if (capped > 0) {
                breakdown.put(factor, capped);
            }
        });
        int total = clamp(breakdown);
        return new ComplexityScore(total, config.riskLevel(total), breakdown, bottlenecks);
    }

    /**
     * Scores a query and decides whether it may run.
     */
    public ComplexityCheck check(String query) {
        return check(query, null);
    }

    /**
     * Scores a query, with optional plan data, and decides whether it may run. Above the
     * configured maximum the query is blocked, or only warned about when blocking is off.
     */
    public ComplexityCheck check(String query, ExecutionPlan plan) {
        if (!config.enabled()) {
            return new ComplexityCheck(true, ComplexityScore.zero(), null, List.of());
        }
        ComplexityScore score = score(query, plan);
        List<String> warnings = new ArrayList<>();
        if (score.total() > config.maxComplexityScore()) {
            String message = "Query complexity score " + score.total() + " exceeds maximum "
                    + config.maxComplexityScore() + " (risk " + score.riskLevel() + "). Bottlenecks: "
                    + (score.bottlenecks().isEmpty() ? "none identified" : String.join("; ", score.bottlenecks()));
            if (config.blockOnExceed()) {
                log.info("complexity.blocked score={} max={}", score.total(), config.maxComplexityScore());
                return new ComplexityCheck(false, score, message, List.of());
            }
            warnings.add(message);
        } else if (score.riskLevel().isAtLeast(RiskLevel.HIGH)) {
            warnings.add("High complexity query (score " + score.total() + ", risk " + score.riskLevel() + ")");
        }
        for (String bottleneck : score.bottlenecks()) {
            warnings.add("Complexity: " + bottleneck);
        }
        return new ComplexityCheck(true, score, null, warnings);
    }

    /**
     * Appends a {@code LIMIT} to queries that return unbounded rows.
     *
     * @see LimitClauses#maybeInjectLimit(String, int)
     */
    public LimitRewrite maybeInjectLimit(String query, int maxRows) {
        return LimitClauses.maybeInjectLimit(query, maxRows);
    }

    private static void countClauses(String masked, Map<ComplexityFactor, Integer> raw) {
        List<QueryTokens.Word> words = QueryTokens.words(masked);
        int matches = 0;
        int optionals = 0;
        int withs = 0;
        int unions = 0;
        int subqueries = 0;
        QueryTokens.Word previous = null;
        for (QueryTokens.Word word : words) {
            switch (word.upper()) {
                case "MATCH" -> {
                    matches++;
                    if (previous != null && previous.is("OPTIONAL")) {
                        optionals++;
                    }
                }
                case "WITH" -> {
                    if (previous == null || !(previous.is("STARTS") || previous.is("ENDS"))) {
                        withs++;
                    }
                }
                case "UNION" -> unions++;
                case "CALL", "EXISTS", "COUNT", "COLLECT" -> {
                    int next = QueryTokens.nextNonWhitespace(masked, word.end());
                    if (next >= 0 && masked.charAt(next) == '{') {
                        subqueries++;
                    }
                }
                default -> {
                }
            }
            previous = word;
        }
        raw.put(ComplexityFactor.PATTERN_CLAUSES, matches * ComplexityFactor.PATTERN_CLAUSES.points());
        raw.put(ComplexityFactor.OPTIONAL_MATCHES, optionals * ComplexityFactor.OPTIONAL_MATCHES.points());
        raw.put(ComplexityFactor.PROJECTIONS, withs * ComplexityFactor.PROJECTIONS.points());
        raw.put(ComplexityFactor.UNIONS, unions * ComplexityFactor.UNIONS.points());
        raw.put(ComplexityFactor.SUBQUERIES, subqueries * ComplexityFactor.SUBQUERIES.points());
    }

    private void scoreVariableLengthPaths(String masked, Map<ComplexityFactor, Integer> raw,
                                          List<String> bottlenecks) {
        int points = 0;
        Matcher matcher = VARIABLE_LENGTH.matcher(masked);
        while (matcher.find()) {
            Integer upper = upperBound(matcher.group(1), matcher.group(2) != null, matcher.group(3));
            points += hopPoints(upper);
            reportPath(matcher.group().substring(matcher.group().indexOf('[')), upper, bottlenecks);
        }
        Matcher quantifier = QUANTIFIER.matcher(masked);
        while (quantifier.find()) {
            if (quantifier.group(1).isEmpty() && quantifier.group(2) == null) {
                continue;
            }
            Integer upper = upperBound(quantifier.group(1), quantifier.group(2) != null, quantifier.group(3));
            points += hopPoints(upper);
            reportPath(quantifier.group().substring(1).trim(), upper, bottlenecks);
        }
        raw.put(ComplexityFactor.VARIABLE_LENGTH_PATHS, points);
    }

    /**
     * Upper hop bound of a range, {@code null} when unbounded. {@code *3} means exactly three hops.
     */
    private static Integer upperBound(String lower, boolean ranged, String upper) {
        if (ranged) {
            return upper == null || upper.isEmpty() ? null : hops(upper);
        }
        return lower == null || lower.isEmpty() ? null : hops(lower);
    }

    private static int hops(String digits) {
        return digits.length() > 9 ? Integer.MAX_VALUE : Integer.parseInt(digits);
    }

    static int hopPoints(Integer upper) {
        if (upper == null) {
            return 100;
        }
        if (upper > 10) {
            return 80;
        }
        if (upper >= 6) {
            return 50;
        }
        if (upper >= 3) {
            return 25;
        }
        return 10;
    }

    private void reportPath(String text, Integer upper, List<String> bottlenecks) {
        String pattern = text.replaceAll("\\s+", "");
        if (upper == null) {
            bottlenecks.add("Unbounded variable-length path " + pattern);
        } else if (upper > config.maxVariablePathLength()) {
            bottlenecks.add("Variable-length path " + pattern + " of up to " + upper
                    + " hops exceeds the bound of " + config.maxVariablePathLength());
        }
    }

    private static int clamp(Map<ComplexityFactor, Integer> breakdown) {
        int total = breakdown.values().stream().mapToInt(Integer::intValue).sum();
        while (total > ComplexityScore.MAX_SCORE) {
            ComplexityFactor largest = breakdown.entrySet().stream()
                    .max(Map.Entry.comparingByValue(Comparator.naturalOrder()))
                    .map(Map.Entry::getKey)
                    .orElseThrow();
            int excess = total - ComplexityScore.MAX_SCORE;
            int current = breakdown.get(largest);
            int removed = Math.min(current, excess);
            breakdown.put(largest, current - removed);
            total -= removed;
        }
        return total;
    }

    private static int count(Pattern pattern, String text) {
        Matcher matcher = pattern.matcher(text);
        int count = 0;
        while (matcher.find()) {
            count++;
        }
        return count;
    }

    private static String describe(List<List<String>> groups) {
        List<String> rendered = new ArrayList<>();
        for (List<String> group : groups) {
            rendered.add(String.join(", ", group).replaceAll("\\s+", " "));
        }
        return String.join(" | ", rendered);
    }
}
