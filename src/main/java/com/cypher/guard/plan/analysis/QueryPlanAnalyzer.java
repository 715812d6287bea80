package com.cypher.guard.plan.analysis;

import com.cypher.guard.error.EngineException;
import com.cypher.guard.error.QueryGuardException;
import com.cypher.guard.error.WriteBlockedException;
import com.cypher.guard.graph.GraphDriver;
import com.cypher.guard.graph.QueryHandle;
import com.cypher.guard.graph.QuerySummary;
import com.cypher.guard.logging.LogContext;
import com.cypher.guard.plan.AnalysisMode;
import com.cypher.guard.plan.ExecutionPlan;
import com.cypher.guard.plan.PlanParser;
import com.cypher.guard.query.WriteOperationDetector;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Obtains a query plan with EXPLAIN or PROFILE and turns it into bottlenecks,
 * recommendations and a cost estimate.
 *
 * <p>Only the result summary is consumed; result rows are never read. PROFILE executes the
 * query, so it is refused for queries that write unless writes are explicitly allowed.</p>
 */
public class QueryPlanAnalyzer {
    private static final Logger log = LoggerFactory.getLogger(QueryPlanAnalyzer.class);

    private static final Pattern ANALYSIS_PREFIX = Pattern.compile("^\\s*(?:EXPLAIN|PROFILE)\\b\\s*",
            Pattern.CASE_INSENSITIVE);

    private final GraphDriver driver;
    private final Duration timeout;
    private final BottleneckDetector bottleneckDetector;
    private final RecommendationEngine recommendationEngine;
    private final CostEstimator costEstimator;

    public QueryPlanAnalyzer(GraphDriver driver, Duration timeout, int maxVariablePathLength) {
        this(driver, timeout, new BottleneckDetector(maxVariablePathLength), new RecommendationEngine(),
                new CostEstimator());
    }

    public QueryPlanAnalyzer(GraphDriver driver, Duration timeout, BottleneckDetector bottleneckDetector,
                             RecommendationEngine recommendationEngine, CostEstimator costEstimator) {
        this.driver = Objects.requireNonNull(driver, "driver is required");
        this.timeout = Objects.requireNonNull(timeout, "timeout is required");
        this.bottleneckDetector = Objects.requireNonNull(bottleneckDetector, "bottleneckDetector is required");
        this.recommendationEngine = Objects.requireNonNull(recommendationEngine, "recommendationEngine is required");
        this.costEstimator = Objects.requireNonNull(costEstimator, "costEstimator is required");
    }

    public PlanAnalysis analyzeQuery(String query) {
        return analyzeQuery(query, null, AnalysisMode.EXPLAIN, false);
    }

    /**
     * Analyzes a query.
     *
     * @param query             the query, with or without a leading EXPLAIN/PROFILE
     * @param parameters        forwarded to the database unchanged; {@code null} means none
     * @param mode              EXPLAIN plans only, PROFILE executes and measures
     * @param allowWriteQueries permit PROFILE of queries that write
     * @throws WriteBlockedException when PROFILE would execute a write that is not allowed
     * @throws EngineException      when the database fails
     */
    public PlanAnalysis analyzeQuery(String query, Map<String, Object> parameters, AnalysisMode mode,
                                     boolean allowWriteQueries) {
        Objects.requireNonNull(query, "query is required");
        AnalysisMode effectiveMode = mode != null ? mode : AnalysisMode.EXPLAIN;
        String stripped = stripAnalysisPrefix(query);

        if (effectiveMode == AnalysisMode.PROFILE && !allowWriteQueries) {
            Optional<String> write = WriteOperationDetector.findWrite(stripped);
            if (write.isPresent()) {
                log.warn("analysis.writeBlocked operation={}", write.get());
                throw new WriteBlockedException(write.get());
            }
        }

        Map<String, Object> params = parameters != null ? parameters : Map.of();
        try (LogContext ctx = LogContext.forAnalysis(LogContext.generateRequestId(), effectiveMode.name())) {
            QuerySummary summary = fetchSummary(effectiveMode.keyword() + " " + stripped, params);
            ExecutionPlan plan = summary.planTree()
                    .map(node -> PlanParser.parse(effectiveMode, node))
                    .orElseGet(() -> ExecutionPlan.empty(effectiveMode));
            List<Bottleneck> bottlenecks = bottleneckDetector.detect(plan, stripped);
            List<Recommendation> recommendations = recommendationEngine.recommend(bottlenecks);
            CostEstimate cost = costEstimator.estimate(plan);
            PlanAnalysis analysis = new PlanAnalysis(stripped, effectiveMode, plan, bottlenecks, recommendations,
                    cost, summarize(plan, bottlenecks, recommendations, cost));
            log.info("analysis.completed operators={} bottlenecks={} costScore={} risk={}",
                    plan.totals().operatorCount(), bottlenecks.size(), cost.costScore(), cost.riskLevel());
            return analysis;
        }
    }

    private QuerySummary fetchSummary(String analysisQuery, Map<String, Object> params) {
        try (QueryHandle handle = driver.run(analysisQuery, params, timeout)) {
            return handle.consume();
        } catch (QueryGuardException e) {
            throw e;
        } catch (RuntimeException e) {
            log.error("analysis.failed error={}", e.getMessage());
            throw new EngineException("Query analysis failed: " + e.getMessage(), e);
        }
    }

    /**
     * Removes a leading EXPLAIN or PROFILE keyword, repeatedly.
     */
    static String stripAnalysisPrefix(String query) {
        String current = query;
        Matcher matcher = ANALYSIS_PREFIX.matcher(current);
        while (matcher.find()) {
            current = current.substring(matcher.end());
            matcher = ANALYSIS_PREFIX.matcher(current);
        }
        return current.trim();
    }

    static String summarize(ExecutionPlan plan, List<Bottleneck> bottlenecks, List<Recommendation> recommendations,
                            CostEstimate cost) {
        long critical = bottlenecks.stream().filter(b -> b.severity() == BottleneckSeverity.CRITICAL).count();
        return plan.totals().operatorCount() + " operators, " + bottlenecks.size() + " bottlenecks ("
                + critical + " critical), " + recommendations.size() + " recommendations, cost score "
                + cost.costScore() + " (" + cost.riskLevel() + ")";
    }
}
