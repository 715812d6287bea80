package com.cypher.guard.service;

import com.cypher.guard.audit.AuditLogger;
import com.cypher.guard.audit.AuditOutcome;
import com.cypher.guard.complexity.ComplexityAnalyzer;
import com.cypher.guard.complexity.ComplexityCheck;
import com.cypher.guard.complexity.ComplexityFactor;
import com.cypher.guard.error.EngineException;
import com.cypher.guard.error.ErrorKind;
import com.cypher.guard.error.ErrorMessageSanitizer;
import com.cypher.guard.error.WriteBlockedException;
import com.cypher.guard.graph.GraphDriver;
import com.cypher.guard.graph.QueryHandle;
import com.cypher.guard.logging.LogContext;
import com.cypher.guard.metrics.MetricsService;
import com.cypher.guard.metrics.NoOpMetricsService;
import com.cypher.guard.plan.AnalysisMode;
import com.cypher.guard.plan.analysis.AnalysisReportFormatter;
import com.cypher.guard.plan.analysis.PlanAnalysis;
import com.cypher.guard.plan.analysis.QueryPlanAnalyzer;
import com.cypher.guard.query.LimitRewrite;
import com.cypher.guard.ratelimit.RateLimitDecision;
import com.cypher.guard.ratelimit.RateLimiterRegistry;
import com.cypher.guard.sanitizer.QuerySanitizer;
import com.cypher.guard.sanitizer.SanitizationResult;
import com.github.benmanes.caffeine.cache.Ticker;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Composition point of the guard pipeline.
 *
 * <p>Every entrypoint runs the stages in a fixed order: rate limit, sanitize, complexity check
 * and row bounding, execution under a timeout, response truncation, audit. A refusal at any
 * stage ends the request with a structured {@link GuardResponse}; every request, refused or not,
 * produces one outcome record in the audit trail. Entrypoints never throw for bad input or
 * database failures.</p>
 */
public class QueryGuardService implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(QueryGuardService.class);

    public static final String QUERY_GRAPH = "query_graph";
    public static final String EXECUTE_CYPHER = "execute_cypher";
    public static final String ANALYZE_QUERY_PERFORMANCE = "analyze_query_performance";

    static final int RESPONSE_EXCERPT_LENGTH = 500;

    private final GuardConfig config;
    private final GraphDriver driver;
    private final QueryTranslator translator;
    private final RateLimiterRegistry rateLimiter;
    private final QuerySanitizer sanitizer;
    private final ComplexityAnalyzer complexityAnalyzer;
    private final QueryPlanAnalyzer planAnalyzer;
    private final AnalysisReportFormatter reportFormatter;
    private final ResponseTruncator truncator;
    private final ErrorMessageSanitizer errorSanitizer;
    private final AuditLogger auditLogger;
    private final MetricsService metrics;
    private final ExecutorService executor;

    private QueryGuardService(Builder builder) {
        this.config = Objects.requireNonNull(builder.config, "config is required");
        this.driver = Objects.requireNonNull(builder.driver, "driver is required");
        this.translator = builder.translator;
        this.metrics = builder.metrics != null ? builder.metrics : NoOpMetricsService.INSTANCE;
        this.rateLimiter = builder.rateLimiter != null ? builder.rateLimiter : RateLimiterRegistry.builder()
                .defaultLimit(config.defaultRateLimit())
                .operations(config.operationLimits())
                .global(config.globalRateLimit())
                .ticker(builder.ticker)
                .build();
        this.sanitizer = new QuerySanitizer(config.sanitizer());
        this.complexityAnalyzer = new ComplexityAnalyzer(config.complexity());
        this.planAnalyzer = new QueryPlanAnalyzer(driver, config.execution().timeout(),
                config.complexity().maxVariablePathLength());
        this.reportFormatter = new AnalysisReportFormatter();
        this.truncator = new ResponseTruncator(config.execution().responseTokenLimit());
        this.errorSanitizer = new ErrorMessageSanitizer(config.execution().debugMode(),
                config.execution().environment());
        this.auditLogger = builder.auditLogger != null ? builder.auditLogger : AuditLogger.disabled();
        this.executor = Executors.newCachedThreadPool(r -> {
            Thread t = new Thread(r, "cypher-guard-exec");
            t.setDaemon(true);
            return t;
        });
        log.info("QueryGuardService initialized: readOnly={}, complexityEnabled={}, maxRows={}, timeout={}s",
                config.sanitizer().readOnly(), config.complexity().enabled(), config.execution().maxRows(),
                config.execution().timeout().toSeconds());
    }

    public static Builder builder() {
        return new Builder();
    }

    public GuardConfig config() {
        return config;
    }

    public RateLimiterRegistry rateLimiter() {
        return rateLimiter;
    }

    /**
     * Answers a natural-language question: translates it to Cypher, then guards and runs the result.
     */
    public GuardResponse queryGraph(GuardRequest request) {
        String requestId = LogContext.generateRequestId();
        try (LogContext ctx = LogContext.forRequest(requestId, QUERY_GRAPH, request.sessionId())) {
            Map<String, Object> metadata = newMetadata(requestId);
            auditLogger.logQuery(QUERY_GRAPH, request.query(), request.parameters(), request.sessionId());
            GuardResponse limited = checkRateLimit(QUERY_GRAPH, request, metadata);
            if (limited != null) {
                return limited;
            }
            if (request.query() == null || request.query().isBlank()) {
                return refuse(QUERY_GRAPH, request, null, ErrorKind.VALIDATION, AuditOutcome.VALIDATION_REJECTED,
                        "Empty query not allowed", List.of(), metadata, "sanitizer");
            }
            if (translator == null) {
                return refuse(QUERY_GRAPH, request, null, ErrorKind.ENGINE, AuditOutcome.ENGINE_ERROR,
                        "Natural-language translation is not configured", List.of(), metadata, "translator");
            }
            String cypher;
            try {
                cypher = translator.translate(request.query());
            } catch (RuntimeException e) {
                log.warn("guard.translationFailed error={}", e.getMessage());
                return engineFailure(QUERY_GRAPH, request, null, "Query translation failed: " + e.getMessage(),
                        List.of(), metadata);
            }
            metadata.put("generated_cypher", cypher);
            return guardAndExecute(QUERY_GRAPH, request, cypher, metadata);
        }
    }

    /**
     * Guards and runs a Cypher query supplied by the caller.
     */
    public GuardResponse executeCypher(GuardRequest request) {
        String requestId = LogContext.generateRequestId();
        try (LogContext ctx = LogContext.forRequest(requestId, EXECUTE_CYPHER, request.sessionId())) {
            Map<String, Object> metadata = newMetadata(requestId);
            auditLogger.logQuery(EXECUTE_CYPHER, request.query(), request.parameters(), request.sessionId());
            GuardResponse limited = checkRateLimit(EXECUTE_CYPHER, request, metadata);
            if (limited != null) {
                return limited;
            }
            return guardAndExecute(EXECUTE_CYPHER, request, request.query(), metadata);
        }
    }

    /**
     * Analyzes the execution plan of a query without returning its rows.
     *
     * @param mode              EXPLAIN, or PROFILE which executes the query
     * @param allowWriteQueries permit PROFILE of queries that write
     */
    public GuardResponse analyzeQueryPerformance(GuardRequest request, AnalysisMode mode, boolean allowWriteQueries) {
        String requestId = LogContext.generateRequestId();
        String operation = ANALYZE_QUERY_PERFORMANCE;
        AnalysisMode effectiveMode = mode != null ? mode : AnalysisMode.EXPLAIN;
        try (LogContext ctx = LogContext.forRequest(requestId, operation, request.sessionId())
                .with("analysisMode", effectiveMode.name())) {
            Map<String, Object> metadata = newMetadata(requestId);
            metadata.put("mode", effectiveMode.name());
            auditLogger.logQuery(operation, request.query(), request.parameters(), request.sessionId());
            GuardResponse limited = checkRateLimit(operation, request, metadata);
            if (limited != null) {
                return limited;
            }
            SanitizationResult sanitized = sanitizer.sanitize(request.query(), request.parameters());
            List<String> warnings = new ArrayList<>(sanitized.warnings());
            if (!sanitized.safe()) {
                metadata.put("violation", sanitized.violation().name());
                return refuse(operation, request, request.query(), ErrorKind.VALIDATION,
                        AuditOutcome.VALIDATION_REJECTED, sanitized.error(), warnings, metadata, "sanitizer");
            }
            try {
                PlanAnalysis analysis = planAnalyzer.analyzeQuery(request.query(), request.parameters(),
                        effectiveMode, allowWriteQueries);
                Map<String, Object> data = reportFormatter.toMap(analysis);
                data.put("report", reportFormatter.toText(analysis));
                metadata.put("cost_score", analysis.cost().costScore());
                metadata.put("risk_level", analysis.cost().riskLevel().name());
                metadata.put("bottleneck_count", analysis.bottlenecks().size());
                Map<String, Object> details = new LinkedHashMap<>(metadata);
                details.put(AuditLogger.RESPONSE_DETAIL, excerpt(analysis.summary()));
                auditLogger.logOutcome(operation, request.query(), request.parameters(), request.sessionId(),
                        AuditOutcome.SUCCESS, null, details);
                return GuardResponse.success(data, warnings, metadata);
            } catch (WriteBlockedException e) {
                metadata.put("write_operation", e.operation());
                return refuse(operation, request, request.query(), ErrorKind.WRITE_BLOCKED,
                        AuditOutcome.WRITE_BLOCKED, e.getMessage(), warnings, metadata, "write-guard");
            } catch (EngineException e) {
                return engineFailure(operation, request, request.query(), e.getMessage(), warnings, metadata);
            }
        }
    }

    private GuardResponse guardAndExecute(String operation, GuardRequest request, String query,
                                          Map<String, Object> metadata) {
        SanitizationResult sanitized = sanitizer.sanitize(query, request.parameters());
        List<String> warnings = new ArrayList<>(sanitized.warnings());
        if (!sanitized.safe()) {
            metadata.put("violation", sanitized.violation().name());
            return refuse(operation, request, query, ErrorKind.VALIDATION, AuditOutcome.VALIDATION_REJECTED,
                    sanitized.error(), warnings, metadata, "sanitizer");
        }

        ComplexityCheck complexity = complexityAnalyzer.check(query);
        warnings.addAll(complexity.warnings());
        if (config.complexity().enabled()) {
            metrics.recordComplexityScore(complexity.score().total());
            metadata.put("complexity_score", complexity.score().total());
            metadata.put("risk_level", complexity.score().riskLevel().name());
        }
        if (!complexity.allowed()) {
            metadata.put("complexity_breakdown", breakdown(complexity));
            return refuse(operation, request, query, ErrorKind.COMPLEXITY, AuditOutcome.COMPLEXITY_REJECTED,
                    complexity.error(), warnings, metadata, "complexity");
        }

        String bounded = query;
        int maxRows = config.execution().maxRows();
        if (maxRows > 0) {
            LimitRewrite rewrite = complexityAnalyzer.maybeInjectLimit(query, maxRows);
            if (rewrite.injected()) {
                bounded = rewrite.query();
                metrics.incrementLimitInjected(operation);
                warnings.add("Automatic LIMIT " + maxRows + " applied to unbounded query");
            }
            metadata.put("limit_injected", rewrite.injected());
        }

        long start = System.nanoTime();
        List<Map<String, Object>> rows;
        try {
            rows = execute(bounded, request.parameters());
        } catch (EngineException e) {
            metrics.recordExecutionDuration(operation, false, Duration.ofNanos(System.nanoTime() - start));
            return engineFailure(operation, request, query, e.getMessage(), warnings, metadata);
        }
        Duration elapsed = Duration.ofNanos(System.nanoTime() - start);
        metrics.recordExecutionDuration(operation, true, elapsed);

        ResponseTruncator.Truncation truncation = truncator.truncate(rows);
        if (truncation.truncated()) {
            warnings.add("Response truncated to " + truncation.rows().size() + " of " + truncation.originalCount()
                    + " rows to stay within the response token limit");
        }
        metadata.put("row_count", truncation.rows().size());
        metadata.put("truncated", truncation.truncated());
        metadata.put("execution_time_ms", elapsed.toMillis());

        Map<String, Object> details = new LinkedHashMap<>(metadata);
        details.put(AuditLogger.RESPONSE_DETAIL, excerpt(String.valueOf(truncation.rows())));
        auditLogger.logOutcome(operation, bounded, request.parameters(), request.sessionId(),
                AuditOutcome.SUCCESS, null, details);
        log.info("guard.executed operation={} rows={} truncated={} elapsedMs={}",
                operation, truncation.rows().size(), truncation.truncated(), elapsed.toMillis());
        return GuardResponse.success(truncation.rows(), warnings, metadata);
    }

    private List<Map<String, Object>> execute(String query, Map<String, Object> parameters) {
        Map<String, Object> params = parameters != null ? parameters : Map.of();
        Duration timeout = config.execution().timeout();
        Future<List<Map<String, Object>>> future = executor.submit(() -> {
            try (QueryHandle handle = driver.run(query, params, timeout)) {
                return handle.materialize();
            }
        });
        try {
            return future.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            future.cancel(true);
            log.warn("guard.timeout timeoutSeconds={}", timeout.toSeconds());
            throw EngineException.timeout(timeout.toSeconds(), e);
        } catch (InterruptedException e) {
            future.cancel(true);
            Thread.currentThread().interrupt();
            throw new EngineException("Query execution interrupted", e);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof EngineException engine) {
                throw engine;
            }
            throw new EngineException("Query execution failed: " + cause.getMessage(), cause);
        }
    }

    private GuardResponse checkRateLimit(String operation, GuardRequest request, Map<String, Object> metadata) {
        RateLimitDecision decision = rateLimiter.check(request.clientId(), operation);
        if (decision.allowed()) {
            return null;
        }
        metrics.incrementRateLimited(operation, decision.limitedBy());
        metadata.put("retry_after_seconds", decision.retryAfterWholeSeconds());
        metadata.put("limited_by", decision.limitedBy());
        return refuse(operation, request, request.query(), ErrorKind.RATE_LIMIT, AuditOutcome.RATE_LIMITED,
                "Rate limit exceeded. Retry after " + decision.retryAfterWholeSeconds() + " seconds",
                List.of(), metadata, "rate-limit");
    }

    private GuardResponse refuse(String operation, GuardRequest request, String query, ErrorKind kind,
                                 AuditOutcome outcome, String error, List<String> warnings,
                                 Map<String, Object> metadata, String stage) {
        metrics.incrementRejected(operation, stage);
        log.info("guard.rejected operation={} stage={} kind={}", operation, stage, kind);
        auditLogger.logOutcome(operation, query, request.parameters(), request.sessionId(), outcome, error, metadata);
        return GuardResponse.failure(kind, error, warnings, metadata);
    }

    private GuardResponse engineFailure(String operation, GuardRequest request, String query, String detail,
                                        List<String> warnings, Map<String, Object> metadata) {
        metrics.incrementRejected(operation, "engine");
        log.warn("guard.engineError operation={} error={}", operation, detail);
        auditLogger.logOutcome(operation, query, request.parameters(), request.sessionId(),
                AuditOutcome.ENGINE_ERROR, detail, metadata);
        return GuardResponse.failure(ErrorKind.ENGINE, errorSanitizer.sanitize(detail), warnings, metadata);
    }

    private static Map<String, Object> newMetadata(String requestId) {
        Map<String, Object> metadata = new LinkedHashMap<>();
        metadata.put("request_id", requestId);
        return metadata;
    }

    private static Map<String, Integer> breakdown(ComplexityCheck check) {
        Map<String, Integer> breakdown = new LinkedHashMap<>();
        for (Map.Entry<ComplexityFactor, Integer> entry : check.score().breakdown().entrySet()) {
            breakdown.put(entry.getKey().name(), entry.getValue());
        }
        return breakdown;
    }

    private static String excerpt(String text) {
        return text.length() > RESPONSE_EXCERPT_LENGTH ? text.substring(0, RESPONSE_EXCERPT_LENGTH) + "..." : text;
    }

    @Override
    public void close() {
        executor.shutdownNow();
        auditLogger.close();
    }

    public static class Builder {
        private GuardConfig config = GuardConfig.defaults();
        private GraphDriver driver;
        private QueryTranslator translator;
        private RateLimiterRegistry rateLimiter;
        private AuditLogger auditLogger;
        private MetricsService metrics;
        private Ticker ticker = Ticker.systemTicker();

        public Builder config(GuardConfig config) {
            this.config = config;
            return this;
        }

        public Builder driver(GraphDriver driver) {
            this.driver = driver;
            return this;
        }

        public Builder translator(QueryTranslator translator) {
            this.translator = translator;
            return this;
        }

        /**
         * Shares an existing registry instead of building one from the configuration.
         */
        public Builder rateLimiter(RateLimiterRegistry rateLimiter) {
            this.rateLimiter = rateLimiter;
            return this;
        }

        public Builder auditLogger(AuditLogger auditLogger) {
            this.auditLogger = auditLogger;
            return this;
        }

        public Builder metrics(MetricsService metrics) {
            this.metrics = metrics;
            return this;
        }

        public Builder ticker(Ticker ticker) {
            this.ticker = ticker;
            return this;
        }

        public QueryGuardService build() {
            return new QueryGuardService(this);
        }
    }
}
