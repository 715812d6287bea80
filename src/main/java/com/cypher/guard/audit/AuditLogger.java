package com.cypher.guard.audit;

import com.cypher.guard.metrics.MetricsService;
import com.cypher.guard.metrics.NoOpMetricsService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.time.Clock;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.UUID;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;

/**
 * Records the outcome of every guarded request.
 *
 * <p>Logging never fails the request: a record that cannot be written is reported to the
 * {@code com.cypher.guard.audit.fallback} logger and counted as an audit failure. Personal data
 * is redacted once, here, before the entry reaches the sink.</p>
 */
public class AuditLogger implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(AuditLogger.class);
    private static final Logger fallback = LoggerFactory.getLogger("com.cypher.guard.audit.fallback");

    /** Detail key carrying an excerpt of the returned data. */
    public static final String RESPONSE_DETAIL = "response";

    private final AuditConfig config;
    private final AuditSink sink;
    private final MetricsService metrics;
    private final Clock clock;
    private final ExecutorService executor;

    public AuditLogger(AuditConfig config, AuditSink sink, MetricsService metrics) {
        this(config, sink, metrics, Clock.systemUTC());
    }

    public AuditLogger(AuditConfig config, AuditSink sink, MetricsService metrics, Clock clock) {
        this.config = Objects.requireNonNull(config, "config is required");
        this.sink = Objects.requireNonNull(sink, "sink is required");
        this.metrics = metrics != null ? metrics : NoOpMetricsService.INSTANCE;
        this.clock = Objects.requireNonNull(clock, "clock is required");
        this.executor = config.enabled() && config.async()
                ? Executors.newSingleThreadExecutor(r -> {
                    Thread t = new Thread(r, "cypher-guard-audit");
                    t.setDaemon(true);
                    return t;
                })
                : null;
    }

    /**
     * Creates a logger writing to rotating files, or a disabled logger when auditing is off.
     */
    public static AuditLogger create(AuditConfig config, MetricsService metrics) throws IOException {
        if (!config.enabled()) {
            return disabled();
        }
        return new AuditLogger(config, new RotatingFileAuditSink(config), metrics);
    }

    public static AuditLogger disabled() {
        return new AuditLogger(AuditConfig.disabled(), entry -> { }, NoOpMetricsService.INSTANCE);
    }

    public AuditConfig config() {
        return config;
    }

    /**
     * Records an incoming request, when query logging is on.
     */
    public void logQuery(String operation, String query, Map<String, ?> parameters, String sessionId) {
        if (!config.enabled() || !config.logQueries()) {
            return;
        }
        record(AuditEventType.QUERY, operation, query, parameters, sessionId, AuditOutcome.SUCCESS, null, null);
    }

    public void logOutcome(String operation, String query, Map<String, ?> parameters, String sessionId,
                           AuditOutcome outcome, String error) {
        logOutcome(operation, query, parameters, sessionId, outcome, error, null);
    }

    /**
     * Records the final outcome of a request. Successes are written when response logging is on,
     * refusals and failures when error logging is on.
     *
     * @param details extra context; a {@value #RESPONSE_DETAIL} entry is dropped unless
     *                response logging is on
     */
    public void logOutcome(String operation, String query, Map<String, ?> parameters, String sessionId,
                           AuditOutcome outcome, String error, Map<String, ?> details) {
        if (!config.enabled()) {
            return;
        }
        boolean success = outcome == AuditOutcome.SUCCESS;
        if (success ? !config.logResponses() : !config.logErrors()) {
            return;
        }
        record(success ? AuditEventType.RESPONSE : AuditEventType.ERROR,
                operation, query, parameters, sessionId, outcome, error, details);
    }

    private void record(AuditEventType type, String operation, String query, Map<String, ?> parameters,
                        String sessionId, AuditOutcome outcome, String error, Map<String, ?> details) {
        AuditEntry entry;
        try {
            entry = buildEntry(type, operation, query, parameters, sessionId, outcome, error, details);
        } catch (RuntimeException e) {
            reportFailure(operation, outcome, e);
            return;
        }
        if (executor == null) {
            write(entry);
            return;
        }
        try {
            executor.execute(() -> write(entry));
        } catch (RejectedExecutionException e) {
            write(entry);
        }
    }

    private AuditEntry buildEntry(AuditEventType type, String operation, String query, Map<String, ?> parameters,
                                  String sessionId, AuditOutcome outcome, String error, Map<String, ?> details) {
        Map<String, Object> params = parameters != null ? new LinkedHashMap<>(parameters) : null;
        Map<String, Object> extra = details != null ? new LinkedHashMap<>(details) : null;
        if (extra != null && !config.logResponses()) {
            extra.remove(RESPONSE_DETAIL);
        }
        boolean redact = config.piiRedaction();
        return AuditEntry.builder()
                .id(UUID.randomUUID().toString())
                .timestamp(clock.instant())
                .eventType(type)
                .sessionId(sessionId)
                .operation(operation != null ? operation : "unknown")
                .query(redact ? PiiRedactor.redact(query) : query)
                .parameters(redact ? PiiRedactor.redactMap(params) : params)
                .outcome(outcome)
                .error(redact ? PiiRedactor.redact(error) : error)
                .details(redact ? PiiRedactor.redactMap(extra) : extra)
                .redacted(redact)
                .build();
    }

    private void write(AuditEntry entry) {
        try {
            sink.append(entry);
            log.debug("audit.recorded id={} operation={} outcome={}", entry.id(), entry.operation(), entry.outcome());
        } catch (IOException | RuntimeException e) {
            reportFailure(entry.operation(), entry.outcome(), e);
        }
    }

    private void reportFailure(String operation, AuditOutcome outcome, Exception e) {
        metrics.incrementAuditFailure();
        fallback.error("audit.writeFailed operation={} outcome={} error={}", operation, outcome, e.toString());
    }

    /**
     * Drains pending asynchronous writes and closes the sink.
     */
    @Override
    public void close() {
        if (executor != null) {
            executor.shutdown();
            try {
                if (!executor.awaitTermination(5, TimeUnit.SECONDS)) {
                    log.warn("audit.close pending records dropped");
                    executor.shutdownNow();
                }
            } catch (InterruptedException e) {
                executor.shutdownNow();
                Thread.currentThread().interrupt();
            }
        }
        try {
            sink.close();
        } catch (IOException e) {
            log.warn("audit.close failed: {}", e.getMessage());
        }
    }
}
