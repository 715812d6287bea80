package com.cypher.guard.metrics;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;

import java.time.Duration;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Micrometer-based implementation of {@link MetricsService}.
 *
 * <p>Recorded metrics:</p>
 * <ul>
 *   <li>{@code cypher.guard.rejected} Counter (tags: operation, stage)</li>
 *   <li>{@code cypher.guard.rate.limited} Counter (tags: operation, bucket)</li>
 *   <li>{@code cypher.guard.complexity.score} DistributionSummary</li>
 *   <li>{@code cypher.guard.execution.duration} Timer (tags: operation, outcome)</li>
 *   <li>{@code cypher.guard.limit.injected} Counter (tag: operation)</li>
 *   <li>{@code cypher.guard.audit.failures} Counter</li>
 * </ul>
 */
public class MicrometerMetricsService implements MetricsService {

    private final MeterRegistry registry;
    private final Map<String, Timer> timerCache = new ConcurrentHashMap<>();
    private final Map<String, Counter> counterCache = new ConcurrentHashMap<>();
    private final DistributionSummary complexitySummary;
    private final Counter auditFailureCounter;

    public MicrometerMetricsService(MeterRegistry registry) {
        this.registry = registry;
        this.complexitySummary = DistributionSummary.builder("cypher.guard.complexity.score")
                .description("Distribution of query complexity scores")
                .register(registry);
        this.auditFailureCounter = Counter.builder("cypher.guard.audit.failures")
                .description("Audit records that could not be written")
                .register(registry);
    }

    @Override
    public void incrementRejected(String operation, String stage) {
        counterCache.computeIfAbsent("rejected:" + operation + ":" + stage, k ->
                Counter.builder("cypher.guard.rejected")
                        .description("Requests refused by a guard stage")
                        .tag("operation", operation)
                        .tag("stage", stage)
                        .register(registry)).increment();
    }

    @Override
    public void incrementRateLimited(String operation, String bucket) {
        counterCache.computeIfAbsent("rateLimited:" + operation + ":" + bucket, k ->
                Counter.builder("cypher.guard.rate.limited")
                        .description("Requests denied by the rate limiter")
                        .tag("operation", operation)
                        .tag("bucket", bucket)
                        .register(registry)).increment();
    }

    @Override
    public void recordComplexityScore(int score) {
        complexitySummary.record(score);
    }

    @Override
    public void recordExecutionDuration(String operation, boolean success, Duration duration) {
        String outcome = success ? "success" : "failure";
        timerCache.computeIfAbsent(operation + ":" + outcome, k ->
                Timer.builder("cypher.guard.execution.duration")
                        .description("Duration of guarded query executions")
                        .tag("operation", operation)
                        .tag("outcome", outcome)
                        .register(registry)).record(duration);
    }

    @Override
    public void incrementLimitInjected(String operation) {
        counterCache.computeIfAbsent("limit:" + operation, k ->
                Counter.builder("cypher.guard.limit.injected")
                        .description("Queries that received an automatic LIMIT")
                        .tag("operation", operation)
                        .register(registry)).increment();
    }

    @Override
    public void incrementAuditFailure() {
        auditFailureCounter.increment();
    }
}
