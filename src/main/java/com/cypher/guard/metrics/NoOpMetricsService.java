package com.cypher.guard.metrics;

import java.time.Duration;

/**
 * No-op implementation of {@link MetricsService}.
 */
public class NoOpMetricsService implements MetricsService {

    public static final NoOpMetricsService INSTANCE = new NoOpMetricsService();

    @Override
    public void incrementRejected(String operation, String stage) {
    }

    @Override
    public void incrementRateLimited(String operation, String bucket) {
    }

    @Override
    public void recordComplexityScore(int score) {
    }

    @Override
    public void recordExecutionDuration(String operation, boolean success, Duration duration) {
    }

    @Override
    public void incrementLimitInjected(String operation) {
    }

    @Override
    public void incrementAuditFailure() {
    }
}
