package com.cypher.guard.metrics;

import java.time.Duration;

/**
 * Interface for recording query guard metrics.
 * Implementations can integrate with Micrometer or other metrics systems.
 * The default {@link NoOpMetricsService} does nothing, so the guard works
 * without a meter registry.
 */
public interface MetricsService {

    /**
     * @param operation the guarded operation, e.g. {@code execute_cypher}
     * @param stage     the pipeline stage that refused the request
     */
    void incrementRejected(String operation, String stage);

    void incrementRateLimited(String operation, String bucket);

    void recordComplexityScore(int score);

    void recordExecutionDuration(String operation, boolean success, Duration duration);

    void incrementLimitInjected(String operation);

    void incrementAuditFailure();
}
