package com.cypher.guard.ratelimit;

import java.time.Duration;

/**
 * Token bucket settings for one rate-limited operation.
 *
 * <p>Bound from key/value settings:</p>
 * <pre>
 * rate-limit.execute_cypher.enabled=true
 * rate-limit.execute_cypher.requests=10
 * rate-limit.execute_cypher.period-seconds=60
 * rate-limit.execute_cypher.burst=20
 * </pre>
 *
 * @param enabled  whether the bucket is checked
 * @param requests tokens refilled per period
 * @param period   refill period
 * @param burst    bucket capacity
 */
public record RateLimitConfig(
        boolean enabled,
        int requests,
        Duration period,
        int burst
) {

    public RateLimitConfig {
        if (requests <= 0) {
            requests = 10;
        }
        if (period == null || period.isZero() || period.isNegative()) {
            period = Duration.ofSeconds(60);
        }
        if (burst <= 0) {
            burst = requests * 2;
        }
    }

    /**
     * Default rate limit: 10 requests per 60 seconds, burst of 20.
     */
    public static RateLimitConfig defaults() {
        return new RateLimitConfig(true, 10, Duration.ofSeconds(60), 20);
    }

    /**
     * Disabled rate limiting.
     */
    public static RateLimitConfig disabled() {
        return new RateLimitConfig(false, 10, Duration.ofSeconds(60), 20);
    }

    public static RateLimitConfig of(int requests, Duration period, int burst) {
        return new RateLimitConfig(true, requests, period, burst);
    }

    /**
     * Tokens added per second.
     */
    public double refillRatePerSecond() {
        return requests / (period.toNanos() / 1_000_000_000.0);
    }

    /**
     * Time an empty bucket needs to fill up again.
     */
    public Duration fullRefillTime() {
        return Duration.ofNanos((long) Math.ceil(burst / refillRatePerSecond() * 1_000_000_000.0));
    }
}
