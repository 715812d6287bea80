package com.cypher.guard.ratelimit;

import com.github.benmanes.caffeine.cache.Ticker;

/**
 * Token bucket for a single (client, operation) pair.
 * Each bucket synchronizes on itself; distinct buckets never share a lock.
 */
final class TokenBucket {

    /**
     * Result of a consumption attempt.
     *
     * @param allowed           whether a token was taken
     * @param remaining         tokens left after the attempt
     * @param retryAfterSeconds time until one token is available, 0 when allowed
     */
    record Consumption(boolean allowed, double remaining, double retryAfterSeconds) {
    }

    // absorbs rounding so that waiting exactly the reported retry-after is enough
    private static final double EPSILON = 1e-9;

    private final double capacity;
    private final double refillPerNano; // tokens per nanosecond
    private final Ticker ticker;
    private double tokens;
    private long lastRefillNanos;

    TokenBucket(RateLimitConfig config, Ticker ticker) {
        this.capacity = config.burst();
        this.refillPerNano = config.refillRatePerSecond() / 1_000_000_000.0;
        this.ticker = ticker;
        this.tokens = capacity;
        this.lastRefillNanos = ticker.read();
    }

    synchronized Consumption tryConsume() {
        refill();
        if (tokens >= 1.0 - EPSILON) {
            tokens = Math.max(0.0, tokens - 1.0);
            return new Consumption(true, tokens, 0.0);
        }
        double retryAfter = (1.0 - tokens) / (refillPerNano * 1_000_000_000.0);
        return new Consumption(false, tokens, retryAfter);
    }

    /**
     * Returns a token taken by {@link #tryConsume()} when a later bucket denied the request.
     */
    synchronized void refund() {
        tokens = Math.min(capacity, tokens + 1.0);
    }

    synchronized double availableTokens() {
        refill();
        return tokens;
    }

    double capacity() {
        return capacity;
    }

    private void refill() {
        long now = ticker.read();
        long elapsed = now - lastRefillNanos;
        if (elapsed <= 0) {
            return;
        }
        tokens = Math.min(capacity, tokens + elapsed * refillPerNano);
        lastRefillNanos = now;
    }
}
