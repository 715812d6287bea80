package com.cypher.guard.ratelimit;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.github.benmanes.caffeine.cache.Ticker;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Per-client token bucket admission control.
 *
 * <p>Each client gets one bucket per operation, created lazily on first use, plus an optional
 * global bucket shared by all of that client's operations. A request must obtain a token from
 * every applicable bucket; tokens already taken are handed back when a later bucket denies.
 * Buckets live in a Caffeine cache and expire once idle long enough to have refilled completely,
 * so eviction never changes a decision.</p>
 *
 * <p>The registry is an ordinary object owned by whoever composes the pipeline; independent
 * registries never share state.</p>
 */
public class RateLimiterRegistry {
    private static final Logger log = LoggerFactory.getLogger(RateLimiterRegistry.class);

    public static final String GLOBAL_BUCKET = "__global__";
    private static final String ANONYMOUS = "__anonymous__";

    private final RateLimitConfig defaultLimit;
    private final Map<String, RateLimitConfig> operationLimits;
    private final RateLimitConfig globalLimit;
    private final Ticker ticker;
    private final Cache<BucketKey, TokenBucket> buckets;

    private record BucketKey(String clientId, String bucket) {
    }

    public RateLimiterRegistry(RateLimitConfig defaultLimit) {
        this(defaultLimit, Map.of(), RateLimitConfig.disabled(), Ticker.systemTicker());
    }

    /**
     * @param defaultLimit    limit for operations without their own entry
     * @param operationLimits limits by operation name
     * @param globalLimit     limit across all operations of a client
     * @param ticker          time source, in nanoseconds
     */
    public RateLimiterRegistry(RateLimitConfig defaultLimit,
                               Map<String, RateLimitConfig> operationLimits,
                               RateLimitConfig globalLimit,
                               Ticker ticker) {
        this.defaultLimit = Objects.requireNonNull(defaultLimit, "defaultLimit is required");
        this.operationLimits = operationLimits != null ? Map.copyOf(operationLimits) : Map.of();
        this.globalLimit = globalLimit != null ? globalLimit : RateLimitConfig.disabled();
        this.ticker = Objects.requireNonNull(ticker, "ticker is required");
        this.buckets = Caffeine.newBuilder()
                .expireAfterAccess(idleExpiry())
                .ticker(ticker)
                .build();
        log.info("RateLimiterRegistry initialized: default={}/{}s burst={}, operations={}, global={}",
                defaultLimit.requests(), defaultLimit.period().toSeconds(), defaultLimit.burst(),
                this.operationLimits.keySet(), this.globalLimit.enabled());
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Takes one token from every bucket that applies to the client and operation.
     *
     * @param clientId      the client, {@code null} or blank for anonymous callers
     * @param operationName the operation, e.g. {@code execute_cypher}
     * @return the decision, with retry-after when denied
     */
    public RateLimitDecision check(String clientId, String operationName) {
        String client = clientId == null || clientId.isBlank() ? ANONYMOUS : clientId;
        String operation = Objects.requireNonNull(operationName, "operationName is required");

        List<TokenBucket> taken = new ArrayList<>(2);
        double remaining = Double.MAX_VALUE;
        for (Map.Entry<String, RateLimitConfig> applicable : applicableBuckets(operation).entrySet()) {
            TokenBucket bucket = bucket(client, applicable.getKey(), applicable.getValue());
            TokenBucket.Consumption consumption = bucket.tryConsume();
            if (!consumption.allowed()) {
                taken.forEach(TokenBucket::refund);
                log.warn("rateLimit.exceeded client={} operation={} bucket={} retryAfter={}",
                        maskKey(client), operation, applicable.getKey(),
                        String.format("%.2f", consumption.retryAfterSeconds()));
                return RateLimitDecision.denied(consumption.retryAfterSeconds(), consumption.remaining(),
                        applicable.getKey());
            }
            taken.add(bucket);
            remaining = Math.min(remaining, consumption.remaining());
        }
        return RateLimitDecision.allowed(remaining == Double.MAX_VALUE ? Double.POSITIVE_INFINITY : remaining);
    }

    /**
     * Reports the state of the operation bucket without consuming a token.
     */
    public BucketStatus status(String clientId, String operationName) {
        String client = clientId == null || clientId.isBlank() ? ANONYMOUS : clientId;
        RateLimitConfig config = operationLimits.getOrDefault(operationName, defaultLimit);
        TokenBucket bucket = bucket(client, operationName, config);
        return new BucketStatus(operationName, bucket.availableTokens(), bucket.capacity(),
                config.refillRatePerSecond());
    }

    /**
     * Drops every bucket of a client, restoring full capacity.
     */
    public void reset(String clientId) {
        buckets.asMap().keySet().removeIf(key -> key.clientId().equals(clientId));
        log.info("rateLimit.reset client={}", maskKey(clientId));
    }

    /**
     * Drops all buckets.
     */
    public void resetAll() {
        buckets.invalidateAll();
        log.info("rateLimit.resetAll");
    }

    /**
     * Number of live buckets.
     */
    public long bucketCount() {
        buckets.cleanUp();
        return buckets.estimatedSize();
    }

    private Map<String, RateLimitConfig> applicableBuckets(String operation) {
        Map<String, RateLimitConfig> applicable = new LinkedHashMap<>();
        RateLimitConfig config = operationLimits.getOrDefault(operation, defaultLimit);
        if (config.enabled()) {
            applicable.put(operation, config);
        }
        if (globalLimit.enabled()) {
            applicable.put(GLOBAL_BUCKET, globalLimit);
        }
        return applicable;
    }

    private TokenBucket bucket(String client, String name, RateLimitConfig config) {
        return buckets.get(new BucketKey(client, name), k -> new TokenBucket(config, ticker));
    }

    private Duration idleExpiry() {
        Duration longest = defaultLimit.fullRefillTime();
        for (RateLimitConfig config : operationLimits.values()) {
            if (config.fullRefillTime().compareTo(longest) > 0) {
                longest = config.fullRefillTime();
            }
        }
        if (globalLimit.fullRefillTime().compareTo(longest) > 0) {
            longest = globalLimit.fullRefillTime();
        }
        return longest.plusSeconds(1);
    }

    static String maskKey(String key) {
        if (key == null || ANONYMOUS.equals(key)) return "anonymous";
        if (key.length() <= 8) return "****";
        return key.substring(0, 4) + "****";
    }

    public static class Builder {
        private RateLimitConfig defaultLimit = RateLimitConfig.defaults();
        private final Map<String, RateLimitConfig> operationLimits = new HashMap<>();
        private RateLimitConfig globalLimit = RateLimitConfig.disabled();
        private Ticker ticker = Ticker.systemTicker();

        public Builder defaultLimit(RateLimitConfig config) {
            this.defaultLimit = config;
            return this;
        }

        public Builder operation(String operationName, RateLimitConfig config) {
            this.operationLimits.put(operationName, config);
            return this;
        }

        public Builder operations(Map<String, RateLimitConfig> limits) {
            this.operationLimits.putAll(limits);
            return this;
        }

        public Builder global(RateLimitConfig config) {
            this.globalLimit = config;
            return this;
        }

        public Builder ticker(Ticker ticker) {
            this.ticker = ticker;
            return this;
        }

        public RateLimiterRegistry build() {
            return new RateLimiterRegistry(defaultLimit, operationLimits, globalLimit, ticker);
        }
    }
}
