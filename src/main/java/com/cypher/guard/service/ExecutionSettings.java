package com.cypher.guard.service;

import com.cypher.guard.error.ErrorMessageSanitizer;

import java.time.Duration;

/**
 * Settings for running guarded queries.
 *
 * @param timeout            bound on a single database call
 * @param maxRows            row limit injected into unbounded queries, 0 disables injection
 * @param responseTokenLimit approximate token budget of a response, 0 for unlimited
 * @param debugMode          return full error detail to callers
 * @param environment        deployment environment; debug mode is refused in {@code production}
 */
public record ExecutionSettings(
        Duration timeout,
        int maxRows,
        int responseTokenLimit,
        boolean debugMode,
        String environment
) {
    public static final Duration DEFAULT_TIMEOUT = Duration.ofSeconds(30);
    public static final int DEFAULT_MAX_ROWS = 1000;
    public static final int DEFAULT_RESPONSE_TOKEN_LIMIT = 10_000;

    public ExecutionSettings {
        if (timeout == null || timeout.isZero() || timeout.isNegative()) {
            timeout = DEFAULT_TIMEOUT;
        }
        if (maxRows < 0) {
            throw new IllegalArgumentException("maxRows must not be negative");
        }
        if (responseTokenLimit < 0) {
            throw new IllegalArgumentException("responseTokenLimit must not be negative");
        }
        environment = environment != null && !environment.isBlank() ? environment.trim() : "development";
        if (debugMode && ErrorMessageSanitizer.PRODUCTION.equalsIgnoreCase(environment)) {
            throw new IllegalArgumentException("Debug mode must not be enabled in production");
        }
    }

    public static ExecutionSettings defaults() {
        return new ExecutionSettings(DEFAULT_TIMEOUT, DEFAULT_MAX_ROWS, DEFAULT_RESPONSE_TOKEN_LIMIT,
                false, "production");
    }
}
