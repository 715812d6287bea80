package com.cypher.guard.service;

import com.cypher.guard.audit.AuditConfig;
import com.cypher.guard.complexity.ComplexityConfig;
import com.cypher.guard.ratelimit.RateLimitConfig;
import com.cypher.guard.sanitizer.SanitizerConfig;

import java.util.HashMap;
import java.util.Map;

/**
 * Complete configuration of a {@link QueryGuardService}.
 *
 * @param sanitizer        query and parameter validation
 * @param complexity       complexity scoring and blocking
 * @param defaultRateLimit limit for operations without their own entry
 * @param operationLimits  limits by operation name
 * @param globalRateLimit  limit across all operations of a client
 * @param audit            audit trail
 * @param execution        timeouts, row and response bounds, error detail
 */
public record GuardConfig(
        SanitizerConfig sanitizer,
        ComplexityConfig complexity,
        RateLimitConfig defaultRateLimit,
        Map<String, RateLimitConfig> operationLimits,
        RateLimitConfig globalRateLimit,
        AuditConfig audit,
        ExecutionSettings execution
) {
    public GuardConfig {
        if (sanitizer == null) sanitizer = SanitizerConfig.defaults();
        if (complexity == null) complexity = ComplexityConfig.defaults();
        if (defaultRateLimit == null) defaultRateLimit = RateLimitConfig.defaults();
        operationLimits = operationLimits != null ? Map.copyOf(operationLimits) : Map.of();
        if (globalRateLimit == null) globalRateLimit = RateLimitConfig.disabled();
        if (audit == null) audit = AuditConfig.defaults();
        if (execution == null) execution = ExecutionSettings.defaults();
    }

    public static GuardConfig defaults() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private SanitizerConfig sanitizer = SanitizerConfig.defaults();
        private ComplexityConfig complexity = ComplexityConfig.defaults();
        private RateLimitConfig defaultRateLimit = RateLimitConfig.defaults();
        private final Map<String, RateLimitConfig> operationLimits = new HashMap<>();
        private RateLimitConfig globalRateLimit = RateLimitConfig.disabled();
        private AuditConfig audit = AuditConfig.defaults();
        private ExecutionSettings execution = ExecutionSettings.defaults();

        public Builder sanitizer(SanitizerConfig sanitizer) {
            this.sanitizer = sanitizer;
            return this;
        }

        public Builder complexity(ComplexityConfig complexity) {
            this.complexity = complexity;
            return this;
        }

        public Builder defaultRateLimit(RateLimitConfig config) {
            this.defaultRateLimit = config;
            return this;
        }

        public Builder operationLimit(String operationName, RateLimitConfig config) {
            this.operationLimits.put(operationName, config);
            return this;
        }

        public Builder globalRateLimit(RateLimitConfig config) {
            this.globalRateLimit = config;
            return this;
        }

        public Builder audit(AuditConfig audit) {
            this.audit = audit;
            return this;
        }

        public Builder execution(ExecutionSettings execution) {
            this.execution = execution;
            return this;
        }

        public GuardConfig build() {
            return new GuardConfig(sanitizer, complexity, defaultRateLimit, operationLimits, globalRateLimit,
                    audit, execution);
        }
    }
}
