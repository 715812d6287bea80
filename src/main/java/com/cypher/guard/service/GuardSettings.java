package com.cypher.guard.service;

import com.cypher.guard.audit.AuditConfig;
import com.cypher.guard.audit.AuditFormat;
import com.cypher.guard.audit.RotationPolicy;
import com.cypher.guard.complexity.ComplexityConfig;
import com.cypher.guard.ratelimit.RateLimitConfig;
import com.cypher.guard.sanitizer.SanitizerConfig;

import java.nio.file.Path;
import java.time.Duration;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;

/**
 * Binds flat key/value settings to a {@link GuardConfig}.
 *
 * <p>Recognized keys:</p>
 * <ul>
 *   <li>{@code sanitizer.strict-mode}, {@code sanitizer.allow-admin-procedures},
 *       {@code sanitizer.allow-schema-changes}, {@code sanitizer.block-non-ascii},
 *       {@code sanitizer.read-only}, {@code sanitizer.max-query-length},
 *       {@code sanitizer.max-parameters}, {@code sanitizer.max-parameter-length}</li>
 *   <li>{@code complexity.enabled}, {@code complexity.max-score}, {@code complexity.block-on-exceed},
 *       {@code complexity.max-variable-path-length}, {@code complexity.moderate-threshold},
 *       {@code complexity.high-threshold}, {@code complexity.critical-threshold}</li>
 *   <li>{@code rate-limit.default.*}, {@code rate-limit.global.*} and {@code rate-limit.<operation>.*}
 *       with {@code enabled}, {@code requests}, {@code period-seconds}, {@code burst}</li>
 *   <li>{@code audit.enabled}, {@code audit.directory}, {@code audit.format}, {@code audit.rotation},
 *       {@code audit.max-size-mb}, {@code audit.retention-days}, {@code audit.pii-redaction},
 *       {@code audit.log-queries}, {@code audit.log-responses}, {@code audit.log-errors}, {@code audit.async}</li>
 *   <li>{@code execution.timeout-seconds}, {@code execution.max-rows},
 *       {@code execution.response-token-limit}, {@code execution.debug-mode}, {@code execution.environment}</li>
 * </ul>
 * Missing keys keep their defaults. Malformed values raise {@link IllegalArgumentException}.
 */
public final class GuardSettings {

    private static final String RATE_LIMIT_PREFIX = "rate-limit.";
    private static final Set<String> RATE_LIMIT_FIELDS = Set.of("enabled", "requests", "period-seconds", "burst");

    private GuardSettings() {
        // utility class
    }

    public static GuardConfig fromMap(Map<String, String> settings) {
        Map<String, String> s = settings != null ? settings : Map.of();
        GuardConfig.Builder builder = GuardConfig.builder()
                .sanitizer(sanitizer(s))
                .complexity(complexity(s))
                .defaultRateLimit(rateLimit(s, "default", RateLimitConfig.defaults()))
                .globalRateLimit(rateLimit(s, "global", RateLimitConfig.disabled()))
                .audit(audit(s))
                .execution(execution(s));
        for (String operation : rateLimitedOperations(s)) {
            builder.operationLimit(operation, rateLimit(s, operation, RateLimitConfig.defaults()));
        }
        return builder.build();
    }

    static SanitizerConfig sanitizer(Map<String, String> s) {
        SanitizerConfig d = SanitizerConfig.defaults();
        return SanitizerConfig.builder()
                .strictMode(bool(s, "sanitizer.strict-mode", d.strictMode()))
                .allowAdministrativeProcedures(bool(s, "sanitizer.allow-admin-procedures",
                        d.allowAdministrativeProcedures()))
                .allowSchemaChanges(bool(s, "sanitizer.allow-schema-changes", d.allowSchemaChanges()))
                .blockNonAscii(bool(s, "sanitizer.block-non-ascii", d.blockNonAscii()))
                .readOnly(bool(s, "sanitizer.read-only", d.readOnly()))
                .maxQueryLength(integer(s, "sanitizer.max-query-length", d.maxQueryLength()))
                .maxParameters(integer(s, "sanitizer.max-parameters", d.maxParameters()))
                .maxParameterLength(integer(s, "sanitizer.max-parameter-length", d.maxParameterLength()))
                .build();
    }

    static ComplexityConfig complexity(Map<String, String> s) {
        ComplexityConfig d = ComplexityConfig.defaults();
        return new ComplexityConfig(
                bool(s, "complexity.enabled", d.enabled()),
                integer(s, "complexity.max-score", d.maxComplexityScore()),
                bool(s, "complexity.block-on-exceed", d.blockOnExceed()),
                integer(s, "complexity.max-variable-path-length", d.maxVariablePathLength()),
                integer(s, "complexity.moderate-threshold", d.moderateThreshold()),
                integer(s, "complexity.high-threshold", d.highThreshold()),
                integer(s, "complexity.critical-threshold", d.criticalThreshold()));
    }

    static RateLimitConfig rateLimit(Map<String, String> s, String name, RateLimitConfig fallback) {
        String prefix = RATE_LIMIT_PREFIX + name + ".";
        int requests = integer(s, prefix + "requests", fallback.requests());
        // an explicit request rate without a burst gets the default burst for that rate
        int defaultBurst = s.containsKey(prefix + "requests") ? requests * 2 : fallback.burst();
        return new RateLimitConfig(
                bool(s, prefix + "enabled", fallback.enabled() || hasAny(s, prefix)),
                requests,
                Duration.ofSeconds(integer(s, prefix + "period-seconds", (int) fallback.period().toSeconds())),
                integer(s, prefix + "burst", defaultBurst));
    }

    static AuditConfig audit(Map<String, String> s) {
        AuditConfig d = AuditConfig.defaults();
        return AuditConfig.builder()
                .enabled(bool(s, "audit.enabled", d.enabled()))
                .directory(s.containsKey("audit.directory") ? Path.of(s.get("audit.directory").trim()) : d.directory())
                .format(enumValue(s, "audit.format", AuditFormat.class, d.format()))
                .rotation(enumValue(s, "audit.rotation", RotationPolicy.class, d.rotation()))
                .maxSizeMb(integer(s, "audit.max-size-mb", (int) d.maxSizeMb()))
                .retentionDays(integer(s, "audit.retention-days", d.retentionDays()))
                .piiRedaction(bool(s, "audit.pii-redaction", d.piiRedaction()))
                .logQueries(bool(s, "audit.log-queries", d.logQueries()))
                .logResponses(bool(s, "audit.log-responses", d.logResponses()))
                .logErrors(bool(s, "audit.log-errors", d.logErrors()))
                .async(bool(s, "audit.async", d.async()))
                .build();
    }

    static ExecutionSettings execution(Map<String, String> s) {
        ExecutionSettings d = ExecutionSettings.defaults();
        return new ExecutionSettings(
                Duration.ofSeconds(integer(s, "execution.timeout-seconds", (int) d.timeout().toSeconds())),
                integer(s, "execution.max-rows", d.maxRows()),
                integer(s, "execution.response-token-limit", d.responseTokenLimit()),
                bool(s, "execution.debug-mode", d.debugMode()),
                s.getOrDefault("execution.environment", d.environment()));
    }

    private static Set<String> rateLimitedOperations(Map<String, String> s) {
        Set<String> operations = new TreeSet<>();
        for (String key : s.keySet()) {
            if (!key.startsWith(RATE_LIMIT_PREFIX)) {
                continue;
            }
            String rest = key.substring(RATE_LIMIT_PREFIX.length());
            int dot = rest.lastIndexOf('.');
            if (dot <= 0 || !RATE_LIMIT_FIELDS.contains(rest.substring(dot + 1))) {
                throw new IllegalArgumentException("Unknown rate limit setting: " + key);
            }
            String operation = rest.substring(0, dot);
            if (!operation.equals("default") && !operation.equals("global")) {
                operations.add(operation);
            }
        }
        return operations;
    }

    private static boolean hasAny(Map<String, String> s, String prefix) {
        return s.keySet().stream().anyMatch(k -> k.startsWith(prefix) && !k.equals(prefix + "enabled"));
    }

    private static boolean bool(Map<String, String> s, String key, boolean fallback) {
        String value = s.get(key);
        if (value == null || value.isBlank()) {
            return fallback;
        }
        switch (value.trim().toLowerCase(Locale.ROOT)) {
            case "true", "yes", "1", "on":
                return true;
            case "false", "no", "0", "off":
                return false;
            default:
                throw new IllegalArgumentException("Invalid boolean for " + key + ": " + value);
        }
    }

    private static int integer(Map<String, String> s, String key, int fallback) {
        String value = s.get(key);
        if (value == null || value.isBlank()) {
            return fallback;
        }
        try {
            return Integer.parseInt(value.trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Invalid integer for " + key + ": " + value, e);
        }
    }

    private static <E extends Enum<E>> E enumValue(Map<String, String> s, String key, Class<E> type, E fallback) {
        String value = s.get(key);
        if (value == null || value.isBlank()) {
            return fallback;
        }
        try {
            return Enum.valueOf(type, value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Invalid value for " + key + ": " + value, e);
        }
    }
}
