package com.cypher.guard.logging;

import org.slf4j.MDC;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * AutoCloseable MDC wrapper for structured logging.
 * Adds key-value pairs to SLF4J MDC and removes them on close. Values that an
 * enclosing context had set for the same keys are restored.
 *
 * <pre>
 * try (LogContext ctx = LogContext.forRequest(requestId, "execute_cypher", sessionId)) {
 *     log.info("guard.executed rows={}", rows);
 * }
 * </pre>
 */
public class LogContext implements AutoCloseable {

    private final List<String> keys = new ArrayList<>();
    private final Map<String, String> previous = new HashMap<>();

    private LogContext() {
    }

    /**
     * Creates a log context for a guarded request.
     */
    public static LogContext forRequest(String requestId, String operation, String sessionId) {
        LogContext ctx = new LogContext();
        ctx.put("requestId", requestId);
        ctx.put("operation", operation);
        if (sessionId != null) {
            ctx.put("sessionId", sessionId);
        }
        return ctx;
    }

    /**
     * Creates a log context for plan analysis.
     */
    public static LogContext forAnalysis(String requestId, String mode) {
        LogContext ctx = new LogContext();
        ctx.put("requestId", requestId);
        ctx.put("operation", "analyze");
        ctx.put("analysisMode", mode);
        return ctx;
    }

    public static String generateRequestId() {
        return UUID.randomUUID().toString();
    }

    /**
     * Adds an additional key-value pair to this log context.
     */
    public LogContext with(String key, String value) {
        put(key, value);
        return this;
    }

    private void put(String key, String value) {
        if (!keys.contains(key)) {
            keys.add(key);
            String outer = MDC.get(key);
            if (outer != null) {
                previous.put(key, outer);
            }
        }
        MDC.put(key, value);
    }

    @Override
    public void close() {
        for (String key : keys) {
            String outer = previous.get(key);
            if (outer != null) {
                MDC.put(key, outer);
            } else {
                MDC.remove(key);
            }
        }
        keys.clear();
        previous.clear();
    }
}
