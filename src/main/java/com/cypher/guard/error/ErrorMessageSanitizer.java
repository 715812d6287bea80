package com.cypher.guard.error;

import java.util.List;
import java.util.Locale;

/**
 * Decides how much of an internal error message a caller may see.
 *
 * <p>Outside debug mode only messages containing one of the safe phrases pass through;
 * everything else is replaced by a generic message. Debug mode is refused in production.</p>
 */
public class ErrorMessageSanitizer {

    public static final String GENERIC_MESSAGE = "An error occurred while processing the query";
    public static final String PRODUCTION = "production";

    static final List<String> SAFE_PHRASES = List.of(
            "query exceeds maximum length",
            "empty query not allowed",
            "blocked: query contains dangerous pattern",
            "authentication failed",
            "connection refused",
            "timeout",
            "not found",
            "unauthorized");

    private final boolean debugMode;

    /**
     * @param debugMode   return every message unchanged
     * @param environment deployment environment name
     * @throws IllegalArgumentException when debug mode is requested in production
     */
    public ErrorMessageSanitizer(boolean debugMode, String environment) {
        if (debugMode && environment != null && PRODUCTION.equalsIgnoreCase(environment.trim())) {
            throw new IllegalArgumentException("Debug mode must not be enabled in production");
        }
        this.debugMode = debugMode;
    }

    public static ErrorMessageSanitizer production() {
        return new ErrorMessageSanitizer(false, PRODUCTION);
    }

    public boolean debugMode() {
        return debugMode;
    }

    public String sanitize(String message) {
        if (message == null || message.isBlank()) {
            return GENERIC_MESSAGE;
        }
        if (debugMode) {
            return message;
        }
        String lower = message.toLowerCase(Locale.ROOT);
        for (String phrase : SAFE_PHRASES) {
            if (lower.contains(phrase)) {
                return message;
            }
        }
        return GENERIC_MESSAGE;
    }
}
