package com.cypher.guard.error;

/**
 * Category of a failed guarded request, reported to callers.
 */
public enum ErrorKind {
    VALIDATION,
    COMPLEXITY,
    RATE_LIMIT,
    WRITE_BLOCKED,
    ENGINE,
    INTERNAL
}
