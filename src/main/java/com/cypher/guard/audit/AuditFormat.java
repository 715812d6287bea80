package com.cypher.guard.audit;

/**
 * Serialization format of audit records.
 */
public enum AuditFormat {
    /** One JSON object per line. */
    JSON,
    /** Human-readable multi-line blocks. */
    TEXT
}
