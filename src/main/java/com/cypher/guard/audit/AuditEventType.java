package com.cypher.guard.audit;

/**
 * Kinds of audit records: an incoming query, a successful response, or a failure.
 */
public enum AuditEventType {
    QUERY,
    RESPONSE,
    ERROR
}
