package com.cypher.guard.audit;

/**
 * Severity attached to audit records.
 */
public enum AuditSeverity {
    INFO,
    WARNING,
    ERROR
}
