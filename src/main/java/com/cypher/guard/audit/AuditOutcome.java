package com.cypher.guard.audit;

/**
 * Final outcome of an audited request.
 */
public enum AuditOutcome {
    SUCCESS(AuditSeverity.INFO),
    VALIDATION_REJECTED(AuditSeverity.WARNING),
    COMPLEXITY_REJECTED(AuditSeverity.WARNING),
    RATE_LIMITED(AuditSeverity.WARNING),
    WRITE_BLOCKED(AuditSeverity.WARNING),
    ENGINE_ERROR(AuditSeverity.ERROR),
    INTERNAL_ERROR(AuditSeverity.ERROR);

    private final AuditSeverity severity;

    AuditOutcome(AuditSeverity severity) {
        this.severity = severity;
    }

    public AuditSeverity defaultSeverity() {
        return severity;
    }

    public boolean isSuccess() {
        return this == SUCCESS;
    }
}
