package com.cypher.guard.audit;

/**
 * When the audit log moves on to a new file.
 */
public enum RotationPolicy {
    /** {@code audit_yyyy-MM-dd.log} */
    DAILY,
    /** {@code audit_YYYY-Www.log}, ISO week numbering */
    WEEKLY,
    /** {@code audit_current.log}, renamed to {@code audit_yyyyMMdd_HHmmss.log} when full */
    SIZE
}
