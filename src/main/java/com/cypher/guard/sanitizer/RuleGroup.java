package com.cypher.guard.sanitizer;

/**
 * Families of pattern rules. Dangerous groups reject a query, suspicious groups warn
 * (and reject only in strict mode).
 */
public enum RuleGroup {
    FILESYSTEM(ViolationType.FILESYSTEM_ACCESS, true),
    DYNAMIC_CODE(ViolationType.DYNAMIC_EXECUTION, true),
    ADMINISTRATIVE(ViolationType.ADMIN_PROCEDURE, true),
    CHAINING(ViolationType.STATEMENT_CHAINING, true),
    ITERATION(ViolationType.EXCESSIVE_ITERATION, true),
    PROCEDURE_CALL(ViolationType.SUSPICIOUS_PATTERN, false),
    SCHEMA_CHANGE(ViolationType.SUSPICIOUS_PATTERN, false),
    CONCATENATION(ViolationType.SUSPICIOUS_PATTERN, false);

    private final ViolationType violation;
    private final boolean dangerous;

    RuleGroup(ViolationType violation, boolean dangerous) {
        this.violation = violation;
        this.dangerous = dangerous;
    }

    public ViolationType violation() {
        return violation;
    }

    public boolean isDangerous() {
        return dangerous;
    }
}
