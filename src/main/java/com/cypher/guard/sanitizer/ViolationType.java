package com.cypher.guard.sanitizer;

/**
 * Reasons a query or its parameters can be rejected by {@link QuerySanitizer}.
 */
public enum ViolationType {
    EMPTY_QUERY,
    QUERY_TOO_LONG,

    // Unicode and encoding attacks
    NULL_BYTE,
    INVALID_ENCODING,
    ZERO_WIDTH_CHARACTER,
    BIDI_OVERRIDE,
    COMBINING_DIACRITIC,
    MATH_ALPHANUMERIC,
    HOMOGLYPH,
    NON_ASCII,
    ESCAPE_SEQUENCE,

    // Structural and pattern rules
    UNBALANCED_DELIMITERS,
    WRITE_OPERATION,
    FILESYSTEM_ACCESS,
    DYNAMIC_EXECUTION,
    ADMIN_PROCEDURE,
    STATEMENT_CHAINING,
    EXCESSIVE_ITERATION,
    SUSPICIOUS_PATTERN,

    // Parameters
    TOO_MANY_PARAMETERS,
    INVALID_PARAMETER_NAME,
    PARAMETER_TOO_LONG,
    INVALID_PARAMETER_VALUE,
    PARAMETER_INJECTION;

    /**
     * Whether this violation was raised by the Unicode/encoding inspection step.
     */
    public boolean isUnicodeAttack() {
        return switch (this) {
            case NULL_BYTE, INVALID_ENCODING, ZERO_WIDTH_CHARACTER, BIDI_OVERRIDE, COMBINING_DIACRITIC,
                 MATH_ALPHANUMERIC, HOMOGLYPH, NON_ASCII, ESCAPE_SEQUENCE -> true;
            default -> false;
        };
    }
}
