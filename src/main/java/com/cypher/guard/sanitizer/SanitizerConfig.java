package com.cypher.guard.sanitizer;

/**
 * Configuration for {@link QuerySanitizer}.
 *
 * @param strictMode                    reject suspicious patterns instead of warning about them
 * @param allowAdministrativeProcedures permit {@code dbms.*} and other administrative procedures
 * @param allowSchemaChanges            do not warn on index and constraint changes
 * @param blockNonAscii                 reject any non-ASCII character except typographic quotes
 * @param readOnly                      reject write clauses and mutating procedures
 * @param maxQueryLength                maximum query length in characters
 * @param maxParameters                 maximum number of parameters
 * @param maxParameterLength            maximum length of a string value or serialized collection value
 */
public record SanitizerConfig(
        boolean strictMode,
        boolean allowAdministrativeProcedures,
        boolean allowSchemaChanges,
        boolean blockNonAscii,
        boolean readOnly,
        int maxQueryLength,
        int maxParameters,
        int maxParameterLength
) {
    public static final int DEFAULT_MAX_QUERY_LENGTH = 10_000;
    public static final int DEFAULT_MAX_PARAMETERS = 100;
    public static final int DEFAULT_MAX_PARAMETER_LENGTH = 5_000;

    public SanitizerConfig {
        if (maxQueryLength <= 0) {
            maxQueryLength = DEFAULT_MAX_QUERY_LENGTH;
        }
        if (maxParameters <= 0) {
            maxParameters = DEFAULT_MAX_PARAMETERS;
        }
        if (maxParameterLength <= 0) {
            maxParameterLength = DEFAULT_MAX_PARAMETER_LENGTH;
        }
    }

    /**
     * Permissive defaults: writes allowed, suspicious patterns only warned about.
     */
    public static SanitizerConfig defaults() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public Builder toBuilder() {
        return new Builder()
                .strictMode(strictMode)
                .allowAdministrativeProcedures(allowAdministrativeProcedures)
                .allowSchemaChanges(allowSchemaChanges)
                .blockNonAscii(blockNonAscii)
                .readOnly(readOnly)
                .maxQueryLength(maxQueryLength)
                .maxParameters(maxParameters)
                .maxParameterLength(maxParameterLength);
    }

    public static class Builder {
        private boolean strictMode;
        private boolean allowAdministrativeProcedures;
        private boolean allowSchemaChanges;
        private boolean blockNonAscii;
        private boolean readOnly;
        private int maxQueryLength = DEFAULT_MAX_QUERY_LENGTH;
        private int maxParameters = DEFAULT_MAX_PARAMETERS;
        private int maxParameterLength = DEFAULT_MAX_PARAMETER_LENGTH;

        public Builder strictMode(boolean strictMode) {
            this.strictMode = strictMode;
            return this;
        }

        public Builder allowAdministrativeProcedures(boolean allow) {
            this.allowAdministrativeProcedures = allow;
            return this;
        }

        public Builder allowSchemaChanges(boolean allow) {
            this.allowSchemaChanges = allow;
            return this;
        }

        public Builder blockNonAscii(boolean block) {
            this.blockNonAscii = block;
            return this;
        }

        public Builder readOnly(boolean readOnly) {
            this.readOnly = readOnly;
            return this;
        }

        public Builder maxQueryLength(int maxQueryLength) {
            this.maxQueryLength = maxQueryLength;
            return this;
        }

        public Builder maxParameters(int maxParameters) {
            this.maxParameters = maxParameters;
            return this;
        }

        public Builder maxParameterLength(int maxParameterLength) {
            this.maxParameterLength = maxParameterLength;
            return this;
        }

        public SanitizerConfig build() {
            return new SanitizerConfig(strictMode, allowAdministrativeProcedures, allowSchemaChanges,
                    blockNonAscii, readOnly, maxQueryLength, maxParameters, maxParameterLength);
        }
    }
}
