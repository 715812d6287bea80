package com.cypher.guard.audit;

import java.nio.file.Path;
import java.time.Duration;

/**
 * Audit trail configuration.
 *
 * @param enabled      whether records are written at all
 * @param directory    directory holding the audit files
 * @param format       JSON lines or text blocks
 * @param rotation     file rotation policy
 * @param maxSizeMb    file size that triggers rotation under {@link RotationPolicy#SIZE}
 * @param retentionDays audit files older than this are deleted
 * @param piiRedaction redact personal data from queries, parameters, errors and excerpts
 * @param logQueries   write a record when a request arrives
 * @param logResponses write a record for successful outcomes
 * @param logErrors    write a record for refused and failed outcomes
 * @param async        write from a background thread
 */
public record AuditConfig(
        boolean enabled,
        Path directory,
        AuditFormat format,
        RotationPolicy rotation,
        long maxSizeMb,
        int retentionDays,
        boolean piiRedaction,
        boolean logQueries,
        boolean logResponses,
        boolean logErrors,
        boolean async
) {
    public static final Path DEFAULT_DIRECTORY = Path.of("logs", "audit");
    public static final long DEFAULT_MAX_SIZE_MB = 100;
    public static final int DEFAULT_RETENTION_DAYS = 90;

    public AuditConfig {
        if (directory == null) directory = DEFAULT_DIRECTORY;
        if (format == null) format = AuditFormat.JSON;
        if (rotation == null) rotation = RotationPolicy.DAILY;
        if (maxSizeMb <= 0) {
            throw new IllegalArgumentException("maxSizeMb must be positive");
        }
        if (retentionDays <= 0) {
            throw new IllegalArgumentException("retentionDays must be positive");
        }
    }

    public static AuditConfig defaults() {
        return builder().build();
    }

    public static AuditConfig disabled() {
        return builder().enabled(false).build();
    }

    public long maxSizeBytes() {
        return maxSizeMb * 1024 * 1024;
    }

    public Duration retention() {
        return Duration.ofDays(retentionDays);
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private boolean enabled = true;
        private Path directory = DEFAULT_DIRECTORY;
        private AuditFormat format = AuditFormat.JSON;
        private RotationPolicy rotation = RotationPolicy.DAILY;
        private long maxSizeMb = DEFAULT_MAX_SIZE_MB;
        private int retentionDays = DEFAULT_RETENTION_DAYS;
        private boolean piiRedaction = true;
        private boolean logQueries = true;
        private boolean logResponses = true;
        private boolean logErrors = true;
        private boolean async = false;

        public Builder enabled(boolean enabled) {
            this.enabled = enabled;
            return this;
        }

        public Builder directory(Path directory) {
            this.directory = directory;
            return this;
        }

        public Builder format(AuditFormat format) {
            this.format = format;
            return this;
        }

        public Builder rotation(RotationPolicy rotation) {
            this.rotation = rotation;
            return this;
        }

        public Builder maxSizeMb(long maxSizeMb) {
            this.maxSizeMb = maxSizeMb;
            return this;
        }

        public Builder retentionDays(int retentionDays) {
            this.retentionDays = retentionDays;
            return this;
        }

        public Builder piiRedaction(boolean piiRedaction) {
            this.piiRedaction = piiRedaction;
            return this;
        }

        public Builder logQueries(boolean logQueries) {
            this.logQueries = logQueries;
            return this;
        }

        public Builder logResponses(boolean logResponses) {
            this.logResponses = logResponses;
            return this;
        }

        public Builder logErrors(boolean logErrors) {
            this.logErrors = logErrors;
            return this;
        }

        public Builder async(boolean async) {
            this.async = async;
            return this;
        }

        public AuditConfig build() {
            return new AuditConfig(enabled, directory, format, rotation, maxSizeMb, retentionDays,
                    piiRedaction, logQueries, logResponses, logErrors, async);
        }
    }
}
