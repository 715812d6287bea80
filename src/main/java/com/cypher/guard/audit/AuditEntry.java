package com.cypher.guard.audit;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.UUID;

/**
 * Immutable, self-contained record of an audited request.
 *
 * <p>Query, parameters, error and details are stored as given; {@link AuditLogger} redacts
 * them before building the entry and marks it {@code redacted}.</p>
 */
public record AuditEntry(
        String id,
        Instant timestamp,
        AuditEventType eventType,
        String sessionId,
        String operation,
        String query,
        Map<String, Object> parameters,
        AuditOutcome outcome,
        String error,
        AuditSeverity severity,
        Map<String, Object> details,
        boolean redacted
) {
    public AuditEntry {
        Objects.requireNonNull(id, "id is required");
        Objects.requireNonNull(timestamp, "timestamp is required");
        Objects.requireNonNull(eventType, "eventType is required");
        Objects.requireNonNull(operation, "operation is required");
        Objects.requireNonNull(outcome, "outcome is required");
        severity = severity != null ? severity : outcome.defaultSeverity();
        // parameter values may legitimately be null, so Map.copyOf is not an option
        parameters = parameters != null ? copyMap(parameters) : Map.of();
        details = details != null ? copyMap(details) : Map.of();
    }

    /**
     * Copies nested maps, collections and arrays so a queued entry shares no mutable state with the caller.
     */
    private static Map<String, Object> copyMap(Map<?, ?> map) {
        Map<String, Object> copy = new LinkedHashMap<>();
        map.forEach((k, v) -> copy.put(String.valueOf(k), copyValue(v)));
        return Collections.unmodifiableMap(copy);
    }

    private static Object copyValue(Object value) {
        if (value instanceof Map<?, ?> map) {
            return copyMap(map);
        }
        if (value instanceof Collection<?> collection) {
            List<Object> copy = new ArrayList<>(collection.size());
            for (Object item : collection) {
                copy.add(copyValue(item));
            }
            return Collections.unmodifiableList(copy);
        }
        if (value instanceof Object[] array) {
            List<Object> copy = new ArrayList<>(array.length);
            for (Object item : array) {
                copy.add(copyValue(item));
            }
            return Collections.unmodifiableList(copy);
        }
        return value;
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private String id = UUID.randomUUID().toString();
        private Instant timestamp = Instant.now();
        private AuditEventType eventType = AuditEventType.QUERY;
        private String sessionId;
        private String operation;
        private String query;
        private Map<String, Object> parameters;
        private AuditOutcome outcome = AuditOutcome.SUCCESS;
        private String error;
        private AuditSeverity severity;
        private Map<String, Object> details;
        private boolean redacted;

        public Builder id(String id) {
            this.id = id;
            return this;
        }

        public Builder timestamp(Instant timestamp) {
            this.timestamp = timestamp;
            return this;
        }

        public Builder eventType(AuditEventType eventType) {
            this.eventType = eventType;
            return this;
        }

        public Builder sessionId(String sessionId) {
            this.sessionId = sessionId;
            return this;
        }

        public Builder operation(String operation) {
            this.operation = operation;
            return this;
        }

        public Builder query(String query) {
            this.query = query;
            return this;
        }

        public Builder parameters(Map<String, Object> parameters) {
            this.parameters = parameters;
            return this;
        }

        public Builder outcome(AuditOutcome outcome) {
            this.outcome = outcome;
            return this;
        }

        public Builder error(String error) {
            this.error = error;
            return this;
        }

        public Builder severity(AuditSeverity severity) {
            this.severity = severity;
            return this;
        }

        public Builder details(Map<String, Object> details) {
            this.details = details;
            return this;
        }

        public Builder redacted(boolean redacted) {
            this.redacted = redacted;
            return this;
        }

        public AuditEntry build() {
            return new AuditEntry(id, timestamp, eventType, sessionId, operation, query, parameters,
                    outcome, error, severity, details, redacted);
        }
    }
}
