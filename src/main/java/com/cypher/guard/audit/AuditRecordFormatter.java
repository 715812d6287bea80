package com.cypher.guard.audit;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Renders audit entries as JSON lines or text blocks.
 *
 * <p>Every rendered record is self-contained: line breaks inside values are escaped so a JSON
 * record is always one line and a text record never contains an empty line.</p>
 */
public class AuditRecordFormatter {

    static final int TEXT_QUERY_LIMIT = 200;

    private final ObjectMapper objectMapper;

    public AuditRecordFormatter() {
        this(new ObjectMapper().disable(SerializationFeature.FAIL_ON_EMPTY_BEANS));
    }

    public AuditRecordFormatter(ObjectMapper objectMapper) {
        this.objectMapper = Objects.requireNonNull(objectMapper, "objectMapper is required");
    }

    public String format(AuditEntry entry, AuditFormat format) throws JsonProcessingException {
        return format == AuditFormat.TEXT ? toText(entry) : toJson(entry);
    }

    public String toJson(AuditEntry entry) throws JsonProcessingException {
        return objectMapper.writeValueAsString(toMap(entry));
    }

    public String toText(AuditEntry entry) throws JsonProcessingException {
        StringBuilder sb = new StringBuilder();
        sb.append('[').append(entry.timestamp()).append("] ")
                .append(entry.eventType()).append(" - Operation: ").append(entry.operation()).append('\n');
        sb.append("  Id: ").append(entry.id()).append('\n');
        if (entry.sessionId() != null) {
            sb.append("  Session: ").append(oneLine(entry.sessionId())).append('\n');
        }
        sb.append("  Outcome: ").append(entry.outcome()).append(" (").append(entry.severity()).append(")\n");
        if (entry.query() != null) {
            sb.append("  Query: ").append(oneLine(truncate(entry.query()))).append('\n');
        }
        if (!entry.parameters().isEmpty()) {
            sb.append("  Parameters: ").append(objectMapper.writeValueAsString(entry.parameters())).append('\n');
        }
        if (entry.error() != null) {
            sb.append("  Error: ").append(oneLine(entry.error())).append('\n');
        }
        if (!entry.details().isEmpty()) {
            sb.append("  Details: ").append(objectMapper.writeValueAsString(entry.details())).append('\n');
        }
        if (entry.redacted()) {
            sb.append("  Redacted: true\n");
        }
        return sb.toString();
    }

    Map<String, Object> toMap(AuditEntry entry) {
        Map<String, Object> map = new LinkedHashMap<>();
        map.put("id", entry.id());
        map.put("timestamp", entry.timestamp().toString());
        map.put("event_type", entry.eventType().name());
        map.put("severity", entry.severity().name());
        map.put("operation", entry.operation());
        map.put("session_id", entry.sessionId());
        map.put("outcome", entry.outcome().name());
        map.put("query", entry.query());
        map.put("parameters", entry.parameters());
        map.put("error", entry.error());
        map.put("details", entry.details());
        map.put("redacted", entry.redacted());
        return map;
    }

    private static String truncate(String query) {
        return query.length() > TEXT_QUERY_LIMIT ? query.substring(0, TEXT_QUERY_LIMIT) + "..." : query;
    }

    private static String oneLine(String value) {
        return value.replace("\r", "\\r").replace("\n", "\\n");
    }
}
