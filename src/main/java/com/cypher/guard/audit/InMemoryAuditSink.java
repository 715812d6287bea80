package com.cypher.guard.audit;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.stream.Collectors;

/**
 * In-memory audit sink.
 * Thread-safe via CopyOnWriteArrayList.
 */
public class InMemoryAuditSink implements AuditSink {

    private final List<AuditEntry> entries = new CopyOnWriteArrayList<>();

    @Override
    public void append(AuditEntry entry) {
        entries.add(entry);
    }

    public List<AuditEntry> findAll() {
        return Collections.unmodifiableList(new ArrayList<>(entries));
    }

    public List<AuditEntry> findByOutcome(AuditOutcome outcome) {
        return entries.stream()
                .filter(e -> e.outcome() == outcome)
                .collect(Collectors.toList());
    }

    public List<AuditEntry> findBySession(String sessionId) {
        return entries.stream()
                .filter(e -> sessionId.equals(e.sessionId()))
                .collect(Collectors.toList());
    }

    public int count() {
        return entries.size();
    }

    public void clear() {
        entries.clear();
    }
}
