package com.cypher.guard.audit;

import java.io.IOException;

/**
 * Destination for audit records.
 * Implementations must be safe to call from multiple threads.
 */
public interface AuditSink extends AutoCloseable {

    void append(AuditEntry entry) throws IOException;

    @Override
    default void close() throws IOException {
    }
}
