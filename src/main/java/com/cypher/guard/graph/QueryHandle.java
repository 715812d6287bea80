package com.cypher.guard.graph;

import java.util.List;
import java.util.Map;

/**
 * An open query result. Exactly one of {@link #consume()} or {@link #materialize()} should be called.
 */
public interface QueryHandle extends AutoCloseable {

    /**
     * Discards remaining records and returns the summary, including any plan.
     */
    QuerySummary consume();

    /**
     * Reads every record into memory.
     */
    List<Map<String, Object>> materialize();

    @Override
    void close();
}
