package com.cypher.guard.graph;

import java.time.Duration;
import java.util.Map;

/**
 * Boundary to the graph database.
 *
 * <p>Implementations throw {@link com.cypher.guard.error.EngineException} for database failures.</p>
 */
public interface GraphDriver extends AutoCloseable {

    /**
     * Starts a query. The parameter map is passed to the database as is.
     *
     * @param timeout transaction timeout enforced by the database
     */
    QueryHandle run(String query, Map<String, Object> parameters, Duration timeout);

    @Override
    default void close() {
    }
}
