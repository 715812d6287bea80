package com.cypher.guard.service;

import java.util.Map;
import java.util.Objects;

/**
 * A request to one of the guarded operations.
 *
 * @param operationName the operation, one of the {@code QueryGuardService} operation names
 * @param query         a Cypher query, or a natural-language question for {@code query_graph}
 * @param parameters    query parameters, may be {@code null}
 * @param sessionId     caller session, recorded in the audit trail, may be {@code null}
 * @param clientId      rate-limit identity, may be {@code null} for anonymous callers
 */
public record GuardRequest(
        String operationName,
        String query,
        Map<String, Object> parameters,
        String sessionId,
        String clientId
) {
    public GuardRequest {
        Objects.requireNonNull(operationName, "operationName is required");
    }

    public static GuardRequest of(String operationName, String query) {
        return new GuardRequest(operationName, query, null, null, null);
    }

    public GuardRequest withParameters(Map<String, Object> parameters) {
        return new GuardRequest(operationName, query, parameters, sessionId, clientId);
    }

    public GuardRequest withClient(String clientId, String sessionId) {
        return new GuardRequest(operationName, query, parameters, sessionId, clientId);
    }
}
