package com.cypher.guard.mcp;

import com.cypher.guard.error.ErrorKind;
import com.cypher.guard.plan.AnalysisMode;
import com.cypher.guard.service.GuardRequest;
import com.cypher.guard.service.GuardResponse;
import com.cypher.guard.service.QueryGuardService;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Builds MCP tool definitions for the guarded query operations.
 *
 * <p>Available tools:</p>
 * <ul>
 *   <li>{@code query_graph} -- answer a natural-language question</li>
 *   <li>{@code execute_cypher} -- run a Cypher query through every guard</li>
 *   <li>{@code analyze_query_performance} -- explain or profile a query and suggest optimizations</li>
 * </ul>
 *
 * <p>Every tool accepts optional {@code session_id} and {@code client_id} inputs, used for the
 * audit trail and for rate limiting.</p>
 */
public final class QueryGuardMcpTools {

    private final QueryGuardService service;

    public QueryGuardMcpTools(QueryGuardService service) {
        this.service = Objects.requireNonNull(service, "service is required");
    }

    public List<McpToolDefinition> getToolDefinitions() {
        return List.of(
                buildQueryGraphTool(),
                buildExecuteCypherTool(),
                buildAnalyzeQueryPerformanceTool()
        );
    }

    public Optional<McpToolDefinition> getTool(String name) {
        return getToolDefinitions().stream()
                .filter(t -> t.name().equals(name))
                .findFirst();
    }

    private McpToolDefinition buildQueryGraphTool() {
        Map<String, Object> schema = Map.of(
                "type", "object",
                "properties", withIdentity(Map.of(
                        "query", Map.of("type", "string", "description", "Question about the graph in plain language")
                )),
                "required", List.of("query")
        );
        return new McpToolDefinition(
                QueryGuardService.QUERY_GRAPH,
                "Answer a question about the graph. The question is translated to Cypher, which is validated, "
                        + "bounded and executed.",
                schema,
                service.config().sanitizer().readOnly(),
                input -> service.queryGraph(request(QueryGuardService.QUERY_GRAPH, input, "query")).toMap()
        );
    }

    private McpToolDefinition buildExecuteCypherTool() {
        Map<String, Object> schema = Map.of(
                "type", "object",
                "properties", withIdentity(Map.of(
                        "cypher_query", Map.of("type", "string", "description", "Cypher query to execute"),
                        "parameters", Map.of("type", "object", "description", "Query parameters")
                )),
                "required", List.of("cypher_query")
        );
        return new McpToolDefinition(
                QueryGuardService.EXECUTE_CYPHER,
                "Execute a Cypher query. Queries are sanitized, scored for complexity and bounded with a LIMIT "
                        + "when they return unbounded rows.",
                schema,
                service.config().sanitizer().readOnly(),
                input -> service.executeCypher(request(QueryGuardService.EXECUTE_CYPHER, input, "cypher_query"))
                        .toMap()
        );
    }

    private McpToolDefinition buildAnalyzeQueryPerformanceTool() {
        Map<String, Object> schema = Map.of(
                "type", "object",
                "properties", withIdentity(Map.of(
                        "query", Map.of("type", "string", "description", "Cypher query to analyze"),
                        "mode", Map.of("type", "string", "enum", List.of("explain", "profile"),
                                "description", "explain plans without running; profile runs the query"),
                        "allow_write_queries", Map.of("type", "boolean",
                                "description", "Permit profiling of queries that modify data"),
                        "format", Map.of("type", "string", "enum", List.of("text", "json"),
                                "description", "Report format")
                )),
                "required", List.of("query")
        );
        return new McpToolDefinition(
                QueryGuardService.ANALYZE_QUERY_PERFORMANCE,
                "Analyze a Cypher query's execution plan, detect bottlenecks and recommend optimizations. "
                        + "No result rows are returned.",
                schema,
                true,
                input -> {
                    AnalysisMode mode;
                    try {
                        mode = AnalysisMode.fromString((String) input.get("mode"));
                    } catch (IllegalArgumentException e) {
                        return GuardResponse.failure(ErrorKind.VALIDATION, e.getMessage(), List.of(), Map.of())
                                .toMap();
                    }
                    boolean allowWrites = Boolean.TRUE.equals(input.get("allow_write_queries"));
                    GuardResponse response = service.analyzeQueryPerformance(
                            request(QueryGuardService.ANALYZE_QUERY_PERFORMANCE, input, "query"), mode, allowWrites);
                    Map<String, Object> result = response.toMap();
                    if (response.success() && response.data() instanceof Map<?, ?> data
                            && "text".equalsIgnoreCase(String.valueOf(input.getOrDefault("format", "json")))) {
                        result.put("data", data.get("report"));
                    }
                    return result;
                }
        );
    }

    @SuppressWarnings("unchecked")
    private static GuardRequest request(String operation, Map<String, Object> input, String queryKey) {
        Object parameters = input.get("parameters");
        return new GuardRequest(
                operation,
                (String) input.get(queryKey),
                parameters instanceof Map<?, ?> map ? (Map<String, Object>) map : null,
                (String) input.get("session_id"),
                (String) input.get("client_id"));
    }

    private static Map<String, Object> withIdentity(Map<String, Object> properties) {
        Map<String, Object> all = new LinkedHashMap<>(properties);
        all.put("session_id", Map.of("type", "string", "description", "Caller session for the audit trail"));
        all.put("client_id", Map.of("type", "string", "description", "Caller identity for rate limiting"));
        return all;
    }
}
