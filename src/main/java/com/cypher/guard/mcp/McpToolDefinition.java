package com.cypher.guard.mcp;

import java.util.Map;
import java.util.Objects;
import java.util.function.Function;

/**
 * Definition of an MCP (Model Context Protocol) tool that can be exposed to LLM agents.
 *
 * @param name         the tool name, e.g. {@code execute_cypher}
 * @param description  what the tool does, shown to the agent
 * @param inputSchema  JSON Schema of the tool's input
 * @param readOnlyHint whether the tool can never modify the database
 * @param handler      executes the tool, receiving the input and returning a result map
 */
public record McpToolDefinition(
        String name,
        String description,
        Map<String, Object> inputSchema,
        boolean readOnlyHint,
        Function<Map<String, Object>, Map<String, Object>> handler
) {
    public McpToolDefinition {
        Objects.requireNonNull(name, "name is required");
        Objects.requireNonNull(description, "description is required");
        Objects.requireNonNull(inputSchema, "inputSchema is required");
        Objects.requireNonNull(handler, "handler is required");
        inputSchema = Map.copyOf(inputSchema);
    }

    public Map<String, Object> invoke(Map<String, Object> input) {
        return handler.apply(input != null ? input : Map.of());
    }
}
