package com.cypher.guard.mcp;

import com.cypher.guard.graph.GraphDriver;
import com.cypher.guard.graph.PlanNode;
import com.cypher.guard.graph.QueryHandle;
import com.cypher.guard.graph.QuerySummary;
import com.cypher.guard.sanitizer.SanitizerConfig;
import com.cypher.guard.service.GuardConfig;
import com.cypher.guard.service.QueryGuardService;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
@DisplayName("QueryGuardMcpTools Tests")
class QueryGuardMcpToolsTest {

    @Mock
    private GraphDriver driver;

    @Mock
    private QueryHandle handle;

    private QueryGuardService service;
    private QueryGuardMcpTools tools;

    @BeforeEach
    void setUp() {
        service = QueryGuardService.builder()
                .driver(driver)
                .translator(question -> "MATCH (p:Person) RETURN p.name AS name LIMIT 5")
                .build();
        tools = new QueryGuardMcpTools(service);
    }

    @AfterEach
    void tearDown() {
        service.close();
    }

    @Nested
    @DisplayName("Definitions")
    class Definitions {

        @Test
        @DisplayName("Should expose the three guarded operations")
        void shouldExposeTools() {
            List<String> names = tools.getToolDefinitions().stream().map(McpToolDefinition::name).toList();

            assertEquals(List.of("query_graph", "execute_cypher", "analyze_query_performance"), names);
            assertTrue(tools.getTool("execute_cypher").isPresent());
            assertTrue(tools.getTool("drop_database").isEmpty());
        }

        @Test
        @DisplayName("Should describe required inputs and identity fields")
        void shouldDescribeInputs() {
            McpToolDefinition execute = tools.getTool("execute_cypher").orElseThrow();

            assertEquals(List.of("cypher_query"), execute.inputSchema().get("required"));
            @SuppressWarnings("unchecked")
            Map<String, Object> properties = (Map<String, Object>) execute.inputSchema().get("properties");
            assertTrue(properties.containsKey("parameters"));
            assertTrue(properties.containsKey("session_id"));
            assertTrue(properties.containsKey("client_id"));
        }

        @Test
        @DisplayName("Should mark analysis as read-only and execution by configuration")
        void shouldHintReadOnly() {
            assertTrue(tools.getTool("analyze_query_performance").orElseThrow().readOnlyHint());
            assertFalse(tools.getTool("execute_cypher").orElseThrow().readOnlyHint());

            QueryGuardService readOnly = QueryGuardService.builder()
                    .driver(driver)
                    .config(GuardConfig.builder()
                            .sanitizer(SanitizerConfig.builder().readOnly(true).build())
                            .build())
                    .build();
            try {
                assertTrue(new QueryGuardMcpTools(readOnly).getTool("execute_cypher").orElseThrow().readOnlyHint());
            } finally {
                readOnly.close();
            }
        }
    }

    @Nested
    @DisplayName("Invocation")
    class Invocation {

        @Test
        @DisplayName("Should run execute_cypher with parameters")
        void shouldExecuteCypher() {
            Map<String, Object> params = Map.of("name", "Alice");
            when(driver.run(eq("MATCH (p:Person {name: $name}) RETURN p LIMIT 1"), same(params), any()))
                    .thenReturn(handle);
            when(handle.materialize()).thenReturn(List.of(Map.of("p", "Alice")));

            Map<String, Object> result = tools.getTool("execute_cypher").orElseThrow().invoke(Map.of(
                    "cypher_query", "MATCH (p:Person {name: $name}) RETURN p LIMIT 1",
                    "parameters", params,
                    "client_id", "agent-1"));

            assertEquals(true, result.get("success"));
            assertEquals(List.of(Map.of("p", "Alice")), result.get("data"));
        }

        @Test
        @DisplayName("Should return refusals as results")
        void shouldReturnRefusals() {
            Map<String, Object> result = tools.getTool("execute_cypher").orElseThrow()
                    .invoke(Map.of("cypher_query", "MATCH (n) RETURN n; MATCH (m) DETACH DELETE m"));

            assertEquals(false, result.get("success"));
            assertEquals("VALIDATION", result.get("error_kind"));
            verifyNoInteractions(driver);
        }

        @Test
        @DisplayName("Should run query_graph through the translator")
        void shouldQueryGraph() {
            when(driver.run(eq("MATCH (p:Person) RETURN p.name AS name LIMIT 5"), anyMap(), any()))
                    .thenReturn(handle);
            when(handle.materialize()).thenReturn(List.of());

            Map<String, Object> result = tools.getTool("query_graph").orElseThrow()
                    .invoke(Map.of("query", "Who is in the graph?"));

            assertEquals(true, result.get("success"));
        }

        @Test
        @DisplayName("Should return the text report when asked")
        void shouldReturnTextReport() {
            PlanNode root = PlanNode.explained("ProduceResults", Map.of(), List.of("n"), List.of());
            when(driver.run(eq("EXPLAIN MATCH (n) RETURN n"), anyMap(), any())).thenReturn(handle);
            when(handle.consume()).thenReturn(new QuerySummary(root, 0));

            Map<String, Object> result = tools.getTool("analyze_query_performance").orElseThrow()
                    .invoke(Map.of("query", "MATCH (n) RETURN n", "mode", "explain", "format", "text"));

            assertEquals(true, result.get("success"));
            assertInstanceOf(String.class, result.get("data"));
            assertTrue(((String) result.get("data")).startsWith("Query Performance Analysis Report"));
        }

        @Test
        @DisplayName("Should reject an unknown analysis mode")
        void shouldRejectUnknownMode() {
            Map<String, Object> result = tools.getTool("analyze_query_performance").orElseThrow()
                    .invoke(Map.of("query", "MATCH (n) RETURN n", "mode", "trace"));

            assertEquals(false, result.get("success"));
            assertEquals("VALIDATION", result.get("error_kind"));
            verifyNoInteractions(driver);
        }
    }
}
