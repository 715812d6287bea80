package com.cypher.guard.plan.analysis;

import com.cypher.guard.complexity.RiskLevel;
import com.cypher.guard.error.EngineException;
import com.cypher.guard.error.ErrorKind;
import com.cypher.guard.error.WriteBlockedException;
import com.cypher.guard.graph.GraphDriver;
import com.cypher.guard.graph.PlanNode;
import com.cypher.guard.graph.QueryHandle;
import com.cypher.guard.graph.QuerySummary;
import com.cypher.guard.plan.AnalysisMode;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Duration;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
@DisplayName("QueryPlanAnalyzer Tests")
class QueryPlanAnalyzerTest {

    private static final Duration TIMEOUT = Duration.ofSeconds(30);

    @Mock
    private GraphDriver driver;

    @Mock
    private QueryHandle handle;

    private QueryPlanAnalyzer analyzer;

    @BeforeEach
    void setUp() {
        analyzer = new QueryPlanAnalyzer(driver, TIMEOUT, 10);
    }

    private static PlanNode allNodesPlan() {
        PlanNode scan = PlanNode.explained("AllNodesScan@neo4j", Map.of("Details", "n", "EstimatedRows", 1.0),
                List.of("n"), List.of());
        return PlanNode.explained("ProduceResults@neo4j", Map.of("Details", "n", "EstimatedRows", 1.0),
                List.of("n"), List.of(scan));
    }

    @Nested
    @DisplayName("Explain")
    class Explain {

        @Test
        @DisplayName("Should plan without reading any result rows")
        void shouldPlanWithoutMaterializing() {
            when(driver.run(eq("EXPLAIN MATCH (n) RETURN n"), anyMap(), eq(TIMEOUT))).thenReturn(handle);
            when(handle.consume()).thenReturn(new QuerySummary(allNodesPlan(), 0));

            PlanAnalysis analysis = analyzer.analyzeQuery("MATCH (n) RETURN n");

            assertEquals(AnalysisMode.EXPLAIN, analysis.mode());
            assertEquals("MATCH (n) RETURN n", analysis.query());
            assertEquals(2, analysis.plan().steps().size());
            assertFalse(analysis.plan().hasRuntimeStatistics());
            assertEquals(0, analysis.plan().totals().rows());
            assertEquals(BottleneckType.MISSING_INDEX, analysis.bottlenecks().get(0).type());
            assertEquals(1, analysis.recommendations().size());
            verify(handle).consume();
            verify(handle, never()).materialize();
            verify(handle).close();
        }

        @Test
        @DisplayName("Should forward the parameter map unchanged")
        void shouldForwardParameters() {
            Map<String, Object> params = Map.of("name", "Alice");
            when(driver.run(anyString(), same(params), eq(TIMEOUT))).thenReturn(handle);
            when(handle.consume()).thenReturn(QuerySummary.withoutPlan());

            analyzer.analyzeQuery("MATCH (p:Person {name: $name}) RETURN p", params, AnalysisMode.EXPLAIN, false);

            verify(driver).run("EXPLAIN MATCH (p:Person {name: $name}) RETURN p", params, TIMEOUT);
        }

        @Test
        @DisplayName("Should strip an existing analysis prefix")
        void shouldStripPrefix() {
            when(driver.run(anyString(), anyMap(), any())).thenReturn(handle);
            when(handle.consume()).thenReturn(QuerySummary.withoutPlan());

            PlanAnalysis analysis = analyzer.analyzeQuery("explain PROFILE MATCH (n) RETURN n", null,
                    AnalysisMode.EXPLAIN, false);

            assertEquals("MATCH (n) RETURN n", analysis.query());
            verify(driver).run("EXPLAIN MATCH (n) RETURN n", Map.of(), TIMEOUT);
        }

        @Test
        @DisplayName("Should return an empty analysis when no plan comes back")
        void shouldHandleMissingPlan() {
            when(driver.run(anyString(), anyMap(), any())).thenReturn(handle);
            when(handle.consume()).thenReturn(QuerySummary.withoutPlan());

            PlanAnalysis analysis = analyzer.analyzeQuery("MATCH (n) RETURN n");

            assertTrue(analysis.plan().steps().isEmpty());
            assertTrue(analysis.bottlenecks().isEmpty());
            assertEquals(0, analysis.cost().costScore());
            assertEquals(RiskLevel.SAFE, analysis.cost().riskLevel());
            assertEquals("0 operators, 0 bottlenecks (0 critical), 0 recommendations, cost score 0 (SAFE)",
                    analysis.summary());
        }
    }

    @Nested
    @DisplayName("Profile")
    class Profile {

        @Test
        @DisplayName("Should refuse to profile a write without permission")
        void shouldRefuseWriteProfile() {
            WriteBlockedException e = assertThrows(WriteBlockedException.class, () ->
                    analyzer.analyzeQuery("CREATE (n:Person {name: 'x'})", null, AnalysisMode.PROFILE, false));

            assertEquals("CREATE", e.operation());
            assertEquals(ErrorKind.WRITE_BLOCKED, e.kind());
            verifyNoInteractions(driver);
        }

        @Test
        @DisplayName("Should profile a write when permitted")
        void shouldProfileWriteWhenAllowed() {
            PlanNode create = new PlanNode("Create@neo4j", Map.of(), List.of("n"), List.of(), true, 2, 1, 1);
            when(driver.run(eq("PROFILE CREATE (n:Person)"), anyMap(), eq(TIMEOUT))).thenReturn(handle);
            when(handle.consume()).thenReturn(new QuerySummary(create, 1));

            PlanAnalysis analysis = analyzer.analyzeQuery("CREATE (n:Person)", null, AnalysisMode.PROFILE, true);

            assertTrue(analysis.plan().hasRuntimeStatistics());
            assertEquals(2, analysis.plan().totals().dbHits());
        }

        @Test
        @DisplayName("Should allow profiling a read query")
        void shouldProfileRead() {
            when(driver.run(eq("PROFILE MATCH (n) RETURN n"), anyMap(), eq(TIMEOUT))).thenReturn(handle);
            when(handle.consume()).thenReturn(QuerySummary.withoutPlan());

            PlanAnalysis analysis = analyzer.analyzeQuery("MATCH (n) RETURN n", null, AnalysisMode.PROFILE, false);

            assertEquals(AnalysisMode.PROFILE, analysis.mode());
        }
    }

    @Nested
    @DisplayName("Failures")
    class Failures {

        @Test
        @DisplayName("Should wrap database failures as engine errors")
        void shouldWrapDriverFailure() {
            when(driver.run(anyString(), anyMap(), any())).thenThrow(new IllegalStateException("connection lost"));

            EngineException e = assertThrows(EngineException.class, () -> analyzer.analyzeQuery("MATCH (n) RETURN n"));

            assertEquals("Query analysis failed: connection lost", e.getMessage());
            assertEquals(ErrorKind.ENGINE, e.kind());
        }

        @Test
        @DisplayName("Should pass engine errors through unchanged")
        void shouldPassEngineErrorsThrough() {
            EngineException timeout = EngineException.timeout(30, null);
            when(driver.run(anyString(), anyMap(), any())).thenReturn(handle);
            when(handle.consume()).thenThrow(timeout);

            EngineException e = assertThrows(EngineException.class, () -> analyzer.analyzeQuery("MATCH (n) RETURN n"));

            assertSame(timeout, e);
            assertTrue(e.isTimeout());
            verify(handle).close();
        }
    }

    @Test
    @DisplayName("Should strip repeated analysis keywords")
    void shouldStripRepeatedKeywords() {
        assertEquals("MATCH (n) RETURN n", QueryPlanAnalyzer.stripAnalysisPrefix("  EXPLAIN  explain MATCH (n) RETURN n"));
        assertEquals("MATCH (explainer) RETURN explainer",
                QueryPlanAnalyzer.stripAnalysisPrefix("MATCH (explainer) RETURN explainer"));
    }
}
