package com.cypher.guard.plan.analysis;

import com.cypher.guard.graph.PlanNode;
import com.cypher.guard.plan.AnalysisMode;
import com.cypher.guard.plan.ExecutionPlan;
import com.cypher.guard.plan.PlanParser;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("BottleneckDetector Tests")
class BottleneckDetectorTest {

    private BottleneckDetector detector;

    @BeforeEach
    void setUp() {
        detector = new BottleneckDetector(10);
    }

    private static PlanNode node(String operator, String details, PlanNode... children) {
        return PlanNode.explained(operator, details != null ? Map.of("Details", details) : Map.of(),
                List.of(), List.of(children));
    }

    private static ExecutionPlan plan(PlanNode root) {
        return PlanParser.parse(AnalysisMode.EXPLAIN, root);
    }

    @Nested
    @DisplayName("Missing indexes")
    class MissingIndexes {

        @Test
        @DisplayName("Should suggest an index on the filtered property of a label scan")
        void shouldSuggestIndexForLabelScan() {
            ExecutionPlan plan = plan(node("ProduceResults", "n",
                    node("Filter", "n.name = $name", node("NodeByLabelScan", "n:Person"))));

            List<Bottleneck> found = detector.detect(plan, "MATCH (n:Person) WHERE n.name = $name RETURN n");

            assertEquals(1, found.size());
            Bottleneck bottleneck = found.get(0);
            assertEquals(BottleneckType.MISSING_INDEX, bottleneck.type());
            assertEquals(BottleneckSeverity.HIGH, bottleneck.severity());
            assertEquals("NodeByLabelScan", bottleneck.operator());
            assertEquals(2, bottleneck.depth());
            assertEquals("CREATE INDEX FOR (n:Person) ON (n.name)", bottleneck.remediation());
            assertEquals("Label scan reads every :Person node to filter on name", bottleneck.description());
        }

        @Test
        @DisplayName("Should use a placeholder property when the query filters on nothing")
        void shouldUsePlaceholderProperty() {
            List<Bottleneck> found = detector.detect(plan(node("NodeByLabelScan", "n:Person")),
                    "MATCH (n:Person) RETURN n");

            assertEquals("CREATE INDEX FOR (n:Person) ON (n.property)", found.get(0).remediation());
            assertEquals("Label scan reads every :Person node", found.get(0).description());
        }

        @Test
        @DisplayName("Should suggest a relationship index for a relationship type scan")
        void shouldSuggestRelationshipIndex() {
            List<Bottleneck> found = detector.detect(
                    plan(node("DirectedRelationshipTypeScan", "(a)-[r:KNOWS]->(b)")),
                    "MATCH (a)-[r:KNOWS]->(b) WHERE r.since > 2020 RETURN a");

            assertEquals("CREATE INDEX FOR ()-[r:KNOWS]-() ON (r.since)", found.get(0).remediation());
        }

        @Test
        @DisplayName("Should report an all nodes scan")
        void shouldReportAllNodesScan() {
            List<Bottleneck> found = detector.detect(plan(node("AllNodesScan", "n")), "MATCH (n) RETURN n");

            assertEquals(BottleneckType.MISSING_INDEX, found.get(0).type());
            assertEquals("AllNodesScan reads the whole graph (n)", found.get(0).description());
        }

        @Test
        @DisplayName("Should not report index seeks")
        void shouldIgnoreIndexSeeks() {
            List<Bottleneck> found = detector.detect(plan(node("NodeIndexSeek", "RANGE INDEX n:Person(name)")),
                    "MATCH (n:Person {name: 'A'}) RETURN n");

            assertTrue(found.isEmpty());
        }
    }

    @Nested
    @DisplayName("Filtered properties")
    class FilteredProperties {

        @Test
        @DisplayName("Should find an inline map property")
        void shouldFindInlineProperty() {
            assertEquals(Optional.of("email"),
                    BottleneckDetector.filteredProperty("MATCH (u:User {email: $e}) RETURN u", "u"));
        }

        @Test
        @DisplayName("Should find a dotted property")
        void shouldFindDottedProperty() {
            assertEquals(Optional.of("age"),
                    BottleneckDetector.filteredProperty("MATCH (p) WHERE p.age > 30 RETURN p", "p"));
        }

        @Test
        @DisplayName("Should not match a longer variable name")
        void shouldNotMatchLongerVariable() {
            assertEquals(Optional.empty(),
                    BottleneckDetector.filteredProperty("MATCH (np) WHERE np.age > 30 RETURN np", "p"));
        }
    }

    @Nested
    @DisplayName("Structural bottlenecks")
    class StructuralBottlenecks {

        @Test
        @DisplayName("Should report a cartesian product as critical and sort it first")
        void shouldReportCartesianProductFirst() {
            ExecutionPlan plan = plan(node("ProduceResults", "a, b",
                    node("CartesianProduct", null,
                            node("NodeByLabelScan", "a:A"),
                            node("NodeByLabelScan", "b:B"))));

            List<Bottleneck> found = detector.detect(plan, "MATCH (a:A), (b:B) RETURN a, b");

            assertEquals(3, found.size());
            assertEquals(BottleneckType.CARTESIAN_PRODUCT, found.get(0).type());
            assertEquals(BottleneckSeverity.CRITICAL, found.get(0).severity());
            assertEquals("CREATE INDEX FOR (a:A) ON (a.property)", found.get(1).remediation());
            assertEquals("CREATE INDEX FOR (b:B) ON (b.property)", found.get(2).remediation());
        }

        @Test
        @DisplayName("Should report an eager operator as medium")
        void shouldReportEager() {
            List<Bottleneck> found = detector.detect(plan(node("Eager", null)), "MATCH (n) SET n.x = 1");

            assertEquals(BottleneckType.EAGER_OPERATION, found.get(0).type());
            assertEquals(BottleneckSeverity.MEDIUM, found.get(0).severity());
        }

        @ParameterizedTest(name = "{0} {1} -> {2}")
        @CsvSource(delimiter = '|', value = {
                "VarLengthExpand(All) | (a)-[r*]->(b)     | HIGH",
                "VarLengthExpand(All) | (a)-[r*2..]->(b)  | HIGH",
                "VarLengthExpand(All) | (a)-[r*1..20]->(b) | HIGH",
                "VarLengthExpand(All) | (a)-[r*1..5]->(b) | MEDIUM",
                "VarLengthExpand(All) | (a)-[r*3]->(b)    | MEDIUM",
                "Repeat(Trail)        | (a) ((x)-[]->(y)){1, } (b) | HIGH",
                "Repeat(Trail)        | (a) ((x)-[]->(y)){1, 4} (b) | MEDIUM"
        })
        @DisplayName("Should grade variable-length expansion by its upper bound")
        void shouldGradeVariableLength(String operator, String details, BottleneckSeverity expected) {
            List<Bottleneck> found = detector.detect(plan(node(operator, details)), null);

            assertEquals(1, found.size());
            assertEquals(BottleneckType.VARIABLE_LENGTH_EXPANSION, found.get(0).type());
            assertEquals(expected, found.get(0).severity());
        }

        @Test
        @DisplayName("Should name the bound that was exceeded")
        void shouldNameExceededBound() {
            List<Bottleneck> found = detector.detect(plan(node("VarLengthExpand(All)", "(a)-[*1..25]->(b)")), null);

            assertEquals("Variable-length expansion of up to 25 hops exceeds the bound of 10",
                    found.get(0).description());
        }

        @Test
        @DisplayName("Should reject a non-positive hop bound")
        void shouldRejectBadBound() {
            assertThrows(IllegalArgumentException.class, () -> new BottleneckDetector(0));
        }
    }
}
