package com.cypher.guard.graph;

import com.cypher.guard.error.EngineException;
import org.neo4j.driver.AuthTokens;
import org.neo4j.driver.Driver;
import org.neo4j.driver.GraphDatabase;
import org.neo4j.driver.Record;
import org.neo4j.driver.Result;
import org.neo4j.driver.Session;
import org.neo4j.driver.SessionConfig;
import org.neo4j.driver.TransactionConfig;
import org.neo4j.driver.Value;
import org.neo4j.driver.exceptions.Neo4jException;
import org.neo4j.driver.summary.Plan;
import org.neo4j.driver.summary.ProfiledPlan;
import org.neo4j.driver.summary.ResultSummary;
import org.neo4j.driver.types.IsoDuration;
import org.neo4j.driver.types.Node;
import org.neo4j.driver.types.Path;
import org.neo4j.driver.types.Point;
import org.neo4j.driver.types.Relationship;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.temporal.TemporalAccessor;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.TimeUnit;

/**
 * {@link GraphDriver} backed by the Neo4j Java driver. One session per query.
 */
public class Neo4jGraphDriver implements GraphDriver {
    private static final Logger log = LoggerFactory.getLogger(Neo4jGraphDriver.class);

    private final Driver driver;
    private final String database;

    public Neo4jGraphDriver(Driver driver, String database) {
        this.driver = Objects.requireNonNull(driver, "driver is required");
        this.database = database;
    }

    public static Neo4jGraphDriver connect(String uri, String username, String password, String database) {
        Driver driver = GraphDatabase.driver(uri, AuthTokens.basic(username, password));
        log.info("Neo4jGraphDriver connected: uri={}, database={}", uri, database != null ? database : "default");
        return new Neo4jGraphDriver(driver, database);
    }

    @Override
    public QueryHandle run(String query, Map<String, Object> parameters, Duration timeout) {
        SessionConfig sessionConfig = database != null
                ? SessionConfig.forDatabase(database) : SessionConfig.defaultConfig();
        Session session = driver.session(sessionConfig);
        try {
            TransactionConfig txConfig = timeout != null
                    ? TransactionConfig.builder().withTimeout(timeout).build() : TransactionConfig.empty();
            Result result = session.run(query, parameters, txConfig);
            return new Neo4jQueryHandle(session, result);
        } catch (Neo4jException e) {
            session.close();
            throw translate(e);
        } catch (RuntimeException e) {
            session.close();
            throw new EngineException("Query execution failed: " + e.getMessage(), e);
        }
    }

    @Override
    public void close() {
        driver.close();
    }

    static EngineException translate(Neo4jException e) {
        String code = e.code();
        boolean timeout = code != null && (code.contains("TransactionTimedOut") || code.contains("Timeout"));
        return new EngineException(timeout ? "Query execution timeout: " + e.getMessage() : e.getMessage(),
                code, timeout, e);
    }

    static PlanNode toPlanNode(Plan plan) {
        List<PlanNode> children = new ArrayList<>();
        for (Plan child : plan.children()) {
            children.add(toPlanNode(child));
        }
        Map<String, Object> arguments = new LinkedHashMap<>();
        for (Map.Entry<String, Value> argument : plan.arguments().entrySet()) {
            arguments.put(argument.getKey(), argument.getValue().asObject());
        }
        if (plan instanceof ProfiledPlan profiled) {
            // the engine reports operator time in nanoseconds
            return new PlanNode(plan.operatorType(), arguments, plan.identifiers(), children, true,
                    profiled.dbHits(), profiled.records(), TimeUnit.NANOSECONDS.toMillis(profiled.time()));
        }
        return PlanNode.explained(plan.operatorType(), arguments, plan.identifiers(), children);
    }

    static Map<String, Object> toPlainRow(Map<String, Object> row) {
        Map<String, Object> plain = new LinkedHashMap<>();
        for (Map.Entry<String, Object> column : row.entrySet()) {
            plain.put(column.getKey(), toPlainValue(column.getValue()));
        }
        return plain;
    }

    /**
     * Converts driver entities into maps and lists so rows serialize with their content.
     * A node becomes {@code {elementId, labels, properties}}, a relationship
     * {@code {elementId, type, startNodeElementId, endNodeElementId, properties}} and a path
     * {@code {nodes, relationships}}. Temporal, duration and point values become their string form.
     */
    static Object toPlainValue(Object value) {
        if (value instanceof Node node) {
            Map<String, Object> plain = new LinkedHashMap<>();
            plain.put("elementId", node.elementId());
            List<String> labels = new ArrayList<>();
            node.labels().forEach(labels::add);
            plain.put("labels", labels);
            plain.put("properties", toPlainValue(node.asMap()));
            return plain;
        }
        if (value instanceof Relationship relationship) {
            Map<String, Object> plain = new LinkedHashMap<>();
            plain.put("elementId", relationship.elementId());
            plain.put("type", relationship.type());
            plain.put("startNodeElementId", relationship.startNodeElementId());
            plain.put("endNodeElementId", relationship.endNodeElementId());
            plain.put("properties", toPlainValue(relationship.asMap()));
            return plain;
        }
        if (value instanceof Path path) {
            List<Object> nodes = new ArrayList<>();
            path.nodes().forEach(node -> nodes.add(toPlainValue(node)));
            List<Object> relationships = new ArrayList<>();
            path.relationships().forEach(relationship -> relationships.add(toPlainValue(relationship)));
            Map<String, Object> plain = new LinkedHashMap<>();
            plain.put("nodes", nodes);
            plain.put("relationships", relationships);
            return plain;
        }
        if (value instanceof Map<?, ?> map) {
            Map<String, Object> plain = new LinkedHashMap<>();
            map.forEach((key, nested) -> plain.put(String.valueOf(key), toPlainValue(nested)));
            return plain;
        }
        if (value instanceof List<?> list) {
            List<Object> plain = new ArrayList<>(list.size());
            for (Object nested : list) {
                plain.add(toPlainValue(nested));
            }
            return plain;
        }
        if (value instanceof TemporalAccessor || value instanceof IsoDuration || value instanceof Point) {
            return value.toString();
        }
        return value;
    }

    private static final class Neo4jQueryHandle implements QueryHandle {
        private final Session session;
        private final Result result;

        private Neo4jQueryHandle(Session session, Result result) {
            this.session = session;
            this.result = result;
        }

        @Override
        public QuerySummary consume() {
            try {
                ResultSummary summary = result.consume();
                PlanNode plan = null;
                if (summary.hasProfile()) {
                    plan = toPlanNode(summary.profile());
                } else if (summary.hasPlan()) {
                    plan = toPlanNode(summary.plan());
                }
                return new QuerySummary(plan, summary.resultAvailableAfter(TimeUnit.MILLISECONDS));
            } catch (Neo4jException e) {
                throw translate(e);
            }
        }

        @Override
        public List<Map<String, Object>> materialize() {
            try {
                List<Map<String, Object>> rows = new ArrayList<>();
                for (Record record : result.list()) {
                    rows.add(toPlainRow(record.asMap()));
                }
                return rows;
            } catch (Neo4jException e) {
                throw translate(e);
            }
        }

        @Override
        public void close() {
            session.close();
        }
    }
}
