package com.cypher.guard.plan.analysis;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Turns bottlenecks into recommendations: one per distinct fix, most severe first.
 */
public class RecommendationEngine {

    public List<Recommendation> recommend(List<Bottleneck> bottlenecks) {
        Map<String, Recommendation> unique = new LinkedHashMap<>();
        for (Bottleneck bottleneck : bottlenecks) {
            Recommendation recommendation = forBottleneck(bottleneck);
            String key = recommendation.title() + "|" + recommendation.exampleRemediation();
            unique.merge(key, recommendation,
                    (existing, added) -> added.severity().compareTo(existing.severity()) > 0 ? added : existing);
        }
        List<Recommendation> sorted = new ArrayList<>(unique.values());
        sorted.sort(Comparator.comparing(Recommendation::severity).reversed());
        return sorted;
    }

    Recommendation forBottleneck(Bottleneck bottleneck) {
        String category = bottleneck.type().category();
        return switch (bottleneck.type()) {
            case MISSING_INDEX -> new Recommendation(
                    "Create index on frequently queried property", category, bottleneck.severity(),
                    bottleneck.remediation(),
                    "Replaces full scans with index seeks; database hits drop roughly in proportion to selectivity");
            case CARTESIAN_PRODUCT -> new Recommendation(
                    "Connect disconnected MATCH patterns", category, bottleneck.severity(),
                    "Instead of: MATCH (a:A), (b:B) RETURN a, b\nUse: MATCH (a:A)-[:RELATED_TO]->(b:B) RETURN a, b",
                    "Removes multiplicative row growth between patterns");
            case VARIABLE_LENGTH_EXPANSION -> bottleneck.severity() == BottleneckSeverity.HIGH
                    ? new Recommendation("Add reasonable bounds to variable-length pattern", category,
                    bottleneck.severity(),
                    "Instead of: (a)-[*]->(b)\nUse: (a)-[*1..4]->(b) or shortestPath((a)-[*]->(b))",
                    "Limits traversal to a predictable neighbourhood instead of the whole graph")
                    : new Recommendation("Review variable-length pattern bounds", category, bottleneck.severity(),
                    bottleneck.remediation(),
                    "Smaller hop ranges shrink the number of paths explored exponentially");
            case EAGER_OPERATION -> new Recommendation(
                    "Avoid eager materialization", category, bottleneck.severity(),
                    "Use CALL { ... } IN TRANSACTIONS for large updates, or separate reading and writing queries",
                    "Lowers peak memory use");
        };
    }
}
