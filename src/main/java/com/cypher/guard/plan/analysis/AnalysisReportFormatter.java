package com.cypher.guard.plan.analysis;

import com.cypher.guard.plan.PlanStep;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;

import java.io.UncheckedIOException;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Renders a {@link PlanAnalysis} as a text report or as JSON.
 */
public class AnalysisReportFormatter {

    public enum Format {
        TEXT,
        JSON;

        public static Format fromString(String value) {
            return value == null || value.isBlank() ? TEXT : valueOf(value.trim().toUpperCase(Locale.ROOT));
        }
    }

    private final ObjectMapper objectMapper;

    public AnalysisReportFormatter() {
        this(new ObjectMapper().enable(SerializationFeature.INDENT_OUTPUT));
    }

    public AnalysisReportFormatter(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    public String format(PlanAnalysis analysis, Format format) {
        return format == Format.JSON ? toJson(analysis) : toText(analysis);
    }

    public String toJson(PlanAnalysis analysis) {
        try {
            return objectMapper.writeValueAsString(toMap(analysis));
        } catch (JsonProcessingException e) {
            throw new UncheckedIOException("Could not render analysis as JSON", e);
        }
    }

    public String toText(PlanAnalysis analysis) {
        StringBuilder sb = new StringBuilder();
        sb.append("Query Performance Analysis Report\n");
        sb.append("=================================\n\n");
        sb.append("Query: ").append(analysis.query()).append('\n');
        sb.append("Mode: ").append(analysis.mode()).append('\n');
        sb.append("Cost score: ").append(analysis.cost().costScore()).append("/100 (")
                .append(analysis.cost().riskLevel()).append(")\n");
        sb.append("Summary: ").append(analysis.summary()).append("\n\n");

        List<PlanStep> steps = analysis.plan().steps();
        if (!steps.isEmpty()) {
            sb.append("Execution Plan:\n");
            for (PlanStep step : steps) {
                sb.append("  ".repeat(step.depth() + 1)).append(step.operator());
                if (!step.details().isBlank()) {
                    sb.append(' ').append(step.details());
                }
                if (analysis.plan().hasRuntimeStatistics()) {
                    sb.append(" [rows=").append(step.rows()).append(", dbHits=").append(step.dbHits()).append(']');
                } else {
                    sb.append(String.format(Locale.ROOT, " [estimatedRows=%.1f]", step.estimatedRows()));
                }
                sb.append('\n');
            }
            sb.append('\n');
        }

        if (!analysis.bottlenecks().isEmpty()) {
            sb.append("Performance Bottlenecks:\n");
            int i = 1;
            for (Bottleneck bottleneck : analysis.bottlenecks()) {
                sb.append(i++).append(". ").append(bottleneck.type()).append(" (").append(bottleneck.severity())
                        .append(") at ").append(bottleneck.operator()).append(": ")
                        .append(bottleneck.description()).append('\n');
            }
            sb.append('\n');
        }

        if (!analysis.recommendations().isEmpty()) {
            sb.append("Optimization Recommendations:\n");
            int i = 1;
            for (Recommendation recommendation : analysis.recommendations()) {
                sb.append(i++).append(". ").append(recommendation.title()).append('\n');
                sb.append("   Severity: ").append(recommendation.severity()).append('\n');
                if (!recommendation.exampleRemediation().isBlank()) {
                    sb.append("   Example: ").append(recommendation.exampleRemediation().replace("\n", "\n            "))
                            .append('\n');
                }
                if (!recommendation.expectedImpact().isBlank()) {
                    sb.append("   Impact: ").append(recommendation.expectedImpact()).append('\n');
                }
            }
        }
        return sb.toString().strip();
    }

    public Map<String, Object> toMap(PlanAnalysis analysis) {
        Map<String, Object> map = new LinkedHashMap<>();
        map.put("query", analysis.query());
        map.put("mode", analysis.mode().name());
        map.put("summary", analysis.summary());

        Map<String, Object> cost = new LinkedHashMap<>();
        cost.put("total_cost", analysis.cost().totalCost());
        cost.put("cost_score", analysis.cost().costScore());
        cost.put("risk_level", analysis.cost().riskLevel().name());
        cost.put("estimated_rows", analysis.cost().estimatedRows());
        cost.put("risk_factors", analysis.cost().riskFactors());
        map.put("cost_estimate", cost);

        List<Map<String, Object>> steps = new ArrayList<>();
        for (PlanStep step : analysis.plan().steps()) {
            Map<String, Object> s = new LinkedHashMap<>();
            s.put("operator", step.operator());
            s.put("depth", step.depth());
            s.put("details", step.details());
            s.put("estimated_rows", step.estimatedRows());
            s.put("rows", step.rows());
            s.put("db_hits", step.dbHits());
            s.put("time_ms", step.timeMillis());
            s.put("memory_bytes", step.memoryBytes());
            steps.add(s);
        }
        Map<String, Object> plan = new LinkedHashMap<>();
        plan.put("operators", steps);
        plan.put("total_db_hits", analysis.plan().totals().dbHits());
        plan.put("total_rows", analysis.plan().totals().rows());
        plan.put("total_time_ms", analysis.plan().totals().timeMillis());
        plan.put("max_depth", analysis.plan().totals().maxDepth());
        map.put("execution_plan", plan);

        List<Map<String, Object>> bottlenecks = new ArrayList<>();
        for (Bottleneck b : analysis.bottlenecks()) {
            Map<String, Object> m = new LinkedHashMap<>();
            m.put("type", b.type().name());
            m.put("severity", b.severity().name());
            m.put("operator", b.operator());
            m.put("depth", b.depth());
            m.put("description", b.description());
            m.put("remediation", b.remediation());
            bottlenecks.add(m);
        }
        map.put("bottlenecks", bottlenecks);

        List<Map<String, Object>> recommendations = new ArrayList<>();
        for (Recommendation r : analysis.recommendations()) {
            Map<String, Object> m = new LinkedHashMap<>();
            m.put("title", r.title());
            m.put("category", r.category());
            m.put("severity", r.severity().name());
            m.put("example", r.exampleRemediation());
            m.put("expected_impact", r.expectedImpact());
            recommendations.add(m);
        }
        map.put("recommendations", recommendations);
        return map;
    }
}
