package com.report.validation.workflow;

import com.report.validation.core.model.Issue;
import com.report.validation.core.model.IssueCategory;
import com.report.validation.core.model.Report;
import com.report.validation.core.model.ValidationResult;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Derives per-node trends from a report's iteration history.
 */
public class NodeTrendAnalyzer {

    static final int DIRECTION_TOLERANCE = 2;
    static final int MAX_COMMON_CATEGORIES = 3;

    public Map<String, NodeTrend> analyze(Report report) {
        Map<String, List<Integer>> confidences = new LinkedHashMap<>();
        Map<String, Map<IssueCategory, Integer>> categories = new LinkedHashMap<>();
        for (Map<String, ValidationResult> iteration : report.getHistory().values()) {
            iteration.forEach((nodeId, result) -> {
                confidences.computeIfAbsent(nodeId, k -> new ArrayList<>()).add(result.confidence());
                Map<IssueCategory, Integer> counts =
                        categories.computeIfAbsent(nodeId, k -> new EnumMap<>(IssueCategory.class));
                for (Issue issue : result.issues()) {
                    counts.merge(issue.category(), 1, Integer::sum);
                }
            });
        }

        Map<String, NodeTrend> trends = new LinkedHashMap<>();
        confidences.forEach((nodeId, values) ->
                trends.put(nodeId, trend(nodeId, values, categories.getOrDefault(nodeId, Map.of()))));
        return trends;
    }

    static NodeTrend trend(String nodeId, List<Integer> values, Map<IssueCategory, Integer> categoryCounts) {
        int first = values.get(0);
        int last = values.get(values.size() - 1);
        int change = last - first;
        NodeTrend.Direction direction = change > DIRECTION_TOLERANCE ? NodeTrend.Direction.IMPROVING
                : change < -DIRECTION_TOLERANCE ? NodeTrend.Direction.DECLINING
                : NodeTrend.Direction.STABLE;
        double velocity = values.size() > 1 ? (double) change / (values.size() - 1) : 0.0;

        double mean = values.stream().mapToInt(Integer::intValue).average().orElse(0.0);
        double variance = values.stream().mapToDouble(v -> (v - mean) * (v - mean)).average().orElse(0.0);
        double stability = Math.max(0.0, 1.0 - variance / 100.0);

        List<IssueCategory> common = categoryCounts.entrySet().stream()
                .sorted(Map.Entry.<IssueCategory, Integer>comparingByValue(Comparator.reverseOrder())
                        .thenComparing(Map.Entry.comparingByKey()))
                .limit(MAX_COMMON_CATEGORIES)
                .map(Map.Entry::getKey)
                .toList();
        return new NodeTrend(nodeId, values, direction, velocity, stability, common);
    }
}
