package com.report.validation.core.model;

import java.util.Collection;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Validation outcome of one node in one iteration.
 * Superseded, never mutated, when the node is re-scored.
 */
public record ValidationResult(
        String nodeId,
        String contentHash,
        int confidence,
        Map<IssueCategory, MetricScore> metricScores,
        List<Issue> issues,
        List<Suggestion> suggestions,
        ValidationMetadata metadata
) {
    public ValidationResult {
        Objects.requireNonNull(nodeId, "nodeId is required");
        Objects.requireNonNull(contentHash, "contentHash is required");
        Objects.requireNonNull(metadata, "metadata is required");
        if (confidence < 0 || confidence > 100) {
            throw new IllegalArgumentException("confidence must be between 0 and 100, got " + confidence);
        }
        metricScores = metricScores == null || metricScores.isEmpty()
                ? Map.of()
                : Collections.unmodifiableMap(new EnumMap<>(metricScores));
        issues = issues != null ? List.copyOf(issues) : List.of();
        suggestions = suggestions != null ? List.copyOf(suggestions) : List.of();
    }

    /**
     * Confidence aggregation: {@code round(sum(score * weight))}, weights summing to 1.
     */
    public static int aggregate(Collection<MetricScore> scores) {
        double total = 0.0;
        for (MetricScore score : scores) {
            total += score.weightedScore();
        }
        return (int) Math.max(0, Math.min(100, Math.round(total)));
    }

    public MetricScore metric(IssueCategory category) {
        return metricScores.get(category);
    }

    public boolean hasCriticalIssue() {
        return issues.stream().anyMatch(Issue::isCritical);
    }

    public boolean hasIssueAtLeast(Severity severity) {
        return issues.stream().anyMatch(i -> i.severity().isAtLeast(severity));
    }

    /**
     * Whether any metric fell back to a degraded score.
     */
    public boolean isDegraded() {
        return metricScores.values().stream().anyMatch(MetricScore::judgeUnavailable);
    }

    public boolean meets(int threshold) {
        return confidence >= threshold;
    }
}
