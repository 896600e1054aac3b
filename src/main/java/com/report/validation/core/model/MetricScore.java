package com.report.validation.core.model;

import java.util.List;
import java.util.Objects;

/**
 * Score of one quality dimension for one node.
 *
 * @param category         the quality dimension
 * @param score            0-100
 * @param weight           0-1, share of this metric in the node confidence
 * @param evidence         supporting statements from the judge or rule engine
 * @param issues           issues raised by this metric
 * @param selfConfidence   0-100, confidence in the metric value itself
 * @param judgeUnavailable true when the judge could not be reached and the score is a degraded fallback
 */
public record MetricScore(
        IssueCategory category,
        int score,
        double weight,
        List<String> evidence,
        List<Issue> issues,
        int selfConfidence,
        boolean judgeUnavailable
) {
    public MetricScore {
        Objects.requireNonNull(category, "category is required");
        if (score < 0 || score > 100) {
            throw new IllegalArgumentException("score must be between 0 and 100, got " + score);
        }
        if (weight < 0.0 || weight > 1.0) {
            throw new IllegalArgumentException("weight must be between 0.0 and 1.0, got " + weight);
        }
        if (selfConfidence < 0 || selfConfidence > 100) {
            throw new IllegalArgumentException("selfConfidence must be between 0 and 100");
        }
        evidence = evidence != null ? List.copyOf(evidence) : List.of();
        issues = issues != null ? List.copyOf(issues) : List.of();
    }

    /**
     * Degraded score used when the judge is unavailable after all retries.
     */
    public static MetricScore unavailable(IssueCategory category, int fallbackScore, double weight, String reason) {
        return new MetricScore(category, fallbackScore, weight,
                List.of("Judge unavailable: " + reason), List.of(), 0, true);
    }

    public double weightedScore() {
        return score * weight;
    }
}
