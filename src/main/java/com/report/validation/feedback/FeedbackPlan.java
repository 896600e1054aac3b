package com.report.validation.feedback;

import java.util.List;
import java.util.Objects;

/**
 * Ordered remediation plan handed to the content generator.
 *
 * <p>{@code recommendedSequence} is a logical order that respects dependency edges and
 * places critical items first. It does not constrain execution: items in
 * {@code parallelizable} may be applied concurrently.</p>
 */
public record FeedbackPlan(
        String planId,
        List<Feedback> recommendedSequence,
        List<Feedback> parallelizable,
        FeedbackTimeline timeline,
        List<FeedbackDependency> dependencies,
        FeedbackPlanMetrics metrics,
        List<String> crossNodeRecommendations,
        String executionStrategy
) {
    public FeedbackPlan {
        Objects.requireNonNull(planId, "planId is required");
        Objects.requireNonNull(timeline, "timeline is required");
        Objects.requireNonNull(metrics, "metrics is required");
        Objects.requireNonNull(executionStrategy, "executionStrategy is required");
        recommendedSequence = recommendedSequence != null ? List.copyOf(recommendedSequence) : List.of();
        parallelizable = parallelizable != null ? List.copyOf(parallelizable) : List.of();
        dependencies = dependencies != null ? List.copyOf(dependencies) : List.of();
        crossNodeRecommendations = crossNodeRecommendations != null ? List.copyOf(crossNodeRecommendations) : List.of();
    }

    public boolean isEmpty() {
        return recommendedSequence.isEmpty();
    }

    public int size() {
        return recommendedSequence.size();
    }

    public List<Feedback> forNode(String nodeId) {
        return recommendedSequence.stream().filter(f -> f.nodeId().equals(nodeId)).toList();
    }
}
