package com.report.validation.workflow;

import com.report.validation.core.model.IssueCategory;

import java.util.List;
import java.util.Objects;

/**
 * Confidence history of one node across the iterations it was scored in.
 *
 * @param nodeId                node
 * @param confidences           confidence per iteration, oldest first
 * @param direction             overall direction
 * @param improvementVelocity   average confidence change per iteration
 * @param stability             {@code max(0, 1 - variance / 100)}
 * @param commonIssueCategories most frequent issue categories, most frequent first
 */
public record NodeTrend(
        String nodeId,
        List<Integer> confidences,
        Direction direction,
        double improvementVelocity,
        double stability,
        List<IssueCategory> commonIssueCategories
) {
    public enum Direction {
        IMPROVING,
        STABLE,
        DECLINING
    }

    public NodeTrend {
        Objects.requireNonNull(nodeId, "nodeId is required");
        Objects.requireNonNull(direction, "direction is required");
        confidences = confidences != null ? List.copyOf(confidences) : List.of();
        commonIssueCategories = commonIssueCategories != null ? List.copyOf(commonIssueCategories) : List.of();
    }
}
