package com.report.validation.reevaluation;

import com.report.validation.core.model.Node;
import com.report.validation.feedback.Feedback;

import java.util.List;
import java.util.Objects;

/**
 * Input to one re-evaluation pass.
 *
 * @param workflowId      owning workflow
 * @param iteration       iteration being evaluated
 * @param previous        snapshot of the previous iteration
 * @param currentNodes    nodes extracted from the revised report
 * @param appliedFeedback feedback items the generator was asked to apply
 */
public record RevalidationRequest(
        String workflowId,
        int iteration,
        ValidationSnapshot previous,
        List<Node> currentNodes,
        List<Feedback> appliedFeedback
) {
    public RevalidationRequest {
        Objects.requireNonNull(workflowId, "workflowId is required");
        Objects.requireNonNull(previous, "previous is required");
        Objects.requireNonNull(currentNodes, "currentNodes is required");
        currentNodes = List.copyOf(currentNodes);
        appliedFeedback = appliedFeedback != null ? List.copyOf(appliedFeedback) : List.of();
    }
}
