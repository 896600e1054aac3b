package com.report.validation.workflow;

import com.report.validation.core.model.ValidationStatus;
import com.report.validation.decision.BlockingReason;
import com.report.validation.feedback.FeedbackPlan;
import com.report.validation.reevaluation.RevalidationResult;

import java.util.List;
import java.util.Objects;

/**
 * Summary of one workflow iteration.
 *
 * @param iteration        1-based iteration number
 * @param status           decision of the iteration
 * @param reportConfidence importance-weighted report confidence
 * @param consistencyScore cross-node consistency
 * @param nodesScored      nodes re-scored in this iteration, all nodes for the first one
 * @param blockingReasons  what prevented approval
 * @param feedbackPlan     plan handed to the generator, null if none was produced
 * @param revalidation     re-evaluation details, null for the first iteration
 */
public record IterationRecord(
        int iteration,
        ValidationStatus status,
        int reportConfidence,
        int consistencyScore,
        int nodesScored,
        List<BlockingReason> blockingReasons,
        FeedbackPlan feedbackPlan,
        RevalidationResult revalidation
) {
    public IterationRecord {
        Objects.requireNonNull(status, "status is required");
        blockingReasons = blockingReasons != null ? List.copyOf(blockingReasons) : List.of();
    }

    IterationRecord withFeedbackPlan(FeedbackPlan plan) {
        return new IterationRecord(iteration, status, reportConfidence, consistencyScore, nodesScored,
                blockingReasons, plan, revalidation);
    }
}
