package com.report.validation.reevaluation;

import java.util.List;
import java.util.Objects;

/**
 * Measured effect of one applied feedback item on its node.
 *
 * @param feedbackId          the feedback item
 * @param nodeId              node it targeted
 * @param expectedGain        estimated confidence gain
 * @param actualGain          confidence change observed on the node
 * @param effectiveness       actual over expected gain in percent, clamped to 0-100
 * @param appliedSuccessfully whether the node's confidence improved
 * @param recommendation      continue, modify or abandon the approach
 * @param sideEffects         new issue categories and regressions observed on the node
 */
public record FeedbackEffectiveness(
        String feedbackId,
        String nodeId,
        int expectedGain,
        int actualGain,
        int effectiveness,
        boolean appliedSuccessfully,
        FeedbackRecommendation recommendation,
        List<String> sideEffects
) {
    public FeedbackEffectiveness {
        Objects.requireNonNull(feedbackId, "feedbackId is required");
        Objects.requireNonNull(nodeId, "nodeId is required");
        Objects.requireNonNull(recommendation, "recommendation is required");
        sideEffects = sideEffects != null ? List.copyOf(sideEffects) : List.of();
    }

    /**
     * Continue above 80% effectiveness with a positive gain, modify above 50% or with a
     * gain above 5 points, otherwise abandon.
     */
    static FeedbackRecommendation recommend(double rawEffectiveness, int actualGain) {
        if (rawEffectiveness > 80 && actualGain > 0) {
            return FeedbackRecommendation.CONTINUE;
        }
        if (rawEffectiveness > 50 || actualGain > 5) {
            return FeedbackRecommendation.MODIFY;
        }
        return FeedbackRecommendation.ABANDON;
    }
}
