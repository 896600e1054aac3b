package com.report.validation.reevaluation;

import java.time.Duration;

/**
 * Cost figures of one re-evaluation pass.
 *
 * @param nodesRevalidated          nodes fully re-scored
 * @param nodesConsistencyRechecked nodes whose consistency metric alone was re-judged
 * @param nodesCarriedForward       nodes whose previous result was reused
 * @param judgeInvocations          judge calls issued during the pass, retries included
 * @param costSavings               share of a full validation's judge calls avoided, 0-1
 * @param duration                  wall time of the pass
 */
public record RevalidationMetrics(
        int nodesRevalidated,
        int nodesConsistencyRechecked,
        int nodesCarriedForward,
        long judgeInvocations,
        double costSavings,
        Duration duration
) {
    static double costSavings(long judgeInvocations, int totalNodes, int judgedMetricsPerNode) {
        long fullCost = (long) totalNodes * judgedMetricsPerNode;
        if (fullCost == 0) {
            return 0.0;
        }
        return Math.max(0.0, Math.min(1.0, 1.0 - (double) judgeInvocations / fullCost));
    }
}
