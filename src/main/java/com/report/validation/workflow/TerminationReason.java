package com.report.validation.workflow;

/**
 * Why a workflow stopped iterating.
 */
public enum TerminationReason {
    /** Every node met the threshold with no critical issue and consistent content. */
    THRESHOLD_MET,
    /** The iteration budget ran out before approval. */
    ITERATION_BUDGET_EXHAUSTED,
    /** Approval was not reached and no issue produced feedback to act on. */
    NO_ACTIONABLE_FEEDBACK,
    /** Report confidence stopped improving for the configured number of iterations. */
    STAGNATION,
    /** The content generator failed to produce a revision. */
    GENERATOR_ERROR,
    /** The caller cancelled the workflow. */
    CANCELLED;

    /**
     * Whether a report ending this way is handed to a human reviewer.
     */
    public boolean routesToManualReview() {
        return this == ITERATION_BUDGET_EXHAUSTED || this == NO_ACTIONABLE_FEEDBACK || this == STAGNATION;
    }
}
