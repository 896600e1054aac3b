package com.report.validation.workflow;

/**
 * Phases of the validation workflow. Cancellation is honored at phase boundaries.
 */
public enum WorkflowPhase {
    PENDING,
    EXTRACTING,
    SCORING,
    REEVALUATING,
    SYNTHESIZING_FEEDBACK,
    AWAITING_REVISION,
    TERMINATED
}
