package com.report.validation.reevaluation;

/**
 * States of one re-evaluation pass, in order.
 */
public enum RevalidationPhase {
    ANALYZING,
    SELECTIVE_SCORING,
    CONSISTENCY_CHECK,
    DECIDING,
    COMPLETED
}
