package com.report.validation.core.model;

/**
 * Outcome of one validation pass over a whole report.
 */
public enum ValidationStatus {
    /** Every node meets the threshold, no critical issue remains and consistency is sufficient. */
    APPROVED,
    /** Threshold not met but nothing blocks another revision. */
    REQUIRES_FURTHER_REVISION,
    /** A critical issue is present. */
    FAILED
}
