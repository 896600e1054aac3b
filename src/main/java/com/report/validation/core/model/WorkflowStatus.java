package com.report.validation.core.model;

/**
 * Terminal status of a validation workflow.
 */
public enum WorkflowStatus {
    APPROVED,
    FAILED,
    CANCELLED
}
