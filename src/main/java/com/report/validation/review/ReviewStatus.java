package com.report.validation.review;

/**
 * Status of a report in the manual review queue.
 */
public enum ReviewStatus {
    PENDING,
    APPROVED,
    REJECTED
}
