package com.report.validation.classification;

/**
 * How much a defect in a node matters for the report as a whole.
 */
public enum Criticality {
    LOW,
    MEDIUM,
    HIGH,
    CRITICAL
}
