package com.report.validation.consistency;

/**
 * Scope of cross-node consistency checking.
 */
public enum ConsistencyDepth {
    /** Changed nodes are checked against their direct dependencies and dependents only. */
    SHALLOW,
    /** Every pair of nodes in the report is checked. */
    DEEP
}
