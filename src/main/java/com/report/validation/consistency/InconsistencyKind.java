package com.report.validation.consistency;

/**
 * Kind of cross-node disagreement.
 */
public enum InconsistencyKind {
    /** Same concept named differently in different nodes. */
    TERMINOLOGY,
    /** A value quoted in a narrative node disagrees with the scoring node it comes from. */
    DATA_VALUE,
    /** Narrative nodes address the reader in different voices. */
    STYLE
}
