package com.report.validation.reevaluation;

/**
 * What changed about a node between two iterations.
 */
public enum ChangeType {
    /** The node's content changed. */
    CONTENT,
    /** The node is new in this iteration. */
    STRUCTURE,
    /** Only derived metadata (dependencies, importance) changed. */
    METADATA
}
