package com.report.validation.feedback;

/**
 * Strength of a dependency between two feedback items.
 */
public enum DependencyKind {
    /** Prerequisite is critical; the dependent must wait for it. */
    BLOCKING,
    /** Dependent is more effective once the prerequisite is applied; ordering is enforced. */
    ENHANCING,
    /** Informational link only; does not constrain ordering. */
    RELATED;

    public boolean constrainsOrder() {
        return this != RELATED;
    }
}
