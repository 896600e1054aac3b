package com.report.validation.core.model;

import java.util.Locale;

/**
 * Quality dimensions a node is scored on. Each category yields one metric score
 * and tags the issues it produces.
 */
public enum IssueCategory {
    ACCURACY,
    BIAS,
    CLARITY,
    CONSISTENCY,
    COMPLIANCE;

    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }

    /**
     * Whether this category is judged by the oracle. Compliance is rule-based.
     */
    public boolean isJudged() {
        return this != COMPLIANCE;
    }
}
