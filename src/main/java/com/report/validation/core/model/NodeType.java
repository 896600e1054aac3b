package com.report.validation.core.model;

import java.util.Locale;

/**
 * Types of independently validatable units extracted from a report.
 */
public enum NodeType {
    SCORING,
    INSIGHT,
    RECOMMENDATION,
    SUMMARY,
    CONTEXT;

    /**
     * Lower-case wire name, as used in template keys and log output.
     */
    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }

    public static NodeType fromWireName(String value) {
        return NodeType.valueOf(value.trim().toUpperCase(Locale.ROOT));
    }
}
