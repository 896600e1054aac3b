package com.report.validation.core.model;

import java.util.Locale;

/**
 * Issue severity, ordered from least to most severe.
 */
public enum Severity {
    LOW,
    MEDIUM,
    HIGH,
    CRITICAL;

    public boolean isAtLeast(Severity other) {
        return compareTo(other) >= 0;
    }

    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }

    /**
     * Lenient parse used for judge output; unknown values map to MEDIUM.
     */
    public static Severity parse(String value) {
        if (value == null || value.isBlank()) {
            return MEDIUM;
        }
        try {
            return Severity.valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            return MEDIUM;
        }
    }
}
