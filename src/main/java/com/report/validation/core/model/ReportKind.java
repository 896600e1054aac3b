package com.report.validation.core.model;

/**
 * Assessment kind of a report. Selects which structural regions are extracted.
 */
public enum ReportKind {
    INDIVIDUAL,
    EXECUTIVE,
    ORGANIZATIONAL,
    DEFAULT
}
