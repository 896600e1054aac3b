package com.report.validation.workflow;

import java.util.Objects;

/**
 * Non-fatal condition that reduced the coverage or reliability of a workflow result.
 *
 * @param kind      warning kind
 * @param iteration iteration it occurred in
 * @param nodeId    affected node, null when report-wide
 * @param message   explanation
 */
public record QualityWarning(Kind kind, int iteration, String nodeId, String message) {

    public enum Kind {
        EXTRACTION,
        DEGRADED_SCORE,
        SCORING_FAILURE,
        INTEGRITY_VIOLATION
    }

    public QualityWarning {
        Objects.requireNonNull(kind, "kind is required");
        Objects.requireNonNull(message, "message is required");
    }
}
