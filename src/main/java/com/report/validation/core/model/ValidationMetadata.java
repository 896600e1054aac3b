package com.report.validation.core.model;

import java.time.Instant;
import java.util.Objects;

/**
 * Provenance of a validation result.
 */
public record ValidationMetadata(String judgeVersion, Instant timestamp) {

    public ValidationMetadata {
        Objects.requireNonNull(judgeVersion, "judgeVersion is required");
        Objects.requireNonNull(timestamp, "timestamp is required");
    }

    public static ValidationMetadata now(String judgeVersion) {
        return new ValidationMetadata(judgeVersion, Instant.now());
    }
}
