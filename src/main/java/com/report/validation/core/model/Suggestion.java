package com.report.validation.core.model;

import java.util.Objects;

/**
 * A remediation hint attached to one issue by the metric that raised it.
 *
 * @param issueId                 the issue this suggestion addresses
 * @param category                source category
 * @param specificAction          what to change
 * @param estimatedConfidenceGain expected confidence points gained, 0 when unknown
 */
public record Suggestion(
        String issueId,
        IssueCategory category,
        String specificAction,
        int estimatedConfidenceGain
) {
    public Suggestion {
        Objects.requireNonNull(issueId, "issueId is required");
        Objects.requireNonNull(category, "category is required");
        Objects.requireNonNull(specificAction, "specificAction is required");
        if (estimatedConfidenceGain < 0) {
            throw new IllegalArgumentException("estimatedConfidenceGain must be >= 0");
        }
    }
}
