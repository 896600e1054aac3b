package com.report.validation.reevaluation;

import com.report.validation.core.model.Issue;

import java.util.Objects;

/**
 * An issue that disappeared between iterations although the content of its node did not change.
 */
public record IntegrityViolation(String nodeId, Issue vanishedIssue, String contentHash) {

    public IntegrityViolation {
        Objects.requireNonNull(nodeId, "nodeId is required");
        Objects.requireNonNull(vanishedIssue, "vanishedIssue is required");
        Objects.requireNonNull(contentHash, "contentHash is required");
    }

    public String describe() {
        return "Issue " + vanishedIssue.id() + " vanished from node " + nodeId
                + " without a content change (hash " + contentHash.substring(0, Math.min(8, contentHash.length())) + ")";
    }
}
