package com.report.validation.reevaluation;

import com.report.validation.core.model.Issue;
import com.report.validation.core.model.IssueCategory;

import java.util.Objects;

/**
 * A new issue attributed to an applied feedback item targeting the same node and category.
 */
public record RegressionIssue(String nodeId, Issue issue, String causedByFeedbackId, IssueCategory category,
                              String mitigation) {

    public RegressionIssue {
        Objects.requireNonNull(nodeId, "nodeId is required");
        Objects.requireNonNull(issue, "issue is required");
        Objects.requireNonNull(causedByFeedbackId, "causedByFeedbackId is required");
        Objects.requireNonNull(category, "category is required");
        Objects.requireNonNull(mitigation, "mitigation is required");
    }
}
