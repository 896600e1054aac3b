package com.report.validation.decision;

import com.report.validation.core.model.Issue;

import java.util.Objects;

/**
 * Why a report was not approved, tied to a node where one applies.
 *
 * @param nodeId      node that blocks approval, null for report-level reasons
 * @param kind        reason kind
 * @param description human readable explanation
 * @param issue       the blocking issue, null unless {@code kind} is issue-based
 */
public record BlockingReason(String nodeId, Kind kind, String description, Issue issue) {

    public enum Kind {
        CRITICAL_ISSUE,
        BELOW_THRESHOLD,
        LOW_CONSISTENCY,
        HIGH_SEVERITY_ISSUE,
        DEGRADED_SCORE,
        MALFORMED_NODE
    }

    public BlockingReason {
        Objects.requireNonNull(kind, "kind is required");
        Objects.requireNonNull(description, "description is required");
    }

    public static BlockingReason forIssue(Kind kind, Issue issue) {
        return new BlockingReason(issue.nodeId(), kind,
                issue.severity().wireName() + " " + issue.category().wireName() + " issue: " + issue.description(),
                issue);
    }
}
