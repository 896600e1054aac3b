package com.report.validation.core.model;

import java.util.List;
import java.util.Locale;
import java.util.Objects;

/**
 * A defect found on a node by one metric.
 *
 * <p>The id is derived from node, category and normalized description so that the
 * same defect reported in two iterations has the same id. New/resolved issue
 * tracking and regression detection rely on this.</p>
 */
public record Issue(
        String id,
        String nodeId,
        IssueCategory category,
        Severity severity,
        String description,
        List<String> evidence,
        int priority
) {
    public Issue {
        Objects.requireNonNull(nodeId, "nodeId is required");
        Objects.requireNonNull(category, "category is required");
        Objects.requireNonNull(severity, "severity is required");
        Objects.requireNonNull(description, "description is required");
        evidence = evidence != null ? List.copyOf(evidence) : List.of();
        if (priority < 1 || priority > 10) {
            throw new IllegalArgumentException("priority must be between 1 and 10, got " + priority);
        }
        if (id == null) {
            id = deriveId(nodeId, category, description);
        }
    }

    public static Issue of(String nodeId, IssueCategory category, Severity severity,
                           String description, List<String> evidence, int priority) {
        return new Issue(null, nodeId, category, severity, description, evidence, priority);
    }

    public boolean isCritical() {
        return severity == Severity.CRITICAL;
    }

    /**
     * Whether both issues describe the same defect, ignoring node and severity.
     */
    public boolean sameDefectAs(Issue other) {
        return category == other.category && normalize(description).equals(normalize(other.description));
    }

    static String deriveId(String nodeId, IssueCategory category, String description) {
        String digest = ContentHasher.sha256(normalize(description)).substring(0, 12);
        return nodeId + "/" + category.wireName() + "/" + digest;
    }

    private static String normalize(String description) {
        return description.trim().replaceAll("\\s+", " ").toLowerCase(Locale.ROOT);
    }
}
