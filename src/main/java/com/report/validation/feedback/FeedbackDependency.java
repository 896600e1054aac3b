package com.report.validation.feedback;

import java.util.Objects;

/**
 * Edge in the feedback dependency graph: {@code dependentId} should be applied after {@code dependsOnId}.
 */
public record FeedbackDependency(String dependentId, String dependsOnId, String reason, DependencyKind kind) {

    public FeedbackDependency {
        Objects.requireNonNull(dependentId, "dependentId is required");
        Objects.requireNonNull(dependsOnId, "dependsOnId is required");
        Objects.requireNonNull(reason, "reason is required");
        Objects.requireNonNull(kind, "kind is required");
    }
}
