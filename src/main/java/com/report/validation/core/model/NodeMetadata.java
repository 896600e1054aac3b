package com.report.validation.core.model;

import java.util.Collections;
import java.util.Objects;
import java.util.Set;
import java.util.TreeSet;

/**
 * Structural metadata attached to a node at extraction time.
 *
 * @param parentContext        logical section of the report the node belongs to
 * @param dependencies         ids of nodes this node's content is derived from
 * @param importance           1-10, drives report-level weighting and feedback priority
 * @param validationComplexity 1-10, estimated effort to validate the node
 * @param dataSource           origin of the data the node presents
 */
public record NodeMetadata(
        String parentContext,
        Set<String> dependencies,
        int importance,
        int validationComplexity,
        String dataSource
) {
    public NodeMetadata {
        Objects.requireNonNull(parentContext, "parentContext is required");
        Objects.requireNonNull(dataSource, "dataSource is required");
        dependencies = dependencies != null
                ? Collections.unmodifiableSet(new TreeSet<>(dependencies))
                : Set.of();
        if (importance < 1 || importance > 10) {
            throw new IllegalArgumentException("importance must be between 1 and 10, got " + importance);
        }
        if (validationComplexity < 1 || validationComplexity > 10) {
            throw new IllegalArgumentException(
                    "validationComplexity must be between 1 and 10, got " + validationComplexity);
        }
    }

    public NodeMetadata withDependencies(Set<String> newDependencies) {
        return new NodeMetadata(parentContext, newDependencies, importance, validationComplexity, dataSource);
    }
}
