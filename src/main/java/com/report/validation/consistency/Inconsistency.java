package com.report.validation.consistency;

import java.util.Collections;
import java.util.Objects;
import java.util.Set;
import java.util.TreeSet;

/**
 * One cross-node inconsistency. {@code key} identifies the same disagreement across
 * iterations, so deltas can be computed by key.
 */
public record Inconsistency(InconsistencyKind kind, Set<String> nodeIds, String description, String key) {

    public Inconsistency {
        Objects.requireNonNull(kind, "kind is required");
        Objects.requireNonNull(description, "description is required");
        Objects.requireNonNull(key, "key is required");
        nodeIds = nodeIds != null ? Collections.unmodifiableSet(new TreeSet<>(nodeIds)) : Set.of();
    }

    public boolean involves(String nodeId) {
        return nodeIds.contains(nodeId);
    }
}
