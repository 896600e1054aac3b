package com.report.validation.reevaluation;

import java.util.Collections;
import java.util.List;
import java.util.Set;
import java.util.TreeSet;
import java.util.stream.Collectors;

/**
 * All changes between two iterations of a report.
 *
 * @param changes          analyses of new and modified nodes
 * @param unchangedNodeIds nodes whose content and metadata are identical
 * @param removedNodeIds   nodes present before and absent now
 */
public record ChangeSet(List<ChangeAnalysis> changes, Set<String> unchangedNodeIds, Set<String> removedNodeIds) {

    public ChangeSet {
        changes = changes != null ? List.copyOf(changes) : List.of();
        unchangedNodeIds = unchangedNodeIds != null
                ? Collections.unmodifiableSet(new TreeSet<>(unchangedNodeIds)) : Set.of();
        removedNodeIds = removedNodeIds != null
                ? Collections.unmodifiableSet(new TreeSet<>(removedNodeIds)) : Set.of();
    }

    /** Nodes that need a full re-score. */
    public Set<String> revalidationRequired() {
        return changes.stream()
                .filter(ChangeAnalysis::revalidationRequired)
                .map(ChangeAnalysis::nodeId)
                .collect(Collectors.toCollection(TreeSet::new));
    }

    /** Nodes whose content is new or different. */
    public Set<String> contentChanged() {
        return changes.stream()
                .filter(ChangeAnalysis::isContentChange)
                .map(ChangeAnalysis::nodeId)
                .collect(Collectors.toCollection(TreeSet::new));
    }

    /**
     * Nodes depending on a change that requires a consistency re-check, excluding nodes
     * that are re-scored anyway.
     */
    public Set<String> consistencyDependents() {
        Set<String> rescored = revalidationRequired();
        return changes.stream()
                .filter(ChangeAnalysis::consistencyCheckRequired)
                .flatMap(c -> c.affectedNodes().stream())
                .filter(id -> !rescored.contains(id))
                .collect(Collectors.toCollection(TreeSet::new));
    }

    public boolean isEmpty() {
        return changes.isEmpty() && removedNodeIds.isEmpty();
    }
}
