package com.report.validation.reevaluation;

import java.util.List;
import java.util.Objects;

/**
 * Change classification of one new or modified node.
 *
 * @param nodeId                   the node
 * @param changeType               what changed
 * @param changeScope              how much changed
 * @param revalidationRequired     whether the node must be fully re-scored
 * @param consistencyCheckRequired whether the nodes depending on it must have consistency re-judged
 * @param affectedNodes            ids of nodes that depend on this node
 * @param similarity               0-1 similarity of old and new canonical content, 0 for new nodes
 */
public record ChangeAnalysis(
        String nodeId,
        ChangeType changeType,
        ChangeScope changeScope,
        boolean revalidationRequired,
        boolean consistencyCheckRequired,
        List<String> affectedNodes,
        double similarity
) {
    public ChangeAnalysis {
        Objects.requireNonNull(nodeId, "nodeId is required");
        Objects.requireNonNull(changeType, "changeType is required");
        Objects.requireNonNull(changeScope, "changeScope is required");
        affectedNodes = affectedNodes != null ? List.copyOf(affectedNodes) : List.of();
    }

    public boolean isContentChange() {
        return changeType != ChangeType.METADATA;
    }
}
