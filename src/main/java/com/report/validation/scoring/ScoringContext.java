package com.report.validation.scoring;

import com.report.validation.classification.NodeProfile;
import com.report.validation.core.model.Node;

import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Per-node scoring inputs beyond the node itself.
 *
 * @param workflowId   owning workflow, for log correlation
 * @param profile      validation profile of the node
 * @param relatedNodes nodes the consistency metric compares against
 * @param bypassCache  when true the cache is neither read nor written
 */
public record ScoringContext(String workflowId, NodeProfile profile, List<Node> relatedNodes, boolean bypassCache) {

    public ScoringContext {
        Objects.requireNonNull(workflowId, "workflowId is required");
        Objects.requireNonNull(profile, "profile is required");
        relatedNodes = relatedNodes != null ? List.copyOf(relatedNodes) : List.of();
    }

    public static ScoringContext of(String workflowId, NodeProfile profile, List<Node> relatedNodes) {
        return new ScoringContext(workflowId, profile, relatedNodes, false);
    }

    /**
     * Context whose related nodes are the node's dependencies present in {@code nodesById}.
     */
    public static ScoringContext forNode(String workflowId, Node node, NodeProfile profile,
                                         Map<String, Node> nodesById) {
        List<Node> related = node.metadata().dependencies().stream()
                .map(nodesById::get)
                .filter(Objects::nonNull)
                .toList();
        return of(workflowId, profile, related);
    }

    public ScoringContext bypassingCache() {
        return new ScoringContext(workflowId, profile, relatedNodes, true);
    }
}
