package com.report.validation.reevaluation;

import com.report.validation.core.model.ContentHasher;
import com.report.validation.core.model.Node;
import com.report.validation.core.model.NodeType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Diffs the nodes of two iterations.
 *
 * <p>Content changes always require re-validation. A changed recommendation, or any new
 * node, also requires its dependents to have consistency re-checked, since
 * recommendations fan out to the rest of the report. Metadata-only changes require neither.</p>
 */
public class ChangeDetector {
    private static final Logger log = LoggerFactory.getLogger(ChangeDetector.class);

    public ChangeSet detect(List<Node> previousNodes, List<Node> currentNodes) {
        Map<String, Node> previous = new LinkedHashMap<>();
        previousNodes.forEach(n -> previous.put(n.id(), n));

        Map<String, List<String>> dependents = new HashMap<>();
        for (Node node : currentNodes) {
            for (String dependency : node.metadata().dependencies()) {
                dependents.computeIfAbsent(dependency, k -> new ArrayList<>()).add(node.id());
            }
        }

        List<ChangeAnalysis> changes = new ArrayList<>();
        Set<String> unchanged = new HashSet<>();
        Set<String> seen = new HashSet<>();
        for (Node current : currentNodes) {
            seen.add(current.id());
            Node before = previous.get(current.id());
            List<String> affected = dependents.getOrDefault(current.id(), List.of());
            if (before == null) {
                changes.add(new ChangeAnalysis(current.id(), ChangeType.STRUCTURE, ChangeScope.MAJOR,
                        true, true, affected, 0.0));
            } else if (!before.contentHash().equals(current.contentHash())) {
                double similarity = EditDistanceSimilarity.similarity(
                        ContentHasher.canonicalJson(before.content()), ContentHasher.canonicalJson(current.content()));
                changes.add(new ChangeAnalysis(current.id(), ChangeType.CONTENT, ChangeScope.ofSimilarity(similarity),
                        true, current.type() == NodeType.RECOMMENDATION, affected, similarity));
            } else if (before.type() != current.type()) {
                changes.add(new ChangeAnalysis(current.id(), ChangeType.STRUCTURE, ChangeScope.MODERATE,
                        true, true, affected, 1.0));
            } else if (!before.metadata().equals(current.metadata())) {
                changes.add(new ChangeAnalysis(current.id(), ChangeType.METADATA, ChangeScope.MINOR,
                        false, false, affected, 1.0));
            } else {
                unchanged.add(current.id());
            }
        }
        Set<String> removed = new HashSet<>(previous.keySet());
        removed.removeAll(seen);

        ChangeSet changeSet = new ChangeSet(changes, unchanged, removed);
        log.debug("Detected {} change(s), {} unchanged, {} removed node(s)",
                changes.size(), unchanged.size(), removed.size());
        return changeSet;
    }
}
