package com.report.validation.extraction;

import com.report.validation.core.model.ContentHasher;
import com.report.validation.core.model.Node;
import com.report.validation.core.model.NodeMetadata;
import com.report.validation.core.model.NodeType;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Derives importance, validation complexity, dependencies, parent context and data
 * source for extracted nodes. Scoring and recommendation nodes carry the highest importance.
 *
 * <p>Dependencies are inferred from type: insights depend on scoring nodes,
 * recommendations on scoring and insight nodes, summaries on every non-summary node.</p>
 */
public class NodeMetadataAnnotator {

    private static final Map<NodeType, Integer> IMPORTANCE = new EnumMap<>(Map.of(
            NodeType.SCORING, 10,
            NodeType.RECOMMENDATION, 9,
            NodeType.INSIGHT, 8,
            NodeType.SUMMARY, 7,
            NodeType.CONTEXT, 5
    ));

    private static final Map<NodeType, Integer> TYPE_COMPLEXITY = new EnumMap<>(Map.of(
            NodeType.SCORING, 8,
            NodeType.RECOMMENDATION, 7,
            NodeType.INSIGHT, 6,
            NodeType.SUMMARY, 5,
            NodeType.CONTEXT, 4
    ));

    private static final int CHARS_PER_COMPLEXITY_POINT = 500;

    /**
     * Annotates all drafts of one report. Dependencies only reference ids within the same batch.
     */
    public List<Node> annotate(List<NodeDraft> drafts) {
        Map<NodeType, List<String>> idsByType = new EnumMap<>(NodeType.class);
        for (NodeDraft draft : drafts) {
            idsByType.computeIfAbsent(draft.type(), t -> new ArrayList<>()).add(draft.id());
        }

        List<Node> nodes = new ArrayList<>(drafts.size());
        for (NodeDraft draft : drafts) {
            NodeMetadata metadata = new NodeMetadata(
                    parentContext(draft.id(), draft.type()),
                    dependencies(draft, idsByType),
                    IMPORTANCE.get(draft.type()),
                    complexity(draft),
                    dataSource(draft.type()));
            nodes.add(Node.of(draft.id(), draft.type(), draft.content(), metadata));
        }
        return nodes;
    }

    public static int importanceOf(NodeType type) {
        return IMPORTANCE.get(type);
    }

    int complexity(NodeDraft draft) {
        int contentLength = ContentHasher.canonicalJson(draft.content()).length();
        int lengthComplexity = Math.min(10, (int) Math.ceil(contentLength / (double) CHARS_PER_COMPLEXITY_POINT));
        long value = Math.round(TYPE_COMPLEXITY.get(draft.type()) * 0.7 + lengthComplexity * 0.3);
        return (int) Math.max(1, Math.min(10, value));
    }

    private Set<String> dependencies(NodeDraft draft, Map<NodeType, List<String>> idsByType) {
        Set<String> dependencies = new LinkedHashSet<>();
        switch (draft.type()) {
            case INSIGHT -> dependencies.addAll(idsByType.getOrDefault(NodeType.SCORING, List.of()));
            case RECOMMENDATION -> {
                dependencies.addAll(idsByType.getOrDefault(NodeType.SCORING, List.of()));
                dependencies.addAll(idsByType.getOrDefault(NodeType.INSIGHT, List.of()));
            }
            case SUMMARY -> idsByType.forEach((type, ids) -> {
                if (type != NodeType.SUMMARY) {
                    dependencies.addAll(ids);
                }
            });
            default -> {
                // scoring and context nodes are leaves
            }
        }
        dependencies.remove(draft.id());
        return dependencies;
    }

    static String parentContext(String id, NodeType type) {
        if (id.startsWith("ocean_")) {
            return "personality_assessment";
        }
        if (id.startsWith("pillar_")) {
            return "performance_pillars";
        }
        if (id.startsWith("executive_") && type != NodeType.SUMMARY) {
            return "leadership_evaluation";
        }
        if (id.startsWith("team_")) {
            return "team_dynamics";
        }
        if (type == NodeType.SUMMARY) {
            return "executive_summary";
        }
        if (type == NodeType.RECOMMENDATION) {
            return "development_plan";
        }
        return "general_assessment";
    }

    static String dataSource(NodeType type) {
        return switch (type) {
            case SCORING -> "assessment_responses";
            case INSIGHT -> "score_interpretation";
            case RECOMMENDATION -> "development_framework";
            case SUMMARY -> "aggregated_results";
            case CONTEXT -> "contextual_factors";
        };
    }
}
