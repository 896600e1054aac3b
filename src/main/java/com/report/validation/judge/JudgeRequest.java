package com.report.validation.judge;

import com.report.validation.core.model.IssueCategory;
import com.report.validation.core.model.NodeType;

import java.util.List;
import java.util.Objects;

/**
 * One judge evaluation: a content fragment scored against one criterion.
 *
 * @param nodeId          node the fragment belongs to
 * @param nodeType        type of that node
 * @param contentFragment text to evaluate
 * @param criterion       criterion to apply
 * @param relatedContent  text of related nodes, given as context for consistency checks
 */
public record JudgeRequest(
        String nodeId,
        NodeType nodeType,
        String contentFragment,
        JudgeCriterion criterion,
        List<String> relatedContent
) {
    public JudgeRequest {
        Objects.requireNonNull(nodeId, "nodeId is required");
        Objects.requireNonNull(nodeType, "nodeType is required");
        Objects.requireNonNull(contentFragment, "contentFragment is required");
        Objects.requireNonNull(criterion, "criterion is required");
        relatedContent = relatedContent != null ? List.copyOf(relatedContent) : List.of();
    }

    public IssueCategory category() {
        return criterion.category();
    }
}
