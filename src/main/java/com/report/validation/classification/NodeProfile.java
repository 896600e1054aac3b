package com.report.validation.classification;

import com.report.validation.core.model.IssueCategory;
import com.report.validation.core.model.NodeType;

import java.util.Collections;
import java.util.EnumSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * Validation profile of a node: which checks apply and how critical the node is.
 */
public record NodeProfile(NodeType nodeType, Set<ValidationCheck> applicableChecks, Criticality criticality) {

    public NodeProfile {
        Objects.requireNonNull(nodeType, "nodeType is required");
        Objects.requireNonNull(criticality, "criticality is required");
        applicableChecks = applicableChecks == null || applicableChecks.isEmpty()
                ? Set.of()
                : Collections.unmodifiableSet(EnumSet.copyOf(applicableChecks));
    }

    public static NodeProfile of(NodeType nodeType, Criticality criticality, ValidationCheck... checks) {
        return new NodeProfile(nodeType, checks.length == 0 ? Set.of() : EnumSet.of(checks[0], checks), criticality);
    }

    /**
     * Checks of this profile that belong to the given category, in declaration order.
     */
    public List<ValidationCheck> checksFor(IssueCategory category) {
        return applicableChecks.stream().filter(c -> c.category() == category).toList();
    }
}
