package com.report.validation.judge;

import com.report.validation.core.model.IssueCategory;

import java.util.List;
import java.util.Objects;

/**
 * Named evaluation criterion handed to the judge together with a content fragment.
 *
 * @param category the metric category being judged
 * @param name     short criterion name
 * @param checks   individual checks the judge must apply
 */
public record JudgeCriterion(IssueCategory category, String name, List<String> checks) {

    public JudgeCriterion {
        Objects.requireNonNull(category, "category is required");
        Objects.requireNonNull(name, "name is required");
        checks = checks != null ? List.copyOf(checks) : List.of();
    }
}
