package com.report.validation.judge;

import com.report.validation.classification.NodeProfile;
import com.report.validation.classification.ValidationCheck;
import com.report.validation.core.model.IssueCategory;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Category-specific criterion sets. The base checks of a category are extended with
 * the checks the node's profile enables for that category.
 */
public final class JudgeCriteria {

    private static final Map<IssueCategory, List<String>> BASE_CHECKS = new EnumMap<>(Map.of(
            IssueCategory.ACCURACY, List.of(
                    "Factual statements are correct",
                    "Numbers and labels are internally consistent"),
            IssueCategory.BIAS, List.of(
                    "No stereotyping by gender, age, ethnicity or culture",
                    "Judgments rest on behaviour and results, not on personal attributes"),
            IssueCategory.CLARITY, List.of(
                    "Sentences are unambiguous",
                    "Structure is easy to follow"),
            IssueCategory.CONSISTENCY, List.of(
                    "Statements do not contradict related sections",
                    "Terminology and scale names are used consistently")
    ));

    private JudgeCriteria() {
        // Utility class
    }

    public static JudgeCriterion forCategory(IssueCategory category, NodeProfile profile) {
        if (!category.isJudged()) {
            throw new IllegalArgumentException(category + " is evaluated by rules, not by the judge");
        }
        List<String> checks = new ArrayList<>(BASE_CHECKS.get(category));
        for (ValidationCheck check : profile.checksFor(category)) {
            checks.add(check.description());
        }
        return new JudgeCriterion(category, category.wireName() + "-" + profile.nodeType().wireName(), checks);
    }
}
