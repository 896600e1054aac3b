package com.report.validation.classification;

import com.report.validation.core.model.IssueCategory;

/**
 * Individual checks a node profile can enable. Each belongs to one metric category
 * and is passed to the judge as part of that category's criterion.
 */
public enum ValidationCheck {
    DATA_ACCURACY(IssueCategory.ACCURACY, "Stated values match the underlying assessment data"),
    STATISTICAL_VALIDITY(IssueCategory.ACCURACY, "Scores, percentiles and ranges are statistically plausible"),
    SCORE_INTERPRETATION(IssueCategory.ACCURACY, "Interpretations follow from the scores they describe"),
    EVIDENCE_SUPPORT(IssueCategory.ACCURACY, "Claims are supported by assessment evidence"),
    BIAS_DETECTION(IssueCategory.BIAS, "No demographic, cultural or gender bias in wording or judgment"),
    BALANCED_PERSPECTIVE(IssueCategory.BIAS, "Strengths and development areas are presented fairly"),
    LOGICAL_COHERENCE(IssueCategory.CLARITY, "Statements follow logically and do not contradict each other"),
    ACTIONABILITY(IssueCategory.CLARITY, "Recommendations are concrete and actionable"),
    FEASIBILITY(IssueCategory.CLARITY, "Recommended actions are realistic for the subject"),
    READABILITY(IssueCategory.CLARITY, "Language is clear and free of jargon"),
    COMPLETENESS(IssueCategory.CLARITY, "All key findings are covered"),
    TERMINOLOGY_CONSISTENCY(IssueCategory.CONSISTENCY, "Terminology matches the rest of the report"),
    CROSS_REFERENCE_ALIGNMENT(IssueCategory.CONSISTENCY, "Content agrees with the nodes it builds on"),
    RELEVANCE(IssueCategory.CONSISTENCY, "Content is relevant to the assessment context"),
    PROFESSIONAL_TONE(IssueCategory.COMPLIANCE, "Tone is professional and respectful");

    private final IssueCategory category;
    private final String description;

    ValidationCheck(IssueCategory category, String description) {
        this.category = category;
        this.description = description;
    }

    public IssueCategory category() {
        return category;
    }

    public String description() {
        return description;
    }
}
