package com.report.validation.feedback;

import com.report.validation.core.model.IssueCategory;
import com.report.validation.core.model.NodeType;
import com.report.validation.core.model.Severity;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Feedback templates keyed by {@code category_severity_nodeType}. Lookup falls back to
 * {@code category_severity}, then to the generic default template.
 */
public class FeedbackTemplateRegistry {

    static final String DEFAULT_KEY = "default";

    private static final Map<IssueCategory, List<String>> CATEGORY_STEPS = new EnumMap<>(Map.of(
            IssueCategory.ACCURACY, List.of(
                    "Re-check every figure against the source assessment data",
                    "Correct values, percentiles and labels that do not match",
                    "Align interpretations with the corrected scores",
                    "Remove claims that the data does not support",
                    "Re-read dependent sections that quote the corrected values"),
            IssueCategory.BIAS, List.of(
                    "Identify wording that generalizes from personal attributes",
                    "Replace it with observed behaviour and results",
                    "Balance strengths and development areas",
                    "Check examples for cultural and gender neutrality",
                    "Have the revised text reviewed against the bias criteria"),
            IssueCategory.CLARITY, List.of(
                    "Split long or compound sentences",
                    "Replace jargon with plain language",
                    "Make each recommendation a concrete action with an owner and horizon",
                    "Order points from most to least important",
                    "Read the section aloud to confirm it is unambiguous"),
            IssueCategory.CONSISTENCY, List.of(
                    "List the terms and values this section shares with related sections",
                    "Use the same trait and scale names as the scoring sections",
                    "Quote values exactly as stated in the scoring sections",
                    "Align voice and tense with the rest of the report",
                    "Re-validate the sections that depend on this one"),
            IssueCategory.COMPLIANCE, List.of(
                    "Locate the flagged fragment",
                    "Remove or rephrase it according to policy",
                    "Check the rest of the section for similar fragments",
                    "Confirm no personal or sensitive data remains",
                    "Record the change for compliance review")
    ));

    private static final Map<IssueCategory, String> CATEGORY_IMPROVEMENT = new EnumMap<>(Map.of(
            IssueCategory.ACCURACY, "state only values confirmed by the assessment data",
            IssueCategory.BIAS, "describe behaviour and outcomes neutrally",
            IssueCategory.CLARITY, "use short, concrete sentences",
            IssueCategory.CONSISTENCY, "use the same terms and values as the related sections",
            IssueCategory.COMPLIANCE, "remove the non-compliant fragment"
    ));

    private final Map<String, FeedbackTemplate> templates = new ConcurrentHashMap<>();

    /**
     * Registry with a template for every category and severity, node-type specific
     * templates for the most common high-impact cases, and a generic default.
     */
    public static FeedbackTemplateRegistry defaults() {
        FeedbackTemplateRegistry registry = new FeedbackTemplateRegistry();
        registry.register(DEFAULT_KEY, new FeedbackTemplate("default",
                "Address the {{category}} issue in this {{nodeType}} section: {{issueDescription}}",
                List.of("Review the flagged content", "Apply the correction", "Re-validate the section"),
                "{{content}}",
                "{{content}} (revised: {{improvement}})",
                List.of("Issue no longer reported on re-validation")));

        for (IssueCategory category : IssueCategory.values()) {
            for (Severity severity : Severity.values()) {
                registry.register(key(category, severity), new FeedbackTemplate(
                        category.wireName() + "_" + severity.wireName(),
                        actionPrefix(severity) + " {{category}} in the {{nodeType}} section: {{issueDescription}}",
                        CATEGORY_STEPS.get(category),
                        "{{content}}",
                        "{{content}} -> {{improvement}}",
                        List.of(category.wireName() + " issue no longer reported on re-validation",
                                "No new " + category.wireName() + " issues introduced")));
            }
        }

        registry.register(key(IssueCategory.ACCURACY, Severity.CRITICAL, NodeType.SCORING), new FeedbackTemplate(
                "accuracy_critical_scoring",
                "Correct the score data immediately: {{issueDescription}}",
                List.of("Pull the raw score from the assessment responses",
                        "Recompute the percentile from the norm group",
                        "Replace the stated value and its interpretation",
                        "Update every section that quotes this score",
                        "Re-validate this node and its dependents"),
                "Stated: {{evidence}}",
                "Corrected to match assessment data: {{improvement}}",
                List.of("Score matches the assessment data exactly", "Dependent sections quote the same value")));
        registry.register(key(IssueCategory.BIAS, Severity.HIGH, NodeType.INSIGHT), new FeedbackTemplate(
                "bias_high_insight",
                "Remove biased framing from the insight: {{issueDescription}}",
                CATEGORY_STEPS.get(IssueCategory.BIAS),
                "{{content}}",
                "Insight restated in terms of observed behaviour: {{improvement}}",
                List.of("No attribute-based generalization remains", "Insight still follows from the scores")));
        registry.register(key(IssueCategory.BIAS, Severity.CRITICAL, NodeType.RECOMMENDATION), new FeedbackTemplate(
                "bias_critical_recommendation",
                "Rewrite the recommendation without biased assumptions: {{issueDescription}}",
                CATEGORY_STEPS.get(IssueCategory.BIAS),
                "{{content}}",
                "Recommendation grounded in assessment evidence only: {{improvement}}",
                List.of("Recommendation applies regardless of personal attributes")));
        registry.register(key(IssueCategory.CLARITY, Severity.MEDIUM, NodeType.RECOMMENDATION), new FeedbackTemplate(
                "clarity_medium_recommendation",
                "Make the recommendation actionable: {{issueDescription}}",
                List.of("State the concrete action", "Name a time horizon", "Describe the expected outcome",
                        "Link the action to the underlying finding", "Remove vague qualifiers"),
                "{{content}}",
                "Action, horizon and outcome stated explicitly: {{improvement}}",
                List.of("Recommendation names an action, a horizon and an outcome")));
        registry.register(key(IssueCategory.CONSISTENCY, Severity.HIGH, NodeType.SUMMARY), new FeedbackTemplate(
                "consistency_high_summary",
                "Align the summary with the detailed sections: {{issueDescription}}",
                CATEGORY_STEPS.get(IssueCategory.CONSISTENCY),
                "{{content}}",
                "Summary restates the detailed findings verbatim: {{improvement}}",
                List.of("Every figure in the summary appears unchanged in a detailed section")));
        return registry;
    }

    public static String key(IssueCategory category, Severity severity) {
        return category.wireName() + "_" + severity.wireName();
    }

    public static String key(IssueCategory category, Severity severity, NodeType nodeType) {
        return key(category, severity) + "_" + nodeType.wireName();
    }

    public FeedbackTemplateRegistry register(String key, FeedbackTemplate template) {
        templates.put(Objects.requireNonNull(key), Objects.requireNonNull(template));
        return this;
    }

    /**
     * Most specific template for the issue: {@code (category, severity, nodeType)},
     * then {@code (category, severity)}, then the default.
     */
    public FeedbackTemplate resolve(IssueCategory category, Severity severity, NodeType nodeType) {
        FeedbackTemplate template = templates.get(key(category, severity, nodeType));
        if (template == null) {
            template = templates.get(key(category, severity));
        }
        if (template == null) {
            template = templates.get(DEFAULT_KEY);
        }
        if (template == null) {
            throw new IllegalStateException("No default feedback template registered");
        }
        return template;
    }

    static String improvementFor(IssueCategory category) {
        return CATEGORY_IMPROVEMENT.get(category);
    }

    private static String actionPrefix(Severity severity) {
        return switch (severity) {
            case CRITICAL -> "Immediately fix";
            case HIGH -> "Fix";
            case MEDIUM -> "Improve";
            case LOW -> "Polish";
        };
    }
}
