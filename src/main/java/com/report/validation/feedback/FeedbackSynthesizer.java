package com.report.validation.feedback;

import com.report.validation.classification.Criticality;
import com.report.validation.core.model.Issue;
import com.report.validation.core.model.Node;
import com.report.validation.core.model.NodeType;
import com.report.validation.core.model.Severity;
import com.report.validation.core.model.Suggestion;
import com.report.validation.core.model.ValidationResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Turns node issues into feedback items and feedback items into a plan.
 *
 * <p>Priority is {@code issue.priority x severityMultiplier x gapMultiplier x importance/10
 * x urgencyMultiplier}, rounded and clamped to 1-10, where the gap multiplier is 1.5 when
 * the node is more than 20 points below the threshold. Synthesis makes no external calls;
 * malformed input is rejected with {@link IllegalArgumentException}.</p>
 */
public class FeedbackSynthesizer {
    private static final Logger log = LoggerFactory.getLogger(FeedbackSynthesizer.class);

    private static final int LARGE_GAP = 20;
    private static final double LARGE_GAP_MULTIPLIER = 1.5;
    private static final int MAX_EXCERPT_CHARS = 160;

    private final FeedbackTemplateRegistry templates;
    private final FeedbackPlanner planner;

    public FeedbackSynthesizer() {
        this(FeedbackTemplateRegistry.defaults(), new FeedbackPlanner());
    }

    public FeedbackSynthesizer(FeedbackTemplateRegistry templates, FeedbackPlanner planner) {
        this.templates = Objects.requireNonNull(templates, "templates is required");
        this.planner = Objects.requireNonNull(planner, "planner is required");
    }

    /**
     * Generates one feedback item per issue of the result.
     *
     * @throws IllegalArgumentException if the result does not belong to the node
     */
    public List<Feedback> synthesize(ValidationResult result, Node node, FeedbackContext context) {
        Objects.requireNonNull(result, "result is required");
        Objects.requireNonNull(node, "node is required");
        Objects.requireNonNull(context, "context is required");
        if (!result.nodeId().equals(node.id())) {
            throw new IllegalArgumentException(
                    "Validation result for node " + result.nodeId() + " cannot be applied to node " + node.id());
        }

        Map<String, Suggestion> suggestionsByIssue = result.suggestions().stream()
                .collect(Collectors.toMap(Suggestion::issueId, Function.identity(), (a, b) -> a, HashMap::new));
        int confidenceGap = context.confidenceThreshold() - result.confidence();

        List<Feedback> items = new ArrayList<>();
        for (Issue issue : result.issues()) {
            if (!issue.nodeId().equals(node.id())) {
                throw new IllegalArgumentException("Issue " + issue.id() + " does not belong to node " + node.id());
            }
            items.add(toFeedback(issue, node, suggestionsByIssue.get(issue.id()), confidenceGap, context));
        }
        log.debug("Synthesized {} feedback item(s) for node {} (confidence={}, gap={})",
                items.size(), node.id(), result.confidence(), confidenceGap);
        return items;
    }

    /**
     * Orders feedback items into a plan. See {@link FeedbackPlanner}.
     */
    public FeedbackPlan plan(List<Feedback> feedbackItems) {
        return planner.plan(feedbackItems);
    }

    private Feedback toFeedback(Issue issue, Node node, Suggestion suggestion, int confidenceGap,
                                FeedbackContext context) {
        FeedbackTemplate template = templates.resolve(issue.category(), issue.severity(), node.type());
        Map<String, String> variables = templateVariables(issue, node, suggestion);

        String action = suggestion != null
                ? suggestion.specificAction()
                : FeedbackTemplate.render(template.actionTemplate(), variables);

        return new Feedback(
                Feedback.idFor(issue.id()),
                issue.id(),
                node.id(),
                node.type(),
                issue.category(),
                issue.severity(),
                action,
                template.implementationSteps(),
                FeedbackTemplate.render(template.beforeTemplate(), variables),
                FeedbackTemplate.render(template.afterTemplate(), variables),
                estimatedGain(issue.severity(), suggestion),
                estimatedEffort(issue.severity(), node.type()),
                priority(issue, node.importance(), confidenceGap, context.urgency()),
                template.successCriteria(),
                node.metadata().dependencies());
    }

    private Map<String, String> templateVariables(Issue issue, Node node, Suggestion suggestion) {
        Map<String, String> variables = new HashMap<>();
        variables.put("issueDescription", issue.description());
        variables.put("nodeType", node.type().wireName());
        variables.put("category", issue.category().wireName());
        variables.put("content", excerpt(issue.evidence().isEmpty() ? node.text() : issue.evidence().get(0)));
        variables.put("evidence", issue.evidence().isEmpty() ? excerpt(node.text()) : String.join("; ", issue.evidence()));
        variables.put("issue", issue.description());
        variables.put("improvement", suggestion != null
                ? suggestion.specificAction()
                : FeedbackTemplateRegistry.improvementFor(issue.category()));
        return variables;
    }

    static int priority(Issue issue, int importance, int confidenceGap, Criticality urgency) {
        double value = issue.priority()
                * severityMultiplier(issue.severity())
                * (confidenceGap > LARGE_GAP ? LARGE_GAP_MULTIPLIER : 1.0)
                * (importance / 10.0)
                * urgencyMultiplier(urgency);
        return (int) Math.max(1, Math.min(10, Math.round(value)));
    }

    static double severityMultiplier(Severity severity) {
        return switch (severity) {
            case CRITICAL -> 2.0;
            case HIGH -> 1.5;
            case MEDIUM -> 1.0;
            case LOW -> 0.5;
        };
    }

    static double urgencyMultiplier(Criticality urgency) {
        return switch (urgency) {
            case CRITICAL -> 2.0;
            case HIGH -> 1.5;
            case MEDIUM -> 1.0;
            case LOW -> 0.8;
        };
    }

    static EffortLevel estimatedEffort(Severity severity, NodeType nodeType) {
        if (severity == Severity.CRITICAL) {
            return EffortLevel.HIGH;
        }
        if (severity == Severity.HIGH) {
            return EffortLevel.MEDIUM;
        }
        return nodeType == NodeType.SCORING ? EffortLevel.HIGH : EffortLevel.LOW;
    }

    static int estimatedGain(Severity severity, Suggestion suggestion) {
        if (suggestion != null && suggestion.estimatedConfidenceGain() > 0) {
            return suggestion.estimatedConfidenceGain();
        }
        return switch (severity) {
            case CRITICAL -> 25;
            case HIGH -> 15;
            case MEDIUM -> 8;
            case LOW -> 3;
        };
    }

    private static String excerpt(String text) {
        String trimmed = text.strip();
        return trimmed.length() <= MAX_EXCERPT_CHARS ? trimmed : trimmed.substring(0, MAX_EXCERPT_CHARS) + "...";
    }
}
