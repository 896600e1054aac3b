package com.report.validation.feedback;

import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Text template for one kind of feedback. Placeholders use {@code {{name}}} syntax;
 * unknown placeholders render as empty text.
 */
public record FeedbackTemplate(
        String templateId,
        String actionTemplate,
        List<String> implementationSteps,
        String beforeTemplate,
        String afterTemplate,
        List<String> successCriteria
) {
    private static final Pattern PLACEHOLDER = Pattern.compile("\\{\\{(\\w+)}}");

    public FeedbackTemplate {
        Objects.requireNonNull(templateId, "templateId is required");
        Objects.requireNonNull(actionTemplate, "actionTemplate is required");
        Objects.requireNonNull(beforeTemplate, "beforeTemplate is required");
        Objects.requireNonNull(afterTemplate, "afterTemplate is required");
        implementationSteps = implementationSteps != null ? List.copyOf(implementationSteps) : List.of();
        successCriteria = successCriteria != null ? List.copyOf(successCriteria) : List.of();
    }

    public static String render(String template, Map<String, String> variables) {
        Matcher matcher = PLACEHOLDER.matcher(template);
        StringBuilder out = new StringBuilder();
        while (matcher.find()) {
            String value = variables.getOrDefault(matcher.group(1), "");
            matcher.appendReplacement(out, Matcher.quoteReplacement(value));
        }
        matcher.appendTail(out);
        return out.toString();
    }
}
