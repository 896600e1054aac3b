package com.report.validation.feedback;

import com.report.validation.core.model.IssueCategory;
import com.report.validation.core.model.Severity;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;

/**
 * Aggregate figures of a feedback plan.
 *
 * @param itemsByCategory    feedback count per category
 * @param itemsBySeverity    feedback count per severity
 * @param totalEffortHours   sum of effort hours
 * @param overallEffort      bucketed total effort
 * @param totalExpectedGain  sum of estimated confidence gains
 * @param efficiency         expected gain per effort hour
 */
public record FeedbackPlanMetrics(
        Map<IssueCategory, Integer> itemsByCategory,
        Map<Severity, Integer> itemsBySeverity,
        int totalEffortHours,
        EffortLevel overallEffort,
        int totalExpectedGain,
        double efficiency
) {
    public FeedbackPlanMetrics {
        itemsByCategory = itemsByCategory == null || itemsByCategory.isEmpty()
                ? Map.of() : Collections.unmodifiableMap(new EnumMap<>(itemsByCategory));
        itemsBySeverity = itemsBySeverity == null || itemsBySeverity.isEmpty()
                ? Map.of() : Collections.unmodifiableMap(new EnumMap<>(itemsBySeverity));
    }
}
