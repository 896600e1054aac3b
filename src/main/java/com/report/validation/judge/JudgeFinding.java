package com.report.validation.judge;

import com.report.validation.core.model.Severity;

import java.util.List;
import java.util.Objects;

/**
 * A defect reported by the judge. The scorer turns findings into issues of the
 * request's category.
 *
 * @param suggestedAction optional remediation, may be null
 */
public record JudgeFinding(
        Severity severity,
        String description,
        List<String> evidence,
        int priority,
        String suggestedAction
) {
    public JudgeFinding {
        Objects.requireNonNull(severity, "severity is required");
        Objects.requireNonNull(description, "description is required");
        evidence = evidence != null ? List.copyOf(evidence) : List.of();
        priority = Math.max(1, Math.min(10, priority));
    }

    public static JudgeFinding of(Severity severity, String description, int priority) {
        return new JudgeFinding(severity, description, List.of(), priority, null);
    }
}
