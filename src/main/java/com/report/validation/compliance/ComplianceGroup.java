package com.report.validation.compliance;

import com.report.validation.core.model.Severity;

/**
 * Policy areas covered by the compliance metric. The metric score is the share of
 * groups with no violated rule.
 */
public enum ComplianceGroup {
    ETHICS(Severity.HIGH),
    PRIVACY(Severity.HIGH),
    PROFESSIONALISM(Severity.MEDIUM),
    LEGALITY(Severity.CRITICAL);

    private final Severity severity;

    ComplianceGroup(Severity severity) {
        this.severity = severity;
    }

    /**
     * Severity of issues raised for violations in this group.
     */
    public Severity severity() {
        return severity;
    }
}
