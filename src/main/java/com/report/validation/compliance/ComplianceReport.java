package com.report.validation.compliance;

import com.report.validation.core.model.Issue;
import com.report.validation.core.model.Suggestion;

import java.util.List;

/**
 * Outcome of rule-based compliance checking for one node.
 *
 * @param score       passed groups / total groups * 100
 * @param evidence    one line per violated rule
 * @param issues      one issue per violated rule
 * @param suggestions remediation per issue
 */
public record ComplianceReport(int score, List<String> evidence, List<Issue> issues, List<Suggestion> suggestions) {

    public ComplianceReport {
        evidence = evidence != null ? List.copyOf(evidence) : List.of();
        issues = issues != null ? List.copyOf(issues) : List.of();
        suggestions = suggestions != null ? List.copyOf(suggestions) : List.of();
    }
}
