package com.report.validation.compliance;

import com.report.validation.core.model.Issue;
import com.report.validation.core.model.IssueCategory;
import com.report.validation.core.model.Node;
import com.report.validation.core.model.Suggestion;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;

/**
 * Deterministic compliance checks. Policy rules are pattern checks, not quality
 * judgments, so this metric never calls the judge.
 */
public class ComplianceRuleEngine {
    private static final Logger log = LoggerFactory.getLogger(ComplianceRuleEngine.class);

    private final List<ComplianceRule> rules;

    public ComplianceRuleEngine(List<ComplianceRule> rules) {
        this.rules = new ArrayList<>(rules);
        this.rules.sort(Comparator.comparing(ComplianceRule::getGroup).thenComparing(ComplianceRule::getName));
    }

    public List<ComplianceRule> getRules() {
        return List.copyOf(rules);
    }

    public ComplianceReport evaluate(Node node) {
        String text = node.text();
        Set<ComplianceGroup> failedGroups = EnumSet.noneOf(ComplianceGroup.class);
        List<String> evidence = new ArrayList<>();
        List<Issue> issues = new ArrayList<>();
        List<Suggestion> suggestions = new ArrayList<>();

        for (ComplianceRule rule : rules) {
            if (!rule.appliesTo(node.type())) {
                continue;
            }
            List<String> matches = rule.findViolations(text);
            if (matches.isEmpty()) {
                continue;
            }
            failedGroups.add(rule.getGroup());
            evidence.add(rule.getName() + ": " + String.join(", ", matches));
            Issue issue = Issue.of(node.id(), IssueCategory.COMPLIANCE, rule.getGroup().severity(),
                    rule.getDescription(), matches, rule.getPriority());
            issues.add(issue);
            suggestions.add(new Suggestion(issue.id(), IssueCategory.COMPLIANCE, rule.getRemediation(), 0));
            log.debug("Compliance rule {} violated on node {}: {}", rule.getName(), node.id(), matches);
        }

        int totalGroups = ComplianceGroup.values().length;
        int score = (int) Math.round((totalGroups - failedGroups.size()) * 100.0 / totalGroups);
        return new ComplianceReport(score, evidence, issues, suggestions);
    }
}
