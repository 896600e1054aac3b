package com.report.validation.judge;

import java.util.List;

/**
 * Judge response: a 0-100 score, supporting evidence and zero or more findings.
 */
public record JudgeVerdict(int score, List<String> evidence, List<JudgeFinding> findings) {

    public JudgeVerdict {
        if (score < 0 || score > 100) {
            throw new IllegalArgumentException("score must be between 0 and 100, got " + score);
        }
        evidence = evidence != null ? List.copyOf(evidence) : List.of();
        findings = findings != null ? List.copyOf(findings) : List.of();
    }

    public static JudgeVerdict clean(int score, String... evidence) {
        return new JudgeVerdict(score, List.of(evidence), List.of());
    }
}
