package com.report.validation.judge;

/**
 * Judge used when none is configured. It is never available, so every judged metric
 * takes the degraded path instead of receiving a placeholder score.
 */
public class NoOpJudgeOracle implements JudgeOracle {

    @Override
    public JudgeVerdict evaluate(JudgeRequest request) {
        throw new JudgeUnavailableException("No judge oracle configured");
    }

    @Override
    public String getJudgeVersion() {
        return "none";
    }

    @Override
    public boolean isAvailable() {
        return false;
    }
}
