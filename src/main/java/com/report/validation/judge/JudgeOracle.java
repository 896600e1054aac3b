package com.report.validation.judge;

/**
 * External quality judge. Given a content fragment and a criterion, returns a score
 * and supporting evidence.
 *
 * <p>Implementations must be deterministic enough to cache by content hash within one
 * {@link #getJudgeVersion() judge version}. Failures are signalled with
 * {@link JudgeUnavailableException}; callers retry and then degrade.</p>
 */
public interface JudgeOracle {

    /**
     * Evaluates one fragment against one criterion.
     *
     * @throws JudgeUnavailableException if the judge cannot produce a verdict
     */
    JudgeVerdict evaluate(JudgeRequest request);

    /**
     * Version tag of the judge (model plus prompt revision). Part of the cache key.
     */
    String getJudgeVersion();

    /**
     * Returns whether the judge is currently reachable.
     */
    boolean isAvailable();
}
