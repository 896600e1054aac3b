package com.report.validation.consistency;

import java.util.List;
import java.util.Set;

/**
 * Change in cross-node consistency between two iterations.
 */
public record ConsistencyDelta(
        List<Inconsistency> newlyIntroduced,
        List<Inconsistency> newlyResolved,
        int scoreBefore,
        int scoreAfter
) {
    public ConsistencyDelta {
        newlyIntroduced = newlyIntroduced != null ? List.copyOf(newlyIntroduced) : List.of();
        newlyResolved = newlyResolved != null ? List.copyOf(newlyResolved) : List.of();
    }

    /**
     * Compares two reports by inconsistency key.
     */
    public static ConsistencyDelta between(ConsistencyReport before, ConsistencyReport after) {
        Set<String> beforeKeys = before.keys();
        Set<String> afterKeys = after.keys();
        List<Inconsistency> introduced = after.inconsistencies().stream()
                .filter(i -> !beforeKeys.contains(i.key()))
                .toList();
        List<Inconsistency> resolved = before.inconsistencies().stream()
                .filter(i -> !afterKeys.contains(i.key()))
                .toList();
        return new ConsistencyDelta(introduced, resolved, before.score(), after.score());
    }

    public int scoreChange() {
        return scoreAfter - scoreBefore;
    }
}
