package com.report.validation.consistency;

import java.util.Collections;
import java.util.List;
import java.util.Set;
import java.util.TreeSet;
import java.util.stream.Collectors;

/**
 * Outcome of one cross-node consistency check.
 *
 * @param score            0-100, 100 minus 10 per inconsistency
 * @param inconsistencies  inconsistencies found within the checked scope
 * @param checkedNodeIds   ids of the nodes in scope
 */
public record ConsistencyReport(int score, List<Inconsistency> inconsistencies, Set<String> checkedNodeIds) {

    public ConsistencyReport {
        if (score < 0 || score > 100) {
            throw new IllegalArgumentException("score must be between 0 and 100, got " + score);
        }
        inconsistencies = inconsistencies != null ? List.copyOf(inconsistencies) : List.of();
        checkedNodeIds = checkedNodeIds != null
                ? Collections.unmodifiableSet(new TreeSet<>(checkedNodeIds)) : Set.of();
    }

    public static ConsistencyReport consistent(Set<String> checkedNodeIds) {
        return new ConsistencyReport(100, List.of(), checkedNodeIds);
    }

    public Set<String> keys() {
        return inconsistencies.stream().map(Inconsistency::key).collect(Collectors.toSet());
    }

    public boolean meets(int threshold) {
        return score >= threshold;
    }
}
