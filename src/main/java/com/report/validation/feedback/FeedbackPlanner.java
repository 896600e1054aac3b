package com.report.validation.feedback;

import com.report.validation.core.model.ContentHasher;
import com.report.validation.core.model.IssueCategory;
import com.report.validation.core.model.Severity;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.PriorityQueue;
import java.util.Set;
import java.util.TreeSet;
import java.util.stream.Collectors;

/**
 * Builds a {@link FeedbackPlan} from feedback items.
 *
 * <p>Dependency edges are inferred between items: on the same node a consistency fix
 * follows an accuracy fix and a clarity fix follows a bias fix; across nodes a
 * consistency fix follows an accuracy fix on a node it depends on. The sequence is a
 * topological order over the order-constraining edges in which, among ready items,
 * critical items come first, then higher priority, then higher gain, then feedback id.
 * No edge forces a non-critical item ahead of a critical one, so every critical item
 * precedes every non-critical item.</p>
 */
public class FeedbackPlanner {
    private static final Logger log = LoggerFactory.getLogger(FeedbackPlanner.class);

    static final int CROSS_NODE_THRESHOLD = 3;

    /** Same-node prerequisites: key category is applied after value category. */
    private static final Map<IssueCategory, IssueCategory> SAME_NODE_PREREQUISITE = new EnumMap<>(Map.of(
            IssueCategory.CONSISTENCY, IssueCategory.ACCURACY,
            IssueCategory.CLARITY, IssueCategory.BIAS
    ));

    static final Comparator<Feedback> SCHEDULING_ORDER = Comparator
            .comparing((Feedback f) -> !f.isCritical())
            .thenComparing(Feedback::priority, Comparator.reverseOrder())
            .thenComparing(Feedback::estimatedConfidenceGain, Comparator.reverseOrder())
            .thenComparing(Feedback::feedbackId);

    /**
     * @throws IllegalArgumentException if two items share a feedback id
     */
    public FeedbackPlan plan(List<Feedback> feedbackItems) {
        Objects.requireNonNull(feedbackItems, "feedbackItems is required");
        Map<String, Feedback> byId = new LinkedHashMap<>();
        for (Feedback item : feedbackItems) {
            Objects.requireNonNull(item, "feedback item must not be null");
            if (byId.putIfAbsent(item.feedbackId(), item) != null) {
                throw new IllegalArgumentException("Duplicate feedback id: " + item.feedbackId());
            }
        }
        if (byId.isEmpty()) {
            return emptyPlan();
        }

        List<FeedbackDependency> dependencies = inferDependencies(new ArrayList<>(byId.values()));
        List<Feedback> sequence = order(byId, dependencies);

        Set<String> withIncoming = dependencies.stream()
                .map(FeedbackDependency::dependentId)
                .collect(Collectors.toSet());
        List<Feedback> parallelizable = sequence.stream()
                .filter(f -> !withIncoming.contains(f.feedbackId()))
                .toList();

        FeedbackPlanMetrics metrics = metrics(sequence);
        FeedbackPlan plan = new FeedbackPlan(
                planId(byId.keySet()),
                sequence,
                parallelizable,
                timeline(sequence),
                dependencies,
                metrics,
                crossNodeRecommendations(sequence),
                executionStrategy(sequence, metrics));
        log.debug("Planned {} feedback item(s): {} dependencies, {} parallelizable, strategy '{}'",
                sequence.size(), dependencies.size(), parallelizable.size(), plan.executionStrategy());
        return plan;
    }

    List<FeedbackDependency> inferDependencies(List<Feedback> items) {
        List<FeedbackDependency> edges = new ArrayList<>();
        for (Feedback dependent : items) {
            for (Feedback prerequisite : items) {
                if (dependent == prerequisite) {
                    continue;
                }
                if (dependent.nodeId().equals(prerequisite.nodeId())) {
                    if (SAME_NODE_PREREQUISITE.get(dependent.category()) == prerequisite.category()) {
                        edges.add(new FeedbackDependency(dependent.feedbackId(), prerequisite.feedbackId(),
                                prerequisite.category().wireName() + " fix on " + dependent.nodeId()
                                        + " precedes " + dependent.category().wireName() + " fix",
                                kindFor(dependent, prerequisite, DependencyKind.ENHANCING)));
                    }
                } else if (dependent.nodeDependencies().contains(prerequisite.nodeId())
                        && prerequisite.category() == IssueCategory.ACCURACY
                        && dependent.category() == IssueCategory.CONSISTENCY) {
                    edges.add(new FeedbackDependency(dependent.feedbackId(), prerequisite.feedbackId(),
                            dependent.nodeId() + " derives from " + prerequisite.nodeId()
                                    + "; align after its accuracy fix",
                            conflictsWithCritical(dependent, prerequisite)
                                    ? DependencyKind.RELATED : DependencyKind.ENHANCING));
                }
            }
        }
        edges.sort(Comparator.comparing(FeedbackDependency::dependentId)
                .thenComparing(FeedbackDependency::dependsOnId));
        return edges;
    }

    private static DependencyKind kindFor(Feedback dependent, Feedback prerequisite, DependencyKind otherwise) {
        if (prerequisite.isCritical()) {
            return DependencyKind.BLOCKING;
        }
        return conflictsWithCritical(dependent, prerequisite) ? DependencyKind.RELATED : otherwise;
    }

    // an enforced edge must never hold a critical item behind a non-critical one
    private static boolean conflictsWithCritical(Feedback dependent, Feedback prerequisite) {
        return dependent.isCritical() && !prerequisite.isCritical();
    }

    private List<Feedback> order(Map<String, Feedback> byId, List<FeedbackDependency> dependencies) {
        Map<String, Integer> inDegree = new HashMap<>();
        Map<String, List<String>> successors = new HashMap<>();
        byId.keySet().forEach(id -> inDegree.put(id, 0));
        for (FeedbackDependency edge : dependencies) {
            if (!edge.kind().constrainsOrder()) {
                continue;
            }
            successors.computeIfAbsent(edge.dependsOnId(), k -> new ArrayList<>()).add(edge.dependentId());
            inDegree.merge(edge.dependentId(), 1, Integer::sum);
        }

        PriorityQueue<Feedback> ready = new PriorityQueue<>(SCHEDULING_ORDER);
        byId.values().stream().filter(f -> inDegree.get(f.feedbackId()) == 0).forEach(ready::add);

        List<Feedback> sequence = new ArrayList<>(byId.size());
        Set<String> placed = new HashSet<>();
        while (!ready.isEmpty()) {
            Feedback next = ready.poll();
            sequence.add(next);
            placed.add(next.feedbackId());
            for (String successor : successors.getOrDefault(next.feedbackId(), List.of())) {
                if (inDegree.merge(successor, -1, Integer::sum) == 0) {
                    ready.add(byId.get(successor));
                }
            }
        }

        if (sequence.size() < byId.size()) {
            List<Feedback> cyclic = byId.values().stream()
                    .filter(f -> !placed.contains(f.feedbackId()))
                    .sorted(SCHEDULING_ORDER)
                    .toList();
            log.warn("Feedback dependency cycle among {} item(s); appending them in priority order", cyclic.size());
            sequence.addAll(cyclic);
        }
        return sequence;
    }

    static FeedbackTimeline timeline(List<Feedback> sequence) {
        List<Feedback> immediate = new ArrayList<>();
        List<Feedback> shortTerm = new ArrayList<>();
        List<Feedback> longTerm = new ArrayList<>();
        for (Feedback item : sequence) {
            if (item.isCritical() || item.priority() >= 9) {
                immediate.add(item);
            } else if (item.severity() == Severity.HIGH || item.priority() >= 6) {
                shortTerm.add(item);
            } else {
                longTerm.add(item);
            }
        }
        return new FeedbackTimeline(immediate, shortTerm, longTerm);
    }

    static FeedbackPlanMetrics metrics(List<Feedback> sequence) {
        Map<IssueCategory, Integer> byCategory = new EnumMap<>(IssueCategory.class);
        Map<Severity, Integer> bySeverity = new EnumMap<>(Severity.class);
        int hours = 0;
        int gain = 0;
        for (Feedback item : sequence) {
            byCategory.merge(item.category(), 1, Integer::sum);
            bySeverity.merge(item.severity(), 1, Integer::sum);
            hours += item.estimatedEffort().hours();
            gain += item.estimatedConfidenceGain();
        }
        double efficiency = (double) gain / Math.max(1, hours);
        return new FeedbackPlanMetrics(byCategory, bySeverity, hours, EffortLevel.ofTotalHours(hours), gain, efficiency);
    }

    static List<String> crossNodeRecommendations(List<Feedback> sequence) {
        Map<IssueCategory, Set<String>> nodesByCategory = new EnumMap<>(IssueCategory.class);
        for (Feedback item : sequence) {
            nodesByCategory.computeIfAbsent(item.category(), k -> new TreeSet<>()).add(item.nodeId());
        }
        List<String> recommendations = new ArrayList<>();
        nodesByCategory.forEach((category, nodes) -> {
            if (nodes.size() >= CROSS_NODE_THRESHOLD) {
                recommendations.add("Address " + category.wireName() + " systematically across "
                        + nodes.size() + " nodes: " + String.join(", ", nodes));
            }
        });
        return recommendations;
    }

    static String executionStrategy(List<Feedback> sequence, FeedbackPlanMetrics metrics) {
        if (sequence.isEmpty()) {
            return "No remediation required";
        }
        int critical = metrics.itemsBySeverity().getOrDefault(Severity.CRITICAL, 0);
        int high = metrics.itemsBySeverity().getOrDefault(Severity.HIGH, 0);
        if (critical > 0) {
            return "CRITICAL: resolve " + critical + " critical item(s) before any other change, then re-validate";
        }
        if (high > 0) {
            return "HIGH PRIORITY: apply " + high + " high-severity item(s) first, then the remaining "
                    + (sequence.size() - high) + " in sequence";
        }
        return "STANDARD: apply " + sequence.size() + " item(s) in recommended sequence ("
                + metrics.overallEffort().name().toLowerCase(Locale.ROOT) + " effort)";
    }

    private static String planId(Set<String> feedbackIds) {
        return "plan-" + ContentHasher.sha256(String.join("|", new TreeSet<>(feedbackIds))).substring(0, 12);
    }

    private static FeedbackPlan emptyPlan() {
        FeedbackPlanMetrics metrics = metrics(List.of());
        return new FeedbackPlan(planId(Set.of()), List.of(), List.of(), new FeedbackTimeline(null, null, null),
                List.of(), metrics, List.of(), executionStrategy(List.of(), metrics));
    }
}
