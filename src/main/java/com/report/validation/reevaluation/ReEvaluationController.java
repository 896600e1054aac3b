package com.report.validation.reevaluation;

import com.report.validation.api.ValidationOptions;
import com.report.validation.classification.NodeClassifierRegistry;
import com.report.validation.consistency.ConsistencyDelta;
import com.report.validation.consistency.ConsistencyReport;
import com.report.validation.consistency.CrossNodeConsistencyChecker;
import com.report.validation.core.model.Issue;
import com.report.validation.core.model.IssueCategory;
import com.report.validation.core.model.Node;
import com.report.validation.core.model.ValidationResult;
import com.report.validation.core.model.ValidationStatus;
import com.report.validation.decision.ApprovalDecider;
import com.report.validation.decision.ApprovalDecision;
import com.report.validation.decision.BlockingReason;
import com.report.validation.feedback.Feedback;
import com.report.validation.logging.LogContext;
import com.report.validation.metrics.MetricsService;
import com.report.validation.scoring.ConfidenceScorer;
import com.report.validation.scoring.NodeScoringPool;
import com.report.validation.scoring.ScoringContext;
import com.report.validation.tracing.Span;
import com.report.validation.tracing.TracingService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.EnumSet;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.TreeSet;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Re-evaluates a revised report against the snapshot of its previous iteration.
 *
 * <p>Runs {@code ANALYZING -> SELECTIVE_SCORING -> CONSISTENCY_CHECK -> DECIDING}. Only
 * new or modified nodes are fully re-scored. Nodes depending on a change that needs a
 * consistency re-check have their consistency metric re-judged. Every other node carries
 * its previous result forward, unless re-validation of unmodified nodes is enabled. Judge
 * cost therefore scales with the size of the change rather than the size of the report.</p>
 */
public class ReEvaluationController {
    private static final Logger log = LoggerFactory.getLogger(ReEvaluationController.class);

    private static final int JUDGED_METRICS_PER_NODE = (int) Arrays.stream(IssueCategory.values())
            .filter(IssueCategory::isJudged)
            .count();

    private final ConfidenceScorer scorer;
    private final NodeClassifierRegistry classifiers;
    private final NodeScoringPool scoringPool;
    private final CrossNodeConsistencyChecker consistencyChecker;
    private final ChangeDetector changeDetector;
    private final ApprovalDecider decider;
    private final ValidationOptions options;
    private final MetricsService metricsService;
    private final TracingService tracingService;

    public ReEvaluationController(ConfidenceScorer scorer, NodeClassifierRegistry classifiers,
                                  NodeScoringPool scoringPool, CrossNodeConsistencyChecker consistencyChecker,
                                  ChangeDetector changeDetector, ValidationOptions options,
                                  MetricsService metricsService, TracingService tracingService) {
        this.scorer = Objects.requireNonNull(scorer, "scorer is required");
        this.classifiers = Objects.requireNonNull(classifiers, "classifiers is required");
        this.scoringPool = Objects.requireNonNull(scoringPool, "scoringPool is required");
        this.consistencyChecker = Objects.requireNonNull(consistencyChecker, "consistencyChecker is required");
        this.changeDetector = Objects.requireNonNull(changeDetector, "changeDetector is required");
        this.options = Objects.requireNonNull(options, "options is required");
        this.metricsService = Objects.requireNonNull(metricsService, "metricsService is required");
        this.tracingService = Objects.requireNonNull(tracingService, "tracingService is required");
        this.decider = new ApprovalDecider(options.getConfidenceThreshold(),
                options.getConsistencyThreshold(), options.isStrictMode());
    }

    public RevalidationResult revalidate(RevalidationRequest request) {
        Objects.requireNonNull(request, "request is required");
        String workflowId = request.workflowId();
        ValidationSnapshot previous = request.previous();
        List<Node> nodes = request.currentNodes();
        List<RevalidationPhase> trace = new ArrayList<>();
        long start = System.nanoTime();
        long invocationsBefore = scorer.getJudgeInvocationCount();

        try (LogContext ignored = LogContext.forRevalidation(workflowId, request.iteration())) {
            // ANALYZING
            trace.add(RevalidationPhase.ANALYZING);
            ChangeSet changes;
            try (Span span = tracingService.startPhase("revalidation.analyzing", workflowId, request.iteration())) {
                changes = changeDetector.detect(previous.nodes(), nodes);
                span.setAttribute("changes", changes.changes().size());
                span.setAttribute("removed", changes.removedNodeIds().size());
            }

            // SELECTIVE_SCORING
            trace.add(RevalidationPhase.SELECTIVE_SCORING);
            ScoringPlan plan = planScoring(nodes, previous, changes);
            NodeScoringPool.BatchOutcome batch;
            try (Span span = tracingService.startPhase("revalidation.scoring", workflowId, request.iteration())) {
                batch = score(workflowId, nodes, previous, plan);
                span.setAttribute("rescored", plan.fullRescore().size());
                span.setAttribute("consistencyRechecked", plan.consistencyRecheck().size());
                span.setAttribute("carriedForward", plan.carried().size());
            }
            Map<String, ValidationResult> revalidated = new LinkedHashMap<>(batch.results());
            Map<String, ValidationResult> carried = new LinkedHashMap<>();
            for (Node node : nodes) {
                if (plan.carried().contains(node.id())) {
                    carried.put(node.id(), previous.result(node.id()));
                }
            }
            Map<String, ValidationResult> current = new LinkedHashMap<>(revalidated);
            current.putAll(carried);
            metricsService.recordRevalidation(revalidated.size(), carried.size());

            // CONSISTENCY_CHECK
            trace.add(RevalidationPhase.CONSISTENCY_CHECK);
            ConsistencyReport consistency;
            ConsistencyDelta delta;
            try (Span span = tracingService.startPhase("revalidation.consistency", workflowId, request.iteration())) {
                Set<String> changed = new HashSet<>(changes.contentChanged());
                changed.addAll(changes.removedNodeIds());
                consistency = consistencyChecker.recheck(nodes, previous.consistency(), changed,
                        options.getConsistencyDepth());
                delta = ConsistencyDelta.between(previous.consistency(), consistency);
                span.setAttribute("score", consistency.score());
                span.setAttribute("introduced", delta.newlyIntroduced().size());
                span.setAttribute("resolved", delta.newlyResolved().size());
            }

            // DECIDING
            trace.add(RevalidationPhase.DECIDING);
            ApprovalDecision decision;
            try (Span span = tracingService.startPhase("revalidation.deciding", workflowId, request.iteration())) {
                decision = decider.decide(nodes, current, consistency.score());
                span.setAttribute("status", decision.status().name());
            }

            List<Issue> newIssues = newIssues(previous, current);
            List<Issue> resolvedIssues = resolvedIssues(previous, current, changes, batch.failures().keySet());
            List<IntegrityViolation> violations = integrityViolations(previous, nodes, revalidated,
                    plan.consistencyRecheck());
            List<RegressionIssue> regressions = regressions(previous, revalidated, plan.fullRescore(),
                    request.appliedFeedback());
            List<FeedbackEffectiveness> effectiveness = effectiveness(previous, current,
                    request.appliedFeedback(), regressions);

            long invocations = scorer.getJudgeInvocationCount() - invocationsBefore;
            RevalidationMetrics metrics = new RevalidationMetrics(
                    plan.fullRescore().size(), plan.consistencyRecheck().size(), carried.size(), invocations,
                    RevalidationMetrics.costSavings(invocations, nodes.size(), JUDGED_METRICS_PER_NODE),
                    Duration.ofNanos(System.nanoTime() - start));
            trace.add(RevalidationPhase.COMPLETED);

            int previousConfidence = ApprovalDecider.reportConfidence(previous.nodes(), previous.results().values());
            RevalidationResult result = RevalidationResult.builder()
                    .workflowId(workflowId)
                    .iteration(request.iteration())
                    .nodes(nodes)
                    .changes(changes)
                    .revalidatedNodes(revalidated)
                    .unchangedNodes(carried)
                    .failedNodes(batch.failures())
                    .newIssues(newIssues)
                    .resolvedIssues(resolvedIssues)
                    .consistency(consistency)
                    .consistencyDelta(delta)
                    .regressionIssues(regressions)
                    .feedbackEffectiveness(effectiveness)
                    .integrityViolations(violations)
                    .decision(decision)
                    .previousReportConfidence(previousConfidence)
                    .phaseTrace(trace)
                    .metrics(metrics)
                    .recommendedActions(recommendedActions(decision, regressions, violations))
                    .build();

            log.info("Re-evaluation {} iteration {}: status={} confidence={} (was {}), revalidated={}, " +
                            "consistencyRechecked={}, carried={}, judgeCalls={}, regressions={}",
                    workflowId, request.iteration(), decision.status(), decision.reportConfidence(),
                    previousConfidence, plan.fullRescore().size(), plan.consistencyRecheck().size(),
                    carried.size(), invocations, regressions.size());
            return result;
        }
    }

    private ScoringPlan planScoring(List<Node> nodes, ValidationSnapshot previous, ChangeSet changes) {
        Set<String> full = new TreeSet<>(changes.revalidationRequired());
        Set<String> consistencyOnly = new TreeSet<>(changes.consistencyDependents());
        for (String id : changes.consistencyDependents()) {
            if (previous.result(id) == null) {
                consistencyOnly.remove(id);
                full.add(id);
            }
        }
        Set<String> bypass = new TreeSet<>();
        Set<String> carried = new TreeSet<>();
        for (Node node : nodes) {
            String id = node.id();
            if (full.contains(id) || consistencyOnly.contains(id)) {
                continue;
            }
            ValidationResult prior = previous.result(id);
            if (prior == null || !prior.contentHash().equals(node.contentHash())) {
                // no usable prior result, e.g. its scoring failed last iteration
                full.add(id);
            } else if (options.isValidateUnmodifiedNodes()) {
                full.add(id);
                bypass.add(id);
            } else {
                carried.add(id);
            }
        }
        return new ScoringPlan(full, consistencyOnly, bypass, carried);
    }

    private NodeScoringPool.BatchOutcome score(String workflowId, List<Node> nodes, ValidationSnapshot previous,
                                               ScoringPlan plan) {
        Map<String, Node> byId = nodes.stream()
                .collect(Collectors.toMap(Node::id, Function.identity(), (a, b) -> a, LinkedHashMap::new));
        List<Node> toScore = nodes.stream()
                .filter(n -> plan.fullRescore().contains(n.id()) || plan.consistencyRecheck().contains(n.id()))
                .toList();
        return scoringPool.scoreAll(toScore, node -> {
            ScoringContext context = ScoringContext.forNode(workflowId, node, classifiers.classify(node), byId);
            if (plan.consistencyRecheck().contains(node.id())) {
                return scorer.rescoreConsistency(node, previous.result(node.id()), context);
            }
            return scorer.score(node, plan.bypassCache().contains(node.id()) ? context.bypassingCache() : context);
        });
    }

    private static List<Issue> newIssues(ValidationSnapshot previous, Map<String, ValidationResult> current) {
        List<Issue> result = new ArrayList<>();
        current.forEach((nodeId, now) -> {
            Set<String> before = issueIds(previous.result(nodeId));
            now.issues().stream().filter(i -> !before.contains(i.id())).forEach(result::add);
        });
        return result;
    }

    private static List<Issue> resolvedIssues(ValidationSnapshot previous, Map<String, ValidationResult> current,
                                              ChangeSet changes, Set<String> failedNodes) {
        List<Issue> result = new ArrayList<>();
        previous.results().forEach((nodeId, before) -> {
            if (failedNodes.contains(nodeId)) {
                return;
            }
            if (changes.removedNodeIds().contains(nodeId)) {
                result.addAll(before.issues());
                return;
            }
            Set<String> now = issueIds(current.get(nodeId));
            before.issues().stream().filter(i -> !now.contains(i.id())).forEach(result::add);
        });
        return result;
    }

    private List<IntegrityViolation> integrityViolations(ValidationSnapshot previous, List<Node> nodes,
                                                         Map<String, ValidationResult> revalidated,
                                                         Set<String> consistencyRechecked) {
        List<IntegrityViolation> violations = new ArrayList<>();
        for (Node node : nodes) {
            ValidationResult before = previous.result(node.id());
            ValidationResult now = revalidated.get(node.id());
            if (before == null || now == null || !before.contentHash().equals(node.contentHash())) {
                continue;
            }
            Set<String> nowIds = issueIds(now);
            for (Issue issue : before.issues()) {
                boolean relatedContentChanged = issue.category() == IssueCategory.CONSISTENCY
                        && consistencyRechecked.contains(node.id());
                if (!nowIds.contains(issue.id()) && !relatedContentChanged) {
                    IntegrityViolation violation = new IntegrityViolation(node.id(), issue, node.contentHash());
                    log.warn(violation.describe());
                    violations.add(violation);
                }
            }
        }
        return violations;
    }

    private static List<RegressionIssue> regressions(ValidationSnapshot previous,
                                                     Map<String, ValidationResult> revalidated,
                                                     Set<String> fullyRescored, List<Feedback> applied) {
        List<RegressionIssue> regressions = new ArrayList<>();
        for (Map.Entry<String, ValidationResult> entry : revalidated.entrySet()) {
            String nodeId = entry.getKey();
            ValidationResult before = previous.result(nodeId);
            if (before == null || !fullyRescored.contains(nodeId)) {
                continue;
            }
            for (Issue issue : entry.getValue().issues()) {
                boolean existed = before.issues().stream().anyMatch(issue::sameDefectAs);
                if (existed) {
                    continue;
                }
                applied.stream()
                        .filter(f -> f.nodeId().equals(nodeId) && f.category() == issue.category())
                        .findFirst()
                        .ifPresent(f -> regressions.add(new RegressionIssue(nodeId, issue, f.feedbackId(),
                                issue.category(), "Review feedback " + f.feedbackId() + " and adjust its approach to avoid "
                                + issue.category().wireName() + " issues")));
            }
        }
        return regressions;
    }

    private static List<FeedbackEffectiveness> effectiveness(ValidationSnapshot previous,
                                                             Map<String, ValidationResult> current,
                                                             List<Feedback> applied,
                                                             List<RegressionIssue> regressions) {
        List<FeedbackEffectiveness> result = new ArrayList<>();
        for (Feedback feedback : applied) {
            ValidationResult before = previous.result(feedback.nodeId());
            ValidationResult after = current.get(feedback.nodeId());
            if (before == null || after == null) {
                continue;
            }
            int actualGain = after.confidence() - before.confidence();
            int expectedGain = feedback.estimatedConfidenceGain();
            double raw = expectedGain > 0 ? actualGain * 100.0 / expectedGain : 0.0;
            int effectiveness = (int) Math.round(Math.max(0.0, Math.min(100.0, raw)));

            List<String> sideEffects = new ArrayList<>();
            Set<IssueCategory> beforeCategories = before.issues().stream()
                    .map(Issue::category)
                    .collect(Collectors.toCollection(() -> EnumSet.noneOf(IssueCategory.class)));
            Set<IssueCategory> newCategories = after.issues().stream()
                    .map(Issue::category)
                    .filter(c -> !beforeCategories.contains(c))
                    .collect(Collectors.toCollection(() -> EnumSet.noneOf(IssueCategory.class)));
            if (!newCategories.isEmpty()) {
                sideEffects.add("New issues in: " + newCategories.stream()
                        .map(IssueCategory::wireName).collect(Collectors.joining(", ")));
            }
            long caused = regressions.stream().filter(r -> r.causedByFeedbackId().equals(feedback.feedbackId())).count();
            if (caused > 0) {
                sideEffects.add("Introduced " + caused + " regression(s)");
            }

            FeedbackRecommendation recommendation = FeedbackEffectiveness.recommend(raw, actualGain);
            if (caused > 0 && recommendation == FeedbackRecommendation.CONTINUE) {
                recommendation = FeedbackRecommendation.MODIFY;
            }
            result.add(new FeedbackEffectiveness(feedback.feedbackId(), feedback.nodeId(), expectedGain, actualGain,
                    effectiveness, actualGain > 0, recommendation, sideEffects));
        }
        return result;
    }

    static List<String> recommendedActions(ApprovalDecision decision, List<RegressionIssue> regressions,
                                           List<IntegrityViolation> violations) {
        List<String> actions = new ArrayList<>();
        long critical = count(decision, BlockingReason.Kind.CRITICAL_ISSUE);
        long belowThreshold = count(decision, BlockingReason.Kind.BELOW_THRESHOLD);
        if (critical > 0) {
            actions.add("Address " + critical + " critical issue(s) immediately");
        }
        if (belowThreshold > 0) {
            actions.add("Improve " + belowThreshold + " node(s) below the confidence threshold");
        }
        if (count(decision, BlockingReason.Kind.LOW_CONSISTENCY) > 0) {
            actions.add("Address consistency issues across nodes");
        }
        if (count(decision, BlockingReason.Kind.HIGH_SEVERITY_ISSUE) > 0) {
            actions.add("Resolve high-severity issues required by strict mode");
        }
        if (count(decision, BlockingReason.Kind.DEGRADED_SCORE) > 0
                || count(decision, BlockingReason.Kind.MALFORMED_NODE) > 0) {
            actions.add("Re-run validation for nodes without a complete judge verdict");
        }
        if (!regressions.isEmpty()) {
            actions.add("Review " + regressions.stream().map(RegressionIssue::causedByFeedbackId).distinct().count()
                    + " feedback item(s) that introduced regressions");
        }
        if (!violations.isEmpty()) {
            actions.add("Investigate " + violations.size() + " issue(s) that vanished without a content change");
        }
        if (decision.status() == ValidationStatus.APPROVED) {
            actions.add("Report meets quality standards");
        }
        return actions;
    }

    private static long count(ApprovalDecision decision, BlockingReason.Kind kind) {
        return decision.blockingReasons().stream().filter(r -> r.kind() == kind).count();
    }

    private static Set<String> issueIds(ValidationResult result) {
        if (result == null) {
            return Set.of();
        }
        return result.issues().stream().map(Issue::id).collect(Collectors.toSet());
    }

    private record ScoringPlan(Set<String> fullRescore, Set<String> consistencyRecheck,
                               Set<String> bypassCache, Set<String> carried) {
    }
}
