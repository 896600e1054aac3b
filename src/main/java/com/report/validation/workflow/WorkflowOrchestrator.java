package com.report.validation.workflow;

import com.fasterxml.jackson.databind.JsonNode;
import com.report.validation.api.ValidationOptions;
import com.report.validation.classification.NodeClassifierRegistry;
import com.report.validation.classification.NodeProfile;
import com.report.validation.consistency.ConsistencyReport;
import com.report.validation.consistency.CrossNodeConsistencyChecker;
import com.report.validation.core.model.Node;
import com.report.validation.core.model.Report;
import com.report.validation.core.model.ValidationResult;
import com.report.validation.core.model.ValidationStatus;
import com.report.validation.core.model.WorkflowStatus;
import com.report.validation.decision.ApprovalDecider;
import com.report.validation.decision.ApprovalDecision;
import com.report.validation.extraction.ExtractionResult;
import com.report.validation.extraction.ExtractionWarning;
import com.report.validation.extraction.NodeExtractor;
import com.report.validation.feedback.Feedback;
import com.report.validation.feedback.FeedbackContext;
import com.report.validation.feedback.FeedbackPlan;
import com.report.validation.feedback.FeedbackSynthesizer;
import com.report.validation.logging.LogContext;
import com.report.validation.metrics.MetricsService;
import com.report.validation.reevaluation.IntegrityViolation;
import com.report.validation.reevaluation.ReEvaluationController;
import com.report.validation.reevaluation.RevalidationRequest;
import com.report.validation.reevaluation.RevalidationResult;
import com.report.validation.reevaluation.ValidationSnapshot;
import com.report.validation.review.ManualReviewItem;
import com.report.validation.review.ManualReviewQueue;
import com.report.validation.scoring.ConfidenceScorer;
import com.report.validation.scoring.NodeScoringPool;
import com.report.validation.scoring.ScoringContext;
import com.report.validation.tracing.Span;
import com.report.validation.tracing.TracingService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Drives a report through the bounded validate / feedback / revise loop.
 *
 * <p>Each iteration extracts the nodes of the current content, scores them (all nodes in
 * the first iteration, only the affected ones afterwards), decides, and when not
 * approved synthesizes a feedback plan and asks the generator for a revision. The loop
 * is an explicit state machine bounded by {@code maxIterations}: it terminates on
 * approval, budget exhaustion, stagnation, an empty plan, a generator failure or
 * cancellation. Failures are reported as data on the {@link WorkflowResult}; nothing
 * escapes {@link #run}.</p>
 */
public class WorkflowOrchestrator {
    private static final Logger log = LoggerFactory.getLogger(WorkflowOrchestrator.class);

    private final NodeExtractor extractor;
    private final NodeClassifierRegistry classifiers;
    private final ConfidenceScorer scorer;
    private final NodeScoringPool scoringPool;
    private final CrossNodeConsistencyChecker consistencyChecker;
    private final FeedbackSynthesizer synthesizer;
    private final ReEvaluationController reEvaluationController;
    private final ManualReviewQueue reviewQueue;
    private final ValidationOptions options;
    private final ApprovalDecider decider;
    private final NodeTrendAnalyzer trendAnalyzer = new NodeTrendAnalyzer();
    private final MetricsService metricsService;
    private final TracingService tracingService;

    public WorkflowOrchestrator(NodeExtractor extractor, NodeClassifierRegistry classifiers,
                                ConfidenceScorer scorer, NodeScoringPool scoringPool,
                                CrossNodeConsistencyChecker consistencyChecker, FeedbackSynthesizer synthesizer,
                                ReEvaluationController reEvaluationController, ManualReviewQueue reviewQueue,
                                ValidationOptions options, MetricsService metricsService,
                                TracingService tracingService) {
        this.extractor = Objects.requireNonNull(extractor, "extractor is required");
        this.classifiers = Objects.requireNonNull(classifiers, "classifiers is required");
        this.scorer = Objects.requireNonNull(scorer, "scorer is required");
        this.scoringPool = Objects.requireNonNull(scoringPool, "scoringPool is required");
        this.consistencyChecker = Objects.requireNonNull(consistencyChecker, "consistencyChecker is required");
        this.synthesizer = Objects.requireNonNull(synthesizer, "synthesizer is required");
        this.reEvaluationController = Objects.requireNonNull(reEvaluationController,
                "reEvaluationController is required");
        this.reviewQueue = Objects.requireNonNull(reviewQueue, "reviewQueue is required");
        this.options = Objects.requireNonNull(options, "options is required");
        this.metricsService = Objects.requireNonNull(metricsService, "metricsService is required");
        this.tracingService = Objects.requireNonNull(tracingService, "tracingService is required");
        this.decider = new ApprovalDecider(options.getConfidenceThreshold(),
                options.getConsistencyThreshold(), options.isStrictMode());
    }

    public WorkflowResult run(Report report, ReportGenerator generator) {
        return run(report, generator, new WorkflowHandle(report.getWorkflowId()));
    }

    /**
     * Runs the workflow to a terminal state. The report is revised in place and keeps
     * the per-iteration result history.
     */
    public WorkflowResult run(Report report, ReportGenerator generator, WorkflowHandle handle) {
        Objects.requireNonNull(report, "report is required");
        Objects.requireNonNull(generator, "generator is required");
        Objects.requireNonNull(handle, "handle is required");
        Run run = new Run(report, handle);

        try (Span span = tracingService.startSpan("report.workflow",
                Map.of("workflowId", report.getWorkflowId(), "reportKind", report.getKind().name()))) {
            WorkflowResult result = loop(run, generator);
            span.setAttribute("status", result.getStatus().name());
            span.setAttribute("iterations", result.getIterations());
            span.setStatus(result.getStatus() == WorkflowStatus.APPROVED ? Span.SpanStatus.OK : Span.SpanStatus.ERROR);
            metricsService.recordWorkflowCompleted(result.getStatus(), result.getIterations());
            return result;
        }
    }

    private WorkflowResult loop(Run run, ReportGenerator generator) {
        Report report = run.report;
        while (true) {
            int iteration = report.getIteration();
            try (LogContext ignored = LogContext.forWorkflow(report.getWorkflowId(), iteration)) {
                if (run.handle.isCancelled()) {
                    return finish(run, TerminationReason.CANCELLED);
                }

                run.enter(WorkflowPhase.EXTRACTING);
                ExtractionResult extraction = extractor.extract(report);
                for (ExtractionWarning warning : extraction.warnings()) {
                    run.warnings.add(new QualityWarning(QualityWarning.Kind.EXTRACTION, iteration, null,
                            warning.kind() + " at " + warning.region() + ": " + warning.message()));
                }
                if (run.handle.isCancelled()) {
                    return finish(run, TerminationReason.CANCELLED);
                }

                IterationRecord outcome = run.snapshot == null
                        ? initialValidation(run, extraction.nodes())
                        : reEvaluation(run, extraction.nodes());
                report.recordResults(run.snapshot.results());
                run.iterations.add(outcome);
                run.lastDecisionIteration = iteration;
                log.info("Iteration {} of {}: status={} confidence={} consistency={} blocking={}",
                        iteration, report.getWorkflowId(), outcome.status(), outcome.reportConfidence(),
                        outcome.consistencyScore(), outcome.blockingReasons().size());

                if (outcome.status() == ValidationStatus.APPROVED) {
                    return finish(run, TerminationReason.THRESHOLD_MET);
                }
                if (iteration >= options.getMaxIterations()) {
                    return finish(run, TerminationReason.ITERATION_BUDGET_EXHAUSTED);
                }
                if (run.stagnated(outcome.reportConfidence(), options.getMaxIterationsWithoutImprovement())) {
                    return finish(run, TerminationReason.STAGNATION);
                }
                if (run.handle.isCancelled()) {
                    return finish(run, TerminationReason.CANCELLED);
                }

                run.enter(WorkflowPhase.SYNTHESIZING_FEEDBACK);
                FeedbackPlan plan = synthesizeFeedback(run);
                run.iterations.set(run.iterations.size() - 1, outcome.withFeedbackPlan(plan));
                if (plan.isEmpty()) {
                    return finish(run, TerminationReason.NO_ACTIONABLE_FEEDBACK);
                }
                run.plans.add(plan);
                if (run.handle.isCancelled()) {
                    return finish(run, TerminationReason.CANCELLED);
                }

                run.enter(WorkflowPhase.AWAITING_REVISION);
                JsonNode revised;
                try (Span span = tracingService.startPhase("revision", report.getWorkflowId(), iteration)) {
                    try {
                        revised = generator.revise(report, plan);
                    } catch (RuntimeException e) {
                        span.recordException(e);
                        log.error("Generator failed for workflow {} at iteration {}: {}",
                                report.getWorkflowId(), iteration, e.getMessage(), e);
                        run.generatorError = e.toString();
                        return finish(run, TerminationReason.GENERATOR_ERROR);
                    }
                }
                if (revised == null) {
                    run.generatorError = "Generator returned no content";
                    return finish(run, TerminationReason.GENERATOR_ERROR);
                }
                run.appliedFeedback = plan.recommendedSequence();
                report.revise(revised);
            }
        }
    }

    private IterationRecord initialValidation(Run run, List<Node> nodes) {
        String workflowId = run.report.getWorkflowId();
        int iteration = run.report.getIteration();
        run.enter(WorkflowPhase.SCORING);

        Map<String, Node> byId = nodes.stream()
                .collect(Collectors.toMap(Node::id, Function.identity(), (a, b) -> a, LinkedHashMap::new));
        NodeScoringPool.BatchOutcome batch;
        try (Span span = tracingService.startPhase("scoring", workflowId, iteration)) {
            batch = scoringPool.scoreAll(nodes, node ->
                    scorer.score(node, ScoringContext.forNode(workflowId, node, classifiers.classify(node), byId)));
            span.setAttribute("nodes", nodes.size());
            span.setAttribute("failures", batch.failures().size());
        }
        batch.failures().forEach((nodeId, error) -> run.warnings.add(
                new QualityWarning(QualityWarning.Kind.SCORING_FAILURE, iteration, nodeId, error)));
        warnDegraded(run, batch.results(), iteration);

        ConsistencyReport consistency;
        ApprovalDecision decision;
        try (Span span = tracingService.startPhase("deciding", workflowId, iteration)) {
            consistency = consistencyChecker.checkAll(nodes);
            decision = decider.decide(nodes, batch.results(), consistency.score());
            span.setAttribute("status", decision.status().name());
        }
        run.snapshot = new ValidationSnapshot(iteration, nodes, batch.results(), consistency);
        run.decision = decision;
        return new IterationRecord(iteration, decision.status(), decision.reportConfidence(), consistency.score(),
                nodes.size(), decision.blockingReasons(), null, null);
    }

    private IterationRecord reEvaluation(Run run, List<Node> nodes) {
        int iteration = run.report.getIteration();
        run.enter(WorkflowPhase.REEVALUATING);
        RevalidationResult revalidation = reEvaluationController.revalidate(new RevalidationRequest(
                run.report.getWorkflowId(), iteration, run.snapshot, nodes, run.appliedFeedback));
        run.revalidations.add(revalidation);

        revalidation.getFailedNodes().forEach((nodeId, error) -> run.warnings.add(
                new QualityWarning(QualityWarning.Kind.SCORING_FAILURE, iteration, nodeId, error)));
        warnDegraded(run, revalidation.getRevalidatedNodes(), iteration);
        for (IntegrityViolation violation : revalidation.getIntegrityViolations()) {
            run.warnings.add(new QualityWarning(QualityWarning.Kind.INTEGRITY_VIOLATION, iteration,
                    violation.nodeId(), violation.describe()));
        }

        run.snapshot = revalidation.toSnapshot();
        run.decision = revalidation.getDecision();
        return new IterationRecord(iteration, revalidation.getStatus(), revalidation.getReportConfidence(),
                revalidation.getConsistency().score(),
                revalidation.getMetrics().nodesRevalidated() + revalidation.getMetrics().nodesConsistencyRechecked(),
                revalidation.getDecision().blockingReasons(), null, revalidation);
    }

    private FeedbackPlan synthesizeFeedback(Run run) {
        String workflowId = run.report.getWorkflowId();
        try (Span span = tracingService.startPhase("feedback", workflowId, run.report.getIteration())) {
            List<Feedback> items = new ArrayList<>();
            for (Node node : run.snapshot.nodes()) {
                ValidationResult result = run.snapshot.result(node.id());
                if (result == null || result.issues().isEmpty()) {
                    continue;
                }
                NodeProfile profile = classifiers.classify(node);
                items.addAll(synthesizer.synthesize(result, node,
                        new FeedbackContext(options.getConfidenceThreshold(), profile.criticality())));
            }
            FeedbackPlan plan = synthesizer.plan(items);
            span.setAttribute("items", plan.size());
            return plan;
        }
    }

    private static void warnDegraded(Run run, Map<String, ValidationResult> results, int iteration) {
        results.forEach((nodeId, result) -> {
            if (result.isDegraded()) {
                run.warnings.add(new QualityWarning(QualityWarning.Kind.DEGRADED_SCORE, iteration, nodeId,
                        "Judge unavailable for at least one metric; degraded score used"));
            }
        });
    }

    private WorkflowResult finish(Run run, TerminationReason reason) {
        run.enter(WorkflowPhase.TERMINATED);
        WorkflowStatus status = switch (reason) {
            case THRESHOLD_MET -> WorkflowStatus.APPROVED;
            case CANCELLED -> WorkflowStatus.CANCELLED;
            default -> WorkflowStatus.FAILED;
        };
        int confidence = run.decision != null ? run.decision.reportConfidence() : 0;

        String reviewItemId = null;
        if (reason.routesToManualReview()) {
            ManualReviewItem item = reviewQueue.submit(ManualReviewItem.builder()
                    .workflowId(run.report.getWorkflowId())
                    .reason(reason.name())
                    .iteration(run.lastDecisionIteration)
                    .reportConfidence(confidence)
                    .blockingReasons(run.decision != null ? run.decision.blockingReasons() : List.of())
                    .build());
            reviewItemId = item.getId();
        }

        WorkflowResult result = WorkflowResult.builder()
                .workflowId(run.report.getWorkflowId())
                .status(status)
                .terminationReason(reason)
                .iterations(run.lastDecisionIteration)
                .reportConfidence(confidence)
                .consistencyScore(run.snapshot != null ? run.snapshot.consistency().score() : 0)
                .nodeResults(run.snapshot != null ? run.snapshot.results() : Map.of())
                .blockingReasons(run.decision != null ? run.decision.blockingReasons() : List.of())
                .feedbackPlans(run.plans)
                .revalidationHistory(run.revalidations)
                .iterationHistory(run.iterations)
                .qualityWarnings(run.warnings)
                .nodeTrends(trendAnalyzer.analyze(run.report))
                .reviewItemId(reviewItemId)
                .duration(Duration.ofNanos(System.nanoTime() - run.startNanos))
                .build();

        if (run.generatorError != null) {
            log.warn("Workflow {} failed: generator error after iteration {}: {}",
                    run.report.getWorkflowId(), run.lastDecisionIteration, run.generatorError);
        }
        log.info(result.explain());
        return result;
    }

    /**
     * Mutable state of one workflow run, confined to the thread driving it.
     */
    private static final class Run {
        private final Report report;
        private final WorkflowHandle handle;
        private final long startNanos = System.nanoTime();
        private final List<IterationRecord> iterations = new ArrayList<>();
        private final List<FeedbackPlan> plans = new ArrayList<>();
        private final List<RevalidationResult> revalidations = new ArrayList<>();
        private final List<QualityWarning> warnings = new ArrayList<>();
        private ValidationSnapshot snapshot;
        private ApprovalDecision decision;
        private List<Feedback> appliedFeedback = List.of();
        private int lastDecisionIteration;
        private int bestConfidence = -1;
        private int iterationsWithoutImprovement;
        private String generatorError;

        private Run(Report report, WorkflowHandle handle) {
            this.report = report;
            this.handle = handle;
        }

        private void enter(WorkflowPhase phase) {
            handle.enter(phase, report.getIteration());
        }

        private boolean stagnated(int confidence, int limit) {
            if (confidence > bestConfidence) {
                bestConfidence = confidence;
                iterationsWithoutImprovement = 0;
                return false;
            }
            iterationsWithoutImprovement++;
            return iterationsWithoutImprovement >= limit;
        }
    }
}
