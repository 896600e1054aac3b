package com.report.validation.workflow;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.report.validation.api.ReportValidator;
import com.report.validation.api.ValidationOptions;
import com.report.validation.core.model.IssueCategory;
import com.report.validation.core.model.Report;
import com.report.validation.core.model.ReportKind;
import com.report.validation.core.model.Severity;
import com.report.validation.core.model.ValidationStatus;
import com.report.validation.core.model.WorkflowStatus;
import com.report.validation.decision.BlockingReason;
import com.report.validation.feedback.FeedbackPlan;
import com.report.validation.judge.JudgeFinding;
import com.report.validation.judge.JudgeVerdict;
import com.report.validation.review.ManualReviewItem;
import com.report.validation.support.ScriptedJudgeOracle;
import com.report.validation.support.TestReports;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("WorkflowOrchestrator Tests")
class WorkflowOrchestratorTest {

    private static final String PLANNING_TEXT = "carefully";

    private ScriptedJudgeOracle oracle;
    private ReportValidator validator;
    private Report report;
    private AtomicInteger revisions;

    @BeforeEach
    void setUp() {
        oracle = ScriptedJudgeOracle.scoring(90);
        revisions = new AtomicInteger();
        report = new Report("wf-1", ReportKind.INDIVIDUAL, TestReports.individualReport());
        validator = validator(options().build());
    }

    @AfterEach
    void tearDown() {
        validator.close();
    }

    private static ValidationOptions.Builder options() {
        return ValidationOptions.builder()
                .judgeMaxRetries(1)
                .judgeRetryBackoff(Duration.ZERO)
                .judgeTimeout(Duration.ofSeconds(2));
    }

    private ReportValidator validator(ValidationOptions options) {
        return ReportValidator.builder()
                .judgeOracle(oracle)
                .options(options)
                .build();
    }

    private void replaceValidator(ValidationOptions options) {
        validator.close();
        validator = validator(options);
    }

    /** Clarity of the planning insight is poor while its text says "carefully". */
    private void planningInsightIsJargonHeavy() {
        oracle.respond(request -> request.category() == IssueCategory.CLARITY
                && request.contentFragment().contains(PLANNING_TEXT)
                ? new JudgeVerdict(50, List.of("dense wording"),
                List.of(JudgeFinding.of(Severity.MEDIUM, "Jargon heavy", 5)))
                : JudgeVerdict.clean(90));
    }

    /** Rewrites the planning insight, optionally still containing the flagged wording. */
    private ReportGenerator rewritingPlanningInsight(boolean fixed) {
        return (current, plan) -> {
            int revision = revisions.incrementAndGet();
            JsonNode revised = current.getContent().deepCopy();
            String text = fixed
                    ? "The candidate plans work and meets deadlines."
                    : "The candidate plans work " + PLANNING_TEXT + " in revision " + revision + ".";
            ((ObjectNode) revised.path("insights").get(1)).put("text", text);
            return revised;
        };
    }

    /** Bias of the openness insight is critical while its text says "strong openness"; everything else 95. */
    private void opennessInsightIsCriticallyBiased() {
        oracle.respond(request -> request.category() == IssueCategory.BIAS
                && request.contentFragment().contains("strong openness")
                ? new JudgeVerdict(95, List.of("labels the candidate"),
                List.of(JudgeFinding.of(Severity.CRITICAL, "Stereotyping language", 9)))
                : JudgeVerdict.clean(95));
    }

    @Nested
    @DisplayName("Critical issues")
    class CriticalIssueTests {

        @Test
        @DisplayName("Should fail the iteration on a critical bias issue despite a high average")
        void testCriticalIssueFailsIteration() {
            opennessInsightIsCriticallyBiased();
            ReportGenerator generator = (current, plan) -> {
                ObjectNode revised = current.getContent().deepCopy();
                ((ArrayNode) revised.path("insights"))
                        .set(0, revised.textNode("The candidate shows openness, with an openness score of 72."));
                return revised;
            };

            WorkflowResult result = validator.runWorkflow(report, generator);

            IterationRecord first = result.getIterationHistory().get(0);
            assertEquals(ValidationStatus.FAILED, first.status());
            assertTrue(first.reportConfidence() >= 85);
            assertTrue(first.blockingReasons().stream().anyMatch(reason ->
                    reason.kind() == BlockingReason.Kind.CRITICAL_ISSUE && "insight_0".equals(reason.nodeId())));
            FeedbackPlan plan = first.feedbackPlan();
            assertNotNull(plan);
            assertEquals("insight_0", plan.recommendedSequence().get(0).nodeId());
            assertEquals(IssueCategory.BIAS, plan.recommendedSequence().get(0).category());
            assertEquals(Severity.CRITICAL, plan.recommendedSequence().get(0).severity());

            assertEquals(WorkflowStatus.APPROVED, result.getStatus());
            assertEquals(2, result.getIterations());
        }

        @Test
        @DisplayName("Should end failed and name the critical issue when the budget runs out")
        void testCriticalIssueUnresolved() {
            opennessInsightIsCriticallyBiased();
            replaceValidator(options().maxIterations(1).build());

            WorkflowResult result = validator.runWorkflow(report, rewritingPlanningInsight(true));

            assertEquals(WorkflowStatus.FAILED, result.getStatus());
            assertEquals(TerminationReason.ITERATION_BUDGET_EXHAUSTED, result.getTerminationReason());
            assertEquals(ValidationStatus.FAILED, result.getIterationHistory().get(0).status());
            assertTrue(result.getReportConfidence() >= 85);
            assertTrue(result.getBlockingReasons().stream()
                    .anyMatch(reason -> reason.kind() == BlockingReason.Kind.CRITICAL_ISSUE));
            assertEquals(0, revisions.get());
        }
    }

    @Nested
    @DisplayName("Approval")
    class ApprovalTests {

        @Test
        @DisplayName("Should approve a clean report in the first iteration without revising it")
        void testApprovedFirstIteration() {
            WorkflowResult result = validator.runWorkflow(report, rewritingPlanningInsight(true));

            assertTrue(result.isApproved());
            assertEquals(WorkflowStatus.APPROVED, result.getStatus());
            assertEquals(TerminationReason.THRESHOLD_MET, result.getTerminationReason());
            assertEquals(1, result.getIterations());
            assertEquals(0, revisions.get());
            assertEquals(6, result.getNodeResults().size());
            assertEquals(24, oracle.getCallCount());
            assertTrue(result.getFeedbackPlans().isEmpty());
            assertTrue(result.getReviewItemId().isEmpty());
            assertTrue(result.getBlockingReasons().isEmpty());
            assertFalse(result.isDegraded());
            assertEquals(1, report.getHistory().size());
        }

        @Test
        @DisplayName("Should approve after one revision and re-score only the revised node")
        void testApprovedAfterRevision() {
            planningInsightIsJargonHeavy();

            WorkflowResult result = validator.runWorkflow(report, rewritingPlanningInsight(true));

            assertEquals(WorkflowStatus.APPROVED, result.getStatus());
            assertEquals(2, result.getIterations());
            assertEquals(1, revisions.get());
            assertEquals(28, oracle.getCallCount());
            assertEquals(8, oracle.getCallCount("insight_1"));

            IterationRecord first = result.getIterationHistory().get(0);
            assertEquals(ValidationStatus.REQUIRES_FURTHER_REVISION, first.status());
            assertEquals(6, first.nodesScored());
            FeedbackPlan plan = first.feedbackPlan();
            assertNotNull(plan);
            assertEquals(1, plan.size());
            assertEquals("insight_1", plan.recommendedSequence().get(0).nodeId());
            assertEquals(List.of(plan), result.getFeedbackPlans());

            IterationRecord second = result.getIterationHistory().get(1);
            assertEquals(ValidationStatus.APPROVED, second.status());
            assertEquals(1, second.nodesScored());
            assertNotNull(second.revalidation());
            assertEquals(1, result.getRevalidationHistory().size());
            assertEquals(5, result.getRevalidationHistory().get(0).getMetrics().nodesCarriedForward());

            NodeTrend trend = result.getNodeTrends().get("insight_1");
            assertEquals(List.of(83, 91), trend.confidences());
            assertEquals(NodeTrend.Direction.IMPROVING, trend.direction());
            assertEquals(List.of(IssueCategory.CLARITY), trend.commonIssueCategories());
            assertEquals(2, report.getIteration());
        }
    }

    @Nested
    @DisplayName("Termination")
    class TerminationTests {

        @Test
        @DisplayName("Should route to manual review when the iteration budget runs out")
        void testBudgetExhausted() {
            replaceValidator(options().maxIterations(3).build());
            planningInsightIsJargonHeavy();

            WorkflowResult result = validator.runWorkflow(report, rewritingPlanningInsight(false));

            assertEquals(WorkflowStatus.FAILED, result.getStatus());
            assertEquals(TerminationReason.ITERATION_BUDGET_EXHAUSTED, result.getTerminationReason());
            assertEquals(3, result.getIterations());
            assertEquals(2, revisions.get());
            assertFalse(result.getBlockingReasons().isEmpty());
            assertTrue(result.explain().contains("ITERATION_BUDGET_EXHAUSTED"));

            String reviewId = result.getReviewItemId().orElseThrow();
            ManualReviewItem item = validator.getReviewQueue().get(reviewId);
            assertEquals("wf-1", item.getWorkflowId());
            assertEquals("ITERATION_BUDGET_EXHAUSTED", item.getReason());
            assertEquals(3, item.getIteration());
            assertEquals(result.getReportConfidence(), item.getReportConfidence());
            assertEquals(1, validator.getReviewQueue().countPending());
        }

        @Test
        @DisplayName("Should stop when confidence stops improving")
        void testStagnation() {
            replaceValidator(options().maxIterations(10).maxIterationsWithoutImprovement(2).build());
            planningInsightIsJargonHeavy();

            WorkflowResult result = validator.runWorkflow(report, rewritingPlanningInsight(false));

            assertEquals(TerminationReason.STAGNATION, result.getTerminationReason());
            assertEquals(WorkflowStatus.FAILED, result.getStatus());
            assertEquals(3, result.getIterations());
            assertEquals(2, revisions.get());
            assertTrue(result.getReviewItemId().isPresent());
        }

        @Test
        @DisplayName("Should stop when nothing actionable blocks approval")
        void testNoActionableFeedback() {
            oracle.respond(request -> JudgeVerdict.clean(70));

            WorkflowResult result = validator.runWorkflow(report, rewritingPlanningInsight(true));

            assertEquals(TerminationReason.NO_ACTIONABLE_FEEDBACK, result.getTerminationReason());
            assertEquals(1, result.getIterations());
            assertEquals(0, revisions.get());
            assertEquals(73, result.getReportConfidence());
            assertTrue(result.getIterationHistory().get(0).feedbackPlan().isEmpty());
            assertTrue(result.getReviewItemId().isPresent());
        }

        @Test
        @DisplayName("Should fail without manual review when the generator throws")
        void testGeneratorError() {
            planningInsightIsJargonHeavy();

            WorkflowResult result = validator.runWorkflow(report, (current, plan) -> {
                throw new IllegalStateException("generator offline");
            });

            assertEquals(WorkflowStatus.FAILED, result.getStatus());
            assertEquals(TerminationReason.GENERATOR_ERROR, result.getTerminationReason());
            assertEquals(1, result.getIterations());
            assertEquals(6, result.getNodeResults().size());
            assertEquals(1, result.getFeedbackPlans().size());
            assertTrue(result.getReviewItemId().isEmpty());
            assertEquals(0, validator.getReviewQueue().countPending());
        }

        @Test
        @DisplayName("Should treat missing generator output as a generator error")
        void testGeneratorReturnsNothing() {
            planningInsightIsJargonHeavy();

            WorkflowResult result = validator.runWorkflow(report, (current, plan) -> null);

            assertEquals(TerminationReason.GENERATOR_ERROR, result.getTerminationReason());
            assertEquals(1, report.getIteration());
        }
    }

    @Nested
    @DisplayName("Cancellation")
    class CancellationTests {

        @Test
        @DisplayName("Should not score anything when cancelled before starting")
        void testCancelledBeforeStart() {
            WorkflowHandle handle = new WorkflowHandle("wf-1");
            assertTrue(handle.cancel());
            assertFalse(handle.cancel());

            WorkflowResult result = validator.runWorkflow(report, rewritingPlanningInsight(true), handle);

            assertEquals(WorkflowStatus.CANCELLED, result.getStatus());
            assertEquals(TerminationReason.CANCELLED, result.getTerminationReason());
            assertEquals(0, result.getIterations());
            assertEquals(0, oracle.getCallCount());
            assertEquals(WorkflowPhase.TERMINATED, handle.getPhase());
        }

        @Test
        @DisplayName("Should stop at the next phase boundary after cancellation")
        void testCancelledDuringRevision() {
            planningInsightIsJargonHeavy();
            WorkflowHandle handle = new WorkflowHandle("wf-1");
            ReportGenerator fixing = rewritingPlanningInsight(true);

            WorkflowResult result = validator.runWorkflow(report, (current, plan) -> {
                assertEquals(WorkflowPhase.AWAITING_REVISION, handle.getPhase());
                handle.cancel();
                return fixing.revise(current, plan);
            }, handle);

            assertEquals(WorkflowStatus.CANCELLED, result.getStatus());
            assertEquals(1, result.getIterations());
            assertEquals(24, oracle.getCallCount());
            assertTrue(result.getReviewItemId().isEmpty());
        }

        @Test
        @DisplayName("Should run asynchronously and complete through the future")
        void testAsync() throws Exception {
            ReportValidator.AsyncWorkflow workflow = validator.runWorkflowAsync(report, rewritingPlanningInsight(true));

            WorkflowResult result = workflow.result().get(10, TimeUnit.SECONDS);

            assertEquals(WorkflowStatus.APPROVED, result.getStatus());
            assertEquals("wf-1", workflow.handle().getWorkflowId());
        }
    }

    @Test
    @DisplayName("Should report degraded scores when the judge is down")
    void testJudgeOutage() {
        oracle.setFailing(true);

        WorkflowResult result = validator.runWorkflow(report, rewritingPlanningInsight(true));

        assertTrue(result.isDegraded());
        assertEquals(WorkflowStatus.FAILED, result.getStatus());
        assertEquals(46, result.getReportConfidence());
        assertEquals(6, result.getQualityWarnings().stream()
                .filter(w -> w.kind() == QualityWarning.Kind.DEGRADED_SCORE)
                .count());
        // each judged metric is attempted twice
        assertEquals(48, oracle.getCallCount());
    }
}
