package com.report.validation.review;

import com.report.validation.decision.BlockingReason;

import java.time.Instant;
import java.util.List;
import java.util.Objects;
import java.util.UUID;

/**
 * A report routed to a human reviewer because the automated loop could not approve it.
 * Carries the blocking reasons of the last iteration so the reviewer sees what is left.
 */
public class ManualReviewItem {

    private final String id;
    private final String workflowId;
    private final String reason;
    private final int iteration;
    private final int reportConfidence;
    private final List<BlockingReason> blockingReasons;
    private ReviewStatus status;
    private final Instant submittedAt;
    private Instant reviewedAt;
    private String reviewerId;
    private String notes;

    private ManualReviewItem(Builder builder) {
        this.id = builder.id != null ? builder.id : UUID.randomUUID().toString();
        this.workflowId = Objects.requireNonNull(builder.workflowId, "workflowId is required");
        this.reason = Objects.requireNonNull(builder.reason, "reason is required");
        this.iteration = builder.iteration;
        this.reportConfidence = builder.reportConfidence;
        this.blockingReasons = builder.blockingReasons != null ? List.copyOf(builder.blockingReasons) : List.of();
        this.status = ReviewStatus.PENDING;
        this.submittedAt = builder.submittedAt != null ? builder.submittedAt : Instant.now();
    }

    public String getId() {
        return id;
    }

    public String getWorkflowId() {
        return workflowId;
    }

    public String getReason() {
        return reason;
    }

    public int getIteration() {
        return iteration;
    }

    public int getReportConfidence() {
        return reportConfidence;
    }

    public List<BlockingReason> getBlockingReasons() {
        return blockingReasons;
    }

    public synchronized ReviewStatus getStatus() {
        return status;
    }

    public Instant getSubmittedAt() {
        return submittedAt;
    }

    public synchronized Instant getReviewedAt() {
        return reviewedAt;
    }

    public synchronized String getReviewerId() {
        return reviewerId;
    }

    public synchronized String getNotes() {
        return notes;
    }

    public synchronized boolean isPending() {
        return status == ReviewStatus.PENDING;
    }

    synchronized void resolve(ReviewStatus outcome, String reviewerId, String notes) {
        if (status != ReviewStatus.PENDING) {
            throw new IllegalStateException("Review item is not pending: " + id);
        }
        this.status = outcome;
        this.reviewedAt = Instant.now();
        this.reviewerId = reviewerId;
        this.notes = notes;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        ManualReviewItem that = (ManualReviewItem) o;
        return Objects.equals(id, that.id);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id);
    }

    @Override
    public String toString() {
        return "ManualReviewItem{" +
                "id='" + id + '\'' +
                ", workflowId='" + workflowId + '\'' +
                ", reason=" + reason +
                ", iteration=" + iteration +
                ", confidence=" + reportConfidence +
                ", status=" + getStatus() +
                '}';
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private String id;
        private String workflowId;
        private String reason;
        private int iteration;
        private int reportConfidence;
        private List<BlockingReason> blockingReasons;
        private Instant submittedAt;

        public Builder id(String id) {
            this.id = id;
            return this;
        }

        public Builder workflowId(String workflowId) {
            this.workflowId = workflowId;
            return this;
        }

        public Builder reason(String reason) {
            this.reason = reason;
            return this;
        }

        public Builder iteration(int iteration) {
            this.iteration = iteration;
            return this;
        }

        public Builder reportConfidence(int reportConfidence) {
            this.reportConfidence = reportConfidence;
            return this;
        }

        public Builder blockingReasons(List<BlockingReason> blockingReasons) {
            this.blockingReasons = blockingReasons;
            return this;
        }

        public Builder submittedAt(Instant submittedAt) {
            this.submittedAt = submittedAt;
            return this;
        }

        public ManualReviewItem build() {
            return new ManualReviewItem(this);
        }
    }
}
