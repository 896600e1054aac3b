package com.report.validation.review;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Comparator;
import java.util.List;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

/**
 * In-memory {@link ManualReviewQueue}. Suitable for testing and single-JVM deployments.
 */
public class InMemoryManualReviewQueue implements ManualReviewQueue {
    private static final Logger log = LoggerFactory.getLogger(InMemoryManualReviewQueue.class);

    private final ConcurrentMap<String, ManualReviewItem> items = new ConcurrentHashMap<>();

    @Override
    public ManualReviewItem submit(ManualReviewItem item) {
        items.put(item.getId(), item);
        log.info("Report of workflow {} submitted for manual review ({}): {} blocking reason(s)",
                item.getWorkflowId(), item.getReason(), item.getBlockingReasons().size());
        return item;
    }

    @Override
    public List<ManualReviewItem> getPending() {
        return items.values().stream()
                .filter(ManualReviewItem::isPending)
                .sorted(Comparator.comparing(ManualReviewItem::getSubmittedAt))
                .toList();
    }

    @Override
    public void approve(String reviewId, String reviewerId, String notes) {
        require(reviewId).resolve(ReviewStatus.APPROVED, reviewerId, notes);
        log.info("Review item {} approved by {}", reviewId, reviewerId);
    }

    @Override
    public void reject(String reviewId, String reviewerId, String notes) {
        require(reviewId).resolve(ReviewStatus.REJECTED, reviewerId, notes);
        log.info("Review item {} rejected by {}", reviewId, reviewerId);
    }

    @Override
    public ManualReviewItem get(String reviewId) {
        return items.get(reviewId);
    }

    @Override
    public long countPending() {
        return items.values().stream().filter(ManualReviewItem::isPending).count();
    }

    private ManualReviewItem require(String reviewId) {
        ManualReviewItem item = items.get(reviewId);
        if (item == null) {
            throw new IllegalArgumentException("Review item not found: " + reviewId);
        }
        return item;
    }
}
