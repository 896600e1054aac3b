package com.report.validation.review;

import java.util.List;

/**
 * Queue of reports awaiting a human decision.
 */
public interface ManualReviewQueue {

    /**
     * Submits a report for review.
     *
     * @param item the review item
     * @return the stored item
     */
    ManualReviewItem submit(ManualReviewItem item);

    /**
     * Pending items, oldest first.
     */
    List<ManualReviewItem> getPending();

    /**
     * Approves a pending item, releasing the report.
     *
     * @throws IllegalArgumentException if no item has this id
     * @throws IllegalStateException    if the item is no longer pending
     */
    void approve(String reviewId, String reviewerId, String notes);

    /**
     * Rejects a pending item.
     *
     * @throws IllegalArgumentException if no item has this id
     * @throws IllegalStateException    if the item is no longer pending
     */
    void reject(String reviewId, String reviewerId, String notes);

    /**
     * @return the item, or null if not found
     */
    ManualReviewItem get(String reviewId);

    long countPending();
}
