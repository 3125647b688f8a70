package com.airwave.resolution.review;

import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Queue of match decisions waiting for a human.
 * At most one item per signature is pending at any time. A rejection is
 * remembered per signature and candidate work so the pair is not queued again.
 */
public interface ReviewQueue {

    /**
     * Submits a review item. If an item for the same signature is already pending,
     * that item is returned and the new one is discarded.
     *
     * @param item the review item to submit
     * @return the pending item for the item's signature
     */
    ReviewItem submit(ReviewItem item);

    Optional<ReviewItem> findPendingBySignature(String signature);

    /**
     * Looks up the candidate works a reviewer has rejected for each signature.
     * Signatures without rejections are absent from the result.
     */
    Map<String, Set<Long>> findRejectedCandidates(Collection<String> signatures);

    /**
     * Gets pending items, oldest first.
     *
     * @param limit maximum number of items to return
     */
    List<ReviewItem> getPending(int limit);

    /**
     * @throws IllegalArgumentException if the item does not exist
     * @throws IllegalStateException    if the item is not pending
     */
    void approve(String reviewId, String reviewerId, String notes);

    /**
     * @throws IllegalArgumentException if the item does not exist
     * @throws IllegalStateException    if the item is not pending
     */
    void reject(String reviewId, String reviewerId, String notes);

    /**
     * @return the review item, or null if not found
     */
    ReviewItem get(String reviewId);

    long countPending();
}
