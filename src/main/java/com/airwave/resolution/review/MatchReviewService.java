package com.airwave.resolution.review;

import com.airwave.resolution.audit.AuditAction;
import com.airwave.resolution.audit.AuditService;
import com.airwave.resolution.cache.IdentityBridgeCache;
import com.airwave.resolution.core.model.IdentityBridgeEntry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Coordinates the match review queue with the identity bridge and audit trail.
 * An approved item becomes a human-verified bridge entry, so the next play of
 * the same pair resolves at the bridge stage.
 */
public class MatchReviewService {
    private static final Logger log = LoggerFactory.getLogger(MatchReviewService.class);

    static final double VERIFIED_CONFIDENCE = 1.0;

    private final ReviewQueue reviewQueue;
    private final IdentityBridgeCache bridgeCache;
    private final AuditService auditService;

    public MatchReviewService(ReviewQueue reviewQueue, IdentityBridgeCache bridgeCache, AuditService auditService) {
        this.reviewQueue = Objects.requireNonNull(reviewQueue, "reviewQueue is required");
        this.bridgeCache = Objects.requireNonNull(bridgeCache, "bridgeCache is required");
        this.auditService = Objects.requireNonNull(auditService, "auditService is required");
    }

    /**
     * Queues the item unless its signature already has a pending item.
     *
     * @return the pending item for the signature
     */
    public ReviewItem submitForReview(ReviewItem item) {
        ReviewItem pending = reviewQueue.submit(item);
        if (pending.getId().equals(item.getId())) {
            auditService.record(AuditAction.MATCH_REVIEW_REQUESTED, item.getSignature(), null, Map.of(
                    "reviewItemId", item.getId(),
                    "candidateWorkId", item.getCandidateWorkId(),
                    "artistSimilarity", item.getArtistSimilarity(),
                    "titleSimilarity", item.getTitleSimilarity()));
            log.info("review.submitted reviewItemId={} signature='{}' candidateWorkId={}",
                    item.getId(), item.getSignature(), item.getCandidateWorkId());
        }
        return pending;
    }

    /**
     * Approves the item and bridges its signature to the candidate work.
     * The item stays pending if the bridge cannot be recorded.
     *
     * @throws com.airwave.resolution.cache.DuplicateSignatureException if the signature
     *         is already bridged to a different work
     */
    public IdentityBridgeEntry approve(String reviewId, String reviewerId, String notes) {
        ReviewItem item = requirePending(reviewId);

        IdentityBridgeEntry entry = bridgeCache.record(item.getSignature(), item.getRawArtist(),
                item.getRawTitle(), item.getCandidateWorkId(), VERIFIED_CONFIDENCE);
        reviewQueue.approve(reviewId, reviewerId, notes);

        auditService.record(AuditAction.MATCH_REVIEW_COMPLETED, item.getSignature(), reviewerId, Map.of(
                "reviewItemId", reviewId,
                "decision", ReviewStatus.APPROVED.name(),
                "candidateWorkId", item.getCandidateWorkId(),
                "notes", notes != null ? notes : ""));
        log.info("review.approved reviewItemId={} signature='{}' workId={}",
                reviewId, item.getSignature(), entry.getWorkId());
        return entry;
    }

    public void reject(String reviewId, String reviewerId, String notes) {
        ReviewItem item = requirePending(reviewId);
        reviewQueue.reject(reviewId, reviewerId, notes);

        auditService.record(AuditAction.MATCH_REVIEW_COMPLETED, item.getSignature(), reviewerId, Map.of(
                "reviewItemId", reviewId,
                "decision", ReviewStatus.REJECTED.name(),
                "candidateWorkId", item.getCandidateWorkId(),
                "notes", notes != null ? notes : ""));
        log.info("review.rejected reviewItemId={} signature='{}' candidateWorkId={}",
                reviewId, item.getSignature(), item.getCandidateWorkId());
    }

    /**
     * @return signature to the candidate works rejected for it
     */
    public Map<String, Set<Long>> findRejectedCandidates(Collection<String> signatures) {
        return signatures.isEmpty() ? Map.of() : reviewQueue.findRejectedCandidates(signatures);
    }

    public List<ReviewItem> getPendingReviews(int limit) {
        return reviewQueue.getPending(limit);
    }

    public ReviewQueue getReviewQueue() {
        return reviewQueue;
    }

    private ReviewItem requirePending(String reviewId) {
        ReviewItem item = reviewQueue.get(reviewId);
        if (item == null) {
            throw new IllegalArgumentException("Review item not found: " + reviewId);
        }
        if (!item.isPending()) {
            throw new IllegalStateException("Review item is not pending: " + reviewId);
        }
        return item;
    }
}
