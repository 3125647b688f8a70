package com.airwave.resolution.review;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collection;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

/**
 * In-memory implementation of {@link ReviewQueue}.
 * Suitable for testing and single-JVM deployments.
 */
public class InMemoryReviewQueue implements ReviewQueue {
    private static final Logger log = LoggerFactory.getLogger(InMemoryReviewQueue.class);

    private final ConcurrentMap<String, ReviewItem> items = new ConcurrentHashMap<>();
    // signature -> id of its pending item
    private final ConcurrentMap<String, String> pendingBySignature = new ConcurrentHashMap<>();
    // signature -> candidate works a reviewer turned down
    private final ConcurrentMap<String, Set<Long>> rejectedBySignature = new ConcurrentHashMap<>();

    @Override
    public ReviewItem submit(ReviewItem item) {
        // The item is stored before its id becomes visible under the signature
        String pendingId = pendingBySignature.computeIfAbsent(item.getSignature(), signature -> {
            items.put(item.getId(), item);
            return item.getId();
        });
        if (!pendingId.equals(item.getId())) {
            log.debug("Review item for signature '{}' already pending as {}", item.getSignature(), pendingId);
            return items.get(pendingId);
        }
        log.debug("Submitted review item {} (signature={}, candidateWorkId={}, artist={}, title={})",
                item.getId(), item.getSignature(), item.getCandidateWorkId(),
                item.getArtistSimilarity(), item.getTitleSimilarity());
        return item;
    }

    @Override
    public Optional<ReviewItem> findPendingBySignature(String signature) {
        String id = pendingBySignature.get(signature);
        return id != null ? Optional.ofNullable(items.get(id)) : Optional.empty();
    }

    @Override
    public Map<String, Set<Long>> findRejectedCandidates(Collection<String> signatures) {
        Map<String, Set<Long>> rejected = new HashMap<>();
        for (String signature : signatures) {
            Set<Long> workIds = rejectedBySignature.get(signature);
            if (workIds != null && !workIds.isEmpty()) {
                rejected.put(signature, Set.copyOf(workIds));
            }
        }
        return rejected;
    }

    @Override
    public List<ReviewItem> getPending(int limit) {
        return items.values().stream()
                .filter(ReviewItem::isPending)
                .sorted(Comparator.comparing(ReviewItem::getSubmittedAt))
                .limit(limit)
                .toList();
    }

    @Override
    public void approve(String reviewId, String reviewerId, String notes) {
        decide(reviewId, ReviewStatus.APPROVED, reviewerId, notes);
        log.info("Review item {} approved by {}", reviewId, reviewerId);
    }

    @Override
    public void reject(String reviewId, String reviewerId, String notes) {
        decide(reviewId, ReviewStatus.REJECTED, reviewerId, notes);
        log.info("Review item {} rejected by {}", reviewId, reviewerId);
    }

    @Override
    public ReviewItem get(String reviewId) {
        return items.get(reviewId);
    }

    @Override
    public long countPending() {
        return items.values().stream().filter(ReviewItem::isPending).count();
    }

    private void decide(String reviewId, ReviewStatus decision, String reviewerId, String notes) {
        ReviewItem item = items.get(reviewId);
        if (item == null) {
            throw new IllegalArgumentException("Review item not found: " + reviewId);
        }
        if (!item.decide(decision, reviewerId, notes)) {
            throw new IllegalStateException("Review item is not pending: " + reviewId);
        }
        if (decision == ReviewStatus.REJECTED) {
            rejectedBySignature.computeIfAbsent(item.getSignature(), signature -> ConcurrentHashMap.newKeySet())
                    .add(item.getCandidateWorkId());
        }
        pendingBySignature.remove(item.getSignature(), reviewId);
    }
}
