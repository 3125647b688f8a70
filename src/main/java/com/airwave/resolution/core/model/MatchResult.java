package com.airwave.resolution.core.model;

import java.util.Objects;
import java.util.Optional;

/**
 * Outcome of matching one artist/title pair.
 * Matched outcomes carry a work id; unmatched outcomes ({@link MatchReason#NO_MATCH},
 * {@link MatchReason#NEEDS_REVIEW}) never do.
 */
public record MatchResult(
        Long workId,
        MatchReason reason,
        double confidence,
        String detail
) {
    public MatchResult {
        Objects.requireNonNull(reason, "reason is required");
        if (confidence < 0.0 || confidence > 1.0) {
            throw new IllegalArgumentException("Confidence must be between 0.0 and 1.0");
        }
        if (reason.isMatched() && workId == null) {
            throw new IllegalArgumentException("Matched result requires a workId");
        }
        if (!reason.isMatched() && workId != null) {
            throw new IllegalArgumentException("Unmatched result cannot carry a workId");
        }
    }

    public static MatchResult matched(long workId, MatchReason reason, double confidence) {
        return new MatchResult(workId, reason, confidence, null);
    }

    public static MatchResult matched(long workId, MatchReason reason, double confidence, String detail) {
        return new MatchResult(workId, reason, confidence, detail);
    }

    public static MatchResult noMatch() {
        return new MatchResult(null, MatchReason.NO_MATCH, 0.0, null);
    }

    public static MatchResult needsReview(String detail) {
        return new MatchResult(null, MatchReason.NEEDS_REVIEW, 0.0, detail);
    }

    public boolean isMatched() {
        return reason.isMatched();
    }

    public boolean requiresReview() {
        return reason == MatchReason.NEEDS_REVIEW;
    }

    public Optional<Long> workIdOptional() {
        return Optional.ofNullable(workId);
    }

    /**
     * The human-readable reason string persisted on broadcast logs.
     */
    public String label() {
        return reason.getLabel();
    }
}
