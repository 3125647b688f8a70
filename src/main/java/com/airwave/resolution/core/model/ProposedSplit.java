package com.airwave.resolution.core.model;

import java.time.Instant;
import java.util.List;
import java.util.Objects;

/**
 * A candidate decomposition of a raw artist string into individual artists.
 * Stays non-authoritative until a reviewer approves it.
 */
public record ProposedSplit(
        String rawArtist,
        List<String> proposedArtists,
        SplitStatus status,
        double confidence,
        Instant createdAt
) {
    public ProposedSplit {
        Objects.requireNonNull(rawArtist, "rawArtist is required");
        Objects.requireNonNull(status, "status is required");
        proposedArtists = proposedArtists != null ? List.copyOf(proposedArtists) : List.of();
        if (confidence < 0.0 || confidence > 1.0) {
            throw new IllegalArgumentException("Confidence must be between 0.0 and 1.0");
        }
        if (createdAt == null) {
            createdAt = Instant.now();
        }
    }

    public static ProposedSplit pending(String rawArtist, List<String> proposedArtists, double confidence) {
        return new ProposedSplit(rawArtist, proposedArtists, SplitStatus.PENDING, confidence, Instant.now());
    }

    public boolean isPending() {
        return status == SplitStatus.PENDING;
    }

    public ProposedSplit withStatus(SplitStatus newStatus) {
        return new ProposedSplit(rawArtist, proposedArtists, newStatus, confidence, createdAt);
    }

    public ProposedSplit withProposedArtists(List<String> artists) {
        return new ProposedSplit(rawArtist, artists, status, confidence, createdAt);
    }
}
