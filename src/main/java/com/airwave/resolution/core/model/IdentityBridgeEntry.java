package com.airwave.resolution.core.model;

import java.time.Instant;
import java.util.Objects;

/**
 * A verified mapping from a normalized signature to a canonical work.
 * Entries are never overwritten; revocation is the only permitted mutation.
 */
public class IdentityBridgeEntry {
    private final Long id;
    private final String signature;
    private final String referenceArtist;
    private final String referenceTitle;
    private final long workId;
    private final double confidence;
    private final boolean revoked;
    private final Instant createdAt;
    private final Instant revokedAt;
    private final String revokedBy;

    private IdentityBridgeEntry(Builder builder) {
        this.id = builder.id;
        this.signature = builder.signature;
        this.referenceArtist = builder.referenceArtist;
        this.referenceTitle = builder.referenceTitle;
        this.workId = builder.workId;
        this.confidence = builder.confidence;
        this.revoked = builder.revoked;
        this.createdAt = builder.createdAt != null ? builder.createdAt : Instant.now();
        this.revokedAt = builder.revokedAt;
        this.revokedBy = builder.revokedBy;
    }

    public Long getId() {
        return id;
    }

    public String getSignature() {
        return signature;
    }

    public String getReferenceArtist() {
        return referenceArtist;
    }

    public String getReferenceTitle() {
        return referenceTitle;
    }

    public long getWorkId() {
        return workId;
    }

    public double getConfidence() {
        return confidence;
    }

    public boolean isRevoked() {
        return revoked;
    }

    public boolean isActive() {
        return !revoked;
    }

    public Instant getCreatedAt() {
        return createdAt;
    }

    public Instant getRevokedAt() {
        return revokedAt;
    }

    public String getRevokedBy() {
        return revokedBy;
    }

    /**
     * Returns a revoked copy of this entry.
     */
    public IdentityBridgeEntry revoke(String actor, Instant at) {
        return builder(this)
                .revoked(true)
                .revokedBy(actor)
                .revokedAt(at)
                .build();
    }

    /**
     * Returns a copy carrying the storage-assigned id.
     */
    public IdentityBridgeEntry withId(Long id) {
        return builder(this).id(id).build();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        IdentityBridgeEntry that = (IdentityBridgeEntry) o;
        return Objects.equals(signature, that.signature);
    }

    @Override
    public int hashCode() {
        return Objects.hash(signature);
    }

    @Override
    public String toString() {
        return "IdentityBridgeEntry{" +
                "signature='" + signature + '\'' +
                ", workId=" + workId +
                ", confidence=" + confidence +
                ", revoked=" + revoked +
                '}';
    }

    public static Builder builder() {
        return new Builder();
    }

    public static Builder builder(IdentityBridgeEntry entry) {
        return new Builder()
                .id(entry.id)
                .signature(entry.signature)
                .referenceArtist(entry.referenceArtist)
                .referenceTitle(entry.referenceTitle)
                .workId(entry.workId)
                .confidence(entry.confidence)
                .revoked(entry.revoked)
                .createdAt(entry.createdAt)
                .revokedAt(entry.revokedAt)
                .revokedBy(entry.revokedBy);
    }

    public static class Builder {
        private Long id;
        private String signature;
        private String referenceArtist;
        private String referenceTitle;
        private long workId;
        private double confidence = 1.0;
        private boolean revoked;
        private Instant createdAt;
        private Instant revokedAt;
        private String revokedBy;

        public Builder id(Long id) {
            this.id = id;
            return this;
        }

        public Builder signature(String signature) {
            this.signature = signature;
            return this;
        }

        public Builder referenceArtist(String referenceArtist) {
            this.referenceArtist = referenceArtist;
            return this;
        }

        public Builder referenceTitle(String referenceTitle) {
            this.referenceTitle = referenceTitle;
            return this;
        }

        public Builder workId(long workId) {
            this.workId = workId;
            return this;
        }

        public Builder confidence(double confidence) {
            this.confidence = confidence;
            return this;
        }

        public Builder revoked(boolean revoked) {
            this.revoked = revoked;
            return this;
        }

        public Builder createdAt(Instant createdAt) {
            this.createdAt = createdAt;
            return this;
        }

        public Builder revokedAt(Instant revokedAt) {
            this.revokedAt = revokedAt;
            return this;
        }

        public Builder revokedBy(String revokedBy) {
            this.revokedBy = revokedBy;
            return this;
        }

        public IdentityBridgeEntry build() {
            Objects.requireNonNull(signature, "signature is required");
            if (confidence < 0.0 || confidence > 1.0) {
                throw new IllegalArgumentException("Confidence must be between 0.0 and 1.0");
            }
            return new IdentityBridgeEntry(this);
        }
    }
}
