package com.airwave.resolution.review;

import java.time.Instant;
import java.util.Objects;
import java.util.UUID;

/**
 * A broadcast pair whose best candidate scored in the review band: close enough
 * that a human should decide, not close enough to link automatically.
 */
public class ReviewItem {

    private final String id;
    private final String signature;
    private final String rawArtist;
    private final String rawTitle;
    private final long candidateWorkId;
    private final double artistSimilarity;
    private final double titleSimilarity;
    private final double vectorDistance;
    private ReviewStatus status;
    private final Instant submittedAt;
    private Instant reviewedAt;
    private String reviewerId;
    private String notes;

    private ReviewItem(Builder builder) {
        this.id = builder.id != null ? builder.id : UUID.randomUUID().toString();
        this.signature = Objects.requireNonNull(builder.signature, "signature is required");
        this.rawArtist = builder.rawArtist;
        this.rawTitle = builder.rawTitle;
        this.candidateWorkId = Objects.requireNonNull(builder.candidateWorkId, "candidateWorkId is required");
        this.artistSimilarity = builder.artistSimilarity;
        this.titleSimilarity = builder.titleSimilarity;
        this.vectorDistance = builder.vectorDistance;
        this.status = ReviewStatus.PENDING;
        this.submittedAt = builder.submittedAt != null ? builder.submittedAt : Instant.now();
    }

    public String getId() {
        return id;
    }

    public String getSignature() {
        return signature;
    }

    public String getRawArtist() {
        return rawArtist;
    }

    public String getRawTitle() {
        return rawTitle;
    }

    public long getCandidateWorkId() {
        return candidateWorkId;
    }

    public double getArtistSimilarity() {
        return artistSimilarity;
    }

    public double getTitleSimilarity() {
        return titleSimilarity;
    }

    public double getVectorDistance() {
        return vectorDistance;
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

    /**
     * Moves a pending item to its final status. Returns false if it was already decided.
     */
    synchronized boolean decide(ReviewStatus decision, String reviewerId, String notes) {
        if (status != ReviewStatus.PENDING) {
            return false;
        }
        this.status = decision;
        this.reviewedAt = Instant.now();
        this.reviewerId = reviewerId;
        this.notes = notes;
        return true;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        ReviewItem that = (ReviewItem) o;
        return Objects.equals(id, that.id);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id);
    }

    @Override
    public String toString() {
        return "ReviewItem{" +
                "id='" + id + '\'' +
                ", signature='" + signature + '\'' +
                ", candidateWorkId=" + candidateWorkId +
                ", artistSimilarity=" + artistSimilarity +
                ", titleSimilarity=" + titleSimilarity +
                ", status=" + getStatus() +
                '}';
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private String id;
        private String signature;
        private String rawArtist;
        private String rawTitle;
        private Long candidateWorkId;
        private double artistSimilarity;
        private double titleSimilarity;
        private double vectorDistance;
        private Instant submittedAt;

        public Builder id(String id) {
            this.id = id;
            return this;
        }

        public Builder signature(String signature) {
            this.signature = signature;
            return this;
        }

        public Builder rawArtist(String rawArtist) {
            this.rawArtist = rawArtist;
            return this;
        }

        public Builder rawTitle(String rawTitle) {
            this.rawTitle = rawTitle;
            return this;
        }

        public Builder candidateWorkId(long candidateWorkId) {
            this.candidateWorkId = candidateWorkId;
            return this;
        }

        public Builder artistSimilarity(double artistSimilarity) {
            this.artistSimilarity = artistSimilarity;
            return this;
        }

        public Builder titleSimilarity(double titleSimilarity) {
            this.titleSimilarity = titleSimilarity;
            return this;
        }

        public Builder vectorDistance(double vectorDistance) {
            this.vectorDistance = vectorDistance;
            return this;
        }

        public Builder submittedAt(Instant submittedAt) {
            this.submittedAt = submittedAt;
            return this;
        }

        public ReviewItem build() {
            return new ReviewItem(this);
        }
    }
}
