package com.airwave.resolution.api;

import com.airwave.resolution.cache.CacheConfig;
import com.airwave.resolution.matching.MatchThresholds;

import java.util.Objects;

/**
 * Options for the matching engine.
 * Configures thresholds, candidate fan-out, catalog promotion and orphan linking.
 */
public class MatchingOptions {

    private static final int DEFAULT_CANDIDATE_LIMIT = 10;
    private static final int DEFAULT_PROMOTION_MIN_OCCURRENCES = 2;
    private static final double DEFAULT_PROMOTION_CONFIDENCE = 0.8;
    private static final int DEFAULT_ORPHAN_CHUNK_SIZE = 500;

    private final MatchThresholds thresholds;
    private final int candidateLimit;
    private final int promotionMinOccurrences;
    private final double promotionConfidence;
    private final int orphanChunkSize;
    private final CacheConfig bridgeCache;
    private final String sourceSystem;

    private MatchingOptions(Builder builder) {
        this.thresholds = builder.thresholds;
        this.candidateLimit = builder.candidateLimit;
        this.promotionMinOccurrences = builder.promotionMinOccurrences;
        this.promotionConfidence = builder.promotionConfidence;
        this.orphanChunkSize = builder.orphanChunkSize;
        this.bridgeCache = builder.bridgeCache;
        this.sourceSystem = builder.sourceSystem;
    }

    public MatchThresholds getThresholds() {
        return thresholds;
    }

    public int getCandidateLimit() {
        return candidateLimit;
    }

    public int getPromotionMinOccurrences() {
        return promotionMinOccurrences;
    }

    public double getPromotionConfidence() {
        return promotionConfidence;
    }

    public int getOrphanChunkSize() {
        return orphanChunkSize;
    }

    public CacheConfig getBridgeCache() {
        return bridgeCache;
    }

    public String getSourceSystem() {
        return sourceSystem;
    }

    /**
     * Creates default options.
     */
    public static MatchingOptions defaults() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private MatchThresholds thresholds = MatchThresholds.defaults();
        private int candidateLimit = DEFAULT_CANDIDATE_LIMIT;
        private int promotionMinOccurrences = DEFAULT_PROMOTION_MIN_OCCURRENCES;
        private double promotionConfidence = DEFAULT_PROMOTION_CONFIDENCE;
        private int orphanChunkSize = DEFAULT_ORPHAN_CHUNK_SIZE;
        private CacheConfig bridgeCache = CacheConfig.defaults();
        private String sourceSystem = "SYSTEM";

        public Builder thresholds(MatchThresholds thresholds) {
            this.thresholds = Objects.requireNonNull(thresholds, "thresholds is required");
            return this;
        }

        public Builder candidateLimit(int candidateLimit) {
            if (candidateLimit <= 0) {
                throw new IllegalArgumentException("candidateLimit must be positive");
            }
            this.candidateLimit = candidateLimit;
            return this;
        }

        public Builder promotionMinOccurrences(int promotionMinOccurrences) {
            if (promotionMinOccurrences <= 0) {
                throw new IllegalArgumentException("promotionMinOccurrences must be positive");
            }
            this.promotionMinOccurrences = promotionMinOccurrences;
            return this;
        }

        public Builder promotionConfidence(double promotionConfidence) {
            if (promotionConfidence < 0.0 || promotionConfidence > 1.0) {
                throw new IllegalArgumentException("promotionConfidence must be between 0.0 and 1.0");
            }
            this.promotionConfidence = promotionConfidence;
            return this;
        }

        public Builder orphanChunkSize(int orphanChunkSize) {
            if (orphanChunkSize <= 0) {
                throw new IllegalArgumentException("orphanChunkSize must be positive");
            }
            this.orphanChunkSize = orphanChunkSize;
            return this;
        }

        public Builder bridgeCache(CacheConfig bridgeCache) {
            this.bridgeCache = Objects.requireNonNull(bridgeCache, "bridgeCache is required");
            return this;
        }

        public Builder sourceSystem(String sourceSystem) {
            this.sourceSystem = sourceSystem;
            return this;
        }

        public MatchingOptions build() {
            if (sourceSystem == null || sourceSystem.isBlank()) {
                throw new IllegalArgumentException("sourceSystem is required");
            }
            return new MatchingOptions(this);
        }
    }

    @Override
    public String toString() {
        return "MatchingOptions{" +
                "thresholds=" + thresholds +
                ", candidateLimit=" + candidateLimit +
                ", promotionMinOccurrences=" + promotionMinOccurrences +
                ", promotionConfidence=" + promotionConfidence +
                ", orphanChunkSize=" + orphanChunkSize +
                ", bridgeCache=" + bridgeCache +
                ", sourceSystem='" + sourceSystem + '\'' +
                '}';
    }
}
