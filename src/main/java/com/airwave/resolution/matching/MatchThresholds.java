package com.airwave.resolution.matching;

/**
 * Numeric boundaries of the similarity stage.
 *
 * @param variantArtistScore   minimum artist similarity for a variant match
 * @param variantTitleScore    minimum title similarity for a variant match
 * @param aliasArtistScore     minimum artist similarity for the review band
 * @param aliasTitleScore      minimum title similarity for the review band
 * @param vectorStrongDistance maximum index distance for a vector match
 * @param vectorTitleGuard     minimum title similarity a vector match still needs
 */
public record MatchThresholds(
        double variantArtistScore,
        double variantTitleScore,
        double aliasArtistScore,
        double aliasTitleScore,
        double vectorStrongDistance,
        double vectorTitleGuard
) {
    public static final double DEFAULT_VARIANT_ARTIST_SCORE = 0.85;
    public static final double DEFAULT_VARIANT_TITLE_SCORE = 0.80;
    public static final double DEFAULT_ALIAS_ARTIST_SCORE = 0.70;
    public static final double DEFAULT_ALIAS_TITLE_SCORE = 0.70;
    public static final double DEFAULT_VECTOR_STRONG_DISTANCE = 0.15;
    public static final double DEFAULT_VECTOR_TITLE_GUARD = 0.5;

    public MatchThresholds {
        validateScore(variantArtistScore, "variantArtistScore");
        validateScore(variantTitleScore, "variantTitleScore");
        validateScore(aliasArtistScore, "aliasArtistScore");
        validateScore(aliasTitleScore, "aliasTitleScore");
        validateScore(vectorTitleGuard, "vectorTitleGuard");
        if (vectorStrongDistance < 0.0 || Double.isNaN(vectorStrongDistance)) {
            throw new IllegalArgumentException("vectorStrongDistance must be >= 0.0");
        }
        if (variantArtistScore < aliasArtistScore) {
            throw new IllegalArgumentException("variantArtistScore must be >= aliasArtistScore");
        }
        if (variantTitleScore < aliasTitleScore) {
            throw new IllegalArgumentException("variantTitleScore must be >= aliasTitleScore");
        }
    }

    public static MatchThresholds defaults() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public static Builder builder(MatchThresholds thresholds) {
        return new Builder()
                .variantArtistScore(thresholds.variantArtistScore)
                .variantTitleScore(thresholds.variantTitleScore)
                .aliasArtistScore(thresholds.aliasArtistScore)
                .aliasTitleScore(thresholds.aliasTitleScore)
                .vectorStrongDistance(thresholds.vectorStrongDistance)
                .vectorTitleGuard(thresholds.vectorTitleGuard);
    }

    private static void validateScore(double value, String name) {
        if (value < 0.0 || value > 1.0 || Double.isNaN(value)) {
            throw new IllegalArgumentException(name + " must be between 0.0 and 1.0");
        }
    }

    public static class Builder {
        private double variantArtistScore = DEFAULT_VARIANT_ARTIST_SCORE;
        private double variantTitleScore = DEFAULT_VARIANT_TITLE_SCORE;
        private double aliasArtistScore = DEFAULT_ALIAS_ARTIST_SCORE;
        private double aliasTitleScore = DEFAULT_ALIAS_TITLE_SCORE;
        private double vectorStrongDistance = DEFAULT_VECTOR_STRONG_DISTANCE;
        private double vectorTitleGuard = DEFAULT_VECTOR_TITLE_GUARD;

        public Builder variantArtistScore(double variantArtistScore) {
            this.variantArtistScore = variantArtistScore;
            return this;
        }

        public Builder variantTitleScore(double variantTitleScore) {
            this.variantTitleScore = variantTitleScore;
            return this;
        }

        public Builder aliasArtistScore(double aliasArtistScore) {
            this.aliasArtistScore = aliasArtistScore;
            return this;
        }

        public Builder aliasTitleScore(double aliasTitleScore) {
            this.aliasTitleScore = aliasTitleScore;
            return this;
        }

        public Builder vectorStrongDistance(double vectorStrongDistance) {
            this.vectorStrongDistance = vectorStrongDistance;
            return this;
        }

        public Builder vectorTitleGuard(double vectorTitleGuard) {
            this.vectorTitleGuard = vectorTitleGuard;
            return this;
        }

        public MatchThresholds build() {
            return new MatchThresholds(variantArtistScore, variantTitleScore, aliasArtistScore,
                    aliasTitleScore, vectorStrongDistance, vectorTitleGuard);
        }
    }
}
