package com.airwave.resolution.matching;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * Flags candidates a curator should look at twice when tuning thresholds.
 * Warnings compare the played title with the candidate's title; edge cases
 * compare the similarity scores with the active thresholds.
 */
public final class MatchQualityAnalyzer {

    /**
     * Scores within this distance of a threshold count as an edge case.
     */
    public static final double EDGE_MARGIN = 0.05;

    static final double TRUNCATION_RATIO = 0.6;
    static final int LENGTH_MISMATCH_CHARS = 30;

    private static final List<String> EXTRA_TEXT_MARKERS =
            List.of("feat.", "ft.", "(", "remix", "live", "version", "remaster", "edit");

    public enum QualityWarning {
        /** The candidate title is much shorter than the played one. */
        TRUNCATION_RISK,
        LENGTH_MISMATCH,
        /** The candidate carries decoration (feat., remix, brackets) the played title lacks. */
        EXTRA_TEXT,
        CASE_ONLY
    }

    public enum EdgeCase {
        NEAR_AUTO_THRESHOLD,
        NEAR_REVIEW_THRESHOLD
    }

    private MatchQualityAnalyzer() {
    }

    public static List<QualityWarning> analyze(String playedTitle, String candidateTitle) {
        String played = playedTitle != null ? playedTitle : "";
        String candidate = candidateTitle != null ? candidateTitle : "";
        List<QualityWarning> warnings = new ArrayList<>();

        if (candidate.length() < played.length() * TRUNCATION_RATIO) {
            warnings.add(QualityWarning.TRUNCATION_RISK);
        }
        if (Math.abs(candidate.length() - played.length()) > LENGTH_MISMATCH_CHARS) {
            warnings.add(QualityWarning.LENGTH_MISMATCH);
        }
        if (hasExtraText(candidate) && !hasExtraText(played)) {
            warnings.add(QualityWarning.EXTRA_TEXT);
        }
        if (!played.equals(candidate) && played.equalsIgnoreCase(candidate)) {
            warnings.add(QualityWarning.CASE_ONLY);
        }
        return List.copyOf(warnings);
    }

    /**
     * The auto-link (variant) band is checked before the review (alias) band.
     */
    public static Optional<EdgeCase> detectEdgeCase(double artistSimilarity, double titleSimilarity,
                                                    MatchThresholds thresholds) {
        if (near(artistSimilarity, thresholds.variantArtistScore())
                || near(titleSimilarity, thresholds.variantTitleScore())) {
            return Optional.of(EdgeCase.NEAR_AUTO_THRESHOLD);
        }
        if (near(artistSimilarity, thresholds.aliasArtistScore())
                || near(titleSimilarity, thresholds.aliasTitleScore())) {
            return Optional.of(EdgeCase.NEAR_REVIEW_THRESHOLD);
        }
        return Optional.empty();
    }

    private static boolean near(double score, double threshold) {
        // Rounded so a score exactly on the margin is not lost to floating point
        return Math.round(Math.abs(score - threshold) * 1e9) <= Math.round(EDGE_MARGIN * 1e9);
    }

    private static boolean hasExtraText(String title) {
        String lower = title.toLowerCase(Locale.ROOT);
        for (String marker : EXTRA_TEXT_MARKERS) {
            if (lower.contains(marker)) {
                return true;
            }
        }
        return false;
    }
}
