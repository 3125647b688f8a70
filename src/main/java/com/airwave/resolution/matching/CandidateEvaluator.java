package com.airwave.resolution.matching;

import com.airwave.resolution.core.model.Work;
import com.airwave.resolution.rules.Normalizer;
import com.airwave.resolution.similarity.SimilarityAlgorithm;

import java.util.Objects;

/**
 * Scores one index candidate against a cleaned query and applies the threshold
 * rules in order: variant, then vector, then review. The first rule that holds wins.
 * Text similarity is computed independently of the index distance.
 */
public class CandidateEvaluator {

    private final SimilarityAlgorithm similarity;

    public CandidateEvaluator(SimilarityAlgorithm similarity) {
        this.similarity = Objects.requireNonNull(similarity, "similarity is required");
    }

    /**
     * @param cleanArtist query artist, already cleaned with {@link Normalizer#cleanArtist}
     * @param cleanTitle  query title, already cleaned with {@link Normalizer#clean}
     */
    public CandidateEvaluation evaluate(String cleanArtist, String cleanTitle, Work work,
                                        double distance, MatchThresholds thresholds) {
        double artistScore = bestArtistSimilarity(cleanArtist, work);
        double titleScore = similarity.compute(cleanTitle, Normalizer.clean(work.getTitle()));

        CandidateVerdict verdict;
        if (artistScore >= thresholds.variantArtistScore() && titleScore >= thresholds.variantTitleScore()) {
            verdict = CandidateVerdict.VARIANT;
        } else if (distance <= thresholds.vectorStrongDistance() && titleScore >= thresholds.vectorTitleGuard()) {
            verdict = CandidateVerdict.VECTOR;
        } else if (artistScore >= thresholds.aliasArtistScore() && titleScore >= thresholds.aliasTitleScore()) {
            verdict = CandidateVerdict.REVIEW;
        } else {
            verdict = CandidateVerdict.REJECT;
        }
        return new CandidateEvaluation(verdict, work.getId(), artistScore, titleScore, distance);
    }

    private double bestArtistSimilarity(String cleanArtist, Work work) {
        double best = 0.0;
        for (String artist : work.allArtists()) {
            best = Math.max(best, similarity.compute(cleanArtist, Normalizer.cleanArtist(artist)));
        }
        return best;
    }
}
