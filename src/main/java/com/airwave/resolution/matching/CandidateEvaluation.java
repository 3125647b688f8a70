package com.airwave.resolution.matching;

/**
 * Scores behind a {@link CandidateVerdict}.
 */
public record CandidateEvaluation(
        CandidateVerdict verdict,
        long workId,
        double artistSimilarity,
        double titleSimilarity,
        double distance
) {
}
