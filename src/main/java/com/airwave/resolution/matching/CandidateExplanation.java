package com.airwave.resolution.matching;

import com.airwave.resolution.matching.MatchQualityAnalyzer.EdgeCase;
import com.airwave.resolution.matching.MatchQualityAnalyzer.QualityWarning;

import java.util.List;
import java.util.Optional;

/**
 * One index candidate as the matcher scored it, with curator-facing quality flags.
 *
 * @param rejectedInReview a reviewer already turned this work down for the pair;
 *                         the matcher skips it whatever its verdict
 */
public record CandidateExplanation(
        long recordingId,
        long workId,
        String artist,
        String title,
        double artistSimilarity,
        double titleSimilarity,
        double distance,
        CandidateVerdict verdict,
        boolean rejectedInReview,
        List<QualityWarning> qualityWarnings,
        EdgeCase edgeCase
) {
    public CandidateExplanation {
        qualityWarnings = List.copyOf(qualityWarnings);
    }

    public Optional<EdgeCase> findEdgeCase() {
        return Optional.ofNullable(edgeCase);
    }
}
