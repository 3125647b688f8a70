package com.airwave.resolution.matching;

import com.airwave.resolution.core.model.ArtistTitle;
import com.airwave.resolution.core.model.MatchReason;

import java.util.List;

/**
 * What the matcher would decide for a pair, and the candidates behind it.
 * Bridged pairs carry no candidates since the index is never consulted for them.
 *
 * @param workId the work the pair would resolve to, or null when unmatched
 */
public record MatchExplanation(
        ArtistTitle pair,
        MatchReason reason,
        Long workId,
        List<CandidateExplanation> candidates
) {
    public MatchExplanation {
        candidates = List.copyOf(candidates);
    }

    public boolean isMatched() {
        return reason.isMatched();
    }
}
