package com.airwave.resolution.matching;

import com.airwave.resolution.cache.DuplicateSignatureException;
import com.airwave.resolution.core.model.ArtistTitle;
import com.airwave.resolution.core.model.MatchResult;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Outcome of a match batch, keyed by the exact input pairs.
 * A pair appears in exactly one of {@link #outcomes()} and {@link #integrityErrors()}.
 */
public class BatchMatchResult {

    private final Map<ArtistTitle, MatchResult> outcomes;
    private final Map<ArtistTitle, DuplicateSignatureException> integrityErrors;

    public BatchMatchResult(Map<ArtistTitle, MatchResult> outcomes,
                            Map<ArtistTitle, DuplicateSignatureException> integrityErrors) {
        this.outcomes = Collections.unmodifiableMap(new LinkedHashMap<>(outcomes));
        this.integrityErrors = Collections.unmodifiableMap(new LinkedHashMap<>(integrityErrors));
    }

    /**
     * Matched outcomes only; an absent key means the pair was not matched.
     */
    public Map<ArtistTitle, MatchResult> matches() {
        Map<ArtistTitle, MatchResult> matched = new LinkedHashMap<>();
        outcomes.forEach((pair, result) -> {
            if (result.isMatched()) {
                matched.put(pair, result);
            }
        });
        return Collections.unmodifiableMap(matched);
    }

    /**
     * Every outcome, including {@code NO_MATCH} and {@code NEEDS_REVIEW}.
     */
    public Map<ArtistTitle, MatchResult> outcomes() {
        return outcomes;
    }

    public Map<ArtistTitle, DuplicateSignatureException> integrityErrors() {
        return integrityErrors;
    }

    public Optional<MatchResult> get(String artist, String title) {
        return Optional.ofNullable(outcomes.get(ArtistTitle.of(artist, title)));
    }

    public int matchedCount() {
        return (int) outcomes.values().stream().filter(MatchResult::isMatched).count();
    }

    public int size() {
        return outcomes.size() + integrityErrors.size();
    }

    public boolean hasIntegrityErrors() {
        return !integrityErrors.isEmpty();
    }
}
