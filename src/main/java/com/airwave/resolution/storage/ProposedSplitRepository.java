package com.airwave.resolution.storage;

import com.airwave.resolution.core.model.ProposedSplit;
import com.airwave.resolution.core.model.SplitStatus;

import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Store of collaboration split proposals, unique on raw artist.
 */
public interface ProposedSplitRepository {

    Optional<ProposedSplit> findByRawArtist(String rawArtist);

    /**
     * Returns the subset of {@code rawArtists} that already have a proposal in any status.
     */
    Set<String> findExistingRawArtists(Collection<String> rawArtists);

    /**
     * @throws UniqueConstraintViolationException if the raw artist already has a proposal
     */
    ProposedSplit insert(ProposedSplit split);

    ProposedSplit update(ProposedSplit split);

    List<ProposedSplit> findByStatus(SplitStatus status);
}
