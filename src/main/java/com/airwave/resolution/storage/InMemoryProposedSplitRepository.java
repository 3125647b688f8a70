package com.airwave.resolution.storage;

import com.airwave.resolution.core.model.ProposedSplit;
import com.airwave.resolution.core.model.SplitStatus;

import java.util.Collection;
import java.util.Comparator;
import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

/**
 * In-memory implementation of {@link ProposedSplitRepository}.
 * {@link ConcurrentMap#putIfAbsent} stands in for the unique index on raw artist.
 */
public class InMemoryProposedSplitRepository implements ProposedSplitRepository {

    private final ConcurrentMap<String, ProposedSplit> splits = new ConcurrentHashMap<>();

    @Override
    public Optional<ProposedSplit> findByRawArtist(String rawArtist) {
        return Optional.ofNullable(splits.get(rawArtist));
    }

    @Override
    public Set<String> findExistingRawArtists(Collection<String> rawArtists) {
        Set<String> existing = new HashSet<>();
        for (String rawArtist : rawArtists) {
            if (splits.containsKey(rawArtist)) {
                existing.add(rawArtist);
            }
        }
        return existing;
    }

    @Override
    public ProposedSplit insert(ProposedSplit split) {
        if (splits.putIfAbsent(split.rawArtist(), split) != null) {
            throw new UniqueConstraintViolationException("proposed_split_raw_artist", split.rawArtist());
        }
        return split;
    }

    @Override
    public ProposedSplit update(ProposedSplit split) {
        ProposedSplit replaced = splits.computeIfPresent(split.rawArtist(), (k, v) -> split);
        if (replaced == null) {
            throw new IllegalArgumentException("Proposed split not found: " + split.rawArtist());
        }
        return replaced;
    }

    @Override
    public List<ProposedSplit> findByStatus(SplitStatus status) {
        return splits.values().stream()
                .filter(split -> split.status() == status)
                .sorted(Comparator.comparing(ProposedSplit::createdAt))
                .toList();
    }

    public int size() {
        return splits.size();
    }
}
