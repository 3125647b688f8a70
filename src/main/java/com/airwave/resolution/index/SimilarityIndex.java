package com.airwave.resolution.index;

import com.airwave.resolution.core.model.ArtistTitle;

import java.util.List;

/**
 * Approximate nearest-neighbour search over recordings, keyed by artist and title text.
 * Results are ordered by ascending distance.
 */
public interface SimilarityIndex {

    void add(IndexDocument document);

    void addBatch(List<IndexDocument> documents);

    List<IndexCandidate> search(String artist, String title, int limit);

    /**
     * Searches many queries in one call. The returned list is positionally aligned
     * with {@code queries}.
     */
    List<List<IndexCandidate>> searchBatch(List<ArtistTitle> queries, int limit);
}
