package com.airwave.resolution.index;

import com.airwave.resolution.core.model.ArtistTitle;
import com.airwave.resolution.metrics.MetricsService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;

/**
 * Decorator that turns index failures into empty candidate lists.
 * A thrown exception, a result list of the wrong length, a null list or a hit
 * without an id or with an invalid distance degrades that query to "no candidates"
 * instead of failing the batch. Well-formed hits are re-sorted by ascending distance.
 */
public class GuardedSimilarityIndex implements SimilarityIndex {
    private static final Logger log = LoggerFactory.getLogger(GuardedSimilarityIndex.class);

    private final SimilarityIndex delegate;
    private final MetricsService metricsService;

    public GuardedSimilarityIndex(SimilarityIndex delegate, MetricsService metricsService) {
        this.delegate = Objects.requireNonNull(delegate, "delegate is required");
        this.metricsService = Objects.requireNonNull(metricsService, "metricsService is required");
    }

    @Override
    public void add(IndexDocument document) {
        delegate.add(document);
    }

    @Override
    public void addBatch(List<IndexDocument> documents) {
        delegate.addBatch(documents);
    }

    @Override
    public List<IndexCandidate> search(String artist, String title, int limit) {
        List<IndexCandidate> raw;
        try {
            raw = delegate.search(artist, title, limit);
        } catch (Exception e) {
            log.warn("index.search.failed artist='{}' title='{}' error={}", artist, title, e.getMessage());
            metricsService.incrementIndexDegraded();
            return List.of();
        }
        return sanitize(raw);
    }

    @Override
    public List<List<IndexCandidate>> searchBatch(List<ArtistTitle> queries, int limit) {
        if (queries.isEmpty()) {
            return List.of();
        }
        List<List<IndexCandidate>> raw;
        try {
            raw = delegate.searchBatch(queries, limit);
        } catch (Exception e) {
            log.warn("index.searchBatch.failed queries={} error={}", queries.size(), e.getMessage());
            metricsService.incrementIndexDegraded();
            return emptyResults(queries.size());
        }

        if (raw == null || raw.size() != queries.size()) {
            log.warn("index.searchBatch.malformed expected={} actual={}",
                    queries.size(), raw == null ? "null" : raw.size());
            metricsService.incrementIndexDegraded();
            return emptyResults(queries.size());
        }

        List<List<IndexCandidate>> results = new ArrayList<>(raw.size());
        for (List<IndexCandidate> candidates : raw) {
            results.add(sanitize(candidates));
        }
        return results;
    }

    private List<IndexCandidate> sanitize(List<IndexCandidate> candidates) {
        if (candidates == null) {
            log.warn("index.result.malformed reason=null-list");
            metricsService.incrementIndexDegraded();
            return List.of();
        }
        for (IndexCandidate candidate : candidates) {
            if (candidate == null || !candidate.isWellFormed()) {
                log.warn("index.result.malformed reason=bad-candidate candidate={}", candidate);
                metricsService.incrementIndexDegraded();
                return List.of();
            }
        }
        List<IndexCandidate> sorted = new ArrayList<>(candidates);
        sorted.sort(Comparator.comparingDouble(IndexCandidate::distance));
        return List.copyOf(sorted);
    }

    private static List<List<IndexCandidate>> emptyResults(int size) {
        List<List<IndexCandidate>> results = new ArrayList<>(size);
        for (int i = 0; i < size; i++) {
            results.add(List.of());
        }
        return results;
    }
}
