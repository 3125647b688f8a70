package com.airwave.resolution.index;

import com.airwave.resolution.core.model.ArtistTitle;
import com.airwave.resolution.rules.Normalizer;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Thread-safe in-memory similarity index for tests and single-JVM deployments.
 * Documents are embedded as character trigram count vectors over the cleaned
 * "artist title" text; distance is cosine distance in [0, 1].
 */
public class InMemorySimilarityIndex implements SimilarityIndex {

    private final Map<Long, Map<String, Integer>> vectors = new ConcurrentHashMap<>();

    @Override
    public void add(IndexDocument document) {
        vectors.put(document.recordingId(), embed(document.artist(), document.title()));
    }

    @Override
    public void addBatch(List<IndexDocument> documents) {
        for (IndexDocument document : documents) {
            add(document);
        }
    }

    @Override
    public List<IndexCandidate> search(String artist, String title, int limit) {
        Map<String, Integer> query = embed(artist, title);
        if (query.isEmpty() || limit <= 0) {
            return List.of();
        }
        List<IndexCandidate> hits = new ArrayList<>();
        for (Map.Entry<Long, Map<String, Integer>> entry : vectors.entrySet()) {
            hits.add(IndexCandidate.of(entry.getKey(), cosineDistance(query, entry.getValue())));
        }
        hits.sort(Comparator.comparingDouble(IndexCandidate::distance)
                .thenComparing(IndexCandidate::recordingId));
        return hits.size() > limit ? List.copyOf(hits.subList(0, limit)) : List.copyOf(hits);
    }

    @Override
    public List<List<IndexCandidate>> searchBatch(List<ArtistTitle> queries, int limit) {
        List<List<IndexCandidate>> results = new ArrayList<>(queries.size());
        for (ArtistTitle query : queries) {
            results.add(search(query.artist(), query.title(), limit));
        }
        return results;
    }

    public int size() {
        return vectors.size();
    }

    static Map<String, Integer> embed(String artist, String title) {
        String text = (Normalizer.cleanArtist(artist) + " " + Normalizer.clean(title)).trim();
        Map<String, Integer> grams = new HashMap<>();
        if (text.isEmpty()) {
            return grams;
        }
        String padded = "  " + text + " ";
        for (int i = 0; i + 3 <= padded.length(); i++) {
            grams.merge(padded.substring(i, i + 3), 1, Integer::sum);
        }
        return grams;
    }

    static double cosineDistance(Map<String, Integer> a, Map<String, Integer> b) {
        if (a.isEmpty() || b.isEmpty()) {
            return 1.0;
        }
        double dot = 0.0;
        for (Map.Entry<String, Integer> entry : a.entrySet()) {
            Integer other = b.get(entry.getKey());
            if (other != null) {
                dot += (double) entry.getValue() * other;
            }
        }
        double similarity = dot / (norm(a) * norm(b));
        return Math.max(0.0, Math.min(1.0, 1.0 - similarity));
    }

    private static double norm(Map<String, Integer> vector) {
        double sum = 0.0;
        for (int count : vector.values()) {
            sum += (double) count * count;
        }
        return Math.sqrt(sum);
    }
}
