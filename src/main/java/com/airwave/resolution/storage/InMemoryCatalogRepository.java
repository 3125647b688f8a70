package com.airwave.resolution.storage;

import com.airwave.resolution.core.model.Recording;
import com.airwave.resolution.core.model.Work;
import com.airwave.resolution.rules.Normalizer;

import java.util.Collection;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.atomic.AtomicLong;

/**
 * In-memory implementation of {@link CatalogRepository}.
 * Keeps a normalized (artist, title) index so exact-match lookups are map reads.
 */
public class InMemoryCatalogRepository implements CatalogRepository {

    private final ConcurrentMap<Long, Work> works = new ConcurrentHashMap<>();
    private final ConcurrentMap<Long, Recording> recordings = new ConcurrentHashMap<>();
    private final ConcurrentMap<NormalizedPair, Set<Long>> exactIndex = new ConcurrentHashMap<>();
    private final AtomicLong workIds = new AtomicLong();
    private final AtomicLong recordingIds = new AtomicLong();

    @Override
    public Map<NormalizedPair, Work> findExactMatches(Collection<NormalizedPair> pairs) {
        Map<NormalizedPair, Work> result = new HashMap<>();
        for (NormalizedPair pair : pairs) {
            Set<Long> ids = exactIndex.get(pair);
            if (ids != null && !ids.isEmpty()) {
                // Lowest id wins so repeated lookups are stable
                long first = ids.stream().mapToLong(Long::longValue).min().getAsLong();
                result.put(pair, works.get(first));
            }
        }
        return result;
    }

    @Override
    public Map<Long, Recording> findRecordingsByIds(Collection<Long> ids) {
        Map<Long, Recording> result = new HashMap<>();
        for (Long id : ids) {
            Recording recording = recordings.get(id);
            if (recording != null) {
                result.put(id, recording);
            }
        }
        return result;
    }

    @Override
    public Map<Long, Work> findWorksByIds(Collection<Long> ids) {
        Map<Long, Work> result = new HashMap<>();
        for (Long id : ids) {
            Work work = works.get(id);
            if (work != null) {
                result.put(id, work);
            }
        }
        return result;
    }

    @Override
    public Work createWork(Work work) {
        Work stored = Work.builder(work).id(workIds.incrementAndGet()).build();
        works.put(stored.getId(), stored);
        String title = Normalizer.clean(stored.getTitle());
        for (String artist : stored.allArtists()) {
            exactIndex.computeIfAbsent(new NormalizedPair(Normalizer.cleanArtist(artist), title),
                    k -> ConcurrentHashMap.newKeySet()).add(stored.getId());
        }
        return stored;
    }

    @Override
    public Recording createRecording(Recording recording) {
        if (!works.containsKey(recording.getWorkId())) {
            throw new IllegalArgumentException("Work not found: " + recording.getWorkId());
        }
        Recording stored = Recording.builder(recording).id(recordingIds.incrementAndGet()).build();
        recordings.put(stored.getId(), stored);
        return stored;
    }

    public List<Work> findAllWorks() {
        return List.copyOf(works.values());
    }

    public int countWorks() {
        return works.size();
    }
}
