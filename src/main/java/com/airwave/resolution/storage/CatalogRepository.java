package com.airwave.resolution.storage;

import com.airwave.resolution.core.model.Recording;
import com.airwave.resolution.core.model.Work;

import java.util.Collection;
import java.util.Map;

/**
 * Read and write access to the reference library of Works and Recordings.
 */
public interface CatalogRepository {

    /**
     * Finds Works whose cleaned title equals the pair's title and whose cleaned
     * primary artist or any cleaned co-artist equals the pair's artist.
     * One call serves a whole batch; pairs without a hit are absent from the result.
     */
    Map<NormalizedPair, Work> findExactMatches(Collection<NormalizedPair> pairs);

    Map<Long, Recording> findRecordingsByIds(Collection<Long> recordingIds);

    Map<Long, Work> findWorksByIds(Collection<Long> workIds);

    Work createWork(Work work);

    Recording createRecording(Recording recording);
}
