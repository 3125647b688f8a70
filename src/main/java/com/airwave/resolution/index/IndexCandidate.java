package com.airwave.resolution.index;

/**
 * One nearest-neighbour hit from the similarity index. Lower distance means closer.
 * Fields are not validated here because index responses are untrusted; see
 * {@link GuardedSimilarityIndex}.
 */
public record IndexCandidate(Long recordingId, double distance) {

    public static IndexCandidate of(long recordingId, double distance) {
        return new IndexCandidate(recordingId, distance);
    }

    /**
     * True when the hit carries an id and a finite, non-negative distance.
     */
    public boolean isWellFormed() {
        return recordingId != null && !Double.isNaN(distance) && !Double.isInfinite(distance) && distance >= 0.0;
    }
}
