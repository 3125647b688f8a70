package com.airwave.resolution.index;

import java.util.Objects;

/**
 * A recording to be embedded in the similarity index.
 */
public record IndexDocument(long recordingId, String artist, String title) {
    public IndexDocument {
        Objects.requireNonNull(artist, "artist is required");
        Objects.requireNonNull(title, "title is required");
    }
}
