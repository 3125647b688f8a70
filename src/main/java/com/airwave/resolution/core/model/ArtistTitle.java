package com.airwave.resolution.core.model;

/**
 * A raw artist/title pair exactly as reported. Used as the batch key,
 * so two pairs differing only in case or spacing are distinct keys.
 */
public record ArtistTitle(String artist, String title) {
    public ArtistTitle {
        artist = artist != null ? artist : "";
        title = title != null ? title : "";
    }

    public static ArtistTitle of(String artist, String title) {
        return new ArtistTitle(artist, title);
    }
}
