package com.airwave.resolution.storage;

/**
 * Cleaned artist and title, the key of the catalog's exact-match lookup.
 */
public record NormalizedPair(String artist, String title) {
}
