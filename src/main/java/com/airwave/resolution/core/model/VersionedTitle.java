package com.airwave.resolution.core.model;

/**
 * A title with its version suffix split off, e.g. "Voodoo (Live)" becomes
 * {@code ("Voodoo", "Live")}.
 */
public record VersionedTitle(String title, String versionType) {
    public static final String ORIGINAL = "Original";
}
