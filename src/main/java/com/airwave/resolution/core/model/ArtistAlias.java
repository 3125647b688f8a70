package com.airwave.resolution.core.model;

import java.util.Objects;

/**
 * Maps a raw artist string to its canonical name.
 * A {@code nullAlias} entry records that the raw name was reviewed and has no better form.
 */
public record ArtistAlias(
        String rawName,
        String resolvedName,
        boolean verified,
        boolean nullAlias
) {
    public ArtistAlias {
        Objects.requireNonNull(rawName, "rawName is required");
        if (!nullAlias) {
            Objects.requireNonNull(resolvedName, "resolvedName is required unless nullAlias");
        }
    }

    public static ArtistAlias of(String rawName, String resolvedName, boolean verified) {
        return new ArtistAlias(rawName, resolvedName, verified, false);
    }

    /**
     * Negative cache entry: the raw name resolves to itself.
     */
    public static ArtistAlias noBetterName(String rawName) {
        return new ArtistAlias(rawName, null, true, true);
    }

    /**
     * The name this alias resolves to.
     */
    public String effectiveName() {
        return nullAlias ? rawName : resolvedName;
    }
}
