package com.airwave.resolution.storage;

import com.airwave.resolution.core.model.ArtistAlias;

import java.util.Collection;
import java.util.Map;

/**
 * Raw-name to canonical-name mappings. Lookups ignore case.
 */
public interface ArtistAliasRepository {

    /**
     * Result keys are the raw names as passed in.
     */
    Map<String, ArtistAlias> findByRawNames(Collection<String> rawNames);

    ArtistAlias upsert(ArtistAlias alias);
}
