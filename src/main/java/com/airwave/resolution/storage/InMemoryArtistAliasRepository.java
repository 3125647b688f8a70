package com.airwave.resolution.storage;

import com.airwave.resolution.core.model.ArtistAlias;

import java.util.Collection;
import java.util.HashMap;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

/**
 * In-memory implementation of {@link ArtistAliasRepository}, keyed by lower-cased raw name.
 */
public class InMemoryArtistAliasRepository implements ArtistAliasRepository {

    private final ConcurrentMap<String, ArtistAlias> aliases = new ConcurrentHashMap<>();

    @Override
    public Map<String, ArtistAlias> findByRawNames(Collection<String> rawNames) {
        Map<String, ArtistAlias> result = new HashMap<>();
        for (String rawName : rawNames) {
            ArtistAlias alias = aliases.get(key(rawName));
            if (alias != null) {
                result.put(rawName, alias);
            }
        }
        return result;
    }

    @Override
    public ArtistAlias upsert(ArtistAlias alias) {
        aliases.put(key(alias.rawName()), alias);
        return alias;
    }

    public int size() {
        return aliases.size();
    }

    private static String key(String rawName) {
        return rawName.toLowerCase(Locale.ROOT);
    }
}
