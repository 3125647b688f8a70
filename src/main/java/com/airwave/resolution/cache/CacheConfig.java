package com.airwave.resolution.cache;

/**
 * Configuration for the in-process identity bridge cache.
 *
 * @param maxSize    maximum number of active bridge entries held in memory
 * @param ttlSeconds time-to-live in seconds; bounds how long a revocation made by
 *                   another process can go unnoticed
 * @param enabled    whether the in-process layer is used at all
 */
public record CacheConfig(int maxSize, int ttlSeconds, boolean enabled) {

    public CacheConfig {
        if (maxSize <= 0) {
            throw new IllegalArgumentException("maxSize must be > 0");
        }
        if (ttlSeconds <= 0) {
            throw new IllegalArgumentException("ttlSeconds must be > 0");
        }
    }

    /**
     * 50,000 entries, 600s TTL, enabled.
     */
    public static CacheConfig defaults() {
        return new CacheConfig(50_000, 600, true);
    }

    /**
     * Every lookup goes to the repository.
     */
    public static CacheConfig disabled() {
        return new CacheConfig(1, 1, false);
    }
}
