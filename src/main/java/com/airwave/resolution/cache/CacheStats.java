package com.airwave.resolution.cache;

/**
 * Bridge cache metrics.
 *
 * @param hitCount       lookups answered from memory
 * @param missCount      lookups that went to the repository
 * @param evictionCount  entries evicted for size or age
 * @param size           current number of cached entries
 */
public record CacheStats(long hitCount, long missCount, long evictionCount, long size) {

    /**
     * Returns the hit rate (0.0 to 1.0).
     */
    public double hitRate() {
        long total = hitCount + missCount;
        return total == 0 ? 0.0 : (double) hitCount / total;
    }

    public static CacheStats empty() {
        return new CacheStats(0, 0, 0, 0);
    }
}
