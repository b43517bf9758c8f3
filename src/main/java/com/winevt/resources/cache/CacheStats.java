package com.winevt.resources.cache;

/**
 * Message string cache counters.
 *
 * <p>Hits and misses are counted once per lookup, whichever key served it. A resolved
 * string is stored under up to two keys, provider identifier and log source, and each key
 * is evicted on its own, so evictions and size count keys rather than resolutions.</p>
 *
 * @param hitCount      lookups served from the cache
 * @param missCount     lookups that found neither key
 * @param evictionCount keys dropped to stay within the capacity
 * @param size          keys currently held
 */
public record CacheStats(long hitCount, long missCount, long evictionCount, long size) {

    /**
     * Returns the hit rate (0.0 to 1.0).
     */
    public double hitRate() {
        long total = hitCount + missCount;
        return total == 0 ? 0.0 : (double) hitCount / total;
    }

    /**
     * Returns empty stats.
     */
    public static CacheStats empty() {
        return new CacheStats(0, 0, 0, 0);
    }
}
