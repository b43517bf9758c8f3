package com.winevt.resources.cache;

/**
 * Configuration for the message string cache.
 *
 * @param maxSize maximum number of entries
 * @param enabled whether caching is enabled
 */
public record CacheConfig(int maxSize, boolean enabled) {

    /**
     * Default capacity: 64 Ki entries.
     */
    public static final int DEFAULT_MAX_SIZE = 64 * 1024;

    public CacheConfig {
        if (maxSize <= 0) {
            throw new IllegalArgumentException("maxSize must be > 0");
        }
    }

    /**
     * Default cache configuration: 65,536 entries, enabled.
     */
    public static CacheConfig defaults() {
        return new CacheConfig(DEFAULT_MAX_SIZE, true);
    }

    /**
     * Disabled cache configuration.
     */
    public static CacheConfig disabled() {
        return new CacheConfig(1, false);
    }
}
