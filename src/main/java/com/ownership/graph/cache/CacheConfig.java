package com.ownership.graph.cache;

/**
 * Configuration for the lookup cache.
 *
 * @param maxSize    maximum number of entries per lookup
 * @param ttlSeconds time-to-live in seconds for each entry
 */
public record CacheConfig(int maxSize, int ttlSeconds) {

    public CacheConfig {
        if (maxSize <= 0) {
            throw new IllegalArgumentException("maxSize must be > 0");
        }
        if (ttlSeconds <= 0) {
            throw new IllegalArgumentException("ttlSeconds must be > 0");
        }
    }

    /**
     * Default cache configuration: 5,000 entries per lookup, 900s TTL.
     */
    public static CacheConfig defaults() {
        return new CacheConfig(5_000, 900);
    }
}
