package com.ownership.graph.cache;

/**
 * Cache metrics, summed over every cached lookup.
 *
 * @param hitCount      number of cache hits
 * @param missCount     number of cache misses
 * @param evictionCount number of evictions
 * @param size          current number of entries
 */
public record CacheStats(long hitCount, long missCount, long evictionCount, long size) {

    /**
     * Returns the hit rate (0.0 to 1.0).
     */
    public double hitRate() {
        long total = hitCount + missCount;
        return total == 0 ? 0.0 : (double) hitCount / total;
    }

    CacheStats plus(CacheStats other) {
        return new CacheStats(hitCount + other.hitCount, missCount + other.missCount,
                evictionCount + other.evictionCount, size + other.size);
    }
}
