package com.property.distress.cache;

/**
 * Snapshot of resolution cache counters.
 */
public record CacheStats(long hitCount, long missCount, long evictionCount, long estimatedSize) {

    public static final CacheStats EMPTY = new CacheStats(0, 0, 0, 0);

    public long requestCount() {
        return hitCount + missCount;
    }

    public double hitRate() {
        long requests = requestCount();
        return requests == 0 ? 0.0 : (double) hitCount / requests;
    }
}
