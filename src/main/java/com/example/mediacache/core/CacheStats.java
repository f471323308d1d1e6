package com.example.mediacache.core;

/**
 * Point-in-time counters of a {@link CacheService}. {@code hitRate} is a percentage.
 */
public record CacheStats(
    int size,
    int maxSize,
    long hitCount,
    long missCount,
    double hitRate,
    long totalRequests
) {

    static CacheStats of(int size, int maxSize, long hits, long misses) {
        long total = hits + misses;
        double rate = total > 0 ? Math.round(hits * 10_000.0 / total) / 100.0 : 0.0;
        return new CacheStats(size, maxSize, hits, misses, rate, total);
    }
}
