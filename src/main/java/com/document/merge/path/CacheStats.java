package com.document.merge.path;

/**
 * Path cache counters.
 *
 * @param invalidations number of times a document's cached paths were dropped
 *                      after a structural change
 * @param documents     documents that currently have cached paths
 */
public record CacheStats(long hitCount, long missCount, long evictionCount, long size,
                         long invalidations, int documents) {

    public double hitRate() {
        long total = hitCount + missCount;
        return total == 0 ? 0.0 : (double) hitCount / total;
    }

    public static CacheStats empty() {
        return new CacheStats(0, 0, 0, 0, 0, 0);
    }
}
