package net.seoedge.domain.cache;

/**
 * Point-in-time copy of the cache counters.
 */
public record CacheMetricsSnapshot(
    long hits,
    long misses,
    long sets,
    long deletes,
    long evictions,
    long invalidations,
    long startTime
) {

    public long totalRequests() {
        return hits + misses;
    }
}
