package net.seoedge.domain.cache;

/**
 * Aggregate cache statistics exposed to operators.
 *
 * @param entries current number of live slots
 * @param hitRate hit percentage in {@code [0, 100]}
 * @param missRate miss percentage in {@code [0, 100]}
 * @param memoryEstimate estimated bytes held by entries and indexes
 * @param maxSize configured capacity
 * @param metrics raw counters
 * @param uptimeMillis time since the counters started
 */
public record CacheStats(
    int entries,
    double hitRate,
    double missRate,
    long memoryEstimate,
    int maxSize,
    CacheMetricsSnapshot metrics,
    long uptimeMillis
) {
}
