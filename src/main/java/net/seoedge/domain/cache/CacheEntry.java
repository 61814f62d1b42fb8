package net.seoedge.domain.cache;

import java.util.Set;

/**
 * One stored cache slot. Entries are replaced, never mutated in place.
 *
 * @param value stored value (plain or compressed)
 * @param createdAt wall-clock creation time in epoch millis
 * @param ttlMillis time-to-live measured from {@code createdAt}
 * @param tags invalidation tags carried by this entry
 * @param approxSizeBytes rough memory estimate used for health reporting
 */
public record CacheEntry(
    CacheValue value,
    long createdAt,
    long ttlMillis,
    Set<String> tags,
    long approxSizeBytes
) {

    public CacheEntry {
        tags = tags == null ? Set.of() : Set.copyOf(tags);
    }

    /**
     * An entry is stale once strictly more than {@code ttlMillis} has elapsed.
     */
    public boolean isExpiredAt(long nowMillis) {
        return nowMillis - createdAt > ttlMillis;
    }
}
