package net.seoedge.domain.cache;

import java.util.List;

/**
 * Portable snapshot of one cache slot used by export/import.
 *
 * @param key cache key
 * @param value decoded value
 * @param ttl original time-to-live in millis
 * @param tags invalidation tags
 * @param createdAt creation time in epoch millis
 */
public record ExportedCacheEntry(
    String key,
    Object value,
    long ttl,
    List<String> tags,
    long createdAt
) {

    public ExportedCacheEntry {
        tags = tags == null ? List.of() : List.copyOf(tags);
    }
}
