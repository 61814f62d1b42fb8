package net.seoedge.domain.cache;

import java.util.List;

/**
 * An entry produced by a warmup strategy.
 *
 * @param key cache key
 * @param value value to store
 * @param ttlMillis optional TTL; {@code null} uses the cache default
 * @param tags invalidation tags
 */
public record WarmupEntry(
    String key,
    Object value,
    Long ttlMillis,
    List<String> tags
) {

    public WarmupEntry {
        tags = tags == null ? List.of() : List.copyOf(tags);
    }

    public static WarmupEntry of(String key, Object value, List<String> tags) {
        return new WarmupEntry(key, value, null, tags);
    }
}
