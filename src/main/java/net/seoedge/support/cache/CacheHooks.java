package net.seoedge.support.cache;

import net.seoedge.domain.cache.EvictionReason;

import java.util.Set;

/**
 * Side-effect-only observer of cache activity.
 *
 * <p>Callbacks run on the calling thread after the mutation has been applied. Implementations must
 * be fast and must not call back into the cache. Exceptions thrown here are logged and dropped.</p>
 */
public interface CacheHooks {

    default void onSet(String key, Object value, Set<String> tags) {
    }

    default void onGet(String key, boolean hit) {
    }

    default void onDelete(String key) {
    }

    default void onInvalidate(String tag, int count) {
    }

    default void onEvict(String key, EvictionReason reason) {
    }
}
