package net.seoedge.support.cache;

import net.seoedge.domain.cache.WarmupEntry;
import net.seoedge.domain.cache.WarmupPriority;

import java.util.List;

/**
 * Produces entries to preload into the tagged cache.
 */
public interface CacheWarmupStrategy {

    /**
     * Stable name used in logs and for registration.
     */
    String name();

    WarmupPriority priority();

    /**
     * Builds the entries to store. Called without holding the cache lock, so it may take its time
     * and may read from the cache itself.
     *
     * @return finite list of entries, never {@code null}
     * @throws Exception when the source data cannot be produced; the strategy is then skipped
     */
    List<WarmupEntry> generate() throws Exception;
}
