package net.seoedge.config;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Duration;

/**
 * Factory for bounded Caffeine caches used for derived, recomputable data (compiled patterns and the like).
 * Request-facing SEO values live in {@link net.seoedge.service.TaggedCache} instead.
 */
@Slf4j
@Component
public class CacheFactory {

    /**
     * Create a cache with specified configuration.
     */
    public <K, V> Cache<K, V> createCache(String name, int maxSize, Duration ttl) {
        log.debug("Creating Caffeine cache '{}' (maxSize={}, ttl={})", name, maxSize, ttl);
        return Caffeine.newBuilder()
            .maximumSize(maxSize)
            .expireAfterAccess(ttl)
            .recordStats()
            .build();
    }
}
