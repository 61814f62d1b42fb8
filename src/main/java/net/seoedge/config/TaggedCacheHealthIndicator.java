package net.seoedge.config;

import net.seoedge.domain.cache.CacheHealth;
import net.seoedge.domain.cache.CacheHealthStatus;
import net.seoedge.domain.cache.CacheStats;
import net.seoedge.service.TaggedCache;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.stereotype.Component;

/**
 * Reports tagged cache health: CRITICAL maps to DOWN, WARNING stays UP with the issues attached.
 */
@Component("taggedCacheHealthIndicator")
public class TaggedCacheHealthIndicator implements HealthIndicator {

    private final TaggedCache taggedCache;

    public TaggedCacheHealthIndicator(TaggedCache taggedCache) {
        this.taggedCache = taggedCache;
    }

    @Override
    public Health health() {
        CacheHealth cacheHealth = taggedCache.getHealth();
        CacheStats stats = cacheHealth.stats();
        Health.Builder builder = cacheHealth.status() == CacheHealthStatus.CRITICAL ? Health.down() : Health.up();
        builder.withDetail("cache_status", cacheHealth.status().name())
            .withDetail("entries", stats.entries())
            .withDetail("max_size", stats.maxSize())
            .withDetail("hit_rate", stats.hitRate())
            .withDetail("memory_estimate_bytes", stats.memoryEstimate());
        if (!cacheHealth.issues().isEmpty()) {
            builder.withDetail("issues", cacheHealth.issues())
                .withDetail("recommendations", cacheHealth.recommendations());
        }
        return builder.build();
    }
}
