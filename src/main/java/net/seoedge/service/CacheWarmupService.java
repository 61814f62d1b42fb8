package net.seoedge.service;

import lombok.extern.slf4j.Slf4j;
import net.seoedge.config.SeoCacheProperties;
import net.seoedge.support.cache.CacheWarmupStrategy;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.scheduling.annotation.Async;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Warms the tagged cache on application startup to prevent first-request delays.
 * Every {@link CacheWarmupStrategy} bean is registered with the cache.
 */
@Service
@Slf4j
public class CacheWarmupService {

    private final TaggedCache taggedCache;
    private final SeoCacheProperties cacheProperties;
    private final AtomicBoolean warmupInProgress = new AtomicBoolean(false);

    public CacheWarmupService(TaggedCache taggedCache,
                              SeoCacheProperties cacheProperties,
                              List<CacheWarmupStrategy> strategies) {
        this.taggedCache = taggedCache;
        this.cacheProperties = cacheProperties;
        strategies.forEach(taggedCache::registerWarmupStrategy);
    }

    /**
     * Warm cache when application is ready.
     * Runs asynchronously to not delay startup.
     */
    @Async
    @EventListener(ApplicationReadyEvent.class)
    public void warmupCachesOnStartup() {
        if (!cacheProperties.isWarmupOnStartup()) {
            log.debug("Startup cache warmup is disabled");
            return;
        }
        warmup();
    }

    /**
     * Runs every registered strategy unless a warmup is already running.
     *
     * @return number of entries stored, or -1 when skipped because a warmup is in progress
     */
    public int warmup() {
        if (!warmupInProgress.compareAndSet(false, true)) {
            log.debug("Cache warmup already running; skipping duplicate invocation");
            return -1;
        }
        try {
            return taggedCache.warmup();
        } finally {
            warmupInProgress.set(false);
        }
    }

    public boolean isWarmupInProgress() {
        return warmupInProgress.get();
    }
}
