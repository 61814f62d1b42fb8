/**
 * In-process, tag-indexed LRU cache shared by the SEO edge engines
 *
 * Features:
 * - Per-entry TTL with lazy expiry on read and an eager periodic sweep
 * - Tag index for bulk invalidation of related entries
 * - Least-recently-used eviction driven by a monotonic access counter
 * - Hit/miss/set counters, advisory health and observer hooks
 * - Warmup strategies, critical preloading, export and import
 */
package net.seoedge.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.annotation.Nullable;
import lombok.extern.slf4j.Slf4j;
import net.seoedge.config.SeoCacheProperties;
import net.seoedge.domain.cache.CacheEntry;
import net.seoedge.domain.cache.CacheHealth;
import net.seoedge.domain.cache.CacheHealthStatus;
import net.seoedge.domain.cache.CacheMetricsSnapshot;
import net.seoedge.domain.cache.CacheStats;
import net.seoedge.domain.cache.CacheValue;
import net.seoedge.domain.cache.EvictionReason;
import net.seoedge.domain.cache.ExportedCacheEntry;
import net.seoedge.domain.cache.WarmupEntry;
import net.seoedge.support.cache.CacheHooks;
import net.seoedge.support.cache.CacheWarmupStrategy;
import net.seoedge.util.CompressionUtils;
import org.springframework.scheduling.TaskScheduler;

import java.io.IOException;
import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Consumer;
import java.util.regex.Pattern;

@Slf4j
public class TaggedCache {

    public static final String CRITICAL_TAG = "critical";

    private static final long HIGH_MEMORY_BYTES = 100L * 1024 * 1024;
    private static final double LOW_HIT_RATE_PERCENT = 50.0;
    private static final long MIN_REQUESTS_FOR_HIT_RATE = 100;
    private static final double CRITICAL_UTILIZATION_PERCENT = 90.0;
    private static final long ENTRY_OVERHEAD_BYTES = 64;
    private static final long TAG_BUCKET_OVERHEAD_BYTES = 64;
    private static final long ACCESS_SLOT_OVERHEAD_BYTES = 16;

    /**
     * Loads the value for one critical key during {@link #preloadCritical}.
     */
    @FunctionalInterface
    public interface CriticalValueLoader {
        Object load(String key) throws Exception;
    }

    // Every field below is guarded by lock
    private final ReentrantLock lock = new ReentrantLock();
    private final Map<String, CacheEntry> entries = new HashMap<>();
    private final Map<String, Set<String>> tagIndex = new HashMap<>();
    private final Map<String, Long> accessOrder = new HashMap<>();
    private final Set<String> invalidationQueue = new LinkedHashSet<>();
    private final Map<String, CacheWarmupStrategy> warmupStrategies = new LinkedHashMap<>();
    private long accessCounter;
    private long hits;
    private long misses;
    private long sets;
    private long deletes;
    private long evictions;
    private long invalidations;
    private long metricsStartTime;
    private ScheduledFuture<?> sweepTask;

    private final SeoCacheProperties properties;
    private final Clock clock;
    private final ObjectMapper objectMapper;
    private final TaskScheduler sweepScheduler;
    private final List<CacheHooks> hooks = new CopyOnWriteArrayList<>();

    /**
     * @param properties cache sizing, TTL and logging options
     * @param clock source of entry timestamps
     * @param objectMapper used only to estimate entry sizes
     * @param sweepScheduler scheduler for the periodic sweep, or null to disable it
     * @param hooks observers registered at construction
     */
    public TaggedCache(SeoCacheProperties properties,
                       Clock clock,
                       ObjectMapper objectMapper,
                       @Nullable TaskScheduler sweepScheduler,
                       List<CacheHooks> hooks) {
        this.properties = properties;
        this.clock = clock;
        this.objectMapper = objectMapper;
        this.sweepScheduler = sweepScheduler;
        if (hooks != null) {
            this.hooks.addAll(hooks);
        }
        this.metricsStartTime = clock.millis();
        log.info("Tagged cache initialized (maxSize={}, defaultTtl={}, compression={})",
            properties.getMaxSize(), properties.getDefaultTtl(), properties.isCompressionEnabled());
    }

    /**
     * Starts the periodic expired-entry sweep when a scheduler is available.
     */
    public void start() {
        lock.lock();
        try {
            if (sweepScheduler == null || sweepTask != null) {
                return;
            }
            Duration interval = properties.getSweepInterval();
            sweepTask = sweepScheduler.scheduleWithFixedDelay(this::sweepExpiredSafely,
                clock.instant().plus(interval), interval);
            log.info("Scheduled cache sweep every {}", interval);
        } finally {
            lock.unlock();
        }
    }

    /**
     * Cancels the periodic sweep and drains queued invalidations.
     */
    public void shutdown() {
        lock.lock();
        try {
            if (sweepTask != null) {
                sweepTask.cancel(false);
                sweepTask = null;
            }
        } finally {
            lock.unlock();
        }
        int drained = processInvalidationQueue();
        log.info("Tagged cache shutdown completed ({} queued invalidations applied)", drained);
    }

    public void registerHooks(CacheHooks cacheHooks) {
        if (cacheHooks != null) {
            hooks.add(cacheHooks);
            log.debug("Cache hooks registered: {}", cacheHooks.getClass().getSimpleName());
        }
    }

    public void registerWarmupStrategy(CacheWarmupStrategy strategy) {
        lock.lock();
        try {
            warmupStrategies.put(strategy.name(), strategy);
        } finally {
            lock.unlock();
        }
        log.debug("Warmup strategy registered: {}", strategy.name());
    }

    /**
     * Returns the cached value when present and fresh. A stale entry is deleted and counted as a miss.
     */
    @SuppressWarnings("unchecked")
    public <T> Optional<T> get(String key) {
        List<Consumer<CacheHooks>> events = new ArrayList<>();
        CacheValue stored = null;
        lock.lock();
        try {
            CacheEntry entry = entries.get(key);
            if (entry == null) {
                recordMissLocked(key, null, events);
            } else if (entry.isExpiredAt(clock.millis())) {
                deleteLocked(key, events);
                recordMissLocked(key, "expired", events);
            } else {
                accessOrder.put(key, ++accessCounter);
                recordHitLocked(key, events);
                stored = entry.value();
            }
        } finally {
            lock.unlock();
        }
        fireHooks(events);
        if (stored == null) {
            return Optional.empty();
        }
        return Optional.ofNullable((T) decode(key, stored));
    }

    public void set(String key, Object value) {
        set(key, value, null, List.of());
    }

    public void set(String key, Object value, Collection<String> tags) {
        set(key, value, null, tags);
    }

    /**
     * Stores {@code value} under {@code key}. A full cache evicts exactly one LRU entry first unless
     * the key is already present; replacing a key drops its previous tags.
     *
     * @param ttl time-to-live, or null (or non-positive) for the configured default
     */
    public void set(String key, Object value, @Nullable Duration ttl, Collection<String> tags) {
        Set<String> tagSet = tags == null ? Set.of() : new LinkedHashSet<>(tags);
        CacheValue encoded = encode(value);
        long ttlMillis = ttl == null || ttl.isNegative() || ttl.isZero()
            ? properties.getDefaultTtl().toMillis()
            : ttl.toMillis();
        long size = estimateEntrySize(key, encoded);

        List<Consumer<CacheHooks>> events = new ArrayList<>();
        lock.lock();
        try {
            boolean existing = entries.containsKey(key);
            if (!existing && entries.size() >= properties.getMaxSize()) {
                evictLruLocked(events);
            }
            if (existing) {
                removeFromTagIndexLocked(key, null);
            }
            entries.put(key, new CacheEntry(encoded, clock.millis(), ttlMillis, tagSet, size));
            accessOrder.put(key, ++accessCounter);
            for (String tag : tagSet) {
                tagIndex.computeIfAbsent(tag, ignored -> new HashSet<>()).add(key);
            }
            if (properties.isMetricsEnabled()) {
                sets++;
            }
        } finally {
            lock.unlock();
        }
        events.add(h -> h.onSet(key, value, tagSet));
        fireHooks(events);
        if (properties.isDetailedLogging()) {
            log.debug("Cache set for key: {} with tags: {}, size: {} bytes", key, tagSet, size);
        }
    }

    /**
     * Removes the entry, its access slot and every tag membership.
     *
     * @return whether an entry was removed
     */
    public boolean delete(String key) {
        List<Consumer<CacheHooks>> events = new ArrayList<>();
        boolean deleted;
        lock.lock();
        try {
            deleted = deleteLocked(key, events);
        } finally {
            lock.unlock();
        }
        fireHooks(events);
        return deleted;
    }

    /**
     * Same expiry semantics as {@link #get} without returning the value or touching recency.
     */
    public boolean has(String key) {
        List<Consumer<CacheHooks>> events = new ArrayList<>();
        boolean present;
        lock.lock();
        try {
            CacheEntry entry = entries.get(key);
            if (entry == null) {
                present = false;
            } else if (entry.isExpiredAt(clock.millis())) {
                deleteLocked(key, events);
                present = false;
            } else {
                present = true;
            }
        } finally {
            lock.unlock();
        }
        fireHooks(events);
        return present;
    }

    /**
     * Deletes every entry carrying {@code tag} and scrubs those keys from their other tag buckets.
     *
     * @return number of entries removed
     */
    public int invalidateByTag(String tag) {
        int invalidated = 0;
        lock.lock();
        try {
            Set<String> keys = tagIndex.remove(tag);
            if (keys == null) {
                return 0;
            }
            for (String key : keys) {
                CacheEntry entry = entries.remove(key);
                if (entry == null) {
                    continue;
                }
                accessOrder.remove(key);
                invalidated++;
                for (String otherTag : entry.tags()) {
                    if (!otherTag.equals(tag)) {
                        removeKeyFromBucketLocked(otherTag, key);
                    }
                }
            }
            if (properties.isMetricsEnabled()) {
                invalidations += invalidated;
            }
        } finally {
            lock.unlock();
        }
        int count = invalidated;
        fireHooks(List.of(h -> h.onInvalidate(tag, count)));
        log.info("Invalidated {} cache entries for tag: {}", count, tag);
        return count;
    }

    /**
     * Sums {@link #invalidateByTag} over {@code tags}. A key shared by two requested tags is removed once
     * but the total is the plain sum of per-tag results.
     */
    public int invalidateByTags(Collection<String> tags) {
        int total = 0;
        for (String tag : tags) {
            total += invalidateByTag(tag);
        }
        return total;
    }

    public void queueInvalidation(String tag) {
        lock.lock();
        try {
            invalidationQueue.add(tag);
        } finally {
            lock.unlock();
        }
    }

    /**
     * Applies and clears every queued tag invalidation.
     */
    public int processInvalidationQueue() {
        List<String> tags;
        lock.lock();
        try {
            tags = new ArrayList<>(invalidationQueue);
            invalidationQueue.clear();
        } finally {
            lock.unlock();
        }
        return tags.isEmpty() ? 0 : invalidateByTags(tags);
    }

    public void clear() {
        int size;
        lock.lock();
        try {
            size = entries.size();
            entries.clear();
            tagIndex.clear();
            accessOrder.clear();
            accessCounter = 0;
            invalidationQueue.clear();
        } finally {
            lock.unlock();
        }
        log.info("Cleared {} cache entries", size);
    }

    /**
     * Lists keys, optionally those where {@code pattern} finds a match.
     */
    public List<String> keys(@Nullable Pattern pattern) {
        List<String> snapshot;
        lock.lock();
        try {
            snapshot = new ArrayList<>(entries.keySet());
        } finally {
            lock.unlock();
        }
        if (pattern == null) {
            return snapshot;
        }
        return snapshot.stream().filter(key -> pattern.matcher(key).find()).toList();
    }

    public List<String> keys() {
        return keys(null);
    }

    public int size() {
        lock.lock();
        try {
            return entries.size();
        } finally {
            lock.unlock();
        }
    }

    /**
     * Tags that currently index at least one key.
     */
    public Set<String> tags() {
        lock.lock();
        try {
            return Set.copyOf(tagIndex.keySet());
        } finally {
            lock.unlock();
        }
    }

    public CacheStats getStats() {
        lock.lock();
        try {
            CacheMetricsSnapshot metrics = new CacheMetricsSnapshot(
                hits, misses, sets, deletes, evictions, invalidations, metricsStartTime);
            long totalRequests = metrics.totalRequests();
            double hitRate = totalRequests > 0 ? (hits * 100.0) / totalRequests : 0.0;
            double missRate = totalRequests > 0 ? (misses * 100.0) / totalRequests : 0.0;
            return new CacheStats(
                entries.size(),
                hitRate,
                missRate,
                estimateMemoryUsageLocked(),
                properties.getMaxSize(),
                metrics,
                clock.millis() - metricsStartTime
            );
        } finally {
            lock.unlock();
        }
    }

    /**
     * Advisory health: critical above 90% utilization, warning on high memory or a poor hit rate.
     */
    public CacheHealth getHealth() {
        CacheStats stats = getStats();
        List<String> issues = new ArrayList<>();
        List<String> recommendations = new ArrayList<>();
        CacheHealthStatus status = CacheHealthStatus.HEALTHY;

        if (stats.memoryEstimate() > HIGH_MEMORY_BYTES) {
            issues.add("High memory usage detected");
            recommendations.add("Consider reducing cache size or TTL");
            status = CacheHealthStatus.WARNING;
        }

        if (stats.hitRate() < LOW_HIT_RATE_PERCENT && stats.metrics().totalRequests() >= MIN_REQUESTS_FOR_HIT_RATE) {
            issues.add("Low cache hit rate");
            recommendations.add("Review caching strategy and TTL settings");
            status = CacheHealthStatus.WARNING;
        }

        double utilization = (stats.entries() * 100.0) / stats.maxSize();
        if (utilization > CRITICAL_UTILIZATION_PERCENT) {
            issues.add("Cache near capacity");
            recommendations.add("Increase cache size or implement more aggressive eviction");
            status = CacheHealthStatus.CRITICAL;
        }

        return new CacheHealth(status, issues, recommendations, stats);
    }

    /**
     * Runs every registered strategy.
     */
    public int warmup() {
        List<CacheWarmupStrategy> registered;
        lock.lock();
        try {
            registered = new ArrayList<>(warmupStrategies.values());
        } finally {
            lock.unlock();
        }
        return warmup(registered);
    }

    /**
     * Runs {@code strategies} in HIGH, MEDIUM, LOW order (registration order within a bucket). Each
     * generator runs outside the cache lock; a failing strategy is logged and skipped.
     *
     * @return number of entries stored
     */
    public int warmup(Collection<? extends CacheWarmupStrategy> strategies) {
        log.info("Starting cache warmup with {} strategies", strategies.size());
        List<CacheWarmupStrategy> ordered = new ArrayList<>(strategies);
        ordered.sort(Comparator.comparing(CacheWarmupStrategy::priority));

        int loaded = 0;
        for (CacheWarmupStrategy strategy : ordered) {
            try {
                log.debug("Executing warmup strategy: {}", strategy.name());
                List<WarmupEntry> data = strategy.generate();
                loaded += load(data);
                log.debug("Completed warmup strategy: {} ({} entries)", strategy.name(), data.size());
            } catch (Exception e) {
                log.error("Failed to execute warmup strategy: {}", strategy.name(), e);
            }
        }
        log.info("Cache warmup completed ({} entries)", loaded);
        return loaded;
    }

    /**
     * Stores pre-built warmup entries in order.
     */
    public int load(List<WarmupEntry> data) {
        if (data == null) {
            return 0;
        }
        for (WarmupEntry item : data) {
            Duration ttl = item.ttlMillis() == null ? null : Duration.ofMillis(item.ttlMillis());
            set(item.key(), item.value(), ttl, item.tags());
        }
        return data.size();
    }

    /**
     * Loads every missing key through {@code loader} and tags it {@value #CRITICAL_TAG}.
     *
     * @return number of keys loaded
     */
    public int preloadCritical(Collection<String> keys, CriticalValueLoader loader) {
        log.info("Preloading {} critical cache entries", keys.size());
        int loaded = 0;
        for (String key : keys) {
            try {
                if (!has(key)) {
                    set(key, loader.load(key), null, List.of(CRITICAL_TAG));
                    loaded++;
                }
            } catch (Exception e) {
                log.error("Failed to preload key: {}", key, e);
            }
        }
        log.info("Critical cache preloading completed ({} loaded)", loaded);
        return loaded;
    }

    /**
     * Snapshot of every non-expired entry with decoded values.
     */
    public List<ExportedCacheEntry> export() {
        Map<String, CacheEntry> snapshot;
        long now;
        lock.lock();
        try {
            snapshot = new LinkedHashMap<>(entries);
            now = clock.millis();
        } finally {
            lock.unlock();
        }
        List<ExportedCacheEntry> exported = new ArrayList<>();
        snapshot.forEach((key, entry) -> {
            if (!entry.isExpiredAt(now)) {
                exported.add(new ExportedCacheEntry(key, decode(key, entry.value()), entry.ttlMillis(),
                    List.copyOf(entry.tags()), entry.createdAt()));
            }
        });
        return exported;
    }

    /**
     * Restores exported entries with their remaining TTL; entries whose TTL has run out are skipped.
     *
     * @return number of entries imported
     */
    public int importEntries(List<ExportedCacheEntry> data) {
        int imported = 0;
        long now = clock.millis();
        for (ExportedCacheEntry item : data) {
            long remainingTtl = item.ttl() - (now - item.createdAt());
            if (remainingTtl <= 0) {
                continue;
            }
            set(item.key(), item.value(), Duration.ofMillis(remainingTtl), item.tags());
            imported++;
        }
        log.info("Imported {} cache entries", imported);
        return imported;
    }

    /**
     * Eagerly removes every expired entry regardless of access pattern.
     *
     * @return number of entries removed
     */
    public int sweepExpired() {
        List<Consumer<CacheHooks>> events = new ArrayList<>();
        int cleaned = 0;
        lock.lock();
        try {
            long now = clock.millis();
            List<String> expired = new ArrayList<>();
            entries.forEach((key, entry) -> {
                if (entry.isExpiredAt(now)) {
                    expired.add(key);
                }
            });
            for (String key : expired) {
                deleteLocked(key, events);
                events.add(h -> h.onEvict(key, EvictionReason.EXPIRED));
                cleaned++;
            }
        } finally {
            lock.unlock();
        }
        fireHooks(events);
        if (cleaned > 0) {
            log.debug("Cleaned up {} expired cache entries", cleaned);
        }
        return cleaned;
    }

    private void sweepExpiredSafely() {
        try {
            sweepExpired();
        } catch (RuntimeException e) {
            log.error("Cache sweep failed", e);
        }
    }

    private boolean deleteLocked(String key, List<Consumer<CacheHooks>> events) {
        removeFromTagIndexLocked(key, null);
        boolean deleted = entries.remove(key) != null;
        accessOrder.remove(key);
        if (deleted) {
            if (properties.isMetricsEnabled()) {
                deletes++;
            }
            events.add(h -> h.onDelete(key));
            if (properties.isDetailedLogging()) {
                log.debug("Cache deleted for key: {}", key);
            }
        }
        return deleted;
    }

    private void evictLruLocked(List<Consumer<CacheHooks>> events) {
        String lruKey = null;
        long lruAccess = Long.MAX_VALUE;
        for (Map.Entry<String, Long> candidate : accessOrder.entrySet()) {
            if (candidate.getValue() < lruAccess) {
                lruAccess = candidate.getValue();
                lruKey = candidate.getKey();
            }
        }
        if (lruKey == null) {
            return;
        }
        String evicted = lruKey;
        deleteLocked(evicted, events);
        if (properties.isMetricsEnabled()) {
            evictions++;
        }
        events.add(h -> h.onEvict(evicted, EvictionReason.LRU));
        if (properties.isDetailedLogging()) {
            log.debug("Evicted LRU entry: {}", evicted);
        }
    }

    private void removeFromTagIndexLocked(String key, @Nullable String excludeTag) {
        CacheEntry entry = entries.get(key);
        if (entry == null) {
            return;
        }
        for (String tag : entry.tags()) {
            if (!tag.equals(excludeTag)) {
                removeKeyFromBucketLocked(tag, key);
            }
        }
    }

    private void removeKeyFromBucketLocked(String tag, String key) {
        Set<String> bucket = tagIndex.get(tag);
        if (bucket != null) {
            bucket.remove(key);
            if (bucket.isEmpty()) {
                tagIndex.remove(tag);
            }
        }
    }

    private void recordHitLocked(String key, List<Consumer<CacheHooks>> events) {
        if (properties.isMetricsEnabled()) {
            hits++;
        }
        events.add(h -> h.onGet(key, true));
        if (properties.isDetailedLogging()) {
            log.debug("Cache hit for key: {}", key);
        }
    }

    private void recordMissLocked(String key, @Nullable String reason, List<Consumer<CacheHooks>> events) {
        if (properties.isMetricsEnabled()) {
            misses++;
        }
        events.add(h -> h.onGet(key, false));
        if (properties.isDetailedLogging()) {
            log.debug("Cache miss for key: {}{}", key, reason != null ? " (" + reason + ")" : "");
        }
    }

    private long estimateMemoryUsageLocked() {
        long size = 0;
        for (CacheEntry entry : entries.values()) {
            size += entry.approxSizeBytes();
        }
        size += tagIndex.size() * TAG_BUCKET_OVERHEAD_BYTES;
        size += accessOrder.size() * ACCESS_SLOT_OVERHEAD_BYTES;
        return size;
    }

    private CacheValue encode(Object value) {
        if (properties.isCompressionEnabled()
            && value instanceof String text
            && text.length() > properties.getCompressionThreshold()) {
            return new CacheValue.Compressed(CompressionUtils.gzipUtf8(text), text.length());
        }
        return new CacheValue.Plain(value);
    }

    private Object decode(String key, CacheValue stored) {
        if (stored instanceof CacheValue.Compressed compressed) {
            try {
                return CompressionUtils.decodeUtf8ExpectingGzip(compressed.gzipBytes());
            } catch (IOException e) {
                log.warn("Failed to decompress cache value for key: {}", key, e);
                return null;
            }
        }
        return ((CacheValue.Plain) stored).value();
    }

    private long estimateEntrySize(String key, CacheValue encoded) {
        long valueLength;
        if (encoded instanceof CacheValue.Compressed compressed) {
            valueLength = compressed.gzipBytes().length;
        } else {
            Object value = ((CacheValue.Plain) encoded).value();
            try {
                valueLength = objectMapper.writeValueAsString(value).length();
            } catch (JsonProcessingException e) {
                log.debug("Falling back to toString size estimate for key {}: {}", key, e.getOriginalMessage());
                valueLength = String.valueOf(value).length();
            }
        }
        return key.length() * 2L + valueLength * 2L + ENTRY_OVERHEAD_BYTES;
    }

    private void fireHooks(List<Consumer<CacheHooks>> events) {
        if (events.isEmpty() || hooks.isEmpty()) {
            return;
        }
        for (CacheHooks observer : hooks) {
            for (Consumer<CacheHooks> event : events) {
                try {
                    event.accept(observer);
                } catch (RuntimeException e) {
                    log.warn("Cache hook {} failed: {}", observer.getClass().getSimpleName(), e.getMessage());
                }
            }
        }
    }
}
