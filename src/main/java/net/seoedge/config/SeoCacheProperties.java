package net.seoedge.config;

import jakarta.annotation.PostConstruct;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;
import org.springframework.util.Assert;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * Strongly typed configuration for the tagged SEO cache.
 */
@Component
@ConfigurationProperties(prefix = "seo.cache")
public class SeoCacheProperties {

    /**
     * Maximum number of entries before LRU eviction kicks in.
     */
    private int maxSize = 1000;

    /**
     * TTL applied when a caller does not pass one.
     */
    private Duration defaultTtl = Duration.ofHours(1);

    /**
     * Log every hit, miss, set and eviction at debug level.
     */
    private boolean detailedLogging = false;

    /**
     * Maintain hit/miss/set counters.
     */
    private boolean metricsEnabled = true;

    /**
     * Gzip string values longer than {@link #compressionThreshold} characters.
     */
    private boolean compressionEnabled = false;

    private int compressionThreshold = 1000;

    /**
     * Interval of the eager expired-entry sweep.
     */
    private Duration sweepInterval = Duration.ofMinutes(5);

    /**
     * Run registered warmup strategies once the application is ready.
     */
    private boolean warmupOnStartup = true;

    /**
     * Page paths whose hreflang alternates are generated during warmup.
     */
    private List<String> warmupPaths = new ArrayList<>(List.of("/"));

    @PostConstruct
    void validate() {
        Assert.isTrue(maxSize > 0, "seo.cache.max-size must be positive");
        Assert.isTrue(!defaultTtl.isNegative() && !defaultTtl.isZero(), "seo.cache.default-ttl must be positive");
        Assert.isTrue(!sweepInterval.isNegative() && !sweepInterval.isZero(), "seo.cache.sweep-interval must be positive");
        Assert.isTrue(compressionThreshold >= 0, "seo.cache.compression-threshold must be non-negative");
    }

    public int getMaxSize() {
        return maxSize;
    }

    public void setMaxSize(int maxSize) {
        this.maxSize = maxSize;
    }

    public Duration getDefaultTtl() {
        return defaultTtl;
    }

    public void setDefaultTtl(Duration defaultTtl) {
        this.defaultTtl = defaultTtl != null ? defaultTtl : Duration.ofHours(1);
    }

    public boolean isDetailedLogging() {
        return detailedLogging;
    }

    public void setDetailedLogging(boolean detailedLogging) {
        this.detailedLogging = detailedLogging;
    }

    public boolean isMetricsEnabled() {
        return metricsEnabled;
    }

    public void setMetricsEnabled(boolean metricsEnabled) {
        this.metricsEnabled = metricsEnabled;
    }

    public boolean isCompressionEnabled() {
        return compressionEnabled;
    }

    public void setCompressionEnabled(boolean compressionEnabled) {
        this.compressionEnabled = compressionEnabled;
    }

    public int getCompressionThreshold() {
        return compressionThreshold;
    }

    public void setCompressionThreshold(int compressionThreshold) {
        this.compressionThreshold = compressionThreshold;
    }

    public Duration getSweepInterval() {
        return sweepInterval;
    }

    public void setSweepInterval(Duration sweepInterval) {
        this.sweepInterval = sweepInterval != null ? sweepInterval : Duration.ofMinutes(5);
    }

    public boolean isWarmupOnStartup() {
        return warmupOnStartup;
    }

    public void setWarmupOnStartup(boolean warmupOnStartup) {
        this.warmupOnStartup = warmupOnStartup;
    }

    public List<String> getWarmupPaths() {
        return warmupPaths;
    }

    public void setWarmupPaths(List<String> warmupPaths) {
        this.warmupPaths = warmupPaths != null ? warmupPaths : new ArrayList<>();
    }
}
