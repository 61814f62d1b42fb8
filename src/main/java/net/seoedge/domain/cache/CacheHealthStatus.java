package net.seoedge.domain.cache;

public enum CacheHealthStatus {
    HEALTHY,
    WARNING,
    CRITICAL
}
