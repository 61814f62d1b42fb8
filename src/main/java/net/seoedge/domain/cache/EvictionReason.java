package net.seoedge.domain.cache;

/**
 * Why an entry left the cache without an explicit delete.
 */
public enum EvictionReason {
    LRU,
    EXPIRED,
    MANUAL
}
