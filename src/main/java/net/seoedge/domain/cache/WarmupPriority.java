package net.seoedge.domain.cache;

/**
 * Execution bucket for warmup strategies; declaration order is execution order.
 */
public enum WarmupPriority {
    HIGH,
    MEDIUM,
    LOW
}
