package net.seoedge.domain.cache;

import java.util.List;

/**
 * Advisory health verdict derived from {@link CacheStats}. Nothing is enforced from it.
 */
public record CacheHealth(
    CacheHealthStatus status,
    List<String> issues,
    List<String> recommendations,
    CacheStats stats
) {

    public CacheHealth {
        issues = issues == null ? List.of() : List.copyOf(issues);
        recommendations = recommendations == null ? List.of() : List.copyOf(recommendations);
    }
}
