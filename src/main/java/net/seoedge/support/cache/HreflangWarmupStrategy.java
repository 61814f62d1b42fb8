package net.seoedge.support.cache;

import net.seoedge.config.SeoCacheProperties;
import net.seoedge.domain.cache.WarmupEntry;
import net.seoedge.domain.cache.WarmupPriority;
import net.seoedge.service.LocaleRegistry;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Precomputes hreflang alternates for the configured warmup paths in every enabled locale.
 */
@Component
public class HreflangWarmupStrategy implements CacheWarmupStrategy {

    private final LocaleRegistry localeRegistry;
    private final SeoCacheProperties cacheProperties;

    public HreflangWarmupStrategy(LocaleRegistry localeRegistry, SeoCacheProperties cacheProperties) {
        this.localeRegistry = localeRegistry;
        this.cacheProperties = cacheProperties;
    }

    @Override
    public String name() {
        return "hreflang";
    }

    @Override
    public WarmupPriority priority() {
        return WarmupPriority.HIGH;
    }

    @Override
    public List<WarmupEntry> generate() {
        return localeRegistry.hreflangWarmupEntries(cacheProperties.getWarmupPaths());
    }
}
