package net.seoedge.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import net.seoedge.service.TaggedCache;
import net.seoedge.support.cache.CacheHooks;
import net.seoedge.support.url.UrlNormalizer;
import net.seoedge.support.url.UrlSecurityValidator;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.TaskScheduler;

import java.time.Clock;
import java.util.List;

/**
 * Wires the shared SEO engines. Each is a singleton constructed once and injected where needed.
 */
@Configuration
public class SeoEdgeConfig {

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    /**
     * The sweep is scheduled on start and cancelled, with the invalidation queue drained, on shutdown.
     */
    @Bean(initMethod = "start", destroyMethod = "shutdown")
    public TaggedCache taggedCache(SeoCacheProperties cacheProperties,
                                   Clock clock,
                                   ObjectMapper objectMapper,
                                   TaskScheduler taskScheduler,
                                   ObjectProvider<CacheHooks> cacheHooks) {
        List<CacheHooks> hooks = cacheHooks.orderedStream().toList();
        return new TaggedCache(cacheProperties, clock, objectMapper, taskScheduler, hooks);
    }

    @Bean
    public UrlNormalizer urlNormalizer(SeoUrlProperties urlProperties) {
        return new UrlNormalizer(urlProperties.normalizationOptions());
    }

    @Bean
    public UrlSecurityValidator urlSecurityValidator(SeoUrlProperties urlProperties) {
        return new UrlSecurityValidator(urlProperties.securityOptions());
    }
}
