/**
 * Web MVC wiring for the SEO edge
 *
 * Features:
 * - Registers the SEO edge filter for page requests
 * - Runs it early so redirects are answered before any handler work
 */
package net.seoedge.config;

import jakarta.servlet.DispatcherType;
import net.seoedge.SeoEdgeFilter;
import net.seoedge.service.LocaleRegistry;
import net.seoedge.service.RedirectResolver;
import net.seoedge.support.seo.HeadTagInjector;
import net.seoedge.support.seo.HreflangLinkRenderer;
import org.springframework.boot.web.servlet.FilterRegistrationBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.Ordered;

@Configuration
public class WebConfig {

    // After forwarded-header and character-encoding filters
    private static final int SEO_EDGE_FILTER_ORDER = Ordered.HIGHEST_PRECEDENCE + 100;

    @Bean
    public SeoEdgeFilter seoEdgeFilter(RedirectResolver redirectResolver,
                                       LocaleRegistry localeRegistry,
                                       HreflangLinkRenderer hreflangLinkRenderer,
                                       HeadTagInjector headTagInjector,
                                       SeoEdgeProperties seoEdgeProperties) {
        return new SeoEdgeFilter(redirectResolver, localeRegistry, hreflangLinkRenderer, headTagInjector,
            seoEdgeProperties);
    }

    /**
     * Registers the SEO edge filter for top-level requests only.
     *
     * @param seoEdgeFilter filter bean
     * @return ordered filter registration
     */
    @Bean
    public FilterRegistrationBean<SeoEdgeFilter> seoEdgeFilterRegistration(SeoEdgeFilter seoEdgeFilter) {
        FilterRegistrationBean<SeoEdgeFilter> registration = new FilterRegistrationBean<>(seoEdgeFilter);
        registration.setDispatcherTypes(DispatcherType.REQUEST);
        registration.setOrder(SEO_EDGE_FILTER_ORDER);
        return registration;
    }
}
