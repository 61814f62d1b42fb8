package net.seoedge.config;

import jakarta.annotation.PostConstruct;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;
import org.springframework.util.Assert;

import java.util.ArrayList;
import java.util.List;

/**
 * Behavior of the request edge filter.
 */
@Component
@ConfigurationProperties(prefix = "seo.edge")
public class SeoEdgeProperties {

    private boolean redirectsEnabled = true;

    /**
     * Adds {@code X-Redirect-Reason} to redirect responses; keep off in production.
     */
    private boolean exposeRedirectReason = true;

    /**
     * Injects hreflang link tags into HTML responses.
     */
    private boolean injectHeadTags = true;

    private String localeParameter = "locale";

    private String localeCookie = "locale";

    private String redirectCacheControl = "public, max-age=31536000";

    /**
     * Path prefixes the filter never touches: APIs, admin, health and static assets.
     */
    private List<String> skipPrefixes = new ArrayList<>(List.of(
        "/api/", "/admin/", "/auth/", "/actuator", "/health", "/metrics", "/robots.txt", "/sitemap",
        "/favicon.ico", "/manifest.json", "/.well-known/", "/static/", "/assets/", "/public/",
        "/uploads/", "/images/", "/css/", "/js/", "/fonts/"));

    @PostConstruct
    void validate() {
        Assert.hasText(localeParameter, "seo.edge.locale-parameter must not be blank");
        Assert.hasText(localeCookie, "seo.edge.locale-cookie must not be blank");
    }

    public boolean isRedirectsEnabled() {
        return redirectsEnabled;
    }

    public void setRedirectsEnabled(boolean redirectsEnabled) {
        this.redirectsEnabled = redirectsEnabled;
    }

    public boolean isExposeRedirectReason() {
        return exposeRedirectReason;
    }

    public void setExposeRedirectReason(boolean exposeRedirectReason) {
        this.exposeRedirectReason = exposeRedirectReason;
    }

    public boolean isInjectHeadTags() {
        return injectHeadTags;
    }

    public void setInjectHeadTags(boolean injectHeadTags) {
        this.injectHeadTags = injectHeadTags;
    }

    public String getLocaleParameter() {
        return localeParameter;
    }

    public void setLocaleParameter(String localeParameter) {
        this.localeParameter = localeParameter;
    }

    public String getLocaleCookie() {
        return localeCookie;
    }

    public void setLocaleCookie(String localeCookie) {
        this.localeCookie = localeCookie;
    }

    public String getRedirectCacheControl() {
        return redirectCacheControl;
    }

    public void setRedirectCacheControl(String redirectCacheControl) {
        this.redirectCacheControl = redirectCacheControl;
    }

    public List<String> getSkipPrefixes() {
        return skipPrefixes;
    }

    public void setSkipPrefixes(List<String> skipPrefixes) {
        this.skipPrefixes = skipPrefixes != null ? skipPrefixes : new ArrayList<>();
    }
}
