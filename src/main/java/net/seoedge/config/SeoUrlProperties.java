package net.seoedge.config;

import jakarta.annotation.PostConstruct;
import lombok.extern.slf4j.Slf4j;
import net.seoedge.domain.redirect.NormalizationOptions;
import net.seoedge.domain.redirect.SecurityOptions;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;
import org.springframework.util.Assert;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * Strongly typed configuration for URL normalization, validation and redirect resolution.
 */
@Slf4j
@Component
@ConfigurationProperties(prefix = "seo.url")
public class SeoUrlProperties {

    /**
     * Public site origin used for canonical and redirect targets.
     */
    private String siteUrl = "https://example.com";

    /**
     * Memoize redirect decisions in the tagged cache.
     */
    private boolean cacheEnabled = true;

    /**
     * Lifetime of a memoized redirect decision.
     */
    private Duration decisionTtl = Duration.ofHours(1);

    /**
     * Maximum number of compiled regex rule patterns kept in memory.
     */
    private int patternCacheSize = 500;

    private final Normalization normalization = new Normalization();

    private final Security security = new Security();

    @PostConstruct
    void validate() {
        Assert.hasText(siteUrl, "seo.url.site-url must not be blank");
        Assert.isTrue(!decisionTtl.isNegative() && !decisionTtl.isZero(), "seo.url.decision-ttl must be positive");
        Assert.isTrue(patternCacheSize > 0, "seo.url.pattern-cache-size must be positive");
        Assert.isTrue(security.maxUrlLength > 0, "seo.url.security.max-url-length must be positive");
        if (normalization.removeTrailingSlash && normalization.enforceTrailingSlash) {
            log.warn("Both seo.url.normalization.remove-trailing-slash and enforce-trailing-slash are set; removal wins");
        }
    }

    public String getSiteUrl() {
        return siteUrl;
    }

    public void setSiteUrl(String siteUrl) {
        this.siteUrl = siteUrl;
    }

    public boolean isCacheEnabled() {
        return cacheEnabled;
    }

    public void setCacheEnabled(boolean cacheEnabled) {
        this.cacheEnabled = cacheEnabled;
    }

    public Duration getDecisionTtl() {
        return decisionTtl;
    }

    public void setDecisionTtl(Duration decisionTtl) {
        this.decisionTtl = decisionTtl != null ? decisionTtl : Duration.ofHours(1);
    }

    public int getPatternCacheSize() {
        return patternCacheSize;
    }

    public void setPatternCacheSize(int patternCacheSize) {
        this.patternCacheSize = patternCacheSize;
    }

    public Normalization getNormalization() {
        return normalization;
    }

    public Security getSecurity() {
        return security;
    }

    public NormalizationOptions normalizationOptions() {
        return new NormalizationOptions(
            normalization.enforceHttps,
            normalization.removeWww,
            normalization.enforceLowercase,
            normalization.removeIndexHtml,
            normalization.removeTrailingSlash,
            normalization.enforceTrailingSlash,
            normalization.removeQueryParams,
            normalization.sortQueryParams
        );
    }

    public SecurityOptions securityOptions() {
        return new SecurityOptions(
            security.allowedProtocols,
            security.blockedPaths,
            security.maxUrlLength,
            security.allowedFileExtensions,
            security.sanitizeSpecialChars,
            security.preventDirectoryTraversal
        );
    }

    public static class Normalization {

        private boolean enforceHttps = true;
        private boolean removeWww = false;
        private boolean enforceLowercase = true;
        private boolean removeIndexHtml = true;
        private boolean removeTrailingSlash = true;
        private boolean enforceTrailingSlash = false;

        /**
         * Query parameter names stripped from every URL, typically tracking parameters.
         */
        private List<String> removeQueryParams = new ArrayList<>(List.of("utm_source", "utm_medium", "utm_campaign"));

        private boolean sortQueryParams = true;

        public boolean isEnforceHttps() {
            return enforceHttps;
        }

        public void setEnforceHttps(boolean enforceHttps) {
            this.enforceHttps = enforceHttps;
        }

        public boolean isRemoveWww() {
            return removeWww;
        }

        public void setRemoveWww(boolean removeWww) {
            this.removeWww = removeWww;
        }

        public boolean isEnforceLowercase() {
            return enforceLowercase;
        }

        public void setEnforceLowercase(boolean enforceLowercase) {
            this.enforceLowercase = enforceLowercase;
        }

        public boolean isRemoveIndexHtml() {
            return removeIndexHtml;
        }

        public void setRemoveIndexHtml(boolean removeIndexHtml) {
            this.removeIndexHtml = removeIndexHtml;
        }

        public boolean isRemoveTrailingSlash() {
            return removeTrailingSlash;
        }

        public void setRemoveTrailingSlash(boolean removeTrailingSlash) {
            this.removeTrailingSlash = removeTrailingSlash;
        }

        public boolean isEnforceTrailingSlash() {
            return enforceTrailingSlash;
        }

        public void setEnforceTrailingSlash(boolean enforceTrailingSlash) {
            this.enforceTrailingSlash = enforceTrailingSlash;
        }

        public List<String> getRemoveQueryParams() {
            return removeQueryParams;
        }

        public void setRemoveQueryParams(List<String> removeQueryParams) {
            this.removeQueryParams = removeQueryParams != null ? removeQueryParams : new ArrayList<>();
        }

        public boolean isSortQueryParams() {
            return sortQueryParams;
        }

        public void setSortQueryParams(boolean sortQueryParams) {
            this.sortQueryParams = sortQueryParams;
        }
    }

    public static class Security {

        private List<String> allowedProtocols = new ArrayList<>(List.of("http", "https"));
        private List<String> blockedPaths = new ArrayList<>(List.of("/admin", "/api/internal", "/.env"));
        private int maxUrlLength = 2048;
        private List<String> allowedFileExtensions =
            new ArrayList<>(List.of(".html", ".htm", ".php", ".asp", ".aspx", ".jsp"));
        private boolean sanitizeSpecialChars = true;
        private boolean preventDirectoryTraversal = true;

        public List<String> getAllowedProtocols() {
            return allowedProtocols;
        }

        public void setAllowedProtocols(List<String> allowedProtocols) {
            this.allowedProtocols = allowedProtocols != null ? allowedProtocols : new ArrayList<>();
        }

        public List<String> getBlockedPaths() {
            return blockedPaths;
        }

        public void setBlockedPaths(List<String> blockedPaths) {
            this.blockedPaths = blockedPaths != null ? blockedPaths : new ArrayList<>();
        }

        public int getMaxUrlLength() {
            return maxUrlLength;
        }

        public void setMaxUrlLength(int maxUrlLength) {
            this.maxUrlLength = maxUrlLength;
        }

        public List<String> getAllowedFileExtensions() {
            return allowedFileExtensions;
        }

        public void setAllowedFileExtensions(List<String> allowedFileExtensions) {
            this.allowedFileExtensions = allowedFileExtensions != null ? allowedFileExtensions : new ArrayList<>();
        }

        public boolean isSanitizeSpecialChars() {
            return sanitizeSpecialChars;
        }

        public void setSanitizeSpecialChars(boolean sanitizeSpecialChars) {
            this.sanitizeSpecialChars = sanitizeSpecialChars;
        }

        public boolean isPreventDirectoryTraversal() {
            return preventDirectoryTraversal;
        }

        public void setPreventDirectoryTraversal(boolean preventDirectoryTraversal) {
            this.preventDirectoryTraversal = preventDirectoryTraversal;
        }
    }
}
