package net.seoedge.config;

import jakarta.annotation.PostConstruct;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;
import org.springframework.util.Assert;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * Locale selection and metadata overrides. Built-in locales are en, es, fr, de, ja and ar.
 */
@Component
@ConfigurationProperties(prefix = "seo.locale")
public class LocaleProperties {

    private String defaultLocale = "en";

    private List<String> enabledLocales = new ArrayList<>(List.of("en", "es", "fr", "de", "ja", "ar"));

    /**
     * Origin for hreflang and localized URLs; falls back to {@code seo.url.site-url} when blank.
     */
    private String baseUrl;

    private Duration hreflangTtl = Duration.ofHours(1);

    /**
     * Entries replacing a built-in locale's metadata (matched by code) or adding a new locale.
     */
    private List<Definition> overrides = new ArrayList<>();

    @PostConstruct
    void validate() {
        Assert.hasText(defaultLocale, "seo.locale.default-locale must not be blank");
        Assert.isTrue(enabledLocales.contains(defaultLocale),
            "seo.locale.enabled-locales must contain the default locale '" + defaultLocale + "'");
        Assert.isTrue(!hreflangTtl.isNegative() && !hreflangTtl.isZero(), "seo.locale.hreflang-ttl must be positive");
        for (Definition override : overrides) {
            Assert.hasText(override.getCode(), "seo.locale.overrides[].code must not be blank");
        }
    }

    public String getDefaultLocale() {
        return defaultLocale;
    }

    public void setDefaultLocale(String defaultLocale) {
        this.defaultLocale = defaultLocale;
    }

    public List<String> getEnabledLocales() {
        return enabledLocales;
    }

    public void setEnabledLocales(List<String> enabledLocales) {
        this.enabledLocales = enabledLocales != null ? enabledLocales : new ArrayList<>();
    }

    public String getBaseUrl() {
        return baseUrl;
    }

    public void setBaseUrl(String baseUrl) {
        this.baseUrl = baseUrl;
    }

    public Duration getHreflangTtl() {
        return hreflangTtl;
    }

    public void setHreflangTtl(Duration hreflangTtl) {
        this.hreflangTtl = hreflangTtl != null ? hreflangTtl : Duration.ofHours(1);
    }

    public List<Definition> getOverrides() {
        return overrides;
    }

    public void setOverrides(List<Definition> overrides) {
        this.overrides = overrides != null ? overrides : new ArrayList<>();
    }

    public static class Definition {

        private String code;
        private String name;
        private String nativeName;
        private String region;
        private String direction = "ltr";
        private String currency;
        private String dateFormat;
        private String numberFormat;

        public String getCode() {
            return code;
        }

        public void setCode(String code) {
            this.code = code;
        }

        public String getName() {
            return name;
        }

        public void setName(String name) {
            this.name = name;
        }

        public String getNativeName() {
            return nativeName;
        }

        public void setNativeName(String nativeName) {
            this.nativeName = nativeName;
        }

        public String getRegion() {
            return region;
        }

        public void setRegion(String region) {
            this.region = region;
        }

        public String getDirection() {
            return direction;
        }

        public void setDirection(String direction) {
            this.direction = direction;
        }

        public String getCurrency() {
            return currency;
        }

        public void setCurrency(String currency) {
            this.currency = currency;
        }

        public String getDateFormat() {
            return dateFormat;
        }

        public void setDateFormat(String dateFormat) {
            this.dateFormat = dateFormat;
        }

        public String getNumberFormat() {
            return numberFormat;
        }

        public void setNumberFormat(String numberFormat) {
            this.numberFormat = numberFormat;
        }
    }
}
