/**
 * Registry of supported locales for localized routing and hreflang output
 *
 * Features:
 * - Locale detection from URL prefix, Accept-Language, cookie and default
 * - Hreflang alternates memoized in the tagged cache
 * - Inverse extract/build helpers for locale-prefixed paths
 * - Atomic, validated configuration mutations keeping exactly one enabled default
 */
package net.seoedge.service;

import jakarta.annotation.Nullable;
import lombok.extern.slf4j.Slf4j;
import net.seoedge.config.LocaleProperties;
import net.seoedge.config.SeoUrlProperties;
import net.seoedge.domain.cache.WarmupEntry;
import net.seoedge.domain.locale.DetectionSource;
import net.seoedge.domain.locale.HreflangTag;
import net.seoedge.domain.locale.LocaleConfig;
import net.seoedge.domain.locale.LocaleDetection;
import net.seoedge.domain.locale.LocalePath;
import net.seoedge.domain.locale.LocaleStats;
import net.seoedge.domain.locale.LocalizedUrl;
import net.seoedge.domain.locale.TextDirection;
import net.seoedge.exception.LocaleConfigurationException;
import org.springframework.stereotype.Service;
import org.springframework.util.StringUtils;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.locks.ReentrantLock;

@Slf4j
@Service
public class LocaleRegistry {

    public static final String LOCALE_TAG = "locale";
    public static final String HREFLANG_TAG = "hreflang";

    static final double URL_CONFIDENCE = 1.0;
    static final double COOKIE_CONFIDENCE = 0.8;
    static final double DEFAULT_CONFIDENCE = 0.5;

    private static final String HREFLANG_KEY_PREFIX = "hreflang:";

    private static final List<LocaleConfig> BUILT_IN_LOCALES = List.of(
        new LocaleConfig("en", "English", "English", "US", TextDirection.LTR, "USD", "MM/DD/YYYY", "en-US", true, false),
        new LocaleConfig("es", "Spanish", "Español", "ES", TextDirection.LTR, "EUR", "DD/MM/YYYY", "es-ES", true, false),
        new LocaleConfig("fr", "French", "Français", "FR", TextDirection.LTR, "EUR", "DD/MM/YYYY", "fr-FR", true, false),
        new LocaleConfig("de", "German", "Deutsch", "DE", TextDirection.LTR, "EUR", "DD.MM.YYYY", "de-DE", true, false),
        new LocaleConfig("ja", "Japanese", "日本語", "JP", TextDirection.LTR, "JPY", "YYYY/MM/DD", "ja-JP", true, false),
        new LocaleConfig("ar", "Arabic", "العربية", "SA", TextDirection.RTL, "SAR", "DD/MM/YYYY", "ar-SA", true, false)
    );

    private final TaggedCache cache;
    private final LocaleProperties localeProperties;
    private final SeoUrlProperties urlProperties;

    // Copy-on-write snapshot, replaced whole under mutationLock
    private final ReentrantLock mutationLock = new ReentrantLock();
    private volatile Map<String, LocaleConfig> locales;
    // Bumped on every table replacement, before locale caches are invalidated
    private final AtomicLong configVersion = new AtomicLong();

    public LocaleRegistry(LocaleProperties localeProperties, SeoUrlProperties urlProperties, TaggedCache cache) {
        this.localeProperties = localeProperties;
        this.urlProperties = urlProperties;
        this.cache = cache;
        this.locales = initialLocales(localeProperties);
        List<String> problems = invariantViolations(locales);
        if (!problems.isEmpty()) {
            throw new LocaleConfigurationException(localeProperties.getDefaultLocale(), problems);
        }
        log.info("Initialized {} locales, default: {}", locales.size(), getDefaultLocale());
    }

    private static Map<String, LocaleConfig> initialLocales(LocaleProperties properties) {
        Map<String, LocaleConfig> table = new LinkedHashMap<>();
        for (LocaleConfig builtIn : BUILT_IN_LOCALES) {
            table.put(builtIn.code(), builtIn);
        }
        for (LocaleProperties.Definition override : properties.getOverrides()) {
            table.put(override.getCode(), new LocaleConfig(
                override.getCode(),
                override.getName(),
                override.getNativeName(),
                override.getRegion(),
                TextDirection.fromValue(override.getDirection()),
                override.getCurrency(),
                override.getDateFormat(),
                override.getNumberFormat(),
                true,
                false));
        }
        Map<String, LocaleConfig> resolved = new LinkedHashMap<>();
        table.forEach((code, config) -> resolved.put(code, config
            .withEnabled(properties.getEnabledLocales().contains(code))
            .withDefaultLocale(code.equals(properties.getDefaultLocale()))));
        return Collections.unmodifiableMap(resolved);
    }

    public List<LocaleConfig> getAllLocales() {
        return List.copyOf(locales.values());
    }

    public List<LocaleConfig> getEnabledLocales() {
        return locales.values().stream().filter(LocaleConfig::enabled).toList();
    }

    public List<String> getEnabledLocaleCodes() {
        return locales.values().stream().filter(LocaleConfig::enabled).map(LocaleConfig::code).toList();
    }

    public Optional<LocaleConfig> getLocale(String code) {
        return code == null ? Optional.empty() : Optional.ofNullable(locales.get(code));
    }

    public String getDefaultLocale() {
        return locales.values().stream()
            .filter(LocaleConfig::defaultLocale)
            .map(LocaleConfig::code)
            .findFirst()
            .orElseThrow(() -> new IllegalStateException("Locale registry has no default locale"));
    }

    /**
     * Whether {@code code} names an enabled locale.
     */
    public boolean isSupported(@Nullable String code) {
        if (code == null) {
            return false;
        }
        LocaleConfig config = locales.get(code);
        return config != null && config.enabled();
    }

    /**
     * Picks the locale for a request. Priority: URL locale, then the best Accept-Language match, then
     * the cookie, then the default locale.
     */
    public LocaleDetection detectLocale(@Nullable String acceptLanguage,
                                        @Nullable String cookieLocale,
                                        @Nullable String urlLocale) {
        if (isSupported(urlLocale)) {
            return detection(urlLocale, URL_CONFIDENCE, DetectionSource.URL);
        }
        if (StringUtils.hasText(acceptLanguage)) {
            for (LanguagePreference preference : parseAcceptLanguage(acceptLanguage)) {
                if (isSupported(preference.code())) {
                    return detection(preference.code(), preference.quality(), DetectionSource.HEADER);
                }
            }
        }
        if (isSupported(cookieLocale)) {
            return detection(cookieLocale, COOKIE_CONFIDENCE, DetectionSource.COOKIE);
        }
        return detection(getDefaultLocale(), DEFAULT_CONFIDENCE, DetectionSource.DEFAULT);
    }

    private LocaleDetection detection(String code, double confidence, DetectionSource source) {
        List<String> alternatives = getEnabledLocaleCodes().stream().filter(c -> !c.equals(code)).toList();
        return new LocaleDetection(code, confidence, source, alternatives);
    }

    /**
     * Parses {@code code[-region][;q=value]} entries, dropping entries with a quality of zero or less.
     * Sorted by quality, highest first; equal qualities keep header order.
     */
    static List<LanguagePreference> parseAcceptLanguage(String header) {
        List<LanguagePreference> preferences = new ArrayList<>();
        for (String part : header.split(",")) {
            String[] pieces = part.trim().split(";");
            String tag = pieces[0].trim();
            if (tag.isEmpty()) {
                continue;
            }
            double quality = 1.0;
            for (int i = 1; i < pieces.length; i++) {
                String parameter = pieces[i].trim();
                if (parameter.startsWith("q=")) {
                    quality = parseQuality(parameter.substring(2));
                }
            }
            if (quality <= 0) {
                continue;
            }
            int dash = tag.indexOf('-');
            String language = (dash >= 0 ? tag.substring(0, dash) : tag).toLowerCase(Locale.ROOT);
            preferences.add(new LanguagePreference(language, quality));
        }
        preferences.sort(Comparator.comparingDouble(LanguagePreference::quality).reversed());
        return preferences;
    }

    private static double parseQuality(String raw) {
        try {
            return Double.parseDouble(raw.trim());
        } catch (NumberFormatException e) {
            log.debug("Ignoring malformed Accept-Language quality '{}'", raw);
            return 0;
        }
    }

    record LanguagePreference(String code, double quality) {
    }

    public List<HreflangTag> generateHreflangTags(String path, String currentLocale) {
        return generateHreflangTags(path, currentLocale, null);
    }

    /**
     * One alternate per enabled locale plus {@code x-default}. The default locale is served un-prefixed.
     *
     * @param baseUrl origin override, or null for the configured one
     */
    public List<HreflangTag> generateHreflangTags(String path, String currentLocale, @Nullable String baseUrl) {
        String cleanPath = ensureLeadingSlash(path);
        String cacheKey = hreflangCacheKey(cleanPath, currentLocale, baseUrl);
        Optional<List<HreflangTag>> cached = cache.get(cacheKey);
        if (cached.isPresent()) {
            return cached.get();
        }
        long version = configVersion.get();
        List<HreflangTag> tags = buildHreflangTags(cleanPath, baseUrl);
        cache.set(cacheKey, tags, localeProperties.getHreflangTtl(), List.of(HREFLANG_TAG, LOCALE_TAG));
        // Tags built from a table replaced mid-lookup must not outlive its invalidation
        if (configVersion.get() != version) {
            cache.delete(cacheKey);
        }
        log.debug("Generated {} hreflang tags for {}", tags.size(), cleanPath);
        return tags;
    }

    /**
     * Pre-built hreflang entries for every enabled locale of each path, keyed as
     * {@link #generateHreflangTags(String, String)} looks them up.
     */
    public List<WarmupEntry> hreflangWarmupEntries(Collection<String> paths) {
        long ttlMillis = localeProperties.getHreflangTtl().toMillis();
        List<WarmupEntry> entries = new ArrayList<>();
        for (String path : paths) {
            String cleanPath = ensureLeadingSlash(path);
            List<HreflangTag> tags = buildHreflangTags(cleanPath, null);
            for (String code : getEnabledLocaleCodes()) {
                entries.add(new WarmupEntry(hreflangCacheKey(cleanPath, code, null), tags, ttlMillis,
                    List.of(HREFLANG_TAG, LOCALE_TAG)));
            }
        }
        return entries;
    }

    private List<HreflangTag> buildHreflangTags(String cleanPath, @Nullable String baseUrl) {
        String base = resolveBaseUrl(baseUrl);
        List<HreflangTag> tags = new ArrayList<>();
        for (LocaleConfig locale : getEnabledLocales()) {
            tags.add(new HreflangTag(locale.code(), base + buildLocalizedPath(cleanPath, locale.code()),
                locale.nativeName()));
        }
        tags.add(new HreflangTag(HreflangTag.X_DEFAULT, base + cleanPath, "Default"));
        return List.copyOf(tags);
    }

    private static String hreflangCacheKey(String cleanPath, String locale, @Nullable String baseUrl) {
        return HREFLANG_KEY_PREFIX + cleanPath + ":" + locale + (StringUtils.hasText(baseUrl) ? ":" + baseUrl : "");
    }

    public List<LocalizedUrl> generateLocalizedUrls(String path, @Nullable String baseUrl) {
        String cleanPath = ensureLeadingSlash(path);
        String base = resolveBaseUrl(baseUrl);
        String defaultCode = getDefaultLocale();
        return getEnabledLocales().stream()
            .map(locale -> new LocalizedUrl(locale.code(), base + buildLocalizedPath(cleanPath, locale.code()),
                locale.code().equals(defaultCode)))
            .toList();
    }

    /**
     * Splits an enabled locale prefix off {@code path}. Paths without one belong to the default locale.
     */
    public LocalePath extractLocaleFromPath(String path) {
        String defaultCode = getDefaultLocale();
        String safePath = ensureLeadingSlash(path);
        String[] segments = safePath.substring(1).split("/", 2);
        if (segments[0].isEmpty()) {
            return new LocalePath(defaultCode, safePath);
        }
        if (isSupported(segments[0])) {
            String rest = segments.length > 1 ? segments[1] : "";
            return new LocalePath(segments[0], "/" + rest);
        }
        return new LocalePath(defaultCode, safePath);
    }

    /**
     * Inverse of {@link #extractLocaleFromPath}: prefixes non-default locales, leaves the default as is.
     */
    public String buildLocalizedPath(String path, String locale) {
        String safePath = ensureLeadingSlash(path);
        if (locale == null || locale.equals(getDefaultLocale())) {
            return safePath;
        }
        if ("/".equals(safePath)) {
            return "/" + locale;
        }
        return "/" + locale + safePath;
    }

    public LocaleStats getStats() {
        Collection<LocaleConfig> all = locales.values();
        List<LocaleConfig> enabled = all.stream().filter(LocaleConfig::enabled).toList();
        int rtl = (int) enabled.stream().filter(l -> l.direction() == TextDirection.RTL).count();
        return new LocaleStats(all.size(), enabled.size(), all.size() - enabled.size(), getDefaultLocale(),
            rtl, enabled.size() - rtl);
    }

    /**
     * Adds or replaces a locale. The whole mutation is rejected when the locale is invalid or the result
     * would not have exactly one enabled default.
     *
     * @throws LocaleConfigurationException listing every failed check
     */
    public void updateLocale(LocaleConfig config) {
        String code = config == null ? null : config.code();
        mutationLock.lock();
        try {
            List<String> errors = validateLocaleConfig(config);
            if (errors.isEmpty()) {
                Map<String, LocaleConfig> candidate = new LinkedHashMap<>(locales);
                candidate.put(config.code(), config);
                errors.addAll(invariantViolations(candidate));
                if (errors.isEmpty()) {
                    publishLocked(candidate);
                }
            }
            if (!errors.isEmpty()) {
                log.warn("Rejected locale configuration for {}: {}", code, errors);
                throw new LocaleConfigurationException(code, errors);
            }
        } finally {
            mutationLock.unlock();
        }
        invalidateLocaleCaches();
        log.info("Updated locale configuration for {}", code);
    }

    /**
     * Moves the default flag to {@code code}, which must be an enabled locale.
     */
    public void setDefaultLocale(String code) {
        mutationLock.lock();
        try {
            LocaleConfig target = locales.get(code);
            if (target == null || !target.enabled()) {
                throw new LocaleConfigurationException(code, List.of("Default locale must be an enabled locale"));
            }
            Map<String, LocaleConfig> candidate = new LinkedHashMap<>();
            locales.forEach((key, value) -> candidate.put(key, value.withDefaultLocale(key.equals(code))));
            publishLocked(candidate);
        } finally {
            mutationLock.unlock();
        }
        invalidateLocaleCaches();
        log.info("Default locale changed to {}", code);
    }

    /**
     * @return false when no locale has {@code code}
     * @throws LocaleConfigurationException when {@code code} is the default locale
     */
    public boolean removeLocale(String code) {
        mutationLock.lock();
        try {
            LocaleConfig existing = locales.get(code);
            if (existing == null) {
                return false;
            }
            if (existing.defaultLocale()) {
                throw new LocaleConfigurationException(code, List.of("Cannot remove default locale: " + code));
            }
            Map<String, LocaleConfig> candidate = new LinkedHashMap<>(locales);
            candidate.remove(code);
            publishLocked(candidate);
        } finally {
            mutationLock.unlock();
        }
        invalidateLocaleCaches();
        log.info("Removed locale configuration for {}", code);
        return true;
    }

    public List<String> validateLocaleConfig(@Nullable LocaleConfig config) {
        List<String> errors = new ArrayList<>();
        if (config == null) {
            errors.add("Locale configuration is required");
            return errors;
        }
        if (config.code() == null || config.code().trim().length() < 2) {
            errors.add("Locale code must be at least 2 characters");
        }
        if (!StringUtils.hasText(config.name())) {
            errors.add("Locale name is required");
        }
        if (!StringUtils.hasText(config.nativeName())) {
            errors.add("Native name is required");
        }
        if (config.direction() == null) {
            errors.add("Direction must be either \"ltr\" or \"rtl\"");
        }
        return errors;
    }

    private static List<String> invariantViolations(Map<String, LocaleConfig> table) {
        List<String> errors = new ArrayList<>();
        List<LocaleConfig> defaults = table.values().stream().filter(LocaleConfig::defaultLocale).toList();
        if (defaults.size() != 1) {
            errors.add("Exactly one default locale is required, found " + defaults.size());
        }
        for (LocaleConfig candidate : defaults) {
            if (!candidate.enabled()) {
                errors.add("Default locale " + candidate.code() + " cannot be disabled");
            }
        }
        return errors;
    }

    private void publishLocked(Map<String, LocaleConfig> candidate) {
        locales = Collections.unmodifiableMap(candidate);
        configVersion.incrementAndGet();
    }

    private void invalidateLocaleCaches() {
        cache.invalidateByTag(LOCALE_TAG);
        cache.invalidateByTag(HREFLANG_TAG);
    }

    private String resolveBaseUrl(@Nullable String override) {
        String base = StringUtils.hasText(override) ? override
            : StringUtils.hasText(localeProperties.getBaseUrl()) ? localeProperties.getBaseUrl()
            : urlProperties.getSiteUrl();
        String trimmed = base.trim();
        while (trimmed.endsWith("/")) {
            trimmed = trimmed.substring(0, trimmed.length() - 1);
        }
        return trimmed;
    }

    private static String ensureLeadingSlash(String path) {
        if (!StringUtils.hasText(path)) {
            return "/";
        }
        return path.startsWith("/") ? path : "/" + path;
    }
}
