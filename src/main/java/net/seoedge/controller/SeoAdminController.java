/**
 * REST Controller for SEO edge administration
 *
 * Features:
 * - Cache statistics, health, clearing, tag invalidation and warmup
 * - Redirect rule management with bulk import and export
 * - URL normalization, validation and canonicalization diagnostics
 * - Locale configuration, detection and hreflang previews
 */
package net.seoedge.controller;

import lombok.extern.slf4j.Slf4j;
import net.seoedge.domain.cache.CacheHealth;
import net.seoedge.domain.cache.CacheStats;
import net.seoedge.domain.locale.HreflangTag;
import net.seoedge.domain.locale.LocaleConfig;
import net.seoedge.domain.locale.LocaleDetection;
import net.seoedge.domain.locale.LocaleStats;
import net.seoedge.domain.locale.LocalizedUrl;
import net.seoedge.domain.redirect.AlternateUrl;
import net.seoedge.domain.redirect.RedirectDecision;
import net.seoedge.domain.redirect.RedirectImportResult;
import net.seoedge.domain.redirect.RedirectRule;
import net.seoedge.domain.redirect.RedirectRuleRequest;
import net.seoedge.domain.redirect.RedirectStats;
import net.seoedge.domain.redirect.UrlValidationResult;
import net.seoedge.exception.LocaleConfigurationException;
import net.seoedge.service.CacheWarmupService;
import net.seoedge.service.LocaleRegistry;
import net.seoedge.service.RedirectResolver;
import net.seoedge.service.TaggedCache;
import net.seoedge.support.seo.CanonicalUrlResolver;
import net.seoedge.support.url.UrlNormalizer;
import net.seoedge.support.url.UrlSecurityValidator;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.util.StringUtils;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.server.ResponseStatusException;

import java.util.List;
import java.util.Map;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;

@RestController
@RequestMapping("/admin/seo")
@Slf4j
public class SeoAdminController {

    private final TaggedCache taggedCache;
    private final CacheWarmupService cacheWarmupService;
    private final RedirectResolver redirectResolver;
    private final UrlNormalizer urlNormalizer;
    private final UrlSecurityValidator urlSecurityValidator;
    private final CanonicalUrlResolver canonicalUrlResolver;
    private final LocaleRegistry localeRegistry;

    public SeoAdminController(TaggedCache taggedCache,
                              CacheWarmupService cacheWarmupService,
                              RedirectResolver redirectResolver,
                              UrlNormalizer urlNormalizer,
                              UrlSecurityValidator urlSecurityValidator,
                              CanonicalUrlResolver canonicalUrlResolver,
                              LocaleRegistry localeRegistry) {
        this.taggedCache = taggedCache;
        this.cacheWarmupService = cacheWarmupService;
        this.redirectResolver = redirectResolver;
        this.urlNormalizer = urlNormalizer;
        this.urlSecurityValidator = urlSecurityValidator;
        this.canonicalUrlResolver = canonicalUrlResolver;
        this.localeRegistry = localeRegistry;
    }

    @GetMapping("/cache/stats")
    public CacheStats cacheStats() {
        return taggedCache.getStats();
    }

    @GetMapping("/cache/health")
    public CacheHealth cacheHealth() {
        return taggedCache.getHealth();
    }

    @GetMapping("/cache/keys")
    public List<String> cacheKeys(@RequestParam(name = "pattern", required = false) String pattern) {
        if (!StringUtils.hasText(pattern)) {
            return taggedCache.keys();
        }
        try {
            return taggedCache.keys(Pattern.compile(pattern));
        } catch (PatternSyntaxException e) {
            throw new ResponseStatusException(HttpStatus.BAD_REQUEST, "Invalid key pattern: " + e.getDescription());
        }
    }

    @PostMapping("/cache/clear")
    public Map<String, Object> clearCache() {
        int cleared = taggedCache.size();
        taggedCache.clear();
        log.info("Cache cleared by administrator ({} entries)", cleared);
        return Map.of("cleared", cleared);
    }

    /**
     * Invalidates one tag, or queues it for the next batch when {@code queued} is set.
     */
    @PostMapping("/cache/invalidate")
    public Map<String, Object> invalidateTag(@RequestParam("tag") String tag,
                                             @RequestParam(name = "queued", defaultValue = "false") boolean queued) {
        if (!StringUtils.hasText(tag)) {
            throw new ResponseStatusException(HttpStatus.BAD_REQUEST, "tag must not be blank");
        }
        if (queued) {
            taggedCache.queueInvalidation(tag);
            return Map.of("tag", tag, "queued", true);
        }
        return Map.of("tag", tag, "invalidated", taggedCache.invalidateByTag(tag));
    }

    @PostMapping("/cache/warmup")
    public ResponseEntity<Map<String, Object>> warmupCache() {
        int loaded = cacheWarmupService.warmup();
        if (loaded < 0) {
            return ResponseEntity.status(HttpStatus.CONFLICT).body(Map.of("status", "already_running"));
        }
        return ResponseEntity.ok(Map.of("status", "completed", "loaded", loaded));
    }

    @GetMapping("/redirects")
    public List<RedirectRule> redirects() {
        return redirectResolver.getRules();
    }

    @PostMapping("/redirects")
    public ResponseEntity<RedirectRule> addRedirect(@RequestBody RedirectRuleRequest request) {
        RedirectRule rule;
        try {
            rule = request.toRule(null);
        } catch (IllegalArgumentException e) {
            throw new ResponseStatusException(HttpStatus.BAD_REQUEST, e.getMessage());
        }
        redirectResolver.addRule(rule);
        return ResponseEntity.status(HttpStatus.CREATED).body(rule);
    }

    @DeleteMapping("/redirects")
    public ResponseEntity<Void> removeRedirect(@RequestParam("from") String from) {
        if (!redirectResolver.removeRule(from)) {
            throw new ResponseStatusException(HttpStatus.NOT_FOUND, "No redirect rule for " + from);
        }
        return ResponseEntity.noContent().build();
    }

    @PostMapping("/redirects/import")
    public RedirectImportResult importRedirects(@RequestBody List<RedirectRuleRequest> requests) {
        return redirectResolver.importRules(requests);
    }

    @GetMapping("/redirects/export")
    public List<RedirectRule> exportRedirects() {
        return redirectResolver.exportRules();
    }

    @GetMapping("/redirects/check")
    public RedirectDecision checkRedirect(@RequestParam("url") String url) {
        return redirectResolver.checkRedirect(url);
    }

    @GetMapping("/urls/normalize")
    public Map<String, String> normalizeUrl(@RequestParam("url") String url) {
        return Map.of("original", url, "normalized", urlNormalizer.normalize(url));
    }

    @GetMapping("/urls/validate")
    public UrlValidationResult validateUrl(@RequestParam("url") String url) {
        return urlSecurityValidator.validate(url);
    }

    @GetMapping("/urls/sanitize")
    public Map<String, String> sanitizeUrl(@RequestParam("url") String url) {
        return Map.of("original", url, "sanitized", urlSecurityValidator.sanitize(url));
    }

    @GetMapping("/urls/canonical")
    public Map<String, Object> canonicalUrl(@RequestParam("path") String path,
                                            @RequestParam(name = "baseUrl", required = false) String baseUrl) {
        String canonical = canonicalUrlResolver.canonicalUrl(path, baseUrl);
        List<AlternateUrl> alternates =
            canonicalUrlResolver.alternateUrls(path, localeRegistry.getEnabledLocaleCodes(), baseUrl);
        return Map.of("canonical", canonical, "alternates", alternates);
    }

    @GetMapping("/urls/stats")
    public RedirectStats urlStats() {
        return redirectResolver.getStats();
    }

    @GetMapping("/locales")
    public List<LocaleConfig> locales() {
        return localeRegistry.getAllLocales();
    }

    @GetMapping("/locales/detect")
    public LocaleDetection detectLocale(@RequestParam(name = "acceptLanguage", required = false) String acceptLanguage,
                                        @RequestParam(name = "cookie", required = false) String cookieLocale,
                                        @RequestParam(name = "urlLocale", required = false) String urlLocale) {
        return localeRegistry.detectLocale(acceptLanguage, cookieLocale, urlLocale);
    }

    @GetMapping("/locales/hreflang")
    public List<HreflangTag> hreflang(@RequestParam("path") String path,
                                      @RequestParam(name = "locale", required = false) String locale) {
        String current = StringUtils.hasText(locale) ? locale : localeRegistry.getDefaultLocale();
        return localeRegistry.generateHreflangTags(path, current);
    }

    @GetMapping("/locales/urls")
    public List<LocalizedUrl> localizedUrls(@RequestParam("path") String path,
                                            @RequestParam(name = "baseUrl", required = false) String baseUrl) {
        return localeRegistry.generateLocalizedUrls(path, baseUrl);
    }

    @GetMapping("/locales/stats")
    public LocaleStats localeStats() {
        return localeRegistry.getStats();
    }

    @PutMapping("/locales/{code}")
    public LocaleConfig updateLocale(@PathVariable("code") String code, @RequestBody LocaleConfig config) {
        if (config == null || !code.equals(config.code())) {
            throw new ResponseStatusException(HttpStatus.BAD_REQUEST, "Locale code in path and body must match");
        }
        try {
            localeRegistry.updateLocale(config);
        } catch (LocaleConfigurationException e) {
            throw new ResponseStatusException(HttpStatus.BAD_REQUEST, String.join("; ", e.getReasons()));
        }
        return config;
    }

    @PostMapping("/locales/{code}/default")
    public LocaleStats makeDefaultLocale(@PathVariable("code") String code) {
        if (localeRegistry.getLocale(code).isEmpty()) {
            throw new ResponseStatusException(HttpStatus.NOT_FOUND, "Unknown locale " + code);
        }
        try {
            localeRegistry.setDefaultLocale(code);
        } catch (LocaleConfigurationException e) {
            throw new ResponseStatusException(HttpStatus.BAD_REQUEST, String.join("; ", e.getReasons()));
        }
        return localeRegistry.getStats();
    }

    @DeleteMapping("/locales/{code}")
    public ResponseEntity<Void> removeLocale(@PathVariable("code") String code) {
        boolean removed;
        try {
            removed = localeRegistry.removeLocale(code);
        } catch (LocaleConfigurationException e) {
            throw new ResponseStatusException(HttpStatus.BAD_REQUEST, String.join("; ", e.getReasons()));
        }
        if (!removed) {
            throw new ResponseStatusException(HttpStatus.NOT_FOUND, "Unknown locale " + code);
        }
        return ResponseEntity.noContent().build();
    }
}
