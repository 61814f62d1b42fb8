package net.seoedge.support.seo;

import jakarta.annotation.Nullable;
import net.seoedge.config.SeoUrlProperties;
import net.seoedge.domain.redirect.AlternateUrl;
import net.seoedge.support.url.UrlNormalizer;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Locale;

/**
 * Canonicalizes route-relative and absolute URLs to stable public URL values.
 */
@Component
public class CanonicalUrlResolver {

    private static final String HTTP_SCHEME_PREFIX = "http";

    private final UrlNormalizer urlNormalizer;
    private final SeoUrlProperties urlProperties;

    public CanonicalUrlResolver(UrlNormalizer urlNormalizer, SeoUrlProperties urlProperties) {
        this.urlNormalizer = urlNormalizer;
        this.urlProperties = urlProperties;
    }

    /**
     * Returns an absolute URL for a route-relative or already absolute candidate, without normalizing it.
     *
     * @param candidate route-relative path (for example {@code /products/shoes}) or absolute URL
     * @param baseUrl origin to anchor relative candidates to, or null for the configured site URL
     */
    public String toAbsoluteUrl(String candidate, @Nullable String baseUrl) {
        String base = stripTrailingSlashes(StringUtils.hasText(baseUrl) ? baseUrl.trim() : urlProperties.getSiteUrl());
        String raw = StringUtils.hasText(candidate) ? candidate.trim() : "/";
        if (raw.toLowerCase(Locale.ROOT).startsWith(HTTP_SCHEME_PREFIX)) {
            return raw;
        }
        if (!raw.startsWith("/")) {
            raw = "/" + raw;
        }
        return base + raw;
    }

    /**
     * Returns the normalized absolute canonical URL for {@code path}.
     */
    public String canonicalUrl(String path, @Nullable String baseUrl) {
        return urlNormalizer.normalize(toAbsoluteUrl(path, baseUrl));
    }

    public String canonicalUrl(String path) {
        return canonicalUrl(path, null);
    }

    /**
     * Builds one canonical {@code /<locale><path>} URL per locale code, in input order.
     */
    public List<AlternateUrl> alternateUrls(String path, Collection<String> locales, @Nullable String baseUrl) {
        String cleanPath = StringUtils.hasText(path) && path.startsWith("/") ? path : "/" + (path == null ? "" : path);
        List<AlternateUrl> alternates = new ArrayList<>(locales.size());
        for (String locale : locales) {
            alternates.add(new AlternateUrl(locale, canonicalUrl("/" + locale + cleanPath, baseUrl)));
        }
        return List.copyOf(alternates);
    }

    private static String stripTrailingSlashes(String base) {
        String result = base;
        while (result.endsWith("/")) {
            result = result.substring(0, result.length() - 1);
        }
        return result;
    }
}
