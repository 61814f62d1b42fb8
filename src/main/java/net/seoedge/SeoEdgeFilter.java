/**
 * Servlet filter applying SEO handling at the request edge
 *
 * Features:
 * - Answers non-canonical or rule-matched GET requests with a cacheable redirect
 * - Detects the request locale and exposes it as a request attribute
 * - Emits Content-Language and hreflang Link headers
 * - Optionally injects hreflang link tags into HTML responses
 */
package net.seoedge;

import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.Cookie;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import lombok.extern.slf4j.Slf4j;
import net.seoedge.config.SeoEdgeProperties;
import net.seoedge.domain.locale.HreflangTag;
import net.seoedge.domain.locale.LocaleDetection;
import net.seoedge.domain.locale.LocalePath;
import net.seoedge.domain.redirect.RedirectDecision;
import net.seoedge.service.LocaleRegistry;
import net.seoedge.service.RedirectResolver;
import net.seoedge.support.seo.HeadTagInjector;
import net.seoedge.support.seo.HreflangLinkRenderer;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.MediaType;
import org.springframework.util.StringUtils;
import org.springframework.web.filter.OncePerRequestFilter;
import org.springframework.web.util.ContentCachingResponseWrapper;

import java.io.IOException;
import java.nio.charset.Charset;
import java.nio.charset.StandardCharsets;
import java.util.List;

@Slf4j
public class SeoEdgeFilter extends OncePerRequestFilter {

    public static final String LOCALE_ATTRIBUTE = "seo.locale";
    public static final String HREFLANG_ATTRIBUTE = "seo.hreflang";
    static final String REDIRECT_REASON_HEADER = "X-Redirect-Reason";

    private final RedirectResolver redirectResolver;
    private final LocaleRegistry localeRegistry;
    private final HreflangLinkRenderer hreflangLinkRenderer;
    private final HeadTagInjector headTagInjector;
    private final SeoEdgeProperties properties;

    public SeoEdgeFilter(RedirectResolver redirectResolver,
                         LocaleRegistry localeRegistry,
                         HreflangLinkRenderer hreflangLinkRenderer,
                         HeadTagInjector headTagInjector,
                         SeoEdgeProperties properties) {
        this.redirectResolver = redirectResolver;
        this.localeRegistry = localeRegistry;
        this.hreflangLinkRenderer = hreflangLinkRenderer;
        this.headTagInjector = headTagInjector;
        this.properties = properties;
    }

    @Override
    protected boolean shouldNotFilter(HttpServletRequest request) {
        if (!HttpMethod.GET.matches(request.getMethod())) {
            return true;
        }
        String path = pathWithinApplication(request);
        return properties.getSkipPrefixes().stream().anyMatch(path::startsWith);
    }

    @Override
    protected void doFilterInternal(HttpServletRequest request, HttpServletResponse response, FilterChain chain)
            throws ServletException, IOException {
        String path = pathWithinApplication(request);
        String query = request.getQueryString();
        String fullUrl = StringUtils.hasText(query) ? path + "?" + query : path;

        if (properties.isRedirectsEnabled() && sendRedirectIfNeeded(fullUrl, response)) {
            return;
        }

        List<HreflangTag> hreflangTags = applyLocale(request, response, path);

        if (!properties.isInjectHeadTags() || hreflangTags.isEmpty()) {
            chain.doFilter(request, response);
            return;
        }
        ContentCachingResponseWrapper wrapper = new ContentCachingResponseWrapper(response);
        chain.doFilter(request, wrapper);
        writeWithHeadTags(wrapper, response, hreflangTags);
    }

    private boolean sendRedirectIfNeeded(String fullUrl, HttpServletResponse response) {
        RedirectDecision decision;
        try {
            decision = redirectResolver.checkRedirect(fullUrl);
        } catch (RuntimeException e) {
            log.error("Error resolving redirect for {}", fullUrl, e);
            return false;
        }
        if (!decision.redirect()) {
            return false;
        }
        log.info("Redirecting {} to {} ({})", fullUrl, decision.to(), decision.statusCode());
        response.setStatus(decision.statusCode());
        response.setHeader(HttpHeaders.LOCATION, decision.to());
        response.setHeader(HttpHeaders.CACHE_CONTROL, properties.getRedirectCacheControl());
        if (properties.isExposeRedirectReason() && decision.rule() != null
            && StringUtils.hasText(decision.rule().reason())) {
            response.setHeader(REDIRECT_REASON_HEADER, decision.rule().reason());
        }
        return true;
    }

    private List<HreflangTag> applyLocale(HttpServletRequest request, HttpServletResponse response, String path) {
        try {
            LocalePath localePath = localeRegistry.extractLocaleFromPath(path);
            String urlLocale = request.getParameter(properties.getLocaleParameter());
            if (!localeRegistry.isSupported(urlLocale) && !localePath.cleanPath().equals(path)) {
                urlLocale = localePath.locale();
            }
            LocaleDetection detection = localeRegistry.detectLocale(
                request.getHeader(HttpHeaders.ACCEPT_LANGUAGE),
                cookieValue(request, properties.getLocaleCookie()),
                urlLocale);
            List<HreflangTag> tags = localeRegistry.generateHreflangTags(localePath.cleanPath(), detection.detected());

            request.setAttribute(LOCALE_ATTRIBUTE, detection);
            request.setAttribute(HREFLANG_ATTRIBUTE, tags);
            response.setHeader(HttpHeaders.CONTENT_LANGUAGE, detection.detected());
            String linkHeader = hreflangLinkRenderer.renderLinkHeader(tags);
            if (StringUtils.hasText(linkHeader)) {
                response.setHeader(HttpHeaders.LINK, linkHeader);
            }
            return tags;
        } catch (RuntimeException e) {
            log.error("Error applying locale metadata for {}", path, e);
            return List.of();
        }
    }

    private void writeWithHeadTags(ContentCachingResponseWrapper wrapper,
                                   HttpServletResponse response,
                                   List<HreflangTag> tags) throws IOException {
        if (!isHtml(wrapper.getContentType()) || wrapper.getContentSize() == 0) {
            wrapper.copyBodyToResponse();
            return;
        }
        Charset charset = resolveCharset(wrapper.getCharacterEncoding());
        String html = new String(wrapper.getContentAsByteArray(), charset);
        byte[] body;
        try {
            body = headTagInjector.inject(html, hreflangLinkRenderer.renderLinkTags(tags)).getBytes(charset);
        } catch (RuntimeException e) {
            log.error("Error injecting head tags, serving the unmodified body", e);
            wrapper.copyBodyToResponse();
            return;
        }
        response.setContentLength(body.length);
        response.getOutputStream().write(body);
        response.flushBuffer();
    }

    private static boolean isHtml(String contentType) {
        if (!StringUtils.hasText(contentType)) {
            return false;
        }
        try {
            return MediaType.TEXT_HTML.isCompatibleWith(MediaType.parseMediaType(contentType));
        } catch (IllegalArgumentException e) {
            log.debug("Unparseable response content type '{}'", contentType);
            return false;
        }
    }

    private static Charset resolveCharset(String encoding) {
        try {
            return StringUtils.hasText(encoding) ? Charset.forName(encoding) : StandardCharsets.UTF_8;
        } catch (IllegalArgumentException e) {
            return StandardCharsets.UTF_8;
        }
    }

    private static String cookieValue(HttpServletRequest request, String name) {
        Cookie[] cookies = request.getCookies();
        if (cookies == null) {
            return null;
        }
        for (Cookie cookie : cookies) {
            if (name.equals(cookie.getName())) {
                return cookie.getValue();
            }
        }
        return null;
    }

    private static String pathWithinApplication(HttpServletRequest request) {
        String uri = request.getRequestURI();
        String contextPath = request.getContextPath();
        if (StringUtils.hasText(contextPath) && uri.startsWith(contextPath)) {
            uri = uri.substring(contextPath.length());
        }
        return uri.isEmpty() ? "/" : uri;
    }
}
