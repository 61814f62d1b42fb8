package net.seoedge.support.url;

import lombok.extern.slf4j.Slf4j;
import net.seoedge.domain.redirect.NormalizationOptions;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Rewrites URLs into their canonical form according to a {@link NormalizationOptions} policy.
 *
 * <p>Steps run in a fixed order: https upgrade, {@code www.} removal, path lowercasing, index-file
 * collapse, trailing-slash policy, query parameter removal, query parameter sorting. Host and query
 * values are never case-folded. The result is idempotent.</p>
 */
@Slf4j
public class UrlNormalizer {

    private static final Pattern INDEX_SUFFIX =
        Pattern.compile("/index\\.(html|htm|php|asp|aspx|jsp)$", Pattern.CASE_INSENSITIVE);

    private static final int MAX_PASSES = 32;

    private final NormalizationOptions options;
    private final Set<String> removedParams;

    public UrlNormalizer(NormalizationOptions options) {
        this.options = options;
        this.removedParams = new HashSet<>(options.removeQueryParams());
    }

    public NormalizationOptions options() {
        return options;
    }

    /**
     * Normalizes {@code url}. Relative input stays relative; input that cannot be parsed is returned
     * unchanged.
     */
    public String normalize(String url) {
        Optional<ParsedUrl> parsed = ParsedUrl.parse(url);
        if (parsed.isEmpty()) {
            log.warn("Failed to normalize URL: {}", url);
            return url;
        }
        // A pass can expose a new match for an earlier step (e.g. "/index.html/"), so iterate to a fixed point
        ParsedUrl current = parsed.get();
        for (int pass = 0; pass < MAX_PASSES; pass++) {
            ParsedUrl next = normalizeOnce(current);
            if (next.equals(current)) {
                break;
            }
            current = next;
        }
        return current.toUrlString();
    }

    private ParsedUrl normalizeOnce(ParsedUrl url) {
        ParsedUrl result = url;

        if (result.scheme() != null) {
            String scheme = result.scheme().toLowerCase(Locale.ROOT);
            if (options.enforceHttps() && "http".equals(scheme)) {
                scheme = "https";
            }
            result = result.withScheme(scheme);
        }

        String host = result.host();
        if (options.removeWww() && host != null && host.regionMatches(true, 0, "www.", 0, 4)) {
            result = result.withHost(host.substring(4));
        }

        result = result.withPath(normalizePath(result));
        result = result.withQuery(normalizeQuery(result.query()));
        return result;
    }

    private String normalizePath(ParsedUrl url) {
        String path = url.path();
        if (path.isEmpty() || !path.startsWith("/")) {
            path = "/" + path;
        }
        if (options.enforceLowercase()) {
            path = path.toLowerCase(Locale.ROOT);
        }
        if (options.removeIndexHtml()) {
            path = INDEX_SUFFIX.matcher(path).replaceFirst("/");
        }
        if (options.removeTrailingSlash()) {
            while (path.length() > 1 && path.endsWith("/")) {
                path = path.substring(0, path.length() - 1);
            }
        } else if (options.enforceTrailingSlash() && !path.endsWith("/") && !lastSegmentHasDot(path)) {
            path = path + "/";
        }
        return path;
    }

    private String normalizeQuery(String query) {
        if (query == null) {
            return null;
        }
        List<String> pairs = new ArrayList<>();
        for (String pair : query.split("&")) {
            if (pair.isEmpty() || removedParams.contains(paramName(pair))) {
                continue;
            }
            pairs.add(pair);
        }
        if (options.sortQueryParams()) {
            // List.sort is stable, so repeated keys keep their relative order
            pairs.sort(Comparator.comparing(UrlNormalizer::paramName));
        }
        return pairs.isEmpty() ? null : String.join("&", pairs);
    }

    private static String paramName(String pair) {
        int eq = pair.indexOf('=');
        return eq >= 0 ? pair.substring(0, eq) : pair;
    }

    static boolean lastSegmentHasDot(String path) {
        String lastSegment = path.substring(path.lastIndexOf('/') + 1);
        return lastSegment.contains(".");
    }
}
