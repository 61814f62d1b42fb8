package net.seoedge.support.url;

import jakarta.annotation.Nullable;

import java.util.Locale;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Lenient split of a URL into its RFC 3986 components. Components keep their raw encoding.
 *
 * @param scheme scheme without the colon, null for relative references
 * @param authority {@code [userinfo@]host[:port]}, null when absent
 * @param path path, possibly empty
 * @param query query without {@code ?}, null when absent
 * @param fragment fragment without {@code #}, null when absent
 */
public record ParsedUrl(
    @Nullable String scheme,
    @Nullable String authority,
    String path,
    @Nullable String query,
    @Nullable String fragment
) {

    // RFC 3986 appendix B
    private static final Pattern URI_PARTS =
        Pattern.compile("^(([^:/?#]+):)?(//([^/?#]*))?([^?#]*)(\\?([^#]*))?(#(.*))?$", Pattern.DOTALL);

    private static final Pattern VALID_AUTHORITY = Pattern.compile("[A-Za-z0-9.\\-_~%!$&'()*+,;=:@\\[\\]]+");

    /**
     * Parses {@code url}, rejecting inputs a browser URL parser would refuse: blank input, a web scheme
     * without a host, or an authority containing illegal characters.
     */
    public static Optional<ParsedUrl> parse(@Nullable String url) {
        if (url == null || url.isBlank()) {
            return Optional.empty();
        }
        Matcher matcher = URI_PARTS.matcher(url.trim());
        if (!matcher.matches()) {
            return Optional.empty();
        }
        String scheme = matcher.group(2);
        String authority = matcher.group(4);
        boolean webScheme = scheme != null
            && ("http".equalsIgnoreCase(scheme) || "https".equalsIgnoreCase(scheme));
        if (webScheme && (authority == null || authority.isEmpty())) {
            return Optional.empty();
        }
        if (authority != null && !authority.isEmpty() && !VALID_AUTHORITY.matcher(authority).matches()) {
            return Optional.empty();
        }
        return Optional.of(new ParsedUrl(scheme, authority, matcher.group(5), matcher.group(7), matcher.group(9)));
    }

    public boolean isAbsolute() {
        return authority != null;
    }

    /**
     * Scheme used for policy checks; relative references resolve against an https origin.
     */
    public String effectiveScheme() {
        return scheme == null ? "https" : scheme.toLowerCase(Locale.ROOT);
    }

    /**
     * Host portion of the authority, without userinfo or port.
     */
    @Nullable
    public String host() {
        if (authority == null) {
            return null;
        }
        String hostPort = authority.substring(authority.lastIndexOf('@') + 1);
        if (hostPort.startsWith("[")) {
            int end = hostPort.indexOf(']');
            return end > 0 ? hostPort.substring(0, end + 1) : hostPort;
        }
        int colon = hostPort.indexOf(':');
        return colon >= 0 ? hostPort.substring(0, colon) : hostPort;
    }

    public ParsedUrl withScheme(@Nullable String newScheme) {
        return new ParsedUrl(newScheme, authority, path, query, fragment);
    }

    public ParsedUrl withHost(String newHost) {
        String host = host();
        if (authority == null || host == null) {
            return this;
        }
        int at = authority.lastIndexOf('@');
        String userInfo = at >= 0 ? authority.substring(0, at + 1) : "";
        String port = authority.substring(at + 1 + host.length());
        return new ParsedUrl(scheme, userInfo + newHost + port, path, query, fragment);
    }

    public ParsedUrl withPath(String newPath) {
        return new ParsedUrl(scheme, authority, newPath, query, fragment);
    }

    public ParsedUrl withQuery(@Nullable String newQuery) {
        return new ParsedUrl(scheme, authority, path, newQuery, fragment);
    }

    /**
     * Reassembles the URL. Relative references render as path, query and fragment only.
     */
    public String toUrlString() {
        StringBuilder builder = new StringBuilder();
        if (scheme != null) {
            builder.append(scheme).append(':');
        }
        if (authority != null) {
            builder.append("//").append(authority);
        }
        builder.append(path);
        if (query != null) {
            builder.append('?').append(query);
        }
        if (fragment != null) {
            builder.append('#').append(fragment);
        }
        return builder.toString();
    }
}
