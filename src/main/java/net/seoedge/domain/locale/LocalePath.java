package net.seoedge.domain.locale;

/**
 * A request path split into its locale and the path without the locale prefix.
 */
public record LocalePath(String locale, String cleanPath) {
}
