package net.seoedge.domain.locale;

/**
 * One alternate-language link; {@code hreflang} is a locale code or {@code x-default}.
 */
public record HreflangTag(String hreflang, String href, String title) {

    public static final String X_DEFAULT = "x-default";
}
