package net.seoedge.domain.redirect;

/**
 * How a redirect rule's {@code from} value is compared with an incoming URL.
 */
public enum MatchKind {
    /** String equality. */
    EXACT,
    /** {@code url.startsWith(from)}. */
    PREFIX,
    /** {@code from} compiled as a regular expression and searched for anywhere in the URL. */
    REGEX
}
