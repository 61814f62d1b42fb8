package net.seoedge.domain.redirect;

import java.util.List;

/**
 * Immutable URL normalization policy. When both trailing-slash flags are set, removal wins.
 */
public record NormalizationOptions(
    boolean enforceHttps,
    boolean removeWww,
    boolean enforceLowercase,
    boolean removeIndexHtml,
    boolean removeTrailingSlash,
    boolean enforceTrailingSlash,
    List<String> removeQueryParams,
    boolean sortQueryParams
) {

    public NormalizationOptions {
        removeQueryParams = removeQueryParams == null ? List.of() : List.copyOf(removeQueryParams);
    }
}
