package net.seoedge.domain.redirect;

import java.util.List;

public record UrlValidationResult(boolean valid, List<String> issues) {

    public UrlValidationResult {
        issues = issues == null ? List.of() : List.copyOf(issues);
    }

    public static UrlValidationResult of(List<String> issues) {
        return new UrlValidationResult(issues.isEmpty(), issues);
    }
}
