package net.seoedge.domain.redirect;

import java.util.Map;

/**
 * Rule table summary with the active URL policies.
 */
public record RedirectStats(
    int totalRules,
    int enabledRules,
    int disabledRules,
    Map<Integer, Long> rulesByStatusCode,
    NormalizationOptions normalizationOptions,
    SecurityOptions securityOptions
) {

    public RedirectStats {
        rulesByStatusCode = rulesByStatusCode == null ? Map.of() : Map.copyOf(rulesByStatusCode);
    }
}
