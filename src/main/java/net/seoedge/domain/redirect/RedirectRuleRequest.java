package net.seoedge.domain.redirect;

import java.time.Instant;

/**
 * Unvalidated redirect rule as received from operators or bulk imports. Omitted fields take the
 * rule defaults: status 301, exact matching, enabled, priority 0.
 */
public record RedirectRuleRequest(
    String from,
    String to,
    Integer statusCode,
    MatchKind matchKind,
    Boolean enabled,
    Integer priority,
    String reason
) {

    /**
     * @throws IllegalArgumentException when the request does not describe a valid rule
     */
    public RedirectRule toRule(Instant createdAt) {
        return new RedirectRule(
            from,
            to,
            statusCode == null ? 301 : statusCode,
            matchKind,
            enabled == null || enabled,
            priority == null ? 0 : priority,
            reason,
            createdAt
        );
    }
}
