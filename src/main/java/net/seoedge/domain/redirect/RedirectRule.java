package net.seoedge.domain.redirect;

import java.time.Instant;
import java.util.Set;

/**
 * One entry of the redirect rule table.
 *
 * @param from literal, prefix or regex source pattern
 * @param to redirect target
 * @param statusCode one of 301, 302, 307 or 308
 * @param matchKind comparison mode, {@link MatchKind#EXACT} when omitted
 * @param enabled disabled rules are kept but never matched
 * @param priority higher wins; ties keep insertion order
 * @param reason diagnostic description
 * @param createdAt creation time, stamped when omitted
 */
public record RedirectRule(
    String from,
    String to,
    int statusCode,
    MatchKind matchKind,
    boolean enabled,
    int priority,
    String reason,
    Instant createdAt
) {

    public static final Set<Integer> ALLOWED_STATUS_CODES = Set.of(301, 302, 307, 308);

    public RedirectRule {
        if (from == null || from.isBlank()) {
            throw new IllegalArgumentException("Redirect rule 'from' must not be blank");
        }
        if (to == null || to.isBlank()) {
            throw new IllegalArgumentException("Redirect rule 'to' must not be blank");
        }
        if (!ALLOWED_STATUS_CODES.contains(statusCode)) {
            throw new IllegalArgumentException("Unsupported redirect status code: " + statusCode);
        }
        matchKind = matchKind == null ? MatchKind.EXACT : matchKind;
        createdAt = createdAt == null ? Instant.now() : createdAt;
    }

    public static RedirectRule exact(String from, String to, int statusCode, int priority, String reason) {
        return new RedirectRule(from, to, statusCode, MatchKind.EXACT, true, priority, reason, null);
    }

    public static RedirectRule prefix(String from, String to, int statusCode, int priority, String reason) {
        return new RedirectRule(from, to, statusCode, MatchKind.PREFIX, true, priority, reason, null);
    }

    public static RedirectRule regex(String from, String to, int statusCode, int priority, String reason) {
        return new RedirectRule(from, to, statusCode, MatchKind.REGEX, true, priority, reason, null);
    }
}
