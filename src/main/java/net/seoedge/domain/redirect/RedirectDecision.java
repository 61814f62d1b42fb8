package net.seoedge.domain.redirect;

/**
 * Outcome of a redirect lookup.
 *
 * @param redirect whether the caller should redirect
 * @param to target URL, null when {@code redirect} is false
 * @param statusCode HTTP status to answer with, null when {@code redirect} is false
 * @param rule matched (or synthetic normalization) rule
 */
public record RedirectDecision(
    boolean redirect,
    String to,
    Integer statusCode,
    RedirectRule rule
) {

    private static final RedirectDecision NONE = new RedirectDecision(false, null, null, null);

    public static RedirectDecision none() {
        return NONE;
    }

    public static RedirectDecision via(RedirectRule rule) {
        return new RedirectDecision(true, rule.to(), rule.statusCode(), rule);
    }

    /**
     * A redirect to {@code rule.to()} with {@code query} appended, for rules matched on the path alone.
     */
    public static RedirectDecision via(RedirectRule rule, String query) {
        if (query == null || query.isEmpty()) {
            return via(rule);
        }
        String separator = rule.to().indexOf('?') >= 0 ? "&" : "?";
        return new RedirectDecision(true, rule.to() + separator + query, rule.statusCode(), rule);
    }
}
