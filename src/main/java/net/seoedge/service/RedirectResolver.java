/**
 * Decides whether an incoming URL must be redirected
 *
 * Features:
 * - Normalization redirects take precedence over every explicit rule
 * - Explicit rules matched by priority with exact, prefix and regex comparison
 * - Decisions memoized in the tagged cache and invalidated when rules change
 * - Bulk import and export of the rule table
 */
package net.seoedge.service;

import com.github.benmanes.caffeine.cache.Cache;
import lombok.extern.slf4j.Slf4j;
import net.seoedge.config.CacheFactory;
import net.seoedge.config.SeoUrlProperties;
import net.seoedge.domain.redirect.MatchKind;
import net.seoedge.domain.redirect.RedirectDecision;
import net.seoedge.domain.redirect.RedirectImportResult;
import net.seoedge.domain.redirect.RedirectRule;
import net.seoedge.domain.redirect.RedirectRuleRequest;
import net.seoedge.domain.redirect.RedirectStats;
import net.seoedge.support.url.UrlNormalizer;
import net.seoedge.support.url.UrlSecurityValidator;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.locks.ReentrantLock;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;
import java.util.stream.Collectors;

@Slf4j
@Service
public class RedirectResolver {

    public static final String REDIRECT_TAG = "redirect";
    public static final String NORMALIZATION_REASON = "normalization";
    static final int NORMALIZATION_PRIORITY = 1000;
    static final int DEFAULT_RULE_PRIORITY = 100;

    private static final String DECISION_KEY_PREFIX = "redirect:";
    private static final String URL_TAG_PREFIX = "url:";
    private static final Comparator<RedirectRule> BY_PRIORITY_DESC =
        Comparator.comparingInt(RedirectRule::priority).reversed();

    private final TaggedCache cache;
    private final UrlNormalizer urlNormalizer;
    private final UrlSecurityValidator urlSecurityValidator;
    private final SeoUrlProperties urlProperties;
    private final Clock clock;
    private final Cache<String, Optional<Pattern>> patternCache;

    // Keyed by rule source; guarded by rulesLock
    private final Map<String, RedirectRule> rules = new LinkedHashMap<>();
    private final ReentrantLock rulesLock = new ReentrantLock();
    private volatile List<RedirectRule> orderedRules = List.of();
    // Bumped on every rule change, before its decisions are invalidated
    private final AtomicLong rulesVersion = new AtomicLong();

    public RedirectResolver(TaggedCache cache,
                            UrlNormalizer urlNormalizer,
                            UrlSecurityValidator urlSecurityValidator,
                            SeoUrlProperties urlProperties,
                            CacheFactory cacheFactory,
                            Clock clock) {
        this.cache = cache;
        this.urlNormalizer = urlNormalizer;
        this.urlSecurityValidator = urlSecurityValidator;
        this.urlProperties = urlProperties;
        this.clock = clock;
        this.patternCache = cacheFactory.createCache("redirectPatterns",
            urlProperties.getPatternCacheSize(), urlProperties.getDecisionTtl());
        initializeDefaultRules();
    }

    private void initializeDefaultRules() {
        addRule(new RedirectRule("/home", "/", 301, MatchKind.EXACT, true, DEFAULT_RULE_PRIORITY,
            "Redirect /home to homepage", clock.instant()));
        addRule(new RedirectRule("/index.html", "/", 301, MatchKind.EXACT, true, DEFAULT_RULE_PRIORITY,
            "Remove index.html", clock.instant()));
        addRule(new RedirectRule("/index.php", "/", 301, MatchKind.EXACT, true, DEFAULT_RULE_PRIORITY,
            "Remove index.php", clock.instant()));
        log.info("Initialized {} default redirect rules", rules.size());
    }

    /**
     * Resolves the redirect for {@code url}: a normalization redirect when the URL is not canonical,
     * otherwise the highest-priority enabled rule that matches, otherwise no redirect. When a URL with
     * a query string matches no rule, its path alone is tried and the query is carried over to the target.
     */
    public RedirectDecision checkRedirect(String url) {
        if (url == null || url.isEmpty()) {
            return RedirectDecision.none();
        }
        String cacheKey = DECISION_KEY_PREFIX + url;
        if (urlProperties.isCacheEnabled()) {
            Optional<RedirectDecision> cached = cache.get(cacheKey);
            if (cached.isPresent()) {
                return cached.get();
            }
        }

        long version = rulesVersion.get();
        RedirectDecision decision = resolve(url);

        if (urlProperties.isCacheEnabled()) {
            cache.set(cacheKey, decision, urlProperties.getDecisionTtl(), decisionTags(url));
            // A rule change that raced this lookup may have invalidated before the decision was stored
            if (rulesVersion.get() != version) {
                cache.delete(cacheKey);
            }
        }
        return decision;
    }

    private RedirectDecision resolve(String url) {
        String normalized = urlNormalizer.normalize(url);
        if (!normalized.equals(url)) {
            return RedirectDecision.via(new RedirectRule(url, normalized, 301, MatchKind.EXACT, true,
                NORMALIZATION_PRIORITY, NORMALIZATION_REASON, clock.instant()));
        }
        Optional<RedirectRule> rule = firstMatchingRule(url);
        if (rule.isPresent()) {
            return RedirectDecision.via(rule.get());
        }
        int queryStart = url.indexOf('?');
        if (queryStart > 0) {
            Optional<RedirectRule> pathRule = firstMatchingRule(url.substring(0, queryStart));
            if (pathRule.isPresent()) {
                return RedirectDecision.via(pathRule.get(), url.substring(queryStart + 1));
            }
        }
        return RedirectDecision.none();
    }

    private Optional<RedirectRule> firstMatchingRule(String url) {
        for (RedirectRule rule : orderedRules) {
            if (rule.enabled() && matches(url, rule)) {
                return Optional.of(rule);
            }
        }
        return Optional.empty();
    }

    private static List<String> decisionTags(String url) {
        int queryStart = url.indexOf('?');
        if (queryStart > 0) {
            return List.of(URL_TAG_PREFIX + url, URL_TAG_PREFIX + url.substring(0, queryStart), REDIRECT_TAG);
        }
        return List.of(URL_TAG_PREFIX + url, REDIRECT_TAG);
    }

    private boolean matches(String url, RedirectRule rule) {
        switch (rule.matchKind()) {
            case PREFIX:
                return url.startsWith(rule.from());
            case REGEX:
                return compiledPattern(rule.from())
                    .map(pattern -> pattern.matcher(url).find())
                    .orElse(false);
            case EXACT:
            default:
                return url.equals(rule.from());
        }
    }

    private Optional<Pattern> compiledPattern(String source) {
        return patternCache.get(source, key -> {
            try {
                return Optional.of(Pattern.compile(key));
            } catch (PatternSyntaxException e) {
                log.warn("Ignoring redirect rule with malformed pattern '{}': {}", key, e.getDescription());
                return Optional.empty();
            }
        });
    }

    /**
     * Adds or replaces the rule keyed by {@code rule.from()} and drops memoized decisions it may affect.
     */
    public void addRule(RedirectRule rule) {
        rulesLock.lock();
        try {
            // Re-insert so a replaced rule moves to the end of its priority bucket
            rules.remove(rule.from());
            rules.put(rule.from(), rule);
            rebuildOrderLocked();
        } finally {
            rulesLock.unlock();
        }
        invalidateDecisions(rule);
        log.debug("Added redirect rule: {} -> {} ({}, {})", rule.from(), rule.to(), rule.statusCode(), rule.matchKind());
    }

    public boolean removeRule(String from) {
        RedirectRule removed;
        rulesLock.lock();
        try {
            removed = rules.remove(from);
            if (removed != null) {
                rebuildOrderLocked();
            }
        } finally {
            rulesLock.unlock();
        }
        if (removed == null) {
            return false;
        }
        invalidateDecisions(removed);
        log.debug("Removed redirect rule: {}", from);
        return true;
    }

    public Optional<RedirectRule> getRule(String from) {
        rulesLock.lock();
        try {
            return Optional.ofNullable(rules.get(from));
        } finally {
            rulesLock.unlock();
        }
    }

    /**
     * All rules, highest priority first; ties keep insertion order.
     */
    public List<RedirectRule> getRules() {
        return orderedRules;
    }

    /**
     * Imports each request independently. An invalid request is reported in the result and does not
     * stop the rest of the batch.
     */
    public RedirectImportResult importRules(Collection<RedirectRuleRequest> requests) {
        int imported = 0;
        List<String> errors = new ArrayList<>();
        for (RedirectRuleRequest request : requests) {
            try {
                addRule(request.toRule(clock.instant()));
                imported++;
            } catch (IllegalArgumentException e) {
                errors.add("Failed to import rule " + request.from() + " -> " + request.to() + ": " + e.getMessage());
            }
        }
        log.info("Imported {} redirect rules with {} errors", imported, errors.size());
        return new RedirectImportResult(imported, errors);
    }

    public List<RedirectRule> exportRules() {
        return getRules();
    }

    public RedirectStats getStats() {
        List<RedirectRule> snapshot = orderedRules;
        int enabled = (int) snapshot.stream().filter(RedirectRule::enabled).count();
        Map<Integer, Long> byStatus = snapshot.stream()
            .collect(Collectors.groupingBy(RedirectRule::statusCode, TreeMap::new, Collectors.counting()));
        return new RedirectStats(
            snapshot.size(),
            enabled,
            snapshot.size() - enabled,
            byStatus,
            urlNormalizer.options(),
            urlSecurityValidator.options()
        );
    }

    private void rebuildOrderLocked() {
        List<RedirectRule> ordered = new ArrayList<>(rules.values());
        ordered.sort(BY_PRIORITY_DESC);
        orderedRules = List.copyOf(ordered);
        rulesVersion.incrementAndGet();
    }

    private void invalidateDecisions(RedirectRule rule) {
        if (!urlProperties.isCacheEnabled()) {
            return;
        }
        cache.invalidateByTag(URL_TAG_PREFIX + rule.from());
        // Prefix and regex rules can match URLs other than their source
        if (rule.matchKind() != MatchKind.EXACT) {
            cache.invalidateByTag(REDIRECT_TAG);
        }
    }
}
