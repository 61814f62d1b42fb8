package net.seoedge.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import net.seoedge.config.CacheFactory;
import net.seoedge.config.SeoCacheProperties;
import net.seoedge.config.SeoUrlProperties;
import net.seoedge.domain.redirect.MatchKind;
import net.seoedge.domain.redirect.RedirectDecision;
import net.seoedge.domain.redirect.RedirectImportResult;
import net.seoedge.domain.redirect.RedirectRule;
import net.seoedge.domain.redirect.RedirectRuleRequest;
import net.seoedge.domain.redirect.RedirectStats;
import net.seoedge.support.url.UrlNormalizer;
import net.seoedge.support.url.UrlSecurityValidator;
import net.seoedge.testutil.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicReference;
import java.util.regex.Pattern;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class RedirectResolverTest {

    private MutableClock clock;
    private SeoUrlProperties urlProperties;
    private TaggedCache cache;
    private RedirectResolver resolver;

    @BeforeEach
    void setUp() {
        clock = MutableClock.startingAt("2024-03-01T10:00:00Z");
        urlProperties = new SeoUrlProperties();
        cache = new TaggedCache(new SeoCacheProperties(), clock, new ObjectMapper(), null, List.of());
        resolver = newResolver();
    }

    private RedirectResolver newResolver() {
        return new RedirectResolver(
            cache,
            new UrlNormalizer(urlProperties.normalizationOptions()),
            new UrlSecurityValidator(urlProperties.securityOptions()),
            urlProperties,
            new CacheFactory(),
            clock);
    }

    @Test
    void constructor_ShouldInstallDefaultRules() {
        assertThat(resolver.getRules())
            .extracting(RedirectRule::from)
            .containsExactly("/home", "/index.html", "/index.php");

        RedirectDecision decision = resolver.checkRedirect("/home");

        assertThat(decision.redirect()).isTrue();
        assertThat(decision.to()).isEqualTo("/");
        assertThat(decision.statusCode()).isEqualTo(301);
    }

    @Test
    void checkRedirect_ShouldReturnNone_When_NothingMatches() {
        assertThat(resolver.checkRedirect("/products")).isEqualTo(RedirectDecision.none());
        assertThat(resolver.checkRedirect("")).isEqualTo(RedirectDecision.none());
        assertThat(resolver.checkRedirect(null)).isEqualTo(RedirectDecision.none());
    }

    @Test
    void checkRedirect_ShouldFallBackToPathAndKeepQuery_When_FullUrlMatchesNoRule() {
        RedirectDecision decision = resolver.checkRedirect("/home?ref=nav");

        assertThat(decision.redirect()).isTrue();
        assertThat(decision.to()).isEqualTo("/?ref=nav");
        assertThat(decision.statusCode()).isEqualTo(301);
        assertThat(decision.rule().from()).isEqualTo("/home");
    }

    @Test
    void checkRedirect_ShouldPreferFullUrlRule_When_BothFullUrlAndPathMatch() {
        resolver.addRule(RedirectRule.exact("/home?tab=deals", "/deals", 302, 0, "deals tab"));

        assertThat(resolver.checkRedirect("/home?tab=deals").to()).isEqualTo("/deals");
        assertThat(resolver.checkRedirect("/home?tab=news").to()).isEqualTo("/?tab=news");
    }

    @Test
    void checkRedirect_ShouldAppendQueryWithAmpersand_When_TargetAlreadyHasQuery() {
        resolver.addRule(RedirectRule.exact("/promo", "/offers?src=promo", 302, 0, "campaign"));

        assertThat(resolver.checkRedirect("/promo?lang=fr").to()).isEqualTo("/offers?src=promo&lang=fr");
    }

    @Test
    void removeRule_ShouldInvalidatePathFallbackDecisions() {
        assertThat(resolver.checkRedirect("/home?ref=nav").redirect()).isTrue();

        resolver.removeRule("/home");

        assertThat(resolver.checkRedirect("/home?ref=nav").redirect()).isFalse();
    }

    @Test
    void checkRedirect_ShouldNotKeepStaleDecision_When_RuleChangesWhileDecisionIsStored() {
        AtomicReference<Runnable> duringSizeEstimate = new AtomicReference<>();
        ObjectMapper interleavingMapper = new ObjectMapper() {
            @Override
            public String writeValueAsString(Object value) throws JsonProcessingException {
                Runnable action = duringSizeEstimate.getAndSet(null);
                if (action != null) {
                    action.run();
                }
                return super.writeValueAsString(value);
            }
        };
        cache = new TaggedCache(new SeoCacheProperties(), clock, interleavingMapper, null, List.of());
        resolver = newResolver();
        duringSizeEstimate.set(() -> resolver.addRule(RedirectRule.exact("/sale", "/offers", 301, 0, "campaign")));

        RedirectDecision computedBeforeRule = resolver.checkRedirect("/sale");

        assertThat(computedBeforeRule.redirect()).isFalse();
        assertThat(cache.has("redirect:/sale")).isFalse();
        assertThat(resolver.checkRedirect("/sale").to()).isEqualTo("/offers");
    }

    @Test
    void checkRedirect_ShouldPreferNormalizationRedirect_When_UrlIsNotCanonical() {
        resolver.addRule(RedirectRule.exact("/Products/", "/elsewhere", 302, 500, "manual"));

        RedirectDecision decision = resolver.checkRedirect("/Products/");

        assertThat(decision.redirect()).isTrue();
        assertThat(decision.to()).isEqualTo("/products");
        assertThat(decision.statusCode()).isEqualTo(301);
        assertThat(decision.rule().reason()).isEqualTo(RedirectResolver.NORMALIZATION_REASON);
        assertThat(decision.rule().priority()).isEqualTo(RedirectResolver.NORMALIZATION_PRIORITY);
    }

    @Test
    void checkRedirect_ShouldPickHighestPriorityRule() {
        resolver.addRule(RedirectRule.regex("^/blog/", "/articles", 301, 10, "blog moved"));
        resolver.addRule(RedirectRule.exact("/blog/launch", "/news/launch", 308, 100, "launch post"));

        assertThat(resolver.checkRedirect("/blog/launch").to()).isEqualTo("/news/launch");
        assertThat(resolver.checkRedirect("/blog/other").to()).isEqualTo("/articles");
    }

    @Test
    void checkRedirect_ShouldKeepInsertionOrder_When_PrioritiesTie() {
        resolver.addRule(RedirectRule.prefix("/sale", "/first", 302, 5, "first"));
        resolver.addRule(RedirectRule.regex("^/sale", "/second", 302, 5, "second"));

        assertThat(resolver.checkRedirect("/sale/shoes").to()).isEqualTo("/first");
    }

    @Test
    void checkRedirect_ShouldMatchPrefixRules() {
        resolver.addRule(RedirectRule.prefix("/shop", "/store", 302, 0, "rename"));

        RedirectDecision decision = resolver.checkRedirect("/shop/shoes");

        assertThat(decision.to()).isEqualTo("/store");
        assertThat(decision.statusCode()).isEqualTo(302);
        assertThat(decision.rule().matchKind()).isEqualTo(MatchKind.PREFIX);
    }

    @Test
    void checkRedirect_ShouldSearchRegexAnywhereInUrl() {
        resolver.addRule(RedirectRule.regex("/legacy/\\d+", "/archive", 301, 0, "legacy ids"));

        assertThat(resolver.checkRedirect("/shop/legacy/42").redirect()).isTrue();
        assertThat(resolver.checkRedirect("/shop/legacy/latest").redirect()).isFalse();
    }

    @Test
    void checkRedirect_ShouldIgnoreMalformedRegexRule() {
        resolver.addRule(RedirectRule.regex("[unclosed", "/x", 301, 50, "broken"));

        assertThat(resolver.checkRedirect("/[unclosed").redirect()).isFalse();
        assertThat(resolver.getRule("[unclosed")).isPresent();
    }

    @Test
    void checkRedirect_ShouldSkipDisabledRules() {
        resolver.addRule(new RedirectRule("/paused", "/live", 301, MatchKind.EXACT, false, 0, "paused", null));

        assertThat(resolver.checkRedirect("/paused").redirect()).isFalse();
    }

    @Test
    void checkRedirect_ShouldMemoizeDecisionInTaggedCache() {
        resolver.checkRedirect("/products");

        assertThat(cache.keys(Pattern.compile("^redirect:"))).containsExactly("redirect:/products");
        assertThat(cache.tags()).contains("url:/products", RedirectResolver.REDIRECT_TAG);
    }

    @Test
    void checkRedirect_ShouldNotTouchCache_When_CachingDisabled() {
        urlProperties.setCacheEnabled(false);
        RedirectResolver uncached = newResolver();

        uncached.checkRedirect("/products");

        assertThat(cache.size()).isZero();
    }

    @Test
    void addRule_ShouldInvalidateMemoizedDecisionForItsSource() {
        assertThat(resolver.checkRedirect("/promo").redirect()).isFalse();

        resolver.addRule(RedirectRule.exact("/promo", "/sale", 302, 0, "campaign"));
        assertThat(resolver.checkRedirect("/promo").to()).isEqualTo("/sale");

        assertThat(resolver.removeRule("/promo")).isTrue();
        assertThat(resolver.checkRedirect("/promo").redirect()).isFalse();
    }

    @Test
    void addRule_ShouldInvalidateEveryDecision_When_RuleIsPrefix() {
        assertThat(resolver.checkRedirect("/catalog/boots").redirect()).isFalse();

        resolver.addRule(RedirectRule.prefix("/catalog", "/shop", 301, 0, "catalog moved"));

        assertThat(resolver.checkRedirect("/catalog/boots").to()).isEqualTo("/shop");
    }

    @Test
    void addRule_ShouldReplaceRuleWithSameSource() {
        resolver.addRule(RedirectRule.exact("/a", "/b", 301, 0, "v1"));
        resolver.addRule(RedirectRule.exact("/a", "/c", 302, 0, "v2"));

        assertThat(resolver.getRule("/a")).get().extracting(RedirectRule::to).isEqualTo("/c");
        assertThat(resolver.getRules()).filteredOn(rule -> rule.from().equals("/a")).hasSize(1);
    }

    @Test
    void removeRule_ShouldReturnFalse_When_RuleIsUnknown() {
        assertThat(resolver.removeRule("/missing")).isFalse();
    }

    @Test
    void newRule_ShouldRejectUnsupportedStatusCode() {
        assertThatThrownBy(() -> RedirectRule.exact("/a", "/b", 303, 0, "see other"))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("303");
    }

    @Test
    void importRules_ShouldReportFailuresWithoutAbortingBatch() {
        RedirectImportResult result = resolver.importRules(List.of(
            new RedirectRuleRequest("/x", "/y", 303, null, null, null, null),
            new RedirectRuleRequest("/old-blog", "/blog", null, MatchKind.PREFIX, null, 20, "migration"),
            new RedirectRuleRequest(" ", "/z", 301, null, null, null, null)));

        assertThat(result.imported()).isEqualTo(1);
        assertThat(result.errors()).hasSize(2);
        assertThat(result.errors().get(0))
            .isEqualTo("Failed to import rule /x -> /y: Unsupported redirect status code: 303");
        assertThat(resolver.getRule("/old-blog")).get()
            .satisfies(rule -> {
                assertThat(rule.statusCode()).isEqualTo(301);
                assertThat(rule.enabled()).isTrue();
                assertThat(rule.priority()).isEqualTo(20);
            });
    }

    @Test
    void exportRules_ShouldListRulesByDescendingPriority() {
        resolver.addRule(RedirectRule.exact("/low", "/x", 301, -5, "low"));
        resolver.addRule(RedirectRule.exact("/top", "/x", 301, 900, "top"));

        assertThat(resolver.exportRules())
            .extracting(RedirectRule::from)
            .containsExactly("/top", "/home", "/index.html", "/index.php", "/low");
    }

    @Test
    void getStats_ShouldCountRulesByStateAndStatus() {
        resolver.addRule(RedirectRule.exact("/temp", "/x", 302, 0, "temporary"));
        resolver.addRule(new RedirectRule("/off", "/x", 307, MatchKind.EXACT, false, 0, "off", null));

        RedirectStats stats = resolver.getStats();

        assertThat(stats.totalRules()).isEqualTo(5);
        assertThat(stats.enabledRules()).isEqualTo(4);
        assertThat(stats.disabledRules()).isEqualTo(1);
        assertThat(stats.rulesByStatusCode()).isEqualTo(Map.of(301, 3L, 302, 1L, 307, 1L));
        assertThat(stats.normalizationOptions().enforceHttps()).isTrue();
        assertThat(stats.securityOptions().maxUrlLength()).isEqualTo(2048);
    }
}
