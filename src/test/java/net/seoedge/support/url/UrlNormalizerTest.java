package net.seoedge.support.url;

import net.seoedge.domain.redirect.NormalizationOptions;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class UrlNormalizerTest {

    private static final List<String> TRACKING_PARAMS = List.of("utm_source", "utm_medium", "utm_campaign");

    private final UrlNormalizer normalizer = new UrlNormalizer(
        new NormalizationOptions(true, false, true, true, true, false, TRACKING_PARAMS, true));

    @Test
    void normalize_ShouldApplyEveryStep_When_DefaultPolicy() {
        assertThat(normalizer.normalize("http://example.com/Products/Index.html?utm_source=fb&id=5"))
            .isEqualTo("https://example.com/products?id=5");
    }

    @Test
    void normalize_ShouldKeepRelativeUrlsRelative() {
        assertThat(normalizer.normalize("/Shoes/?b=2&a=1")).isEqualTo("/shoes?a=1&b=2");
        assertThat(normalizer.normalize("Shoes")).isEqualTo("/shoes");
    }

    @Test
    void normalize_ShouldPreserveHostCaseAndFragment() {
        assertThat(normalizer.normalize("https://Example.com/A#Top")).isEqualTo("https://Example.com/a#Top");
    }

    @Test
    void normalize_ShouldKeepRootSlash() {
        assertThat(normalizer.normalize("https://example.com")).isEqualTo("https://example.com/");
        assertThat(normalizer.normalize("https://example.com/index.php")).isEqualTo("https://example.com/");
    }

    @Test
    void normalize_ShouldDropQuery_When_OnlyTrackingParamsRemain() {
        assertThat(normalizer.normalize("https://example.com/a?utm_medium=email&utm_campaign=spring"))
            .isEqualTo("https://example.com/a");
    }

    @Test
    void normalize_ShouldSortParamsStably_When_KeysRepeat() {
        assertThat(normalizer.normalize("/list?b=2&a=1&b=1")).isEqualTo("/list?a=1&b=2&b=1");
    }

    @Test
    void normalize_ShouldNotLowercaseQueryValues() {
        assertThat(normalizer.normalize("/Search?q=Running+Shoes")).isEqualTo("/search?q=Running+Shoes");
    }

    @Test
    void normalize_ShouldReturnInputUnchanged_When_UrlCannotBeParsed() {
        assertThat(normalizer.normalize("http://")).isEqualTo("http://");
        assertThat(normalizer.normalize("https://exa mple.com/a")).isEqualTo("https://exa mple.com/a");
    }

    @Test
    void normalize_ShouldStripWww_When_Enabled() {
        UrlNormalizer stripping = new UrlNormalizer(
            new NormalizationOptions(true, true, true, true, true, false, List.of(), true));

        assertThat(stripping.normalize("http://www.example.com/Shop")).isEqualTo("https://example.com/shop");
        assertThat(stripping.normalize("https://WWW.example.com:8443/")).isEqualTo("https://example.com:8443/");
    }

    @Test
    void normalize_ShouldAppendTrailingSlash_When_EnforcedAndNotAFile() {
        UrlNormalizer enforcing = new UrlNormalizer(
            new NormalizationOptions(true, false, true, false, false, true, List.of(), false));

        assertThat(enforcing.normalize("https://example.com/docs")).isEqualTo("https://example.com/docs/");
        assertThat(enforcing.normalize("https://example.com/guide.pdf")).isEqualTo("https://example.com/guide.pdf");
        assertThat(enforcing.normalize("https://example.com/docs/")).isEqualTo("https://example.com/docs/");
    }

    @Test
    void normalize_ShouldPreferRemoval_When_BothTrailingSlashFlagsAreSet() {
        UrlNormalizer conflicting = new UrlNormalizer(
            new NormalizationOptions(true, false, true, true, true, true, List.of(), true));

        assertThat(conflicting.normalize("/docs/")).isEqualTo("/docs");
        assertThat(conflicting.normalize("/docs")).isEqualTo("/docs");
    }

    @Test
    void normalize_ShouldLeavePathAlone_When_EveryStepDisabled() {
        UrlNormalizer passive = new UrlNormalizer(
            new NormalizationOptions(false, false, false, false, false, false, List.of(), false));

        assertThat(passive.normalize("http://example.com/A/index.html/?z=1&a=2"))
            .isEqualTo("http://example.com/A/index.html/?z=1&a=2");
    }

    @ParameterizedTest
    @ValueSource(strings = {
        "http://example.com/Products/Index.html?utm_source=fb&id=5",
        "/index.html/",
        "HTTP://Example.com/A/B/index.php/?utm_medium=x&z=1&a=2",
        "https://example.com///",
        "/Docs/INDEX.HTM",
        "relative/Path/?b&a"
    })
    void normalize_ShouldBeIdempotent(String url) {
        String once = normalizer.normalize(url);

        assertThat(normalizer.normalize(once)).isEqualTo(once);
    }

    @Test
    void normalize_ShouldCollapseIndexExposedByTrailingSlashRemoval() {
        assertThat(normalizer.normalize("/index.html/")).isEqualTo("/");
    }
}
