package net.seoedge.support.seo;

import net.seoedge.domain.locale.HreflangTag;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;

class HreflangLinkRendererTest {

    private final HreflangLinkRenderer renderer = new HreflangLinkRenderer();

    @Test
    void should_RenderEscapedLinkTags_When_TagsAreValid() {
        String html = renderer.renderLinkTags(List.of(
            new HreflangTag("fr", "https://example.com/fr/shoes?a=1&b=2", "Français"),
            new HreflangTag(HreflangTag.X_DEFAULT, "https://example.com/shoes", "Default")
        ));

        assertEquals(
            "<link rel=\"alternate\" hreflang=\"fr\" href=\"https://example.com/fr/shoes?a=1&amp;b=2\">\n"
                + "<link rel=\"alternate\" hreflang=\"x-default\" href=\"https://example.com/shoes\">",
            html);
    }

    @Test
    void should_RenderLinkHeader_When_TagsAreValid() {
        String header = renderer.renderLinkHeader(List.of(
            new HreflangTag("en", "https://example.com/shoes", "English"),
            new HreflangTag("fr", "https://example.com/fr/shoes", "Français")
        ));

        assertEquals("<https://example.com/shoes>; rel=\"alternate\"; hreflang=\"en\", "
            + "<https://example.com/fr/shoes>; rel=\"alternate\"; hreflang=\"fr\"", header);
    }

    @Test
    void should_StripHeaderBreakingCharacters_When_RenderingLinkHeader() {
        String header = renderer.renderLinkHeader(List.of(
            new HreflangTag("en\r\n", "https://example.com/<x>\"\r\nSet-Cookie: a=b", "English")
        ));

        assertEquals("<https://example.com/xSet-Cookie: a=b>; rel=\"alternate\"; hreflang=\"en\"", header);
    }

    @Test
    void should_ReturnEmptyString_When_NoRenderableTagsProvided() {
        assertEquals("", renderer.renderLinkTags(null));
        assertEquals("", renderer.renderLinkTags(List.of()));
        assertEquals("", renderer.renderLinkHeader(List.of(
            new HreflangTag(" ", "https://example.com/", "Blank"),
            new HreflangTag("fr", "", "Empty")
        )));
    }
}
