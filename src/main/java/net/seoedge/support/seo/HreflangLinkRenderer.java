package net.seoedge.support.seo;

import net.seoedge.domain.locale.HreflangTag;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;

import java.util.List;

/**
 * Renders hreflang alternates as HTML head links and as an HTTP {@code Link} header value.
 */
@Component
public class HreflangLinkRenderer {

    /**
     * Renders escaped {@code <link rel="alternate">} tags, one per line.
     *
     * @return HTML fragment, or an empty string when nothing is renderable
     */
    public String renderLinkTags(List<HreflangTag> tags) {
        if (tags == null || tags.isEmpty()) {
            return "";
        }
        StringBuilder builder = new StringBuilder();
        for (HreflangTag tag : tags) {
            if (!isRenderable(tag)) {
                continue;
            }
            if (builder.length() > 0) {
                builder.append('\n');
            }
            builder.append("<link rel=\"alternate\" hreflang=\"")
                .append(escapeHtml(tag.hreflang().trim()))
                .append("\" href=\"")
                .append(escapeHtml(tag.href().trim()))
                .append("\">");
        }
        return builder.toString();
    }

    /**
     * RFC 8288 header form: {@code <href>; rel="alternate"; hreflang="code"}, comma separated.
     */
    public String renderLinkHeader(List<HreflangTag> tags) {
        if (tags == null || tags.isEmpty()) {
            return "";
        }
        StringBuilder builder = new StringBuilder();
        for (HreflangTag tag : tags) {
            if (!isRenderable(tag)) {
                continue;
            }
            if (builder.length() > 0) {
                builder.append(", ");
            }
            builder.append('<')
                .append(stripHeaderBreakers(tag.href().trim()))
                .append(">; rel=\"alternate\"; hreflang=\"")
                .append(stripHeaderBreakers(tag.hreflang().trim()))
                .append('"');
        }
        return builder.toString();
    }

    private boolean isRenderable(HreflangTag tag) {
        return tag != null && StringUtils.hasText(tag.hreflang()) && StringUtils.hasText(tag.href());
    }

    private String stripHeaderBreakers(String value) {
        return value.replaceAll("[\\r\\n<>\"]", "");
    }

    private String escapeHtml(String value) {
        return value
            .replace("&", "&amp;")
            .replace("<", "&lt;")
            .replace(">", "&gt;")
            .replace("\"", "&quot;")
            .replace("'", "&#39;");
    }
}
