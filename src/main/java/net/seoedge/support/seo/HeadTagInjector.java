package net.seoedge.support.seo;

import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;

/**
 * Inserts a head fragment into an HTML document using plain substring search; no HTML parsing.
 *
 * <p>Placement, first match wins: before {@code </head>}, after {@code <head>}, after the opening
 * {@code <html...>} tag wrapped in a new head element, otherwise prepended.</p>
 */
@Component
public class HeadTagInjector {

    private static final String HEAD_CLOSE = "</head>";
    private static final String HEAD_OPEN = "<head>";
    private static final String HTML_OPEN = "<html";

    public String inject(String html, String fragment) {
        if (!StringUtils.hasText(fragment)) {
            return html == null ? "" : html;
        }
        if (html == null || html.isEmpty()) {
            return fragment;
        }
        int headClose = indexOfIgnoreCase(html, HEAD_CLOSE);
        if (headClose >= 0) {
            return html.substring(0, headClose) + fragment + "\n" + html.substring(headClose);
        }

        int headOpen = indexOfIgnoreCase(html, HEAD_OPEN);
        if (headOpen >= 0) {
            int insertAt = headOpen + HEAD_OPEN.length();
            return html.substring(0, insertAt) + "\n" + fragment + html.substring(insertAt);
        }

        int htmlOpen = indexOfIgnoreCase(html, HTML_OPEN);
        if (htmlOpen >= 0) {
            int tagEnd = html.indexOf('>', htmlOpen);
            if (tagEnd >= 0) {
                int insertAt = tagEnd + 1;
                return html.substring(0, insertAt) + "\n<head>\n" + fragment + "\n</head>" + html.substring(insertAt);
            }
        }

        return fragment + "\n" + html;
    }

    // Offsets must index the original text; lower-casing can change its length
    private static int indexOfIgnoreCase(String text, String needle) {
        int last = text.length() - needle.length();
        for (int i = 0; i <= last; i++) {
            if (text.regionMatches(true, i, needle, 0, needle.length())) {
                return i;
            }
        }
        return -1;
    }
}
