package net.seoedge.domain.locale;

public record LocalizedUrl(String locale, String url, boolean canonical) {
}
