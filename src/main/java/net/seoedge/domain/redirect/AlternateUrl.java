package net.seoedge.domain.redirect;

public record AlternateUrl(String locale, String url) {
}
