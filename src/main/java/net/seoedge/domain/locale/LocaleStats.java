package net.seoedge.domain.locale;

public record LocaleStats(
    int total,
    int enabled,
    int disabled,
    String defaultLocale,
    int rtl,
    int ltr
) {
}
