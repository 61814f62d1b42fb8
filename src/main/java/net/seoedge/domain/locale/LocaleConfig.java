package net.seoedge.domain.locale;

/**
 * Metadata and state of one registered locale.
 *
 * @param code language code used in URL prefixes and hreflang values (for example {@code fr})
 * @param name English display name
 * @param nativeName display name in the locale itself
 * @param region optional region code
 * @param direction text direction, null only on invalid input
 * @param currency optional ISO currency code
 * @param dateFormat optional display date pattern
 * @param numberFormat optional number formatting tag
 * @param enabled whether the locale is served
 * @param defaultLocale whether this is the registry's default locale
 */
public record LocaleConfig(
    String code,
    String name,
    String nativeName,
    String region,
    TextDirection direction,
    String currency,
    String dateFormat,
    String numberFormat,
    boolean enabled,
    boolean defaultLocale
) {

    public LocaleConfig withEnabled(boolean value) {
        return new LocaleConfig(code, name, nativeName, region, direction, currency, dateFormat, numberFormat,
            value, defaultLocale);
    }

    public LocaleConfig withDefaultLocale(boolean value) {
        return new LocaleConfig(code, name, nativeName, region, direction, currency, dateFormat, numberFormat,
            enabled, value);
    }
}
