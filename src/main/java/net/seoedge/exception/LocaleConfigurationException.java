package net.seoedge.exception;

import java.util.List;

/**
 * A locale registry mutation was rejected. The registry is left exactly as it was before the call.
 */
public class LocaleConfigurationException extends RuntimeException {

    private final String localeCode;
    private final List<String> reasons;

    public LocaleConfigurationException(String localeCode, List<String> reasons) {
        super("Invalid locale configuration for " + localeCode + ": " + String.join(", ", reasons));
        this.localeCode = localeCode;
        this.reasons = List.copyOf(reasons);
    }

    public String getLocaleCode() {
        return localeCode;
    }

    /** Every validation failure, in the order checked. */
    public List<String> getReasons() {
        return reasons;
    }
}
