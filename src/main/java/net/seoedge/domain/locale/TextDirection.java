package net.seoedge.domain.locale;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Script direction of a locale, serialized as {@code ltr} or {@code rtl}.
 */
public enum TextDirection {
    LTR,
    RTL;

    @JsonValue
    public String value() {
        return name().toLowerCase(Locale.ROOT);
    }

    /**
     * Lenient parse; returns null for anything other than {@code ltr} or {@code rtl}.
     */
    @JsonCreator
    public static TextDirection fromValue(String value) {
        if (value == null) {
            return null;
        }
        return switch (value.trim().toLowerCase(Locale.ROOT)) {
            case "ltr" -> LTR;
            case "rtl" -> RTL;
            default -> null;
        };
    }
}
