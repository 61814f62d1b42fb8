package net.seoedge.domain.locale;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/** Where a detected locale came from, in decreasing priority. */
public enum DetectionSource {
    URL,
    HEADER,
    COOKIE,
    DEFAULT;

    @JsonValue
    public String value() {
        return name().toLowerCase(Locale.ROOT);
    }
}
