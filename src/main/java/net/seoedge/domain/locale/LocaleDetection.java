package net.seoedge.domain.locale;

import java.util.List;

/**
 * @param detected chosen locale code
 * @param confidence 1.0 for URL, header quality, 0.8 for cookie, 0.5 for the default fallback
 * @param source signal that produced {@code detected}
 * @param alternatives the other enabled locale codes
 */
public record LocaleDetection(
    String detected,
    double confidence,
    DetectionSource source,
    List<String> alternatives
) {
    public LocaleDetection {
        alternatives = alternatives == null ? List.of() : List.copyOf(alternatives);
    }
}
