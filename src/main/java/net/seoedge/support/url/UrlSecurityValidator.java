package net.seoedge.support.url;

import net.seoedge.domain.redirect.SecurityOptions;
import net.seoedge.domain.redirect.UrlValidationResult;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * Screens URLs against the configured security policy and offers a best-effort sanitizer.
 * Neither operation throws.
 */
public class UrlSecurityValidator {

    public static final String INVALID_FORMAT = "Invalid URL format";

    private static final Pattern DANGEROUS_CONTENT =
        Pattern.compile("<|>|\"|'|javascript:|data:|vbscript:", Pattern.CASE_INSENSITIVE);

    private static final Pattern DANGEROUS_SCHEME =
        Pattern.compile("^(javascript|data|vbscript):", Pattern.CASE_INSENSITIVE);

    private static final Pattern CONTROL_CHARS = Pattern.compile("[\\x00-\\x1F\\x7F]");

    private static final List<String> TRAVERSAL_SEQUENCES =
        List.of("../", "..\\", "%2e%2e", "%2e.", ".%2e", "..%2f", "..%5c", "%252e%252e");

    private final SecurityOptions options;

    public UrlSecurityValidator(SecurityOptions options) {
        this.options = options;
    }

    public SecurityOptions options() {
        return options;
    }

    public UrlValidationResult validate(String url) {
        List<String> issues = new ArrayList<>();
        Optional<ParsedUrl> parsed = ParsedUrl.parse(url);
        if (parsed.isEmpty()) {
            return UrlValidationResult.of(List.of(INVALID_FORMAT));
        }

        if (url.length() > options.maxUrlLength()) {
            issues.add("URL exceeds maximum length of " + options.maxUrlLength() + " characters");
        }

        ParsedUrl parts = parsed.get();
        String protocol = parts.effectiveScheme();
        if (options.allowedProtocols().stream().noneMatch(protocol::equalsIgnoreCase)) {
            issues.add("Protocol " + protocol + ": is not allowed");
        }

        String pathname = parts.path().toLowerCase(Locale.ROOT);
        for (String blockedPath : options.blockedPaths()) {
            if (pathname.startsWith(blockedPath.toLowerCase(Locale.ROOT))) {
                issues.add("Path " + pathname + " is blocked");
                break;
            }
        }

        if (options.preventDirectoryTraversal()) {
            String lowered = url.toLowerCase(Locale.ROOT);
            if (TRAVERSAL_SEQUENCES.stream().anyMatch(lowered::contains)) {
                issues.add("Directory traversal attempt detected");
            }
        }

        if (UrlNormalizer.lastSegmentHasDot(pathname) && !pathname.endsWith(".")) {
            String extension = pathname.substring(pathname.lastIndexOf('.'));
            boolean allowed = options.allowedFileExtensions().stream().anyMatch(extension::equalsIgnoreCase);
            if (!allowed) {
                issues.add("File extension " + extension + " is not allowed");
            }
        }

        if (options.sanitizeSpecialChars() && DANGEROUS_CONTENT.matcher(url).find()) {
            issues.add("URL contains potentially dangerous characters");
        }

        return UrlValidationResult.of(issues);
    }

    /**
     * Strips control characters and script-capable scheme prefixes and percent-encodes quote and angle
     * characters. This is mitigation, not a full sanitizer.
     */
    public String sanitize(String url) {
        if (url == null) {
            return null;
        }
        String sanitized = CONTROL_CHARS.matcher(url).replaceAll("");
        String previous;
        do {
            previous = sanitized;
            sanitized = DANGEROUS_SCHEME.matcher(sanitized).replaceFirst("");
        } while (!sanitized.equals(previous));
        return sanitized
            .replace("<", "%3C")
            .replace(">", "%3E")
            .replace("\"", "%22")
            .replace("'", "%27");
    }
}
