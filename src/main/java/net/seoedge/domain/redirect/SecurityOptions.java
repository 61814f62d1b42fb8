package net.seoedge.domain.redirect;

import java.util.List;

/**
 * Immutable URL validation policy.
 */
public record SecurityOptions(
    List<String> allowedProtocols,
    List<String> blockedPaths,
    int maxUrlLength,
    List<String> allowedFileExtensions,
    boolean sanitizeSpecialChars,
    boolean preventDirectoryTraversal
) {

    public SecurityOptions {
        allowedProtocols = allowedProtocols == null ? List.of() : List.copyOf(allowedProtocols);
        blockedPaths = blockedPaths == null ? List.of() : List.copyOf(blockedPaths);
        allowedFileExtensions = allowedFileExtensions == null ? List.of() : List.copyOf(allowedFileExtensions);
    }
}
