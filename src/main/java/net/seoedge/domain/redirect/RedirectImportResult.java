package net.seoedge.domain.redirect;

import java.util.List;

/**
 * Result of a bulk rule import; failures are reported per rule and never abort the batch.
 */
public record RedirectImportResult(int imported, List<String> errors) {

    public RedirectImportResult {
        errors = errors == null ? List.of() : List.copyOf(errors);
    }
}
