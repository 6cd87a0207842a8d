package uk.gegc.manuscript.features.scrivener.domain;

import uk.gegc.manuscript.features.scrivener.domain.model.ScrivenerVersion;

import java.util.List;

/**
 * Pre-flight check of a bundle. Produced without converting or writing anything.
 */
public record ValidationResult(
        boolean valid,
        String projectTitle,
        int itemCount,
        ScrivenerVersion version,
        List<String> warnings,
        List<String> errors
) {
    public ValidationResult {
        warnings = warnings == null ? List.of() : List.copyOf(warnings);
        errors = errors == null ? List.of() : List.copyOf(errors);
    }

    public static ValidationResult invalid(String error) {
        return new ValidationResult(false, "", 0, null, List.of(), List.of(error));
    }
}
