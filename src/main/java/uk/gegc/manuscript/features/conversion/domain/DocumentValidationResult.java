package uk.gegc.manuscript.features.conversion.domain;

import java.util.List;
import java.util.Locale;

/**
 * Pre-flight check of a single file, made from its name and size alone.
 */
public record DocumentValidationResult(
        boolean valid,
        String documentTitle,
        long fileSize,
        List<String> warnings,
        List<String> errors
) {
    public DocumentValidationResult {
        documentTitle = documentTitle == null ? "" : documentTitle;
        warnings = warnings == null ? List.of() : List.copyOf(warnings);
        errors = errors == null ? List.of() : List.copyOf(errors);
    }

    public String fileSizeFormatted() {
        if (fileSize < 1024) {
            return fileSize + " B";
        }
        if (fileSize < 1024 * 1024) {
            return (fileSize / 1024) + " KB";
        }
        return String.format(Locale.ROOT, "%.1f MB", fileSize / (1024.0 * 1024.0));
    }
}
