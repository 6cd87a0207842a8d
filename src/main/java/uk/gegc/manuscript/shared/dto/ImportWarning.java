package uk.gegc.manuscript.shared.dto;

/**
 * A recoverable problem recorded while converting a single item.
 * The operation carries on; callers render these in a post-import summary.
 */
public record ImportWarning(
        String message,
        String itemTitle,
        WarningSeverity severity
) {
    public ImportWarning {
        if (message == null || message.isBlank()) {
            throw new IllegalArgumentException("Warning message cannot be null or blank");
        }
        if (severity == null) {
            severity = WarningSeverity.WARNING;
        }
    }

    public static ImportWarning info(String message, String itemTitle) {
        return new ImportWarning(message, itemTitle, WarningSeverity.INFO);
    }

    public static ImportWarning warning(String message, String itemTitle) {
        return new ImportWarning(message, itemTitle, WarningSeverity.WARNING);
    }

    public static ImportWarning error(String message, String itemTitle) {
        return new ImportWarning(message, itemTitle, WarningSeverity.ERROR);
    }
}
