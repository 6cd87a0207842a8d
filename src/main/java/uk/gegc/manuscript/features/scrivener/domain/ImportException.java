package uk.gegc.manuscript.features.scrivener.domain;

import lombok.Getter;

/**
 * Aborts a whole import. Per-item problems are reported as warnings instead.
 */
@Getter
public class ImportException extends Exception {

    private final ImportError error;
    private final String detail;

    public ImportException(ImportError error) {
        this(error, null, null);
    }

    public ImportException(ImportError error, String detail) {
        this(error, detail, null);
    }

    public ImportException(ImportError error, String detail, Throwable cause) {
        super(error.describe(detail), cause);
        this.error = error;
        this.detail = detail;
    }

    public String getRecoverySuggestion() {
        return error.recoverySuggestion();
    }
}
