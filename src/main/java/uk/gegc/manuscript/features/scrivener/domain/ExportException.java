package uk.gegc.manuscript.features.scrivener.domain;

import lombok.Getter;

/**
 * Aborts a Scrivener export.
 */
@Getter
public class ExportException extends Exception {

    public enum Reason {
        WRITE_FAILED,
        ARCHIVE_FAILED,
        CANCELLED
    }

    private final Reason reason;

    public ExportException(Reason reason, String message) {
        super(message);
        this.reason = reason;
    }

    public ExportException(Reason reason, String message, Throwable cause) {
        super(message, cause);
        this.reason = reason;
    }
}
