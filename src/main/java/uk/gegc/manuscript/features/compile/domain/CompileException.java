package uk.gegc.manuscript.features.compile.domain;

import lombok.Getter;

/**
 * Aborts a compile run.
 */
@Getter
public class CompileException extends Exception {

    public enum Reason {
        NO_DOCUMENTS,
        EXPORT_FAILED,
        UNSUPPORTED_FORMAT
    }

    private final Reason reason;

    public CompileException(Reason reason, String message) {
        super(message);
        this.reason = reason;
    }

    public CompileException(Reason reason, String message, Throwable cause) {
        super(message, cause);
        this.reason = reason;
    }

    public static CompileException noDocuments() {
        return new CompileException(Reason.NO_DOCUMENTS,
                "No documents to compile. Make sure at least one document is marked for inclusion.");
    }

    public static CompileException exportFailed(Throwable cause) {
        return new CompileException(Reason.EXPORT_FAILED, "Export failed: " + cause.getMessage(), cause);
    }
}
