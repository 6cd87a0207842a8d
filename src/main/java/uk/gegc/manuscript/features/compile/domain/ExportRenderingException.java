package uk.gegc.manuscript.features.compile.domain;

/**
 * Unexpected failure inside a format renderer.
 */
public class ExportRenderingException extends RuntimeException {

    public ExportRenderingException(String message) {
        super(message);
    }

    public ExportRenderingException(String message, Throwable cause) {
        super(message, cause);
    }
}
