package uk.gegc.manuscript.features.archive.domain;

/**
 * Thrown when an entry name or text payload cannot be encoded for the archive.
 * This is the only way assembling an archive can fail.
 */
public class ZipEncodingException extends RuntimeException {

    public ZipEncodingException(String message) {
        super(message);
    }

    public ZipEncodingException(String message, Throwable cause) {
        super(message, cause);
    }
}
