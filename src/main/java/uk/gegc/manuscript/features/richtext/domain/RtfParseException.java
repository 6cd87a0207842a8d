package uk.gegc.manuscript.features.richtext.domain;

/**
 * Thrown when a byte buffer is not well-formed RTF.
 */
public class RtfParseException extends Exception {

    public RtfParseException(String message) {
        super(message);
    }

    public RtfParseException(String message, Throwable cause) {
        super(message, cause);
    }
}
