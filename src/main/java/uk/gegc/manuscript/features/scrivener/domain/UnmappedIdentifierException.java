package uk.gegc.manuscript.features.scrivener.domain;

/**
 * A manifest writer was asked to reference an identifier that was never registered in the
 * export mapping tables. Always a programming error.
 */
public class UnmappedIdentifierException extends IllegalStateException {

    public UnmappedIdentifierException(String kind, Object identifier) {
        super("No " + kind + " mapping registered for " + identifier);
    }
}
