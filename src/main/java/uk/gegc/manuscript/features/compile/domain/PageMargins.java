package uk.gegc.manuscript.features.compile.domain;

/**
 * Page margins in points.
 */
public record PageMargins(float top, float leading, float bottom, float trailing) {

    public static final PageMargins ONE_INCH = all(72);

    public PageMargins {
        if (top < 0 || leading < 0 || bottom < 0 || trailing < 0) {
            throw new IllegalArgumentException("Margins cannot be negative");
        }
    }

    public static PageMargins all(float value) {
        return new PageMargins(value, value, value, value);
    }
}
