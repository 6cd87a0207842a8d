package uk.gegc.manuscript.features.compile.domain;

/**
 * Paper sizes in PostScript points (1/72 inch).
 */
public enum PageSize {
    LETTER("US Letter", 612, 792),
    A4("A4", 595, 842);

    private final String displayName;
    private final float width;
    private final float height;

    PageSize(String displayName, float width, float height) {
        this.displayName = displayName;
        this.width = width;
        this.height = height;
    }

    public String displayName() {
        return displayName;
    }

    public float width() {
        return width;
    }

    public float height() {
        return height;
    }
}
