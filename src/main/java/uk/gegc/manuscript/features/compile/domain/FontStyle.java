package uk.gegc.manuscript.features.compile.domain;

public enum FontStyle {
    SERIF("Serif", "Georgia", "Georgia, 'Times New Roman', serif"),
    SANS_SERIF("Sans Serif", "Helvetica Neue", "'Helvetica Neue', Helvetica, Arial, sans-serif"),
    MONOSPACE("Monospace", "Menlo", "Menlo, Monaco, 'Courier New', monospace");

    private final String displayName;
    private final String fontName;
    private final String cssFontFamily;

    FontStyle(String displayName, String fontName, String cssFontFamily) {
        this.displayName = displayName;
        this.fontName = fontName;
        this.cssFontFamily = cssFontFamily;
    }

    public String displayName() {
        return displayName;
    }

    /** Font family name written into word-processor styles. */
    public String fontName() {
        return fontName;
    }

    public String cssFontFamily() {
        return cssFontFamily;
    }
}
