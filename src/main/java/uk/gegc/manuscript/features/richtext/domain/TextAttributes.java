package uk.gegc.manuscript.features.richtext.domain;

/**
 * Formatting shared by every character of a run.
 *
 * @param headingLevel 0 for body text, 1 to 3 for heading lines
 * @param link         target URL, or {@code null}
 */
public record TextAttributes(
        boolean bold,
        boolean italic,
        boolean strikethrough,
        boolean underline,
        boolean highlight,
        String link,
        int headingLevel
) {

    public static final TextAttributes PLAIN = new TextAttributes(false, false, false, false, false, null, 0);

    public TextAttributes {
        if (headingLevel < 0 || headingLevel > 6) {
            throw new IllegalArgumentException("Heading level must be between 0 and 6: " + headingLevel);
        }
    }

    public TextAttributes withBold(boolean value) {
        return new TextAttributes(value, italic, strikethrough, underline, highlight, link, headingLevel);
    }

    public TextAttributes withItalic(boolean value) {
        return new TextAttributes(bold, value, strikethrough, underline, highlight, link, headingLevel);
    }

    public TextAttributes withStrikethrough(boolean value) {
        return new TextAttributes(bold, italic, value, underline, highlight, link, headingLevel);
    }

    public TextAttributes withUnderline(boolean value) {
        return new TextAttributes(bold, italic, strikethrough, value, highlight, link, headingLevel);
    }

    public TextAttributes withHighlight(boolean value) {
        return new TextAttributes(bold, italic, strikethrough, underline, value, link, headingLevel);
    }

    public TextAttributes withLink(String value) {
        return new TextAttributes(bold, italic, strikethrough, underline, highlight, value, headingLevel);
    }

    public TextAttributes withHeadingLevel(int value) {
        return new TextAttributes(bold, italic, strikethrough, underline, highlight, link, value);
    }

    public boolean isPlain() {
        return equals(PLAIN);
    }
}
