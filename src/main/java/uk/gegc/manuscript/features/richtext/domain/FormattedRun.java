package uk.gegc.manuscript.features.richtext.domain;

/**
 * A maximal span of text sharing one attribute set.
 */
public record FormattedRun(String text, TextAttributes attributes) {

    public FormattedRun {
        if (text == null) {
            text = "";
        }
        if (attributes == null) {
            attributes = TextAttributes.PLAIN;
        }
    }

    public static FormattedRun plain(String text) {
        return new FormattedRun(text, TextAttributes.PLAIN);
    }
}
