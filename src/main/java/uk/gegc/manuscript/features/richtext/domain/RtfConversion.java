package uk.gegc.manuscript.features.richtext.domain;

/**
 * Outcome of converting an RTF buffer to Markdown.
 *
 * @param markdown      converted text, never {@code null}
 * @param failureReason why RTF parsing failed and a fallback was used, or {@code null} on success
 */
public record RtfConversion(String markdown, String failureReason) {

    public RtfConversion {
        if (markdown == null) {
            markdown = "";
        }
    }

    public boolean fellBack() {
        return failureReason != null;
    }
}
