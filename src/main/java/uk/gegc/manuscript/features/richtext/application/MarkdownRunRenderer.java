package uk.gegc.manuscript.features.richtext.application;

import org.springframework.stereotype.Component;
import uk.gegc.manuscript.features.richtext.domain.FormattedRun;
import uk.gegc.manuscript.features.richtext.domain.RichText;
import uk.gegc.manuscript.features.richtext.domain.TextAttributes;

/**
 * Renders formatting runs as Markdown.
 * <p>
 * Markers wrap only the trimmed part of each line segment of a run; leading and trailing
 * whitespace stays outside. A run with a link and visible text becomes {@code [text](url)}
 * and its other styles are ignored. Heading runs that start a line get {@code #} prefixes.
 * The result is passed through {@link MarkdownCleanup}.
 */
@Component
public class MarkdownRunRenderer {

    public String render(RichText richText) {
        StringBuilder out = new StringBuilder();
        boolean atLineStart = true;
        // Styles Markdown cannot show are dropped first so equal-looking runs coalesce.
        RichText visible = new RichText(richText.runs().stream()
                .map(run -> new FormattedRun(run.text(), visibleAttributes(run.attributes())))
                .toList());

        for (FormattedRun run : visible.runs()) {
            String[] segments = run.text().split("\n", -1);
            for (int i = 0; i < segments.length; i++) {
                if (i > 0) {
                    out.append('\n');
                    atLineStart = true;
                }
                String segment = segments[i];
                if (segment.isEmpty()) {
                    continue;
                }
                TextAttributes attributes = run.attributes();
                if (atLineStart && attributes.headingLevel() > 0 && !segment.isBlank()) {
                    out.append("#".repeat(attributes.headingLevel())).append(' ');
                    segment = stripLeading(segment);
                }
                out.append(formatSegment(segment, attributes));
                atLineStart = false;
            }
        }
        return MarkdownCleanup.clean(out.toString());
    }

    String formatSegment(String text, TextAttributes attributes) {
        String trimmed = text.strip();
        if (trimmed.isEmpty()) {
            return text;
        }
        String leading = text.substring(0, text.indexOf(trimmed));
        String trailing = text.substring(leading.length() + trimmed.length());

        if (attributes.link() != null) {
            return leading + "[" + trimmed + "](" + attributes.link() + ")" + trailing;
        }

        String formatted = trimmed;
        if (attributes.strikethrough()) {
            formatted = "~~" + formatted + "~~";
        }
        if (attributes.highlight()) {
            formatted = "==" + formatted + "==";
        }
        // Heading lines are bold by presentation; the # prefix already carries that.
        boolean bold = attributes.bold() && attributes.headingLevel() == 0;
        if (attributes.underline() && !bold && !attributes.italic()) {
            formatted = "<u>" + formatted + "</u>";
        }
        if (bold && attributes.italic()) {
            formatted = "***" + formatted + "***";
        } else if (bold) {
            formatted = "**" + formatted + "**";
        } else if (attributes.italic()) {
            formatted = "*" + formatted + "*";
        }
        return leading + formatted + trailing;
    }

    static TextAttributes visibleAttributes(TextAttributes attributes) {
        if (attributes.link() != null) {
            return TextAttributes.PLAIN.withLink(attributes.link()).withHeadingLevel(attributes.headingLevel());
        }
        boolean bold = attributes.bold() && attributes.headingLevel() == 0;
        return attributes
                .withBold(bold)
                .withUnderline(attributes.underline() && !bold && !attributes.italic());
    }

    private static String stripLeading(String text) {
        int i = 0;
        while (i < text.length() && Character.isWhitespace(text.charAt(i))) {
            i++;
        }
        return text.substring(i);
    }
}
