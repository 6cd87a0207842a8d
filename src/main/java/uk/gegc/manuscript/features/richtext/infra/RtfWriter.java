package uk.gegc.manuscript.features.richtext.infra;

import org.springframework.stereotype.Component;
import uk.gegc.manuscript.features.richtext.domain.FormattedRun;
import uk.gegc.manuscript.features.richtext.domain.RichText;
import uk.gegc.manuscript.features.richtext.domain.TextAttributes;

/**
 * Writes formatting runs as minimal Cocoa-compatible RTF.
 * Output is 7-bit ASCII: characters above 127 are written as u-escapes with a {@code ?} fallback.
 */
@Component
public class RtfWriter {

    static final String HEADER = "{\\rtf1\\ansi\\ansicpg1252\\cocoartf2639\n"
            + "{\\fonttbl\\f0\\fswiss\\fcharset0 Helvetica;}\n"
            + "{\\colortbl;\\red0\\green0\\blue0;\\red255\\green255\\blue0;}\n"
            + "\\f0\\fs24 ";

    private static final int HIGHLIGHT_COLOR_INDEX = 2;

    public String write(RichText richText) {
        StringBuilder rtf = new StringBuilder(HEADER);
        for (FormattedRun run : richText.runs()) {
            TextAttributes attributes = run.attributes();
            if (attributes.isPlain()) {
                appendEscaped(rtf, run.text());
                continue;
            }
            rtf.append('{');
            if (attributes.link() != null) {
                rtf.append("\\field{\\*\\fldinst{HYPERLINK \"")
                        .append(escapeText(attributes.link()))
                        .append("\"}}{\\fldrslt ");
                appendFormatting(rtf, attributes);
                appendEscaped(rtf, run.text());
                rtf.append('}');
            } else {
                appendFormatting(rtf, attributes);
                appendEscaped(rtf, run.text());
            }
            rtf.append('}');
        }
        rtf.append('}');
        return rtf.toString();
    }

    private void appendFormatting(StringBuilder rtf, TextAttributes attributes) {
        StringBuilder words = new StringBuilder();
        switch (attributes.headingLevel()) {
            case 1 -> words.append("\\fs48\\b");
            case 2 -> words.append("\\fs36\\b");
            case 3 -> words.append("\\fs28\\b");
            default -> {
                if (attributes.bold()) {
                    words.append("\\b");
                }
            }
        }
        if (attributes.italic()) {
            words.append("\\i");
        }
        if (attributes.strikethrough()) {
            words.append("\\strike");
        }
        if (attributes.underline()) {
            words.append("\\ul");
        }
        if (attributes.highlight()) {
            words.append("\\highlight").append(HIGHLIGHT_COLOR_INDEX);
        }
        if (words.length() > 0) {
            rtf.append(words).append(' ');
        }
    }

    private static void appendEscaped(StringBuilder rtf, String text) {
        rtf.append(escapeText(text));
    }

    static String escapeText(String text) {
        StringBuilder out = new StringBuilder(text.length());
        for (int i = 0; i < text.length(); i++) {
            char c = text.charAt(i);
            switch (c) {
                case '\\' -> out.append("\\\\");
                case '{' -> out.append("\\{");
                case '}' -> out.append("\\}");
                case '\n' -> out.append("\\par\n");
                case '\t' -> out.append("\\tab ");
                case '\r' -> {
                    // dropped; line endings are normalized to \n upstream
                }
                default -> {
                    if (c > 127) {
                        int signed = c > 32767 ? c - 65536 : c;
                        out.append("\\u").append(signed).append('?');
                    } else {
                        out.append(c);
                    }
                }
            }
        }
        return out.toString();
    }
}
