package uk.gegc.manuscript.features.richtext.application;

import java.util.List;
import java.util.regex.Pattern;

/**
 * Normalizes Markdown produced from formatting runs.
 * <ul>
 *     <li>CRLF and CR become LF</li>
 *     <li>a closing marker followed (after optional spaces) by the same opening marker is merged:
 *     {@code **a****b**} becomes {@code **ab**}, {@code **a** **b**} becomes {@code **a b**};
 *     single {@code *} markers merge only across spaces</li>
 *     <li>empty marker pairs such as {@code ****} or {@code ~~~~} are dropped</li>
 *     <li>trailing whitespace is stripped from every line</li>
 *     <li>three or more consecutive newlines collapse to two</li>
 * </ul>
 * Rules are applied until nothing changes, so {@code clean(clean(x)).equals(clean(x))}.
 */
public final class MarkdownCleanup {

    private static final int MAX_PASSES = 16;

    // A closing marker must follow visible text and the reopening marker must precede it,
    // so thematic breaks like "* * *" are left alone. Single asterisks only merge across
    // whitespace: "**" between two words is a literal, as in "2**3".
    private static final List<Pattern> ADJACENT_MARKERS = List.of(
            Pattern.compile("(?<=[^\\s*])\\*\\*\\*([ \\t]*)\\*\\*\\*(?=[^\\s*])"),
            Pattern.compile("(?<=[^\\s*])\\*\\*([ \\t]*)\\*\\*(?=[^\\s*])"),
            Pattern.compile("(?<=[^\\s*])\\*([ \\t]+)\\*(?=[^\\s*])"),
            Pattern.compile("(?<=[^\\s~])~~([ \\t]*)~~(?=[^\\s~])"),
            Pattern.compile("(?<=[^\\s=])==([ \\t]*)==(?=[^\\s=])"),
            Pattern.compile("</u>([ \\t]*)<u>")
    );

    private static final List<Pattern> EMPTY_PAIRS = List.of(
            Pattern.compile("(?<!\\*)\\*{6}(?!\\*)"),
            Pattern.compile("(?<!\\*)\\*{4}(?!\\*)"),
            Pattern.compile("(?<!~)~{4}(?!~)"),
            Pattern.compile("(?<!=)={4}(?!=)"),
            Pattern.compile("<u></u>")
    );

    private static final Pattern TRAILING_WHITESPACE = Pattern.compile("[ \\t]+$", Pattern.MULTILINE);
    private static final Pattern EXCESS_NEWLINES = Pattern.compile("\\n{3,}");

    private MarkdownCleanup() {
    }

    public static String clean(String markdown) {
        if (markdown == null || markdown.isEmpty()) {
            return "";
        }
        String current = markdown.replace("\r\n", "\n").replace('\r', '\n');
        for (int pass = 0; pass < MAX_PASSES; pass++) {
            String next = applyOnce(current);
            if (next.equals(current)) {
                return current;
            }
            current = next;
        }
        return current;
    }

    private static String applyOnce(String text) {
        String result = text;
        for (Pattern marker : ADJACENT_MARKERS) {
            result = marker.matcher(result).replaceAll("$1");
        }
        for (Pattern emptyPair : EMPTY_PAIRS) {
            result = emptyPair.matcher(result).replaceAll("");
        }
        result = TRAILING_WHITESPACE.matcher(result).replaceAll("");
        result = EXCESS_NEWLINES.matcher(result).replaceAll("\n\n");
        return result;
    }
}
