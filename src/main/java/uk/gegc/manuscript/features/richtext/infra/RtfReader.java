package uk.gegc.manuscript.features.richtext.infra;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import uk.gegc.manuscript.features.richtext.domain.FormattedRun;
import uk.gegc.manuscript.features.richtext.domain.RichText;
import uk.gegc.manuscript.features.richtext.domain.RtfParseException;
import uk.gegc.manuscript.features.richtext.domain.TextAttributes;

import java.nio.charset.Charset;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Reads RTF into formatting runs.
 * <p>
 * Tracks character formatting per group (bold, italic, strike, underline, highlight, font size
 * and plain), paragraph and line breaks, tabs, u-escapes, hex escapes and HYPERLINK fields.
 * Font tables, color tables, stylesheets, info blocks, pictures and every ignorable destination
 * the reader does not know are skipped. A bold run at 24pt, 18pt or 14pt that fills a whole line
 * becomes heading level 1, 2 or 3, mirroring {@link RtfWriter}; inside a line it stays bold.
 * Numeric parameters are clamped to the signed and unsigned 16-bit range RTF allows.
 */
@Component
@Slf4j
public class RtfReader {

    private static final Charset ANSI = Charset.forName("windows-1252");
    private static final int MIN_PARAMETER = Short.MIN_VALUE;
    private static final int MAX_PARAMETER = 0xFFFF;
    private static final int MAX_PARAMETER_DIGITS = 9;
    private static final Pattern HYPERLINK = Pattern.compile("HYPERLINK\\s+\"([^\"]*)\"");

    private static final Set<String> SKIPPED_DESTINATIONS = Set.of(
            "fonttbl", "colortbl", "expandedcolortbl", "stylesheet", "info", "pict", "header",
            "footer", "headerl", "headerr", "footerl", "footerr", "listtable", "listoverridetable",
            "generator", "themedata", "colorschememapping", "latentstyles", "rsidtbl", "xmlnstbl",
            "datastore", "object", "nonshppict", "shp", "footnote", "annotation", "revtbl"
    );

    private static final Map<String, String> SYMBOLS = Map.of(
            "bullet", "•",
            "emdash", "—",
            "endash", "–",
            "lquote", "‘",
            "rquote", "’",
            "ldblquote", "“",
            "rdblquote", "”",
            "emspace", " ",
            "enspace", " "
    );

    private enum Destination {
        TEXT,
        SKIP,
        FIELD_INSTRUCTION
    }

    private static final class GroupState {
        boolean bold;
        boolean italic;
        boolean strikethrough;
        boolean underline;
        boolean highlight;
        int fontSize = 24;
        String link;
        int unicodeSkip = 1;
        Destination destination = Destination.TEXT;

        GroupState copy() {
            GroupState copy = new GroupState();
            copy.bold = bold;
            copy.italic = italic;
            copy.strikethrough = strikethrough;
            copy.underline = underline;
            copy.highlight = highlight;
            copy.fontSize = fontSize;
            copy.link = link;
            copy.unicodeSkip = unicodeSkip;
            copy.destination = destination;
            return copy;
        }

        void resetCharacterFormatting() {
            bold = false;
            italic = false;
            strikethrough = false;
            underline = false;
            highlight = false;
            fontSize = 24;
        }

        TextAttributes toAttributes() {
            int headingLevel = 0;
            if (bold) {
                if (fontSize == 48) {
                    headingLevel = 1;
                } else if (fontSize == 36) {
                    headingLevel = 2;
                } else if (fontSize == 28) {
                    headingLevel = 3;
                }
            }
            return new TextAttributes(bold, italic, strikethrough, underline, highlight, link, headingLevel);
        }
    }

    public RichText read(byte[] rtf) throws RtfParseException {
        if (rtf == null) {
            throw new RtfParseException("RTF input is null");
        }
        String source = new String(rtf, ANSI);
        if (!source.stripLeading().startsWith("{\\rtf")) {
            throw new RtfParseException("Input does not start with an RTF header");
        }
        return new Parser(source).parse();
    }

    private static final class Parser {
        private final String source;
        private final Deque<GroupState> groups = new ArrayDeque<>();
        private final List<FormattedRun> runs = new ArrayList<>();
        private final StringBuilder pending = new StringBuilder();
        private final StringBuilder fieldInstruction = new StringBuilder();
        private TextAttributes pendingAttributes = TextAttributes.PLAIN;
        private GroupState state = new GroupState();
        private String fieldLink;
        private int position;
        private int charactersToSkip;
        private boolean ignorableDestination;

        Parser(String source) {
            this.source = source;
        }

        RichText parse() throws RtfParseException {
            while (position < source.length()) {
                char c = source.charAt(position);
                if (c == '{') {
                    position++;
                    groups.push(state);
                    state = state.copy();
                } else if (c == '}') {
                    position++;
                    if (groups.isEmpty()) {
                        throw new RtfParseException("Unbalanced closing brace at offset " + (position - 1));
                    }
                    closeGroup();
                } else if (c == '\\') {
                    readControl();
                } else if (c == '\r' || c == '\n') {
                    position++;
                } else {
                    position++;
                    if (!groups.isEmpty()) {
                        emit(String.valueOf(c));
                    }
                }
            }
            if (!groups.isEmpty()) {
                log.debug("RTF ended with {} unclosed group(s)", groups.size());
            }
            flush();
            return new RichText(wholeLineHeadings(runs));
        }

        private void closeGroup() {
            GroupState closed = state;
            state = groups.pop();
            if (closed.destination == Destination.FIELD_INSTRUCTION
                    && state.destination != Destination.FIELD_INSTRUCTION) {
                Matcher matcher = HYPERLINK.matcher(fieldInstruction);
                fieldLink = matcher.find() ? matcher.group(1) : null;
                fieldInstruction.setLength(0);
            }
        }

        private void readControl() {
            position++; // backslash
            if (position >= source.length()) {
                return;
            }
            char c = source.charAt(position);
            if (!isAsciiLetter(c)) {
                position++;
                readControlSymbol(c);
                return;
            }

            int wordStart = position;
            while (position < source.length() && isAsciiLetter(source.charAt(position))) {
                position++;
            }
            String word = source.substring(wordStart, position);

            Integer parameter = null;
            int paramStart = position;
            if (position < source.length() && (source.charAt(position) == '-' || Character.isDigit(source.charAt(position)))) {
                position++;
                while (position < source.length() && Character.isDigit(source.charAt(position))) {
                    position++;
                }
                String digits = source.substring(paramStart, position);
                if (!digits.equals("-")) {
                    parameter = clampParameter(digits);
                }
            }
            if (position < source.length() && source.charAt(position) == ' ') {
                position++;
            }
            applyControlWord(word, parameter);
        }

        private void readControlSymbol(char symbol) {
            switch (symbol) {
                case '\\', '{', '}' -> emit(String.valueOf(symbol));
                case '\'' -> {
                    if (position + 2 <= source.length()) {
                        String hex = source.substring(position, position + 2);
                        position += 2;
                        try {
                            byte value = (byte) Integer.parseInt(hex, 16);
                            emit(new String(new byte[]{value}, ANSI));
                        } catch (NumberFormatException e) {
                            log.debug("Ignoring malformed hex escape \\'{}", hex);
                        }
                    }
                }
                case '*' -> ignorableDestination = true;
                case '~' -> emit(" ");
                case '_' -> emit("-");
                case '\n', '\r' -> emit("\n");
                default -> {
                    // \- optional hyphen, \: index subentry and other symbols carry no text
                }
            }
        }

        private void applyControlWord(String word, Integer parameter) {
            boolean ignorable = ignorableDestination;
            ignorableDestination = false;
            boolean on = parameter == null || parameter != 0;

            if (word.equals("fldinst")) {
                state.destination = Destination.FIELD_INSTRUCTION;
                return;
            }
            if (word.equals("fldrslt")) {
                state.destination = Destination.TEXT;
                state.link = fieldLink;
                return;
            }
            if (SKIPPED_DESTINATIONS.contains(word) || ignorable) {
                state.destination = Destination.SKIP;
                return;
            }

            switch (word) {
                case "par", "line", "sect", "page" -> emit("\n");
                case "tab" -> emit("\t");
                case "b" -> state.bold = on;
                case "i" -> state.italic = on;
                case "strike", "striked" -> state.strikethrough = on;
                case "ul", "uld", "uldb", "ulw" -> state.underline = on;
                case "ulnone" -> state.underline = false;
                case "highlight", "cb" -> state.highlight = parameter != null && parameter > 0;
                case "fs" -> state.fontSize = parameter != null ? parameter : 24;
                case "plain" -> state.resetCharacterFormatting();
                case "uc" -> state.unicodeSkip = parameter != null ? Math.max(0, parameter) : 1;
                case "u" -> {
                    if (parameter != null) {
                        int codeUnit = parameter < 0 ? parameter + 65536 : parameter;
                        emit(String.valueOf((char) codeUnit));
                        charactersToSkip = state.unicodeSkip;
                        skipFallback();
                    }
                }
                default -> {
                    String symbol = SYMBOLS.get(word);
                    if (symbol != null) {
                        emit(symbol);
                    }
                }
            }
        }

        /**
         * Skips the ANSI fallback that follows a u-escape.
         */
        private void skipFallback() {
            while (charactersToSkip > 0 && position < source.length()) {
                char c = source.charAt(position);
                if (c == '{' || c == '}') {
                    break;
                }
                if (c == '\\') {
                    if (position + 1 < source.length() && source.charAt(position + 1) == '\'') {
                        position += 4;
                    } else {
                        break;
                    }
                } else {
                    position++;
                }
                charactersToSkip--;
            }
            charactersToSkip = 0;
        }

        private void emit(String text) {
            switch (state.destination) {
                case SKIP -> {
                    return;
                }
                case FIELD_INSTRUCTION -> {
                    fieldInstruction.append(text);
                    return;
                }
                default -> {
                    TextAttributes attributes = state.toAttributes();
                    if (!attributes.equals(pendingAttributes)) {
                        flush();
                        pendingAttributes = attributes;
                    }
                    pending.append(text);
                }
            }
        }

        private void flush() {
            if (pending.length() > 0) {
                runs.add(new FormattedRun(pending.toString(), pendingAttributes));
                pending.setLength(0);
            }
        }

        private static int clampParameter(String digits) {
            boolean negative = digits.startsWith("-");
            String magnitude = negative ? digits.substring(1) : digits;
            if (magnitude.length() > MAX_PARAMETER_DIGITS) {
                log.debug("Clamping oversized RTF parameter {}", digits);
                return negative ? MIN_PARAMETER : MAX_PARAMETER;
            }
            int value = Integer.parseInt(digits);
            return Math.max(MIN_PARAMETER, Math.min(MAX_PARAMETER, value));
        }

        /**
         * Drops the heading level from runs that share their line with other text.
         */
        private static List<FormattedRun> wholeLineHeadings(List<FormattedRun> runs) {
            List<FormattedRun> result = new ArrayList<>(runs.size());
            for (int i = 0; i < runs.size(); i++) {
                FormattedRun run = runs.get(i);
                TextAttributes attributes = run.attributes();
                if (attributes.headingLevel() > 0) {
                    boolean startsLine = i == 0 || runs.get(i - 1).text().endsWith("\n");
                    boolean endsLine = run.text().endsWith("\n") || i == runs.size() - 1
                            || runs.get(i + 1).text().startsWith("\n");
                    if (!startsLine || !endsLine) {
                        run = new FormattedRun(run.text(), attributes.withHeadingLevel(0));
                    }
                }
                result.add(run);
            }
            return result;
        }

        private static boolean isAsciiLetter(char c) {
            return (c >= 'a' && c <= 'z') || (c >= 'A' && c <= 'Z');
        }
    }
}
