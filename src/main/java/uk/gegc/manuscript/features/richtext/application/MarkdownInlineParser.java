package uk.gegc.manuscript.features.richtext.application;

import org.springframework.stereotype.Component;
import uk.gegc.manuscript.features.richtext.domain.FormattedRun;
import uk.gegc.manuscript.features.richtext.domain.RichText;
import uk.gegc.manuscript.features.richtext.domain.TextAttributes;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.function.UnaryOperator;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Parses Markdown source into formatting runs.
 * <p>
 * Lines starting with {@code #}, {@code ##} or {@code ###} become heading runs for that line only.
 * Inline markers are matched in precedence order (bold-italic, bold, italic, strikethrough,
 * highlight, underline, link). A span claimed by an earlier pattern discards every later
 * candidate that overlaps it; text outside any claimed span keeps the line's base attributes.
 */
@Component
public class MarkdownInlineParser {

    private record InlineRule(Pattern pattern, UnaryOperator<TextAttributes> style, boolean link) {
    }

    private record Span(int start, int end, String text, TextAttributes attributes) {
        boolean overlaps(int otherStart, int otherEnd) {
            return otherStart < end && start < otherEnd;
        }
    }

    private static final List<InlineRule> RULES = List.of(
            style("\\*\\*\\*(.+?)\\*\\*\\*", a -> a.withBold(true).withItalic(true)),
            style("___(.+?)___", a -> a.withBold(true).withItalic(true)),
            style("\\*\\*(.+?)\\*\\*", a -> a.withBold(true)),
            style("__(.+?)__", a -> a.withBold(true)),
            style("(?<!\\*)\\*(?![\\s*])([^*\\n]+?)(?<!\\s)\\*(?!\\*)", a -> a.withItalic(true)),
            style("(?<![_\\p{L}\\p{N}])_(?![\\s_])([^_\\n]+?)(?<!\\s)_(?![_\\p{L}\\p{N}])", a -> a.withItalic(true)),
            style("~~(.+?)~~", a -> a.withStrikethrough(true)),
            style("==(.+?)==", a -> a.withHighlight(true)),
            style("<u>(.+?)</u>", a -> a.withUnderline(true)),
            new InlineRule(Pattern.compile("\\[([^\\]\\n]+)\\]\\(([^)\\s]+)\\)"), UnaryOperator.identity(), true)
    );

    public RichText parse(String markdown) {
        if (markdown == null || markdown.isEmpty()) {
            return RichText.EMPTY;
        }
        String normalized = markdown.replace("\r\n", "\n").replace('\r', '\n');
        String[] lines = normalized.split("\n", -1);
        List<FormattedRun> runs = new ArrayList<>();

        for (int i = 0; i < lines.length; i++) {
            String line = lines[i];
            TextAttributes base = TextAttributes.PLAIN;
            int level = headingLevel(line);
            if (level > 0) {
                base = base.withHeadingLevel(level);
                line = line.substring(level + 1);
            }
            runs.addAll(parseInline(line, base));
            if (i < lines.length - 1) {
                runs.add(FormattedRun.plain("\n"));
            }
        }
        return new RichText(runs);
    }

    List<FormattedRun> parseInline(String text, TextAttributes base) {
        List<Span> claimed = new ArrayList<>();
        for (InlineRule rule : RULES) {
            Matcher matcher = rule.pattern().matcher(text);
            while (matcher.find()) {
                int start = matcher.start();
                int end = matcher.end();
                if (claimed.stream().anyMatch(span -> span.overlaps(start, end))) {
                    continue;
                }
                TextAttributes attributes = rule.link()
                        ? base.withLink(matcher.group(2))
                        : rule.style().apply(base);
                claimed.add(new Span(start, end, matcher.group(1), attributes));
            }
        }
        claimed.sort(Comparator.comparingInt(Span::start));

        List<FormattedRun> runs = new ArrayList<>();
        int position = 0;
        for (Span span : claimed) {
            if (span.start() > position) {
                runs.add(new FormattedRun(text.substring(position, span.start()), base));
            }
            runs.add(new FormattedRun(span.text(), span.attributes()));
            position = span.end();
        }
        if (position < text.length()) {
            runs.add(new FormattedRun(text.substring(position), base));
        }
        return runs;
    }

    static int headingLevel(String line) {
        if (line.startsWith("### ")) {
            return 3;
        }
        if (line.startsWith("## ")) {
            return 2;
        }
        if (line.startsWith("# ")) {
            return 1;
        }
        return 0;
    }

    private static InlineRule style(String regex, UnaryOperator<TextAttributes> style) {
        return new InlineRule(Pattern.compile(regex), style, false);
    }
}
