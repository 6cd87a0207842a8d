package uk.gegc.manuscript.features.conversion.infra;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.jsoup.nodes.Node;
import org.jsoup.nodes.TextNode;
import org.springframework.stereotype.Component;
import uk.gegc.manuscript.features.conversion.domain.ConversionException;
import uk.gegc.manuscript.features.conversion.domain.ConversionResult;
import uk.gegc.manuscript.features.conversion.domain.DocumentConverter;
import uk.gegc.manuscript.features.conversion.domain.DocumentImportOptions;
import uk.gegc.manuscript.features.richtext.application.RichTextMarkdownBridge;
import uk.gegc.manuscript.features.richtext.domain.FormattedRun;
import uk.gegc.manuscript.features.richtext.domain.RichText;
import uk.gegc.manuscript.features.richtext.domain.TextAttributes;
import uk.gegc.manuscript.shared.dto.ImportWarning;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * HTML document converter using JSoup.
 * Walks the cleaned body and turns inline elements into formatting runs and block elements into
 * paragraph breaks, then renders the runs as Markdown.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class HtmlDocumentConverter implements DocumentConverter {

    static final String CONVERTED_MESSAGE = "HTML formatting is converted to basic Markdown (bold, italic, links and headings).";

    private static final Set<String> BLOCK_TAGS = Set.of(
            "p", "div", "section", "article", "header", "footer", "main", "aside", "blockquote",
            "pre", "ul", "ol", "li", "table", "tr", "h1", "h2", "h3", "h4", "h5", "h6", "hr", "figure");

    private final RichTextMarkdownBridge bridge;

    @Override
    public boolean supports(String filenameOrMime) {
        if (filenameOrMime == null) return false;
        String lower = filenameOrMime.toLowerCase(Locale.ROOT);
        return lower.endsWith(".html") || lower.endsWith(".htm") ||
               lower.equals("text/html") || lower.equals("application/xhtml+xml");
    }

    @Override
    public ConversionResult convert(byte[] bytes, DocumentImportOptions options) throws ConversionException {
        RichText richText;
        try {
            Document doc = Jsoup.parse(new String(bytes, StandardCharsets.UTF_8));
            doc.select("script,style,noscript,template").remove();
            RunCollector collector = new RunCollector();
            collector.walk(doc.body(), TextAttributes.PLAIN);
            richText = collector.toRichText();
        } catch (RuntimeException e) {
            throw new ConversionException("Failed to convert HTML document: " + e.getMessage(), e);
        }

        if (!options.preserveFormatting()) {
            return new ConversionResult(bridge.cleanup(richText.plainText()).strip());
        }
        String markdown = bridge.toMarkdown(richText).strip();
        log.debug("Converted HTML document: {} bytes -> {} characters", bytes.length, markdown.length());
        return new ConversionResult(markdown, List.of(ImportWarning.info(CONVERTED_MESSAGE, null)));
    }

    /**
     * Accumulates runs while tracking whether output currently sits at the start of a line, so
     * indentation whitespace between block elements is dropped.
     */
    private static final class RunCollector {
        private final List<FormattedRun> runs = new ArrayList<>();
        private boolean atLineStart = true;
        private boolean pendingSpace;

        void walk(Element element, TextAttributes attributes) {
            for (Node child : element.childNodes()) {
                if (child instanceof TextNode textNode) {
                    appendText(textNode.getWholeText(), attributes);
                } else if (child instanceof Element childElement) {
                    walkElement(childElement, attributes);
                }
            }
        }

        private void walkElement(Element element, TextAttributes attributes) {
            String tag = element.normalName();
            if (tag.equals("br")) {
                lineBreak(1);
                return;
            }
            if (tag.equals("hr")) {
                lineBreak(2);
                emit("***", TextAttributes.PLAIN);
                lineBreak(2);
                return;
            }
            boolean block = BLOCK_TAGS.contains(tag);
            if (block) {
                lineBreak(tag.equals("li") ? 1 : 2);
            }
            if (tag.equals("li")) {
                emit("- ", TextAttributes.PLAIN);
            }
            walk(element, styleFor(element, tag, attributes));
            if (block) {
                lineBreak(tag.equals("li") ? 1 : 2);
            }
        }

        private static TextAttributes styleFor(Element element, String tag, TextAttributes attributes) {
            return switch (tag) {
                case "b", "strong" -> attributes.withBold(true);
                case "i", "em", "cite" -> attributes.withItalic(true);
                case "s", "strike", "del" -> attributes.withStrikethrough(true);
                case "u", "ins" -> attributes.withUnderline(true);
                case "mark" -> attributes.withHighlight(true);
                case "a" -> element.hasAttr("href") && !element.attr("href").isBlank()
                        ? attributes.withLink(element.attr("href"))
                        : attributes;
                case "h1", "h2", "h3", "h4", "h5", "h6" -> attributes.withHeadingLevel(tag.charAt(1) - '0');
                default -> attributes;
            };
        }

        private void appendText(String raw, TextAttributes attributes) {
            String collapsed = raw.replaceAll("\\s+", " ");
            if (collapsed.isEmpty()) {
                return;
            }
            if (collapsed.startsWith(" ")) {
                pendingSpace = !atLineStart;
                collapsed = collapsed.substring(1);
            }
            if (collapsed.isEmpty()) {
                return;
            }
            boolean trailingSpace = collapsed.endsWith(" ");
            if (trailingSpace) {
                collapsed = collapsed.substring(0, collapsed.length() - 1);
            }
            if (pendingSpace) {
                emit(" ", TextAttributes.PLAIN);
            }
            emit(collapsed, attributes);
            pendingSpace = trailingSpace;
        }

        private void emit(String text, TextAttributes attributes) {
            runs.add(new FormattedRun(text, attributes));
            atLineStart = false;
        }

        /**
         * Ends the current line so that at least {@code newlines} line feeds separate it from
         * what follows. Does nothing at the very start of the document.
         */
        private void lineBreak(int newlines) {
            pendingSpace = false;
            if (runs.isEmpty()) {
                return;
            }
            int trailing = trailingNewlines();
            if (trailing < newlines) {
                runs.add(FormattedRun.plain("\n".repeat(newlines - trailing)));
            }
            atLineStart = true;
        }

        private int trailingNewlines() {
            int count = 0;
            for (int i = runs.size() - 1; i >= 0; i--) {
                String text = runs.get(i).text();
                for (int j = text.length() - 1; j >= 0; j--) {
                    if (text.charAt(j) != '\n') {
                        return count;
                    }
                    count++;
                }
            }
            return count;
        }

        RichText toRichText() {
            return new RichText(runs);
        }
    }
}
