package uk.gegc.manuscript.features.conversion.infra;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.apache.poi.xwpf.usermodel.IBodyElement;
import org.apache.poi.xwpf.usermodel.UnderlinePatterns;
import org.apache.poi.xwpf.usermodel.XWPFDocument;
import org.apache.poi.xwpf.usermodel.XWPFHyperlink;
import org.apache.poi.xwpf.usermodel.XWPFHyperlinkRun;
import org.apache.poi.xwpf.usermodel.XWPFParagraph;
import org.apache.poi.xwpf.usermodel.XWPFRun;
import org.apache.poi.xwpf.usermodel.XWPFStyle;
import org.apache.poi.xwpf.usermodel.XWPFTable;
import org.apache.poi.xwpf.usermodel.XWPFTableCell;
import org.apache.poi.xwpf.usermodel.XWPFTableRow;
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

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Word (.docx) converter using Apache POI.
 * Paragraph runs keep bold, italic, strikethrough, underline, highlight and hyperlinks; paragraphs
 * styled as headings (or Title) become Markdown headings. Table cells are read as paragraphs.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class DocxDocumentConverter implements DocumentConverter {

    static final String TABLES_FLATTENED_MESSAGE = "Tables were imported as plain paragraphs.";

    private static final Pattern HEADING_STYLE = Pattern.compile("(?i)heading\\s*([1-6])");

    private final RichTextMarkdownBridge bridge;

    @Override
    public boolean supports(String filenameOrMime) {
        if (filenameOrMime == null) return false;
        String lower = filenameOrMime.toLowerCase(Locale.ROOT);
        return lower.endsWith(".docx")
                || lower.equals("application/vnd.openxmlformats-officedocument.wordprocessingml.document");
    }

    @Override
    public ConversionResult convert(byte[] bytes, DocumentImportOptions options) throws ConversionException {
        List<FormattedRun> runs = new ArrayList<>();
        List<ImportWarning> warnings = new ArrayList<>();

        try (XWPFDocument document = new XWPFDocument(new ByteArrayInputStream(bytes))) {
            boolean sawTable = false;
            for (IBodyElement element : document.getBodyElements()) {
                if (element instanceof XWPFParagraph paragraph) {
                    appendParagraph(document, paragraph, runs);
                } else if (element instanceof XWPFTable table) {
                    sawTable = true;
                    for (XWPFTableRow row : table.getRows()) {
                        for (XWPFTableCell cell : row.getTableCells()) {
                            for (XWPFParagraph paragraph : cell.getParagraphs()) {
                                appendParagraph(document, paragraph, runs);
                            }
                        }
                    }
                }
            }
            if (sawTable) {
                warnings.add(ImportWarning.info(TABLES_FLATTENED_MESSAGE, null));
            }
        } catch (IOException | RuntimeException e) {
            throw new ConversionException("Failed to convert DOCX document: " + e.getMessage(), e);
        }

        RichText richText = new RichText(runs);
        String content = options.preserveFormatting()
                ? bridge.toMarkdown(richText)
                : bridge.cleanup(richText.plainText());
        log.debug("Converted DOCX document: {} bytes -> {} characters", bytes.length, content.length());
        return new ConversionResult(content.strip(), warnings);
    }

    private static void appendParagraph(XWPFDocument document, XWPFParagraph paragraph, List<FormattedRun> runs) {
        int headingLevel = headingLevel(document, paragraph);
        List<FormattedRun> paragraphRuns = new ArrayList<>();
        for (XWPFRun run : paragraph.getRuns()) {
            String text = run.text();
            if (text == null || text.isEmpty()) {
                continue;
            }
            paragraphRuns.add(new FormattedRun(text, attributesOf(document, run, headingLevel)));
        }
        if (paragraphRuns.stream().allMatch(run -> run.text().isBlank())) {
            return;
        }
        if (!runs.isEmpty()) {
            runs.add(FormattedRun.plain("\n\n"));
        }
        runs.addAll(paragraphRuns);
    }

    private static TextAttributes attributesOf(XWPFDocument document, XWPFRun run, int headingLevel) {
        TextAttributes attributes = TextAttributes.PLAIN
                .withBold(run.isBold())
                .withItalic(run.isItalic())
                .withStrikethrough(run.isStrikeThrough() || run.isDoubleStrikeThrough())
                .withUnderline(run.getUnderline() != null && run.getUnderline() != UnderlinePatterns.NONE)
                .withHighlight(run.isHighlighted())
                .withHeadingLevel(headingLevel);
        if (run instanceof XWPFHyperlinkRun hyperlinkRun) {
            XWPFHyperlink hyperlink = hyperlinkRun.getHyperlink(document);
            if (hyperlink != null && hyperlink.getURL() != null && !hyperlink.getURL().isBlank()) {
                attributes = attributes.withLink(hyperlink.getURL());
            }
        }
        return attributes;
    }

    /**
     * Heading level from the paragraph style id or its display name; {@code Title} counts as level 1.
     */
    static int headingLevel(XWPFDocument document, XWPFParagraph paragraph) {
        String styleId = paragraph.getStyleID();
        if (styleId == null) {
            return 0;
        }
        String name = styleId;
        if (document.getStyles() != null) {
            XWPFStyle style = document.getStyles().getStyle(styleId);
            if (style != null && style.getName() != null) {
                name = style.getName();
            }
        }
        for (String candidate : List.of(name, styleId)) {
            Matcher matcher = HEADING_STYLE.matcher(candidate);
            if (matcher.find()) {
                return Integer.parseInt(matcher.group(1));
            }
            if (candidate.equalsIgnoreCase("title")) {
                return 1;
            }
        }
        return 0;
    }
}
