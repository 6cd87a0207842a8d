package uk.gegc.manuscript.features.compile.application.impl;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.apache.pdfbox.pdmodel.PDDocument;
import org.apache.pdfbox.pdmodel.PDPage;
import org.apache.pdfbox.pdmodel.PDPageContentStream;
import org.apache.pdfbox.pdmodel.common.PDRectangle;
import org.apache.pdfbox.pdmodel.font.PDFont;
import org.apache.pdfbox.pdmodel.font.PDType1Font;
import org.apache.pdfbox.pdmodel.font.encoding.GlyphList;
import org.apache.pdfbox.pdmodel.font.encoding.WinAnsiEncoding;
import org.springframework.stereotype.Component;
import uk.gegc.manuscript.features.compile.application.ContentBlockParser;
import uk.gegc.manuscript.features.compile.application.ExportRenderer;
import uk.gegc.manuscript.features.compile.domain.CompilableDocument;
import uk.gegc.manuscript.features.compile.domain.CompilePayload;
import uk.gegc.manuscript.features.compile.domain.CompileProgress;
import uk.gegc.manuscript.features.compile.domain.CompileSettings;
import uk.gegc.manuscript.features.compile.domain.ContentBlock;
import uk.gegc.manuscript.features.compile.domain.DocumentSeparator;
import uk.gegc.manuscript.features.compile.domain.ExportFile;
import uk.gegc.manuscript.features.compile.domain.ExportFormat;
import uk.gegc.manuscript.features.compile.domain.ExportRenderingException;
import uk.gegc.manuscript.features.compile.domain.FontStyle;
import uk.gegc.manuscript.features.compile.domain.PageMargins;
import uk.gegc.manuscript.features.richtext.domain.FormattedRun;
import uk.gegc.manuscript.features.richtext.domain.RichText;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.util.ArrayList;
import java.util.List;

/**
 * Single-column PDF with optional title page, contents page and page numbers.
 * <p>
 * Uses the standard 14 Type 1 fonts, so text is limited to WinAnsi; other characters print as
 * {@code ?}. Bold and italic runs switch font within a line; other inline styles print plain.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class PdfExportRenderer implements ExportRenderer {

    private static final float TITLE_FONT_SIZE = 36f;
    private static final float AUTHOR_FONT_SIZE = 18f;
    private static final float TITLE_TOP_OFFSET = 300f;
    private static final float AUTHOR_GAP = 24f;
    private static final float CHAPTER_TITLE_INCREASE = 6f;
    private static final float PAGE_NUMBER_FONT_SIZE = 10f;
    private static final float PAGE_NUMBER_BASELINE = 36f;
    private static final float TOC_INDENT = 20f;
    private static final String SCENE_BREAK = "* * *";

    private final ContentBlockParser blockParser;

    private record TocEntry(String title, int depth, int pageIndex) {
    }

    @Override
    public boolean supports(ExportFormat format) {
        return format == ExportFormat.PDF;
    }

    @Override
    public ExportFile render(CompilePayload payload) {
        CompileSettings settings = payload.settings();
        FontSet fonts = FontSet.of(settings.getFontStyle());

        try (PDDocument document = new PDDocument()) {
            PDPageContext context = new PDPageContext(document, settings);

            if (settings.isIncludeTitlePage()) {
                renderTitlePage(context, payload, fonts);
            }
            int contentStart = document.getNumberOfPages();
            List<TocEntry> toc = renderDocuments(context, payload, fonts);
            if (document.getNumberOfPages() == 0) {
                context.startNewPage();
            }
            context.close();

            payload.report(CompileProgress.generating(payload.documents().size()));
            if (settings.isIncludeTableOfContents()) {
                insertContents(document, settings, fonts, toc, contentStart);
            }
            if (settings.isIncludePageNumbers()) {
                numberPages(document, fonts, settings.isIncludeTitlePage());
            }

            ByteArrayOutputStream baos = new ByteArrayOutputStream();
            document.save(baos);
            byte[] bytes = baos.toByteArray();
            log.debug("Rendered PDF with {} pages ({} bytes)", document.getNumberOfPages(), bytes.length);
            return ExportFile.ofBytes(payload.filename(ExportFormat.PDF), ExportFormat.PDF.contentType(), bytes);
        } catch (IOException e) {
            throw new ExportRenderingException("Failed to render PDF export", e);
        }
    }

    private void renderTitlePage(PDPageContext context, CompilePayload payload, FontSet fonts) throws IOException {
        context.startNewPage();
        context.moveTo(context.pageHeight() - TITLE_TOP_OFFSET + TITLE_FONT_SIZE);
        context.writeText(payload.title(), fonts.bold(), TITLE_FONT_SIZE, fonts, true);
        if (payload.hasAuthor()) {
            context.skip(AUTHOR_GAP);
            context.writeText("by " + payload.author(), fonts.regular(), AUTHOR_FONT_SIZE, fonts, true);
        }
    }

    private List<TocEntry> renderDocuments(PDPageContext context, CompilePayload payload, FontSet fonts)
            throws IOException {
        CompileSettings settings = payload.settings();
        DocumentSeparator separator = settings.getDocumentSeparator();
        float fontSize = settings.getFontSize();
        List<CompilableDocument> documents = payload.documents();
        List<TocEntry> toc = new ArrayList<>();

        for (int index = 0; index < documents.size(); index++) {
            CompilableDocument doc = documents.get(index);
            payload.report(CompileProgress.processing(index + 1, documents.size()));

            if (index == 0 || separator.breaksPage()) {
                context.startNewPage();
            }

            if (settings.isIncludeChapterTitles() && !doc.title().isBlank()) {
                float titleSize = fontSize + CHAPTER_TITLE_INCREASE;
                if (!context.atTopOfPage()) {
                    context.skip(fontSize * 2);
                }
                context.ensureSpace(titleSize * settings.getLineSpacing());
                toc.add(new TocEntry(doc.title(), doc.depth(), context.pageIndex()));
                context.writeText(doc.title(), fonts.bold(), titleSize, fonts, false);
                context.skip(fontSize);
            } else {
                context.ensureSpace(fontSize * settings.getLineSpacing());
                toc.add(new TocEntry(doc.title().isBlank() ? "Untitled" : doc.title(), doc.depth(), context.pageIndex()));
            }

            for (ContentBlock block : blockParser.parse(doc.content())) {
                switch (block.kind()) {
                    case HEADING -> {
                        float size = fontSize + Math.max(2, 8 - 2 * block.level());
                        context.writeRichText(block.text(), size, fonts, true);
                    }
                    case SCENE_BREAK -> context.writeText(SCENE_BREAK, fonts.regular(), fontSize, fonts, true);
                    case PARAGRAPH -> context.writeRichText(block.text(), fontSize, fonts, false);
                }
                context.skip(fontSize * 0.5f);
            }

            if (index < documents.size() - 1) {
                switch (separator) {
                    case BLANK_LINE -> context.skip(fontSize * settings.getLineSpacing());
                    case THREE_ASTERISKS -> {
                        context.skip(fontSize);
                        context.writeText(SCENE_BREAK, fonts.regular(), fontSize, fonts, true);
                        context.skip(fontSize);
                    }
                    case NONE, PAGE_BREAK, CHAPTER_HEADING -> {
                    }
                }
            }
        }
        return toc;
    }

    /**
     * Lays the contents out once on a scratch document to learn its length, then for real at the
     * end of the document, and finally moves those pages in front of the first content page.
     */
    private void insertContents(PDDocument document, CompileSettings settings, FontSet fonts,
                                List<TocEntry> toc, int contentStart) throws IOException {
        int tocPages;
        try (PDDocument scratch = new PDDocument()) {
            tocPages = renderContents(scratch, settings, fonts, toc, 0);
        }
        int before = document.getNumberOfPages();
        PDPage firstContentPage = contentStart < before ? document.getPage(contentStart) : null;
        renderContents(document, settings, fonts, toc, tocPages);

        if (firstContentPage == null) {
            return;
        }
        List<PDPage> contentsPages = new ArrayList<>();
        for (int i = before; i < document.getNumberOfPages(); i++) {
            contentsPages.add(document.getPage(i));
        }
        for (PDPage page : contentsPages) {
            document.getPages().remove(page);
            document.getPages().insertBefore(page, firstContentPage);
        }
    }

    private int renderContents(PDDocument document, CompileSettings settings, FontSet fonts,
                               List<TocEntry> toc, int pageOffset) throws IOException {
        int start = document.getNumberOfPages();
        PDPageContext context = new PDPageContext(document, settings);
        context.startNewPage();
        context.writeText("Table of Contents", fonts.bold(), settings.getFontSize() + CHAPTER_TITLE_INCREASE, fonts, false);
        context.skip(settings.getFontSize());
        for (TocEntry entry : toc) {
            context.writeTocEntry(entry.title(), entry.depth() * TOC_INDENT,
                    String.valueOf(entry.pageIndex() + pageOffset + 1), fonts.regular(), settings.getFontSize());
        }
        context.close();
        return document.getNumberOfPages() - start;
    }

    private void numberPages(PDDocument document, FontSet fonts, boolean skipFirst) throws IOException {
        PDFont font = fonts.regular();
        for (int i = 0; i < document.getNumberOfPages(); i++) {
            if (i == 0 && skipFirst) {
                continue;
            }
            PDPage page = document.getPage(i);
            String number = String.valueOf(i + 1);
            float width = font.getStringWidth(number) / 1000 * PAGE_NUMBER_FONT_SIZE;
            float x = (page.getMediaBox().getWidth() - width) / 2;
            try (PDPageContentStream stream = new PDPageContentStream(document, page,
                    PDPageContentStream.AppendMode.APPEND, true, true)) {
                stream.beginText();
                stream.setFont(font, PAGE_NUMBER_FONT_SIZE);
                stream.newLineAtOffset(x, PAGE_NUMBER_BASELINE);
                stream.showText(number);
                stream.endText();
            }
        }
    }

    /**
     * Regular, bold, italic and bold-italic faces of one standard font family.
     */
    record FontSet(PDFont regular, PDFont bold, PDFont italic, PDFont boldItalic) {

        static FontSet of(FontStyle style) {
            return switch (style) {
                case SERIF -> new FontSet(PDType1Font.TIMES_ROMAN, PDType1Font.TIMES_BOLD,
                        PDType1Font.TIMES_ITALIC, PDType1Font.TIMES_BOLD_ITALIC);
                case SANS_SERIF -> new FontSet(PDType1Font.HELVETICA, PDType1Font.HELVETICA_BOLD,
                        PDType1Font.HELVETICA_OBLIQUE, PDType1Font.HELVETICA_BOLD_OBLIQUE);
                case MONOSPACE -> new FontSet(PDType1Font.COURIER, PDType1Font.COURIER_BOLD,
                        PDType1Font.COURIER_OBLIQUE, PDType1Font.COURIER_BOLD_OBLIQUE);
            };
        }

        PDFont select(boolean bold, boolean italic) {
            if (bold && italic) {
                return boldItalic;
            }
            if (bold) {
                return bold();
            }
            return italic ? italic() : regular;
        }
    }

    /** A piece of a word drawn in one font. */
    private record Piece(String text, PDFont font) {
    }

    /** A word as drawn: one or more pieces with no space between them. A {@code null} list is a line break. */
    private record Word(List<Piece> pieces, float width) {
        static final Word LINE_BREAK = new Word(null, 0);

        boolean isLineBreak() {
            return pieces == null;
        }
    }

    private static final class PDPageContext {
        private final PDDocument document;
        private final PDRectangle pageSize;
        private final PageMargins margins;
        private final float lineSpacing;
        private final float maxTextWidth;
        private PDPage currentPage;
        private PDPageContentStream contentStream;
        private float y;

        PDPageContext(PDDocument document, CompileSettings settings) {
            this.document = document;
            this.pageSize = new PDRectangle(settings.getPageSize().width(), settings.getPageSize().height());
            this.margins = settings.getMargins();
            this.lineSpacing = settings.getLineSpacing();
            this.maxTextWidth = pageSize.getWidth() - margins.leading() - margins.trailing();
        }

        float pageHeight() {
            return pageSize.getHeight();
        }

        int pageIndex() {
            return document.getNumberOfPages() - 1;
        }

        void startNewPage() throws IOException {
            if (contentStream != null) {
                contentStream.close();
            }
            currentPage = new PDPage(pageSize);
            document.addPage(currentPage);
            contentStream = new PDPageContentStream(document, currentPage);
            y = pageSize.getHeight() - margins.top();
        }

        boolean atTopOfPage() {
            return currentPage != null && y >= pageSize.getHeight() - margins.top();
        }

        void ensureSpace(float requiredSpace) throws IOException {
            if (currentPage == null || y - requiredSpace < margins.bottom()) {
                startNewPage();
            }
        }

        void moveTo(float newY) {
            y = newY;
        }

        /**
         * Moves down by {@code amount}; a gap never carries over onto the next page.
         */
        void skip(float amount) {
            y = Math.max(margins.bottom(), y - amount);
        }

        void writeText(String text, PDFont font, float fontSize, FontSet fonts, boolean centered) throws IOException {
            List<Word> words = new ArrayList<>();
            for (String token : sanitize(text).split("\\s+")) {
                if (!token.isEmpty()) {
                    words.add(new Word(List.of(new Piece(token, font)), width(token, font, fontSize)));
                }
            }
            writeWords(words, fontSize, fonts, centered);
        }

        void writeRichText(RichText text, float fontSize, FontSet fonts, boolean forceBold) throws IOException {
            writeWords(toWords(text, fontSize, fonts, forceBold), fontSize, fonts, false);
        }

        void writeTocEntry(String title, float indent, String pageNumber, PDFont font, float fontSize)
                throws IOException {
            float lineHeight = fontSize * lineSpacing;
            ensureSpace(lineHeight);
            float numberWidth = width(pageNumber, font, fontSize);
            float available = maxTextWidth - indent - numberWidth - fontSize;
            String fitted = sanitize(title);
            while (!fitted.isEmpty() && width(fitted, font, fontSize) > available) {
                fitted = fitted.substring(0, fitted.length() - 1);
            }
            float baseline = y - fontSize;
            contentStream.beginText();
            contentStream.setFont(font, fontSize);
            contentStream.newLineAtOffset(margins.leading() + indent, baseline);
            contentStream.showText(fitted);
            contentStream.endText();
            contentStream.beginText();
            contentStream.setFont(font, fontSize);
            contentStream.newLineAtOffset(margins.leading() + maxTextWidth - numberWidth, baseline);
            contentStream.showText(pageNumber);
            contentStream.endText();
            y -= lineHeight;
        }

        void close() throws IOException {
            if (contentStream != null) {
                contentStream.close();
                contentStream = null;
            }
        }

        private void writeWords(List<Word> words, float fontSize, FontSet fonts, boolean centered) throws IOException {
            float spaceWidth = width(" ", fonts.regular(), fontSize);
            List<Word> line = new ArrayList<>();
            float lineWidth = 0;
            for (Word word : words) {
                if (word.isLineBreak()) {
                    writeLine(line, lineWidth, fontSize, fonts, centered);
                    line = new ArrayList<>();
                    lineWidth = 0;
                    continue;
                }
                float candidate = line.isEmpty() ? word.width() : lineWidth + spaceWidth + word.width();
                if (candidate > maxTextWidth && !line.isEmpty()) {
                    writeLine(line, lineWidth, fontSize, fonts, centered);
                    line = new ArrayList<>();
                    candidate = word.width();
                }
                line.add(word);
                lineWidth = candidate;
            }
            if (!line.isEmpty()) {
                writeLine(line, lineWidth, fontSize, fonts, centered);
            }
        }

        private void writeLine(List<Word> line, float lineWidth, float fontSize, FontSet fonts, boolean centered)
                throws IOException {
            float lineHeight = fontSize * lineSpacing;
            ensureSpace(lineHeight);
            if (!line.isEmpty()) {
                float x = centered
                        ? margins.leading() + Math.max(0, (maxTextWidth - lineWidth) / 2)
                        : margins.leading();
                contentStream.beginText();
                contentStream.newLineAtOffset(x, y - fontSize);
                for (int i = 0; i < line.size(); i++) {
                    if (i > 0) {
                        contentStream.setFont(fonts.regular(), fontSize);
                        contentStream.showText(" ");
                    }
                    for (Piece piece : line.get(i).pieces()) {
                        contentStream.setFont(piece.font(), fontSize);
                        contentStream.showText(piece.text());
                    }
                }
                contentStream.endText();
            }
            y -= lineHeight;
        }

        /**
         * Splits runs into words. A word may span runs (for example {@code **bold**,}), in which case it
         * keeps one piece per font.
         */
        private static List<Word> toWords(RichText text, float fontSize, FontSet fonts, boolean forceBold)
                throws IOException {
            List<Word> words = new ArrayList<>();
            List<Piece> pieces = new ArrayList<>();
            StringBuilder current = new StringBuilder();
            PDFont currentFont = null;

            for (FormattedRun run : text.runs()) {
                PDFont font = fonts.select(forceBold || run.attributes().bold(), run.attributes().italic());
                String value = sanitize(run.text());
                for (int i = 0; i < value.length(); i++) {
                    char c = value.charAt(i);
                    if (c == '\n' || Character.isWhitespace(c)) {
                        if (current.length() > 0) {
                            pieces.add(new Piece(current.toString(), currentFont));
                            current.setLength(0);
                        }
                        if (!pieces.isEmpty()) {
                            words.add(word(pieces, fontSize));
                            pieces = new ArrayList<>();
                        }
                        if (c == '\n') {
                            words.add(Word.LINE_BREAK);
                        }
                        continue;
                    }
                    if (currentFont != null && currentFont != font && current.length() > 0) {
                        pieces.add(new Piece(current.toString(), currentFont));
                        current.setLength(0);
                    }
                    currentFont = font;
                    current.append(c);
                }
            }
            if (current.length() > 0) {
                pieces.add(new Piece(current.toString(), currentFont));
            }
            if (!pieces.isEmpty()) {
                words.add(word(pieces, fontSize));
            }
            return words;
        }

        private static Word word(List<Piece> pieces, float fontSize) throws IOException {
            float total = 0;
            for (Piece piece : pieces) {
                total += width(piece.text(), piece.font(), fontSize);
            }
            return new Word(List.copyOf(pieces), total);
        }

        private static float width(String text, PDFont font, float fontSize) throws IOException {
            return font.getStringWidth(text) / 1000 * fontSize;
        }
    }

    /**
     * Replaces characters the standard fonts cannot encode. Tabs become spaces, other control
     * characters except line feeds are dropped.
     */
    static String sanitize(String text) {
        if (text == null) {
            return "";
        }
        GlyphList glyphs = GlyphList.getAdobeGlyphList();
        StringBuilder sb = new StringBuilder(text.length());
        text.codePoints().forEach(cp -> {
            if (cp == '\n') {
                sb.append('\n');
            } else if (cp == '\t') {
                sb.append(' ');
            } else if (Character.isISOControl(cp)) {
                return;
            } else if (WinAnsiEncoding.INSTANCE.contains(glyphs.codePointToName(cp))) {
                sb.appendCodePoint(cp);
            } else {
                sb.append('?');
            }
        });
        return sb.toString();
    }
}
