package uk.gegc.manuscript.features.compile.application.impl;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import uk.gegc.manuscript.features.archive.application.ZipArchiveWriter;
import uk.gegc.manuscript.features.archive.domain.ZipEncodingException;
import uk.gegc.manuscript.features.compile.application.ContentBlockParser;
import uk.gegc.manuscript.features.compile.application.ExportRenderer;
import uk.gegc.manuscript.features.compile.config.CompileProperties;
import uk.gegc.manuscript.features.compile.domain.CompilableDocument;
import uk.gegc.manuscript.features.compile.domain.CompilePayload;
import uk.gegc.manuscript.features.compile.domain.CompileProgress;
import uk.gegc.manuscript.features.compile.domain.CompileSettings;
import uk.gegc.manuscript.features.compile.domain.ContentBlock;
import uk.gegc.manuscript.features.compile.domain.ExportFile;
import uk.gegc.manuscript.features.compile.domain.ExportFormat;
import uk.gegc.manuscript.features.compile.domain.ExportRenderingException;
import uk.gegc.manuscript.features.richtext.domain.FormattedRun;
import uk.gegc.manuscript.features.richtext.domain.RichText;
import uk.gegc.manuscript.features.richtext.domain.TextAttributes;

import java.time.Clock;
import java.time.format.DateTimeFormatter;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

import static uk.gegc.manuscript.shared.util.XmlText.escape;

/**
 * Writes an EPUB 3 book with an EPUB 2 NCX for older readers.
 * <p>
 * The {@code mimetype} entry is always first and stored uncompressed. Every compiled document gets
 * its own {@code chapter-NNN.xhtml}; the optional title and contents pages come before them in the
 * spine.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class EpubExportRenderer implements ExportRenderer {

    static final String MIMETYPE = "application/epub+zip";
    private static final String XML_DECLARATION = "<?xml version=\"1.0\" encoding=\"UTF-8\"?>\n";

    private final ContentBlockParser blockParser;
    private final CompileProperties properties;
    private final Clock clock;

    private record Chapter(String filename, String title, String content) {
    }

    @Override
    public boolean supports(ExportFormat format) {
        return format == ExportFormat.EPUB;
    }

    @Override
    public ExportFile render(CompilePayload payload) {
        CompileSettings settings = payload.settings();
        List<CompilableDocument> documents = payload.documents();
        String bookId = UUID.randomUUID().toString();

        List<Chapter> chapters = new ArrayList<>();
        if (settings.isIncludeTitlePage()) {
            chapters.add(new Chapter("title.xhtml", "Title Page", buildTitlePage(payload)));
        }
        if (settings.isIncludeTableOfContents()) {
            chapters.add(new Chapter("toc-page.xhtml", "Table of Contents", buildContentsPage(documents)));
        }
        for (int index = 0; index < documents.size(); index++) {
            CompilableDocument doc = documents.get(index);
            payload.report(CompileProgress.processing(index + 1, documents.size()));
            chapters.add(new Chapter(chapterFilename(index), doc.title(), buildChapter(doc, settings)));
        }

        payload.report(CompileProgress.generating(documents.size()));
        try {
            ZipArchiveWriter zip = new ZipArchiveWriter(clock);
            zip.addEntry("mimetype", MIMETYPE, false);
            zip.addEntry("META-INF/container.xml", buildContainerXml());
            zip.addEntry("OEBPS/content.opf", buildContentOpf(payload, bookId, chapters));
            zip.addEntry("OEBPS/toc.ncx", buildTocNcx(payload.title(), bookId, chapters));
            zip.addEntry("OEBPS/nav.xhtml", buildNavXhtml(payload.title(), chapters));
            zip.addEntry("OEBPS/styles.css", buildStylesCss(settings));
            for (Chapter chapter : chapters) {
                zip.addEntry("OEBPS/" + chapter.filename(), chapter.content());
            }
            byte[] bytes = zip.finish();
            log.debug("Rendered EPUB {} with {} spine items ({} bytes)", bookId, chapters.size(), bytes.length);
            return ExportFile.ofBytes(payload.filename(ExportFormat.EPUB), ExportFormat.EPUB.contentType(), bytes);
        } catch (ZipEncodingException e) {
            throw new ExportRenderingException("Failed to render EPUB export", e);
        }
    }

    static String chapterFilename(int index) {
        return String.format("chapter-%03d.xhtml", index + 1);
    }

    private static String buildContainerXml() {
        return XML_DECLARATION
                + "<container version=\"1.0\" xmlns=\"urn:oasis:names:tc:opendocument:xmlns:container\">\n"
                + "  <rootfiles>\n"
                + "    <rootfile full-path=\"OEBPS/content.opf\" media-type=\"application/oebps-package+xml\"/>\n"
                + "  </rootfiles>\n"
                + "</container>\n";
    }

    private String buildContentOpf(CompilePayload payload, String bookId, List<Chapter> chapters) {
        String modified = DateTimeFormatter.ISO_INSTANT.format(clock.instant().truncatedTo(ChronoUnit.SECONDS));
        StringBuilder sb = new StringBuilder(XML_DECLARATION);
        sb.append("<package xmlns=\"http://www.idpf.org/2007/opf\" version=\"3.0\" unique-identifier=\"bookid\">\n");
        sb.append("  <metadata xmlns:dc=\"http://purl.org/dc/elements/1.1/\">\n");
        sb.append("    <dc:identifier id=\"bookid\">urn:uuid:").append(bookId).append("</dc:identifier>\n");
        sb.append("    <dc:title>").append(escape(payload.title())).append("</dc:title>\n");
        sb.append("    <dc:creator>").append(escape(payload.author())).append("</dc:creator>\n");
        sb.append("    <dc:language>").append(escape(properties.getLanguage())).append("</dc:language>\n");
        sb.append("    <meta property=\"dcterms:modified\">").append(modified).append("</meta>\n");
        sb.append("  </metadata>\n");
        sb.append("  <manifest>\n");
        sb.append("    <item id=\"nav\" href=\"nav.xhtml\" media-type=\"application/xhtml+xml\" properties=\"nav\"/>\n");
        sb.append("    <item id=\"ncx\" href=\"toc.ncx\" media-type=\"application/x-dtbncx+xml\"/>\n");
        sb.append("    <item id=\"css\" href=\"styles.css\" media-type=\"text/css\"/>\n");
        for (int i = 0; i < chapters.size(); i++) {
            sb.append("    <item id=\"chapter-").append(i).append("\" href=\"").append(chapters.get(i).filename())
                    .append("\" media-type=\"application/xhtml+xml\"/>\n");
        }
        sb.append("  </manifest>\n");
        sb.append("  <spine toc=\"ncx\">\n");
        for (int i = 0; i < chapters.size(); i++) {
            sb.append("    <itemref idref=\"chapter-").append(i).append("\"/>\n");
        }
        sb.append("  </spine>\n");
        sb.append("</package>\n");
        return sb.toString();
    }

    private static String buildTocNcx(String title, String bookId, List<Chapter> chapters) {
        StringBuilder sb = new StringBuilder(XML_DECLARATION);
        sb.append("<ncx xmlns=\"http://www.daisy.org/z3986/2005/ncx/\" version=\"2005-1\">\n");
        sb.append("  <head>\n");
        sb.append("    <meta name=\"dtb:uid\" content=\"urn:uuid:").append(bookId).append("\"/>\n");
        sb.append("    <meta name=\"dtb:depth\" content=\"1\"/>\n");
        sb.append("    <meta name=\"dtb:totalPageCount\" content=\"0\"/>\n");
        sb.append("    <meta name=\"dtb:maxPageNumber\" content=\"0\"/>\n");
        sb.append("  </head>\n");
        sb.append("  <docTitle><text>").append(escape(title)).append("</text></docTitle>\n");
        sb.append("  <navMap>\n");
        for (int i = 0; i < chapters.size(); i++) {
            Chapter chapter = chapters.get(i);
            sb.append("    <navPoint id=\"navpoint-").append(i + 1).append("\" playOrder=\"").append(i + 1).append("\">\n");
            sb.append("      <navLabel><text>").append(escape(chapter.title())).append("</text></navLabel>\n");
            sb.append("      <content src=\"").append(chapter.filename()).append("\"/>\n");
            sb.append("    </navPoint>\n");
        }
        sb.append("  </navMap>\n");
        sb.append("</ncx>\n");
        return sb.toString();
    }

    private static String buildNavXhtml(String title, List<Chapter> chapters) {
        StringBuilder items = new StringBuilder();
        for (Chapter chapter : chapters) {
            items.append("      <li><a href=\"").append(chapter.filename()).append("\">")
                    .append(escape(chapter.title())).append("</a></li>\n");
        }
        String body = "  <nav epub:type=\"toc\" id=\"toc\">\n"
                + "    <h1>Table of Contents</h1>\n"
                + "    <ol>\n" + items + "    </ol>\n"
                + "  </nav>\n";
        return xhtmlPage(title, body, " xmlns:epub=\"http://www.idpf.org/2007/ops\"");
    }

    private static String buildTitlePage(CompilePayload payload) {
        StringBuilder body = new StringBuilder();
        body.append("  <div class=\"title-page\">\n");
        body.append("    <h1>").append(escape(payload.title())).append("</h1>\n");
        if (payload.hasAuthor()) {
            body.append("    <p class=\"author\">by ").append(escape(payload.author())).append("</p>\n");
        }
        body.append("  </div>\n");
        return xhtmlPage(payload.title(), body.toString(), "");
    }

    private static String buildContentsPage(List<CompilableDocument> documents) {
        StringBuilder body = new StringBuilder("  <h1>Table of Contents</h1>\n");
        for (int i = 0; i < documents.size(); i++) {
            CompilableDocument doc = documents.get(i);
            body.append("  <p class=\"toc-entry\"");
            if (doc.depth() > 0) {
                body.append(" style=\"margin-left: ").append(doc.depth() * 20).append("px\"");
            }
            body.append("><a href=\"").append(chapterFilename(i)).append("\">")
                    .append(escape(doc.title())).append("</a></p>\n");
        }
        return xhtmlPage("Table of Contents", body.toString(), "");
    }

    private String buildChapter(CompilableDocument doc, CompileSettings settings) {
        StringBuilder body = new StringBuilder();
        if (settings.isIncludeChapterTitles() && !doc.title().isBlank()) {
            String tag = doc.depth() == 0 ? "h1" : "h2";
            body.append("  <").append(tag).append(">").append(escape(doc.title())).append("</").append(tag).append(">\n");
        }
        boolean first = true;
        for (ContentBlock block : blockParser.parse(doc.content())) {
            switch (block.kind()) {
                case HEADING -> {
                    String tag = "h" + Math.min(block.level() + 1, 6);
                    body.append("  <").append(tag).append(">");
                    appendRuns(body, block.text());
                    body.append("</").append(tag).append(">\n");
                    first = true;
                }
                case SCENE_BREAK -> {
                    body.append("  <p class=\"separator\">* * *</p>\n");
                    first = true;
                }
                case PARAGRAPH -> {
                    body.append(first ? "  <p class=\"first\">" : "  <p>");
                    appendRuns(body, block.text());
                    body.append("</p>\n");
                    first = false;
                }
            }
        }
        return xhtmlPage(doc.title(), body.toString(), "");
    }

    /**
     * Appends runs as inline XHTML. Line breaks inside a run become {@code <br/>}.
     */
    static void appendRuns(StringBuilder sb, RichText text) {
        for (FormattedRun run : text.runs()) {
            TextAttributes a = run.attributes();
            List<String> closing = new ArrayList<>();
            if (a.link() != null) {
                sb.append("<a href=\"").append(escape(a.link())).append("\">");
                closing.add(0, "</a>");
            }
            openTag(sb, closing, a.bold(), "strong");
            openTag(sb, closing, a.italic(), "em");
            openTag(sb, closing, a.strikethrough(), "del");
            openTag(sb, closing, a.underline(), "u");
            openTag(sb, closing, a.highlight(), "mark");
            String[] lines = run.text().split("\n", -1);
            for (int i = 0; i < lines.length; i++) {
                if (i > 0) {
                    sb.append("<br/>");
                }
                sb.append(escape(lines[i]));
            }
            closing.forEach(sb::append);
        }
    }

    private static void openTag(StringBuilder sb, List<String> closing, boolean enabled, String tag) {
        if (enabled) {
            sb.append('<').append(tag).append('>');
            closing.add(0, "</" + tag + ">");
        }
    }

    private static String xhtmlPage(String title, String body, String extraNamespaces) {
        return XML_DECLARATION
                + "<!DOCTYPE html>\n"
                + "<html xmlns=\"http://www.w3.org/1999/xhtml\"" + extraNamespaces + ">\n"
                + "<head>\n"
                + "  <meta charset=\"UTF-8\"/>\n"
                + "  <title>" + escape(title) + "</title>\n"
                + "  <link rel=\"stylesheet\" type=\"text/css\" href=\"styles.css\"/>\n"
                + "</head>\n"
                + "<body>\n"
                + body
                + "</body>\n"
                + "</html>\n";
    }

    private static String buildStylesCss(CompileSettings settings) {
        return """
                body {
                    font-family: %s;
                    font-size: %dpt;
                    line-height: %s;
                    margin: 1em;
                    text-align: justify;
                }

                h1 {
                    font-size: 2em;
                    font-weight: bold;
                    margin-top: 1em;
                    margin-bottom: 0.5em;
                    text-align: left;
                }

                h2 {
                    font-size: 1.5em;
                    font-weight: bold;
                    margin-top: 1em;
                    margin-bottom: 0.5em;
                }

                p {
                    margin: 0.5em 0;
                    text-indent: 1.5em;
                }

                p.first, h1 + p, h2 + p {
                    text-indent: 0;
                }

                .title-page {
                    text-align: center;
                    margin-top: 30%%;
                }

                .title-page h1 {
                    font-size: 2.5em;
                    text-align: center;
                }

                .title-page .author {
                    font-size: 1.2em;
                    font-style: italic;
                    color: #666;
                    margin-top: 1em;
                }

                .separator {
                    text-align: center;
                    text-indent: 0;
                    margin: 2em 0;
                }

                nav ol {
                    list-style-type: none;
                    padding-left: 0;
                }

                nav li {
                    margin: 0.5em 0;
                }

                nav a {
                    text-decoration: none;
                    color: #333;
                }
                """.formatted(settings.getFontStyle().cssFontFamily(), Math.round(settings.getFontSize()),
                trimFloat(settings.getLineSpacing()));
    }

    private static String trimFloat(float value) {
        return value == Math.rint(value) ? String.valueOf((int) value) : String.valueOf(value);
    }
}
