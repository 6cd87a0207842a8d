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
import uk.gegc.manuscript.features.compile.domain.DocumentSeparator;
import uk.gegc.manuscript.features.compile.domain.ExportFile;
import uk.gegc.manuscript.features.compile.domain.ExportFormat;
import uk.gegc.manuscript.features.compile.domain.ExportRenderingException;
import uk.gegc.manuscript.features.compile.domain.PageMargins;
import uk.gegc.manuscript.features.richtext.domain.FormattedRun;
import uk.gegc.manuscript.features.richtext.domain.RichText;
import uk.gegc.manuscript.features.richtext.domain.TextAttributes;

import java.time.Clock;
import java.time.format.DateTimeFormatter;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.List;

import static uk.gegc.manuscript.shared.util.XmlText.escape;

/**
 * Writes a minimal WordprocessingML package.
 * <p>
 * Parts: {@code [Content_Types].xml}, {@code _rels/.rels}, {@code word/_rels/document.xml.rels},
 * {@code word/document.xml}, {@code word/styles.xml}, {@code docProps/core.xml},
 * {@code docProps/app.xml}, plus {@code word/footer1.xml} when page numbers are on. Links become
 * external hyperlink relationships numbered after the fixed ones.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class DocxExportRenderer implements ExportRenderer {

    static final String W_NS = "http://schemas.openxmlformats.org/wordprocessingml/2006/main";
    static final String R_NS = "http://schemas.openxmlformats.org/officeDocument/2006/relationships";
    private static final String PACKAGE_RELS_NS = "http://schemas.openxmlformats.org/package/2006/relationships";
    private static final String XML_DECLARATION = "<?xml version=\"1.0\" encoding=\"UTF-8\" standalone=\"yes\"?>\n";

    private static final String STYLES_REL_ID = "rId1";
    private static final String FOOTER_REL_ID = "rId2";
    private static final int FIRST_LINK_REL_ID = 3;
    private static final int TITLE_PAGE_SPACER_PARAGRAPHS = 6;

    private final ContentBlockParser blockParser;
    private final CompileProperties properties;
    private final Clock clock;

    @Override
    public boolean supports(ExportFormat format) {
        return format == ExportFormat.DOCX;
    }

    @Override
    public ExportFile render(CompilePayload payload) {
        try {
            CompileSettings settings = payload.settings();
            List<String> links = new ArrayList<>();
            String documentXml = buildDocumentXml(payload, links);

            payload.report(CompileProgress.generating(payload.documents().size()));
            String created = DateTimeFormatter.ISO_INSTANT.format(clock.instant().truncatedTo(ChronoUnit.SECONDS));

            ZipArchiveWriter zip = new ZipArchiveWriter(clock);
            zip.addEntry("[Content_Types].xml", buildContentTypesXml(settings.isIncludePageNumbers()));
            zip.addEntry("_rels/.rels", buildRelsXml());
            zip.addEntry("word/_rels/document.xml.rels", buildDocumentRelsXml(settings.isIncludePageNumbers(), links));
            zip.addEntry("word/document.xml", documentXml);
            zip.addEntry("word/styles.xml", buildStylesXml(settings));
            if (settings.isIncludePageNumbers()) {
                zip.addEntry("word/footer1.xml", buildFooterXml());
            }
            zip.addEntry("docProps/core.xml", buildCorePropertiesXml(payload.title(), payload.author(), created));
            zip.addEntry("docProps/app.xml", buildAppPropertiesXml());
            byte[] bytes = zip.finish();

            log.debug("Rendered DOCX with {} documents and {} links ({} bytes)",
                    payload.documents().size(), links.size(), bytes.length);
            return ExportFile.ofBytes(payload.filename(ExportFormat.DOCX), ExportFormat.DOCX.contentType(), bytes);
        } catch (ZipEncodingException e) {
            throw new ExportRenderingException("Failed to render DOCX export", e);
        }
    }

    private String buildDocumentXml(CompilePayload payload, List<String> links) {
        CompileSettings settings = payload.settings();
        List<CompilableDocument> documents = payload.documents();
        StringBuilder body = new StringBuilder();

        if (settings.isIncludeTitlePage()) {
            for (int i = 0; i < TITLE_PAGE_SPACER_PARAGRAPHS; i++) {
                emptyParagraph(body);
            }
            textParagraph(body, payload.title(), "Title", true);
            if (payload.hasAuthor()) {
                emptyParagraph(body);
                textParagraph(body, "by " + payload.author(), "Subtitle", true);
            }
            if (settings.isIncludeTableOfContents() || !documents.isEmpty()) {
                pageBreak(body);
            }
        }

        if (settings.isIncludeTableOfContents()) {
            textParagraph(body, "Table of Contents", "Heading1", false);
            for (CompilableDocument doc : documents) {
                String indent = "    ".repeat(doc.depth());
                textParagraph(body, indent + doc.title(), "TOC" + Math.min(doc.depth() + 1, 3), false);
            }
            if (!documents.isEmpty()) {
                pageBreak(body);
            }
        }

        for (int index = 0; index < documents.size(); index++) {
            CompilableDocument doc = documents.get(index);
            payload.report(CompileProgress.processing(index + 1, documents.size()));

            if (settings.isIncludeChapterTitles() && !doc.title().isBlank()) {
                textParagraph(body, doc.title(), doc.depth() == 0 ? "Heading1" : "Heading2", false);
            }
            for (ContentBlock block : blockParser.parse(doc.content())) {
                switch (block.kind()) {
                    case HEADING -> richParagraph(body, block.text(), "Heading" + Math.min(block.level() + 1, 3), false, links);
                    case SCENE_BREAK -> textParagraph(body, "* * *", "Normal", true);
                    case PARAGRAPH -> richParagraph(body, block.text(), "Normal", false, links);
                }
            }
            if (index < documents.size() - 1) {
                separator(body, settings.getDocumentSeparator());
            }
        }

        PageMargins margins = settings.getMargins();
        StringBuilder xml = new StringBuilder(XML_DECLARATION);
        xml.append("<w:document xmlns:w=\"").append(W_NS).append("\" xmlns:r=\"").append(R_NS).append("\">");
        xml.append("<w:body>").append(body);
        xml.append("<w:sectPr>");
        if (settings.isIncludePageNumbers()) {
            xml.append("<w:footerReference w:type=\"default\" r:id=\"").append(FOOTER_REL_ID).append("\"/>");
        }
        xml.append("<w:pgSz w:w=\"").append(twips(settings.getPageSize().width()))
                .append("\" w:h=\"").append(twips(settings.getPageSize().height())).append("\"/>");
        xml.append("<w:pgMar w:top=\"").append(twips(margins.top()))
                .append("\" w:right=\"").append(twips(margins.trailing()))
                .append("\" w:bottom=\"").append(twips(margins.bottom()))
                .append("\" w:left=\"").append(twips(margins.leading()))
                .append("\" w:header=\"720\" w:footer=\"720\" w:gutter=\"0\"/>");
        if (settings.isIncludePageNumbers()) {
            xml.append("<w:pgNumType w:start=\"1\"/>");
        }
        xml.append("</w:sectPr></w:body></w:document>");
        return xml.toString();
    }

    private void separator(StringBuilder body, DocumentSeparator separator) {
        switch (separator) {
            case NONE -> {
            }
            case BLANK_LINE -> emptyParagraph(body);
            case THREE_ASTERISKS -> textParagraph(body, "* * *", "Normal", true);
            case PAGE_BREAK, CHAPTER_HEADING -> pageBreak(body);
        }
    }

    private static void paragraphStart(StringBuilder body, String style, boolean centered) {
        body.append("<w:p><w:pPr><w:pStyle w:val=\"").append(style).append("\"/>");
        if (centered) {
            body.append("<w:jc w:val=\"center\"/>");
        }
        body.append("</w:pPr>");
    }

    private static void emptyParagraph(StringBuilder body) {
        paragraphStart(body, "Normal", false);
        body.append("</w:p>");
    }

    private static void textParagraph(StringBuilder body, String text, String style, boolean centered) {
        paragraphStart(body, style, centered);
        run(body, text, TextAttributes.PLAIN);
        body.append("</w:p>");
    }

    private static void richParagraph(StringBuilder body, RichText text, String style, boolean centered,
                                      List<String> links) {
        paragraphStart(body, style, centered);
        for (FormattedRun formattedRun : text.runs()) {
            TextAttributes attributes = formattedRun.attributes();
            if (attributes.link() != null) {
                links.add(attributes.link());
                String relId = "rId" + (FIRST_LINK_REL_ID + links.size() - 1);
                body.append("<w:hyperlink r:id=\"").append(relId).append("\">");
                run(body, formattedRun.text(), attributes);
                body.append("</w:hyperlink>");
            } else {
                run(body, formattedRun.text(), attributes);
            }
        }
        body.append("</w:p>");
    }

    /**
     * Emits one {@code w:r} per line of {@code text}, separated by {@code w:br}.
     * Properties follow the schema order of {@code CT_RPr}.
     */
    private static void run(StringBuilder body, String text, TextAttributes attributes) {
        String[] lines = text.split("\n", -1);
        for (int i = 0; i < lines.length; i++) {
            body.append("<w:r>");
            appendRunProperties(body, attributes);
            if (i > 0) {
                body.append("<w:br/>");
            }
            if (!lines[i].isEmpty()) {
                body.append("<w:t xml:space=\"preserve\">").append(escape(lines[i])).append("</w:t>");
            }
            body.append("</w:r>");
        }
    }

    private static void appendRunProperties(StringBuilder body, TextAttributes attributes) {
        if (attributes.isPlain()) {
            return;
        }
        body.append("<w:rPr>");
        if (attributes.link() != null) {
            body.append("<w:rStyle w:val=\"Hyperlink\"/>");
        }
        if (attributes.bold()) {
            body.append("<w:b/>");
        }
        if (attributes.italic()) {
            body.append("<w:i/>");
        }
        if (attributes.strikethrough()) {
            body.append("<w:strike/>");
        }
        if (attributes.highlight()) {
            body.append("<w:highlight w:val=\"yellow\"/>");
        }
        if (attributes.underline()) {
            body.append("<w:u w:val=\"single\"/>");
        }
        body.append("</w:rPr>");
    }

    private static void pageBreak(StringBuilder body) {
        body.append("<w:p><w:r><w:br w:type=\"page\"/></w:r></w:p>");
    }

    private static int twips(float points) {
        return Math.round(points * 20);
    }

    private static String buildContentTypesXml(boolean withFooter) {
        StringBuilder xml = new StringBuilder(XML_DECLARATION);
        xml.append("<Types xmlns=\"http://schemas.openxmlformats.org/package/2006/content-types\">");
        xml.append("<Default Extension=\"rels\" ContentType=\"application/vnd.openxmlformats-package.relationships+xml\"/>");
        xml.append("<Default Extension=\"xml\" ContentType=\"application/xml\"/>");
        xml.append("<Override PartName=\"/word/document.xml\" ContentType=\"application/vnd.openxmlformats-officedocument.wordprocessingml.document.main+xml\"/>");
        xml.append("<Override PartName=\"/word/styles.xml\" ContentType=\"application/vnd.openxmlformats-officedocument.wordprocessingml.styles+xml\"/>");
        if (withFooter) {
            xml.append("<Override PartName=\"/word/footer1.xml\" ContentType=\"application/vnd.openxmlformats-officedocument.wordprocessingml.footer+xml\"/>");
        }
        xml.append("<Override PartName=\"/docProps/core.xml\" ContentType=\"application/vnd.openxmlformats-package.core-properties+xml\"/>");
        xml.append("<Override PartName=\"/docProps/app.xml\" ContentType=\"application/vnd.openxmlformats-officedocument.extended-properties+xml\"/>");
        xml.append("</Types>");
        return xml.toString();
    }

    private static String buildRelsXml() {
        return XML_DECLARATION
                + "<Relationships xmlns=\"" + PACKAGE_RELS_NS + "\">"
                + "<Relationship Id=\"rId1\" Type=\"" + R_NS + "/officeDocument\" Target=\"word/document.xml\"/>"
                + "<Relationship Id=\"rId2\" Type=\"http://schemas.openxmlformats.org/package/2006/relationships/metadata/core-properties\" Target=\"docProps/core.xml\"/>"
                + "<Relationship Id=\"rId3\" Type=\"" + R_NS + "/extended-properties\" Target=\"docProps/app.xml\"/>"
                + "</Relationships>";
    }

    private static String buildDocumentRelsXml(boolean withFooter, List<String> links) {
        StringBuilder xml = new StringBuilder(XML_DECLARATION);
        xml.append("<Relationships xmlns=\"").append(PACKAGE_RELS_NS).append("\">");
        xml.append("<Relationship Id=\"").append(STYLES_REL_ID).append("\" Type=\"").append(R_NS)
                .append("/styles\" Target=\"styles.xml\"/>");
        if (withFooter) {
            xml.append("<Relationship Id=\"").append(FOOTER_REL_ID).append("\" Type=\"").append(R_NS)
                    .append("/footer\" Target=\"footer1.xml\"/>");
        }
        for (int i = 0; i < links.size(); i++) {
            xml.append("<Relationship Id=\"rId").append(FIRST_LINK_REL_ID + i).append("\" Type=\"").append(R_NS)
                    .append("/hyperlink\" Target=\"").append(escape(links.get(i)))
                    .append("\" TargetMode=\"External\"/>");
        }
        xml.append("</Relationships>");
        return xml.toString();
    }

    private static String buildFooterXml() {
        return XML_DECLARATION
                + "<w:ftr xmlns:w=\"" + W_NS + "\" xmlns:r=\"" + R_NS + "\">"
                + "<w:p><w:pPr><w:jc w:val=\"center\"/></w:pPr>"
                + "<w:r><w:fldChar w:fldCharType=\"begin\"/></w:r>"
                + "<w:r><w:instrText xml:space=\"preserve\"> PAGE </w:instrText></w:r>"
                + "<w:r><w:fldChar w:fldCharType=\"separate\"/></w:r>"
                + "<w:r><w:t>1</w:t></w:r>"
                + "<w:r><w:fldChar w:fldCharType=\"end\"/></w:r>"
                + "</w:p></w:ftr>";
    }

    private static String buildStylesXml(CompileSettings settings) {
        String fontName = escape(settings.getFontStyle().fontName());
        int fontSize = Math.round(settings.getFontSize() * 2);
        int lineSpacing = Math.round(settings.getLineSpacing() * 240);

        StringBuilder xml = new StringBuilder(XML_DECLARATION);
        xml.append("<w:styles xmlns:w=\"").append(W_NS).append("\">");
        xml.append("<w:docDefaults><w:rPrDefault><w:rPr>")
                .append("<w:rFonts w:ascii=\"").append(fontName).append("\" w:hAnsi=\"").append(fontName).append("\"/>")
                .append("<w:sz w:val=\"").append(fontSize).append("\"/>")
                .append("</w:rPr></w:rPrDefault>")
                .append("<w:pPrDefault><w:pPr><w:spacing w:line=\"").append(lineSpacing)
                .append("\" w:lineRule=\"auto\"/></w:pPr></w:pPrDefault></w:docDefaults>");

        xml.append("<w:style w:type=\"paragraph\" w:default=\"1\" w:styleId=\"Normal\"><w:name w:val=\"Normal\"/>")
                .append("<w:pPr><w:spacing w:after=\"200\"/></w:pPr></w:style>");
        xml.append("<w:style w:type=\"paragraph\" w:styleId=\"Title\"><w:name w:val=\"Title\"/><w:basedOn w:val=\"Normal\"/>")
                .append("<w:pPr><w:spacing w:after=\"300\"/><w:jc w:val=\"center\"/></w:pPr>")
                .append("<w:rPr><w:b/><w:sz w:val=\"72\"/></w:rPr></w:style>");
        xml.append("<w:style w:type=\"paragraph\" w:styleId=\"Subtitle\"><w:name w:val=\"Subtitle\"/><w:basedOn w:val=\"Normal\"/>")
                .append("<w:pPr><w:jc w:val=\"center\"/></w:pPr>")
                .append("<w:rPr><w:i/><w:color w:val=\"666666\"/><w:sz w:val=\"36\"/></w:rPr></w:style>");
        headingStyle(xml, 1, 480, 240, fontSize + 12);
        headingStyle(xml, 2, 360, 200, fontSize + 8);
        headingStyle(xml, 3, 240, 120, fontSize + 4);
        tocStyle(xml, 1, 0);
        tocStyle(xml, 2, 240);
        tocStyle(xml, 3, 480);
        xml.append("<w:style w:type=\"character\" w:styleId=\"Hyperlink\"><w:name w:val=\"Hyperlink\"/>")
                .append("<w:rPr><w:color w:val=\"0563C1\"/><w:u w:val=\"single\"/></w:rPr></w:style>");
        xml.append("</w:styles>");
        return xml.toString();
    }

    private static void headingStyle(StringBuilder xml, int level, int before, int after, int size) {
        xml.append("<w:style w:type=\"paragraph\" w:styleId=\"Heading").append(level).append("\">")
                .append("<w:name w:val=\"heading ").append(level).append("\"/><w:basedOn w:val=\"Normal\"/>")
                .append("<w:next w:val=\"Normal\"/>")
                .append("<w:pPr><w:keepNext/><w:spacing w:before=\"").append(before)
                .append("\" w:after=\"").append(after).append("\"/>")
                .append("<w:outlineLvl w:val=\"").append(level - 1).append("\"/></w:pPr>")
                .append("<w:rPr><w:b/><w:sz w:val=\"").append(size).append("\"/></w:rPr></w:style>");
    }

    private static void tocStyle(StringBuilder xml, int level, int indent) {
        xml.append("<w:style w:type=\"paragraph\" w:styleId=\"TOC").append(level).append("\">")
                .append("<w:name w:val=\"toc ").append(level).append("\"/><w:basedOn w:val=\"Normal\"/>");
        if (indent > 0) {
            xml.append("<w:pPr><w:ind w:left=\"").append(indent).append("\"/></w:pPr>");
        }
        xml.append("</w:style>");
    }

    private static String buildCorePropertiesXml(String title, String author, String created) {
        return XML_DECLARATION
                + "<cp:coreProperties xmlns:cp=\"http://schemas.openxmlformats.org/package/2006/metadata/core-properties\""
                + " xmlns:dc=\"http://purl.org/dc/elements/1.1/\""
                + " xmlns:dcterms=\"http://purl.org/dc/terms/\""
                + " xmlns:xsi=\"http://www.w3.org/2001/XMLSchema-instance\">"
                + "<dc:title>" + escape(title) + "</dc:title>"
                + "<dc:creator>" + escape(author) + "</dc:creator>"
                + "<dcterms:created xsi:type=\"dcterms:W3CDTF\">" + created + "</dcterms:created>"
                + "<dcterms:modified xsi:type=\"dcterms:W3CDTF\">" + created + "</dcterms:modified>"
                + "</cp:coreProperties>";
    }

    private String buildAppPropertiesXml() {
        return XML_DECLARATION
                + "<Properties xmlns=\"http://schemas.openxmlformats.org/officeDocument/2006/extended-properties\">"
                + "<Application>" + escape(properties.getAppName()) + "</Application>"
                + "</Properties>";
    }
}
