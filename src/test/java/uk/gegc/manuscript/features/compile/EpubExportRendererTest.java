package uk.gegc.manuscript.features.compile;

import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.jsoup.parser.Parser;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import uk.gegc.manuscript.features.compile.application.impl.EpubExportRenderer;
import uk.gegc.manuscript.features.compile.config.CompileProperties;
import uk.gegc.manuscript.features.compile.domain.CompilePayload;
import uk.gegc.manuscript.features.compile.domain.CompileSettings;
import uk.gegc.manuscript.features.compile.domain.ExportFile;
import uk.gegc.manuscript.features.compile.domain.ExportFormat;
import uk.gegc.manuscript.shared.progress.ProgressListener;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.zip.ZipEntry;
import java.util.zip.ZipInputStream;

import static org.assertj.core.api.Assertions.assertThat;

class EpubExportRendererTest {

    private EpubExportRenderer renderer;

    @BeforeEach
    void setUp() {
        CompileProperties properties = new CompileProperties();
        properties.setLanguage("en-GB");
        renderer = new EpubExportRenderer(CompileTestSupport.blockParser(), properties, CompileTestSupport.CLOCK);
    }

    @Test
    @DisplayName("mimetype is the first entry, stored without compression")
    void render_mimetypeEntry_isFirstAndStored() throws IOException {
        // When
        ExportFile file = renderer.render(CompileTestSupport.samplePayload(CompileSettings.defaults()));

        // Then
        try (ZipInputStream in = new ZipInputStream(new ByteArrayInputStream(file.readAllBytes()))) {
            ZipEntry first = in.getNextEntry();
            assertThat(first).isNotNull();
            assertThat(first.getName()).isEqualTo("mimetype");
            assertThat(first.getMethod()).isEqualTo(ZipEntry.STORED);
            assertThat(new String(in.readAllBytes(), StandardCharsets.US_ASCII)).isEqualTo("application/epub+zip");
        }
    }

    @Test
    void render_titlePageAndContents_listsAllParts() throws IOException {
        // Given
        CompileSettings settings = CompileSettings.builder().includeTableOfContents(true).build();

        // When
        ExportFile file = renderer.render(CompileTestSupport.samplePayload(settings));

        // Then
        assertThat(file.filename()).isEqualTo("the-long-road.epub");
        assertThat(file.contentType()).isEqualTo("application/epub+zip");
        List<String> names = DocxExportRendererTest.entryNames(file.readAllBytes());
        assertThat(names).containsExactly(
                "mimetype",
                "META-INF/container.xml",
                "OEBPS/content.opf",
                "OEBPS/toc.ncx",
                "OEBPS/nav.xhtml",
                "OEBPS/styles.css",
                "OEBPS/title.xhtml",
                "OEBPS/toc-page.xhtml",
                "OEBPS/chapter-001.xhtml",
                "OEBPS/chapter-002.xhtml",
                "OEBPS/chapter-003.xhtml");
    }

    @Test
    void render_withoutTitlePage_startsSpineAtFirstChapter() throws IOException {
        // Given
        CompileSettings settings = CompileSettings.builder().includeTitlePage(false).build();

        // When
        ExportFile file = renderer.render(CompileTestSupport.samplePayload(settings));

        // Then
        byte[] bytes = file.readAllBytes();
        assertThat(DocxExportRendererTest.entryNames(bytes)).doesNotContain("OEBPS/title.xhtml");
        Document opf = Jsoup.parse(DocxExportRendererTest.entryText(bytes, "OEBPS/content.opf"), "", Parser.xmlParser());
        assertThat(opf.select("spine > itemref").first().attr("idref")).isEqualTo("chapter-0");
        assertThat(opf.select("manifest > item[id=chapter-0]").attr("href")).isEqualTo("chapter-001.xhtml");
    }

    @Test
    void render_chapterBody_carriesInlineFormattingAndHeadings() throws IOException {
        // When
        ExportFile file = renderer.render(CompileTestSupport.samplePayload(CompileSettings.defaults()));

        // Then
        byte[] bytes = file.readAllBytes();
        String opening = DocxExportRendererTest.entryText(bytes, "OEBPS/chapter-001.xhtml");
        assertThat(opening).contains("<h1>Opening</h1>");
        assertThat(opening).contains("<p class=\"first\">It was a <strong>bold</strong> start.</p>");
        assertThat(opening).contains("<p>The second paragraph.</p>");

        String arrival = DocxExportRendererTest.entryText(bytes, "OEBPS/chapter-002.xhtml");
        assertThat(arrival).contains("<h2>Arrival</h2>");
        assertThat(arrival).contains("<em>late</em>");

        String departure = DocxExportRendererTest.entryText(bytes, "OEBPS/chapter-003.xhtml");
        assertThat(departure).contains("<a href=\"https://example.com/map\">the map</a>");
    }

    @Test
    void render_metadata_escapesTitleAndUsesConfiguredLanguage() throws IOException {
        // Given
        CompilePayload payload = new CompilePayload(CompileTestSupport.sampleDocuments(), "Salt & <Pepper>",
                "Ann Writer", CompileSettings.defaults(), "salt-pepper", ProgressListener.NONE);

        // When
        ExportFile file = renderer.render(payload);

        // Then
        String opf = DocxExportRendererTest.entryText(file.readAllBytes(), "OEBPS/content.opf");
        assertThat(opf).contains("<dc:title>Salt &amp; &lt;Pepper&gt;</dc:title>");
        assertThat(opf).contains("<dc:creator>Ann Writer</dc:creator>");
        assertThat(opf).contains("<dc:language>en-GB</dc:language>");
        assertThat(opf).contains("<meta property=\"dcterms:modified\">2024-05-01T12:00:00Z</meta>");
    }

    @Test
    void render_sceneBreakAndMultilineParagraph_renderAsSeparatorAndLineBreaks() throws IOException {
        // Given
        CompilePayload payload = CompileTestSupport.payload(CompileSettings.defaults(),
                CompileTestSupport.doc("Scenes", "First line\nsecond line\n\n***\n\nAfter the break.", 0));

        // When
        ExportFile file = renderer.render(payload);

        // Then
        String chapter = DocxExportRendererTest.entryText(file.readAllBytes(), "OEBPS/chapter-001.xhtml");
        assertThat(chapter).contains("<p class=\"first\">First line<br/>second line</p>");
        assertThat(chapter).contains("<p class=\"separator\">* * *</p>");
        assertThat(chapter).contains("<p class=\"first\">After the break.</p>");
    }

    @Test
    void render_stylesheet_reflectsFontSettings() throws IOException {
        // Given
        CompileSettings settings = CompileSettings.builder().fontSize(14f).lineSpacing(2f).build();

        // When
        ExportFile file = renderer.render(CompileTestSupport.samplePayload(settings));

        // Then
        String css = DocxExportRendererTest.entryText(file.readAllBytes(), "OEBPS/styles.css");
        assertThat(css).contains("font-family: " + settings.getFontStyle().cssFontFamily() + ";");
        assertThat(css).contains("font-size: 14pt;");
        assertThat(css).contains("line-height: 2;");
    }

    @Test
    void supports_epubOnly() {
        assertThat(renderer.supports(ExportFormat.EPUB)).isTrue();
        assertThat(renderer.supports(ExportFormat.PDF)).isFalse();
    }
}
