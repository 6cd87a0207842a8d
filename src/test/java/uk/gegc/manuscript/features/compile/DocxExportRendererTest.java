package uk.gegc.manuscript.features.compile;

import org.apache.poi.xwpf.usermodel.XWPFDocument;
import org.apache.poi.xwpf.usermodel.XWPFHyperlinkRun;
import org.apache.poi.xwpf.usermodel.XWPFParagraph;
import org.apache.poi.xwpf.usermodel.XWPFRun;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import uk.gegc.manuscript.features.compile.application.impl.DocxExportRenderer;
import uk.gegc.manuscript.features.compile.config.CompileProperties;
import uk.gegc.manuscript.features.compile.domain.CompilePayload;
import uk.gegc.manuscript.features.compile.domain.CompileSettings;
import uk.gegc.manuscript.features.compile.domain.DocumentSeparator;
import uk.gegc.manuscript.features.compile.domain.ExportFile;
import uk.gegc.manuscript.features.compile.domain.ExportFormat;
import uk.gegc.manuscript.features.compile.domain.PageSize;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.zip.ZipEntry;
import java.util.zip.ZipInputStream;

import static org.assertj.core.api.Assertions.assertThat;

class DocxExportRendererTest {

    private DocxExportRenderer renderer;

    @BeforeEach
    void setUp() {
        renderer = new DocxExportRenderer(CompileTestSupport.blockParser(), new CompileProperties(),
                CompileTestSupport.CLOCK);
    }

    @Test
    void supports_docxOnly() {
        assertThat(renderer.supports(ExportFormat.DOCX)).isTrue();
        assertThat(renderer.supports(ExportFormat.EPUB)).isFalse();
    }

    @Test
    void render_defaultSettings_containsAllRequiredParts() throws IOException {
        // When
        ExportFile file = renderer.render(CompileTestSupport.samplePayload(CompileSettings.defaults()));

        // Then
        assertThat(file.filename()).isEqualTo("the-long-road.docx");
        assertThat(file.contentType()).isEqualTo(ExportFormat.DOCX.contentType());
        assertThat(entryNames(file.readAllBytes())).containsExactly(
                "[Content_Types].xml",
                "_rels/.rels",
                "word/_rels/document.xml.rels",
                "word/document.xml",
                "word/styles.xml",
                "word/footer1.xml",
                "docProps/core.xml",
                "docProps/app.xml");
    }

    @Test
    void render_withoutPageNumbers_omitsFooterPart() throws IOException {
        // Given
        CompileSettings settings = CompileSettings.builder().includePageNumbers(false).build();

        // When
        ExportFile file = renderer.render(CompileTestSupport.samplePayload(settings));

        // Then
        assertThat(entryNames(file.readAllBytes())).doesNotContain("word/footer1.xml");
    }

    @Test
    void render_opensInPoiWithTitleHeadingsAndBody() throws IOException {
        // When
        ExportFile file = renderer.render(CompileTestSupport.samplePayload(CompileSettings.defaults()));

        // Then
        try (XWPFDocument document = new XWPFDocument(new ByteArrayInputStream(file.readAllBytes()))) {
            List<XWPFParagraph> paragraphs = document.getParagraphs();
            assertThat(paragraphs).anySatisfy(p -> {
                assertThat(p.getStyle()).isEqualTo("Title");
                assertThat(p.getText()).isEqualTo("The Long Road");
            });
            assertThat(paragraphs).anySatisfy(p -> {
                assertThat(p.getStyle()).isEqualTo("Subtitle");
                assertThat(p.getText()).isEqualTo("by Ann Writer");
            });
            assertThat(paragraphs).anySatisfy(p -> {
                assertThat(p.getStyle()).isEqualTo("Heading1");
                assertThat(p.getText()).isEqualTo("Opening");
            });
            assertThat(paragraphs).anySatisfy(p -> {
                assertThat(p.getStyle()).isEqualTo("Heading2");
                assertThat(p.getText()).isEqualTo("Arrival");
            });
            assertThat(paragraphs).extracting(XWPFParagraph::getText).contains("The second paragraph.");
            assertThat(document.getProperties().getCoreProperties().getTitle()).isEqualTo("The Long Road");
            assertThat(document.getProperties().getCoreProperties().getCreator()).isEqualTo("Ann Writer");
        }
    }

    @Test
    void render_inlineFormatting_becomesRunProperties() throws IOException {
        // When
        ExportFile file = renderer.render(CompileTestSupport.samplePayload(CompileSettings.defaults()));

        // Then
        try (XWPFDocument document = new XWPFDocument(new ByteArrayInputStream(file.readAllBytes()))) {
            List<XWPFRun> runs = new ArrayList<>();
            document.getParagraphs().forEach(p -> runs.addAll(p.getRuns()));

            XWPFRun bold = runs.stream().filter(r -> "bold".equals(r.text())).findFirst().orElseThrow();
            assertThat(bold.isBold()).isTrue();
            XWPFRun italic = runs.stream().filter(r -> "late".equals(r.text())).findFirst().orElseThrow();
            assertThat(italic.isItalic()).isTrue();

            XWPFHyperlinkRun link = runs.stream()
                    .filter(XWPFHyperlinkRun.class::isInstance)
                    .map(XWPFHyperlinkRun.class::cast)
                    .findFirst().orElseThrow();
            assertThat(link.text()).isEqualTo("the map");
            assertThat(link.getHyperlink(document).getURL()).isEqualTo("https://example.com/map");
        }
    }

    @Test
    void render_a4Page_setsPageSizeInTwips() throws IOException {
        // Given
        CompileSettings settings = CompileSettings.builder().pageSize(PageSize.A4).build();

        // When
        ExportFile file = renderer.render(CompileTestSupport.samplePayload(settings));

        // Then
        String documentXml = entryText(file.readAllBytes(), "word/document.xml");
        assertThat(documentXml).contains("<w:pgSz w:w=\"11900\" w:h=\"16840\"/>");
        assertThat(documentXml).contains("<w:footerReference w:type=\"default\" r:id=\"rId2\"/>");
    }

    @Test
    void render_threeAsterisksSeparator_addsCenteredSeparatorParagraphs() throws IOException {
        // Given
        CompileSettings settings = CompileSettings.builder()
                .documentSeparator(DocumentSeparator.THREE_ASTERISKS)
                .includeTitlePage(false)
                .build();

        // When
        ExportFile file = renderer.render(CompileTestSupport.samplePayload(settings));

        // Then
        try (XWPFDocument document = new XWPFDocument(new ByteArrayInputStream(file.readAllBytes()))) {
            long separators = document.getParagraphs().stream()
                    .filter(p -> "* * *".equals(p.getText()))
                    .count();
            assertThat(separators).isEqualTo(2);
            assertThat(document.getParagraphs()).noneMatch(p -> "Title".equals(p.getStyle()));
        }
    }

    @Test
    void render_tableOfContents_listsEveryDocument() throws IOException {
        // Given
        CompileSettings settings = CompileSettings.builder().includeTableOfContents(true).build();

        // When
        ExportFile file = renderer.render(CompileTestSupport.samplePayload(settings));

        // Then
        try (XWPFDocument document = new XWPFDocument(new ByteArrayInputStream(file.readAllBytes()))) {
            assertThat(document.getParagraphs())
                    .filteredOn(p -> p.getStyle() != null && p.getStyle().startsWith("TOC"))
                    .extracting(XWPFParagraph::getText)
                    .containsExactly("Opening", "    Arrival", "    Departure");
        }
    }

    @Test
    void render_specialCharactersInTitle_areEscaped() throws IOException {
        // Given
        CompilePayload payload = new CompilePayload(
                CompileTestSupport.sampleDocuments(), "Salt & <Pepper>", "", CompileSettings.defaults(),
                "salt-pepper", null);

        // When
        ExportFile file = renderer.render(payload);

        // Then
        try (XWPFDocument document = new XWPFDocument(new ByteArrayInputStream(file.readAllBytes()))) {
            assertThat(document.getParagraphs()).extracting(XWPFParagraph::getText).contains("Salt & <Pepper>");
            assertThat(document.getParagraphs()).noneMatch(p -> "Subtitle".equals(p.getStyle()));
        }
    }

    static String entryText(byte[] zip, String name) throws IOException {
        try (ZipInputStream in = new ZipInputStream(new ByteArrayInputStream(zip))) {
            ZipEntry entry;
            while ((entry = in.getNextEntry()) != null) {
                if (entry.getName().equals(name)) {
                    return new String(in.readAllBytes(), StandardCharsets.UTF_8);
                }
            }
        }
        throw new AssertionError("Missing zip entry " + name);
    }

    static List<String> entryNames(byte[] zip) throws IOException {
        List<String> names = new ArrayList<>();
        try (ZipInputStream in = new ZipInputStream(new ByteArrayInputStream(zip))) {
            ZipEntry entry;
            while ((entry = in.getNextEntry()) != null) {
                names.add(entry.getName());
            }
        }
        return names;
    }
}
