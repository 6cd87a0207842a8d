package uk.gegc.manuscript.features.conversion;

import org.apache.poi.xwpf.usermodel.UnderlinePatterns;
import org.apache.poi.xwpf.usermodel.XWPFDocument;
import org.apache.poi.xwpf.usermodel.XWPFHyperlinkRun;
import org.apache.poi.xwpf.usermodel.XWPFParagraph;
import org.apache.poi.xwpf.usermodel.XWPFRun;
import org.apache.poi.xwpf.usermodel.XWPFTable;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import uk.gegc.manuscript.features.compile.application.ContentBlockParser;
import uk.gegc.manuscript.features.compile.application.impl.DocxExportRenderer;
import uk.gegc.manuscript.features.compile.config.CompileProperties;
import uk.gegc.manuscript.features.compile.domain.CompilableDocument;
import uk.gegc.manuscript.features.compile.domain.CompilePayload;
import uk.gegc.manuscript.features.compile.domain.CompileSettings;
import uk.gegc.manuscript.features.conversion.domain.ConversionException;
import uk.gegc.manuscript.features.conversion.domain.ConversionResult;
import uk.gegc.manuscript.features.conversion.domain.DocumentImportOptions;
import uk.gegc.manuscript.features.conversion.infra.DocxDocumentConverter;
import uk.gegc.manuscript.shared.progress.ProgressListener;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class DocxDocumentConverterTest {

    private DocxDocumentConverter converter;

    @BeforeEach
    void setUp() {
        converter = new DocxDocumentConverter(ConversionTestSupport.bridge());
    }

    @Test
    void supports_acceptsDocxExtAndMime() {
        assertThat(converter.supports("Chapter.DOCX")).isTrue();
        assertThat(converter.supports("application/vnd.openxmlformats-officedocument.wordprocessingml.document")).isTrue();
        assertThat(converter.supports("old.doc")).isFalse();
        assertThat(converter.supports(null)).isFalse();
    }

    @Test
    void convert_formattedRuns_becomeMarkdown() throws Exception {
        // Given
        byte[] bytes = docx(document -> {
            XWPFParagraph heading = document.createParagraph();
            heading.setStyle("Heading1");
            heading.createRun().setText("The Storm");

            XWPFParagraph body = document.createParagraph();
            body.createRun().setText("It was ");
            XWPFRun bold = body.createRun();
            bold.setBold(true);
            bold.setText("dark");
            body.createRun().setText(" and ");
            XWPFRun italic = body.createRun();
            italic.setItalic(true);
            italic.setText("stormy");
            body.createRun().setText(".");

            XWPFParagraph styled = document.createParagraph();
            XWPFRun strike = styled.createRun();
            strike.setStrikeThrough(true);
            strike.setText("gone");
            styled.createRun().setText(" ");
            XWPFRun underline = styled.createRun();
            underline.setUnderline(UnderlinePatterns.SINGLE);
            underline.setText("marked");
        });

        // When
        ConversionResult result = converter.convert(bytes, DocumentImportOptions.defaults());

        // Then
        assertThat(result.text()).isEqualTo("# The Storm\n\nIt was **dark** and *stormy*.\n\n~~gone~~ <u>marked</u>");
        assertThat(result.warnings()).isEmpty();
    }

    @Test
    void convert_hyperlinkRun_becomesMarkdownLink() throws Exception {
        // Given
        byte[] bytes = docx(document -> {
            XWPFParagraph paragraph = document.createParagraph();
            paragraph.createRun().setText("See ");
            XWPFHyperlinkRun link = paragraph.createHyperlinkRun("https://example.com/map");
            link.setText("the map");
        });

        // When
        ConversionResult result = converter.convert(bytes, DocumentImportOptions.defaults());

        // Then
        assertThat(result.text()).isEqualTo("See [the map](https://example.com/map)");
    }

    @Test
    void convert_withoutFormatting_returnsPlainParagraphs() throws Exception {
        // Given
        byte[] bytes = docx(document -> {
            XWPFParagraph first = document.createParagraph();
            XWPFRun bold = first.createRun();
            bold.setBold(true);
            bold.setText("Loud");
            document.createParagraph();
            document.createParagraph().createRun().setText("Quiet");
        });
        DocumentImportOptions options = DocumentImportOptions.builder().preserveFormatting(false).build();

        // When
        ConversionResult result = converter.convert(bytes, options);

        // Then
        assertThat(result.text()).isEqualTo("Loud\n\nQuiet");
    }

    @Test
    void convert_table_flattensCellsAndWarns() throws Exception {
        // Given
        byte[] bytes = docx(document -> {
            document.createParagraph().createRun().setText("Before");
            XWPFTable table = document.createTable(1, 2);
            table.getRow(0).getCell(0).setText("Left");
            table.getRow(0).getCell(1).setText("Right");
        });

        // When
        ConversionResult result = converter.convert(bytes, DocumentImportOptions.defaults());

        // Then
        assertThat(result.text()).isEqualTo("Before\n\nLeft\n\nRight");
        assertThat(result.warnings()).singleElement()
                .satisfies(warning -> assertThat(warning.message()).contains("Tables"));
    }

    @Test
    void convert_exportedManuscript_readsBackHeadingsAndInlineStyles() throws Exception {
        // Given
        Clock clock = Clock.fixed(Instant.parse("2024-05-01T12:00:00Z"), ZoneOffset.UTC);
        DocxExportRenderer renderer = new DocxExportRenderer(new ContentBlockParser(ConversionTestSupport.bridge()),
                new CompileProperties(), clock);
        CompileSettings settings = CompileSettings.builder().includeTitlePage(false).build();
        CompilePayload payload = new CompilePayload(
                List.of(new CompilableDocument(UUID.randomUUID(), "Opening", "It was a **bold** start.", 0, 0, "Draft")),
                "Book", "", settings, "book", ProgressListener.NONE);
        byte[] exported = renderer.render(payload).readAllBytes();

        // When
        ConversionResult result = converter.convert(exported, DocumentImportOptions.defaults());

        // Then
        assertThat(result.text()).isEqualTo("# Opening\n\nIt was a **bold** start.");
    }

    @Test
    void convert_notAZip_throwsConversionException() {
        assertThatThrownBy(() -> converter.convert("plain text".getBytes(), DocumentImportOptions.defaults()))
                .isInstanceOf(ConversionException.class)
                .hasMessageContaining("Failed to convert DOCX document");
    }

    private interface DocumentBuilder {
        void build(XWPFDocument document);
    }

    private static byte[] docx(DocumentBuilder builder) throws IOException {
        try (XWPFDocument document = new XWPFDocument(); ByteArrayOutputStream out = new ByteArrayOutputStream()) {
            builder.build(document);
            document.write(out);
            return out.toByteArray();
        }
    }
}
