package uk.gegc.manuscript.features.conversion;

import org.junit.jupiter.api.Test;
import uk.gegc.manuscript.features.conversion.domain.ConversionResult;
import uk.gegc.manuscript.features.conversion.domain.DocumentImportOptions;
import uk.gegc.manuscript.features.conversion.infra.MarkdownDocumentConverter;
import uk.gegc.manuscript.features.conversion.infra.RtfDocumentConverter;
import uk.gegc.manuscript.features.conversion.infra.TxtPassthroughConverter;
import uk.gegc.manuscript.features.richtext.application.RichTextMarkdownBridge;
import uk.gegc.manuscript.shared.dto.WarningSeverity;

import java.nio.charset.StandardCharsets;

import static org.assertj.core.api.Assertions.assertThat;

class TextDocumentConvertersTest {

    private static final DocumentImportOptions PRESERVE = DocumentImportOptions.defaults();
    private static final DocumentImportOptions FLATTEN = DocumentImportOptions.defaults().toBuilder()
            .preserveFormatting(false)
            .build();

    private final RichTextMarkdownBridge bridge = ConversionTestSupport.bridge();

    @Test
    void txt_byteOrderMarkAndCrLf_areNormalized() {
        // Given
        byte[] bytes = "\uFEFFFirst line\r\nSecond line\rThird".getBytes(StandardCharsets.UTF_8);

        // When
        ConversionResult result = new TxtPassthroughConverter().convert(bytes, PRESERVE);

        // Then
        assertThat(result.text()).isEqualTo("First line\nSecond line\nThird");
        assertThat(result.warnings()).isEmpty();
    }

    @Test
    void txt_supports_matchesExtensionAndMime() {
        TxtPassthroughConverter converter = new TxtPassthroughConverter();

        assertThat(converter.supports("notes.TXT")).isTrue();
        assertThat(converter.supports("text/plain")).isTrue();
        assertThat(converter.supports("notes.md")).isFalse();
    }

    @Test
    void markdown_preserveFormatting_keepsSourceWithInfo() {
        // Given
        String source = "# Title\n\nSome **bold** text.";

        // When
        ConversionResult result = new MarkdownDocumentConverter(bridge)
                .convert(source.getBytes(StandardCharsets.UTF_8), PRESERVE);

        // Then
        assertThat(result.text()).isEqualTo(source);
        assertThat(result.warnings()).singleElement().satisfies(warning -> {
            assertThat(warning.severity()).isEqualTo(WarningSeverity.INFO);
            assertThat(warning.message()).contains("Markdown syntax is preserved");
        });
    }

    @Test
    void markdown_flatten_stripsMarkup() {
        // Given
        String source = "# Title\n\nSome **bold** text.";

        // When
        ConversionResult result = new MarkdownDocumentConverter(bridge)
                .convert(source.getBytes(StandardCharsets.UTF_8), FLATTEN);

        // Then
        assertThat(result.text()).isEqualTo("Title\n\nSome bold text.");
        assertThat(result.warnings()).isEmpty();
    }

    @Test
    void rtf_writtenByBridge_readsBackAsMarkdown() {
        // Given
        byte[] rtf = bridge.markdownToRtfBytes("Some **bold** and *italic* words.");

        // When
        ConversionResult result = new RtfDocumentConverter(bridge).convert(rtf, PRESERVE);

        // Then
        assertThat(result.text()).isEqualTo("Some **bold** and *italic* words.");
        assertThat(result.warnings()).isEmpty();
    }

    @Test
    void rtf_flatten_returnsPlainText() {
        // Given
        byte[] rtf = bridge.markdownToRtfBytes("Some **bold** words.");

        // When
        ConversionResult result = new RtfDocumentConverter(bridge).convert(rtf, FLATTEN);

        // Then
        assertThat(result.text()).isEqualTo("Some bold words.");
    }

    @Test
    void rtf_notRtf_fallsBackToTextWithWarning() {
        // Given
        byte[] bytes = "Just words".getBytes(StandardCharsets.UTF_8);

        // When
        ConversionResult result = new RtfDocumentConverter(bridge).convert(bytes, PRESERVE);

        // Then
        assertThat(result.text()).isEqualTo("Just words");
        assertThat(result.warnings()).singleElement().satisfies(warning -> {
            assertThat(warning.severity()).isEqualTo(WarningSeverity.WARNING);
            assertThat(warning.message()).startsWith("RTF formatting could not be read");
        });
    }
}
