package uk.gegc.manuscript.features.conversion;

import org.junit.jupiter.api.Test;
import uk.gegc.manuscript.features.conversion.domain.ConversionException;
import uk.gegc.manuscript.features.conversion.domain.DocumentImportOptions;
import uk.gegc.manuscript.features.conversion.infra.LegacyWordDocumentConverter;

import java.nio.charset.StandardCharsets;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class LegacyWordDocumentConverterTest {

    private final LegacyWordDocumentConverter converter = new LegacyWordDocumentConverter();

    @Test
    void supports_docAndMswordMime() {
        assertThat(converter.supports("old.DOC")).isTrue();
        assertThat(converter.supports("application/msword")).isTrue();
        assertThat(converter.supports("new.docx")).isFalse();
        assertThat(converter.supports(null)).isFalse();
    }

    @Test
    void convert_notAnOle2File_throwsConversionException() {
        // Given
        byte[] bytes = "plain text pretending to be a Word file".getBytes(StandardCharsets.UTF_8);

        // When / Then
        assertThatThrownBy(() -> converter.convert(bytes, DocumentImportOptions.defaults()))
                .isInstanceOf(ConversionException.class)
                .hasMessageStartingWith("Failed to convert DOC document");
    }
}
