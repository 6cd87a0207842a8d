package uk.gegc.manuscript.features.conversion;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import uk.gegc.manuscript.features.conversion.application.MimeTypeDetector;

import static org.assertj.core.api.Assertions.assertThat;

class MimeTypeDetectorTest {

    private final MimeTypeDetector detector = new MimeTypeDetector();

    @ParameterizedTest
    @CsvSource({
            "chapter.docx, application/vnd.openxmlformats-officedocument.wordprocessingml.document",
            "OLD.DOC, application/msword",
            "notes.md, text/markdown",
            "notes.markdown, text/markdown",
            "page.htm, text/html",
            "draft.rtf, application/rtf",
            "scan.pdf, application/pdf",
            "readme.txt, text/plain"
    })
    void detectMimeType_knownExtension_returnsMime(String filename, String expected) {
        assertThat(detector.detectMimeType(filename)).isEqualTo(expected);
    }

    @Test
    void detectMimeType_unknownOrMissingExtension_returnsOctetStream() {
        assertThat(detector.detectMimeType("archive.zip")).isEqualTo("application/octet-stream");
        assertThat(detector.detectMimeType("README")).isEqualTo("application/octet-stream");
        assertThat(detector.detectMimeType(".hidden")).isEqualTo("application/octet-stream");
        assertThat(detector.detectMimeType(null)).isEqualTo("application/octet-stream");
    }

    @Test
    void detectMimeType_dotInDirectoryName_usesFileExtensionOnly() {
        assertThat(detector.detectMimeType("my.docs/chapter")).isEqualTo("application/octet-stream");
        assertThat(detector.detectMimeType("my.docs/chapter.pdf")).isEqualTo("application/pdf");
    }

    @Test
    void knownExtensions_sortedForDisplay() {
        assertThat(detector.knownExtensions())
                .containsExactly(".doc", ".docx", ".htm", ".html", ".markdown", ".md", ".pdf", ".rtf", ".txt");
    }
}
