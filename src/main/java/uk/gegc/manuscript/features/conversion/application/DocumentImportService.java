package uk.gegc.manuscript.features.conversion.application;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import uk.gegc.manuscript.features.conversion.config.DocumentImportProperties;
import uk.gegc.manuscript.features.conversion.domain.ConversionException;
import uk.gegc.manuscript.features.conversion.domain.ConversionResult;
import uk.gegc.manuscript.features.conversion.domain.DocumentConverter;
import uk.gegc.manuscript.features.conversion.domain.DocumentImportOptions;
import uk.gegc.manuscript.features.conversion.domain.DocumentImportResult;
import uk.gegc.manuscript.features.conversion.domain.DocumentValidationResult;
import uk.gegc.manuscript.features.conversion.domain.UnsupportedFormatException;
import uk.gegc.manuscript.features.project.domain.model.Document;
import uk.gegc.manuscript.shared.dto.ImportWarning;
import uk.gegc.manuscript.shared.progress.ProgressListener;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Imports one DOCX, DOC, HTML, PDF, RTF, Markdown or text file as a new document.
 * Delegates the format work to the first {@link DocumentConverter} that supports the filename,
 * falling back to its detected MIME type.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class DocumentImportService {

    static final String IMPORTED_ICON = "doc.text.fill";

    private final List<DocumentConverter> converters;
    private final MimeTypeDetector mimeTypeDetector;
    private final DocumentImportProperties properties;
    private final Clock clock;

    /**
     * Checks name and size without reading the content.
     */
    public DocumentValidationResult validate(String filename, long size) {
        String title = titleFromFilename(filename);
        List<String> warnings = new ArrayList<>();
        List<String> errors = new ArrayList<>();

        if (findConverter(filename).isEmpty()) {
            errors.add("File is not a supported document (" + String.join(", ", mimeTypeDetector.knownExtensions()) + ")");
            return new DocumentValidationResult(false, title, size, warnings, errors);
        }
        if (size == 0) {
            errors.add("File is empty");
        } else if (size > properties.getMaxFileSizeBytes()) {
            errors.add("File is too large (" + size / 1_000_000 + " MB); the limit is "
                    + properties.getMaxFileSizeBytes() / 1_000_000 + " MB");
        } else if (size > properties.getLargeFileWarningBytes()) {
            warnings.add("Large file (" + size / 1_000_000 + " MB) - import may take a while");
        }
        if (".doc".equals(MimeTypeDetector.extensionOf(filename))) {
            warnings.add("Older .doc format may have limited formatting support");
        }
        return new DocumentValidationResult(errors.isEmpty(), title, size, warnings, errors);
    }

    public DocumentImportResult importFile(Path file, DocumentImportOptions options, ProgressListener listener)
            throws ConversionException {
        byte[] bytes;
        try {
            bytes = Files.readAllBytes(file);
        } catch (IOException e) {
            throw new ConversionException("Could not read file: " + file, e);
        }
        return importDocument(file.getFileName().toString(), bytes, options, listener);
    }

    /**
     * Converts {@code bytes} and wraps the result in a new document titled after the filename.
     *
     * @throws UnsupportedFormatException if no converter handles the file
     * @throws ConversionException        if the file is empty, too large or unreadable as its format
     */
    public DocumentImportResult importDocument(String filename, byte[] bytes, DocumentImportOptions options,
                                               ProgressListener listener) throws ConversionException {
        ProgressListener progress = ProgressListener.nullSafe(listener);
        DocumentImportOptions effective = options != null ? options : DocumentImportOptions.defaults();
        String title = titleFromFilename(filename);

        progress.onProgress(0.1, "Reading document...");
        if (bytes == null || bytes.length == 0) {
            throw new ConversionException("File is empty: " + filename);
        }
        if (bytes.length > properties.getMaxFileSizeBytes()) {
            throw new ConversionException("File is too large to import: " + filename);
        }
        DocumentConverter converter = findConverter(filename)
                .orElseThrow(() -> new UnsupportedFormatException("No suitable converter found for: " + filename));
        log.debug("Importing {} ({} bytes) with {}", filename, bytes.length, converter.getClass().getSimpleName());

        progress.onProgress(0.3, "Converting content...");
        ConversionResult result = converter.convert(bytes, effective);

        progress.onProgress(0.6, "Extracting text...");
        List<ImportWarning> warnings = result.warnings().stream()
                .map(warning -> new ImportWarning(warning.message(), title, warning.severity()))
                .toList();

        progress.onProgress(0.9, "Creating document...");
        Document document = Document.builder()
                .title(title)
                .content(result.text())
                .creationDate(clock.instant())
                .iconName(IMPORTED_ICON)
                .build();

        progress.onProgress(1.0, "Import complete!");
        log.info("Imported '{}' ({} characters, {} warnings)", title, result.text().length(), warnings.size());
        return new DocumentImportResult(document, title, warnings);
    }

    public boolean isSupported(String filenameOrMime) {
        return findConverter(filenameOrMime).isPresent();
    }

    private Optional<DocumentConverter> findConverter(String filename) {
        Optional<DocumentConverter> byName = firstSupporting(filename);
        if (byName.isPresent() || !mimeTypeDetector.isKnownExtension(filename)) {
            return byName;
        }
        return firstSupporting(mimeTypeDetector.detectMimeType(filename));
    }

    private Optional<DocumentConverter> firstSupporting(String filenameOrMime) {
        return converters.stream()
                .filter(converter -> converter.supports(filenameOrMime))
                .findFirst();
    }

    /**
     * Last path segment without its final extension; "Untitled" when nothing is left.
     */
    static String titleFromFilename(String filename) {
        if (filename == null || filename.isBlank()) {
            return "Untitled";
        }
        String name = filename.substring(Math.max(filename.lastIndexOf('/'), filename.lastIndexOf('\\')) + 1);
        int dot = name.lastIndexOf('.');
        String title = dot > 0 ? name.substring(0, dot) : name;
        return title.isBlank() ? "Untitled" : title.strip();
    }
}
