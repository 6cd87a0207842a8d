package uk.gegc.manuscript.features.conversion.application;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Lightweight MIME type detector based on file extensions.
 * Used to fall back to MIME matching when no converter claims a filename.
 */
@Component
@Slf4j
public class MimeTypeDetector {

    private static final Map<String, String> EXTENSION_TO_MIME = Map.of(
        ".txt", "text/plain",
        ".md", "text/markdown",
        ".markdown", "text/markdown",
        ".pdf", "application/pdf",
        ".html", "text/html",
        ".htm", "text/html",
        ".rtf", "application/rtf",
        ".docx", "application/vnd.openxmlformats-officedocument.wordprocessingml.document",
        ".doc", "application/msword"
    );

    static final String DEFAULT_MIME_TYPE = "application/octet-stream";

    /**
     * Detects MIME type based on filename extension.
     *
     * @param filename the filename to analyze
     * @return the detected MIME type or default if unknown
     */
    public String detectMimeType(String filename) {
        String extension = extensionOf(filename);
        String mimeType = EXTENSION_TO_MIME.get(extension);
        if (mimeType == null) {
            log.debug("Unknown file extension for {}, using default MIME type: {}", filename, DEFAULT_MIME_TYPE);
            return DEFAULT_MIME_TYPE;
        }
        log.debug("Detected MIME type for {}: {}", filename, mimeType);
        return mimeType;
    }

    public boolean isKnownExtension(String filename) {
        return EXTENSION_TO_MIME.containsKey(extensionOf(filename));
    }

    /**
     * Known extensions, dot included, sorted for display.
     */
    public List<String> knownExtensions() {
        return EXTENSION_TO_MIME.keySet().stream().sorted().toList();
    }

    /**
     * Lowercase extension including the dot, or an empty string when there is none.
     */
    static String extensionOf(String filename) {
        if (filename == null || filename.isEmpty()) {
            return "";
        }
        String name = filename.substring(Math.max(filename.lastIndexOf('/'), filename.lastIndexOf('\\')) + 1);
        int dot = name.lastIndexOf('.');
        return dot <= 0 ? "" : name.substring(dot).toLowerCase(Locale.ROOT);
    }
}
