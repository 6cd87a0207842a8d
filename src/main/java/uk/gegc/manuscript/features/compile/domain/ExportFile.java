package uk.gegc.manuscript.features.compile.domain;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.util.function.Supplier;

/**
 * A compiled file ready to be saved or sent somewhere.
 * Content is supplied lazily so callers can stream it.
 */
public record ExportFile(
    String filename,
    String contentType,
    Supplier<InputStream> contentSupplier,
    long contentLength
) {
    public ExportFile {
        if (filename == null || filename.isBlank()) {
            throw new IllegalArgumentException("Filename cannot be null or blank");
        }
        if (contentType == null || contentType.isBlank()) {
            throw new IllegalArgumentException("Content type cannot be null or blank");
        }
        if (contentSupplier == null) {
            throw new IllegalArgumentException("Content supplier cannot be null");
        }
        if (contentLength < 0) {
            contentLength = -1;
        }
    }

    public static ExportFile ofBytes(String filename, String contentType, byte[] bytes) {
        return new ExportFile(filename, contentType, () -> new ByteArrayInputStream(bytes), bytes.length);
    }

    /**
     * Reads the whole content into memory.
     */
    public byte[] readAllBytes() {
        try (InputStream in = contentSupplier.get()) {
            return in.readAllBytes();
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read content of " + filename, e);
        }
    }
}
