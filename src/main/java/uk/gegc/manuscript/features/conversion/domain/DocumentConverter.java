package uk.gegc.manuscript.features.conversion.domain;

/**
 * Converts the bytes of one foreign document into document content.
 * Strategy pattern for supporting different file formats.
 */
public interface DocumentConverter {

    /**
     * Checks if this converter supports the given filename or MIME type.
     *
     * @param filenameOrMime the filename or MIME type to check
     * @return true if this converter can handle the format
     */
    boolean supports(String filenameOrMime);

    /**
     * Converts document bytes to Markdown, or to plain text when formatting is not preserved.
     *
     * @param bytes   the document bytes
     * @param options import switches
     * @return ConversionResult containing the content and any per-document warnings
     * @throws ConversionException if the bytes cannot be read as this format
     */
    ConversionResult convert(byte[] bytes, DocumentImportOptions options) throws ConversionException;
}
