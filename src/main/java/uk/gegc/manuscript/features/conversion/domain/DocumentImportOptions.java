package uk.gegc.manuscript.features.conversion.domain;

import lombok.Builder;

/**
 * Single-document import switches.
 *
 * @param preserveFormatting keep bold, italic, links and headings as Markdown; otherwise plain text
 * @param createNewProject   hint for the caller on where to place the document; converters ignore it
 */
@Builder(toBuilder = true)
public record DocumentImportOptions(boolean preserveFormatting, boolean createNewProject) {

    public static DocumentImportOptions defaults() {
        return new DocumentImportOptions(true, false);
    }
}
