package uk.gegc.manuscript.features.compile.domain;

import java.util.UUID;

/**
 * A document flattened out of the project tree, ready for a renderer.
 *
 * @param depth       0 for documents directly in the root folder, 1 for a subfolder, and so on
 * @param parentTitle title of the folder the document was collected from
 */
public record CompilableDocument(
        UUID id,
        String title,
        String content,
        int order,
        int depth,
        String parentTitle
) {

    public CompilableDocument {
        title = title == null ? "" : title;
        content = content == null ? "" : content;
    }

    public int wordCount() {
        String trimmed = content.strip();
        return trimmed.isEmpty() ? 0 : trimmed.split("\\s+").length;
    }

    public int characterCount() {
        return content.codePointCount(0, content.length());
    }
}
