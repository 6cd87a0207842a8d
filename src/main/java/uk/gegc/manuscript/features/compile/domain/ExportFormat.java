package uk.gegc.manuscript.features.compile.domain;

/**
 * Output formats a project can be compiled into.
 */
public enum ExportFormat {
    PDF("PDF", "pdf", "application/pdf"),
    DOCX("Word", "docx", "application/vnd.openxmlformats-officedocument.wordprocessingml.document"),
    EPUB("EPUB", "epub", "application/epub+zip"),
    MARKDOWN("Markdown", "md", "text/markdown; charset=utf-8"),
    PLAIN_TEXT("Plain Text", "txt", "text/plain; charset=utf-8"),
    HTML("HTML", "html", "text/html; charset=utf-8"),
    /**
     * A zipped {@code .scriv} bundle; produced by the Scrivener export pipeline rather than a renderer.
     */
    SCRIVENER("Scrivener", "scriv", "application/zip");

    private final String displayName;
    private final String fileExtension;
    private final String contentType;

    ExportFormat(String displayName, String fileExtension, String contentType) {
        this.displayName = displayName;
        this.fileExtension = fileExtension;
        this.contentType = contentType;
    }

    public String displayName() {
        return displayName;
    }

    public String fileExtension() {
        return fileExtension;
    }

    public String contentType() {
        return contentType;
    }

    /**
     * Whether the format is a directory package on disk rather than a single file.
     */
    public boolean isPackageFormat() {
        return this == SCRIVENER;
    }
}
