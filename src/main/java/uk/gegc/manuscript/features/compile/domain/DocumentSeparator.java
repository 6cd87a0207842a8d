package uk.gegc.manuscript.features.compile.domain;

/**
 * What goes between two consecutive documents in compiled output.
 */
public enum DocumentSeparator {
    NONE("None", ""),
    BLANK_LINE("Blank Line", "\n\n"),
    THREE_ASTERISKS("***", "\n\n***\n\n"),
    PAGE_BREAK("Page Break", "\n\n---\n\n"),
    /** Each document starts on a new page under its own heading. */
    CHAPTER_HEADING("Chapter Heading", "");

    private final String displayName;
    private final String markdownSeparator;

    DocumentSeparator(String displayName, String markdownSeparator) {
        this.displayName = displayName;
        this.markdownSeparator = markdownSeparator;
    }

    public String displayName() {
        return displayName;
    }

    public String markdownSeparator() {
        return markdownSeparator;
    }

    /**
     * Whether paginated formats should start the next document on a fresh page.
     */
    public boolean breaksPage() {
        return this == PAGE_BREAK || this == CHAPTER_HEADING;
    }
}
