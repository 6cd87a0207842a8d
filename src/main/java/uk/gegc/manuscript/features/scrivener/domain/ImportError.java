package uk.gegc.manuscript.features.scrivener.domain;

/**
 * Fatal import failures. Descriptions may take one detail argument.
 */
public enum ImportError {
    NOT_A_BUNDLE(
            "The selected file is not a valid Scrivener project bundle.",
            "Please select a valid .scriv folder or bundle."),
    MISSING_PROJECT_FILE(
            "Could not find a .scrivx project file in the Scrivener bundle.",
            "The Scrivener project may be corrupted. Try opening it in Scrivener first."),
    XML_PARSING_FAILED(
            "Failed to parse project file: %s",
            "The project file may be corrupted. Try creating a backup in Scrivener and importing that instead."),
    RTF_CONVERSION_FAILED(
            "Failed to convert RTF content: %s",
            "Some document content may not be imported correctly. You can manually copy the content from Scrivener."),
    MISSING_CONTENT(
            "Could not find content for document %s.",
            "The document content file may have been deleted. The document will be imported with empty content."),
    UNSUPPORTED_VERSION(
            "Scrivener version %s is not supported.",
            "Please upgrade your Scrivener project to version 2.x or 3.x format."),
    FILE_READ_FAILED(
            "Failed to read file: %s",
            "Check that you have permission to read the file and that it exists."),
    INVALID_BUNDLE_STRUCTURE(
            "Invalid Scrivener bundle structure: %s",
            "The Scrivener project structure is not recognized. Try creating a backup in Scrivener."),
    CANCELLED(
            "Import was cancelled.",
            null);

    private final String descriptionTemplate;
    private final String recoverySuggestion;

    ImportError(String descriptionTemplate, String recoverySuggestion) {
        this.descriptionTemplate = descriptionTemplate;
        this.recoverySuggestion = recoverySuggestion;
    }

    public String describe(String detail) {
        if (!descriptionTemplate.contains("%s")) {
            return descriptionTemplate;
        }
        return String.format(descriptionTemplate, detail != null ? detail : "unknown");
    }

    /**
     * @return a hint for the user, or {@code null} when there is nothing to suggest
     */
    public String recoverySuggestion() {
        return recoverySuggestion;
    }
}
