package uk.gegc.manuscript.features.compile.domain;

import uk.gegc.manuscript.shared.progress.ProgressListener;

import java.util.List;

/**
 * Everything a renderer needs for one compile run.
 *
 * @param documents      flattened documents in output order
 * @param title          resolved book title, never blank
 * @param author         resolved author, possibly empty
 * @param filenamePrefix filename without extension
 * @param listener       progress sink; renderers report through {@link #report(CompileProgress)}
 */
public record CompilePayload(
        List<CompilableDocument> documents,
        String title,
        String author,
        CompileSettings settings,
        String filenamePrefix,
        ProgressListener listener
) {
    public CompilePayload {
        if (documents == null) {
            throw new IllegalArgumentException("Documents list cannot be null");
        }
        documents = List.copyOf(documents);
        if (title == null || title.isBlank()) {
            title = "Untitled";
        }
        if (author == null) {
            author = "";
        }
        if (settings == null) {
            settings = CompileSettings.defaults();
        }
        if (filenamePrefix == null || filenamePrefix.isBlank()) {
            filenamePrefix = "untitled";
        }
        listener = ProgressListener.nullSafe(listener);
    }

    public void report(CompileProgress progress) {
        listener.onProgress(progress.overallFraction(), progress.description());
    }

    public boolean hasAuthor() {
        return !author.isBlank();
    }

    public String filename(ExportFormat format) {
        return filenamePrefix + "." + format.fileExtension();
    }
}
