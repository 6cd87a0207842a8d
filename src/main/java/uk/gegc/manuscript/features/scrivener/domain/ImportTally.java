package uk.gegc.manuscript.features.scrivener.domain;

import uk.gegc.manuscript.features.project.domain.model.ManuscriptProject;
import uk.gegc.manuscript.shared.dto.ImportWarning;
import uk.gegc.manuscript.shared.progress.ProgressListener;

import java.util.ArrayList;
import java.util.List;

/**
 * Counters and warnings accumulated while converting one binder tree. Also turns per-item
 * progress into the conversion stage's share of the overall fraction.
 */
public class ImportTally {

    static final double STAGE_START = 0.20;
    static final double STAGE_SPAN = 0.70;

    private final ProgressListener listener;
    private final int totalItems;
    private final List<ImportWarning> warnings = new ArrayList<>();
    private int documents;
    private int folders;
    private int skipped;
    private int processed;

    public ImportTally(ProgressListener listener, int totalItems) {
        this.listener = ProgressListener.nullSafe(listener);
        this.totalItems = Math.max(totalItems, 1);
    }

    public void documentImported() {
        documents++;
    }

    public void folderImported() {
        folders++;
    }

    public void skipped(int count) {
        skipped += count;
    }

    public void warn(ImportWarning warning) {
        warnings.add(warning);
    }

    /**
     * Marks {@code count} binder items as handled and reports progress for {@code title}.
     */
    public void advance(int count, String title) {
        processed = Math.min(processed + count, totalItems);
        listener.onProgress(STAGE_START + (double) processed / totalItems * STAGE_SPAN, "Converting: " + title);
    }

    public int documents() {
        return documents;
    }

    public int folders() {
        return folders;
    }

    public int skipped() {
        return skipped;
    }

    public List<ImportWarning> warnings() {
        return List.copyOf(warnings);
    }

    public ImportResult toResult(ManuscriptProject project) {
        return new ImportResult(project, warnings, skipped, documents, folders);
    }
}
