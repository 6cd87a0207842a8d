package uk.gegc.manuscript.features.project.domain.model;

import java.time.LocalDate;

/**
 * One day of writing activity.
 */
public record WritingSession(
        LocalDate date,
        int wordsWritten,
        int draftWordCount,
        long durationSeconds
) {
}
