package uk.gegc.manuscript.features.project.domain.model;

import java.time.Instant;

/**
 * Word-count goals. Every field is optional.
 */
public record ManuscriptTargets(
        Integer draftWordCount,
        Instant draftDeadline,
        Integer sessionWordCount
) {
}
