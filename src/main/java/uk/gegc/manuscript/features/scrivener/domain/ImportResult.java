package uk.gegc.manuscript.features.scrivener.domain;

import uk.gegc.manuscript.features.project.domain.model.ManuscriptProject;
import uk.gegc.manuscript.shared.dto.ImportWarning;
import uk.gegc.manuscript.shared.dto.WarningSeverity;

import java.util.List;

/**
 * Outcome of a completed import: the project plus counts and every recoverable warning.
 */
public record ImportResult(
        ManuscriptProject project,
        List<ImportWarning> warnings,
        int skippedItems,
        int importedDocuments,
        int importedFolders
) {
    public ImportResult {
        warnings = warnings == null ? List.of() : List.copyOf(warnings);
    }

    public boolean hasWarnings() {
        return !warnings.isEmpty();
    }

    public boolean hasErrors() {
        return warnings.stream().anyMatch(w -> w.severity() == WarningSeverity.ERROR);
    }

    public String summary() {
        StringBuilder sb = new StringBuilder()
                .append("Imported ").append(plural(importedDocuments, "document"))
                .append(", ").append(plural(importedFolders, "folder"));
        if (skippedItems > 0) {
            sb.append(" (").append(plural(skippedItems, "item")).append(" skipped)");
        }
        return sb.toString();
    }

    private static String plural(int count, String noun) {
        return count + " " + noun + (count == 1 ? "" : "s");
    }
}
