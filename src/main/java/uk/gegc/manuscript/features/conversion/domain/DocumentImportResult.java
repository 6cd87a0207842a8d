package uk.gegc.manuscript.features.conversion.domain;

import uk.gegc.manuscript.features.project.domain.model.Document;
import uk.gegc.manuscript.shared.dto.ImportWarning;

import java.util.List;

public record DocumentImportResult(Document document, String title, List<ImportWarning> warnings) {

    public DocumentImportResult {
        warnings = warnings == null ? List.of() : List.copyOf(warnings);
    }

    public boolean hasWarnings() {
        return !warnings.isEmpty();
    }
}
