package uk.gegc.manuscript.features.conversion.domain;

import uk.gegc.manuscript.shared.dto.ImportWarning;

import java.util.List;

/**
 * Result of document conversion: the extracted content plus anything the caller should tell the
 * user about it.
 */
public record ConversionResult(String text, List<ImportWarning> warnings) {

    public ConversionResult {
        text = text == null ? "" : text;
        warnings = warnings == null ? List.of() : List.copyOf(warnings);
    }

    public ConversionResult(String text) {
        this(text, List.of());
    }
}
