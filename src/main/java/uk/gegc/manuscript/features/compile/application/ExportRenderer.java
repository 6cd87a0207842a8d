package uk.gegc.manuscript.features.compile.application;

import uk.gegc.manuscript.features.compile.domain.CompilePayload;
import uk.gegc.manuscript.features.compile.domain.ExportFormat;
import uk.gegc.manuscript.features.compile.domain.ExportFile;

/**
 * SPI for rendering compiled documents into a single output file.
 */
public interface ExportRenderer {
    boolean supports(ExportFormat format);

    ExportFile render(CompilePayload payload);
}
