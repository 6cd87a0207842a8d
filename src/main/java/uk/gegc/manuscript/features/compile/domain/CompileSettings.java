package uk.gegc.manuscript.features.compile.domain;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Options for one compile run. Overrides that are {@code null} or blank fall back to the project's
 * own title and author.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class CompileSettings {

    private String titleOverride;

    private String authorOverride;

    @Builder.Default
    private boolean includeFrontMatter = true;

    @Builder.Default
    private boolean includeTableOfContents = false;

    @Builder.Default
    private DocumentSeparator documentSeparator = DocumentSeparator.CHAPTER_HEADING;

    @Builder.Default
    private PageSize pageSize = PageSize.LETTER;

    @Builder.Default
    private FontStyle fontStyle = FontStyle.SERIF;

    @Builder.Default
    private float fontSize = 12f;

    @Builder.Default
    private float lineSpacing = 1.5f;

    @Builder.Default
    private PageMargins margins = PageMargins.ONE_INCH;

    @Builder.Default
    private boolean includePageNumbers = true;

    @Builder.Default
    private boolean includeTitlePage = true;

    @Builder.Default
    private boolean includeChapterTitles = true;

    @Builder.Default
    private ExportFormat format = ExportFormat.PDF;

    public static CompileSettings defaults() {
        return CompileSettings.builder().build();
    }
}
