package uk.gegc.manuscript.features.compile;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import uk.gegc.manuscript.features.compile.application.CompileService;
import uk.gegc.manuscript.features.compile.application.ExportRenderer;
import uk.gegc.manuscript.features.compile.application.impl.MarkdownExportRenderer;
import uk.gegc.manuscript.features.compile.application.impl.PlainTextExportRenderer;
import uk.gegc.manuscript.features.compile.config.CompileProperties;
import uk.gegc.manuscript.features.compile.domain.CompilableDocument;
import uk.gegc.manuscript.features.compile.domain.CompileException;
import uk.gegc.manuscript.features.compile.domain.CompileResult;
import uk.gegc.manuscript.features.compile.domain.CompileSettings;
import uk.gegc.manuscript.features.compile.domain.CompileStatistics;
import uk.gegc.manuscript.features.compile.domain.ExportFormat;
import uk.gegc.manuscript.features.compile.domain.ExportRenderingException;
import uk.gegc.manuscript.features.project.domain.model.Document;
import uk.gegc.manuscript.features.project.domain.model.Folder;
import uk.gegc.manuscript.features.project.domain.model.FolderKind;
import uk.gegc.manuscript.features.project.domain.model.ManuscriptProject;
import uk.gegc.manuscript.features.scrivener.application.ScrivenerExportPipeline;
import uk.gegc.manuscript.features.scrivener.domain.ExportException;
import uk.gegc.manuscript.shared.progress.ProgressListener;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class CompileServiceTest {

    @Mock
    private ScrivenerExportPipeline scrivenerExportPipeline;

    private CompileService compileService;

    @BeforeEach
    void setUp() {
        List<ExportRenderer> renderers = List.of(
                new MarkdownExportRenderer(CompileTestSupport.CLOCK),
                new PlainTextExportRenderer(CompileTestSupport.bridge()));
        compileService = new CompileService(renderers, scrivenerExportPipeline, new CompileProperties());
    }

    @Test
    void collectCompilableDocuments_nestedFolders_ordersDocumentsBeforeSubfolders() {
        // Given
        Folder partTwo = Folder.builder().title("Part Two").order(2)
                .documents(new ArrayList<>(List.of(document("Two-A", 0, true))))
                .build();
        Folder partOne = Folder.builder().title("Part One").order(1)
                .documents(new ArrayList<>(List.of(
                        document("One-B", 1, true),
                        document("One-A", 0, true),
                        document("One-Hidden", 2, false))))
                .build();
        Folder draft = Folder.builder().title("Draft").kind(FolderKind.DRAFT)
                .documents(new ArrayList<>(List.of(document("Prologue", 5, true))))
                .subfolders(new ArrayList<>(List.of(partTwo, partOne)))
                .build();

        // When
        List<CompilableDocument> documents = compileService.collectCompilableDocuments(draft);

        // Then
        assertThat(documents).extracting(CompilableDocument::title)
                .containsExactly("Prologue", "One-A", "One-B", "Two-A");
        assertThat(documents).extracting(CompilableDocument::depth).containsExactly(0, 1, 1, 1);
        assertThat(documents).extracting(CompilableDocument::parentTitle)
                .containsExactly("Draft", "Part One", "Part One", "Part Two");
    }

    @Test
    void compile_noIncludedDocuments_throwsNoDocuments() {
        // Given
        ManuscriptProject project = project("Book", document("Skipped", 0, false));

        // When / Then
        assertThatThrownBy(() -> compileService.compile(project, CompileSettings.defaults()))
                .isInstanceOf(CompileException.class)
                .hasMessageContaining("No documents to compile")
                .extracting("reason").isEqualTo(CompileException.Reason.NO_DOCUMENTS);
    }

    @Test
    void compile_markdown_usesSlugFilenameAndReportsStatistics() throws CompileException {
        // Given
        ManuscriptProject project = project("The Long Road!",
                document("One", 0, true, "one two three"),
                document("Two", 1, true, "four five"));
        CompileSettings settings = CompileSettings.builder().format(ExportFormat.MARKDOWN).build();

        // When
        CompileResult result = compileService.compile(project, settings);

        // Then
        assertThat(result.file().filename()).isEqualTo("the-long-road.md");
        String markdown = new String(result.file().readAllBytes(), StandardCharsets.UTF_8);
        assertThat(markdown).contains("# The Long Road!").contains("## One").contains("four five");
        CompileStatistics statistics = result.statistics();
        assertThat(statistics.documentCount()).isEqualTo(2);
        assertThat(statistics.wordCount()).isEqualTo(5);
        assertThat(statistics.estimatedPages()).isEqualTo(1);
    }

    @Test
    void compile_titleOverride_takesPrecedenceOverProjectTitle() throws CompileException {
        // Given
        ManuscriptProject project = project("Working Title", document("One", 0, true));
        CompileSettings settings = CompileSettings.builder()
                .format(ExportFormat.PLAIN_TEXT)
                .titleOverride("Final Title")
                .authorOverride("Pen Name")
                .build();

        // When
        CompileResult result = compileService.compile(project, settings);

        // Then
        assertThat(result.file().filename()).isEqualTo("final-title.txt");
        String text = new String(result.file().readAllBytes(), StandardCharsets.UTF_8);
        assertThat(text).startsWith("FINAL TITLE\n===========\n\nby Pen Name\n\n");
    }

    @Test
    void compile_blankProjectTitle_fallsBackToUntitled() throws CompileException {
        // Given
        ManuscriptProject project = project("  ", document("One", 0, true));
        CompileSettings settings = CompileSettings.builder().format(ExportFormat.PLAIN_TEXT).build();

        // When
        CompileResult result = compileService.compile(project, settings);

        // Then
        assertThat(result.file().filename()).isEqualTo("untitled.txt");
    }

    @Test
    void compile_noRendererForFormat_throwsUnsupportedFormat() {
        // Given
        ManuscriptProject project = project("Book", document("One", 0, true));
        CompileSettings settings = CompileSettings.builder().format(ExportFormat.DOCX).build();

        // When / Then
        assertThatThrownBy(() -> compileService.compile(project, settings))
                .isInstanceOf(CompileException.class)
                .hasMessage("No renderer available for Word")
                .extracting("reason").isEqualTo(CompileException.Reason.UNSUPPORTED_FORMAT);
    }

    @Test
    void compile_rendererFails_wrapsAsExportFailed() {
        // Given
        ExportRenderer failing = mock(ExportRenderer.class);
        when(failing.supports(ExportFormat.HTML)).thenReturn(true);
        when(failing.render(any())).thenThrow(new ExportRenderingException("disk full"));
        CompileService service = new CompileService(List.of(failing), scrivenerExportPipeline, new CompileProperties());
        ManuscriptProject project = project("Book", document("One", 0, true));
        CompileSettings settings = CompileSettings.builder().format(ExportFormat.HTML).build();

        // When / Then
        assertThatThrownBy(() -> service.compile(project, settings))
                .isInstanceOf(CompileException.class)
                .hasMessage("Export failed: disk full")
                .hasCauseInstanceOf(ExportRenderingException.class)
                .extracting("reason").isEqualTo(CompileException.Reason.EXPORT_FAILED);
    }

    @Test
    void compile_scrivenerFormat_delegatesToExportPipeline() throws Exception {
        // Given
        ManuscriptProject project = project("My Novel", document("One", 0, true));
        byte[] zip = {'P', 'K', 3, 4};
        when(scrivenerExportPipeline.exportAsZip(eq(project), any(ProgressListener.class))).thenReturn(zip);
        CompileSettings settings = CompileSettings.builder().format(ExportFormat.SCRIVENER).build();
        List<Double> fractions = new ArrayList<>();

        // When
        CompileResult result = compileService.compile(project, settings, (fraction, message) -> fractions.add(fraction));

        // Then
        assertThat(result.file().filename()).isEqualTo("my-novel.scriv.zip");
        assertThat(result.file().contentType()).isEqualTo("application/zip");
        assertThat(result.file().readAllBytes()).isEqualTo(zip);

        ArgumentCaptor<ProgressListener> captor = ArgumentCaptor.forClass(ProgressListener.class);
        verify(scrivenerExportPipeline).exportAsZip(eq(project), captor.capture());
        captor.getValue().onProgress(1.0, "done");
        assertThat(fractions).contains(0.0, 1.0);
        assertThat(fractions.get(fractions.size() - 1)).isCloseTo(0.95, within(1e-9));
    }

    @Test
    void compile_scrivenerExportFails_throwsExportFailed() throws Exception {
        // Given
        ManuscriptProject project = project("My Novel", document("One", 0, true));
        when(scrivenerExportPipeline.exportAsZip(any(), any()))
                .thenThrow(new ExportException(ExportException.Reason.ARCHIVE_FAILED, "zip broke"));
        CompileSettings settings = CompileSettings.builder().format(ExportFormat.SCRIVENER).build();

        // When / Then
        assertThatThrownBy(() -> compileService.compile(project, settings))
                .isInstanceOf(CompileException.class)
                .hasMessage("Export failed: zip broke")
                .extracting("reason").isEqualTo(CompileException.Reason.EXPORT_FAILED);
    }

    @Test
    void compile_progress_isMonotonicAndEndsAtOne() throws CompileException {
        // Given
        ManuscriptProject project = project("Book",
                document("One", 0, true), document("Two", 1, true), document("Three", 2, true));
        CompileSettings settings = CompileSettings.builder().format(ExportFormat.MARKDOWN).build();
        List<Double> fractions = new ArrayList<>();
        List<String> messages = new ArrayList<>();

        // When
        compileService.compile(project, settings, (fraction, message) -> {
            fractions.add(fraction);
            messages.add(message);
        });

        // Then
        assertThat(fractions).isSorted();
        assertThat(fractions.get(0)).isEqualTo(0.0);
        assertThat(fractions.get(fractions.size() - 1)).isEqualTo(1.0);
        assertThat(messages).contains("Collecting documents...", "Processing document 2 of 3...",
                "Generating output...", "Complete");
        verifyNoInteractions(scrivenerExportPipeline);
    }

    @Test
    void statistics_manyWords_estimatesPagesFromConfiguredDensity() {
        // Given
        CompileProperties properties = new CompileProperties();
        properties.setWordsPerPage(10);
        CompileService service = new CompileService(List.of(), scrivenerExportPipeline, properties);
        String content = "word ".repeat(35);

        // When
        CompileStatistics statistics = service.statistics(List.of(
                CompileTestSupport.doc("A", content, 0),
                CompileTestSupport.doc("B", "", 0)));

        // Then
        assertThat(statistics.documentCount()).isEqualTo(2);
        assertThat(statistics.wordCount()).isEqualTo(35);
        assertThat(statistics.estimatedPages()).isEqualTo(3);
    }

    private static Document document(String title, int order, boolean include) {
        return document(title, order, include, "Text of " + title + ".");
    }

    private static Document document(String title, int order, boolean include, String content) {
        return Document.builder()
                .title(title)
                .order(order)
                .includeInCompile(include)
                .content(content)
                .build();
    }

    private static ManuscriptProject project(String title, Document... documents) {
        Folder draft = Folder.builder().title("Draft").kind(FolderKind.DRAFT)
                .documents(new ArrayList<>(List.of(documents)))
                .build();
        return ManuscriptProject.builder()
                .title(title)
                .author("Ann Writer")
                .rootFolder(draft)
                .build();
    }
}
