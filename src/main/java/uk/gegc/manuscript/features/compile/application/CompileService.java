package uk.gegc.manuscript.features.compile.application;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import uk.gegc.manuscript.features.compile.config.CompileProperties;
import uk.gegc.manuscript.features.compile.domain.CompilableDocument;
import uk.gegc.manuscript.features.compile.domain.CompileException;
import uk.gegc.manuscript.features.compile.domain.CompilePayload;
import uk.gegc.manuscript.features.compile.domain.CompileProgress;
import uk.gegc.manuscript.features.compile.domain.CompileResult;
import uk.gegc.manuscript.features.compile.domain.CompileSettings;
import uk.gegc.manuscript.features.compile.domain.CompileStatistics;
import uk.gegc.manuscript.features.compile.domain.ExportFile;
import uk.gegc.manuscript.features.compile.domain.ExportFormat;
import uk.gegc.manuscript.features.compile.domain.ExportRenderingException;
import uk.gegc.manuscript.features.project.domain.model.Document;
import uk.gegc.manuscript.features.project.domain.model.Folder;
import uk.gegc.manuscript.features.project.domain.model.ManuscriptProject;
import uk.gegc.manuscript.features.scrivener.application.ScrivenerExportPipeline;
import uk.gegc.manuscript.features.scrivener.domain.ExportException;
import uk.gegc.manuscript.shared.progress.ProgressListener;
import uk.gegc.manuscript.shared.util.Slugs;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Flattens a project's draft into an ordered document list and hands it to the renderer for the
 * requested format.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class CompileService {

    private final List<ExportRenderer> renderers;
    private final ScrivenerExportPipeline scrivenerExportPipeline;
    private final CompileProperties properties;

    /**
     * Collects the documents of {@code folder} and all its subfolders, depth first.
     * Within a folder, documents come first in {@code order}, then subfolders in {@code order}.
     * Documents excluded from compile are skipped.
     */
    public List<CompilableDocument> collectCompilableDocuments(Folder folder) {
        return collectCompilableDocuments(folder, 0, null);
    }

    public List<CompilableDocument> collectCompilableDocuments(Folder folder, int depth, String parentTitle) {
        List<CompilableDocument> collected = new ArrayList<>();
        String parent = parentTitle != null ? parentTitle : folder.getTitle();

        folder.getDocuments().stream()
                .filter(Document::isIncludeInCompile)
                .sorted(Comparator.comparingInt(Document::getOrder))
                .map(document -> new CompilableDocument(
                        document.getId(),
                        document.getTitle(),
                        document.getContent(),
                        document.getOrder(),
                        depth,
                        parent))
                .forEach(collected::add);

        folder.getSubfolders().stream()
                .sorted(Comparator.comparingInt(Folder::getOrder))
                .forEach(subfolder -> collected.addAll(
                        collectCompilableDocuments(subfolder, depth + 1, subfolder.getTitle())));

        return collected;
    }

    public CompileResult compile(ManuscriptProject project, CompileSettings settings) throws CompileException {
        return compile(project, settings, ProgressListener.NONE);
    }

    public CompileResult compile(ManuscriptProject project, CompileSettings settings, ProgressListener listener)
            throws CompileException {
        CompileSettings effective = settings != null ? settings : CompileSettings.defaults();
        ProgressListener progress = ProgressListener.nullSafe(listener);
        ExportFormat format = effective.getFormat();

        progress.onProgress(0.0, CompileProgress.collecting().description());
        List<CompilableDocument> documents = collectCompilableDocuments(project.getRootFolder());
        if (documents.isEmpty()) {
            throw CompileException.noDocuments();
        }

        String title = resolveTitle(project, effective);
        String author = resolveAuthor(project, effective);
        CompileStatistics statistics = statistics(documents);
        log.info("Compiling '{}' as {}: {} documents, {} words", title, format, documents.size(),
                statistics.wordCount());

        CompilePayload payload = new CompilePayload(documents, title, author, effective,
                Slugs.slugifyOr(title, "untitled"), progress);
        ExportFile file = format == ExportFormat.SCRIVENER
                ? exportScrivener(project, payload)
                : render(format, payload);

        payload.report(CompileProgress.complete(documents.size()));
        log.info("Compiled {} ({} bytes)", file.filename(), file.contentLength());
        return new CompileResult(file, statistics);
    }

    public CompileStatistics statistics(List<CompilableDocument> documents) {
        return CompileStatistics.of(documents, properties.getWordsPerPage());
    }

    private ExportFile render(ExportFormat format, CompilePayload payload) throws CompileException {
        ExportRenderer renderer = renderers.stream()
                .filter(candidate -> candidate.supports(format))
                .findFirst()
                .orElseThrow(() -> new CompileException(CompileException.Reason.UNSUPPORTED_FORMAT,
                        "No renderer available for " + format.displayName()));
        try {
            return renderer.render(payload);
        } catch (ExportRenderingException e) {
            log.error("Rendering {} failed", format, e);
            throw CompileException.exportFailed(e);
        }
    }

    private ExportFile exportScrivener(ManuscriptProject project, CompilePayload payload) throws CompileException {
        ProgressListener scaled = payload.listener().scaled(0.05, 0.90);
        try {
            byte[] zip = scrivenerExportPipeline.exportAsZip(project, scaled);
            String filename = payload.filenamePrefix() + "." + ExportFormat.SCRIVENER.fileExtension() + ".zip";
            return ExportFile.ofBytes(filename, ExportFormat.SCRIVENER.contentType(), zip);
        } catch (ExportException e) {
            log.error("Scrivener export failed", e);
            throw CompileException.exportFailed(e);
        }
    }

    private static String resolveTitle(ManuscriptProject project, CompileSettings settings) {
        if (settings.getTitleOverride() != null && !settings.getTitleOverride().isBlank()) {
            return settings.getTitleOverride();
        }
        String title = project.getTitle();
        return title == null || title.isBlank() ? "Untitled" : title;
    }

    private static String resolveAuthor(ManuscriptProject project, CompileSettings settings) {
        if (settings.getAuthorOverride() != null && !settings.getAuthorOverride().isBlank()) {
            return settings.getAuthorOverride();
        }
        return project.getAuthor() == null ? "" : project.getAuthor();
    }
}
