package uk.gegc.manuscript.features.interchange.application;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Async;
import org.springframework.stereotype.Service;
import uk.gegc.manuscript.features.compile.application.CompileService;
import uk.gegc.manuscript.features.compile.domain.CompileException;
import uk.gegc.manuscript.features.compile.domain.CompileResult;
import uk.gegc.manuscript.features.compile.domain.CompileSettings;
import uk.gegc.manuscript.features.conversion.application.DocumentImportService;
import uk.gegc.manuscript.features.conversion.domain.ConversionException;
import uk.gegc.manuscript.features.conversion.domain.DocumentImportOptions;
import uk.gegc.manuscript.features.conversion.domain.DocumentImportResult;
import uk.gegc.manuscript.features.project.domain.model.ManuscriptProject;
import uk.gegc.manuscript.features.scrivener.application.ScrivenerExportPipeline;
import uk.gegc.manuscript.features.scrivener.application.ScrivenerImportPipeline;
import uk.gegc.manuscript.features.scrivener.domain.ExportException;
import uk.gegc.manuscript.features.scrivener.domain.ImportException;
import uk.gegc.manuscript.features.scrivener.domain.ImportOptions;
import uk.gegc.manuscript.features.scrivener.domain.ImportResult;
import uk.gegc.manuscript.shared.progress.ProgressListener;

import java.nio.file.Path;
import java.util.concurrent.CompletableFuture;

/**
 * Runs imports, exports and compiles on the interchange executor.
 * <p>
 * Each operation is a single sequential task. Checked failures complete the returned future
 * exceptionally with the original exception; callers cancel by interrupting the worker.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class InterchangeService {

    private final ScrivenerImportPipeline scrivenerImportPipeline;
    private final ScrivenerExportPipeline scrivenerExportPipeline;
    private final CompileService compileService;
    private final DocumentImportService documentImportService;

    @Async("interchangeTaskExecutor")
    public CompletableFuture<ImportResult> importScrivener(Path bundle, ImportOptions options,
                                                           ProgressListener listener) {
        log.debug("Scrivener import of {} on {}", bundle, Thread.currentThread().getName());
        try {
            return CompletableFuture.completedFuture(scrivenerImportPipeline.importProject(bundle, options, listener));
        } catch (ImportException e) {
            log.warn("Scrivener import of {} failed: {}", bundle, e.getMessage());
            return CompletableFuture.failedFuture(e);
        }
    }

    @Async("interchangeTaskExecutor")
    public CompletableFuture<Path> exportScrivener(ManuscriptProject project, Path destinationDirectory,
                                                   ProgressListener listener) {
        log.debug("Scrivener export of '{}' on {}", project.getTitle(), Thread.currentThread().getName());
        try {
            return CompletableFuture.completedFuture(
                    scrivenerExportPipeline.export(project, destinationDirectory, listener));
        } catch (ExportException e) {
            log.warn("Scrivener export of '{}' failed ({}): {}", project.getTitle(), e.getReason(), e.getMessage());
            return CompletableFuture.failedFuture(e);
        }
    }

    @Async("interchangeTaskExecutor")
    public CompletableFuture<byte[]> exportScrivenerZip(ManuscriptProject project, ProgressListener listener) {
        try {
            return CompletableFuture.completedFuture(scrivenerExportPipeline.exportAsZip(project, listener));
        } catch (ExportException e) {
            log.warn("Scrivener ZIP export of '{}' failed ({}): {}",
                    project.getTitle(), e.getReason(), e.getMessage());
            return CompletableFuture.failedFuture(e);
        }
    }

    @Async("interchangeTaskExecutor")
    public CompletableFuture<CompileResult> compile(ManuscriptProject project, CompileSettings settings,
                                                    ProgressListener listener) {
        log.debug("Compiling '{}' on {}", project.getTitle(), Thread.currentThread().getName());
        try {
            return CompletableFuture.completedFuture(compileService.compile(project, settings, listener));
        } catch (CompileException e) {
            log.warn("Compile of '{}' failed: {}", project.getTitle(), e.getMessage());
            return CompletableFuture.failedFuture(e);
        }
    }

    @Async("interchangeTaskExecutor")
    public CompletableFuture<DocumentImportResult> importDocument(Path file, DocumentImportOptions options,
                                                                  ProgressListener listener) {
        try {
            return CompletableFuture.completedFuture(documentImportService.importFile(file, options, listener));
        } catch (ConversionException e) {
            log.warn("Document import of {} failed: {}", file, e.getMessage());
            return CompletableFuture.failedFuture(e);
        }
    }
}
