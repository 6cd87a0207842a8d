package uk.gegc.manuscript.features.scrivener.application;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import uk.gegc.manuscript.features.archive.application.ZipArchiveWriter;
import uk.gegc.manuscript.features.archive.domain.ZipEncodingException;
import uk.gegc.manuscript.features.project.domain.model.Document;
import uk.gegc.manuscript.features.project.domain.model.Folder;
import uk.gegc.manuscript.features.project.domain.model.ManuscriptProject;
import uk.gegc.manuscript.features.richtext.application.RichTextMarkdownBridge;
import uk.gegc.manuscript.features.scrivener.config.ScrivenerProperties;
import uk.gegc.manuscript.features.scrivener.domain.ExportException;
import uk.gegc.manuscript.features.scrivener.domain.ExportException.Reason;
import uk.gegc.manuscript.shared.progress.ProgressListener;
import uk.gegc.manuscript.shared.util.Slugs;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.time.Clock;
import java.util.Comparator;
import java.util.List;
import java.util.stream.Stream;

/**
 * Writes a {@link ManuscriptProject} as a Scrivener 3 bundle.
 * <p>
 * The bundle is always assembled in a throwaway staging directory. {@link #export} then moves it
 * into place in one step; {@link #exportAsZip} archives it and discards the staging copy.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class ScrivenerExportPipeline {

    static final String BUNDLE_EXTENSION = ".scriv";
    static final String MANIFEST_EXTENSION = ".scrivx";

    private final RichTextMarkdownBridge bridge;
    private final ScrivenerProperties properties;
    private final Clock clock;

    /**
     * Exports into {@code destinationDirectory}/{@code <slug>.scriv}. An existing bundle of the
     * same name is not overwritten.
     *
     * @return the path of the finished bundle
     */
    public Path export(ManuscriptProject project, Path destinationDirectory, ProgressListener listener)
            throws ExportException {
        ProgressListener progress = ProgressListener.nullSafe(listener);
        Path target = destinationDirectory.resolve(bundleName(project));
        if (Files.exists(target)) {
            log.error("Export target already exists: {}", target);
            throw new ExportException(Reason.WRITE_FAILED, "Export target already exists: " + target);
        }

        Path staging = createStagingDirectory();
        try {
            Path bundle = stage(project, staging, progress);
            Files.createDirectories(destinationDirectory);
            moveIntoPlace(bundle, target);
            progress.onProgress(1.0, "Export complete!");
            log.info("Exported '{}' to {}", project.getTitle(), target);
            return target;
        } catch (IOException e) {
            log.error("Failed to write Scrivener bundle for '{}'", project.getTitle(), e);
            throw new ExportException(Reason.WRITE_FAILED, "Failed to write Scrivener bundle: " + e.getMessage(), e);
        } finally {
            deleteQuietly(staging);
        }
    }

    /**
     * Exports to an in-memory ZIP whose entries are rooted at {@code <slug>.scriv/}.
     */
    public byte[] exportAsZip(ManuscriptProject project, ProgressListener listener) throws ExportException {
        ProgressListener progress = ProgressListener.nullSafe(listener);
        Path staging = createStagingDirectory();
        try {
            Path bundle = stage(project, staging, progress.scaled(0.0, 0.8));

            progress.onProgress(0.85, "Creating ZIP archive...");
            ZipArchiveWriter zip = new ZipArchiveWriter(clock);
            for (Path file : listFiles(bundle)) {
                checkCancelled();
                String entryName = staging.relativize(file).toString().replace('\\', '/');
                zip.addEntry(entryName, Files.readAllBytes(file), true);
            }

            progress.onProgress(0.95, "Finalizing...");
            byte[] archive = zip.finish();
            progress.onProgress(1.0, "Export complete!");
            log.info("Exported '{}' as ZIP ({} entries, {} bytes)", project.getTitle(), zip.entryCount(), archive.length);
            return archive;
        } catch (ZipEncodingException e) {
            log.error("Failed to build ZIP archive for '{}'", project.getTitle(), e);
            throw new ExportException(Reason.ARCHIVE_FAILED, "Failed to create the ZIP archive: " + e.getMessage(), e);
        } catch (IOException e) {
            log.error("Failed to write Scrivener bundle for '{}'", project.getTitle(), e);
            throw new ExportException(Reason.WRITE_FAILED, "Failed to write Scrivener bundle: " + e.getMessage(), e);
        } finally {
            deleteQuietly(staging);
        }
    }

    Path stage(ManuscriptProject project, Path staging, ProgressListener progress)
            throws IOException, ExportException {
        progress.onProgress(0.05, "Preparing export...");
        ExportMappings mappings = ExportMappings.of(project);
        checkCancelled();

        progress.onProgress(0.10, "Creating project structure...");
        String name = slug(project);
        Path bundle = staging.resolve(name + BUNDLE_EXTENSION);
        Path data = bundle.resolve("Files").resolve("Data");
        Files.createDirectories(data);
        Files.createDirectories(bundle.resolve("Settings"));

        progress.onProgress(0.20, "Generating project manifest...");
        String manifest = new BinderXmlWriter(project, mappings, properties, clock).write();
        Files.writeString(bundle.resolve(name + MANIFEST_EXTENSION), manifest, StandardCharsets.UTF_8);

        progress.onProgress(0.30, "Writing version file...");
        Files.writeString(bundle.resolve("Files").resolve("version.txt"), properties.getFormatVersion(),
                StandardCharsets.UTF_8);

        progress.onProgress(0.35, "Converting documents...");
        DocumentCounter counter = new DocumentCounter(Math.max(countDocuments(project), 1), progress);
        writeFolder(project.getRootFolder(), data, mappings, counter);
        if (project.getResearchFolder() != null && !project.getResearchFolder().isEmpty()) {
            writeFolder(project.getResearchFolder(), data, mappings, counter);
        }
        if (project.getTrashFolder() != null && !project.getTrashFolder().isEmpty()) {
            writeFolder(project.getTrashFolder(), data, mappings, counter);
        }
        log.debug("Staged bundle {} with {} document(s)", bundle, counter.written);
        return bundle;
    }

    private void writeFolder(Folder folder, Path data, ExportMappings mappings, DocumentCounter counter)
            throws IOException, ExportException {
        Files.createDirectories(data.resolve(mappings.uuidFor(folder.getId())));
        for (Document document : folder.getDocuments()) {
            checkCancelled();
            Path dir = Files.createDirectories(data.resolve(mappings.uuidFor(document.getId())));
            Files.write(dir.resolve("content.rtf"), bridge.markdownToRtfBytes(document.getContent()));
            if (document.getNotes() != null && !document.getNotes().isEmpty()) {
                Files.write(dir.resolve("notes.rtf"), bridge.markdownToRtfBytes(document.getNotes()));
            }
            if (document.getSynopsis() != null && !document.getSynopsis().isEmpty()) {
                Files.writeString(dir.resolve("synopsis.txt"), document.getSynopsis(), StandardCharsets.UTF_8);
            }
            counter.written(document.getTitle());
        }
        for (Folder subfolder : folder.getSubfolders()) {
            writeFolder(subfolder, data, mappings, counter);
        }
    }

    static String slug(ManuscriptProject project) {
        String title = project.getTitle();
        return title == null || title.isBlank() ? "Untitled" : Slugs.slugifyOr(title, "Untitled");
    }

    static String bundleName(ManuscriptProject project) {
        return slug(project) + BUNDLE_EXTENSION;
    }

    private static int countDocuments(ManuscriptProject project) {
        int count = project.getRootFolder().totalDocumentCount();
        if (project.getResearchFolder() != null) {
            count += project.getResearchFolder().totalDocumentCount();
        }
        if (project.getTrashFolder() != null) {
            count += project.getTrashFolder().totalDocumentCount();
        }
        return count;
    }

    private static void moveIntoPlace(Path source, Path target) throws IOException {
        try {
            Files.move(source, target, StandardCopyOption.ATOMIC_MOVE);
        } catch (AtomicMoveNotSupportedException e) {
            log.debug("Atomic move to {} not supported, copying instead", target);
            copyTree(source, target);
        }
    }

    private static void copyTree(Path source, Path target) throws IOException {
        List<Path> paths;
        try (Stream<Path> walk = Files.walk(source)) {
            paths = walk.sorted().toList();
        }
        for (Path path : paths) {
            Path destination = target.resolve(source.relativize(path).toString());
            if (Files.isDirectory(path)) {
                Files.createDirectories(destination);
            } else {
                Files.copy(path, destination);
            }
        }
    }

    private static List<Path> listFiles(Path root) throws IOException {
        try (Stream<Path> walk = Files.walk(root)) {
            return walk.filter(Files::isRegularFile).sorted().toList();
        }
    }

    private static Path createStagingDirectory() throws ExportException {
        try {
            return Files.createTempDirectory("manuscript-export-");
        } catch (IOException e) {
            log.error("Could not create a staging directory", e);
            throw new ExportException(Reason.WRITE_FAILED, "Failed to create the staging directory", e);
        }
    }

    private static void deleteQuietly(Path root) {
        if (!Files.exists(root)) {
            return;
        }
        try (Stream<Path> walk = Files.walk(root)) {
            for (Path path : walk.sorted(Comparator.reverseOrder()).toList()) {
                Files.deleteIfExists(path);
            }
        } catch (IOException e) {
            log.warn("Could not remove staging directory {}: {}", root, e.getMessage());
        }
    }

    private static void checkCancelled() throws ExportException {
        if (Thread.currentThread().isInterrupted()) {
            log.info("Scrivener export cancelled");
            throw new ExportException(Reason.CANCELLED, "Export was cancelled.");
        }
    }

    private static final class DocumentCounter {

        private final int total;
        private final ProgressListener progress;
        private int written;

        private DocumentCounter(int total, ProgressListener progress) {
            this.total = total;
            this.progress = progress;
        }

        void written(String title) {
            written++;
            progress.onProgress(0.35 + (double) written / total * 0.60, "Converting: " + title);
        }
    }
}
