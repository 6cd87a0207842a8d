package uk.gegc.manuscript.features.scrivener.application;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import uk.gegc.manuscript.features.scrivener.config.ScrivenerProperties;
import uk.gegc.manuscript.features.scrivener.domain.ImportError;
import uk.gegc.manuscript.features.scrivener.domain.ImportException;
import uk.gegc.manuscript.features.scrivener.domain.ValidationResult;
import uk.gegc.manuscript.features.scrivener.domain.model.BinderItem;
import uk.gegc.manuscript.features.scrivener.domain.model.ScrivenerProject;
import uk.gegc.manuscript.features.scrivener.domain.model.ScrivenerVersion;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.stream.Stream;

/**
 * Pre-flight checks on a {@code .scriv} bundle. Reads the manifest but never converts or writes anything.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class ScrivenerBundleValidator {

    static final String LEGACY_MANIFEST = "project.scrivx";
    static final String MANIFEST_EXTENSION = ".scrivx";

    private final BinderXmlParser parser;
    private final ScrivenerProperties properties;

    public ValidationResult validate(Path bundle) {
        if (bundle == null || !Files.exists(bundle)) {
            return ValidationResult.invalid("File does not exist at " + bundle);
        }
        if (!Files.isDirectory(bundle)) {
            return ValidationResult.invalid("The selected file is not a Scrivener project bundle");
        }
        Optional<Path> manifest = findManifest(bundle);
        if (manifest.isEmpty()) {
            return ValidationResult.invalid("Missing .scrivx file - this may not be a valid Scrivener project");
        }

        ScrivenerVersion version = detectVersion(bundle);
        List<String> warnings = new ArrayList<>();
        List<String> errors = new ArrayList<>();

        if (!Files.isDirectory(bundle.resolve("Files/Data")) && !Files.isDirectory(bundle.resolve("Files/Docs"))) {
            warnings.add("No content directory found - documents may be empty");
        }

        String title = "";
        int itemCount = 0;
        try (InputStream in = Files.newInputStream(manifest.get())) {
            ScrivenerProject project = parser.parse(in);
            title = project.getTitle();
            itemCount = project.totalItemCount();
            if (itemCount > properties.getLargeProjectThreshold()) {
                warnings.add("Large project (" + itemCount + " items) - import may take a while");
            }
            if (hasMedia(project.getBinderItems())) {
                warnings.add("Some media files (images, PDFs) will be referenced but not embedded");
            }
        } catch (ImportException | IOException e) {
            log.warn("Could not parse manifest {}: {}", manifest.get(), e.getMessage());
            errors.add("Could not parse project file: " + e.getMessage());
        }

        if (title.isEmpty() || "Untitled Project".equals(title)) {
            title = bundleName(bundle);
        }
        return new ValidationResult(errors.isEmpty(), title, itemCount, version, warnings, errors);
    }

    /**
     * Fails fast with the same checks {@link #validate(Path)} reports, for use at the start of an import.
     */
    public Path requireManifest(Path bundle) throws ImportException {
        if (bundle == null || !Files.isDirectory(bundle)) {
            log.error("Not a Scrivener bundle: {}", bundle);
            throw new ImportException(ImportError.NOT_A_BUNDLE);
        }
        return findManifest(bundle).orElseThrow(() -> {
            log.error("No .scrivx manifest in {}", bundle);
            return new ImportException(ImportError.MISSING_PROJECT_FILE);
        });
    }

    /**
     * Prefers the legacy {@code project.scrivx}, otherwise the first {@code *.scrivx} by name.
     */
    public Optional<Path> findManifest(Path bundle) {
        Path legacy = bundle.resolve(LEGACY_MANIFEST);
        if (Files.isRegularFile(legacy)) {
            return Optional.of(legacy);
        }
        try (Stream<Path> entries = Files.list(bundle)) {
            return entries
                    .filter(Files::isRegularFile)
                    .filter(p -> p.getFileName().toString().endsWith(MANIFEST_EXTENSION))
                    .sorted()
                    .findFirst();
        } catch (IOException e) {
            log.warn("Could not list bundle {}: {}", bundle, e.getMessage());
            return Optional.empty();
        }
    }

    public ScrivenerVersion detectVersion(Path bundle) {
        return Files.isDirectory(bundle.resolve("Files/Data")) ? ScrivenerVersion.V3 : ScrivenerVersion.V2;
    }

    static String bundleName(Path bundle) {
        String name = bundle.getFileName() == null ? "" : bundle.getFileName().toString();
        int dot = name.lastIndexOf('.');
        return dot > 0 ? name.substring(0, dot) : name;
    }

    private static boolean hasMedia(List<BinderItem> items) {
        for (BinderItem item : items) {
            if (item.getType().isMedia() || hasMedia(item.getChildren())) {
                return true;
            }
        }
        return false;
    }
}
