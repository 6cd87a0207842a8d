package uk.gegc.manuscript.features.scrivener.application;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import uk.gegc.manuscript.features.project.domain.model.Document;
import uk.gegc.manuscript.features.project.domain.model.Folder;
import uk.gegc.manuscript.features.project.domain.model.FolderKind;
import uk.gegc.manuscript.features.project.domain.model.Label;
import uk.gegc.manuscript.features.project.domain.model.ManuscriptProject;
import uk.gegc.manuscript.features.project.domain.model.ManuscriptTargets;
import uk.gegc.manuscript.features.project.domain.model.Status;
import uk.gegc.manuscript.features.project.domain.model.WritingSession;
import uk.gegc.manuscript.features.richtext.application.RichTextMarkdownBridge;
import uk.gegc.manuscript.features.richtext.domain.RtfConversion;
import uk.gegc.manuscript.features.scrivener.config.ScrivenerProperties;
import uk.gegc.manuscript.features.scrivener.domain.BinderItemShape;
import uk.gegc.manuscript.features.scrivener.domain.ImportError;
import uk.gegc.manuscript.features.scrivener.domain.ImportException;
import uk.gegc.manuscript.features.scrivener.domain.ImportOptions;
import uk.gegc.manuscript.features.scrivener.domain.ImportResult;
import uk.gegc.manuscript.features.scrivener.domain.ImportTally;
import uk.gegc.manuscript.features.scrivener.domain.model.BinderItem;
import uk.gegc.manuscript.features.scrivener.domain.model.BinderItemType;
import uk.gegc.manuscript.features.scrivener.domain.model.ScrivenerKeyword;
import uk.gegc.manuscript.features.scrivener.domain.model.ScrivenerLabel;
import uk.gegc.manuscript.features.scrivener.domain.model.ScrivenerProject;
import uk.gegc.manuscript.features.scrivener.domain.model.ScrivenerStatus;
import uk.gegc.manuscript.features.scrivener.domain.model.ScrivenerVersion;
import uk.gegc.manuscript.shared.dto.ImportWarning;
import uk.gegc.manuscript.shared.progress.ProgressListener;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.UUID;
import java.util.stream.Stream;

/**
 * Imports a {@code .scriv} bundle into a {@link ManuscriptProject}.
 * <p>
 * Any binder item may carry content and children at once, so every item is classified with
 * {@link BinderItemShape} before it is converted. Counters and warnings travel in an
 * {@link ImportTally}; a single unreadable document never aborts the import.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class ScrivenerImportPipeline {

    static final String MEDIA_SKIPPED = "Media item skipped (not yet supported)";
    static final String DEFAULT_ICON = "doc.text";
    static final String CONTENT_OUTSIDE_BUNDLE = "Content path points outside the project bundle and was ignored";

    private final ScrivenerBundleValidator validator;
    private final BinderXmlParser parser;
    private final WritingHistoryParser historyParser;
    private final RichTextMarkdownBridge bridge;
    private final ScrivenerProperties properties;
    private final Clock clock;

    public ImportResult importProject(Path bundle) throws ImportException {
        return importProject(bundle, properties.defaultImportOptions(), ProgressListener.NONE);
    }

    public ImportResult importProject(Path bundle, ImportOptions options, ProgressListener listener)
            throws ImportException {
        ProgressListener progress = ProgressListener.nullSafe(listener);
        ImportOptions effective = options != null ? options : properties.defaultImportOptions();

        progress.onProgress(0.05, "Validating Scrivener project...");
        Path manifest = validator.requireManifest(bundle);
        checkCancelled();

        progress.onProgress(0.10, "Reading project structure...");
        ScrivenerProject scrivener = readManifest(manifest);
        ScrivenerVersion version = validator.detectVersion(bundle);
        scrivener.setVersion(version);
        log.info("Importing Scrivener {} project '{}' ({} binder items)",
                version, scrivener.getTitle(), scrivener.totalItemCount());

        ManuscriptProject project = ManuscriptProject.builder().build();
        project.setTitle(projectTitle(scrivener, bundle));

        ImportTally tally = new ImportTally(progress, scrivener.totalItemCount());
        ImportContext context = new ImportContext(bundle, version, effective, tally);
        mapLabels(scrivener, project, context);
        mapStatuses(scrivener, project, context);
        for (ScrivenerKeyword keyword : scrivener.getKeywords()) {
            context.keywords().putIfAbsent(keyword.id(), keyword.name());
        }
        if (scrivener.getTargets() != null) {
            project.setTargets(new ManuscriptTargets(
                    scrivener.getTargets().getDraftWordCount(),
                    scrivener.getTargets().getDraftDeadline(),
                    scrivener.getTargets().getSessionWordCount()));
        }

        progress.onProgress(0.20, "Converting documents...");
        convertBinder(scrivener, project, context);

        progress.onProgress(0.95, "Importing writing history...");
        project.setWritingHistory(importWritingHistory(bundle, tally));

        progress.onProgress(1.0, "Import complete!");
        ImportResult result = tally.toResult(project);
        log.info("Finished importing '{}': {} with {} warning(s)",
                project.getTitle(), result.summary(), result.warnings().size());
        return result;
    }

    private ScrivenerProject readManifest(Path manifest) throws ImportException {
        try (InputStream in = Files.newInputStream(manifest)) {
            return parser.parse(in);
        } catch (IOException e) {
            log.error("Could not read manifest {}", manifest, e);
            throw new ImportException(ImportError.FILE_READ_FAILED, manifest.toString(), e);
        }
    }

    private static String projectTitle(ScrivenerProject scrivener, Path bundle) {
        String title = scrivener.getTitle();
        if (title == null || title.isEmpty() || "Untitled Project".equals(title)) {
            return ScrivenerBundleValidator.bundleName(bundle);
        }
        return title;
    }

    private static void mapLabels(ScrivenerProject scrivener, ManuscriptProject project, ImportContext context) {
        List<Label> labels = new ArrayList<>();
        for (ScrivenerLabel scrivLabel : scrivener.getLabels()) {
            if (scrivLabel.id() < 0) {
                continue;
            }
            Label label = new Label("scriv-label-" + scrivLabel.id(), scrivLabel.name(), scrivLabel.color().toHex());
            context.labels().put(scrivLabel.id(), label);
            labels.add(label);
        }
        project.setLabels(labels.isEmpty() ? new ArrayList<>(Label.defaults()) : labels);
    }

    private static void mapStatuses(ScrivenerProject scrivener, ManuscriptProject project, ImportContext context) {
        List<Status> statuses = new ArrayList<>();
        for (ScrivenerStatus scrivStatus : scrivener.getStatuses()) {
            if (scrivStatus.id() < 0) {
                continue;
            }
            Status status = new Status("scriv-status-" + scrivStatus.id(), scrivStatus.name());
            context.statuses().put(scrivStatus.id(), status);
            statuses.add(status);
        }
        project.setStatuses(statuses.isEmpty() ? new ArrayList<>(Status.defaults()) : statuses);
    }

    private void convertBinder(ScrivenerProject scrivener, ManuscriptProject project, ImportContext context)
            throws ImportException {
        ImportOptions options = context.options();
        Folder draft = null;
        Folder looseItems = Folder.builder().build();

        for (BinderItem item : scrivener.getBinderItems()) {
            checkCancelled();
            switch (item.getType()) {
                case DRAFT_FOLDER -> draft = convertFolder(item, 0, context);
                case RESEARCH_FOLDER -> {
                    if (options.importResearch()) {
                        Folder research = convertFolder(item, 0, context);
                        research.setKind(FolderKind.RESEARCH);
                        project.setResearchFolder(research);
                    } else {
                        context.tally().skipped(item.totalCount());
                    }
                }
                case TRASH_FOLDER -> {
                    if (options.importTrash()) {
                        Folder trash = convertFolder(item, 0, context);
                        trash.setKind(FolderKind.TRASH);
                        project.setTrashFolder(trash);
                    } else {
                        context.tally().skipped(item.totalCount());
                    }
                }
                default -> convertChild(item, looseItems.getDocuments().size() + looseItems.getSubfolders().size(),
                        looseItems, context);
            }
        }

        if (draft == null) {
            draft = Folder.builder().title(scrivener.getTitle()).creationDate(clock.instant()).build();
        }
        draft.setKind(FolderKind.DRAFT);
        int offset = draft.getDocuments().size() + draft.getSubfolders().size();
        for (Document document : looseItems.getDocuments()) {
            document.setOrder(document.getOrder() + offset);
            draft.getDocuments().add(document);
        }
        for (Folder folder : looseItems.getSubfolders()) {
            folder.setOrder(folder.getOrder() + offset);
            draft.getSubfolders().add(folder);
        }
        project.setRootFolder(draft);
    }

    /**
     * Converts an item known to become a folder. When the item has its own content that content
     * becomes the folder's first document and the children's orders shift by one.
     */
    Folder convertFolder(BinderItem item, int order, ImportContext context) throws ImportException {
        boolean hasContent = locate(item, context).hasContent();
        Folder folder = Folder.builder()
                .id(hasContent ? UUID.randomUUID() : idFor(item, context.options()))
                .title(item.getTitle())
                .creationDate(created(item))
                .order(order)
                .build();
        context.tally().folderImported();

        int offset = 0;
        if (hasContent) {
            addDocument(folder, item, 0, context, "Could not import folder content: ");
            offset = 1;
        }
        List<BinderItem> children = item.getChildren();
        for (int i = 0; i < children.size(); i++) {
            convertChild(children.get(i), i + offset, folder, context);
        }
        return folder;
    }

    private void convertChild(BinderItem child, int order, Folder parent, ImportContext context)
            throws ImportException {
        checkCancelled();
        ImportTally tally = context.tally();
        BinderItemType type = child.getType();

        if (type.isMedia()) {
            log.debug("Skipping media item '{}' ({})", child.getTitle(), type.xmlName());
            tally.warn(ImportWarning.info(MEDIA_SKIPPED, child.getTitle()));
            tally.skipped(1);
            tally.advance(1, child.getTitle());
            return;
        }
        if (type == BinderItemType.TRASH_FOLDER && !context.options().importTrash()) {
            tally.skipped(child.totalCount());
            tally.advance(child.totalCount(), child.getTitle());
            return;
        }

        ContentFiles files = locate(child, context);
        if (!files.insideBundle()) {
            log.warn("Binder item '{}' references content outside the bundle (ID {}, UUID {})",
                    child.getTitle(), child.getId(), child.getUuid());
            tally.warn(ImportWarning.warning(CONTENT_OUTSIDE_BUNDLE, child.getTitle()));
        }
        boolean hasContent = files.hasContent();
        switch (BinderItemShape.classify(hasContent, !child.getChildren().isEmpty())) {
            case BOTH, FOLDER_ONLY -> parent.getSubfolders().add(convertFolder(child, order, context));
            case DOCUMENT_ONLY -> addDocument(parent, child, order, context, "Could not import document: ");
            case EMPTY -> {
                if (type == BinderItemType.TEXT) {
                    addDocument(parent, child, order, context, "Could not import document: ");
                } else {
                    parent.getSubfolders().add(Folder.builder()
                            .id(idFor(child, context.options()))
                            .title(child.getTitle())
                            .creationDate(created(child))
                            .order(order)
                            .build());
                    tally.folderImported();
                    tally.advance(1, child.getTitle());
                }
            }
        }
    }

    private void addDocument(Folder parent, BinderItem item, int order, ImportContext context, String failurePrefix) {
        ImportTally tally = context.tally();
        try {
            parent.getDocuments().add(convertDocument(item, order, context));
            tally.documentImported();
        } catch (IOException e) {
            log.warn("Could not import '{}': {}", item.getTitle(), e.getMessage());
            tally.warn(ImportWarning.warning(failurePrefix + e.getMessage(), item.getTitle()));
            tally.skipped(1);
        }
        tally.advance(1, item.getTitle());
    }

    Document convertDocument(BinderItem item, int order, ImportContext context) throws IOException {
        ContentFiles files = locate(item, context);
        ImportTally tally = context.tally();

        String content = "";
        if (files.hasContent()) {
            RtfConversion conversion = bridge.rtfToMarkdown(Files.readAllBytes(files.content()));
            content = conversion.markdown();
            if (conversion.fellBack()) {
                log.warn("RTF content of '{}' imported as plain text: {}", item.getTitle(), conversion.failureReason());
                tally.warn(ImportWarning.warning(
                        "Could not convert RTF content: " + conversion.failureReason(), item.getTitle()));
            }
        }

        String notes = "";
        if (files.hasNotes()) {
            RtfConversion conversion = bridge.rtfToMarkdown(Files.readAllBytes(files.notes()));
            notes = conversion.markdown();
            if (conversion.fellBack()) {
                tally.warn(ImportWarning.info(
                        "Notes imported as plain text: " + conversion.failureReason(), item.getTitle()));
            }
        }

        String synopsis = item.getSynopsis() != null ? item.getSynopsis() : "";
        if (files.hasSynopsis()) {
            try {
                synopsis = Files.readString(files.synopsis(), StandardCharsets.UTF_8).trim();
            } catch (IOException e) {
                log.debug("Unreadable synopsis file {}: {}", files.synopsis(), e.getMessage());
                tally.warn(ImportWarning.info("Could not read synopsis file; using binder synopsis", item.getTitle()));
            }
        }

        Document document = Document.builder()
                .id(idFor(item, context.options()))
                .title(item.getTitle())
                .content(content)
                .notes(notes)
                .synopsis(synopsis)
                .creationDate(created(item))
                .order(order)
                .includeInCompile(item.isIncludeInCompile())
                .keywords(keywords(item, context))
                .iconName(DEFAULT_ICON)
                .build();

        if (item.getLabelId() != null) {
            Label label = context.labels().get(item.getLabelId());
            if (label != null) {
                document.setLabelId(label.id());
                document.setColorName(LabelColorNamer.colorName(label));
            }
        }
        if (item.getStatusId() != null) {
            Status status = context.statuses().get(item.getStatusId());
            if (status != null) {
                document.setStatusId(status.id());
            }
        }
        log.debug("Converted '{}' ({} chars)", item.getTitle(), content.length());
        return document;
    }

    private static List<String> keywords(BinderItem item, ImportContext context) {
        Set<String> names = new LinkedHashSet<>();
        for (Integer id : item.getKeywordIds()) {
            String name = context.keywords().get(id);
            if (name != null) {
                names.add(name);
            }
        }
        return new ArrayList<>(names);
    }

    private List<WritingSession> importWritingHistory(Path bundle, ImportTally tally) {
        Path history = bundle.resolve("Files").resolve("writing.history");
        if (!Files.isRegularFile(history)) {
            return new ArrayList<>();
        }
        try {
            List<WritingSession> sessions = historyParser.parse(Files.readAllBytes(history));
            log.debug("Imported {} day(s) of writing history", sessions.size());
            return new ArrayList<>(sessions);
        } catch (ImportException | IOException e) {
            log.warn("Could not import writing history: {}", e.getMessage());
            tally.warn(ImportWarning.info("Could not import writing history: " + e.getMessage(), "writing.history"));
            return new ArrayList<>();
        }
    }

    /**
     * Resolves the content files of a binder item. IDs come from the manifest, so paths that
     * normalize to somewhere outside the content directory are flagged rather than followed.
     */
    static ContentFiles locate(BinderItem item, ImportContext context) {
        Path root = context.bundle()
                .resolve(context.version() == ScrivenerVersion.V3 ? "Files/Data" : "Files/Docs")
                .normalize();
        ContentFiles files;
        if (context.version() == ScrivenerVersion.V3 && item.getUuid() != null && !item.getUuid().isEmpty()) {
            Path dir = root.resolve(item.getUuid());
            files = new ContentFiles(dir.resolve("content.rtf"), dir.resolve("notes.rtf"),
                    dir.resolve("synopsis.txt"), true);
        } else {
            files = new ContentFiles(
                    root.resolve(item.getId() + ".rtf"),
                    root.resolve(item.getId() + "_notes.rtf"),
                    root.resolve(item.getId() + "_synopsis.txt"),
                    true);
        }
        boolean inside = Stream.of(files.content(), files.notes(), files.synopsis())
                .map(Path::normalize)
                .allMatch(path -> path.startsWith(root) && !path.equals(root));
        return inside ? files : new ContentFiles(files.content(), files.notes(), files.synopsis(), false);
    }

    private static UUID idFor(BinderItem item, ImportOptions options) {
        if (options.preserveScrivenerIds() && item.getUuid() != null) {
            try {
                return UUID.fromString(item.getUuid());
            } catch (IllegalArgumentException e) {
                log.debug("Binder UUID '{}' is not a UUID; generating a new id", item.getUuid());
            }
        }
        return UUID.randomUUID();
    }

    private Instant created(BinderItem item) {
        return item.getCreated() != null ? item.getCreated() : clock.instant();
    }

    private static void checkCancelled() throws ImportException {
        if (Thread.currentThread().isInterrupted()) {
            log.info("Scrivener import cancelled");
            throw new ImportException(ImportError.CANCELLED);
        }
    }

    record ContentFiles(Path content, Path notes, Path synopsis, boolean insideBundle) {

        boolean hasContent() {
            return insideBundle && Files.isRegularFile(content);
        }

        boolean hasNotes() {
            return insideBundle && Files.isRegularFile(notes);
        }

        boolean hasSynopsis() {
            return insideBundle && Files.isRegularFile(synopsis);
        }
    }

    /**
     * Per-import state: where content lives, the switches, and the reverse identifier maps
     * (foreign label and status ints to local entries, keyword ints to names).
     */
    record ImportContext(
            Path bundle,
            ScrivenerVersion version,
            ImportOptions options,
            ImportTally tally,
            Map<Integer, Label> labels,
            Map<Integer, Status> statuses,
            Map<Integer, String> keywords
    ) {
        ImportContext(Path bundle, ScrivenerVersion version, ImportOptions options, ImportTally tally) {
            this(bundle, version, options, tally, new HashMap<>(), new HashMap<>(), new HashMap<>());
        }
    }
}
