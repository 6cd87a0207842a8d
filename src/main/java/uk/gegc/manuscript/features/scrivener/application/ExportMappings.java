package uk.gegc.manuscript.features.scrivener.application;

import uk.gegc.manuscript.features.project.domain.model.Document;
import uk.gegc.manuscript.features.project.domain.model.Folder;
import uk.gegc.manuscript.features.project.domain.model.ManuscriptProject;
import uk.gegc.manuscript.features.scrivener.domain.UnmappedIdentifierException;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.function.Supplier;

/**
 * Identifier tables for one export, built before anything is written and read-only afterwards.
 *
 * @param uuidMapping      folder and document ids to the binder UUIDs written for them
 * @param labelIdMapping   local label id to its index in the label table
 * @param statusIdMapping  local status id to its index in the status table
 * @param keywordIdMapping keyword to its index in the sorted draft and research keyword set
 */
public record ExportMappings(
        Map<UUID, String> uuidMapping,
        Map<String, Integer> labelIdMapping,
        Map<String, Integer> statusIdMapping,
        Map<String, Integer> keywordIdMapping
) {

    public ExportMappings {
        uuidMapping = Collections.unmodifiableMap(new LinkedHashMap<>(uuidMapping));
        labelIdMapping = Collections.unmodifiableMap(new LinkedHashMap<>(labelIdMapping));
        statusIdMapping = Collections.unmodifiableMap(new LinkedHashMap<>(statusIdMapping));
        keywordIdMapping = Collections.unmodifiableMap(new LinkedHashMap<>(keywordIdMapping));
    }

    public static ExportMappings of(ManuscriptProject project) {
        return of(project, () -> UUID.randomUUID().toString().toUpperCase());
    }

    /**
     * Builds every table for {@code project}. UUIDs are assigned in one pre-order walk over
     * draft, research and trash.
     */
    public static ExportMappings of(ManuscriptProject project, Supplier<String> uuidSource) {
        Map<UUID, String> uuids = new LinkedHashMap<>();
        assignUuids(project.getRootFolder(), uuids, uuidSource);
        if (project.getResearchFolder() != null) {
            assignUuids(project.getResearchFolder(), uuids, uuidSource);
        }
        if (project.getTrashFolder() != null) {
            assignUuids(project.getTrashFolder(), uuids, uuidSource);
        }

        Map<String, Integer> labels = new HashMap<>();
        for (int i = 0; i < project.getLabels().size(); i++) {
            labels.put(project.getLabels().get(i).id(), i);
        }
        Map<String, Integer> statuses = new HashMap<>();
        for (int i = 0; i < project.getStatuses().size(); i++) {
            statuses.put(project.getStatuses().get(i).id(), i);
        }

        List<String> sortedKeywords = new ArrayList<>(project.collectKeywords());
        Collections.sort(sortedKeywords);
        Map<String, Integer> keywords = new LinkedHashMap<>();
        for (int i = 0; i < sortedKeywords.size(); i++) {
            keywords.put(sortedKeywords.get(i), i);
        }
        return new ExportMappings(uuids, labels, statuses, keywords);
    }

    private static void assignUuids(Folder folder, Map<UUID, String> uuids, Supplier<String> uuidSource) {
        uuids.put(folder.getId(), uuidSource.get());
        for (Document document : folder.getDocuments()) {
            uuids.put(document.getId(), uuidSource.get());
        }
        for (Folder subfolder : folder.getSubfolders()) {
            assignUuids(subfolder, uuids, uuidSource);
        }
    }

    public String uuidFor(UUID id) {
        return require(uuidMapping, id, "UUID");
    }

    public int labelIdFor(String labelId) {
        return require(labelIdMapping, labelId, "label");
    }

    public int statusIdFor(String statusId) {
        return require(statusIdMapping, statusId, "status");
    }

    public int keywordIdFor(String keyword) {
        return require(keywordIdMapping, keyword, "keyword");
    }

    /**
     * Keywords in id order.
     */
    public List<String> sortedKeywords() {
        return List.copyOf(keywordIdMapping.keySet());
    }

    private static <K, V> V require(Map<K, V> table, K key, String kind) {
        V value = table.get(key);
        if (value == null) {
            throw new UnmappedIdentifierException(kind, key);
        }
        return value;
    }
}
