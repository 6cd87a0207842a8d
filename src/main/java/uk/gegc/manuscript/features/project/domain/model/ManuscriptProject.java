package uk.gegc.manuscript.features.project.domain.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * In-memory writing project: one draft root plus optional research and trash
 * siblings, and the per-project label, status and target tables.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ManuscriptProject {

    @Builder.Default
    private String title = "";

    @Builder.Default
    private String author = "";

    @Builder.Default
    private Folder rootFolder = Folder.builder().title("Draft").kind(FolderKind.DRAFT).build();

    private Folder researchFolder;

    private Folder trashFolder;

    @Builder.Default
    private List<Label> labels = new ArrayList<>();

    @Builder.Default
    private List<Status> statuses = new ArrayList<>();

    private ManuscriptTargets targets;

    @Builder.Default
    private List<WritingSession> writingHistory = new ArrayList<>();

    /**
     * Keywords used by documents under the draft and research folders, in first-seen order.
     * Trash is excluded.
     */
    public Set<String> collectKeywords() {
        Set<String> keywords = new LinkedHashSet<>();
        collectKeywords(rootFolder, keywords);
        if (researchFolder != null) {
            collectKeywords(researchFolder, keywords);
        }
        return keywords;
    }

    private static void collectKeywords(Folder folder, Set<String> keywords) {
        for (Document document : folder.getDocuments()) {
            keywords.addAll(document.getKeywords());
        }
        for (Folder subfolder : folder.getSubfolders()) {
            collectKeywords(subfolder, keywords);
        }
    }
}
