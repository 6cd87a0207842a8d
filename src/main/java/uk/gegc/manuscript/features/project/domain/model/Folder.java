package uk.gegc.manuscript.features.project.domain.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Folder {

    @Builder.Default
    private UUID id = UUID.randomUUID();

    @Builder.Default
    private String title = "";

    private Instant creationDate;

    @Builder.Default
    private FolderKind kind = FolderKind.SUBFOLDER;

    private int order;

    @Builder.Default
    private List<Document> documents = new ArrayList<>();

    @Builder.Default
    private List<Folder> subfolders = new ArrayList<>();

    public boolean isEmpty() {
        return documents.isEmpty() && subfolders.isEmpty();
    }

    /**
     * Counts documents in this folder and every nested subfolder.
     */
    public int totalDocumentCount() {
        int count = documents.size();
        for (Folder subfolder : subfolders) {
            count += subfolder.totalDocumentCount();
        }
        return count;
    }
}
