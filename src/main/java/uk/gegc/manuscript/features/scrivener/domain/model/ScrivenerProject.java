package uk.gegc.manuscript.features.scrivener.domain.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * Parsed project manifest. {@code version} is filled in from the bundle layout, not the XML.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ScrivenerProject {

    @Builder.Default
    private String title = "Untitled Project";

    @Builder.Default
    private ScrivenerVersion version = ScrivenerVersion.V3;

    @Builder.Default
    private List<BinderItem> binderItems = new ArrayList<>();

    @Builder.Default
    private List<ScrivenerLabel> labels = new ArrayList<>();

    @Builder.Default
    private List<ScrivenerStatus> statuses = new ArrayList<>();

    @Builder.Default
    private List<ScrivenerKeyword> keywords = new ArrayList<>();

    private ScrivenerTargets targets;

    public int totalItemCount() {
        return binderItems.stream().mapToInt(BinderItem::totalCount).sum();
    }
}
