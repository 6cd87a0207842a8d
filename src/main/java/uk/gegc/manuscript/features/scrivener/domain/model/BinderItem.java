package uk.gegc.manuscript.features.scrivener.domain.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * An item in the binder. Any kind may carry its own content and children at the same time.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class BinderItem {

    private String id;

    /** Present in v3 projects only. */
    private String uuid;

    @Builder.Default
    private BinderItemType type = BinderItemType.TEXT;

    @Builder.Default
    private String title = "";

    private Instant created;

    private Instant modified;

    private String synopsis;

    private Integer labelId;

    private Integer statusId;

    @Builder.Default
    private boolean includeInCompile = true;

    @Builder.Default
    private List<BinderItem> children = new ArrayList<>();

    private Integer targetWordCount;

    private String iconFileName;

    @Builder.Default
    private List<Integer> keywordIds = new ArrayList<>();

    /**
     * Counts this item and all of its descendants.
     */
    public int totalCount() {
        int count = 1;
        for (BinderItem child : children) {
            count += child.totalCount();
        }
        return count;
    }

    /**
     * Name of the content directory (v3) or file stem (v2) for this item.
     */
    public String contentKey() {
        return uuid != null && !uuid.isEmpty() ? uuid : id;
    }
}
