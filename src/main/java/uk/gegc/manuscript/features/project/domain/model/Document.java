package uk.gegc.manuscript.features.project.domain.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

/**
 * A single piece of prose in the project tree. Content is stored as Markdown.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Document {

    @Builder.Default
    private UUID id = UUID.randomUUID();

    @Builder.Default
    private String title = "";

    @Builder.Default
    private String content = "";

    @Builder.Default
    private String notes = "";

    @Builder.Default
    private String synopsis = "";

    private Instant creationDate;

    /** Sort key among siblings; not unique across the tree. */
    private int order;

    private String labelId;

    private String statusId;

    @Builder.Default
    private List<String> keywords = new ArrayList<>();

    @Builder.Default
    private boolean includeInCompile = true;

    @Builder.Default
    private String colorName = "Brown";

    private String iconName;
}
