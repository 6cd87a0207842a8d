package uk.gegc.manuscript.features.scrivener.domain.model;

import java.util.Arrays;

/**
 * Binder item kinds, keyed by the {@code Type} attribute value used in project XML.
 */
public enum BinderItemType {
    DRAFT_FOLDER("DraftFolder"),
    RESEARCH_FOLDER("ResearchFolder"),
    TRASH_FOLDER("TrashFolder"),
    FOLDER("Folder"),
    TEXT("Text"),
    PDF("PDF"),
    IMAGE("Image"),
    WEB_PAGE("WebPage"),
    ROOT("Root"),
    OTHER("Other");

    private final String xmlName;

    BinderItemType(String xmlName) {
        this.xmlName = xmlName;
    }

    public String xmlName() {
        return xmlName;
    }

    public boolean isMedia() {
        return this == PDF || this == IMAGE || this == WEB_PAGE;
    }

    public boolean isFolderLike() {
        return this == FOLDER || this == DRAFT_FOLDER || this == RESEARCH_FOLDER;
    }

    public static BinderItemType fromXml(String value) {
        if (value == null) {
            return TEXT;
        }
        return Arrays.stream(values())
                .filter(type -> type.xmlName.equals(value))
                .findFirst()
                .orElse(OTHER);
    }
}
