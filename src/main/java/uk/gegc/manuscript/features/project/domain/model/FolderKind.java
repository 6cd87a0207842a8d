package uk.gegc.manuscript.features.project.domain.model;

public enum FolderKind {
    DRAFT,
    RESEARCH,
    TRASH,
    SUBFOLDER
}
