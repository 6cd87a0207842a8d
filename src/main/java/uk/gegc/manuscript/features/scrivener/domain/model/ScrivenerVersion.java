package uk.gegc.manuscript.features.scrivener.domain.model;

/**
 * On-disk layout of a project bundle.
 * V2 stores content as {@code Files/Docs/<id>.rtf}; V3 as {@code Files/Data/<uuid>/content.rtf}.
 */
public enum ScrivenerVersion {
    V2,
    V3
}
