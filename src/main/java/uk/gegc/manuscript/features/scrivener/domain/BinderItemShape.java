package uk.gegc.manuscript.features.scrivener.domain;

/**
 * How a binder item maps onto the document tree, decided by whether it has its own content
 * and whether it has children.
 */
public enum BinderItemShape {
    /** Content, no children: becomes a document. */
    DOCUMENT_ONLY,
    /** Children, no content: becomes a folder. */
    FOLDER_ONLY,
    /** Both: a folder whose first document (order 0) holds the item's own content. */
    BOTH,
    /** Neither: an empty folder kept as a placeholder. */
    EMPTY;

    public static BinderItemShape classify(boolean hasContent, boolean hasChildren) {
        if (hasContent && hasChildren) {
            return BOTH;
        }
        if (hasContent) {
            return DOCUMENT_ONLY;
        }
        if (hasChildren) {
            return FOLDER_ONLY;
        }
        return EMPTY;
    }
}
