package uk.gegc.manuscript.features.scrivener.domain;

import lombok.Builder;

/**
 * Scrivener import switches.
 *
 * @param importSnapshots      accepted for compatibility; snapshots are not imported
 * @param preserveScrivenerIds reuse binder UUIDs as document and folder ids when they are valid UUIDs
 */
@Builder(toBuilder = true)
public record ImportOptions(
        boolean importSnapshots,
        boolean importTrash,
        boolean importResearch,
        boolean preserveScrivenerIds
) {

    public static ImportOptions defaults() {
        return new ImportOptions(true, false, true, false);
    }
}
