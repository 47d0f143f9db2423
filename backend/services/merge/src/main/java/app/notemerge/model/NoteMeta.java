package app.notemerge.model;

import java.time.Instant;

/**
 * Lightweight projection of a target note, keyed by GUID in the merge index.
 */
public record NoteMeta(
        long id,
        Instant mtime,
        long notetypeId
) {
}
