package app.notemerge.service.media;

/**
 * A media file of the package, resolved to the name it has in the target collection.
 */
public record MediaEntry(
        String name,
        String sha1,
        int index,
        long size
) {
}
