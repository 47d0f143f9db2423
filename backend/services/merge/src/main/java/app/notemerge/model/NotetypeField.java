package app.notemerge.model;

public record NotetypeField(
        String name,
        int ord
) {
}
