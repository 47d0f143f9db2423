package app.notemerge.model;

import java.util.List;

/**
 * Notetypes and notes decoded from a foreign package, in package order.
 */
public record ImportData(
        List<Notetype> notetypes,
        List<Note> notes
) {
    public ImportData {
        notetypes = notetypes == null ? List.of() : List.copyOf(notetypes);
        notes = notes == null ? List.of() : List.copyOf(notes);
    }
}
