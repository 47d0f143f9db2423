package app.notemerge.collection;

import app.notemerge.model.Note;
import app.notemerge.model.NoteMeta;
import app.notemerge.model.Notetype;

import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Storage of the collection notes are merged into. A merge session holds the only
 * mutable handle for its whole duration.
 */
public interface TargetCollection {

    /**
     * Revision stamp for records written during the session.
     */
    int usn();

    boolean normalizeNoteText();

    Optional<Notetype> getNotetype(long notetypeId);

    /**
     * Renames {@code notetype} in place until no other notetype uses its name.
     */
    void ensureNotetypeNameUnique(Notetype notetype);

    void addNotetypeWithId(Notetype notetype);

    /**
     * Stores {@code notetype} under a freshly allocated id, which is also set on it.
     *
     * @return the allocated id
     */
    long addNotetypeWithNewId(Notetype notetype);

    void updateNotetype(Notetype notetype);

    Optional<Note> getNote(long noteId);

    void addNoteWithId(Note note);

    void updateNote(Note note);

    Set<Long> allNoteIds();

    Map<String, NoteMeta> noteGuidMap();

    void canonifyNoteTags(Note note, int usn);
}
