package app.notemerge.model;

import app.notemerge.text.HtmlText;

import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Result of a merge session: the outcome log plus the source note id to target note id
 * map consumed by the card import phase.
 */
public class NoteImports {

    private final Map<Long, Long> idMap = new HashMap<>();
    private final NoteLog log = new NoteLog();

    public void logNew(Note note, long sourceId) {
        idMap.put(sourceId, note.getId());
        log.addNew(toLogNote(note));
    }

    public void logUpdated(Note note, long sourceId) {
        idMap.put(sourceId, note.getId());
        log.addUpdated(toLogNote(note));
    }

    public void logDuplicate(Note note, long targetId) {
        idMap.put(note.getId(), targetId);
        // the logged id refers to the note in the target collection
        note.setId(targetId);
        log.addDuplicate(toLogNote(note));
    }

    public void logConflicting(Note note) {
        log.addConflicting(toLogNote(note));
    }

    public Map<Long, Long> getIdMap() {
        return Collections.unmodifiableMap(idMap);
    }

    public NoteLog getLog() {
        return log;
    }

    private LogNote toLogNote(Note note) {
        List<String> fields = note.getFields().stream()
                .map(HtmlText::stripHtmlPreservingMediaFilenames)
                .toList();
        return new LogNote(note.getId(), fields);
    }
}
