package app.notemerge.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Notes of a merge session grouped by outcome, in processing order.
 */
public class NoteLog {

    private final List<LogNote> newNotes = new ArrayList<>();
    private final List<LogNote> updated = new ArrayList<>();
    private final List<LogNote> duplicate = new ArrayList<>();
    private final List<LogNote> conflicting = new ArrayList<>();
    private int foundNotes;

    public List<LogNote> getNewNotes() {
        return Collections.unmodifiableList(newNotes);
    }

    public List<LogNote> getUpdated() {
        return Collections.unmodifiableList(updated);
    }

    public List<LogNote> getDuplicate() {
        return Collections.unmodifiableList(duplicate);
    }

    public List<LogNote> getConflicting() {
        return Collections.unmodifiableList(conflicting);
    }

    void addNew(LogNote note) {
        newNotes.add(note);
    }

    void addUpdated(LogNote note) {
        updated.add(note);
    }

    void addDuplicate(LogNote note) {
        duplicate.add(note);
    }

    void addConflicting(LogNote note) {
        conflicting.add(note);
    }

    public int getFoundNotes() {
        return foundNotes;
    }

    public void setFoundNotes(int foundNotes) {
        this.foundNotes = foundNotes;
    }

    public int loggedCount() {
        return newNotes.size() + updated.size() + duplicate.size() + conflicting.size();
    }
}
