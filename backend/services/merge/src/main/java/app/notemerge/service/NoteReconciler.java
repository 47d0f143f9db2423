package app.notemerge.service;

import app.notemerge.model.Note;
import app.notemerge.model.NoteMeta;
import app.notemerge.model.Notetype;
import app.notemerge.service.media.MediaReferenceRewriter;
import app.notemerge.service.progress.ImportProgress;
import app.notemerge.service.progress.ThrottlingProgressHandler;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.stereotype.Component;
import org.springframework.web.server.ResponseStatusException;

import java.util.List;
import java.util.Optional;

@Component
public class NoteReconciler {

    private static final Logger log = LoggerFactory.getLogger(NoteReconciler.class);

    /**
     * Added to a colliding note id until it is free. Ids are epoch millis, so collisions
     * are rare and a fixed step settles quickly.
     */
    static final long NOTE_ID_STEP = 999;

    private final MediaReferenceRewriter mediaRewriter;
    private final NotePreparer notePreparer;

    public NoteReconciler(MediaReferenceRewriter mediaRewriter, NotePreparer notePreparer) {
        this.mediaRewriter = mediaRewriter;
        this.notePreparer = notePreparer;
    }

    public void importNotes(MergeContext ctx, List<Note> notes, ThrottlingProgressHandler progress) {
        ThrottlingProgressHandler.Incrementor incrementor = progress.incrementor(ImportProgress.Stage.NOTES);
        ctx.imports().getLog().setFoundNotes(notes.size());
        for (Note note : notes) {
            incrementor.increment();
            importNote(ctx, note);
        }
    }

    void importNote(MergeContext ctx, Note note) {
        Optional<Long> remappedNotetypeId = ctx.remappedNotetype(note.getNotetypeId());
        Optional<NoteMeta> existing = ctx.existingNote(note.getGuid());
        if (existing.isPresent()) {
            NoteMeta existingNote = existing.get();
            if (existingNote.mtime().isBefore(note.getMtime())) {
                if (existingNote.notetypeId() != note.getNotetypeId() || remappedNotetypeId.isPresent()) {
                    // same guid, but a different notetype or a diverged schema
                    log.debug("Conflicting note skipped: guid={}, sourceId={}, targetId={}",
                            note.getGuid(), note.getId(), existingNote.id());
                    ctx.imports().logConflicting(note);
                } else {
                    updateNote(ctx, note, existingNote.id());
                }
            } else {
                ctx.imports().logDuplicate(note, existingNote.id());
            }
        } else {
            // a new note can follow its diverged notetype to the new id
            remappedNotetypeId.ifPresent(note::setNotetypeId);
            addNote(ctx, note);
        }
    }

    private void addNote(MergeContext ctx, Note note) {
        mediaRewriter.rewrite(note, ctx.mediaMap());
        ctx.target().canonifyNoteTags(note, ctx.usn());
        Notetype notetype = expectedNotetype(ctx, note.getNotetypeId());
        notePreparer.prepare(note, notetype, ctx.normalizeNotes());
        note.setUsn(ctx.usn());
        long sourceId = uniquifyNoteId(ctx, note);

        ctx.target().addNoteWithId(note);
        ctx.claimNoteId(note.getId());
        ctx.imports().logNew(note, sourceId);
    }

    private void updateNote(MergeContext ctx, Note note, long targetId) {
        long sourceId = note.getId();
        note.setId(targetId);
        mediaRewriter.rewrite(note, ctx.mediaMap());
        requireExistingNote(ctx, targetId);
        Notetype notetype = expectedNotetype(ctx, note.getNotetypeId());
        ctx.target().canonifyNoteTags(note, ctx.usn());
        notePreparer.prepare(note, notetype, ctx.normalizeNotes());
        note.setModified(ctx.usn());

        ctx.target().updateNote(note);
        ctx.imports().logUpdated(note, sourceId);
    }

    /**
     * Moves the note to a free id and returns the id it arrived with.
     */
    long uniquifyNoteId(MergeContext ctx, Note note) {
        long original = note.getId();
        while (ctx.noteIdTaken(note.getId())) {
            note.setId(note.getId() + NOTE_ID_STEP);
        }
        return original;
    }

    private Notetype expectedNotetype(MergeContext ctx, long notetypeId) {
        return ctx.target().getNotetype(notetypeId)
                .orElseThrow(() -> new ResponseStatusException(HttpStatus.NOT_FOUND, "Notetype not found: " + notetypeId));
    }

    private void requireExistingNote(MergeContext ctx, long noteId) {
        if (ctx.target().getNote(noteId).isEmpty()) {
            throw new ResponseStatusException(HttpStatus.NOT_FOUND, "Note not found: " + noteId);
        }
    }
}
