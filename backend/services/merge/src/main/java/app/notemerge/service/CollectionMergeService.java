package app.notemerge.service;

import app.notemerge.collection.TargetCollection;
import app.notemerge.config.MergeProps;
import app.notemerge.model.ImportData;
import app.notemerge.model.NoteImports;
import app.notemerge.model.NoteLog;
import app.notemerge.service.media.MediaUseMap;
import app.notemerge.service.progress.ProgressListener;
import app.notemerge.service.progress.ThrottlingProgressHandler;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

@Service
public class CollectionMergeService {

    private static final Logger log = LoggerFactory.getLogger(CollectionMergeService.class);

    private final NotetypeReconciler notetypeReconciler;
    private final NoteReconciler noteReconciler;
    private final MergeProps props;

    public CollectionMergeService(NotetypeReconciler notetypeReconciler,
                                  NoteReconciler noteReconciler,
                                  MergeProps props) {
        this.notetypeReconciler = notetypeReconciler;
        this.noteReconciler = noteReconciler;
        this.props = props;
    }

    @Transactional
    public NoteImports importNotesAndNotetypes(TargetCollection target,
                                               ImportData data,
                                               MediaUseMap mediaMap,
                                               ProgressListener listener) {
        ThrottlingProgressHandler progress = new ThrottlingProgressHandler(listener, props.progressThrottle());
        return importNotesAndNotetypes(target, data, mediaMap, progress);
    }

    /**
     * Reconciles notetypes first, then notes in package order. Mutations already written
     * stay in place when the session fails; rollback belongs to the enclosing transaction.
     */
    @Transactional
    public NoteImports importNotesAndNotetypes(TargetCollection target,
                                               ImportData data,
                                               MediaUseMap mediaMap,
                                               ThrottlingProgressHandler progress) {
        MergeContext ctx = MergeContext.open(target, mediaMap);
        log.info("Merge started: notetypes={}, notes={}, targetNotes={}",
                data.notetypes().size(), data.notes().size(), ctx.targetNoteCount());
        try {
            notetypeReconciler.importNotetypes(ctx, data.notetypes(), progress);
            noteReconciler.importNotes(ctx, data.notes(), progress);
        } catch (RuntimeException ex) {
            log.warn("Merge failed: processed={}, error={}", ctx.imports().getLog().loggedCount(), summarizeError(ex));
            throw ex;
        }
        NoteLog noteLog = ctx.imports().getLog();
        log.info("Merge finished: found={}, new={}, updated={}, duplicate={}, conflicting={}, remappedNotetypes={}",
                noteLog.getFoundNotes(),
                noteLog.getNewNotes().size(),
                noteLog.getUpdated().size(),
                noteLog.getDuplicate().size(),
                noteLog.getConflicting().size(),
                ctx.remappedNotetypes().size());
        return ctx.imports();
    }

    private String summarizeError(Throwable throwable) {
        String message = throwable.getMessage();
        if (message != null && !message.isBlank()) {
            return message;
        }
        return throwable.getClass().getSimpleName();
    }
}
