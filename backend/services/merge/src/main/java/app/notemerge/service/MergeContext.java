package app.notemerge.service;

import app.notemerge.collection.TargetCollection;
import app.notemerge.model.NoteImports;
import app.notemerge.model.NoteMeta;
import app.notemerge.service.media.MediaUseMap;

import java.util.Collections;
import java.util.HashMap;
import java.util.HashSet;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * State of one merge session. Owned by the session and handed from the notetype phase to
 * the note phase; never shared between sessions.
 * <p>
 * The GUID index is a snapshot taken when the session opens and is not refreshed while
 * notes are inserted. The id set is, so that ids allocated earlier in the batch are not
 * reused.
 */
public class MergeContext {

    private final TargetCollection target;
    private final int usn;
    private final boolean normalizeNotes;
    private final Map<Long, Long> remappedNotetypes = new HashMap<>();
    private final Map<String, NoteMeta> targetGuids;
    private final Set<Long> targetIds;
    private final MediaUseMap mediaMap;
    private final NoteImports imports = new NoteImports();

    MergeContext(TargetCollection target,
                 int usn,
                 boolean normalizeNotes,
                 Map<String, NoteMeta> targetGuids,
                 Set<Long> targetIds,
                 MediaUseMap mediaMap) {
        this.target = target;
        this.usn = usn;
        this.normalizeNotes = normalizeNotes;
        this.targetGuids = Collections.unmodifiableMap(new HashMap<>(targetGuids));
        this.targetIds = new HashSet<>(targetIds);
        this.mediaMap = mediaMap;
    }

    public static MergeContext open(TargetCollection target, MediaUseMap mediaMap) {
        return new MergeContext(
                target,
                target.usn(),
                target.normalizeNoteText(),
                target.noteGuidMap(),
                target.allNoteIds(),
                mediaMap == null ? new MediaUseMap() : mediaMap
        );
    }

    public TargetCollection target() {
        return target;
    }

    public int usn() {
        return usn;
    }

    public boolean normalizeNotes() {
        return normalizeNotes;
    }

    public Optional<NoteMeta> existingNote(String guid) {
        return Optional.ofNullable(targetGuids.get(guid));
    }

    public int targetNoteCount() {
        return targetIds.size();
    }

    public boolean noteIdTaken(long noteId) {
        return targetIds.contains(noteId);
    }

    public void claimNoteId(long noteId) {
        targetIds.add(noteId);
    }

    public void remapNotetype(long sourceId, long targetId) {
        remappedNotetypes.put(sourceId, targetId);
    }

    public Optional<Long> remappedNotetype(long sourceId) {
        return Optional.ofNullable(remappedNotetypes.get(sourceId));
    }

    public Map<Long, Long> remappedNotetypes() {
        return Collections.unmodifiableMap(remappedNotetypes);
    }

    public MediaUseMap mediaMap() {
        return mediaMap;
    }

    public NoteImports imports() {
        return imports;
    }
}
