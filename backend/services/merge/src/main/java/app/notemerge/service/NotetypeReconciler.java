package app.notemerge.service;

import app.notemerge.model.CardTemplate;
import app.notemerge.model.Notetype;
import app.notemerge.model.NotetypeField;
import app.notemerge.service.progress.ImportProgress;
import app.notemerge.service.progress.ThrottlingProgressHandler;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.stereotype.Component;
import org.springframework.web.server.ResponseStatusException;

import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

@Component
public class NotetypeReconciler {

    private static final Logger log = LoggerFactory.getLogger(NotetypeReconciler.class);

    public void importNotetypes(MergeContext ctx, List<Notetype> notetypes, ThrottlingProgressHandler progress) {
        int done = 0;
        for (Notetype notetype : notetypes) {
            validate(notetype);
            Optional<Notetype> existing = ctx.target().getNotetype(notetype.getId());
            if (existing.isPresent()) {
                mergeOrRemap(ctx, notetype, existing.get());
            } else {
                addNotetype(ctx, notetype);
            }
            done++;
            progress.update(new ImportProgress(ImportProgress.Stage.NOTETYPES, done), true);
        }
    }

    private void mergeOrRemap(MergeContext ctx, Notetype incoming, Notetype existing) {
        if (SchemaFingerprint.sameSchema(incoming, existing)) {
            if (incoming.getMtime().isAfter(existing.getMtime())) {
                updateNotetype(ctx, incoming);
            }
        } else {
            addNotetypeWithRemappedId(ctx, incoming);
        }
    }

    private void addNotetype(MergeContext ctx, Notetype notetype) {
        ensureNameUnique(ctx, notetype);
        notetype.setUsn(ctx.usn());
        ctx.target().addNotetypeWithId(notetype);
    }

    private void updateNotetype(MergeContext ctx, Notetype notetype) {
        ensureNameUnique(ctx, notetype);
        notetype.setUsn(ctx.usn());
        ctx.target().updateNotetype(notetype);
    }

    private void addNotetypeWithRemappedId(MergeContext ctx, Notetype notetype) {
        long oldId = notetype.getId();
        notetype.setId(0);
        ensureNameUnique(ctx, notetype);
        notetype.setUsn(ctx.usn());
        long newId = ctx.target().addNotetypeWithNewId(notetype);
        ctx.remapNotetype(oldId, newId);
        log.info("Notetype schema diverged, imported as copy: name={}, oldId={}, newId={}",
                notetype.getName(), oldId, newId);
    }

    private void ensureNameUnique(MergeContext ctx, Notetype notetype) {
        String original = notetype.getName();
        ctx.target().ensureNotetypeNameUnique(notetype);
        if (!original.equals(notetype.getName())) {
            log.debug("Renamed imported notetype: from={}, to={}", original, notetype.getName());
        }
    }

    static void validate(Notetype notetype) {
        if (notetype.getName() == null || notetype.getName().isBlank()) {
            throw new ResponseStatusException(HttpStatus.BAD_REQUEST, "Notetype " + notetype.getId() + " has no name");
        }
        if (notetype.getFields().isEmpty()) {
            throw new ResponseStatusException(HttpStatus.BAD_REQUEST, "Notetype " + notetype.getName() + " has no fields");
        }
        if (notetype.getTemplates().isEmpty()) {
            throw new ResponseStatusException(HttpStatus.BAD_REQUEST, "Notetype " + notetype.getName() + " has no templates");
        }
        Set<String> fieldNames = new HashSet<>();
        for (NotetypeField field : notetype.getFields()) {
            if (field.name() == null || field.name().isBlank() || !fieldNames.add(field.name())) {
                throw new ResponseStatusException(HttpStatus.BAD_REQUEST,
                        "Notetype " + notetype.getName() + " has a blank or repeated field name");
            }
        }
        Set<String> templateNames = new HashSet<>();
        for (CardTemplate template : notetype.getTemplates()) {
            if (template.name() == null || template.name().isBlank() || !templateNames.add(template.name())) {
                throw new ResponseStatusException(HttpStatus.BAD_REQUEST,
                        "Notetype " + notetype.getName() + " has a blank or repeated template name");
            }
        }
        int sortIndex = notetype.getSortFieldIndex();
        if (sortIndex < 0 || sortIndex >= notetype.getFields().size()) {
            throw new ResponseStatusException(HttpStatus.BAD_REQUEST,
                    "Notetype " + notetype.getName() + " sorts by missing field " + sortIndex);
        }
    }
}
