package app.notemerge.service.media;

import app.notemerge.model.Note;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Optional;

@Component
public class MediaReferenceRewriter {

    public void rewrite(Note note, MediaUseMap mediaMap) {
        List<String> fields = note.getFields();
        for (int i = 0; i < fields.size(); i++) {
            String field = fields.get(i);
            String rewritten = rewriteField(field, mediaMap);
            if (!rewritten.equals(field)) {
                fields.set(i, rewritten);
            }
        }
    }

    public String rewriteField(String field, MediaUseMap mediaMap) {
        if (field == null) {
            return "";
        }
        return MediaReferences.replace(field, name -> resolve(name, mediaMap));
    }

    Optional<String> resolve(String name, MediaUseMap mediaMap) {
        Optional<String> normalized = MediaNames.safeNormalizedFileName(name);
        if (normalized.isEmpty()) {
            return Optional.empty();
        }
        Optional<MediaEntry> entry = mediaMap.useEntry(normalized.get());
        if (entry.isPresent()) {
            // not normalized, or renamed to avoid a clash in the target
            String target = entry.get().name();
            return target.equals(name) ? Optional.empty() : Optional.of(target);
        }
        // no package file; may point at an existing target file, so keep it normalized
        return normalized.get().equals(name) ? Optional.empty() : normalized;
    }
}
