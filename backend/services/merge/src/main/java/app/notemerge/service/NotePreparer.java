package app.notemerge.service;

import app.notemerge.model.Note;
import app.notemerge.model.Notetype;
import app.notemerge.text.HtmlText;
import org.springframework.stereotype.Component;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.text.Normalizer;
import java.util.ArrayList;
import java.util.List;

@Component
public class NotePreparer {

    private static final String EXTRA_FIELD_SEPARATOR = "; ";

    public void prepare(Note note, Notetype notetype, boolean normalizeText) {
        List<String> fields = fixFieldCount(note.getFields(), Math.max(notetype.getFields().size(), 1));
        if (normalizeText) {
            fields = fields.stream()
                    .map(field -> Normalizer.normalize(field, Normalizer.Form.NFC))
                    .toList();
        }
        note.setFields(fields);

        int sortIndex = Math.min(Math.max(notetype.getSortFieldIndex(), 0), fields.size() - 1);
        note.setSortField(HtmlText.stripHtmlPreservingMediaFilenames(fields.get(sortIndex)));
        note.setChecksum(fieldChecksum(fields.get(0)));
    }

    static List<String> fixFieldCount(List<String> fields, int expected) {
        List<String> out = new ArrayList<>(expected);
        for (String field : fields) {
            out.add(field == null ? "" : field);
        }
        if (out.size() > expected) {
            List<String> extra = out.subList(expected - 1, out.size());
            String joined = String.join(EXTRA_FIELD_SEPARATOR, extra);
            extra.clear();
            out.add(joined);
        }
        while (out.size() < expected) {
            out.add("");
        }
        return out;
    }

    /**
     * First 32 bits of the SHA-1 of the field's text, used for duplicate lookups.
     */
    static long fieldChecksum(String field) {
        String text = HtmlText.stripHtmlPreservingMediaFilenames(field);
        try {
            byte[] digest = MessageDigest.getInstance("SHA-1").digest(text.getBytes(StandardCharsets.UTF_8));
            return ((long) (digest[0] & 0xff) << 24)
                    | ((digest[1] & 0xff) << 16)
                    | ((digest[2] & 0xff) << 8)
                    | (digest[3] & 0xff);
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-1 not available", e);
        }
    }
}
