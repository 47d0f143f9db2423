package app.notemerge.support;

import app.notemerge.model.CardTemplate;
import app.notemerge.model.Note;
import app.notemerge.model.Notetype;
import app.notemerge.model.NotetypeField;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

public final class TestNotes {

    public static final long BASIC_ID = 1_600_000_000_000L;
    public static final Instant BASE_TIME = Instant.parse("2024-05-01T10:00:00Z");

    private TestNotes() {
    }

    public static Notetype basic() {
        return notetype(BASIC_ID, "Basic", List.of("Front", "Back"), List.of("Card 1"));
    }

    public static Notetype notetype(long id, String name, List<String> fieldNames, List<String> templateNames) {
        List<NotetypeField> fields = new ArrayList<>();
        for (int i = 0; i < fieldNames.size(); i++) {
            fields.add(new NotetypeField(fieldNames.get(i), i));
        }
        List<CardTemplate> templates = new ArrayList<>();
        for (int i = 0; i < templateNames.size(); i++) {
            templates.add(new CardTemplate(templateNames.get(i), i, "{{" + fieldNames.get(0) + "}}", "{{FrontSide}}"));
        }
        return new Notetype(id, name, BASE_TIME, 0, fields, templates, ".card {}", 0);
    }

    public static Note note(long id, String guid, long notetypeId, String... fields) {
        return new Note(id, guid, notetypeId, BASE_TIME, 0, List.of(), List.of(fields));
    }

    public static Note copy(Note note) {
        Note copy = new Note(
                note.getId(),
                note.getGuid(),
                note.getNotetypeId(),
                note.getMtime(),
                note.getUsn(),
                note.getTags(),
                note.getFields()
        );
        copy.setSortField(note.getSortField());
        copy.setChecksum(note.getChecksum());
        return copy;
    }

    public static Notetype copy(Notetype notetype) {
        return new Notetype(
                notetype.getId(),
                notetype.getName(),
                notetype.getMtime(),
                notetype.getUsn(),
                notetype.getFields(),
                notetype.getTemplates(),
                notetype.getCss(),
                notetype.getSortFieldIndex()
        );
    }
}
