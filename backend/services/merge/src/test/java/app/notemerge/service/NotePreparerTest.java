package app.notemerge.service;

import app.notemerge.model.Note;
import app.notemerge.model.Notetype;
import app.notemerge.support.TestNotes;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class NotePreparerTest {

    private final NotePreparer preparer = new NotePreparer();

    @Test
    void padsMissingFields() {
        assertThat(NotePreparer.fixFieldCount(List.of("a"), 3)).containsExactly("a", "", "");
    }

    @Test
    void joinsSurplusFieldsIntoLastField() {
        assertThat(NotePreparer.fixFieldCount(List.of("a", "b", "c", "d"), 2)).containsExactly("a", "b; c; d");
    }

    @Test
    void computesSortFieldFromConfiguredIndex() {
        Notetype notetype = TestNotes.basic();
        notetype.setSortFieldIndex(1);
        Note note = TestNotes.note(1, "g", notetype.getId(), "front", "<b>back</b> &amp; more");

        preparer.prepare(note, notetype, true);

        assertThat(note.getSortField()).isEqualTo("back & more");
    }

    @Test
    void checksumIgnoresMarkup() {
        assertThat(NotePreparer.fieldChecksum("<i>word</i>")).isEqualTo(NotePreparer.fieldChecksum("word"));
        assertThat(NotePreparer.fieldChecksum("word")).isNotEqualTo(NotePreparer.fieldChecksum("other"));
        assertThat(NotePreparer.fieldChecksum("word")).isBetween(0L, 0xffffffffL);
    }
}
