package app.notemerge.model;

import app.notemerge.support.TestNotes;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class NoteImportsTest {

    @Test
    void duplicateLogsTargetIdAndMapsSourceIdToIt() {
        NoteImports imports = new NoteImports();
        Note note = TestNotes.note(10, "g", 1, "<b>x</b>");

        imports.logDuplicate(note, 99);

        assertThat(imports.getIdMap()).containsEntry(10L, 99L);
        assertThat(imports.getLog().getDuplicate()).singleElement().satisfies(logNote -> {
            assertThat(logNote.id()).isEqualTo(99L);
            assertThat(logNote.fields()).containsExactly("x");
        });
    }

    @Test
    void newAndUpdatedKeepSourceIdAsKey() {
        NoteImports imports = new NoteImports();
        Note added = TestNotes.note(1_999, "a", 1, "a");
        Note updated = TestNotes.note(50, "b", 1, "b");

        imports.logNew(added, 1_000);
        imports.logUpdated(updated, 7);

        assertThat(imports.getIdMap()).containsEntry(1_000L, 1_999L).containsEntry(7L, 50L);
        assertThat(imports.getLog().getNewNotes()).hasSize(1);
        assertThat(imports.getLog().getUpdated()).hasSize(1);
    }

    @Test
    void conflictingIsLoggedWithoutMapping() {
        NoteImports imports = new NoteImports();

        imports.logConflicting(TestNotes.note(3, "c", 1, "c"));

        assertThat(imports.getIdMap()).isEmpty();
        assertThat(imports.getLog().getConflicting()).hasSize(1);
        assertThat(imports.getLog().loggedCount()).isEqualTo(1);
    }

    @Test
    void logListsCannotBeChangedByCallers() {
        NoteImports imports = new NoteImports();
        imports.logNew(TestNotes.note(1, "a", 1, "a"), 1);
        NoteLog log = imports.getLog();
        LogNote extra = new LogNote(2, List.of("b"));

        assertThatThrownBy(() -> log.getNewNotes().add(extra)).isInstanceOf(UnsupportedOperationException.class);
        assertThatThrownBy(() -> log.getUpdated().add(extra)).isInstanceOf(UnsupportedOperationException.class);
        assertThatThrownBy(() -> log.getDuplicate().add(extra)).isInstanceOf(UnsupportedOperationException.class);
        assertThatThrownBy(() -> log.getConflicting().clear()).isInstanceOf(UnsupportedOperationException.class);
        assertThat(log.getNewNotes()).hasSize(1);
    }
}
