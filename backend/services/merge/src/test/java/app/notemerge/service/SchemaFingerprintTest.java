package app.notemerge.service;

import app.notemerge.model.Notetype;
import app.notemerge.support.TestNotes;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class SchemaFingerprintTest {

    @Test
    void hashesFieldNamesThenTemplateNamesInOrder() throws Exception {
        Notetype notetype = TestNotes.notetype(1, "Basic", List.of("Front", "Back"), List.of("Card 1"));

        MessageDigest expected = MessageDigest.getInstance("SHA-1");
        expected.update("Front".getBytes(StandardCharsets.UTF_8));
        expected.update("Back".getBytes(StandardCharsets.UTF_8));
        expected.update("Card 1".getBytes(StandardCharsets.UTF_8));

        assertThat(SchemaFingerprint.of(notetype)).isEqualTo(expected.digest());
    }

    @Test
    void ignoresIdNameStylingAndFormats() {
        Notetype a = TestNotes.notetype(1, "Basic", List.of("Front", "Back"), List.of("Card 1"));
        Notetype b = TestNotes.notetype(2, "Renamed", List.of("Front", "Back"), List.of("Card 1"));
        b.setCss(".card { font-size: 40px; }");
        b.setSortFieldIndex(1);

        assertThat(SchemaFingerprint.sameSchema(a, b)).isTrue();
    }

    @Test
    void detectsReorderedFields() {
        Notetype a = TestNotes.notetype(1, "Basic", List.of("Front", "Back"), List.of("Card 1"));
        Notetype b = TestNotes.notetype(1, "Basic", List.of("Back", "Front"), List.of("Card 1"));

        assertThat(SchemaFingerprint.sameSchema(a, b)).isFalse();
    }

    @Test
    void detectsAddedTemplate() {
        Notetype a = TestNotes.notetype(1, "Basic", List.of("Front", "Back"), List.of("Card 1"));
        Notetype b = TestNotes.notetype(1, "Basic", List.of("Front", "Back"), List.of("Card 1", "Card 2"));

        assertThat(SchemaFingerprint.sameSchema(a, b)).isFalse();
    }
}
