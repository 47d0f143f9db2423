package app.notemerge.service.media;

import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;

class MediaReferencesTest {

    @Test
    void findsHtmlAndSoundReferences() {
        List<String> seen = new ArrayList<>();
        String field = "<img class=x src=\"a.png\"><audio src='b.mp3'></audio><object data=c.svg></object>[sound:d.ogg]"
                + "<video controls src=\"e.mp4\"><source src=\"f.webm\"></video>";

        MediaReferences.replace(field, name -> {
            seen.add(name);
            return Optional.empty();
        });

        assertThat(seen).containsExactly("a.png", "b.mp3", "c.svg", "e.mp4", "f.webm", "d.ogg");
    }

    @Test
    void decodesAndReescapesAttributeValues() {
        List<String> seen = new ArrayList<>();

        String result = MediaReferences.replace("<img src=\"a&amp;b.png\">", name -> {
            seen.add(name);
            return Optional.of("c&d.png");
        });

        assertThat(seen).containsExactly("a&b.png");
        assertThat(result).isEqualTo("<img src=\"c&amp;d.png\">");
    }

    @Test
    void quotesUnquotedValueWhenReplacementHasSpaces() {
        String result = MediaReferences.replace("<img src=a.png>", name -> Optional.of("a b.png"));

        assertThat(result).isEqualTo("<img src=\"a b.png\">");
    }

    @Test
    void returnsSameInstanceWhenNothingChanges() {
        String field = "no media here";

        assertThat(MediaReferences.replace(field, name -> Optional.of("x"))).isSameAs(field);
    }
}
