package app.notemerge.service.media;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class MediaUseMapTest {

    @Test
    void marksEntriesUsedOnlyWhenLookedUp() {
        MediaUseMap map = new MediaUseMap();
        map.addChecked("a.jpg", new MediaEntry("a.jpg", "01", 0, 10));
        map.addChecked("b.jpg", new MediaEntry("b-1.jpg", "02", 1, 20));
        map.addUnchecked(new MediaEntry("c.jpg", "03", 2, 30));

        assertThat(map.useEntry("b.jpg")).map(MediaEntry::name).contains("b-1.jpg");
        assertThat(map.useEntry("missing.jpg")).isEmpty();

        assertThat(map.usedEntries()).extracting(MediaEntry::index).containsExactly(1);
        assertThat(map.isUsed("a.jpg")).isFalse();
        assertThat(map.uncheckedEntries()).hasSize(1);
        assertThat(map.size()).isEqualTo(2);
    }
}
