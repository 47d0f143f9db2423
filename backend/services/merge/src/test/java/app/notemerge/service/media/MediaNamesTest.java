package app.notemerge.service.media;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class MediaNamesTest {

    @Test
    void normalizesToNfc() {
        assertThat(MediaNames.safeNormalizedFileName("cafe\u0301.jpg")).contains("caf\u00e9.jpg");
        assertThat(MediaNames.safeNormalizedFileName("plain.jpg")).contains("plain.jpg");
    }

    @Test
    void rejectsNamesThatCouldLeaveMediaFolder() {
        assertThat(MediaNames.safeNormalizedFileName("dir/file.jpg")).isEmpty();
        assertThat(MediaNames.safeNormalizedFileName("dir\\file.jpg")).isEmpty();
        assertThat(MediaNames.safeNormalizedFileName("..")).isEmpty();
        assertThat(MediaNames.safeNormalizedFileName(" ")).isEmpty();
        assertThat(MediaNames.safeNormalizedFileName("a\0.jpg")).isEmpty();
    }
}
