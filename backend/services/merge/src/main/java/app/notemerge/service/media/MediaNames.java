package app.notemerge.service.media;

import java.text.Normalizer;
import java.util.Optional;

public final class MediaNames {

    private MediaNames() {
    }

    /**
     * Returns the NFC form of a referenced filename, or empty when the name could escape
     * the media folder.
     */
    public static Optional<String> safeNormalizedFileName(String name) {
        if (!isSafe(name)) {
            return Optional.empty();
        }
        return Optional.of(Normalizer.normalize(name, Normalizer.Form.NFC));
    }

    public static boolean isSafe(String name) {
        if (name == null || name.isBlank()) {
            return false;
        }
        if (name.equals(".") || name.equals("..")) {
            return false;
        }
        return name.indexOf('/') < 0 && name.indexOf('\\') < 0 && name.indexOf('\0') < 0;
    }
}
