package app.notemerge.service.media;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Package media keyed by normalized filename. Entries looked up while rewriting notes are
 * flagged as used, so only referenced files get copied afterwards.
 */
public class MediaUseMap {

    private final Map<String, UsageEntry> checked = new LinkedHashMap<>();
    private final List<MediaEntry> unchecked = new ArrayList<>();

    public void addChecked(String normalizedName, MediaEntry entry) {
        checked.put(normalizedName, new UsageEntry(entry));
    }

    public void addUnchecked(MediaEntry entry) {
        unchecked.add(entry);
    }

    public Optional<MediaEntry> useEntry(String normalizedName) {
        UsageEntry usage = checked.get(normalizedName);
        if (usage == null) {
            return Optional.empty();
        }
        usage.used = true;
        return Optional.of(usage.entry);
    }

    public boolean isUsed(String normalizedName) {
        UsageEntry usage = checked.get(normalizedName);
        return usage != null && usage.used;
    }

    public List<MediaEntry> usedEntries() {
        return checked.values().stream()
                .filter(usage -> usage.used)
                .map(usage -> usage.entry)
                .toList();
    }

    public List<MediaEntry> uncheckedEntries() {
        return Collections.unmodifiableList(unchecked);
    }

    int size() {
        return checked.size();
    }

    private static final class UsageEntry {
        private final MediaEntry entry;
        private boolean used;

        private UsageEntry(MediaEntry entry) {
            this.entry = entry;
        }
    }
}
