package app.notemerge.model;

import java.util.List;

public record LogNote(
        long id,
        List<String> fields
) {
    public LogNote {
        fields = List.copyOf(fields);
    }
}
