package app.notemerge.service.progress;

public record ImportProgress(
        Stage stage,
        int count
) {
    public enum Stage {
        NOTETYPES,
        NOTES
    }
}
