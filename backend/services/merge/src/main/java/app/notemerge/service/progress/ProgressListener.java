package app.notemerge.service.progress;

@FunctionalInterface
public interface ProgressListener {

    /**
     * @return {@code false} to ask the running import to stop
     */
    boolean onProgress(ImportProgress progress);
}
