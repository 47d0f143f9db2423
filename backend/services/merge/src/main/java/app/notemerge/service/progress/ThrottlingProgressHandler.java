package app.notemerge.service.progress;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.CancellationException;

/**
 * Forwards progress to a listener at most once per throttle interval. A listener that
 * declines an update cancels the import.
 */
public class ThrottlingProgressHandler {

    static final int INCREMENT_REPORT_INTERVAL = 17;

    private final ProgressListener listener;
    private final Duration throttle;
    private final Clock clock;
    private Instant lastUpdate;
    private ImportProgress lastProgress;

    public ThrottlingProgressHandler(ProgressListener listener, Duration throttle) {
        this(listener, throttle, Clock.systemUTC());
    }

    public ThrottlingProgressHandler(ProgressListener listener, Duration throttle, Clock clock) {
        this.listener = listener;
        this.throttle = throttle;
        this.clock = clock;
    }

    public static ThrottlingProgressHandler noop() {
        return new ThrottlingProgressHandler(progress -> true, Duration.ZERO);
    }

    public void update(ImportProgress progress, boolean throttled) {
        lastProgress = progress;
        Instant now = clock.instant();
        if (throttled && lastUpdate != null && now.isBefore(lastUpdate.plus(throttle))) {
            return;
        }
        lastUpdate = now;
        if (!listener.onProgress(progress)) {
            throw new CancellationException("Import cancelled at " + progress.stage() + " " + progress.count());
        }
    }

    public Incrementor incrementor(ImportProgress.Stage stage) {
        return new Incrementor(this, stage);
    }

    ImportProgress lastProgress() {
        return lastProgress;
    }

    public static final class Incrementor {
        private final ThrottlingProgressHandler handler;
        private final ImportProgress.Stage stage;
        private int count;

        private Incrementor(ThrottlingProgressHandler handler, ImportProgress.Stage stage) {
            this.handler = handler;
            this.stage = stage;
        }

        public void increment() {
            count++;
            if (count % INCREMENT_REPORT_INTERVAL == 0) {
                handler.update(new ImportProgress(stage, count), true);
            }
        }

        public int count() {
            return count;
        }
    }
}
