package app.notemerge.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

@ConfigurationProperties(prefix = "app.merge")
public record MergeProps(
        Boolean normalizeNoteText,
        Integer usn,
        Duration progressThrottle
) {
    public MergeProps {
        if (normalizeNoteText == null) {
            normalizeNoteText = true;
        }
        if (usn == null) {
            usn = -1;
        }
        if (progressThrottle == null) {
            progressThrottle = Duration.ofMillis(100);
        }
    }
}
