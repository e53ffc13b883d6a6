package ai.tidal.cli;

import ai.tidal.events.EventType;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import org.jetbrains.annotations.Nullable;

/**
 * One step of a replay transcript: either an event to publish or the {@code abort} directive.
 *
 * @param lineNumber source line, for error reporting
 * @param type event type to publish; null for the abort directive
 * @param payload event payload, or {@code {stream_id}} for abort
 * @param delayMs pause before this step when replaying in real time
 */
public record TranscriptEntry(int lineNumber, @Nullable EventType type, Map<String, Object> payload, long delayMs) {
    public static final String ABORT = "abort";

    public TranscriptEntry {
        if (delayMs < 0) {
            throw new IllegalArgumentException("delayMs must be non-negative, got: " + delayMs);
        }
        payload = Collections.unmodifiableMap(new LinkedHashMap<>(payload));
    }

    public boolean isAbort() {
        return type == null;
    }
}
