package ai.tidal.io;

import ai.tidal.events.Event;
import ai.tidal.events.EventType;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import java.time.Instant;
import java.util.Map;

/**
 * One line of the diagnostic event log.
 *
 * @param seq monotonically increasing sequence number, starting at 1
 * @param timestamp arrival time of the event, epoch milliseconds
 * @param type wire name of the event type
 * @param payload the event payload
 */
@JsonPropertyOrder({"seq", "timestamp", "type", "payload"})
public record EventLogEntry(
        @JsonProperty("seq") long seq,
        @JsonProperty("timestamp") long timestamp,
        @JsonProperty("type") String type,
        @JsonProperty("payload") Map<String, Object> payload) {

    public EventLogEntry {
        if (seq < 0) {
            throw new IllegalArgumentException("seq must be non-negative, got: " + seq);
        }
        if (type.isBlank()) {
            throw new IllegalArgumentException("type must not be blank");
        }
        payload = payload == null ? Map.of() : payload;
    }

    public static EventLogEntry of(long seq, Event event) {
        return new EventLogEntry(seq, event.timestamp().toEpochMilli(), event.type().wireName(), event.payload());
    }

    /**
     * Rebuild the event this entry was recorded from.
     *
     * @throws IllegalArgumentException if {@link #type()} is not a known wire name
     */
    public Event toEvent() {
        return new Event(EventType.fromWireName(type), payload, Instant.ofEpochMilli(timestamp));
    }
}
