package ai.tidal.events;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import org.jetbrains.annotations.Nullable;

/**
 * A single immutable event on the bus.
 *
 * @param type the event type
 * @param payload type-specific key/value data; copied and wrapped unmodifiable on construction
 * @param timestamp arrival time assigned by the bus
 */
public record Event(EventType type, Map<String, Object> payload, Instant timestamp) {

    public Event {
        Objects.requireNonNull(type, "type");
        Objects.requireNonNull(timestamp, "timestamp");
        // LinkedHashMap rather than Map.copyOf: payloads may carry null values (e.g. error details)
        payload = Collections.unmodifiableMap(new LinkedHashMap<>(payload));
    }

    public static Event of(EventType type, Map<String, Object> payload) {
        return new Event(type, payload, Instant.now());
    }

    /**
     * Returns a copy of this event stamped with a new arrival time.
     */
    public Event withTimestamp(Instant arrival) {
        return new Event(type, payload, arrival);
    }

    public @Nullable Object get(String key) {
        return payload.get(key);
    }

    /**
     * String value for {@code key}, or {@code defaultValue} when absent or null.
     * Non-string values are rendered with {@link String#valueOf(Object)}.
     */
    public String getString(String key, String defaultValue) {
        var value = payload.get(key);
        return value == null ? defaultValue : String.valueOf(value);
    }

    public @Nullable String getString(String key) {
        var value = payload.get(key);
        return value == null ? null : String.valueOf(value);
    }

    /**
     * Boolean value for {@code key}. Accepts {@link Boolean} and the strings "true"/"false".
     */
    public boolean getBoolean(String key) {
        var value = payload.get(key);
        if (value instanceof Boolean b) {
            return b;
        }
        return value != null && Boolean.parseBoolean(value.toString());
    }

    @SuppressWarnings("unchecked")
    public Map<String, Object> getMap(String key) {
        var value = payload.get(key);
        if (value instanceof Map<?, ?> map) {
            return (Map<String, Object>) map;
        }
        return Map.of();
    }

    @Override
    public String toString() {
        return "Event[" + type.wireName() + " " + payload + "]";
    }
}
