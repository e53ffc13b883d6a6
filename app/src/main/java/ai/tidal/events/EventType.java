package ai.tidal.events;

import java.util.Arrays;
import java.util.Locale;
import java.util.Map;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Closed set of event types carried by the {@link EventBus}.
 *
 * <p>Each type declares how the bus treats it:
 * <ul>
 *   <li>{@code deduplicated}: identical content published twice within the dedup window is delivered once.</li>
 *   <li>{@code sideMessage}: a discrete event that must not overtake an active stream; routed through the
 *       installed {@link EventGate} when there is one.</li>
 * </ul>
 */
public enum EventType {
    STREAM_START("stream_start", false, false),
    STREAM_CHUNK("stream_chunk", false, false),
    STREAM_COALESCED("stream_coalesced", false, false),
    STREAM_END("stream_end", false, false),
    MESSAGE("message", true, true),
    TOKEN_UPDATE("token_update", false, false),
    STATUS("status", false, true),
    ERROR("error", false, true),
    TOOL("tool", true, true),
    WARNING("warning", true, true);

    private static final Map<String, EventType> BY_WIRE_NAME =
            Arrays.stream(values()).collect(Collectors.toUnmodifiableMap(EventType::wireName, Function.identity()));

    private final String wireName;
    private final boolean deduplicated;
    private final boolean sideMessage;

    EventType(String wireName, boolean deduplicated, boolean sideMessage) {
        this.wireName = wireName;
        this.deduplicated = deduplicated;
        this.sideMessage = sideMessage;
    }

    /** Name used in transcripts and event logs, e.g. {@code stream_chunk}. */
    public String wireName() {
        return wireName;
    }

    public boolean deduplicated() {
        return deduplicated;
    }

    public boolean sideMessage() {
        return sideMessage;
    }

    /**
     * Resolves a wire name (case-insensitive) to its type.
     *
     * @throws IllegalArgumentException if the name is not one of the known types
     */
    public static EventType fromWireName(String wireName) {
        var type = BY_WIRE_NAME.get(wireName.trim().toLowerCase(Locale.ROOT));
        if (type == null) {
            throw new IllegalArgumentException("Unknown event type: " + wireName);
        }
        return type;
    }

    @Override
    public String toString() {
        return wireName;
    }
}
