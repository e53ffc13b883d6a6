package ai.tidal.events;

import java.util.LinkedHashMap;
import java.util.Map;
import org.jetbrains.annotations.Nullable;

/**
 * Payload keys and builders for the event shapes the core consumes and produces.
 */
public final class Payloads {
    public static final String STREAM_ID = "stream_id";
    public static final String ROLE = "role";
    public static final String CHUNK = "chunk";
    public static final String IS_REASONING = "is_reasoning";
    public static final String IS_FINAL = "is_final";
    public static final String CONTENT_SO_FAR = "content_so_far";
    public static final String REASONING_SO_FAR = "reasoning_so_far";
    public static final String CHUNK_COUNT = "chunk_count";
    public static final String MERGED_CHUNKS = "merged_chunks";
    public static final String ABORTED = "aborted";
    public static final String CONTENT = "content";
    public static final String CATEGORY = "category";
    public static final String METADATA = "metadata";
    public static final String TURN = "turn";
    public static final String STATUS_TYPE = "status_type";
    public static final String DATA = "data";
    public static final String MESSAGE = "message";
    public static final String DETAILS = "details";
    public static final String PHASE = "phase";
    public static final String TOOL_NAME = "tool_name";
    public static final String RESULT = "result";

    // metadata keys on finalized messages
    public static final String STREAMED = "streamed";
    public static final String REASONING = "reasoning";
    public static final String HAS_REASONING = "has_reasoning";
    public static final String WAS_EMPTY = "was_empty";

    public static final String ROLE_ASSISTANT = "assistant";
    public static final String ROLE_USER = "user";
    public static final String ROLE_TOOL = "tool";
    public static final String ROLE_SYSTEM = "system";

    public static final String CATEGORY_DIALOG = "DIALOG";

    private Payloads() {}

    public static Map<String, Object> streamChunk(String streamId, String chunk, boolean isReasoning, boolean isFinal) {
        return streamChunk(streamId, ROLE_ASSISTANT, chunk, isReasoning, isFinal);
    }

    public static Map<String, Object> streamChunk(
            String streamId, String role, String chunk, boolean isReasoning, boolean isFinal) {
        var payload = new LinkedHashMap<String, Object>();
        payload.put(STREAM_ID, streamId);
        payload.put(ROLE, role);
        payload.put(CHUNK, chunk);
        payload.put(IS_REASONING, isReasoning);
        payload.put(IS_FINAL, isFinal);
        return payload;
    }

    public static Map<String, Object> message(String role, String content) {
        return message(role, content, CATEGORY_DIALOG, Map.of());
    }

    public static Map<String, Object> message(
            String role, String content, @Nullable String category, @Nullable Map<String, Object> metadata) {
        var payload = new LinkedHashMap<String, Object>();
        payload.put(ROLE, role);
        payload.put(CONTENT, content);
        payload.put(CATEGORY, category == null ? CATEGORY_DIALOG : category);
        payload.put(METADATA, metadata == null ? Map.of() : metadata);
        return payload;
    }

    public static Map<String, Object> status(String statusType, @Nullable Map<String, Object> data) {
        var payload = new LinkedHashMap<String, Object>();
        payload.put(STATUS_TYPE, statusType);
        payload.put(DATA, data == null ? Map.of() : data);
        return payload;
    }

    public static Map<String, Object> error(String message, @Nullable String details) {
        var payload = new LinkedHashMap<String, Object>();
        payload.put(MESSAGE, message);
        payload.put(DETAILS, details);
        return payload;
    }

    public static Map<String, Object> tool(String phase, String toolName, @Nullable String result) {
        var payload = new LinkedHashMap<String, Object>();
        payload.put(PHASE, phase);
        payload.put(TOOL_NAME, toolName);
        payload.put(CONTENT, phase + " " + toolName + (result == null ? "" : ": " + result));
        if (result != null) {
            payload.put(RESULT, result);
        }
        return payload;
    }

    /**
     * Copy of {@code payload} with {@code key} set to {@code value}.
     */
    public static Map<String, Object> with(Map<String, Object> payload, String key, @Nullable Object value) {
        var copy = new LinkedHashMap<String, Object>(payload);
        copy.put(key, value);
        return copy;
    }
}
