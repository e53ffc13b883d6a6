package ai.tidal.stream;

import java.time.Instant;

/**
 * One in-progress turn of streamed output. Content and reasoning are append-only and kept apart.
 *
 * <p>Not thread-safe; owned and mutated only by {@link StreamCoordinator} under its lock.
 */
public final class StreamSession {
    private final String streamId;
    private final String role;
    private final Instant startedAt;
    private final StringBuilder content = new StringBuilder();
    private final StringBuilder reasoning = new StringBuilder();
    private int chunkCount = 0;

    StreamSession(String streamId, String role, Instant startedAt) {
        this.streamId = streamId;
        this.role = role;
        this.startedAt = startedAt;
    }

    void append(String text, boolean isReasoning, int chunks) {
        if (isReasoning) {
            reasoning.append(text);
        } else {
            content.append(text);
        }
        chunkCount += chunks;
    }

    public String streamId() {
        return streamId;
    }

    public String role() {
        return role;
    }

    public Instant startedAt() {
        return startedAt;
    }

    public String content() {
        return content.toString();
    }

    public String reasoning() {
        return reasoning.toString();
    }

    public int chunkCount() {
        return chunkCount;
    }

    @Override
    public String toString() {
        return "StreamSession{id=%s, role=%s, chunks=%d, content=%d chars, reasoning=%d chars}"
                .formatted(streamId, role, chunkCount, content.length(), reasoning.length());
    }
}
