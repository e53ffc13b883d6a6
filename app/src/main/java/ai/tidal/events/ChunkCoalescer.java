package ai.tidal.events;

import java.time.Duration;
import java.time.Instant;
import java.util.Objects;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.function.Consumer;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.jetbrains.annotations.Nullable;

/**
 * Merges consecutive {@code stream_chunk} events into fewer, larger ones.
 *
 * <p>Chunks accumulate while they share a stream id and reasoning flag. The buffer is emitted:
 * <ul>
 *   <li>by a timer, at most once per interval;</li>
 *   <li>immediately when a final chunk arrives;</li>
 *   <li>immediately, before the new chunk is buffered, when the stream id or reasoning flag changes;</li>
 *   <li>on {@link #flush()}, which the bus calls before publishing any other event.</li>
 * </ul>
 * The merged text is always the exact concatenation of the merged chunks, in arrival order.
 */
final class ChunkCoalescer {
    private static final Logger logger = LogManager.getLogger(ChunkCoalescer.class);

    private final Duration interval;
    private final ScheduledExecutorService timer;
    private final Consumer<Event> sink;
    private final Object lock = new Object();

    // guarded by lock
    private @Nullable Pending pending;
    private @Nullable ScheduledFuture<?> scheduledFlush;
    private long lastFlushNanos = 0;

    private static final class Pending {
        final String streamId;
        final String role;
        final boolean reasoning;
        final Instant firstArrival;
        final StringBuilder text = new StringBuilder();
        int merged;
        boolean isFinal;

        Pending(String streamId, String role, boolean reasoning, Instant firstArrival) {
            this.streamId = streamId;
            this.role = role;
            this.reasoning = reasoning;
            this.firstArrival = firstArrival;
        }

        boolean accepts(String otherStreamId, boolean otherReasoning) {
            return streamId.equals(otherStreamId) && reasoning == otherReasoning;
        }
    }

    ChunkCoalescer(Duration interval, ScheduledExecutorService timer, Consumer<Event> sink) {
        this.interval = interval;
        this.timer = timer;
        this.sink = sink;
    }

    /**
     * Buffer a chunk event. Emission happens on the calling thread for immediate flushes and on the timer
     * thread otherwise; in both cases under the coalescer lock, so emitted events keep arrival order.
     */
    void offer(Event chunk) {
        var streamId = Objects.requireNonNull(chunk.getString(Payloads.STREAM_ID), "stream_id");
        var role = chunk.getString(Payloads.ROLE, Payloads.ROLE_ASSISTANT);
        var text = chunk.getString(Payloads.CHUNK, "");
        var reasoning = chunk.getBoolean(Payloads.IS_REASONING);
        var isFinal = chunk.getBoolean(Payloads.IS_FINAL);

        synchronized (lock) {
            if (pending != null && !pending.accepts(streamId, reasoning)) {
                emitLocked();
            }
            if (pending == null) {
                pending = new Pending(streamId, role, reasoning, chunk.timestamp());
            }
            pending.text.append(text);
            pending.merged++;
            pending.isFinal = isFinal;

            if (isFinal || interval.isZero()) {
                emitLocked();
            } else if (scheduledFlush == null) {
                long sinceLast = System.nanoTime() - lastFlushNanos;
                long delay = Math.max(0, interval.toNanos() - sinceLast);
                scheduledFlush = timer.schedule(this::timedFlush, delay, TimeUnit.NANOSECONDS);
            }
        }
    }

    private void timedFlush() {
        synchronized (lock) {
            scheduledFlush = null;
            emitLocked();
        }
    }

    /**
     * Emit whatever is buffered now.
     */
    void flush() {
        synchronized (lock) {
            emitLocked();
        }
    }

    /**
     * Discard buffered text without emitting it.
     */
    void clear() {
        synchronized (lock) {
            if (pending != null) {
                logger.debug("Discarding {} buffered chunk(s) for stream {}", pending.merged, pending.streamId);
            }
            pending = null;
            cancelScheduledLocked();
        }
    }

    boolean isEmpty() {
        synchronized (lock) {
            return pending == null;
        }
    }

    private void emitLocked() {
        cancelScheduledLocked();
        var p = pending;
        if (p == null) {
            return;
        }
        pending = null;
        lastFlushNanos = System.nanoTime();
        if (p.text.length() == 0 && !p.isFinal) {
            // only heartbeats were buffered
            return;
        }
        var payload = Payloads.streamChunk(p.streamId, p.role, p.text.toString(), p.reasoning, p.isFinal);
        payload.put(Payloads.MERGED_CHUNKS, p.merged);
        logger.trace("Flushing {} merged chunk(s) for stream {}", p.merged, p.streamId);
        sink.accept(new Event(EventType.STREAM_CHUNK, payload, p.firstArrival));
    }

    private void cancelScheduledLocked() {
        if (scheduledFlush != null) {
            scheduledFlush.cancel(false);
            scheduledFlush = null;
        }
    }
}
