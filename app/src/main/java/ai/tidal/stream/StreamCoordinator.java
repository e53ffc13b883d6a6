package ai.tidal.stream;

import ai.tidal.config.TidalConfig;
import ai.tidal.events.Event;
import ai.tidal.events.EventBus;
import ai.tidal.events.EventGate;
import ai.tidal.events.EventHandler;
import ai.tidal.events.EventType;
import ai.tidal.events.Payloads;
import java.time.Clock;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.jetbrains.annotations.Nullable;

/**
 * Turns raw {@code stream_chunk} events into one logical turn of output and keeps side messages in
 * chronological order around it.
 *
 * <p>State machine ({@link StreamState}):
 * <ul>
 *   <li>IDLE + chunk for S: start session S, publish {@code stream_start}.</li>
 *   <li>ACTIVE(S) + chunk for S: append to content or reasoning, publish a {@code stream_coalesced} snapshot.</li>
 *   <li>ACTIVE(S) + chunk for T: S is abandoned without any end event; T starts. Later chunks for S are
 *       dropped.</li>
 *   <li>ACTIVE(S) + final chunk for S: publish {@code stream_end} and the finalized {@code message}, release the
 *       queued side messages in arrival order, return to IDLE.</li>
 * </ul>
 * Side messages (see {@link EventType#sideMessage()}) arriving while ACTIVE are queued; while IDLE they pass
 * straight through, except messages that repeat the last finalized turn for the same role.
 *
 * <p>The coordinator is both a subscriber and the bus's {@link EventGate}, so chunks and side messages reach it
 * on a single serial lane in publish order. All output goes through {@link EventBus#deliver(Event)}.
 */
public final class StreamCoordinator implements EventHandler, EventGate {
    private static final Logger logger = LogManager.getLogger(StreamCoordinator.class);

    private static final int SUPERSEDED_HISTORY = 64;

    private final EventBus bus;
    private final DuplicateMessagePolicy duplicatePolicy;
    private final boolean strictInvariants;
    private final Clock clock;

    // all mutable state guarded by this
    private StreamState state = StreamState.IDLE;
    private @Nullable StreamSession active;
    private final Deque<Event> pending = new ArrayDeque<>();
    private final Map<String, String> lastFinalizedByRole = new HashMap<>();
    private final Set<String> superseded = new LinkedHashSet<>();
    private int turn = 0;

    public StreamCoordinator(EventBus bus, TidalConfig config) {
        this(
                bus,
                new PrefixDuplicatePolicy(config.duplicatePrefixLength(), config.normalizeContent()),
                config.strictInvariants(),
                Clock.systemUTC());
    }

    public StreamCoordinator(
            EventBus bus, DuplicateMessagePolicy duplicatePolicy, boolean strictInvariants, Clock clock) {
        this.bus = bus;
        this.duplicatePolicy = duplicatePolicy;
        this.strictInvariants = strictInvariants;
        this.clock = clock;
    }

    /**
     * Subscribe to chunk events and take ownership of side messages.
     */
    public void attach() {
        bus.subscribe(EventType.STREAM_CHUNK, this);
        bus.installGate(this);
        logger.debug("StreamCoordinator attached");
    }

    public void detach() {
        bus.unsubscribe(EventType.STREAM_CHUNK, this);
        bus.removeGate(this);
        logger.debug("StreamCoordinator detached");
    }

    @Override
    public CompletableFuture<Void> handle(Event event) {
        if (event.type() == EventType.STREAM_CHUNK) {
            onChunk(event);
        } else {
            logger.debug("Ignoring unexpected {} delivered to coordinator", event.type());
        }
        return CompletableFuture.completedFuture(null);
    }

    @Override
    public void admit(Event event) {
        onSideMessage(event);
    }

    /**
     * Process one (possibly merged) chunk event.
     */
    public synchronized void onChunk(Event chunk) {
        verifyState();
        var streamId = chunk.getString(Payloads.STREAM_ID);
        if (streamId == null) {
            logger.warn("Ignoring stream_chunk without stream_id: {}", chunk.payload());
            return;
        }
        var text = chunk.getString(Payloads.CHUNK, "");
        var isReasoning = chunk.getBoolean(Payloads.IS_REASONING);
        var isFinal = chunk.getBoolean(Payloads.IS_FINAL);

        if (text.isEmpty() && !isFinal) {
            logger.trace("Heartbeat chunk for stream {}", streamId);
            return;
        }
        if (superseded.contains(streamId)) {
            logger.debug("Dropping late chunk for superseded stream {}", streamId);
            return;
        }

        var session = active;
        if (session != null && !session.streamId().equals(streamId)) {
            logger.info(
                    "Stream {} superseded by {}; discarding {} chars of content",
                    session.streamId(),
                    streamId,
                    session.content().length());
            rememberSuperseded(session.streamId());
            session = null;
            active = null;
            state = StreamState.IDLE;
        }

        if (session == null) {
            session = new StreamSession(streamId, chunk.getString(Payloads.ROLE, Payloads.ROLE_ASSISTANT), clock.instant());
            active = session;
            state = StreamState.ACTIVE;
            var start = new LinkedHashMap<String, Object>();
            start.put(Payloads.STREAM_ID, streamId);
            start.put(Payloads.ROLE, session.role());
            emit(EventType.STREAM_START, start);
        }

        session.append(text, isReasoning, mergedChunks(chunk));
        if (!text.isEmpty()) {
            var snapshot = new LinkedHashMap<String, Object>();
            snapshot.put(Payloads.STREAM_ID, streamId);
            snapshot.put(Payloads.ROLE, session.role());
            snapshot.put(Payloads.CONTENT_SO_FAR, session.content());
            snapshot.put(Payloads.REASONING_SO_FAR, session.reasoning());
            emit(EventType.STREAM_COALESCED, snapshot);
        }

        if (isFinal) {
            finalizeSession(session);
        }
    }

    private void rememberSuperseded(String streamId) {
        superseded.add(streamId);
        if (superseded.size() > SUPERSEDED_HISTORY) {
            var oldest = superseded.iterator();
            oldest.next();
            oldest.remove();
        }
    }

    private static int mergedChunks(Event chunk) {
        var merged = chunk.get(Payloads.MERGED_CHUNKS);
        return merged instanceof Number n ? n.intValue() : 1;
    }

    private void finalizeSession(StreamSession session) {
        emit(EventType.STREAM_END, streamEndPayload(session, false));

        var content = session.content();
        var reasoning = session.reasoning();
        var metadata = new LinkedHashMap<String, Object>();
        metadata.put(Payloads.STREAM_ID, session.streamId());
        metadata.put(Payloads.STREAMED, true);
        metadata.put(Payloads.HAS_REASONING, !reasoning.isEmpty());
        metadata.put(Payloads.CHUNK_COUNT, session.chunkCount());
        if (!reasoning.isEmpty()) {
            metadata.put(Payloads.REASONING, reasoning);
        }
        if (content.isEmpty()) {
            metadata.put(Payloads.WAS_EMPTY, true);
        }
        var message = Payloads.message(session.role(), content, Payloads.CATEGORY_DIALOG, metadata);
        message.put(Payloads.TURN, turn);
        emit(EventType.MESSAGE, message);

        if (!content.isBlank()) {
            lastFinalizedByRole.put(session.role(), content);
        }
        logger.debug("Finalized {}; releasing {} pending message(s)", session, pending.size());

        active = null;
        state = StreamState.IDLE;
        releasePending();
    }

    private synchronized void onSideMessage(Event event) {
        if (active != null) {
            pending.addLast(event);
            logger.debug("Queued {} while stream {} is active", event.type(), active.streamId());
            return;
        }
        release(event);
    }

    private void releasePending() {
        while (!pending.isEmpty()) {
            release(pending.removeFirst());
        }
    }

    private void release(Event event) {
        if (event.type() != EventType.MESSAGE) {
            bus.deliver(event);
            return;
        }
        var role = event.getString(Payloads.ROLE, "unknown");
        var content = event.getString(Payloads.CONTENT, "");
        if (Payloads.ROLE_USER.equals(role)) {
            turn++;
            lastFinalizedByRole.clear();
            logger.debug("User message starts turn {}", turn);
        } else {
            var last = lastFinalizedByRole.get(role);
            if (last != null && duplicatePolicy.isDuplicate(content, last)) {
                logger.debug("Suppressing {} message that repeats the finalized stream", role);
                return;
            }
        }
        bus.deliver(new Event(event.type(), Payloads.with(event.payload(), Payloads.TURN, turn), event.timestamp()));
    }

    /**
     * Abandon the active stream on user interrupt: publishes {@code stream_end} with {@code aborted=true}, no
     * finalized message, and releases queued side messages.
     *
     * @throws StreamInvariantException in strict mode, if {@code streamId} is not the active stream
     */
    public synchronized void abort(String streamId) {
        var session = active;
        if (session == null || !session.streamId().equals(streamId)) {
            invariantViolation("abort for stream " + streamId + " but active stream is "
                    + (session == null ? "none" : session.streamId()));
            return;
        }
        logger.info("Stream {} aborted after {} chunk(s)", streamId, session.chunkCount());
        emit(EventType.STREAM_END, streamEndPayload(session, true));
        active = null;
        state = StreamState.IDLE;
        releasePending();
    }

    /**
     * Drop the session, queued side messages, superseded stream ids and turn state. Nothing is published.
     */
    public synchronized void reset() {
        if (!pending.isEmpty()) {
            logger.debug("Reset discards {} pending message(s)", pending.size());
        }
        active = null;
        state = StreamState.IDLE;
        pending.clear();
        superseded.clear();
        lastFinalizedByRole.clear();
        turn = 0;
    }

    public synchronized StreamState state() {
        return state;
    }

    public synchronized Optional<String> activeStreamId() {
        return Optional.ofNullable(active).map(StreamSession::streamId);
    }

    public synchronized int pendingCount() {
        return pending.size();
    }

    public synchronized int currentTurn() {
        return turn;
    }

    private void verifyState() {
        if ((state == StreamState.ACTIVE) != (active != null)) {
            invariantViolation("state " + state + " inconsistent with session " + active);
        }
    }

    private void invariantViolation(String detail) {
        logger.error("Stream invariant violated (producer contract breach): {}", detail);
        if (strictInvariants) {
            throw new StreamInvariantException(detail);
        }
        active = null;
        state = StreamState.IDLE;
        releasePending();
    }

    private static Map<String, Object> streamEndPayload(StreamSession session, boolean aborted) {
        var payload = new LinkedHashMap<String, Object>();
        payload.put(Payloads.STREAM_ID, session.streamId());
        payload.put(Payloads.ROLE, session.role());
        payload.put(Payloads.CHUNK_COUNT, session.chunkCount());
        payload.put(Payloads.ABORTED, aborted);
        return payload;
    }

    private void emit(EventType type, Map<String, Object> payload) {
        bus.deliver(new Event(type, payload, clock.instant()));
    }
}
