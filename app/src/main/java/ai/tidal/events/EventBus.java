package ai.tidal.events;

import ai.tidal.config.TidalConfig;
import ai.tidal.util.ExecutorServiceUtil;
import ai.tidal.util.SerialByKeyExecutor;
import java.time.Clock;
import java.time.Duration;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArraySet;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.jetbrains.annotations.Nullable;

/**
 * In-process publish/subscribe hub for streaming output and side messages.
 *
 * <p>One instance is created per process (or per test) and passed to producers, the
 * {@link ai.tidal.stream.StreamCoordinator}, and display subscribers. It is not a singleton.
 *
 * <p>Delivery:
 * <ul>
 *   <li>Handlers run on a worker pool, never on the publisher's thread.</li>
 *   <li>Each handler has its own serial lane: it sees events one at a time, in publish order.</li>
 *   <li>A failing handler is logged; other handlers and the publisher are unaffected.</li>
 * </ul>
 *
 * <p>Filtering:
 * <ul>
 *   <li>{@code stream_chunk} events are coalesced (see {@link ChunkCoalescer}).</li>
 *   <li>Types with {@link EventType#deduplicated()} are dropped if identical content was published within the
 *       dedup window.</li>
 *   <li>Types with {@link EventType#sideMessage()} go to the installed {@link EventGate}, if any, which releases
 *       them through {@link #deliver(Event)}.</li>
 * </ul>
 */
public final class EventBus implements AutoCloseable {
    private static final Logger logger = LogManager.getLogger(EventBus.class);

    private static final Duration CLOSE_DRAIN_TIMEOUT = Duration.ofSeconds(2);

    private final Clock clock;
    private final ExecutorService workers;
    private final ScheduledExecutorService timer;
    private final SerialByKeyExecutor lanes;
    private final Map<EventType, Set<EventHandler>> subscribers = new ConcurrentHashMap<>();
    private final DeduplicationWindow dedup;
    private final ChunkCoalescer coalescer;

    private volatile @Nullable EventGate gate;
    private volatile boolean closed = false;

    public EventBus(TidalConfig config) {
        this(config, Clock.systemUTC());
    }

    public EventBus(TidalConfig config, Clock clock) {
        this.clock = clock;
        this.workers = ExecutorServiceUtil.newFixedThreadPool(config.workerThreads(), "tidal-bus");
        this.timer = ExecutorServiceUtil.newSingleThreadScheduledExecutor("tidal-coalesce");
        this.lanes = new SerialByKeyExecutor(workers);
        this.dedup = new DeduplicationWindow(config.dedupWindow(), config.dedupCapacity());
        this.coalescer = new ChunkCoalescer(config.coalesceInterval(), timer, this::dispatch);
        logger.debug(
                "EventBus created: workers={}, coalesce={}ms, dedup={}ms",
                config.workerThreads(),
                config.coalesceInterval().toMillis(),
                config.dedupWindow().toMillis());
    }

    /**
     * Register {@code handler} for every future event of {@code type}. Registering the same handler twice has no
     * further effect.
     */
    public void subscribe(EventType type, EventHandler handler) {
        if (subscribers.computeIfAbsent(type, k -> new CopyOnWriteArraySet<>()).add(handler)) {
            logger.debug("Subscribed handler to {}", type);
        }
    }

    /**
     * Remove a registration; no-op if {@code handler} is not subscribed to {@code type}.
     */
    public void unsubscribe(EventType type, EventHandler handler) {
        var handlers = subscribers.get(type);
        if (handlers != null && handlers.remove(handler)) {
            logger.debug("Unsubscribed handler from {}", type);
        }
    }

    public int subscriberCount(EventType type) {
        var handlers = subscribers.get(type);
        return handlers == null ? 0 : handlers.size();
    }

    /**
     * Install the gate that owns side messages. Only one gate may be installed at a time.
     *
     * @throws IllegalStateException if a different gate is already installed
     */
    public synchronized void installGate(EventGate newGate) {
        var current = gate;
        if (current != null && current != newGate) {
            throw new IllegalStateException("An event gate is already installed");
        }
        gate = newGate;
    }

    public synchronized void removeGate(EventGate existing) {
        if (gate == existing) {
            gate = null;
        }
    }

    public void publish(EventType type, Map<String, Object> payload) {
        publish(new Event(type, payload, clock.instant()));
    }

    /**
     * Publish an event. The bus stamps its arrival time, then coalesces, deduplicates, gates or delivers it.
     * Returns once delivery has been scheduled; handler outcomes never reach the caller.
     *
     * @throws IllegalArgumentException if a {@code stream_chunk} event has no {@code stream_id}
     */
    public void publish(Event event) {
        if (closed) {
            logger.warn("Ignoring {} published after the bus was closed", event.type());
            return;
        }
        var arrived = event.withTimestamp(clock.instant());
        var type = arrived.type();

        if (type == EventType.STREAM_CHUNK) {
            if (arrived.getString(Payloads.STREAM_ID) == null) {
                throw new IllegalArgumentException("stream_chunk event without stream_id: " + arrived.payload());
            }
            coalescer.offer(arrived);
            return;
        }

        // earlier chunks must reach subscribers before anything published after them
        coalescer.flush();

        if (type.deduplicated()
                && dedup.isDuplicate(type, arrived.getString(Payloads.CONTENT, ""), arrived.timestamp())) {
            logger.debug("Dropping duplicate {} event", type);
            return;
        }

        var currentGate = gate;
        if (currentGate != null && type.sideMessage()) {
            lanes.submit(currentGate, () -> {
                try {
                    currentGate.admit(arrived);
                } catch (RuntimeException e) {
                    logger.error("Event gate failed to admit {}", type, e);
                }
                return CompletableFuture.completedFuture(null);
            });
            return;
        }
        dispatch(arrived);
    }

    /**
     * Deliver an already admitted event straight to subscribers, skipping dedup, coalescing and the gate.
     */
    public void deliver(Event event) {
        if (closed) {
            logger.warn("Ignoring {} delivered after the bus was closed", event.type());
            return;
        }
        dispatch(event);
    }

    public void publishMessage(
            String role, String content, @Nullable String category, @Nullable Map<String, Object> metadata) {
        publish(EventType.MESSAGE, Payloads.message(role, content, category, metadata));
    }

    public void publishError(String message, @Nullable String details) {
        publish(EventType.ERROR, Payloads.error(message, details));
    }

    public void publishStatus(String statusType, @Nullable Map<String, Object> data) {
        publish(EventType.STATUS, Payloads.status(statusType, data));
    }

    public void publishTokenUpdate(Map<String, Object> usage) {
        publish(EventType.TOKEN_UPDATE, usage);
    }

    private void dispatch(Event event) {
        var handlers = subscribers.get(event.type());
        if (handlers == null || handlers.isEmpty()) {
            logger.trace("No subscribers for {}", event.type());
            return;
        }
        for (var handler : handlers) {
            lanes.submit(handler, () -> invoke(handler, event));
        }
    }

    private static CompletableFuture<Void> invoke(EventHandler handler, Event event) {
        CompletableFuture<Void> result;
        try {
            result = handler.handle(event);
        } catch (RuntimeException e) {
            logger.error("Error in event handler for {}", event.type(), e);
            return CompletableFuture.completedFuture(null);
        }
        if (result == null) {
            return CompletableFuture.completedFuture(null);
        }
        return result.handle((r, e) -> {
            if (e != null) {
                logger.error("Error in event handler for {}", event.type(), e);
            }
            return null;
        });
    }

    /**
     * Forget dedup history and discard buffered chunks.
     */
    public void reset() {
        dedup.clear();
        coalescer.clear();
    }

    /**
     * Flush buffered chunks and wait until no delivery is queued or running, including deliveries scheduled by
     * handlers while waiting.
     *
     * @return true if the bus went idle within {@code timeout}
     */
    public boolean awaitIdle(Duration timeout) {
        long deadline = System.nanoTime() + timeout.toNanos();
        while (true) {
            coalescer.flush();
            long before = lanes.submittedCount();
            long remaining = deadline - System.nanoTime();
            if (remaining <= 0) {
                return false;
            }
            try {
                lanes.whenAllComplete().get(remaining, TimeUnit.NANOSECONDS);
            } catch (TimeoutException e) {
                return false;
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                return false;
            } catch (ExecutionException e) {
                // lanes never complete exceptionally; treat as settled and re-check
                logger.debug("Unexpected lane failure while awaiting idle", e);
            }
            if (lanes.submittedCount() == before && coalescer.isEmpty()) {
                return true;
            }
        }
    }

    /**
     * Drain pending deliveries briefly, then stop the worker pool and flush timer.
     */
    @Override
    public void close() {
        if (closed) {
            return;
        }
        if (!awaitIdle(CLOSE_DRAIN_TIMEOUT)) {
            logger.warn("EventBus closed with deliveries still pending");
        }
        closed = true;
        coalescer.clear();
        timer.shutdownNow();
        ExecutorServiceUtil.shutdownQuietly(workers, CLOSE_DRAIN_TIMEOUT.toMillis());
    }
}
