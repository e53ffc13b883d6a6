package ai.tidal.events;

import java.util.concurrent.CompletableFuture;
import java.util.function.Consumer;

/**
 * Receives events from the {@link EventBus}.
 *
 * <p>Handlers return a completion signal so the bus treats synchronous and asynchronous handlers alike:
 * the next event for the same handler is not delivered until the returned future completes. A handler that
 * throws, or whose future completes exceptionally, is logged by the bus and does not affect other handlers.
 */
@FunctionalInterface
public interface EventHandler {

    CompletableFuture<Void> handle(Event event);

    /**
     * Adapts a synchronous consumer. Exceptions thrown by the consumer complete the future exceptionally.
     */
    static EventHandler of(Consumer<Event> consumer) {
        return new SyncEventHandler(consumer);
    }

    /**
     * Wrapper that keeps equality on the wrapped consumer, so subscribing the same consumer twice is still
     * idempotent.
     */
    record SyncEventHandler(Consumer<Event> consumer) implements EventHandler {
        @Override
        public CompletableFuture<Void> handle(Event event) {
            try {
                consumer.accept(event);
                return CompletableFuture.completedFuture(null);
            } catch (RuntimeException e) {
                return CompletableFuture.failedFuture(e);
            }
        }
    }
}
