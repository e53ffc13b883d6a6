package ai.tidal.util;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executor;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.Supplier;

/**
 * Runs tasks on a shared executor while guaranteeing that tasks submitted under the same key run one at a time,
 * in submission order. Tasks under different keys run concurrently.
 *
 * <p>A task returns a future; the next task for the key starts only after that future completes (normally or
 * exceptionally). A failed task never blocks its lane.
 */
public final class SerialByKeyExecutor {
    private final Executor executor;
    private final ConcurrentHashMap<Object, CompletableFuture<Void>> tails = new ConcurrentHashMap<>();
    private final AtomicLong submitted = new AtomicLong();

    public SerialByKeyExecutor(Executor executor) {
        this.executor = executor;
    }

    /**
     * Queue {@code task} behind any pending work for {@code key}.
     *
     * @return a future completing when the task's own future completes
     */
    public CompletableFuture<Void> submit(Object key, Supplier<CompletableFuture<Void>> task) {
        submitted.incrementAndGet();
        var tail = tails.compute(key, (k, prev) -> {
            CompletableFuture<Void> base = prev == null ? CompletableFuture.completedFuture(null) : prev;
            return base.handle((r, e) -> (Void) null).thenComposeAsync(ignored -> invoke(task), executor);
        });
        tail.whenComplete((r, e) -> tails.remove(key, tail));
        return tail;
    }

    private static CompletableFuture<Void> invoke(Supplier<CompletableFuture<Void>> task) {
        try {
            var result = task.get();
            return result == null ? CompletableFuture.completedFuture(null) : result;
        } catch (RuntimeException e) {
            return CompletableFuture.failedFuture(e);
        }
    }

    /**
     * A future that completes once every task queued at the time of the call has finished.
     */
    public CompletableFuture<Void> whenAllComplete() {
        var pending = tails.values().stream()
                .map(f -> f.handle((r, e) -> (Void) null))
                .toArray(CompletableFuture[]::new);
        return CompletableFuture.allOf(pending);
    }

    /** Total number of tasks ever submitted; callers compare snapshots to detect new work. */
    public long submittedCount() {
        return submitted.get();
    }
}
