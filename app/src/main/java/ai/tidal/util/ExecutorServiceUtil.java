package ai.tidal.util;

import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

public final class ExecutorServiceUtil {
    private static final Logger logger = LogManager.getLogger(ExecutorServiceUtil.class);

    private ExecutorServiceUtil() {}

    /**
     * Daemon thread factory producing threads named {@code <prefix>-<n>}. Uncaught exceptions are logged.
     */
    public static ThreadFactory createNamedThreadFactory(String prefix) {
        var counter = new AtomicInteger(0);
        var delegate = Executors.defaultThreadFactory();
        return r -> {
            var t = delegate.newThread(r);
            t.setName(prefix + "-" + counter.incrementAndGet());
            t.setDaemon(true);
            t.setUncaughtExceptionHandler(
                    (thread, e) -> logger.error("Uncaught exception in thread {}", thread.getName(), e));
            return t;
        };
    }

    public static ExecutorService newFixedThreadPool(int threads, String prefix) {
        return Executors.newFixedThreadPool(threads, createNamedThreadFactory(prefix));
    }

    public static ScheduledExecutorService newSingleThreadScheduledExecutor(String prefix) {
        return Executors.newSingleThreadScheduledExecutor(createNamedThreadFactory(prefix));
    }

    /**
     * Orderly shutdown, falling back to {@code shutdownNow} if tasks do not finish in time.
     */
    public static void shutdownQuietly(ExecutorService executor, long timeoutMillis) {
        executor.shutdown();
        try {
            if (!executor.awaitTermination(timeoutMillis, TimeUnit.MILLISECONDS)) {
                logger.debug("Executor did not terminate within {} ms; forcing shutdown", timeoutMillis);
                executor.shutdownNow();
            }
        } catch (InterruptedException e) {
            executor.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }
}
