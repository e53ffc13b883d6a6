package ai.tidal.config;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.Locale;
import java.util.Map;
import java.util.Properties;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.jetbrains.annotations.Nullable;

/**
 * Tunables for the event bus and stream coordinator.
 *
 * <p>Resolution order, lowest precedence first: {@link #defaults()}, {@code tidal.properties} on the classpath,
 * an explicit properties file, environment variables. Each property {@code tidal.x.y} has an environment
 * variable counterpart {@code TIDAL_X_Y}.
 *
 * @param dedupWindow how long a delivered discrete message suppresses an identical one
 * @param dedupCapacity maximum number of remembered messages in the dedup window
 * @param coalesceInterval minimum spacing between scheduled chunk flushes; zero disables coalescing
 * @param duplicatePrefixLength characters compared when matching a message against the last finalized turn
 * @param normalizeContent collapse whitespace and strip collapsible reasoning blocks before comparing
 * @param strictInvariants throw on state machine invariant violations instead of self-correcting
 * @param workerThreads size of the handler worker pool
 */
public record TidalConfig(
        Duration dedupWindow,
        int dedupCapacity,
        Duration coalesceInterval,
        int duplicatePrefixLength,
        boolean normalizeContent,
        boolean strictInvariants,
        int workerThreads) {
    private static final Logger logger = LogManager.getLogger(TidalConfig.class);

    public static final String RESOURCE_NAME = "tidal.properties";

    public static final String DEDUP_WINDOW_MS = "tidal.dedup.window.ms";
    public static final String DEDUP_CAPACITY = "tidal.dedup.capacity";
    public static final String COALESCE_INTERVAL_MS = "tidal.coalesce.interval.ms";
    public static final String DUPLICATE_PREFIX_LENGTH = "tidal.duplicate.prefix.length";
    public static final String NORMALIZE_CONTENT = "tidal.normalize.content";
    public static final String STRICT_INVARIANTS = "tidal.strict.invariants";
    public static final String WORKER_THREADS = "tidal.worker.threads";

    private static final String[] KEYS = {
        DEDUP_WINDOW_MS,
        DEDUP_CAPACITY,
        COALESCE_INTERVAL_MS,
        DUPLICATE_PREFIX_LENGTH,
        NORMALIZE_CONTENT,
        STRICT_INVARIANTS,
        WORKER_THREADS
    };

    public TidalConfig {
        if (dedupWindow.isNegative()) {
            throw new IllegalArgumentException("dedupWindow must not be negative, got: " + dedupWindow);
        }
        if (dedupCapacity < 1) {
            throw new IllegalArgumentException("dedupCapacity must be positive, got: " + dedupCapacity);
        }
        if (coalesceInterval.isNegative()) {
            throw new IllegalArgumentException("coalesceInterval must not be negative, got: " + coalesceInterval);
        }
        if (duplicatePrefixLength < 1) {
            throw new IllegalArgumentException(
                    "duplicatePrefixLength must be positive, got: " + duplicatePrefixLength);
        }
        if (workerThreads < 1) {
            throw new IllegalArgumentException("workerThreads must be positive, got: " + workerThreads);
        }
    }

    public static TidalConfig defaults() {
        int threads = Math.max(2, Math.min(4, Runtime.getRuntime().availableProcessors()));
        return new TidalConfig(Duration.ofMillis(50), 50, Duration.ofMillis(50), 50, true, false, threads);
    }

    /**
     * Defaults, overlaid with the classpath resource and the process environment.
     */
    public static TidalConfig load() {
        return load(null);
    }

    /**
     * Like {@link #load()}, with {@code propertiesFile} (if non-null) applied after the classpath resource.
     *
     * @throws IllegalArgumentException if the file cannot be read or holds an invalid value
     */
    public static TidalConfig load(@Nullable Path propertiesFile) {
        var config = defaults();
        try (InputStream in = TidalConfig.class.getClassLoader().getResourceAsStream(RESOURCE_NAME)) {
            if (in != null) {
                var props = new Properties();
                props.load(in);
                config = config.overlay(props);
            }
        } catch (IOException e) {
            logger.warn("Failed to read classpath {}: {}", RESOURCE_NAME, e.getMessage());
        }
        if (propertiesFile != null) {
            var props = new Properties();
            try (var in = Files.newInputStream(propertiesFile)) {
                props.load(in);
            } catch (IOException e) {
                throw new IllegalArgumentException("Cannot read configuration file " + propertiesFile, e);
            }
            config = config.overlay(props);
        }
        return config.overlayEnvironment(System.getenv());
    }

    /**
     * Applies every recognized key present in {@code props}.
     */
    public TidalConfig overlay(Properties props) {
        var config = this;
        for (var key : KEYS) {
            var value = props.getProperty(key);
            if (value != null && !value.isBlank()) {
                config = config.with(key, value.trim());
            }
        }
        return config;
    }

    /**
     * Applies {@code TIDAL_*} variables from {@code env}.
     */
    public TidalConfig overlayEnvironment(Map<String, String> env) {
        var config = this;
        for (var key : KEYS) {
            var value = env.get(envName(key));
            if (value != null && !value.isBlank()) {
                config = config.with(key, value.trim());
            }
        }
        return config;
    }

    public static String envName(String key) {
        return key.toUpperCase(Locale.ROOT).replace('.', '_');
    }

    /**
     * Returns a copy with one property replaced, parsing {@code value} for the property's type.
     */
    public TidalConfig with(String key, String value) {
        try {
            return switch (key) {
                case DEDUP_WINDOW_MS -> withDedupWindow(Duration.ofMillis(Long.parseLong(value)));
                case DEDUP_CAPACITY -> new TidalConfig(
                        dedupWindow,
                        Integer.parseInt(value),
                        coalesceInterval,
                        duplicatePrefixLength,
                        normalizeContent,
                        strictInvariants,
                        workerThreads);
                case COALESCE_INTERVAL_MS -> withCoalesceInterval(Duration.ofMillis(Long.parseLong(value)));
                case DUPLICATE_PREFIX_LENGTH -> withDuplicatePrefixLength(Integer.parseInt(value));
                case NORMALIZE_CONTENT -> new TidalConfig(
                        dedupWindow,
                        dedupCapacity,
                        coalesceInterval,
                        duplicatePrefixLength,
                        parseBoolean(key, value),
                        strictInvariants,
                        workerThreads);
                case STRICT_INVARIANTS -> withStrictInvariants(parseBoolean(key, value));
                case WORKER_THREADS -> new TidalConfig(
                        dedupWindow,
                        dedupCapacity,
                        coalesceInterval,
                        duplicatePrefixLength,
                        normalizeContent,
                        strictInvariants,
                        Integer.parseInt(value));
                default -> throw new IllegalArgumentException("Unknown configuration key: " + key);
            };
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Invalid value for " + key + ": " + value, e);
        }
    }

    private static boolean parseBoolean(String key, String value) {
        if ("true".equalsIgnoreCase(value)) {
            return true;
        }
        if ("false".equalsIgnoreCase(value)) {
            return false;
        }
        throw new IllegalArgumentException("Invalid value for " + key + ": " + value);
    }

    public TidalConfig withDedupWindow(Duration window) {
        return new TidalConfig(
                window,
                dedupCapacity,
                coalesceInterval,
                duplicatePrefixLength,
                normalizeContent,
                strictInvariants,
                workerThreads);
    }

    public TidalConfig withCoalesceInterval(Duration interval) {
        return new TidalConfig(
                dedupWindow,
                dedupCapacity,
                interval,
                duplicatePrefixLength,
                normalizeContent,
                strictInvariants,
                workerThreads);
    }

    public TidalConfig withDuplicatePrefixLength(int length) {
        return new TidalConfig(
                dedupWindow, dedupCapacity, coalesceInterval, length, normalizeContent, strictInvariants, workerThreads);
    }

    public TidalConfig withStrictInvariants(boolean strict) {
        return new TidalConfig(
                dedupWindow, dedupCapacity, coalesceInterval, duplicatePrefixLength, normalizeContent, strict, workerThreads);
    }
}
