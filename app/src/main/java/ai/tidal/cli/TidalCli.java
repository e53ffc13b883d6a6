package ai.tidal.cli;

import ai.tidal.config.TidalConfig;
import ai.tidal.events.Event;
import ai.tidal.events.EventBus;
import ai.tidal.events.Payloads;
import ai.tidal.io.EventLogRecorder;
import ai.tidal.stream.StreamCoordinator;
import ai.tidal.stream.StreamInvariantException;
import java.io.IOException;
import java.io.PrintStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.Callable;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.jetbrains.annotations.Nullable;
import picocli.CommandLine;

@CommandLine.Command(
        name = "tidal",
        mixinStandardHelpOptions = true,
        description = "Replay a JSON-lines transcript of producer events through the event bus and stream coordinator.")
public final class TidalCli implements Callable<Integer> {
    private static final Logger logger = LogManager.getLogger(TidalCli.class);

    public static final int EXIT_OK = 0;
    public static final int EXIT_BAD_INPUT = 1;
    public static final int EXIT_NOT_DRAINED = 2;
    public static final int EXIT_INVARIANT = 3;

    static final String TRANSCRIPT_ENV = "TIDAL_TRANSCRIPT";

    @CommandLine.Option(
            names = "--transcript",
            description = "Transcript to replay. Falls back to $" + TRANSCRIPT_ENV + ".")
    @Nullable
    private Path transcript;

    @CommandLine.Option(names = "--event-log", description = "Append every delivered event to this JSON-lines file.")
    @Nullable
    private Path eventLog;

    @CommandLine.Option(names = "--config", description = "Properties file applied over tidal.properties.")
    @Nullable
    private Path configFile;

    @CommandLine.Option(names = "--coalesce-ms", description = "Chunk coalescing interval in milliseconds.")
    @Nullable
    private Long coalesceMs;

    @CommandLine.Option(names = "--dedup-window-ms", description = "Duplicate suppression window in milliseconds.")
    @Nullable
    private Long dedupWindowMs;

    @CommandLine.Option(names = "--strict", description = "Fail on stream invariant violations instead of recovering.")
    private boolean strict;

    @CommandLine.Option(
            names = "--set",
            description = "Override a configuration property, e.g. --set tidal.dedup.capacity=100. Can be repeated.")
    private Map<String, String> overrides = new LinkedHashMap<>();

    @CommandLine.Option(names = "--ignore-delays", description = "Replay as fast as possible, ignoring delayMs.")
    private boolean ignoreDelays;

    @CommandLine.Option(names = "--color", description = "Use ANSI styling in the console output.")
    private boolean color;

    @CommandLine.Option(names = "--show-tokens", description = "Print token_update events.")
    private boolean showTokens;

    @CommandLine.Option(names = "--quiet", description = "Do not render events to the console.")
    private boolean quiet;

    @CommandLine.Option(
            names = "--drain-timeout-ms",
            defaultValue = "5000",
            description = "How long to wait for deliveries to finish before exiting (default: ${DEFAULT-VALUE}).")
    private long drainTimeoutMs;

    private final PrintStream out;
    private final PrintStream err;
    private final Map<String, String> env;

    public TidalCli() {
        this(System.out, System.err, System.getenv());
    }

    TidalCli(PrintStream out, PrintStream err, Map<String, String> env) {
        this.out = out;
        this.err = err;
        this.env = env;
    }

    public static void main(String[] args) {
        int exitCode = new CommandLine(new TidalCli()).execute(args);
        System.exit(exitCode);
    }

    @Override
    public Integer call() {
        var transcriptPath = resolveTranscript();
        if (transcriptPath == null) {
            err.println("Error: --transcript is required (or set " + TRANSCRIPT_ENV + ").");
            return EXIT_BAD_INPUT;
        }
        if (!Files.isRegularFile(transcriptPath)) {
            err.println("Error: transcript not found: " + transcriptPath);
            return EXIT_BAD_INPUT;
        }

        TidalConfig config;
        try {
            config = buildConfig();
        } catch (IllegalArgumentException e) {
            err.println("Error: invalid configuration: " + e.getMessage());
            return EXIT_BAD_INPUT;
        }

        List<TranscriptEntry> entries;
        try {
            entries = TranscriptReader.read(transcriptPath);
        } catch (TranscriptFormatException e) {
            err.println("Error: malformed transcript " + transcriptPath + " at " + e.getMessage());
            return EXIT_BAD_INPUT;
        } catch (IOException e) {
            err.println("Error reading transcript: " + e.getMessage());
            return EXIT_BAD_INPUT;
        }
        logger.info("Replaying {} transcript entries from {}", entries.size(), transcriptPath);

        try (var bus = new EventBus(config)) {
            return replay(bus, config, entries);
        } catch (IOException e) {
            err.println("Error writing event log: " + e.getMessage());
            return EXIT_BAD_INPUT;
        }
    }

    private int replay(EventBus bus, TidalConfig config, List<TranscriptEntry> entries) throws IOException {
        var coordinator = new StreamCoordinator(bus, config);
        coordinator.attach();
        if (!quiet) {
            new ConsoleDisplay(out, color, showTokens).attach(bus);
        }
        var drainTimeout = Duration.ofMillis(drainTimeoutMs);

        try (var recorder = eventLog == null ? null : new EventLogRecorder(eventLog)) {
            if (recorder != null) {
                recorder.attach(bus);
            }
            for (var entry : entries) {
                if (!pause(entry.delayMs())) {
                    err.println("Interrupted during replay");
                    return EXIT_NOT_DRAINED;
                }
                if (entry.isAbort()) {
                    // the abort must follow every chunk already published
                    bus.awaitIdle(drainTimeout);
                    var streamId = entry.payload().get(Payloads.STREAM_ID).toString();
                    try {
                        coordinator.abort(streamId);
                    } catch (StreamInvariantException e) {
                        err.println("Error: line " + entry.lineNumber() + ": " + e.getMessage());
                        return EXIT_INVARIANT;
                    }
                } else {
                    bus.publish(Event.of(entry.type(), entry.payload()));
                }
            }

            if (!bus.awaitIdle(drainTimeout)) {
                err.println("Error: deliveries did not finish within " + drainTimeoutMs + " ms");
                return EXIT_NOT_DRAINED;
            }
            coordinator.activeStreamId()
                    .ifPresent(id -> logger.warn("Transcript ended with stream {} still active", id));
            if (recorder != null) {
                logger.info("Recorded {} events to {}", recorder.recordedCount(), recorder.file());
            }
            return EXIT_OK;
        } finally {
            coordinator.detach();
        }
    }

    private boolean pause(long delayMs) {
        if (ignoreDelays || delayMs <= 0) {
            return true;
        }
        try {
            Thread.sleep(delayMs);
            return true;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        }
    }

    private @Nullable Path resolveTranscript() {
        if (transcript != null) {
            return transcript;
        }
        var fromEnv = env.get(TRANSCRIPT_ENV);
        return fromEnv == null || fromEnv.isBlank() ? null : Path.of(fromEnv.trim());
    }

    TidalConfig buildConfig() {
        var config = TidalConfig.load(configFile).overlayEnvironment(env);
        for (var override : overrides.entrySet()) {
            config = config.with(override.getKey(), override.getValue());
        }
        if (coalesceMs != null) {
            config = config.withCoalesceInterval(Duration.ofMillis(coalesceMs));
        }
        if (dedupWindowMs != null) {
            config = config.withDedupWindow(Duration.ofMillis(dedupWindowMs));
        }
        if (strict) {
            config = config.withStrictInvariants(true);
        }
        return config;
    }
}
