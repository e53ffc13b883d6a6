package ai.tidal.cli;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ai.tidal.io.EventLogEntry;
import ai.tidal.io.EventLogRecorder;
import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.Map;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import picocli.CommandLine;

class TidalCliTest {
    private static final String HELLO_TRANSCRIPT = """
            {"type": "stream_chunk", "payload": {"stream_id": "s1", "chunk": "Hel", "is_final": false}}
            {"type": "stream_chunk", "payload": {"stream_id": "s1", "chunk": "lo", "is_final": false}}
            {"type": "message", "payload": {"role": "tool", "content": "ran ls"}}
            {"type": "stream_chunk", "payload": {"stream_id": "s1", "chunk": "", "is_final": true}}
            """;

    @TempDir
    Path tempDir;

    private ByteArrayOutputStream out;
    private ByteArrayOutputStream err;

    @BeforeEach
    void setUp() {
        out = new ByteArrayOutputStream();
        err = new ByteArrayOutputStream();
    }

    private int run(Map<String, String> env, String... args) {
        var cli = new TidalCli(
                new PrintStream(out, true, StandardCharsets.UTF_8),
                new PrintStream(err, true, StandardCharsets.UTF_8),
                env);
        return new CommandLine(cli).execute(args);
    }

    private String stdout() {
        return out.toString(StandardCharsets.UTF_8).replace("\r\n", "\n");
    }

    private String stderr() {
        return err.toString(StandardCharsets.UTF_8);
    }

    private Path write(String name, String content) throws Exception {
        var file = tempDir.resolve(name);
        Files.writeString(file, content);
        return file;
    }

    @Test
    void replaysTranscriptInCoordinatedOrder() throws Exception {
        var transcript = write("hello.jsonl", HELLO_TRANSCRIPT);

        int exit = run(Map.of(), "--transcript", transcript.toString(), "--ignore-delays");

        assertEquals(TidalCli.EXIT_OK, exit, stderr());
        assertEquals("[ASSISTANT] Hello\n[TOOL] ran ls\n", stdout());
    }

    @Test
    void recordsEventLog() throws Exception {
        var transcript = write("hello.jsonl", HELLO_TRANSCRIPT);
        var log = tempDir.resolve("out/events.jsonl");

        int exit = run(Map.of(), "--transcript", transcript.toString(), "--event-log", log.toString(), "--quiet");

        assertEquals(TidalCli.EXIT_OK, exit, stderr());
        assertEquals("", stdout());
        var types = EventLogRecorder.read(log).stream().map(EventLogEntry::type).toList();
        assertTrue(types.contains("stream_start"));
        assertTrue(types.contains("stream_end"));
        assertEquals("message", types.get(types.size() - 1));
    }

    @Test
    void transcriptPathFallsBackToEnvironment() throws Exception {
        var transcript = write("hello.jsonl", HELLO_TRANSCRIPT);

        int exit = run(Map.of(TidalCli.TRANSCRIPT_ENV, transcript.toString()), "--quiet");

        assertEquals(TidalCli.EXIT_OK, exit, stderr());
    }

    @Test
    void missingTranscriptIsAnError() {
        assertEquals(TidalCli.EXIT_BAD_INPUT, run(Map.of()));
        assertTrue(stderr().contains("--transcript is required"));

        assertEquals(TidalCli.EXIT_BAD_INPUT, run(Map.of(), "--transcript", tempDir.resolve("nope.jsonl").toString()));
    }

    @Test
    void malformedTranscriptReportsLine() throws Exception {
        var transcript = write("bad.jsonl", "{\"type\": \"status\"}\n{\"type\": \"nonsense\"}\n");

        assertEquals(TidalCli.EXIT_BAD_INPUT, run(Map.of(), "--transcript", transcript.toString()));
        assertTrue(stderr().contains("line 2"), stderr());
    }

    @Test
    void invalidConfigurationIsRejected() throws Exception {
        var transcript = write("hello.jsonl", HELLO_TRANSCRIPT);

        int exit = run(Map.of(), "--transcript", transcript.toString(), "--set", "tidal.dedup.capacity=zero");

        assertEquals(TidalCli.EXIT_BAD_INPUT, exit);
        assertTrue(stderr().contains("invalid configuration"), stderr());
    }

    @Test
    void abortDirectiveInStrictModeFailsOnUnknownStream() throws Exception {
        var transcript = write("abort.jsonl", "{\"type\": \"abort\", \"payload\": {\"stream_id\": \"ghost\"}}\n");

        int exit = run(Map.of(), "--transcript", transcript.toString(), "--strict", "--quiet");

        assertEquals(TidalCli.EXIT_INVARIANT, exit);
        assertTrue(stderr().contains("line 1"), stderr());
    }

    @Test
    void abortDirectiveEndsTheActiveStream() throws Exception {
        var transcript = write("abort.jsonl", """
                {"type": "stream_chunk", "payload": {"stream_id": "s1", "chunk": "partial", "is_final": false}}
                {"type": "status", "payload": {"status_type": "cancelled"}}
                {"type": "abort", "payload": {"stream_id": "s1"}}
                """);

        int exit = run(Map.of(), "--transcript", transcript.toString());

        assertEquals(TidalCli.EXIT_OK, exit, stderr());
        assertEquals("[ASSISTANT] partial\n[ABORTED] stream s1\n[STATUS] cancelled\n", stdout());
    }

    @Test
    void optionsOverrideConfiguration() {
        var cli = new TidalCli(System.out, System.err, Map.of("TIDAL_DEDUP_WINDOW_MS", "70"));
        new CommandLine(cli).parseArgs("--coalesce-ms", "5", "--strict", "--set", "tidal.duplicate.prefix.length=9");

        var config = cli.buildConfig();
        assertEquals(Duration.ofMillis(5), config.coalesceInterval());
        assertEquals(Duration.ofMillis(70), config.dedupWindow());
        assertEquals(9, config.duplicatePrefixLength());
        assertTrue(config.strictInvariants());
    }
}
