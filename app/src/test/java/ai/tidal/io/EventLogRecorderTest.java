package ai.tidal.io;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ai.tidal.config.TidalConfig;
import ai.tidal.events.Event;
import ai.tidal.events.EventBus;
import ai.tidal.events.EventType;
import ai.tidal.events.Payloads;
import ai.tidal.stream.StreamCoordinator;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class EventLogRecorderTest {

    @TempDir
    Path tempDir;

    @Test
    void appendsOneJsonLinePerEventWithIncreasingSeq() throws Exception {
        var file = tempDir.resolve("logs/events.jsonl");
        try (var recorder = new EventLogRecorder(file)) {
            recorder.append(new Event(EventType.STATUS, Payloads.status("thinking", null), Instant.ofEpochMilli(1_000)));
            recorder.append(new Event(EventType.ERROR, Payloads.error("boom", null), Instant.ofEpochMilli(2_000)));
            assertEquals(2, recorder.recordedCount());
        }

        var lines = Files.readAllLines(file);
        assertEquals(2, lines.size());
        assertTrue(lines.get(0).startsWith("{\"seq\":1,\"timestamp\":1000,\"type\":\"status\""), lines.get(0));

        var entries = EventLogRecorder.read(file);
        assertEquals(List.of(1L, 2L), entries.stream().map(EventLogEntry::seq).toList());
        var error = entries.get(1).toEvent();
        assertEquals(EventType.ERROR, error.type());
        assertEquals("boom", error.getString(Payloads.MESSAGE));
        assertEquals(Instant.ofEpochMilli(2_000), error.timestamp());
    }

    @Test
    void recordsCoordinatedOutputFromTheBus() throws Exception {
        var file = tempDir.resolve("bus.jsonl");
        var config = TidalConfig.defaults().withCoalesceInterval(Duration.ZERO);
        try (var bus = new EventBus(config);
                var recorder = new EventLogRecorder(file)) {
            var coordinator = new StreamCoordinator(bus, config);
            coordinator.attach();
            recorder.attach(bus);

            bus.publish(EventType.STREAM_CHUNK, Payloads.streamChunk("s1", "Hi", false, false));
            bus.publishMessage(Payloads.ROLE_TOOL, "ran ls", null, null);
            bus.publish(EventType.STREAM_CHUNK, Payloads.streamChunk("s1", "", false, true));
            assertTrue(bus.awaitIdle(Duration.ofSeconds(5)));
            recorder.detach(bus);
        }

        var entries = EventLogRecorder.read(file);
        var types = entries.stream().map(EventLogEntry::type).toList();
        assertEquals("stream_chunk", types.get(0));
        assertTrue(types.contains("stream_start"));
        assertTrue(types.contains("stream_end"));
        var messages = entries.stream()
                .filter(e -> e.type().equals("message"))
                .map(e -> e.payload().get(Payloads.CONTENT))
                .toList();
        assertEquals(List.of("Hi", "ran ls"), messages);
        for (int i = 0; i < entries.size(); i++) {
            assertEquals(i + 1, entries.get(i).seq());
        }
    }

    @Test
    void appendsToExistingLog() throws Exception {
        var file = tempDir.resolve("events.jsonl");
        try (var recorder = new EventLogRecorder(file)) {
            recorder.append(Event.of(EventType.WARNING, Map.of(Payloads.CONTENT, "first")));
        }
        try (var recorder = new EventLogRecorder(file)) {
            recorder.append(Event.of(EventType.WARNING, Map.of(Payloads.CONTENT, "second")));
        }
        assertEquals(2, EventLogRecorder.read(file).size());
    }

    @Test
    void malformedLineReportsPosition() throws Exception {
        var file = tempDir.resolve("bad.jsonl");
        Files.writeString(file, "{\"seq\":1,\"timestamp\":0,\"type\":\"status\",\"payload\":{}}\n\nnot json\n");

        var e = assertThrows(IOException.class, () -> EventLogRecorder.read(file));
        assertTrue(e.getMessage().endsWith(":3"), e.getMessage());
    }

    @Test
    void closedRecorderRejectsAppends() throws Exception {
        var recorder = new EventLogRecorder(tempDir.resolve("closed.jsonl"));
        recorder.close();
        assertThrows(IOException.class, () -> recorder.append(Event.of(EventType.STATUS, Map.of())));
        assertTrue(recorder.handle(Event.of(EventType.STATUS, Map.of())).isCompletedExceptionally());
    }
}
