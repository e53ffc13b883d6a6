package ai.tidal.io;

import ai.tidal.events.Event;
import ai.tidal.events.EventBus;
import ai.tidal.events.EventHandler;
import ai.tidal.events.EventType;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.io.BufferedWriter;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * Diagnostic subscriber that appends every delivered event to a JSON-lines file.
 *
 * <p>Writes are synchronous and flushed per line so the file is authoritative for everything delivered before a
 * crash. Sequence numbers are assigned in delivery order to this recorder.
 */
public final class EventLogRecorder implements EventHandler, AutoCloseable {
    private static final Logger logger = LogManager.getLogger(EventLogRecorder.class);

    static final ObjectMapper OBJECT_MAPPER = new ObjectMapper();

    private final Path file;
    private final BufferedWriter writer;
    private long nextSeq = 1;
    private boolean closed = false;

    /**
     * Open {@code file} for appending, creating it and its parent directories if needed.
     */
    public EventLogRecorder(Path file) throws IOException {
        this.file = file;
        var parent = file.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        this.writer = Files.newBufferedWriter(
                file, StandardCharsets.UTF_8, StandardOpenOption.CREATE, StandardOpenOption.APPEND);
        logger.debug("Recording events to {}", file);
    }

    /**
     * Subscribe to every event type on {@code bus}.
     */
    public void attach(EventBus bus) {
        for (var type : EventType.values()) {
            bus.subscribe(type, this);
        }
    }

    public void detach(EventBus bus) {
        for (var type : EventType.values()) {
            bus.unsubscribe(type, this);
        }
    }

    @Override
    public CompletableFuture<Void> handle(Event event) {
        try {
            append(event);
            return CompletableFuture.completedFuture(null);
        } catch (IOException e) {
            return CompletableFuture.failedFuture(new UncheckedIOException("Failed to record " + event.type(), e));
        }
    }

    /**
     * Append one event and return its sequence number.
     */
    public synchronized long append(Event event) throws IOException {
        if (closed) {
            throw new IOException("Event log " + file + " is closed");
        }
        long seq = nextSeq++;
        writer.write(OBJECT_MAPPER.writeValueAsString(EventLogEntry.of(seq, event)));
        writer.newLine();
        writer.flush();
        logger.trace("Recorded {} seq={}", event.type(), seq);
        return seq;
    }

    public synchronized long recordedCount() {
        return nextSeq - 1;
    }

    public Path file() {
        return file;
    }

    @Override
    public synchronized void close() throws IOException {
        if (closed) {
            return;
        }
        closed = true;
        writer.close();
    }

    /**
     * Read an event log back, in file order. Blank lines are skipped.
     *
     * @throws IOException if the file cannot be read or a line is not a valid entry
     */
    public static List<EventLogEntry> read(Path file) throws IOException {
        var entries = new ArrayList<EventLogEntry>();
        int lineNumber = 0;
        for (var line : Files.readAllLines(file, StandardCharsets.UTF_8)) {
            lineNumber++;
            if (line.isBlank()) {
                continue;
            }
            try {
                entries.add(OBJECT_MAPPER.readValue(line, EventLogEntry.class));
            } catch (JsonProcessingException e) {
                throw new IOException("Malformed event log entry at " + file + ":" + lineNumber, e);
            }
        }
        return entries;
    }
}
