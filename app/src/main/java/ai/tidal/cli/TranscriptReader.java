package ai.tidal.cli;

import ai.tidal.events.EventType;
import ai.tidal.events.Payloads;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.io.BufferedReader;
import java.io.IOException;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Parses JSON-lines replay transcripts.
 *
 * <p>Each non-blank line that does not start with {@code #} is an object
 * {@code {"type": "<wire name>", "payload": {...}, "delayMs": n}}; {@code payload} and {@code delayMs} are optional.
 * The pseudo type {@code abort} with a {@code stream_id} payload interrupts that stream.
 */
public final class TranscriptReader {
    private static final ObjectMapper OBJECT_MAPPER = new ObjectMapper();
    private static final TypeReference<Map<String, Object>> PAYLOAD_TYPE = new TypeReference<>() {};

    private TranscriptReader() {}

    public static List<TranscriptEntry> read(Path file) throws IOException {
        try (var reader = Files.newBufferedReader(file, StandardCharsets.UTF_8)) {
            return read(reader);
        }
    }

    public static List<TranscriptEntry> read(Reader source) throws IOException {
        var reader = source instanceof BufferedReader br ? br : new BufferedReader(source);
        var entries = new ArrayList<TranscriptEntry>();
        int lineNumber = 0;
        String line;
        while ((line = reader.readLine()) != null) {
            lineNumber++;
            var trimmed = line.strip();
            if (trimmed.isEmpty() || trimmed.startsWith("#")) {
                continue;
            }
            entries.add(parseLine(lineNumber, trimmed));
        }
        return entries;
    }

    static TranscriptEntry parseLine(int lineNumber, String line) throws TranscriptFormatException {
        JsonNode node;
        try {
            node = OBJECT_MAPPER.readTree(line);
        } catch (JsonProcessingException e) {
            throw new TranscriptFormatException(lineNumber, "invalid JSON", e);
        }
        if (node == null || !node.isObject()) {
            throw new TranscriptFormatException(lineNumber, "expected a JSON object");
        }

        var typeNode = node.get("type");
        if (typeNode == null || !typeNode.isTextual()) {
            throw new TranscriptFormatException(lineNumber, "missing \"type\"");
        }

        Map<String, Object> payload = Map.of();
        var payloadNode = node.get("payload");
        if (payloadNode != null && !payloadNode.isNull()) {
            if (!payloadNode.isObject()) {
                throw new TranscriptFormatException(lineNumber, "\"payload\" must be an object");
            }
            payload = OBJECT_MAPPER.convertValue(payloadNode, PAYLOAD_TYPE);
        }

        long delayMs = 0;
        var delayNode = node.get("delayMs");
        if (delayNode != null && !delayNode.isNull()) {
            if (!delayNode.canConvertToLong() || delayNode.asLong() < 0) {
                throw new TranscriptFormatException(lineNumber, "\"delayMs\" must be a non-negative integer");
            }
            delayMs = delayNode.asLong();
        }

        var typeName = typeNode.asText();
        if (TranscriptEntry.ABORT.equals(typeName)) {
            requireStreamId(lineNumber, typeName, payload);
            return new TranscriptEntry(lineNumber, null, payload, delayMs);
        }

        EventType type;
        try {
            type = EventType.fromWireName(typeName);
        } catch (IllegalArgumentException e) {
            throw new TranscriptFormatException(lineNumber, "unknown event type \"" + typeName + "\"", e);
        }
        if (type == EventType.STREAM_CHUNK) {
            requireStreamId(lineNumber, typeName, payload);
        }
        return new TranscriptEntry(lineNumber, type, payload, delayMs);
    }

    private static void requireStreamId(int lineNumber, String typeName, Map<String, Object> payload)
            throws TranscriptFormatException {
        if (!(payload.get(Payloads.STREAM_ID) instanceof String id) || id.isBlank()) {
            throw new TranscriptFormatException(lineNumber, typeName + " requires a \"stream_id\"");
        }
    }
}
