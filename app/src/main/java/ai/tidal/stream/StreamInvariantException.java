package ai.tidal.stream;

/**
 * Thrown, in strict mode, when the stream state machine detects a producer contract breach.
 */
public class StreamInvariantException extends IllegalStateException {
    public StreamInvariantException(String message) {
        super(message);
    }
}
