package ai.tidal.cli;

import java.io.IOException;

/**
 * A transcript line that cannot be replayed.
 */
public class TranscriptFormatException extends IOException {
    private final int lineNumber;

    public TranscriptFormatException(int lineNumber, String message) {
        super("line " + lineNumber + ": " + message);
        this.lineNumber = lineNumber;
    }

    public TranscriptFormatException(int lineNumber, String message, Throwable cause) {
        super("line " + lineNumber + ": " + message, cause);
        this.lineNumber = lineNumber;
    }

    public int lineNumber() {
        return lineNumber;
    }
}
