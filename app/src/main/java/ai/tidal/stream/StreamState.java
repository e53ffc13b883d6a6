package ai.tidal.stream;

public enum StreamState {
    /** No session is accepting chunks. */
    IDLE,
    /** Exactly one session is accepting chunks. */
    ACTIVE
}
