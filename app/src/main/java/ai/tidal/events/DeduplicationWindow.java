package ai.tidal.events;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.HexFormat;

/**
 * Short-lived memory of recently delivered discrete events, keyed by type and a hash of their content.
 *
 * <p>Entries older than the window, or beyond the capacity (oldest first), are forgotten.
 */
final class DeduplicationWindow {
    private record Entry(EventType type, String hash, Instant arrival) {}

    private final Duration window;
    private final int capacity;
    // guarded by this
    private final Deque<Entry> recent = new ArrayDeque<>();

    DeduplicationWindow(Duration window, int capacity) {
        this.window = window;
        this.capacity = capacity;
    }

    /**
     * Returns true if an event of the same type and content arrived within the window; otherwise records this
     * one and returns false.
     */
    synchronized boolean isDuplicate(EventType type, String content, Instant arrival) {
        evictExpired(arrival);
        var hash = hash(type, content);
        for (var entry : recent) {
            if (entry.type() == type && entry.hash().equals(hash)) {
                return true;
            }
        }
        recent.addLast(new Entry(type, hash, arrival));
        while (recent.size() > capacity) {
            recent.removeFirst();
        }
        return false;
    }

    private void evictExpired(Instant now) {
        while (!recent.isEmpty()) {
            var age = Duration.between(recent.peekFirst().arrival(), now);
            if (age.compareTo(window) < 0) {
                break;
            }
            recent.removeFirst();
        }
    }

    synchronized void clear() {
        recent.clear();
    }

    synchronized int size() {
        return recent.size();
    }

    static String hash(EventType type, String content) {
        try {
            var digest = MessageDigest.getInstance("SHA-256");
            byte[] bytes = digest.digest((type.wireName() + ":" + content).getBytes(StandardCharsets.UTF_8));
            return HexFormat.of().formatHex(bytes);
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }
}
