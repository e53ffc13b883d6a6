package ai.tidal.stream;

/**
 * Decides whether a discrete message repeats content that was already shown as a finalized stream.
 */
@FunctionalInterface
public interface DuplicateMessagePolicy {

    /**
     * @param candidate content of the incoming message
     * @param lastFinalized content of the most recently finalized stream for the same role
     * @return true if the candidate should be suppressed
     */
    boolean isDuplicate(String candidate, String lastFinalized);

    /** A policy that never suppresses anything. */
    static DuplicateMessagePolicy never() {
        return (candidate, lastFinalized) -> false;
    }
}
