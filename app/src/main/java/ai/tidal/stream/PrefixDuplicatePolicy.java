package ai.tidal.stream;

import java.util.regex.Pattern;

/**
 * Treats two messages as the same when they are equal, or when either starts with the first
 * {@code prefixLength} characters of the other.
 *
 * <p>With normalization on, collapsible {@code <details>} blocks are removed and whitespace runs collapsed
 * before comparing, so a re-announced message that differs only in formatting still matches.
 */
public final class PrefixDuplicatePolicy implements DuplicateMessagePolicy {
    private static final Pattern DETAILS_BLOCK =
            Pattern.compile("<details>.*?</details>", Pattern.DOTALL | Pattern.CASE_INSENSITIVE);
    private static final Pattern WHITESPACE = Pattern.compile("\\s+");

    private final int prefixLength;
    private final boolean normalize;

    public PrefixDuplicatePolicy(int prefixLength, boolean normalize) {
        if (prefixLength < 1) {
            throw new IllegalArgumentException("prefixLength must be positive, got: " + prefixLength);
        }
        this.prefixLength = prefixLength;
        this.normalize = normalize;
    }

    @Override
    public boolean isDuplicate(String candidate, String lastFinalized) {
        var incoming = normalize ? normalize(candidate) : candidate;
        var previous = normalize ? normalize(lastFinalized) : lastFinalized;
        if (incoming.isBlank() || previous.isBlank()) {
            return false;
        }
        if (incoming.equals(previous)) {
            return true;
        }
        return incoming.startsWith(prefix(previous)) || previous.startsWith(prefix(incoming));
    }

    private String prefix(String s) {
        return s.length() <= prefixLength ? s : s.substring(0, prefixLength);
    }

    static String normalize(String content) {
        var withoutDetails = DETAILS_BLOCK.matcher(content).replaceAll("");
        return WHITESPACE.matcher(withoutDetails).replaceAll(" ").strip();
    }
}
