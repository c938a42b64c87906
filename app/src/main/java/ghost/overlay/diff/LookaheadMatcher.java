package ghost.overlay.diff;

import java.util.List;
import java.util.Objects;

/**
 * Searches a bounded window of upcoming lines for an exact trimmed match.
 */
public final class LookaheadMatcher {

    public static final int DEFAULT_WINDOW = 5;

    private LookaheadMatcher() {
    }

    /**
     * @param target trimmed line to look for
     * @param lines candidate lines starting at the current cursor
     * @param window maximum number of candidates to inspect
     */
    public static LookaheadMatch find(String target, List<String> lines, int window) {
        Objects.requireNonNull(target, "target");
        Objects.requireNonNull(lines, "lines");
        if (window < 0) {
            throw new IllegalArgumentException("window must be zero or greater");
        }
        int searchRange = Math.min(window, lines.size());
        for (int i = 0; i < searchRange; i++) {
            if (LineText.trim(lines.get(i)).equals(target)) {
                return LookaheadMatch.at(i);
            }
        }
        return LookaheadMatch.none();
    }
}
