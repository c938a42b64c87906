package ghost.overlay.diff;

/**
 * Outcome of a bounded lookahead search. {@code offset} is relative to the current cursor and is {@code -1} when
 * nothing was found.
 */
public record LookaheadMatch(boolean found, int offset) {

    private static final LookaheadMatch NONE = new LookaheadMatch(false, -1);

    public LookaheadMatch {
        if (found && offset < 0) {
            throw new IllegalArgumentException("offset must be zero or greater when a match is found");
        }
        if (!found && offset != -1) {
            throw new IllegalArgumentException("offset must be -1 when no match is found");
        }
    }

    public static LookaheadMatch none() {
        return NONE;
    }

    public static LookaheadMatch at(int offset) {
        return new LookaheadMatch(true, offset);
    }
}
