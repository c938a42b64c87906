package ghost.overlay.diff;

/**
 * Classification of a single aligned line.
 */
public enum DiffLineType {
    MATCH,
    ONLY_IN_ORIGINAL,
    ONLY_IN_GHOST,
    MODIFIED;

    public boolean isDifference() {
        return this != MATCH;
    }
}
