package ghost.overlay.diff;

import java.util.Objects;

/**
 * One aligned unit of the comparison output. Line numbers are zero-based indices into the source documents.
 */
public record DiffLine(
        Integer originalLineNumber,
        Integer ghostLineNumber,
        String originalContent,
        String ghostContent,
        DiffLineType type
) {

    public DiffLine {
        Objects.requireNonNull(type, "type");
        boolean hasOriginal = originalLineNumber != null && originalContent != null;
        boolean hasGhost = ghostLineNumber != null && ghostContent != null;
        switch (type) {
            case MATCH, MODIFIED -> {
                if (!hasOriginal || !hasGhost) {
                    throw new IllegalArgumentException(type + " line requires both sides");
                }
            }
            case ONLY_IN_ORIGINAL -> {
                if (!hasOriginal || ghostLineNumber != null || ghostContent != null) {
                    throw new IllegalArgumentException("ONLY_IN_ORIGINAL line must carry only the original side");
                }
            }
            case ONLY_IN_GHOST -> {
                if (!hasGhost || originalLineNumber != null || originalContent != null) {
                    throw new IllegalArgumentException("ONLY_IN_GHOST line must carry only the ghost side");
                }
            }
        }
    }

    public static DiffLine match(int originalIndex, String originalContent, int ghostIndex, String ghostContent) {
        return new DiffLine(originalIndex, ghostIndex, originalContent, ghostContent, DiffLineType.MATCH);
    }

    public static DiffLine modified(int originalIndex, String originalContent, int ghostIndex, String ghostContent) {
        return new DiffLine(originalIndex, ghostIndex, originalContent, ghostContent, DiffLineType.MODIFIED);
    }

    public static DiffLine onlyInOriginal(int originalIndex, String originalContent) {
        return new DiffLine(originalIndex, null, originalContent, null, DiffLineType.ONLY_IN_ORIGINAL);
    }

    public static DiffLine onlyInGhost(int ghostIndex, String ghostContent) {
        return new DiffLine(null, ghostIndex, null, ghostContent, DiffLineType.ONLY_IN_GHOST);
    }

    public boolean isMatch() {
        return type == DiffLineType.MATCH;
    }

    public boolean isDifference() {
        return type.isDifference();
    }
}
