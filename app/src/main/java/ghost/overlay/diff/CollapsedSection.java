package ghost.overlay.diff;

import java.util.Objects;

/**
 * A run of matching lines that can be folded away. {@code startLine} and {@code endLine} are inclusive positions
 * in the {@link DiffResult#diffLines()} sequence, not in either source document.
 */
public record CollapsedSection(int startLine, int endLine, int lineCount, String preview) {

    public CollapsedSection {
        Objects.requireNonNull(preview, "preview");
        if (startLine < 0 || endLine < startLine) {
            throw new IllegalArgumentException("Invalid collapsed section boundaries");
        }
        if (lineCount != endLine - startLine + 1) {
            throw new IllegalArgumentException("lineCount must match section boundaries");
        }
    }

    public boolean contains(int position) {
        return position >= startLine && position <= endLine;
    }

    public String displayText() {
        return "Lines " + (startLine + 1) + "-" + (endLine + 1) + " match (" + lineCount + " lines)";
    }
}
