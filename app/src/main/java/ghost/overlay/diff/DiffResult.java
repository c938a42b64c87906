package ghost.overlay.diff;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.stream.Collectors;
import java.util.stream.IntStream;

/**
 * Immutable outcome of one comparison: the aligned lines and the foldable sections over them.
 */
public class DiffResult {

    private final List<DiffLine> diffLines;
    private final List<CollapsedSection> collapsedSections;

    public DiffResult(List<DiffLine> diffLines, List<CollapsedSection> collapsedSections) {
        this.diffLines = Collections.unmodifiableList(new ArrayList<>(
                Objects.requireNonNull(diffLines, "diffLines")));
        this.collapsedSections = Collections.unmodifiableList(new ArrayList<>(
                Objects.requireNonNull(collapsedSections, "collapsedSections")));
    }

    public List<DiffLine> diffLines() {
        return diffLines;
    }

    public List<CollapsedSection> collapsedSections() {
        return collapsedSections;
    }

    public int differenceCount() {
        return (int) diffLines.stream()
                .filter(DiffLine::isDifference)
                .count();
    }

    /**
     * Ascending positions in {@link #diffLines()} that are not matches.
     */
    public List<Integer> differenceIndices() {
        return IntStream.range(0, diffLines.size())
                .filter(index -> diffLines.get(index).isDifference())
                .boxed()
                .collect(Collectors.toUnmodifiableList());
    }

    public boolean isIdentical() {
        return diffLines.stream().noneMatch(DiffLine::isDifference);
    }

    public DiffLine lineAt(int position) {
        return diffLines.get(position);
    }

    /**
     * Zero-based ghost line a host should jump to for the given position; empty for lines missing from the ghost.
     */
    public Optional<Integer> ghostJumpTarget(int position) {
        return Optional.ofNullable(diffLines.get(position).ghostLineNumber());
    }

    public Optional<CollapsedSection> sectionContaining(int position) {
        return collapsedSections.stream()
                .filter(section -> section.contains(position))
                .findFirst();
    }
}
