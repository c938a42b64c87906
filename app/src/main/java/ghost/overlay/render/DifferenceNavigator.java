package ghost.overlay.render;

import ghost.overlay.diff.DiffResult;
import java.util.List;
import java.util.Objects;
import java.util.OptionalInt;

/**
 * Wrap-around cursor over the difference positions of a {@link DiffResult}.
 */
public class DifferenceNavigator {

    private final List<Integer> differenceIndices;
    private int current;

    public DifferenceNavigator(DiffResult result) {
        this.differenceIndices = Objects.requireNonNull(result, "result").differenceIndices();
        this.current = 0;
    }

    public boolean hasDifferences() {
        return !differenceIndices.isEmpty();
    }

    public int size() {
        return differenceIndices.size();
    }

    /**
     * Position in {@link DiffResult#diffLines()} of the current difference.
     */
    public OptionalInt current() {
        if (differenceIndices.isEmpty()) {
            return OptionalInt.empty();
        }
        return OptionalInt.of(differenceIndices.get(current));
    }

    public OptionalInt next() {
        if (differenceIndices.isEmpty()) {
            return OptionalInt.empty();
        }
        current = (current + 1) % differenceIndices.size();
        return current();
    }

    public OptionalInt previous() {
        if (differenceIndices.isEmpty()) {
            return OptionalInt.empty();
        }
        current = (current - 1 + differenceIndices.size()) % differenceIndices.size();
        return current();
    }
}
