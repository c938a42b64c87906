package ghost.overlay.diff;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * Drops insert/delete pairs whose trimmed content is identical, wherever they landed in the sequence.
 *
 * <p>Each original-only line is paired with the first unconsumed ghost-only line of equal, non-empty content in
 * emission order. With duplicate content this can pair a line with an unrelated twin.
 */
public class FalsePositiveFilter {

    public List<DiffLine> filter(List<DiffLine> diffLines) {
        Objects.requireNonNull(diffLines, "diffLines");

        List<Integer> onlyInOriginal = new ArrayList<>();
        List<Integer> onlyInGhost = new ArrayList<>();
        for (int i = 0; i < diffLines.size(); i++) {
            switch (diffLines.get(i).type()) {
                case ONLY_IN_ORIGINAL -> onlyInOriginal.add(i);
                case ONLY_IN_GHOST -> onlyInGhost.add(i);
                default -> {
                }
            }
        }

        Set<Integer> skipped = new HashSet<>();
        for (int originalPosition : onlyInOriginal) {
            String originalContent = LineText.trim(diffLines.get(originalPosition).originalContent());
            if (originalContent.isEmpty()) {
                continue;
            }
            for (int ghostPosition : onlyInGhost) {
                if (skipped.contains(ghostPosition)) {
                    continue;
                }
                String ghostContent = LineText.trim(diffLines.get(ghostPosition).ghostContent());
                if (originalContent.equals(ghostContent)) {
                    skipped.add(originalPosition);
                    skipped.add(ghostPosition);
                    break;
                }
            }
        }

        if (skipped.isEmpty()) {
            return List.copyOf(diffLines);
        }
        List<DiffLine> result = new ArrayList<>(diffLines.size() - skipped.size());
        for (int i = 0; i < diffLines.size(); i++) {
            if (!skipped.contains(i)) {
                result.add(diffLines.get(i));
            }
        }
        return result;
    }
}
