package ghost.overlay.diff;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Walks both documents with two cursors and emits one classified {@link DiffLine} per step.
 *
 * <p>When neither an exact match nor a shared key settles a pair, a bounded lookahead in both directions decides
 * between an insertion, a deletion and a modification. Ties between the two directions go to the ghost insertion.
 */
public class AlignmentEngine {

    private final int lookaheadWindow;

    public AlignmentEngine() {
        this(LookaheadMatcher.DEFAULT_WINDOW);
    }

    public AlignmentEngine(int lookaheadWindow) {
        if (lookaheadWindow < 0) {
            throw new IllegalArgumentException("lookaheadWindow must be zero or greater");
        }
        this.lookaheadWindow = lookaheadWindow;
    }

    public List<DiffLine> align(List<String> original, List<String> ghost) {
        Objects.requireNonNull(original, "original");
        Objects.requireNonNull(ghost, "ghost");

        List<DiffLine> result = new ArrayList<>(Math.max(original.size(), ghost.size()));
        int originalIndex = 0;
        int ghostIndex = 0;

        while (originalIndex < original.size() || ghostIndex < ghost.size()) {
            if (ghostIndex >= ghost.size()) {
                result.add(DiffLine.onlyInOriginal(originalIndex, original.get(originalIndex)));
                originalIndex++;
                continue;
            }
            if (originalIndex >= original.size()) {
                result.add(DiffLine.onlyInGhost(ghostIndex, ghost.get(ghostIndex)));
                ghostIndex++;
                continue;
            }

            String originalLine = original.get(originalIndex);
            String ghostLine = ghost.get(ghostIndex);
            String trimmedOriginal = LineText.trim(originalLine);
            String trimmedGhost = LineText.trim(ghostLine);

            if (trimmedOriginal.equals(trimmedGhost)) {
                result.add(DiffLine.match(originalIndex, originalLine, ghostIndex, ghostLine));
                originalIndex++;
                ghostIndex++;
                continue;
            }

            Optional<String> originalKey = KeyExtractor.extract(trimmedOriginal);
            Optional<String> ghostKey = KeyExtractor.extract(trimmedGhost);
            if (originalKey.isPresent() && originalKey.equals(ghostKey)) {
                result.add(DiffLine.modified(originalIndex, originalLine, ghostIndex, ghostLine));
                originalIndex++;
                ghostIndex++;
                continue;
            }

            LookaheadMatch originalInGhost = LookaheadMatcher.find(trimmedOriginal,
                    ghost.subList(ghostIndex, ghost.size()), lookaheadWindow);
            LookaheadMatch ghostInOriginal = LookaheadMatcher.find(trimmedGhost,
                    original.subList(originalIndex, original.size()), lookaheadWindow);

            switch (resolve(originalInGhost, ghostInOriginal)) {
                case GHOST_INSERTION -> {
                    result.add(DiffLine.onlyInGhost(ghostIndex, ghostLine));
                    ghostIndex++;
                }
                case ORIGINAL_DELETION -> {
                    result.add(DiffLine.onlyInOriginal(originalIndex, originalLine));
                    originalIndex++;
                }
                case MODIFICATION -> {
                    result.add(DiffLine.modified(originalIndex, originalLine, ghostIndex, ghostLine));
                    originalIndex++;
                    ghostIndex++;
                }
            }
        }
        return result;
    }

    /**
     * Priority rule for an ambiguous pair. The original line reappearing in the ghost means the ghost inserted
     * content first; it wins unless the ghost line reappears strictly sooner in the original.
     */
    static Resolution resolve(LookaheadMatch originalInGhost, LookaheadMatch ghostInOriginal) {
        if (originalInGhost.found()
                && (!ghostInOriginal.found() || originalInGhost.offset() <= ghostInOriginal.offset())) {
            return Resolution.GHOST_INSERTION;
        }
        if (ghostInOriginal.found()) {
            return Resolution.ORIGINAL_DELETION;
        }
        return Resolution.MODIFICATION;
    }

    enum Resolution {
        GHOST_INSERTION,
        ORIGINAL_DELETION,
        MODIFICATION
    }
}
