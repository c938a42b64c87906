package ghost.overlay.diff;

import java.util.List;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Compares an original document with its ghost: split, align, drop reordered pairs, then fold matching runs.
 *
 * <p>Instances hold no per-comparison state and may be shared between threads.
 */
public class GhostOverlayComparator {

    private static final Logger LOGGER = LoggerFactory.getLogger(GhostOverlayComparator.class);

    private final AlignmentEngine alignmentEngine;
    private final FalsePositiveFilter falsePositiveFilter;
    private final SectionCollapser sectionCollapser;

    public GhostOverlayComparator() {
        this(new AlignmentEngine(), new FalsePositiveFilter(), new SectionCollapser());
    }

    GhostOverlayComparator(AlignmentEngine alignmentEngine,
                           FalsePositiveFilter falsePositiveFilter,
                           SectionCollapser sectionCollapser) {
        this.alignmentEngine = Objects.requireNonNull(alignmentEngine, "alignmentEngine");
        this.falsePositiveFilter = Objects.requireNonNull(falsePositiveFilter, "falsePositiveFilter");
        this.sectionCollapser = Objects.requireNonNull(sectionCollapser, "sectionCollapser");
    }

    public DiffResult compare(String original, String ghost) {
        List<String> originalLines = LineSplitter.split(Objects.requireNonNull(original, "original"));
        List<String> ghostLines = LineSplitter.split(Objects.requireNonNull(ghost, "ghost"));

        List<DiffLine> aligned = alignmentEngine.align(originalLines, ghostLines);
        List<DiffLine> filtered = falsePositiveFilter.filter(aligned);
        List<CollapsedSection> sections = sectionCollapser.collapse(filtered);
        DiffResult result = new DiffResult(filtered, sections);

        if (LOGGER.isDebugEnabled()) {
            LOGGER.debug("Compared {} original lines with {} ghost lines: {} aligned, {} reconciled, {} differences, {} sections",
                    originalLines.size(), ghostLines.size(), aligned.size(), aligned.size() - filtered.size(),
                    result.differenceCount(), sections.size());
        }
        return result;
    }
}
