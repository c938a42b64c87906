package ghost.overlay.diff;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * Groups runs of consecutive matching lines into foldable sections.
 */
public class SectionCollapser {

    static final int MIN_SECTION_LINES = 3;
    static final int PREVIEW_LINES = 2;
    static final int PREVIEW_MAX_LENGTH = 60;
    static final String ELLIPSIS = "…";

    public List<CollapsedSection> collapse(List<DiffLine> diffLines) {
        Objects.requireNonNull(diffLines, "diffLines");

        List<CollapsedSection> sections = new ArrayList<>();
        int runStart = -1;
        for (int index = 0; index < diffLines.size(); index++) {
            if (diffLines.get(index).isMatch()) {
                if (runStart < 0) {
                    runStart = index;
                }
                continue;
            }
            if (runStart >= 0) {
                closeRun(diffLines, runStart, index - 1, sections);
                runStart = -1;
            }
        }
        if (runStart >= 0) {
            closeRun(diffLines, runStart, diffLines.size() - 1, sections);
        }
        return sections;
    }

    private void closeRun(List<DiffLine> diffLines, int start, int end, List<CollapsedSection> sections) {
        int lineCount = end - start + 1;
        if (lineCount < MIN_SECTION_LINES) {
            return;
        }
        sections.add(new CollapsedSection(start, end, lineCount, preview(diffLines, start, end)));
    }

    static String preview(List<DiffLine> diffLines, int start, int end) {
        String joined = diffLines.subList(start, Math.min(start + PREVIEW_LINES - 1, end) + 1).stream()
                .map(DiffLine::originalContent)
                .filter(Objects::nonNull)
                .map(LineText::trim)
                .collect(Collectors.joining(" "));
        if (joined.codePointCount(0, joined.length()) <= PREVIEW_MAX_LENGTH) {
            return joined;
        }
        return joined.substring(0, joined.offsetByCodePoints(0, PREVIEW_MAX_LENGTH)) + ELLIPSIS;
    }
}
