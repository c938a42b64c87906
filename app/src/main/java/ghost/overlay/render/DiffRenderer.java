package ghost.overlay.render;

import ghost.overlay.diff.CollapsedSection;
import ghost.overlay.diff.DiffLine;
import ghost.overlay.diff.DiffResult;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Objects;

/**
 * Renders a {@link DiffResult} as plain text rows, folding collapsed sections that are not expanded.
 */
public class DiffRenderer {

    static final String ORIGINAL_LABEL = "Original";
    static final String GHOST_LABEL = "Ghost";

    public List<String> render(DiffResult result, SectionExpansion expansion) {
        Objects.requireNonNull(result, "result");
        Objects.requireNonNull(expansion, "expansion");

        List<String> rows = new ArrayList<>();
        List<DiffLine> lines = result.diffLines();
        Iterator<CollapsedSection> sections = result.collapsedSections().iterator();
        CollapsedSection nextSection = sections.hasNext() ? sections.next() : null;
        for (int index = 0; index < lines.size(); index++) {
            if (nextSection != null && index == nextSection.startLine()) {
                CollapsedSection current = nextSection;
                nextSection = sections.hasNext() ? sections.next() : null;
                boolean expanded = expansion.isExpanded(current);
                rows.add((expanded ? "▾ " : "▸ ") + current.displayText());
                if (!expanded) {
                    if (!current.preview().isEmpty()) {
                        rows.add("    " + current.preview());
                    }
                    index = current.endLine();
                    continue;
                }
            }
            renderLine(lines.get(index), rows);
        }

        int differences = result.differenceCount();
        rows.add(differences + (differences == 1 ? " difference" : " differences"));
        return rows;
    }

    private void renderLine(DiffLine line, List<String> rows) {
        switch (line.type()) {
            case MATCH -> rows.add(row(line.originalLineNumber(), ' ', null, line.originalContent()));
            case MODIFIED -> {
                rows.add(row(line.originalLineNumber(), '-', ORIGINAL_LABEL, line.originalContent()));
                rows.add(row(line.ghostLineNumber(), '+', GHOST_LABEL, line.ghostContent()));
            }
            case ONLY_IN_ORIGINAL -> rows.add(row(line.originalLineNumber(), '-', ORIGINAL_LABEL, line.originalContent()));
            case ONLY_IN_GHOST -> rows.add(row(line.ghostLineNumber(), '+', GHOST_LABEL, line.ghostContent()));
        }
    }

    static String row(Integer lineNumber, char marker, String label, String content) {
        String number = lineNumber == null ? "" : String.valueOf(lineNumber + 1);
        String labelColumn = label == null ? "" : String.format("%-8s ", label);
        return String.format("%4s %c %s%s", number, marker, labelColumn, content);
    }
}
