package ghost.overlay.render;

import ghost.overlay.diff.CollapsedSection;
import ghost.overlay.diff.DiffResult;
import java.util.Set;
import java.util.TreeSet;

/**
 * Presentation-side record of which collapsed sections are currently unfolded, keyed by section start.
 *
 * <p>Belongs to a single {@link DiffResult}; reset it whenever a new comparison replaces the old one.
 */
public class SectionExpansion {

    private final Set<Integer> expandedStarts = new TreeSet<>();

    public static SectionExpansion collapsed() {
        return new SectionExpansion();
    }

    public static SectionExpansion expanded(DiffResult result) {
        SectionExpansion expansion = new SectionExpansion();
        expansion.expandAll(result);
        return expansion;
    }

    public boolean isExpanded(CollapsedSection section) {
        return expandedStarts.contains(section.startLine());
    }

    public void expand(CollapsedSection section) {
        expandedStarts.add(section.startLine());
    }

    /**
     * @return whether the section is expanded after the toggle
     */
    public boolean toggle(CollapsedSection section) {
        if (expandedStarts.remove(section.startLine())) {
            return false;
        }
        expandedStarts.add(section.startLine());
        return true;
    }

    public void expandAll(DiffResult result) {
        result.collapsedSections().forEach(this::expand);
    }

    public void collapseAll() {
        expandedStarts.clear();
    }
}
