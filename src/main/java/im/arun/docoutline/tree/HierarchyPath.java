package im.arun.docoutline.tree;

import im.arun.docoutline.model.HeadingLevel;

import java.util.Arrays;
import java.util.List;

/**
 * Labels of the currently open heading at each depth, outermost first. At most four slots.
 */
public class HierarchyPath {
    private static final int MAX_DEPTH = 4;

    private final String[] labels = new String[MAX_DEPTH];
    private final int labelLength;
    private int size;

    public HierarchyPath(int labelLength) {
        this.labelLength = labelLength;
    }

    /**
     * Opens a heading at the given level, closing any open headings at the same or deeper levels.
     */
    public void descend(HeadingLevel level, String text) {
        int keep = Math.min(level.depth(), size);
        Arrays.fill(labels, keep, MAX_DEPTH, null);
        labels[keep] = text.length() > labelLength ? text.substring(0, labelLength) : text;
        size = keep + 1;
    }

    public int size() {
        return size;
    }

    public List<String> labels() {
        return List.of(Arrays.copyOf(labels, size));
    }

    @Override
    public String toString() {
        return String.join(" > ", labels());
    }
}
