package im.arun.docoutline.model;

/**
 * Heading levels, H1 being the outermost. The depth is the number of ancestor
 * slots a heading of this level keeps in the hierarchy path.
 */
public enum HeadingLevel {
    H1(0),
    H2(1),
    H3(2),
    H4(3);

    private final int depth;

    HeadingLevel(int depth) {
        this.depth = depth;
    }

    public int depth() {
        return depth;
    }
}
