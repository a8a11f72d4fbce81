package club.ppmc.keynav.model;

/**
 * Kind tag of a {@link NavNode}. Nodes stay plain data; what a kind does on activation is
 * decided by the session's action table.
 */
public enum NodeKind {
    CATEGORY(true),
    ITEM(false),
    ACTION(false),
    SECTION(true),
    DETAIL(false),
    FILE(false);

    private final boolean container;

    NodeKind(boolean container) {
        this.container = container;
    }

    /** Container kinds are the ones expanded by "expand all" (the '*' key). */
    public boolean isContainer() {
        return container;
    }
}
