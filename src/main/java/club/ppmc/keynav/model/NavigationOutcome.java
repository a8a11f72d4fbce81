package club.ppmc.keynav.model;

/**
 * What a cursor operation did. None of these is an error: the rejected ones exist so the host can
 * play a distinct cue.
 */
public enum NavigationOutcome {
    MOVED,
    UNCHANGED,
    EXPANDED,
    COLLAPSED,
    CANNOT_EXPAND,
    AT_TOP_LEVEL,
    EMPTY;

    public boolean isRejected() {
        return this == CANNOT_EXPAND || this == AT_TOP_LEVEL || this == EMPTY;
    }

    public boolean isStructural() {
        return this == EXPANDED || this == COLLAPSED;
    }
}
