package club.ppmc.keynav.model;

/**
 * Sound cue accompanying a narration. Playing it is up to the client.
 */
public enum NarrationCue {
    /** No sound. */
    NONE,
    /** Cursor moved. */
    TICK,
    /** Something was expanded, collapsed or activated. */
    CLICK,
    /** The key had nothing to act on. */
    REJECT,
    OPEN,
    CLOSE
}
