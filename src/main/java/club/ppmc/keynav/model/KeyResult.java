package club.ppmc.keynav.model;

/**
 * Whether a session consumed an input event. When it did, the host suppresses its own handling.
 */
public enum KeyResult {
    HANDLED,
    NOT_HANDLED;

    public static KeyResult of(boolean handled) {
        return handled ? HANDLED : NOT_HANDLED;
    }
}
