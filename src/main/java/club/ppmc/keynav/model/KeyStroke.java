package club.ppmc.keynav.model;

/**
 * A key press with its modifiers, as delivered by the host's input loop.
 */
public record KeyStroke(NavKey key, boolean ctrl, boolean shift, boolean alt) {

    public static KeyStroke of(NavKey key) {
        return new KeyStroke(key, false, false, false);
    }

    public static KeyStroke ctrl(NavKey key) {
        return new KeyStroke(key, true, false, false);
    }
}
