package club.ppmc.keynav.model;

import java.util.Locale;

/**
 * Physical keys a menu session reacts to. Printable characters for typeahead travel on their own
 * channel (MenuSession#onCharacter) and are not listed here.
 */
public enum NavKey {
    UP,
    DOWN,
    LEFT,
    RIGHT,
    HOME,
    END,
    ENTER,
    ESCAPE,
    BACKSPACE,
    DELETE,
    /** Numpad '*' or Shift+8: expand every container. */
    STAR;

    /**
     * Parses key names as browsers and hosts report them ("ArrowUp", "Enter", "Esc", "*", "up").
     *
     * @throws IllegalArgumentException for unknown names.
     */
    public static NavKey parse(String name) {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("Key name must not be blank");
        }
        String normalized = name.trim().toUpperCase(Locale.ROOT);
        if (normalized.startsWith("ARROW")) {
            normalized = normalized.substring("ARROW".length());
        }
        return switch (normalized) {
            case "*", "MULTIPLY", "KEYPADMULTIPLY" -> STAR;
            case "ESC" -> ESCAPE;
            case "RETURN", "KEYPADENTER" -> ENTER;
            case "DEL" -> DELETE;
            default -> {
                try {
                    yield NavKey.valueOf(normalized);
                } catch (IllegalArgumentException e) {
                    throw new IllegalArgumentException("Unknown key: " + name, e);
                }
            }
        };
    }
}
