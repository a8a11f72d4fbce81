/**
 * KeyStrokeRequest.java
 *
 * Request body for delivering a key press to the open menu.
 * Used by MenuController; the key name is parsed with NavKey#parse.
 */
package club.ppmc.keynav.model;

import jakarta.validation.constraints.NotBlank;

/**
 * @param key   key name, e.g. "ArrowDown", "Home", "Escape", "*".
 * @param ctrl  Ctrl held.
 * @param shift Shift held.
 * @param alt   Alt held.
 */
public record KeyStrokeRequest(@NotBlank String key, boolean ctrl, boolean shift, boolean alt) {

    public KeyStroke toKeyStroke() {
        return new KeyStroke(NavKey.parse(key), ctrl, shift, alt);
    }
}
