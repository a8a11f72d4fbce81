/**
 * MenuSessionException.java
 *
 * Raised by MenuSessionService when a request cannot be served: no menu is open, or the request
 * names a key or character the menus do not understand. Carries a machine-readable code so the
 * controllers can turn it into a structured error response.
 */
package club.ppmc.keynav.exception;

import java.util.Map;
import lombok.Getter;

@Getter
public class MenuSessionException extends RuntimeException {

    public static final String NO_ACTIVE_MENU = "NO_ACTIVE_MENU";
    public static final String INVALID_INPUT = "INVALID_INPUT";

    /** One of {@link #NO_ACTIVE_MENU} or {@link #INVALID_INPUT}. */
    private final String code;

    public MenuSessionException(String message, String code) {
        super(message);
        this.code = code;
    }

    public static MenuSessionException noActiveMenu() {
        return new MenuSessionException("No menu is open.", NO_ACTIVE_MENU);
    }

    public boolean isNoActiveMenu() {
        return NO_ACTIVE_MENU.equals(code);
    }

    /**
     * @return the error as a map ready to be serialized into a response body.
     */
    public Map<String, Object> toErrorData() {
        return Map.of(
                "type", "MENU_ERROR",
                "code", getCode(),
                "message", getMessage());
    }
}
