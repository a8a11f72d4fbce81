package club.ppmc.keynav.model;

/**
 * Reply to a key or character sent to the open menu.
 *
 * @param result HANDLED when the menu consumed the input.
 * @param menu   state of the menu after the input, including when the input closed it.
 */
public record InputResponse(KeyResult result, MenuSnapshot menu) {
}
