package club.ppmc.keynav.engine;

/**
 * Position of a node among its parent's children (or among the roots).
 *
 * @param index 0-based index in the sibling list.
 * @param total number of siblings, the node included.
 */
public record SiblingPosition(int index, int total) {
}
