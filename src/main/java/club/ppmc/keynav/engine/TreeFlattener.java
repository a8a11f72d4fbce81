/**
 * TreeFlattener.java
 *
 * Turns a forest of NavNodes into the ordered list of nodes currently shown: a pre-order,
 * depth-first, left-to-right walk that only descends into expanded nodes with children.
 * All functions are pure; the visible sequence is always recomputed in full, never patched.
 */
package club.ppmc.keynav.engine;

import club.ppmc.keynav.model.NavNode;
import java.util.ArrayList;
import java.util.List;
import java.util.function.Consumer;

public final class TreeFlattener {

    private TreeFlattener() {}

    /**
     * Computes the visible sequence. A node appears iff every ancestor is expanded.
     *
     * @param roots top-level nodes; null or empty yields an empty list.
     * @return a new mutable list.
     */
    public static List<NavNode> flatten(List<NavNode> roots) {
        List<NavNode> visible = new ArrayList<>();
        if (roots != null) {
            addVisibleNodes(roots, visible);
        }
        return visible;
    }

    private static void addVisibleNodes(List<NavNode> nodes, List<NavNode> visible) {
        for (NavNode node : nodes) {
            visible.add(node);
            if (node.isExpanded() && node.hasChildren()) {
                addVisibleNodes(node.getChildren(), visible);
            }
        }
    }

    /**
     * Sibling group of a node: its parent's children, or the root list for a root.
     */
    public static List<NavNode> siblingsOf(NavNode node, List<NavNode> roots) {
        return node.getParent() != null ? node.getParent().getChildren() : roots;
    }

    /**
     * The bottom of the rendered subtree under {@code node}: follows the last child while the
     * current node is expanded. Returns the node itself when collapsed or childless.
     */
    public static NavNode lastVisibleDescendant(NavNode node) {
        NavNode current = node;
        while (current.isExpanded() && current.hasChildren()) {
            List<NavNode> children = current.getChildren();
            current = children.get(children.size() - 1);
        }
        return current;
    }

    /**
     * Visits every materialized node in pre-order, collapsed subtrees included.
     */
    public static void walk(List<NavNode> roots, Consumer<NavNode> visitor) {
        if (roots == null) {
            return;
        }
        for (NavNode node : roots) {
            visitor.accept(node);
            walk(node.getChildren(), visitor);
        }
    }

    /**
     * Identity lookup of a node in a visible sequence. Two nodes with equal labels are distinct.
     *
     * @return the index, or -1 when the node is not visible.
     */
    public static int indexOf(List<NavNode> visible, NavNode node) {
        for (int i = 0; i < visible.size(); i++) {
            if (visible.get(i) == node) {
                return i;
            }
        }
        return -1;
    }
}
