/**
 * CursorNavigator.java
 *
 * Owns a tree, its visible sequence and the single cursor into that sequence, and implements the
 * keyboard conventions of a WCAG tree view on top of them: circular Up/Down, Right to expand or
 * drill into, Left to collapse or drill out, Home/End within the sibling group, Ctrl+Home/End over
 * the whole tree, and "expand all" for container nodes.
 *
 * Every public operation clamps the cursor before acting, so a tree changed from outside (children
 * removed, labels renamed) never leaves the navigator pointing past the end.
 */
package club.ppmc.keynav.engine;

import club.ppmc.keynav.model.NavNode;
import club.ppmc.keynav.model.NavigationOutcome;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.function.Predicate;
import lombok.extern.slf4j.Slf4j;

@Slf4j
public class CursorNavigator {

    private List<NavNode> roots = new ArrayList<>();
    private List<NavNode> visible = new ArrayList<>();
    private int cursor = -1;

    public CursorNavigator() {}

    public CursorNavigator(List<NavNode> roots) {
        reset(roots);
    }

    /**
     * Replaces the tree and puts the cursor on the first node, as when a menu opens.
     */
    public void reset(List<NavNode> newRoots) {
        this.roots = newRoots != null ? newRoots : new ArrayList<>();
        this.visible = TreeFlattener.flatten(roots);
        this.cursor = visible.isEmpty() ? -1 : 0;
    }

    /**
     * Replaces the tree with a freshly built one, keeping what the user was looking at: expansion
     * flags are carried over by node key and the cursor goes back to the node with the same key,
     * else the first node with exactly the same label, else it stays at the old index clamped to
     * the new length.
     */
    public void rebuild(List<NavNode> newRoots) {
        NavNode previous = current();
        int previousCursor = cursor;
        String previousKey = previous != null ? previous.getKey() : null;
        String previousLabel = previous != null ? previous.getLabel() : null;

        ExpansionMemory memory = ExpansionMemory.capture(roots);
        this.roots = newRoots != null ? newRoots : new ArrayList<>();
        memory.applyTo(roots);
        this.visible = TreeFlattener.flatten(roots);
        restoreCursor(previousKey, previousLabel, previousCursor);
        log.debug("Rebuilt tree: {} visible nodes, cursor {}", visible.size(), cursor);
    }

    /**
     * Recomputes the visible sequence after the caller changed the tree in place. The cursor follows
     * the current node when it is still visible.
     */
    public void refreshVisible() {
        NavNode anchor = cursor >= 0 && cursor < visible.size() ? visible.get(cursor) : null;
        reflattenKeeping(anchor);
    }

    // ---- queries ----

    public int cursor() {
        clamp();
        return cursor;
    }

    public NavNode current() {
        clamp();
        return cursor < 0 ? null : visible.get(cursor);
    }

    public List<NavNode> visible() {
        return Collections.unmodifiableList(visible);
    }

    public List<NavNode> roots() {
        return Collections.unmodifiableList(roots);
    }

    public int size() {
        return visible.size();
    }

    public boolean isEmpty() {
        return visible.isEmpty();
    }

    public List<String> labels() {
        List<String> labels = new ArrayList<>(visible.size());
        for (NavNode node : visible) {
            labels.add(Objects.requireNonNullElse(node.getLabel(), ""));
        }
        return labels;
    }

    /**
     * Position of a node among its own siblings. Adjacent visible nodes can belong to different
     * parents, so this never looks at the visible sequence.
     */
    public SiblingPosition siblingPosition(NavNode node) {
        List<NavNode> siblings = TreeFlattener.siblingsOf(node, roots);
        int index = 0;
        for (int i = 0; i < siblings.size(); i++) {
            if (siblings.get(i) == node) {
                index = i;
                break;
            }
        }
        return new SiblingPosition(index, siblings.size());
    }

    // ---- linear movement ----

    public NavigationOutcome moveTo(int index) {
        clamp();
        if (index < 0 || index >= visible.size()) {
            return NavigationOutcome.UNCHANGED;
        }
        int old = cursor;
        cursor = index;
        return old == index ? NavigationOutcome.UNCHANGED : NavigationOutcome.MOVED;
    }

    /** Moves down, wrapping from the last node to the first. */
    public NavigationOutcome next() {
        clamp();
        if (visible.isEmpty()) {
            return NavigationOutcome.EMPTY;
        }
        cursor = (cursor + 1) % visible.size();
        return NavigationOutcome.MOVED;
    }

    /** Moves up, wrapping from the first node to the last. */
    public NavigationOutcome previous() {
        clamp();
        if (visible.isEmpty()) {
            return NavigationOutcome.EMPTY;
        }
        cursor = (cursor - 1 + visible.size()) % visible.size();
        return NavigationOutcome.MOVED;
    }

    // ---- WCAG expand / collapse ----

    /**
     * Right arrow. A collapsed branch is expanded and keeps the cursor; an expanded branch hands the
     * cursor to its first child; anything else is rejected without changing state.
     */
    public NavigationOutcome expandOrDrillDown() {
        NavNode node = current();
        if (node == null) {
            return NavigationOutcome.EMPTY;
        }
        if (!node.isBranch()) {
            return NavigationOutcome.CANNOT_EXPAND;
        }
        if (!node.isExpanded()) {
            node.setExpanded(true);
            reflattenKeeping(node);
            return NavigationOutcome.EXPANDED;
        }
        NavNode firstChild = node.getChildren().get(0);
        int index = TreeFlattener.indexOf(visible, firstChild);
        if (index < 0) {
            // Children were attached after the last flatten.
            reflattenKeeping(node);
            index = TreeFlattener.indexOf(visible, firstChild);
        }
        cursor = index;
        return NavigationOutcome.MOVED;
    }

    /**
     * Left arrow. An expanded branch is collapsed and keeps the cursor; otherwise the cursor moves
     * to the parent, which stays expanded. Roots that are not expanded are rejected.
     */
    public NavigationOutcome collapseOrDrillUp() {
        NavNode node = current();
        if (node == null) {
            return NavigationOutcome.EMPTY;
        }
        if (node.isBranch() && node.isExpanded()) {
            node.setExpanded(false);
            reflattenKeeping(node);
            return NavigationOutcome.COLLAPSED;
        }
        NavNode parent = node.getParent();
        if (parent == null) {
            return NavigationOutcome.AT_TOP_LEVEL;
        }
        int parentIndex = TreeFlattener.indexOf(visible, parent);
        cursor = Math.max(parentIndex, 0);
        return NavigationOutcome.MOVED;
    }

    /**
     * Expands every collapsed branch accepted by {@code filter}, visible or not, then reflattens once.
     *
     * @return the number of nodes newly expanded; 0 means everything was already open.
     */
    public int expandAll(Predicate<NavNode> filter) {
        int[] expanded = {0};
        TreeFlattener.walk(roots, node -> {
            if (filter.test(node) && node.isBranch() && !node.isExpanded()) {
                node.setExpanded(true);
                expanded[0]++;
            }
        });
        if (expanded[0] > 0) {
            refreshVisible();
        }
        return expanded[0];
    }

    // ---- Home / End ----

    /** Home: first visible node of the current sibling group. */
    public NavigationOutcome homeWithinLevel() {
        NavNode node = current();
        if (node == null) {
            return NavigationOutcome.EMPTY;
        }
        NavNode parent = node.getParent();
        for (int i = 0; i < visible.size(); i++) {
            if (visible.get(i).getParent() == parent) {
                return moveTo(i);
            }
        }
        return NavigationOutcome.UNCHANGED;
    }

    /** End: last visible node of the current sibling group. */
    public NavigationOutcome endWithinLevel() {
        NavNode node = current();
        if (node == null) {
            return NavigationOutcome.EMPTY;
        }
        NavNode parent = node.getParent();
        for (int i = visible.size() - 1; i >= 0; i--) {
            if (visible.get(i).getParent() == parent) {
                return moveTo(i);
            }
        }
        return NavigationOutcome.UNCHANGED;
    }

    /** Ctrl+Home: first node of the whole tree. */
    public NavigationOutcome absoluteHome() {
        clamp();
        if (visible.isEmpty()) {
            return NavigationOutcome.EMPTY;
        }
        return moveTo(0);
    }

    /** Ctrl+End: the bottom of the rendered tree, i.e. the deepest last visible descendant of the last root. */
    public NavigationOutcome absoluteEnd() {
        clamp();
        if (visible.isEmpty()) {
            return NavigationOutcome.EMPTY;
        }
        NavNode bottom = TreeFlattener.lastVisibleDescendant(roots.get(roots.size() - 1));
        int index = TreeFlattener.indexOf(visible, bottom);
        return moveTo(index >= 0 ? index : visible.size() - 1);
    }

    // ---- internals ----

    private void reflattenKeeping(NavNode anchor) {
        visible = TreeFlattener.flatten(roots);
        int index = anchor != null ? TreeFlattener.indexOf(visible, anchor) : -1;
        if (index >= 0) {
            cursor = index;
        } else {
            clamp();
        }
    }

    private void restoreCursor(String key, String label, int oldCursor) {
        if (visible.isEmpty()) {
            cursor = -1;
            return;
        }
        if (key != null) {
            for (int i = 0; i < visible.size(); i++) {
                if (key.equals(visible.get(i).getKey())) {
                    cursor = i;
                    return;
                }
            }
        }
        if (label != null) {
            // First exact match wins, even when siblings share a label.
            for (int i = 0; i < visible.size(); i++) {
                if (label.equals(visible.get(i).getLabel())) {
                    cursor = i;
                    return;
                }
            }
        }
        cursor = Math.min(Math.max(oldCursor, 0), visible.size() - 1);
    }

    private void clamp() {
        if (visible.isEmpty()) {
            cursor = -1;
        } else if (cursor >= visible.size()) {
            cursor = visible.size() - 1;
        } else if (cursor < 0) {
            cursor = 0;
        }
    }
}
