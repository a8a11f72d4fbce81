/**
 * NavNode.java
 *
 * A single entry of a navigable hierarchy: a category, an item, an action, a detail line or a file.
 * Mutable: label and expansion state change while a menu is open.
 * Nodes are built by the screen adapters and consumed by the engine, which never looks at the payload.
 */
package club.ppmc.keynav.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import lombok.AccessLevel;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import lombok.ToString;

@Getter
@Setter
@NoArgsConstructor
@ToString(exclude = {"parent", "children", "payload"})
public class NavNode {

    /** Display and announcement text. */
    private String label;

    /** Indentation level: 0 for roots, parent depth + 1 otherwise. Maintained by {@link #addChild}. */
    @Setter(AccessLevel.NONE)
    private int depth;

    /** Whether the node was built with children eligible to be shown. */
    private boolean expandable;

    /** UI state: whether the children are currently shown. Ignored for non-expandable nodes. */
    private boolean expanded;

    /** Back-reference used for upward walks and sibling lookup only. */
    @Setter(AccessLevel.NONE)
    private NavNode parent;

    @Getter(AccessLevel.NONE)
    @Setter(AccessLevel.NONE)
    private final List<NavNode> children = new ArrayList<>();

    private NodeKind kind = NodeKind.DETAIL;

    /** Domain-stable identity, used to carry expansion and selection across rebuilds. May be null. */
    private String key;

    /** Opaque handle to the domain value this node stands for. */
    private Object payload;

    public NavNode(String label, NodeKind kind) {
        this.label = label;
        this.kind = kind;
    }

    public NavNode(String label, NodeKind kind, String key, Object payload) {
        this(label, kind);
        this.key = key;
        this.payload = payload;
    }

    /**
     * Appends a child, re-parenting it and fixing the depth of its whole subtree.
     * A node that receives a child becomes expandable.
     *
     * @return the child, for chaining while building trees.
     */
    public NavNode addChild(NavNode child) {
        if (child.parent != null) {
            child.parent.children.remove(child);
        }
        child.parent = this;
        child.relevel(this.depth + 1);
        children.add(child);
        this.expandable = true;
        return child;
    }

    /**
     * Detaches a child. The node keeps its {@code expandable} flag, so a node that loses its last
     * child becomes expandable-but-empty and is navigated as a leaf.
     */
    public boolean removeChild(NavNode child) {
        if (children.remove(child)) {
            child.parent = null;
            child.relevel(0);
            return true;
        }
        return false;
    }

    /** Read-only view of the children, in display order. */
    public List<NavNode> getChildren() {
        return Collections.unmodifiableList(children);
    }

    public boolean hasChildren() {
        return !children.isEmpty();
    }

    /** True when the node can actually be expanded right now: expandable and not empty. */
    public boolean isBranch() {
        return expandable && !children.isEmpty();
    }

    public boolean isLeafForNavigation() {
        return !isBranch();
    }

    private void relevel(int newDepth) {
        this.depth = newDepth;
        for (NavNode child : children) {
            child.relevel(newDepth + 1);
        }
    }
}
