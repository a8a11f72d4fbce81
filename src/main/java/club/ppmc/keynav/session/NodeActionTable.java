/**
 * NodeActionTable.java
 *
 * Dispatch table from node kind to what Enter does on such a node. Owned by each menu session, so
 * the tree itself carries no behaviour and can be built and navigated on its own.
 */
package club.ppmc.keynav.session;

import club.ppmc.keynav.model.NavNode;
import club.ppmc.keynav.model.NodeKind;
import java.util.EnumMap;
import java.util.Map;

public class NodeActionTable {

    /** What activating a node does. */
    @FunctionalInterface
    public interface NodeAction {
        void activate(NavNode node);
    }

    private final Map<NodeKind, NodeAction> actions = new EnumMap<>(NodeKind.class);

    public NodeActionTable register(NodeKind kind, NodeAction action) {
        actions.put(kind, action);
        return this;
    }

    public boolean supports(NavNode node) {
        return node != null && actions.containsKey(node.getKind());
    }

    /**
     * Runs the action registered for the node's kind.
     *
     * @return false when no action is registered.
     */
    public boolean dispatch(NavNode node) {
        NodeAction action = node != null ? actions.get(node.getKind()) : null;
        if (action == null) {
            return false;
        }
        action.activate(node);
        return true;
    }
}
