/**
 * ExpansionMemory.java
 *
 * Remembers which nodes were expanded, by domain key, so that a tree rebuilt from fresh domain
 * data opens up the same way. Nodes without a key are remembered by label.
 */
package club.ppmc.keynav.engine;

import club.ppmc.keynav.model.NavNode;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

public final class ExpansionMemory {

    private final Map<String, Boolean> expandedByKey;

    private ExpansionMemory(Map<String, Boolean> expandedByKey) {
        this.expandedByKey = expandedByKey;
    }

    public static ExpansionMemory capture(List<NavNode> roots) {
        Map<String, Boolean> state = new HashMap<>();
        TreeFlattener.walk(roots, node -> {
            String key = keyOf(node);
            if (key != null && !key.isEmpty()) {
                state.put(key, node.isExpanded());
            }
        });
        return new ExpansionMemory(state);
    }

    /**
     * Applies the remembered flags to a new tree. Nodes that were not present before keep the
     * expansion state they were built with.
     *
     * @return how many nodes had a remembered state.
     */
    public int applyTo(List<NavNode> roots) {
        int[] restored = {0};
        TreeFlattener.walk(roots, node -> {
            String key = keyOf(node);
            if (key == null) {
                return;
            }
            Boolean wasExpanded = expandedByKey.get(key);
            if (wasExpanded != null) {
                node.setExpanded(wasExpanded);
                restored[0]++;
            }
        });
        return restored[0];
    }

    public int size() {
        return expandedByKey.size();
    }

    static String keyOf(NavNode node) {
        return node.getKey() != null ? node.getKey() : node.getLabel();
    }
}
