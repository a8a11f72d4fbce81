/**
 * AnnouncementFormatter.java
 *
 * Builds the phrases a screen reader speaks for menus: sibling position, expansion state, level
 * changes and search status. Plain strings in, plain strings out; the output channel is somebody
 * else's business.
 */
package club.ppmc.keynav.engine;

import club.ppmc.keynav.model.NavNode;

public final class AnnouncementFormatter {

    private AnnouncementFormatter() {}

    /**
     * "N of M" for a 0-based index, or an empty string when there is nothing to count.
     */
    public static String formatPosition(int index, int total) {
        if (total <= 1) {
            return "";
        }
        return (index + 1) + " of " + total;
    }

    public static String formatPosition(SiblingPosition position) {
        return formatPosition(position.index(), position.total());
    }

    /**
     * "expanded" or "collapsed" for nodes that can be expanded; empty for leaves, including
     * expandable nodes that have lost all their children.
     */
    public static String formatExpansionState(NavNode node) {
        if (node == null || !node.isBranch()) {
            return "";
        }
        return node.isExpanded() ? "expanded" : "collapsed";
    }

    /**
     * " level N." when {@code depth} differs from the last depth announced in {@code context},
     * otherwise empty. Levels are 1-based: roots are level 1.
     */
    public static String formatLevelSuffix(LevelTracker tracker, String context, int depth) {
        if (!tracker.update(context, depth)) {
            return "";
        }
        return " level " + (depth + 1) + ".";
    }

    /** "2 of 5 matches for 'ap'". */
    public static String formatSearchStatus(TypeaheadSearch search) {
        return search.currentMatchPosition() + " of " + search.matchCount()
                + " matches for '" + search.searchBuffer() + "'";
    }

    public static String formatNoMatches(String query) {
        return "No matches for '" + query + "'";
    }

    /**
     * The tree item shape: {@code "{label}[ {state}].[ {position}.]{levelSuffix}"}, e.g.
     * "Meals expanded. 2 of 4. level 2."
     */
    public static String formatTreeItem(String label, String state, String position, String levelSuffix) {
        StringBuilder text = new StringBuilder(label == null ? "" : label);
        if (!state.isEmpty()) {
            text.append(' ').append(state);
        }
        text.append('.');
        if (!position.isEmpty()) {
            text.append(' ').append(position).append('.');
        }
        text.append(levelSuffix);
        return text.toString().trim();
    }
}
