/**
 * MenuSnapshot.java
 *
 * Read-only view of the open menu returned by the REST API: what is visible, where the cursor is,
 * what was last announced, and the state of the typeahead search.
 */
package club.ppmc.keynav.model;

import java.util.List;

public record MenuSnapshot(
        String screen,
        boolean open,
        List<String> visibleLabels,
        int cursor,
        String selectedLabel,
        String announcement,
        String searchBuffer,
        int matchCount) {
}
