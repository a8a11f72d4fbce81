package club.ppmc.keynav.engine;

import static org.junit.jupiter.api.Assertions.assertEquals;

import club.ppmc.keynav.model.NavNode;
import club.ppmc.keynav.model.NodeKind;
import java.util.List;
import org.junit.jupiter.api.Test;

class AnnouncementFormatterTest {

    @Test
    void positionIsOneBasedAndOmittedForSingleEntries() {
        assertEquals("3 of 7", AnnouncementFormatter.formatPosition(2, 7));
        assertEquals("", AnnouncementFormatter.formatPosition(0, 1));
        assertEquals("", AnnouncementFormatter.formatPosition(0, 0));
        assertEquals("2 of 2", AnnouncementFormatter.formatPosition(new SiblingPosition(1, 2)));
    }

    @Test
    void expansionStateOnlyForRealBranches() {
        NavNode category = new NavNode("Food", NodeKind.CATEGORY);
        NavNode meal = category.addChild(new NavNode("Meal", NodeKind.ITEM));

        assertEquals("collapsed", AnnouncementFormatter.formatExpansionState(category));
        category.setExpanded(true);
        assertEquals("expanded", AnnouncementFormatter.formatExpansionState(category));
        assertEquals("", AnnouncementFormatter.formatExpansionState(meal));

        category.removeChild(meal);
        assertEquals("", AnnouncementFormatter.formatExpansionState(category));
        assertEquals("", AnnouncementFormatter.formatExpansionState(null));
    }

    @Test
    void levelSuffixOnlyWhenDepthChanges() {
        LevelTracker tracker = new LevelTracker();

        assertEquals(" level 1.", AnnouncementFormatter.formatLevelSuffix(tracker, "Inventory", 0));
        assertEquals("", AnnouncementFormatter.formatLevelSuffix(tracker, "Inventory", 0));
        assertEquals(" level 2.", AnnouncementFormatter.formatLevelSuffix(tracker, "Inventory", 1));
        assertEquals(" level 1.", AnnouncementFormatter.formatLevelSuffix(tracker, "Details", 0));
        assertEquals(" level 1.", AnnouncementFormatter.formatLevelSuffix(tracker, "Inventory", 0));
    }

    @Test
    void searchStatusAndMisses() {
        TypeaheadSearch search = new TypeaheadSearch();
        search.processCharacter('a', List.of("Apple", "Pear", "Banana"), 1);

        assertEquals("2 of 3 matches for 'a'", AnnouncementFormatter.formatSearchStatus(search));
        assertEquals("No matches for 'xyz'", AnnouncementFormatter.formatNoMatches("xyz"));
    }

    @Test
    void treeItemShape() {
        assertEquals("Meals expanded. 2 of 4. level 2.",
                AnnouncementFormatter.formatTreeItem("Meals", "expanded", "2 of 4", " level 2."));
        assertEquals("Simple meal x4.", AnnouncementFormatter.formatTreeItem("Simple meal x4", "", "", ""));
        assertEquals("Food collapsed. level 1.",
                AnnouncementFormatter.formatTreeItem("Food", "collapsed", "", " level 1."));
    }
}
