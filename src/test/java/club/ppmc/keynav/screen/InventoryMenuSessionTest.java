package club.ppmc.keynav.screen;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.Mockito.atLeastOnce;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;

import club.ppmc.keynav.engine.LevelTracker;
import club.ppmc.keynav.model.InventoryRecord;
import club.ppmc.keynav.model.KeyResult;
import club.ppmc.keynav.model.KeyStroke;
import club.ppmc.keynav.model.NarrationCue;
import club.ppmc.keynav.model.NarrationEvent;
import club.ppmc.keynav.model.NavKey;
import club.ppmc.keynav.model.NavigationSettings;
import club.ppmc.keynav.model.NodeKind;
import club.ppmc.keynav.session.NarrationSink;
import java.util.List;
import java.util.concurrent.atomic.AtomicReference;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

class InventoryMenuSessionTest {

    private static final List<InventoryRecord> COLONY = List.of(
            new InventoryRecord("Food/Meals", "Simple meal", 4, null),
            new InventoryRecord("Food/Meals", "Simple meal", 2, null),
            new InventoryRecord("Food/Meals", "Fine meal", 1, "Alice"),
            new InventoryRecord("Food", "Berries", 10, null),
            new InventoryRecord("Weapons", "Knife", 1, "Bob"),
            new InventoryRecord("", "Wood", 50, null));

    private NarrationSink sink;
    private InventoryMenuSession menu;

    @BeforeEach
    void setUp() {
        sink = mock(NarrationSink.class);
        menu = new InventoryMenuSession(COLONY, new LevelTracker(), sink, new NavigationSettings());
    }

    private NarrationEvent lastNarration() {
        ArgumentCaptor<NarrationEvent> captor = ArgumentCaptor.forClass(NarrationEvent.class);
        verify(sink, atLeastOnce()).narrate(captor.capture());
        return captor.getValue();
    }

    private void type(String text) {
        for (char c : text.toCharArray()) {
            menu.onCharacter(c);
        }
    }

    @Test
    void categoriesNestByPathWithSubcategoriesBeforeItems() {
        menu.open();
        menu.onKey(KeyStroke.of(NavKey.STAR));

        assertEquals("Expanded 4 categories", lastNarration().text());
        assertEquals(List.of(
                "Food",
                "Meals",
                "Simple meal x6",
                "Fine meal x1 (carried by Alice)",
                "Berries x10",
                "Weapons",
                "Knife x1 (carried by Bob)",
                "Uncategorized",
                "Wood x50"), menu.visibleLabels());
    }

    @Test
    void openingAnnouncementCountsCategories() {
        menu.open();

        ArgumentCaptor<NarrationEvent> captor = ArgumentCaptor.forClass(NarrationEvent.class);
        verify(sink, atLeastOnce()).narrate(captor.capture());
        assertEquals("Colony inventory opened. 3 categories.", captor.getAllValues().get(0).text());
        assertEquals("Food collapsed. 1 of 3. level 1.", menu.currentAnnouncementText());
    }

    @Test
    void itemAnnouncementCarriesPositionAndLevel() {
        menu.open();
        menu.onKey(KeyStroke.of(NavKey.STAR));
        menu.onKey(KeyStroke.of(NavKey.DOWN));
        menu.onKey(KeyStroke.of(NavKey.DOWN));

        assertEquals("Simple meal x6 collapsed. 1 of 2. level 3.", lastNarration().text());
    }

    @Test
    void deleteDropsCarriedItemAndKeepsExpansion() {
        menu.open();
        menu.onKey(KeyStroke.of(NavKey.STAR));
        type("kn");
        assertEquals("Knife x1 (carried by Bob)", menu.currentSelection().getLabel());

        assertEquals(KeyResult.HANDLED, menu.onKey(KeyStroke.of(NavKey.DELETE)));

        assertEquals(5, menu.getRecords().size());
        assertEquals(List.of(
                "Food", "Meals", "Simple meal x6", "Fine meal x1 (carried by Alice)", "Berries x10",
                "Uncategorized", "Wood x50"), menu.visibleLabels());
        assertEquals("Wood x50", menu.currentSelection().getLabel());
        assertFalse(menu.searchState().isActive());
    }

    @Test
    void deleteOnStoredItemIsRejected() {
        menu.open();
        menu.onKey(KeyStroke.of(NavKey.STAR));
        type("berr");

        menu.onKey(KeyStroke.of(NavKey.DELETE));

        assertEquals("Berries is not carried by anyone.", lastNarration().text());
        assertEquals(NarrationCue.REJECT, lastNarration().cue());
        assertEquals(6, menu.getRecords().size());
    }

    @Test
    void deleteOnCategoryIsLeftToHost() {
        menu.open();
        assertEquals(KeyResult.NOT_HANDLED, menu.onKey(KeyStroke.of(NavKey.DELETE)));
    }

    @Test
    void itemActionsViewDetailsAndDrop() {
        menu.open();
        menu.onKey(KeyStroke.of(NavKey.STAR));
        type("fine");
        menu.onKey(KeyStroke.of(NavKey.RIGHT));
        menu.onKey(KeyStroke.of(NavKey.RIGHT));
        assertEquals("View details", menu.currentSelection().getLabel());
        assertEquals(NodeKind.ACTION, menu.currentSelection().getKind());

        menu.onKey(KeyStroke.of(NavKey.ENTER));
        assertEquals("Fine meal, quantity 1, category Food, Meals, carried by Alice.", lastNarration().text());

        menu.onKey(KeyStroke.of(NavKey.DOWN));
        assertEquals("Drop", menu.currentSelection().getLabel());
        menu.onKey(KeyStroke.of(NavKey.ENTER));

        assertEquals(5, menu.getRecords().size());
        assertFalse(menu.visibleLabels().contains("Fine meal x1 (carried by Alice)"));
    }

    @Test
    void storedItemsOnlyOfferDetails() {
        menu.open();
        menu.onKey(KeyStroke.of(NavKey.STAR));
        type("berr");
        menu.onKey(KeyStroke.of(NavKey.RIGHT));

        int index = menu.cursor();
        assertEquals("View details", menu.visibleLabels().get(index + 1));
        assertEquals("Weapons", menu.visibleLabels().get(index + 2));
    }

    @Test
    void detailsHandlerCanBeReplaced() {
        AtomicReference<InventoryMenuSession.InventoryItem> requested = new AtomicReference<>();
        menu.setDetailsHandler(requested::set);
        menu.open();
        menu.onKey(KeyStroke.of(NavKey.STAR));
        type("wood");
        menu.onKey(KeyStroke.of(NavKey.RIGHT));
        menu.onKey(KeyStroke.of(NavKey.RIGHT));

        menu.onKey(KeyStroke.of(NavKey.ENTER));

        assertEquals("Wood", requested.get().name());
        assertEquals(50, requested.get().quantity());
        assertEquals(InventoryMenuSession.UNCATEGORIZED, requested.get().categoryPath());
    }

    @Test
    void emptyInventory() {
        menu = new InventoryMenuSession(List.of(), new LevelTracker(), sink, new NavigationSettings());
        menu.open();
        assertEquals("Colony inventory opened. No items in inventory.", lastNarration().text());

        menu.onKey(KeyStroke.of(NavKey.DOWN));
        assertEquals("No items in inventory.", lastNarration().text());

        menu.onKey(KeyStroke.of(NavKey.STAR));
        assertEquals("No categories to expand.", lastNarration().text());
    }

    @Test
    void escapeCloses() {
        menu.open();
        menu.onKey(KeyStroke.of(NavKey.ESCAPE));

        assertFalse(menu.isOpen());
        assertEquals("Inventory menu closed.", lastNarration().text());
    }

    @Test
    void pathsAreNormalised() {
        assertEquals("Food/Meals", InventoryMenuSession.normalizePath(" Food / /Meals/ "));
        assertEquals(InventoryMenuSession.UNCATEGORIZED, InventoryMenuSession.normalizePath(null));
        assertEquals(InventoryMenuSession.UNCATEGORIZED, InventoryMenuSession.normalizePath(" / "));
    }

    @Test
    void mergedStackKeepsCarriedAndStoredApart() {
        menu = new InventoryMenuSession(List.of(
                new InventoryRecord("Food", "Meal", 3, null),
                new InventoryRecord("Food", "Meal", 1, "Alice")), new LevelTracker(), sink, new NavigationSettings());
        menu.open();
        menu.onKey(KeyStroke.of(NavKey.RIGHT));

        assertEquals(List.of("Food", "Meal x3", "Meal x1 (carried by Alice)"), menu.visibleLabels());
        assertTrue(menu.currentSelection().isExpanded());
    }
}
