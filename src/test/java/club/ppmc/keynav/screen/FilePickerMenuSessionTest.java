package club.ppmc.keynav.screen;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.Mockito.atLeastOnce;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;

import club.ppmc.keynav.engine.LevelTracker;
import club.ppmc.keynav.model.KeyResult;
import club.ppmc.keynav.model.KeyStroke;
import club.ppmc.keynav.model.NarrationEvent;
import club.ppmc.keynav.model.NavKey;
import club.ppmc.keynav.model.NavigationSettings;
import club.ppmc.keynav.model.SaveFileRecord;
import club.ppmc.keynav.session.NarrationSink;
import java.io.IOException;
import java.time.Instant;
import java.util.ArrayList;
import java.time.ZoneOffset;
import java.util.List;
import java.util.concurrent.atomic.AtomicReference;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

class FilePickerMenuSessionTest {

    private static final SaveFileRecord SPRING = new SaveFileRecord(
            "colony1.rsc", "colony1", Instant.parse("2024-05-01T18:30:00Z"), 1024);
    private static final SaveFileRecord SUMMER = new SaveFileRecord(
            "colony2.rsc", "colony2", Instant.parse("2024-06-01T10:00:00Z"), 2048);
    private static final SaveFileRecord OLD = new SaveFileRecord(
            "old.rsc", "old", Instant.parse("2023-01-01T00:00:00Z"), 512);

    private NarrationSink sink;
    private AtomicReference<SaveFileRecord> selected;
    private FilePickerMenuSession menu;

    @BeforeEach
    void setUp() {
        sink = mock(NarrationSink.class);
        selected = new AtomicReference<>();
        menu = new FilePickerMenuSession(List.of(SPRING, OLD, SUMMER), selected::set, ZoneOffset.UTC,
                new LevelTracker(), sink, new NavigationSettings());
    }

    private NarrationEvent lastNarration() {
        ArgumentCaptor<NarrationEvent> captor = ArgumentCaptor.forClass(NarrationEvent.class);
        verify(sink, atLeastOnce()).narrate(captor.capture());
        return captor.getValue();
    }

    @Test
    void listsNewestFirstWithTimestamp() {
        menu.open();

        assertEquals(List.of("colony2", "colony1", "old"), menu.visibleLabels());
        assertEquals("colony2 - 2024-06-01 10:00 (1 of 3)", menu.currentAnnouncementText());

        menu.onKey(KeyStroke.of(NavKey.UP));
        assertEquals("old - 2023-01-01 00:00 (3 of 3)", lastNarration().text());
    }

    @Test
    void searchStatusReplacesPosition() {
        menu.open();
        menu.onCharacter('o');
        menu.onCharacter('l');
        menu.onCharacter('d');

        assertEquals("old - 2023-01-01 00:00, 1 of 1 matches for 'old'", lastNarration().text());
    }

    @Test
    void enterSelectsAndCloses() {
        menu.open();
        menu.onKey(KeyStroke.of(NavKey.DOWN));

        menu.onKey(KeyStroke.of(NavKey.ENTER));

        assertEquals(SPRING, selected.get());
        assertFalse(menu.isOpen());
        assertEquals("File picker closed.", lastNarration().text());
    }

    @Test
    void escapeClosesWithoutSelecting() {
        menu.open();
        menu.onKey(KeyStroke.of(NavKey.ESCAPE));

        assertNull(selected.get());
        assertFalse(menu.isOpen());
    }

    @Test
    void noFiles() {
        menu = new FilePickerMenuSession(List.of(), selected::set, ZoneOffset.UTC,
                new LevelTracker(), sink, new NavigationSettings());
        menu.open();

        assertEquals("Load game. No save files found.", lastNarration().text());
    }

    @Test
    void singleFileIsAnnouncedWithoutPosition() {
        SaveFileRecord solo = new SaveFileRecord("solo.rsc", "solo", Instant.parse("2024-05-01T18:30:00Z"), 10);
        menu = new FilePickerMenuSession(List.of(solo), selected::set, ZoneOffset.UTC,
                new LevelTracker(), sink, new NavigationSettings());

        menu.open();

        assertEquals("solo - 2024-05-01 18:30", menu.currentAnnouncementText());
    }

    @Test
    void starIsLeftToTheHost() {
        menu.open();
        String before = menu.currentAnnouncementText();

        assertEquals(KeyResult.NOT_HANDLED, menu.onKey(KeyStroke.of(NavKey.STAR)));
        assertEquals(before, menu.currentAnnouncementText());
    }

    @Test
    void deleteWithoutHandlerIsNotHandled() {
        menu.open();

        assertEquals(KeyResult.NOT_HANDLED, menu.onKey(KeyStroke.of(NavKey.DELETE)));
        assertFalse(menu.isAwaitingConfirmation());
    }

    @Test
    void deleteAsksForConfirmationThenRemovesFile() {
        List<SaveFileRecord> deleted = new ArrayList<>();
        menu.setDeleteHandler(deleted::add);
        menu.open();
        menu.onKey(KeyStroke.of(NavKey.DOWN));

        assertEquals(KeyResult.HANDLED, menu.onKey(KeyStroke.of(NavKey.DELETE)));
        assertTrue(menu.isAwaitingConfirmation());
        assertEquals("Delete colony1? Press Enter to confirm, Escape to cancel.", lastNarration().text());
        assertTrue(deleted.isEmpty());

        menu.onKey(KeyStroke.of(NavKey.ENTER));

        assertEquals(List.of(SPRING), deleted);
        assertFalse(menu.isAwaitingConfirmation());
        assertTrue(menu.isOpen());
        assertNull(selected.get());
        assertEquals(List.of("colony2", "old"), menu.visibleLabels());
        assertEquals(1, menu.cursor());
        assertEquals("old - 2023-01-01 00:00 (2 of 2)", lastNarration().text());
    }

    @Test
    void deletingTheLastFileClampsCursor() {
        menu.setDeleteHandler(file -> { });
        menu.open();
        menu.onKey(KeyStroke.ctrl(NavKey.END));

        menu.onKey(KeyStroke.of(NavKey.DELETE));
        menu.onKey(KeyStroke.of(NavKey.ENTER));

        assertEquals(List.of("colony2", "colony1"), menu.visibleLabels());
        assertEquals(1, menu.cursor());
    }

    @Test
    void escapeCancelsDeleteAndKeepsMenuOpen() {
        List<SaveFileRecord> deleted = new ArrayList<>();
        menu.setDeleteHandler(deleted::add);
        menu.open();
        menu.onKey(KeyStroke.of(NavKey.DELETE));

        menu.onKey(KeyStroke.of(NavKey.ESCAPE));

        assertTrue(deleted.isEmpty());
        assertTrue(menu.isOpen());
        assertFalse(menu.isAwaitingConfirmation());
        assertEquals(List.of("colony2", "colony1", "old"), menu.visibleLabels());
        assertEquals("colony2 - 2024-06-01 10:00 (1 of 3)", lastNarration().text());
    }

    @Test
    void otherInputWhileConfirmingRepeatsPrompt() {
        menu.setDeleteHandler(file -> { });
        menu.open();
        menu.onKey(KeyStroke.of(NavKey.DELETE));

        assertEquals(KeyResult.HANDLED, menu.onKey(KeyStroke.of(NavKey.DOWN)));
        assertEquals(KeyResult.HANDLED, menu.onCharacter('o'));

        assertEquals(0, menu.cursor());
        assertEquals("Delete colony2? Press Enter to confirm, Escape to cancel.", lastNarration().text());
    }

    @Test
    void failedDeleteKeepsFile() {
        menu.setDeleteHandler(file -> {
            throw new IOException("read-only");
        });
        menu.open();
        menu.onKey(KeyStroke.of(NavKey.DELETE));

        menu.onKey(KeyStroke.of(NavKey.ENTER));

        assertEquals(List.of("colony2", "colony1", "old"), menu.visibleLabels());
        assertEquals("Could not delete colony2.", lastNarration().text());
    }
}
