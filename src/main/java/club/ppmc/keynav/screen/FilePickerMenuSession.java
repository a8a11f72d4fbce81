/**
 * FilePickerMenuSession.java
 *
 * Flat list of save files, newest first. Each file is announced with its modification time, and
 * Enter hands the file to the selection callback and closes the picker.
 *
 * Extra keys: Delete asks for confirmation, then removes the selected file through the delete
 * handler. Without a delete handler the key is left to the host.
 */
package club.ppmc.keynav.screen;

import static club.ppmc.keynav.engine.AnnouncementFormatter.formatPosition;
import static club.ppmc.keynav.engine.AnnouncementFormatter.formatSearchStatus;

import club.ppmc.keynav.engine.LevelTracker;
import club.ppmc.keynav.model.KeyStroke;
import club.ppmc.keynav.model.NarrationCue;
import club.ppmc.keynav.model.NavKey;
import club.ppmc.keynav.model.NavNode;
import club.ppmc.keynav.model.NavigationSettings;
import club.ppmc.keynav.model.NodeKind;
import club.ppmc.keynav.model.SaveFileRecord;
import club.ppmc.keynav.session.MenuSession;
import club.ppmc.keynav.session.NarrationSink;
import java.io.IOException;
import java.time.Instant;
import java.time.ZoneId;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;
import java.util.function.Consumer;
import lombok.extern.slf4j.Slf4j;

@Slf4j
public class FilePickerMenuSession extends MenuSession {

    public static final String SCREEN = "Load game";

    private static final DateTimeFormatter TIMESTAMP = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm");

    /** Removes a save file from storage. */
    @FunctionalInterface
    public interface SaveFileDeleter {
        void delete(SaveFileRecord file) throws IOException;
    }

    private final List<SaveFileRecord> files;
    private final ZoneId zone;
    private final Consumer<SaveFileRecord> onSelect;
    private SaveFileDeleter deleteHandler;

    public FilePickerMenuSession(
            List<SaveFileRecord> files,
            Consumer<SaveFileRecord> onSelect,
            LevelTracker levelTracker,
            NarrationSink narrationSink,
            NavigationSettings settings) {
        this(files, onSelect, ZoneId.systemDefault(), levelTracker, narrationSink, settings);
    }

    public FilePickerMenuSession(
            List<SaveFileRecord> files,
            Consumer<SaveFileRecord> onSelect,
            ZoneId zone,
            LevelTracker levelTracker,
            NarrationSink narrationSink,
            NavigationSettings settings) {
        super(SCREEN, levelTracker, narrationSink, settings);
        this.files = new ArrayList<>(files);
        this.files.sort(Comparator.comparing(SaveFileRecord::lastModified, Comparator.nullsLast(Comparator.<Instant>reverseOrder())));
        this.onSelect = Objects.requireNonNull(onSelect);
        this.zone = zone;
        actions.register(NodeKind.FILE, this::select);
    }

    public void setDeleteHandler(SaveFileDeleter deleteHandler) {
        this.deleteHandler = Objects.requireNonNull(deleteHandler);
    }

    @Override
    protected List<NavNode> buildTree() {
        List<NavNode> nodes = new ArrayList<>();
        for (SaveFileRecord file : files) {
            nodes.add(new NavNode(file.displayName(), NodeKind.FILE, "file:" + file.fileName(), file));
        }
        return nodes;
    }

    /** "{name} - 2024-05-01 18:30 (2 of 7)", or the search status instead of the position. */
    @Override
    protected String describe(NavNode node) {
        StringBuilder text = new StringBuilder(node.getLabel());
        if (node.getPayload() instanceof SaveFileRecord file && file.lastModified() != null) {
            text.append(" - ").append(TIMESTAMP.format(file.lastModified().atZone(zone)));
        }
        if (isCyclingMatches()) {
            text.append(", ").append(formatSearchStatus(typeahead));
        } else if (getSettings().isAnnouncePosition()) {
            String position = formatPosition(navigator.cursor(), navigator.size());
            if (!position.isEmpty()) {
                text.append(" (").append(position).append(')');
            }
        }
        return text.toString();
    }

    @Override
    protected boolean handleCustomKey(KeyStroke stroke) {
        if (stroke.key() != NavKey.DELETE || deleteHandler == null) {
            return false;
        }
        NavNode node = currentSelection();
        if (node == null || !(node.getPayload() instanceof SaveFileRecord file)) {
            return false;
        }
        requestConfirmation(
                "Delete " + file.displayName() + "? Press Enter to confirm, Escape to cancel.",
                () -> delete(file),
                () -> {
                    speak("Delete cancelled.", NarrationCue.TICK);
                    announceCurrent(NarrationCue.NONE);
                });
        return true;
    }

    @Override
    protected boolean supportsExpandAll() {
        return false;
    }

    @Override
    protected String openingAnnouncement() {
        if (navigator.isEmpty()) {
            return "Load game. " + emptyAnnouncement();
        }
        int count = navigator.size();
        return "Load game. " + count + (count == 1 ? " save file." : " save files.");
    }

    @Override
    protected String closingAnnouncement() {
        return "File picker closed.";
    }

    @Override
    protected String emptyAnnouncement() {
        return "No save files found.";
    }

    private void delete(SaveFileRecord file) {
        try {
            deleteHandler.delete(file);
        } catch (IOException e) {
            log.error("Could not delete save file {}.", file.fileName(), e);
            speakUrgent("Could not delete " + file.displayName() + ".", NarrationCue.REJECT);
            return;
        }
        files.remove(file);
        refresh();
        speak("Deleted " + file.displayName() + ".", NarrationCue.CLICK);
        announceCurrent(NarrationCue.NONE);
    }

    private void select(NavNode node) {
        SaveFileRecord file = (SaveFileRecord) node.getPayload();
        log.info("Save file selected: {}", file.fileName());
        speak("Loading " + file.displayName() + ".", NarrationCue.CLICK);
        onSelect.accept(file);
        close();
    }
}
