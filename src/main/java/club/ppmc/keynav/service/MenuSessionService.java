/**
 * MenuSessionService.java
 *
 * Owns the single menu that can be open at a time. Opening a menu closes the previous one; a menu
 * that closes itself (Escape, a file being picked) clears the active slot through its close
 * listener. Every input is applied while holding the session's monitor, so REST calls arriving
 * concurrently are serialized per menu.
 */
package club.ppmc.keynav.service;

import club.ppmc.keynav.engine.LevelTracker;
import club.ppmc.keynav.exception.MenuSessionException;
import club.ppmc.keynav.model.DetailSection;
import club.ppmc.keynav.model.InputResponse;
import club.ppmc.keynav.model.InventoryRecord;
import club.ppmc.keynav.model.KeyResult;
import club.ppmc.keynav.model.KeyStroke;
import club.ppmc.keynav.model.MenuSnapshot;
import club.ppmc.keynav.model.SaveFileRecord;
import club.ppmc.keynav.screen.DetailTreeMenuSession;
import club.ppmc.keynav.screen.FilePickerMenuSession;
import club.ppmc.keynav.screen.InventoryMenuSession;
import club.ppmc.keynav.session.MenuSession;
import club.ppmc.keynav.session.NarrationSink;
import java.io.IOException;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicReference;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

@Service
@Slf4j
public class MenuSessionService {

    private final AtomicReference<MenuSession> activeSession = new AtomicReference<>(null);
    private final AtomicReference<SaveFileRecord> selectedFile = new AtomicReference<>(null);
    private final LevelTracker levelTracker = new LevelTracker();

    private final NarrationSink narrationSink;
    private final SettingsService settingsService;
    private final SaveFileService saveFileService;

    public MenuSessionService(
            NarrationSink narrationSink, SettingsService settingsService, SaveFileService saveFileService) {
        this.narrationSink = narrationSink;
        this.settingsService = settingsService;
        this.saveFileService = saveFileService;
    }

    public MenuSnapshot openInventory(List<InventoryRecord> records) {
        List<InventoryRecord> safeRecords = records == null ? List.of() : records;
        for (InventoryRecord record : safeRecords) {
            if (record == null || record.itemName() == null || record.itemName().isBlank()) {
                throw new MenuSessionException("Every inventory record needs an item name.", MenuSessionException.INVALID_INPUT);
            }
            if (record.quantity() < 0) {
                throw new MenuSessionException(
                        "Quantity of '" + record.itemName() + "' must not be negative.", MenuSessionException.INVALID_INPUT);
            }
        }
        return activate(new InventoryMenuSession(
                safeRecords, levelTracker, narrationSink, settingsService.getSettings()));
    }

    public MenuSnapshot openDetails(String title, List<DetailSection> sections) {
        return activate(new DetailTreeMenuSession(
                title, sections, levelTracker, narrationSink, settingsService.getSettings()));
    }

    /**
     * Opens the save file picker. The file chosen with Enter becomes {@link #getSelectedFile()};
     * files confirmed for deletion are removed through {@link SaveFileService#delete}.
     *
     * @throws IOException if the saves directory cannot be listed.
     */
    public MenuSnapshot openFilePicker() throws IOException {
        List<SaveFileRecord> files = saveFileService.listSaveFiles();
        FilePickerMenuSession picker = new FilePickerMenuSession(
                files, this::onFileSelected, levelTracker, narrationSink, settingsService.getSettings());
        picker.setDeleteHandler(saveFileService::delete);
        return activate(picker);
    }

    public Optional<MenuSession> getActive() {
        return Optional.ofNullable(activeSession.get());
    }

    /**
     * @throws MenuSessionException when no menu is open.
     */
    public MenuSession requireActive() {
        MenuSession session = activeSession.get();
        if (session == null) {
            throw MenuSessionException.noActiveMenu();
        }
        return session;
    }

    public InputResponse dispatchKey(KeyStroke stroke) {
        MenuSession session = requireActive();
        synchronized (session) {
            KeyResult result = session.onKey(stroke);
            return new InputResponse(result, session.snapshot());
        }
    }

    public InputResponse dispatchCharacter(char c) {
        MenuSession session = requireActive();
        synchronized (session) {
            KeyResult result = session.onCharacter(c);
            return new InputResponse(result, session.snapshot());
        }
    }

    public MenuSnapshot snapshot() {
        MenuSession session = requireActive();
        synchronized (session) {
            return session.snapshot();
        }
    }

    /**
     * Closes the open menu, if any.
     *
     * @return true when a menu was closed.
     */
    public boolean closeActive() {
        MenuSession session = activeSession.getAndSet(null);
        if (session == null) {
            return false;
        }
        synchronized (session) {
            session.close();
        }
        return true;
    }

    public Optional<SaveFileRecord> getSelectedFile() {
        return Optional.ofNullable(selectedFile.get());
    }

    private MenuSnapshot activate(MenuSession session) {
        closeActive();
        session.setCloseListener(closed -> activeSession.compareAndSet(closed, null));
        synchronized (session) {
            activeSession.set(session);
            session.open();
            return session.snapshot();
        }
    }

    private void onFileSelected(SaveFileRecord file) {
        selectedFile.set(file);
        log.info("Save file chosen: {}", file.fileName());
    }
}
