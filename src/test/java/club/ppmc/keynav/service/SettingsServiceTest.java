package club.ppmc.keynav.service;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import club.ppmc.keynav.model.NavigationSettings;
import org.junit.jupiter.api.Test;

class SettingsServiceTest {

    @Test
    void defaultsComeFromConstructorAndUpdatesKeepBlankPaths() {
        SettingsService service = new SettingsService(true, false, "/data/saves", "rsc");
        assertTrue(service.getSettings().isAnnouncePosition());
        assertFalse(service.getSettings().isAnnounceLevel());

        NavigationSettings update = new NavigationSettings();
        update.setAnnouncePosition(false);
        update.setSavesRoot(" ");
        update.setSavesExtension(null);
        NavigationSettings result = service.updateSettings(update);

        assertFalse(result.isAnnouncePosition());
        assertEquals("/data/saves", result.getSavesRoot());
        assertEquals("rsc", result.getSavesExtension());
    }

    @Test
    void callersGetCopies() {
        SettingsService service = new SettingsService(true, true, "./saves", "rsc");

        service.getSettings().setAnnounceLevel(false);

        assertTrue(service.getSettings().isAnnounceLevel());
    }
}
