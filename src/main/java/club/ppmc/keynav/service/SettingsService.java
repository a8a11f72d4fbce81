/**
 * SettingsService.java
 *
 * Holds the navigation preferences every new menu session is created with. Defaults come from
 * application.properties; /api/settings replaces them at runtime. Nothing is written to disk.
 */
package club.ppmc.keynav.service;

import club.ppmc.keynav.model.NavigationSettings;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;
import org.springframework.util.StringUtils;

@Service
public class SettingsService {

    private static final Logger LOGGER = LoggerFactory.getLogger(SettingsService.class);

    private volatile NavigationSettings currentSettings;

    public SettingsService(
            @Value("${app.navigation.announce-position:true}") boolean announcePosition,
            @Value("${app.navigation.announce-level:true}") boolean announceLevel,
            @Value("${app.saves-root:./saves}") String savesRoot,
            @Value("${app.saves-extension:rsc}") String savesExtension) {
        var settings = new NavigationSettings();
        settings.setAnnouncePosition(announcePosition);
        settings.setAnnounceLevel(announceLevel);
        settings.setSavesRoot(savesRoot);
        settings.setSavesExtension(savesExtension);
        this.currentSettings = settings;
        LOGGER.info("Navigation settings initialised: {}", settings);
    }

    /**
     * @return a copy, so a session keeps the preferences it was opened with.
     */
    public synchronized NavigationSettings getSettings() {
        return copyOf(currentSettings);
    }

    /**
     * Replaces the settings. Blank paths in the update keep their current values.
     */
    public synchronized NavigationSettings updateSettings(NavigationSettings newSettings) {
        var merged = copyOf(newSettings);
        if (!StringUtils.hasText(merged.getSavesRoot())) {
            merged.setSavesRoot(currentSettings.getSavesRoot());
        }
        if (!StringUtils.hasText(merged.getSavesExtension())) {
            merged.setSavesExtension(currentSettings.getSavesExtension());
        }
        this.currentSettings = merged;
        LOGGER.info("Navigation settings updated: {}", merged);
        return copyOf(merged);
    }

    private static NavigationSettings copyOf(NavigationSettings source) {
        var copy = new NavigationSettings();
        copy.setAnnouncePosition(source.isAnnouncePosition());
        copy.setAnnounceLevel(source.isAnnounceLevel());
        copy.setSavesRoot(source.getSavesRoot());
        copy.setSavesExtension(source.getSavesExtension());
        return copy;
    }
}
