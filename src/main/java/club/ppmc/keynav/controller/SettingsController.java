/**
 * SettingsController.java
 *
 * Reads and replaces the navigation preferences. Menus already open keep the settings they were
 * opened with.
 */
package club.ppmc.keynav.controller;

import club.ppmc.keynav.model.NavigationSettings;
import club.ppmc.keynav.service.SettingsService;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

@RestController
@RequestMapping("/api/settings")
@Slf4j
public class SettingsController {

    private final SettingsService settingsService;

    public SettingsController(SettingsService settingsService) {
        this.settingsService = settingsService;
    }

    @GetMapping
    public ResponseEntity<NavigationSettings> getSettings() {
        return ResponseEntity.ok(settingsService.getSettings());
    }

    @PostMapping
    public ResponseEntity<NavigationSettings> updateSettings(@RequestBody NavigationSettings newSettings) {
        log.info("Updating navigation settings.");
        return ResponseEntity.ok(settingsService.updateSettings(newSettings));
    }
}
