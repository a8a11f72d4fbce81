/**
 * MenuController.java
 *
 * REST surface of the menus: open one of the screens, feed keys and characters to the open menu,
 * read its state and close it. Everything the menu says is pushed separately over the narration
 * topic; the responses here only carry state.
 */
package club.ppmc.keynav.controller;

import club.ppmc.keynav.exception.MenuSessionException;
import club.ppmc.keynav.model.CharacterRequest;
import club.ppmc.keynav.model.DetailTreeRequest;
import club.ppmc.keynav.model.InventoryRecord;
import club.ppmc.keynav.model.KeyStroke;
import club.ppmc.keynav.model.KeyStrokeRequest;
import club.ppmc.keynav.service.MenuSessionService;
import jakarta.validation.Valid;
import java.io.IOException;
import java.util.List;
import java.util.Map;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/menus")
@Slf4j
public class MenuController {

    private final MenuSessionService menuSessionService;

    public MenuController(MenuSessionService menuSessionService) {
        this.menuSessionService = menuSessionService;
    }

    @PostMapping("/inventory")
    public ResponseEntity<?> openInventory(@RequestBody List<InventoryRecord> records) {
        try {
            return ResponseEntity.ok(menuSessionService.openInventory(records));
        } catch (MenuSessionException e) {
            return errorResponse(e);
        }
    }

    @PostMapping("/details")
    public ResponseEntity<?> openDetails(@Valid @RequestBody DetailTreeRequest request) {
        return ResponseEntity.ok(menuSessionService.openDetails(request.title(), request.sections()));
    }

    @PostMapping("/files")
    public ResponseEntity<?> openFilePicker() {
        try {
            return ResponseEntity.ok(menuSessionService.openFilePicker());
        } catch (IOException e) {
            log.error("Failed to list save files", e);
            return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
                    .body(Map.of("message", "Failed to list save files: " + e.getMessage()));
        }
    }

    /**
     * Sends a key to the open menu. Key names are case-insensitive ("Down", "ArrowDown", "Escape", "*").
     */
    @PostMapping("/active/keys")
    public ResponseEntity<?> sendKey(@Valid @RequestBody KeyStrokeRequest request) {
        KeyStroke stroke;
        try {
            stroke = request.toKeyStroke();
        } catch (IllegalArgumentException e) {
            log.warn("Rejected key '{}': {}", request.key(), e.getMessage());
            return ResponseEntity.badRequest().body(Map.of("message", e.getMessage()));
        }
        try {
            return ResponseEntity.ok(menuSessionService.dispatchKey(stroke));
        } catch (MenuSessionException e) {
            return errorResponse(e);
        }
    }

    @PostMapping("/active/characters")
    public ResponseEntity<?> sendCharacter(@Valid @RequestBody CharacterRequest request) {
        try {
            return ResponseEntity.ok(menuSessionService.dispatchCharacter(request.toChar()));
        } catch (MenuSessionException e) {
            return errorResponse(e);
        }
    }

    @GetMapping("/active")
    public ResponseEntity<?> getActive() {
        try {
            return ResponseEntity.ok(menuSessionService.snapshot());
        } catch (MenuSessionException e) {
            return errorResponse(e);
        }
    }

    @DeleteMapping("/active")
    public ResponseEntity<?> closeActive() {
        if (!menuSessionService.closeActive()) {
            return errorResponse(MenuSessionException.noActiveMenu());
        }
        return ResponseEntity.ok(Map.of("message", "Menu closed."));
    }

    @GetMapping("/selected-file")
    public ResponseEntity<?> getSelectedFile() {
        return menuSessionService.getSelectedFile()
                .<ResponseEntity<?>>map(ResponseEntity::ok)
                .orElseGet(() -> ResponseEntity.noContent().build());
    }

    private ResponseEntity<Map<String, Object>> errorResponse(MenuSessionException e) {
        log.warn("Menu request rejected: {}", e.getMessage());
        HttpStatus status = e.isNoActiveMenu() ? HttpStatus.NOT_FOUND : HttpStatus.BAD_REQUEST;
        return ResponseEntity.status(status).body(e.toErrorData());
    }
}
