package club.ppmc.keynav.controller;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import club.ppmc.keynav.model.NavigationSettings;
import club.ppmc.keynav.service.SettingsService;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;

@WebMvcTest(SettingsController.class)
class SettingsControllerTest {

    @Autowired
    private MockMvc mockMvc;

    @MockBean
    private SettingsService settingsService;

    @Test
    void readsAndUpdatesSettings() throws Exception {
        NavigationSettings quiet = new NavigationSettings();
        quiet.setAnnounceLevel(false);
        when(settingsService.getSettings()).thenReturn(new NavigationSettings());
        when(settingsService.updateSettings(any())).thenReturn(quiet);

        mockMvc.perform(get("/api/settings"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.announceLevel").value(true))
                .andExpect(jsonPath("$.savesExtension").value("rsc"));

        mockMvc.perform(post("/api/settings")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"announcePosition\":true,\"announceLevel\":false}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.announceLevel").value(false));
    }
}
