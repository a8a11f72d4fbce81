package club.ppmc.keynav.model;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import java.util.List;

/**
 * Request body for opening a detail tree menu.
 *
 * @param title    spoken when the menu opens and closes.
 * @param sections top-level sections, in display order.
 */
public record DetailTreeRequest(@NotBlank String title, @Valid List<DetailSection> sections) {
}
