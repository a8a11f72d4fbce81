/**
 * DetailSection.java
 *
 * Declarative descriptor of one expandable section in a detail tree: a title, its detail lines and
 * any nested sections. Screens describe their fields with these instead of having them
 * discovered from the domain objects at runtime.
 */
package club.ppmc.keynav.model;

import jakarta.validation.constraints.NotBlank;
import java.util.List;

public record DetailSection(@NotBlank String title, List<String> details, List<DetailSection> subsections) {

    public DetailSection {
        details = details == null ? List.of() : List.copyOf(details);
        subsections = subsections == null ? List.of() : List.copyOf(subsections);
    }

    public static DetailSection of(String title, String... details) {
        return new DetailSection(title, List.of(details), List.of());
    }
}
