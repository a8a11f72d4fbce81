package club.ppmc.keynav.model;

import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;

/**
 * Request body carrying one typed character for typeahead search.
 */
public record CharacterRequest(@NotNull @Size(min = 1, max = 1) String character) {

    public char toChar() {
        return character.charAt(0);
    }
}
