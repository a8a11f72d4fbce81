/**
 * InventoryRecord.java
 *
 * One stack of items as the host application reports it: where it is categorised, what it is,
 * how many there are, and which pawn carries it (null for items in storage).
 * Received by MenuController and turned into a category tree by InventoryMenuSession.
 */
package club.ppmc.keynav.model;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.PositiveOrZero;

/**
 * @param categoryPath slash-separated category chain, e.g. "Food/Meals". Blank means uncategorized.
 * @param itemName     item label without quantity.
 * @param quantity     stack size.
 * @param carriedBy    name of the carrying pawn, or null when stored.
 */
public record InventoryRecord(
        String categoryPath,
        @NotBlank String itemName,
        @PositiveOrZero int quantity,
        String carriedBy) {

    public boolean isCarried() {
        return carriedBy != null && !carriedBy.isBlank();
    }
}
