package nl.bytesoflife.deltabom.fabricator;

import nl.bytesoflife.deltabom.model.InventoryItem;

/**
 * An assembly house and the way it identifies parts in a BOM.
 */
public interface Fabricator {

    String getName();

    /**
     * Column header for the part number in a BOM for this fabricator.
     */
    String getPartNumberHeader();

    /**
     * The fabricator's part number for an item, or an empty string when it has none.
     */
    String partNumber(InventoryItem item);

    /**
     * Name shown next to the part number; fixed for most fabricators.
     */
    default String displayName(InventoryItem item) {
        return getName();
    }

    default boolean supports(InventoryItem item) {
        return !partNumber(item).isEmpty();
    }
}
