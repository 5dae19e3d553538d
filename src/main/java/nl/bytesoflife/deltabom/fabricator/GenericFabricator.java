package nl.bytesoflife.deltabom.fabricator;

import nl.bytesoflife.deltabom.model.InventoryItem;

/**
 * Fallback for any assembly house: lists the manufacturer and its part number.
 * Supports every item, even ones without a part number.
 */
public class GenericFabricator implements Fabricator {

    @Override
    public String getName() {
        return "Generic";
    }

    @Override
    public String getPartNumberHeader() {
        return "Fabricator Part Number";
    }

    @Override
    public String partNumber(InventoryItem item) {
        if (!item.getManufacturerPartNumber().isEmpty()) {
            return item.getManufacturerPartNumber();
        }
        return item.getDistributorId();
    }

    @Override
    public String displayName(InventoryItem item) {
        return item.getManufacturer().isEmpty() ? getName() : item.getManufacturer();
    }

    @Override
    public boolean supports(InventoryItem item) {
        return true;
    }
}
