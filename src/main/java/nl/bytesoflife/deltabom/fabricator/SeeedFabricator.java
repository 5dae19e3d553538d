package nl.bytesoflife.deltabom.fabricator;

import nl.bytesoflife.deltabom.model.InventoryItem;

import java.util.List;

public class SeeedFabricator implements Fabricator {

    static final List<String> PART_NUMBER_COLUMNS = List.of("seeed_sku", "seeed_part");

    @Override
    public String getName() {
        return "Seeed";
    }

    @Override
    public String getPartNumberHeader() {
        return "Seeed SKU";
    }

    @Override
    public String partNumber(InventoryItem item) {
        return Fabricators.firstColumn(item, PART_NUMBER_COLUMNS);
    }
}
