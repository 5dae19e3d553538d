package nl.bytesoflife.deltabom.fabricator;

import nl.bytesoflife.deltabom.model.InventoryItem;

import java.util.List;

/**
 * JLCPCB, which orders parts by LCSC number.
 */
public class JlcFabricator implements Fabricator {

    static final List<String> PART_NUMBER_COLUMNS = List.of(
            "lcsc_part_#", "jlcpcb_part_#", "jlc_part", "lcsc_part", "lcsc", "jlc");

    @Override
    public String getName() {
        return "JLC";
    }

    @Override
    public String getPartNumberHeader() {
        return "LCSC";
    }

    @Override
    public String partNumber(InventoryItem item) {
        if (!item.getDistributorId().isEmpty()) {
            return item.getDistributorId();
        }
        return Fabricators.firstColumn(item, PART_NUMBER_COLUMNS);
    }
}
