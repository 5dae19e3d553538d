package nl.bytesoflife.deltabom.fabricator;

import nl.bytesoflife.deltabom.model.InventoryItem;

import java.util.List;

public class PcbWayFabricator implements Fabricator {

    static final List<String> PART_NUMBER_COLUMNS = List.of("pcbway_part");

    @Override
    public String getName() {
        return "PCBWay";
    }

    @Override
    public String getPartNumberHeader() {
        return "MFGPN";
    }

    @Override
    public String partNumber(InventoryItem item) {
        return Fabricators.firstColumn(item, PART_NUMBER_COLUMNS);
    }
}
