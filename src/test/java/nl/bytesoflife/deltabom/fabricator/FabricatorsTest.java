package nl.bytesoflife.deltabom.fabricator;

import nl.bytesoflife.deltabom.model.InventoryItem;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class FabricatorsTest {

    @Test
    void lookupIsCaseInsensitive() {
        assertInstanceOf(JlcFabricator.class, Fabricators.get("JLC"));
        assertInstanceOf(SeeedFabricator.class, Fabricators.get("seeed"));
        assertInstanceOf(PcbWayFabricator.class, Fabricators.get("PCBWay"));
        assertInstanceOf(GenericFabricator.class, Fabricators.get("generic"));
    }

    @Test
    void unknownNameGivesGeneric() {
        assertInstanceOf(GenericFabricator.class, Fabricators.get("acme"));
        assertInstanceOf(GenericFabricator.class, Fabricators.get(null));
    }

    @Test
    void jlcPrefersDistributorId() {
        InventoryItem item = InventoryItem.builder("RES-1")
                .distributorId("C25804")
                .attribute("JLC", "C99999")
                .build();
        assertEquals("C25804", Fabricators.get("jlc").partNumber(item));
    }

    @Test
    void jlcFallsBackToNormalizedColumns() {
        InventoryItem item = InventoryItem.builder("RES-1")
                .attribute("LCSC Part #", "C25804")
                .build();
        Fabricator jlc = Fabricators.get("jlc");
        assertEquals("C25804", jlc.partNumber(item));
        assertTrue(jlc.supports(item));
        assertEquals("LCSC", jlc.getPartNumberHeader());
    }

    @Test
    void jlcColumnOrderDecides() {
        InventoryItem item = InventoryItem.builder("RES-1")
                .attribute("JLC", "C2")
                .attribute("LCSC Part", "C1")
                .build();
        assertEquals("C1", Fabricators.get("jlc").partNumber(item));
    }

    @Test
    void seeedAndPcbWayUseTheirColumns() {
        InventoryItem item = InventoryItem.builder("RES-1")
                .attribute("Seeed SKU", "310010001")
                .attribute("PCBWay Part", "PW-10K")
                .build();
        assertEquals("310010001", Fabricators.get("seeed").partNumber(item));
        assertEquals("PW-10K", Fabricators.get("pcbway").partNumber(item));
    }

    @Test
    void itemWithoutColumnIsNotSupported() {
        InventoryItem item = InventoryItem.builder("RES-1").build();
        assertFalse(Fabricators.get("seeed").supports(item));
        assertEquals("", Fabricators.get("pcbway").partNumber(item));
    }

    @Test
    void genericUsesManufacturerData() {
        InventoryItem item = InventoryItem.builder("RES-1")
                .manufacturer("Yageo")
                .manufacturerPartNumber("RC0603FR-0710KL")
                .distributorId("C98220")
                .build();
        Fabricator generic = Fabricators.get("generic");
        assertEquals("RC0603FR-0710KL", generic.partNumber(item));
        assertEquals("Yageo", generic.displayName(item));
    }

    @Test
    void genericSupportsEveryItem() {
        InventoryItem bare = InventoryItem.builder("X-1").build();
        Fabricator generic = Fabricators.get("generic");
        assertTrue(generic.supports(bare));
        assertEquals("", generic.partNumber(bare));
        assertEquals("Generic", generic.displayName(bare));
    }

    @Test
    void genericFallsBackToDistributorId() {
        InventoryItem item = InventoryItem.builder("RES-1").distributorId("C98220").build();
        assertEquals("C98220", Fabricators.get("generic").partNumber(item));
    }

    @Test
    void columnNamesAreNormalized() {
        assertEquals("lcsc_part_#", Fabricators.normalizeColumn(" LCSC Part # "));
        assertEquals("jlc_part", Fabricators.normalizeColumn("JLC-Part"));
    }
}
