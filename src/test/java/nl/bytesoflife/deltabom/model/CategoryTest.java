package nl.bytesoflife.deltabom.model;

import nl.bytesoflife.deltabom.value.QuantityKind;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class CategoryTest {

    @Test
    void inventoryCategoryIsMatchedBySubstring() {
        assertTrue(Category.RESISTOR.matchesInventoryCategory("RES"));
        assertTrue(Category.RESISTOR.matchesInventoryCategory("res, smd"));
        assertFalse(Category.RESISTOR.matchesInventoryCategory("CAP"));
        assertFalse(Category.UNKNOWN.matchesInventoryCategory("RES"));
        assertFalse(Category.CAPACITOR.matchesInventoryCategory(null));
    }

    @Test
    void passivesCarryQuantityKind() {
        assertEquals(QuantityKind.RESISTANCE, Category.RESISTOR.quantityKind());
        assertEquals(QuantityKind.CAPACITANCE, Category.CAPACITOR.quantityKind());
        assertEquals(QuantityKind.INDUCTANCE, Category.INDUCTOR.quantityKind());
        assertNull(Category.LED.quantityKind());
    }

    @Test
    void relevantFieldsPerCategory() {
        assertTrue(Category.RESISTOR.isRelevant("Tolerance"));
        assertTrue(Category.LED.isRelevant("Wavelength"));
        assertFalse(Category.LED.isRelevant("Tolerance"));
        assertTrue(Category.UNKNOWN.isRelevant("Temperature Coefficient"));
    }
}
