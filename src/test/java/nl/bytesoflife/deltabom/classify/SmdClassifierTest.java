package nl.bytesoflife.deltabom.classify;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class SmdClassifierTest {

    private final SmdClassifier classifier = new SmdClassifier();

    @Test
    void explicitFlagsWin() {
        assertTrue(classifier.isSmd("SMD", "Resistor_THT:R_Axial"));
        assertTrue(classifier.isSmd("yes", ""));
        assertFalse(classifier.isSmd("PTH", "R_0603_1608Metric"));
        assertFalse(classifier.isSmd("0", "R_0603_1608Metric"));
    }

    @Test
    void emptyFlagFallsBackToFootprint() {
        assertTrue(classifier.isSmd("", "Resistor_SMD:R_0603_1608Metric"));
        assertTrue(classifier.isSmd(null, "Package_TO_SOT_SMD:SOT-23"));
        assertFalse(classifier.isSmd("unknown", "Resistor_THT:R_Axial_DIN0207"));
    }

    @Test
    void unexpectedFlagIsNotSmd() {
        assertFalse(classifier.isSmd("maybe", "R_0603_1608Metric"));
    }

    @Test
    void throughHoleMarkersBeatSmdMarkers() {
        assertFalse(classifier.isSmdFootprint("Package_TO_SOT_THT:TO-92_Inline"));
        assertTrue(classifier.isThroughHoleFootprint("Package_DIP:DIP-8_W7.62mm"));
    }

    @Test
    void unrecognizedFootprintIsNotSmd() {
        assertFalse(classifier.isSmdFootprint("MountingHole:MountingHole_3.2mm"));
        assertFalse(classifier.isSmdFootprint(null));
    }
}
