package nl.bytesoflife.deltabom.match;

import nl.bytesoflife.deltabom.classify.PackageExtractor;
import nl.bytesoflife.deltabom.classify.TypeClassifier;
import nl.bytesoflife.deltabom.model.Component;
import nl.bytesoflife.deltabom.value.ValueParser;
import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class DisplayValuesTest {

    private final ComponentAnnotator annotator = new ComponentAnnotator(
            new TypeClassifier(), new PackageExtractor(), new ValueParser(), 1.0);
    private final DisplayValues display = new DisplayValues(1.0);

    private String format(Component component) {
        return display.format(annotator.annotate(component));
    }

    @Test
    void resistorsUseEiaNotation() {
        assertEquals("4K7", format(new Component("R1", "Device:R", "4.7k", "")));
        assertEquals("10K", format(new Component("R1", "Device:R", "10000", "")));
    }

    @Test
    void precisionResistorsKeepTrailingDigit() {
        assertEquals("10K0", format(new Component("R1", "Device:R", "10k", "", Map.of("Tolerance", "1%"))));
        assertEquals("10K0", format(new Component("R1", "Device:R", "10K0", "")));
        assertEquals("10K", format(new Component("R1", "Device:R", "10k", "", Map.of("Tolerance", "5%"))));
    }

    @Test
    void capacitorsAndInductors() {
        assertEquals("100nF", format(new Component("C1", "Device:C", "0.1uF", "")));
        assertEquals("10uH", format(new Component("L1", "Device:L", "10uH", "")));
    }

    @Test
    void otherValuesAreUnchanged() {
        assertEquals("Red", format(new Component("D1", "Device:LED", "Red", "")));
        assertEquals("fancy", format(new Component("R1", "Device:R", "fancy", "")));
    }
}
