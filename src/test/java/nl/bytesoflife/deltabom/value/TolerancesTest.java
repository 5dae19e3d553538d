package nl.bytesoflife.deltabom.value;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class TolerancesTest {

    @Test
    void parsesCommonSpellings() {
        assertEquals(5.0, Tolerances.parsePercent("5%").getAsDouble());
        assertEquals(1.0, Tolerances.parsePercent("±1%").getAsDouble());
        assertEquals(0.1, Tolerances.parsePercent("+/-0.1%").getAsDouble());
        assertEquals(10.0, Tolerances.parsePercent(" 10 % ").getAsDouble());
    }

    @Test
    void malformedToleranceIsIgnored() {
        assertTrue(Tolerances.parsePercent("tight").isEmpty());
        assertTrue(Tolerances.parsePercent("").isEmpty());
        assertTrue(Tolerances.parsePercent(null).isEmpty());
    }

    @Test
    void atMostThreshold() {
        assertTrue(Tolerances.isAtMost("1%", 1.0));
        assertTrue(Tolerances.isAtMost("0.5%", 1.0));
        assertFalse(Tolerances.isAtMost("5%", 1.0));
        assertFalse(Tolerances.isAtMost("n/a", 1.0));
    }
}
