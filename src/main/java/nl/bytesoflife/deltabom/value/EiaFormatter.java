package nl.bytesoflife.deltabom.value;

import java.math.BigDecimal;
import java.math.MathContext;

/**
 * Formats SI values in compact engineering notation, using the unit letter as decimal
 * point where the value has a fraction ({@code 4K7}, {@code 4n7F}).
 *
 * <p>Values are rounded to three significant digits (two below one ohm). With
 * {@code forcePrecisionDigit} an integral value keeps a trailing zero after the unit
 * letter ({@code 10K0}), so that precision intent survives a round trip.
 */
public final class EiaFormatter {

    private static final MathContext THREE_DIGITS = new MathContext(3);
    private static final MathContext TWO_DIGITS = new MathContext(2);

    private EiaFormatter() {
    }

    public static String format(QuantityKind kind, double value, boolean forcePrecisionDigit) {
        return switch (kind) {
            case RESISTANCE -> formatResistance(value, forcePrecisionDigit);
            case CAPACITANCE -> formatCapacitance(value, forcePrecisionDigit);
            case INDUCTANCE -> formatInductance(value, forcePrecisionDigit);
        };
    }

    /**
     * Examples: 3R3, 330R, 2K2, 10K, 10K0, 1M5, 0R22.
     */
    public static String formatResistance(double ohms, boolean forcePrecisionDigit) {
        requireFinite(ohms);
        if (ohms >= 1e6) {
            return withUnitLetter(scaled(ohms, -6), "M", forcePrecisionDigit);
        }
        if (ohms >= 1e3) {
            return withUnitLetter(scaled(ohms, -3), "K", forcePrecisionDigit);
        }
        if (ohms >= 1) {
            String digits = significant(BigDecimal.valueOf(ohms), THREE_DIGITS);
            if (digits.contains(".")) {
                return digits.replace('.', 'R');
            }
            return digits + "R";
        }
        if (ohms <= 0) {
            return "0R";
        }
        return significant(BigDecimal.valueOf(ohms), TWO_DIGITS).replace('.', 'R');
    }

    /**
     * Examples: 100nF, 4u7F, 22pF, 1u0F (forced).
     */
    public static String formatCapacitance(double farads, boolean forcePrecisionDigit) {
        requireFinite(farads);
        if (farads >= 1e-6) {
            return withUnitLetter(scaled(farads, 6), "u", forcePrecisionDigit) + "F";
        }
        if (farads >= 1e-9) {
            return withUnitLetter(scaled(farads, 9), "n", forcePrecisionDigit) + "F";
        }
        return withUnitLetter(scaled(farads, 12), "p", forcePrecisionDigit) + "F";
    }

    /**
     * Examples: 10uH, 2m2H, 100nH.
     */
    public static String formatInductance(double henries, boolean forcePrecisionDigit) {
        requireFinite(henries);
        if (henries >= 1e-3) {
            return withUnitLetter(scaled(henries, 3), "m", forcePrecisionDigit) + "H";
        }
        if (henries >= 1e-6) {
            return withUnitLetter(scaled(henries, 6), "u", forcePrecisionDigit) + "H";
        }
        return withUnitLetter(scaled(henries, 9), "n", forcePrecisionDigit) + "H";
    }

    private static void requireFinite(double value) {
        if (!Double.isFinite(value)) {
            throw new IllegalArgumentException("Cannot format non-finite value " + value);
        }
    }

    private static BigDecimal scaled(double value, int shift) {
        return BigDecimal.valueOf(value).movePointRight(shift);
    }

    private static String withUnitLetter(BigDecimal value, String letter, boolean forcePrecisionDigit) {
        String digits = significant(value, THREE_DIGITS);
        if (digits.contains(".")) {
            return digits.replace(".", letter);
        }
        return digits + letter + (forcePrecisionDigit ? "0" : "");
    }

    private static String significant(BigDecimal value, MathContext context) {
        BigDecimal rounded = value.round(context).stripTrailingZeros();
        if (rounded.signum() == 0) {
            return "0";
        }
        return rounded.toPlainString();
    }
}
