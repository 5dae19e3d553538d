package nl.bytesoflife.deltabom.value;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigDecimal;
import java.util.Locale;
import java.util.OptionalDouble;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Parses resistance, capacitance and inductance text into SI values.
 *
 * <p>Every parse runs the same fallback sequence and stops at the first step that applies:
 * <ol>
 *   <li>clean the text: trim, drop unit words and symbols (ohm, F, H), map micro signs to
 *       {@code u}, remove whitespace</li>
 *   <li>unit letter as decimal point: {@code 4K7}, {@code 3R3}, {@code 10K0}, {@code 4n7}, {@code 2u2}</li>
 *   <li>number with optional unit suffix: {@code 4.7k}, {@code 330R}, {@code 100nF}, {@code 10uH}</li>
 *   <li>bare number in the quantity's default unit: ohms, henries, and for capacitors
 *       microfarads in legacy mode (rejected otherwise)</li>
 * </ol>
 * Text matching none of these yields an empty result; nothing throws.
 *
 * <p>Values are built from the decimal text with {@link BigDecimal} so that equivalent
 * notations produce the identical double.
 */
public class ValueParser {

    private static final Logger log = LoggerFactory.getLogger(ValueParser.class);

    private static final Pattern RES_INFIX = Pattern.compile("^(\\d*)([RKMG])(\\d+)$");
    private static final Pattern RES_SUFFIX = Pattern.compile("^(\\d*\\.?\\d+)([RKMG]?)$");

    private static final Pattern CAP_INFIX = Pattern.compile("^(\\d+)([pnum])(\\d+)f?$");
    private static final Pattern CAP_SUFFIX = Pattern.compile("^(\\d*\\.?\\d+)([pnum])?(f)?$");

    private static final Pattern IND_INFIX = Pattern.compile("^(\\d+)([pnum])(\\d+)h?$");
    private static final Pattern IND_SUFFIX = Pattern.compile("^(\\d*\\.?\\d+)([pnum])?(h)?$");

    private static final Pattern PRECISION_DIGIT = Pattern.compile("^\\s*\\d+[kKmMrR]\\d+");

    private static final Pattern OHM_WORD = Pattern.compile("(?i)ohms?|[\\u03A9\\u2126\\u03C9]");
    private static final Pattern WHITESPACE = Pattern.compile("\\s+");

    private final boolean legacyBareCapacitance;

    public ValueParser() {
        this(true);
    }

    /**
     * @param legacyBareCapacitance when true a capacitor value without any unit letter is read
     *                              as microfarads; when false it is rejected
     */
    public ValueParser(boolean legacyBareCapacitance) {
        this.legacyBareCapacitance = legacyBareCapacitance;
    }

    public OptionalDouble parse(QuantityKind kind, String text) {
        return switch (kind) {
            case RESISTANCE -> parseResistance(text);
            case CAPACITANCE -> parseCapacitance(text);
            case INDUCTANCE -> parseInductance(text);
        };
    }

    /**
     * Parses a resistance in ohms. {@code M} is mega; there is no milliohm notation.
     */
    public OptionalDouble parseResistance(String text) {
        if (text == null || text.isBlank()) {
            return OptionalDouble.empty();
        }
        String t = WHITESPACE.matcher(OHM_WORD.matcher(text).replaceAll("")).replaceAll("")
                .toUpperCase(Locale.ROOT);

        Matcher infix = RES_INFIX.matcher(t);
        if (infix.matches()) {
            return scaled(infix.group(1), infix.group(3), resistanceExponent(infix.group(2)));
        }
        Matcher suffix = RES_SUFFIX.matcher(t);
        if (suffix.matches()) {
            return scaled(suffix.group(1), resistanceExponent(suffix.group(2)));
        }
        return unparsed(QuantityKind.RESISTANCE, text);
    }

    /**
     * Parses a capacitance in farads.
     */
    public OptionalDouble parseCapacitance(String text) {
        if (text == null || text.isBlank()) {
            return OptionalDouble.empty();
        }
        String t = clean(text);

        Matcher infix = CAP_INFIX.matcher(t);
        if (infix.matches()) {
            return scaled(infix.group(1), infix.group(3), prefixExponent(infix.group(2)));
        }
        Matcher suffix = CAP_SUFFIX.matcher(t);
        if (suffix.matches()) {
            String prefix = suffix.group(2);
            if (prefix != null) {
                return scaled(suffix.group(1), prefixExponent(prefix));
            }
            if (suffix.group(3) != null) {
                return scaled(suffix.group(1), 0);
            }
            if (legacyBareCapacitance) {
                return scaled(suffix.group(1), -6);
            }
            log.debug("Bare capacitance '{}' has no unit and legacy mode is off", text);
            return OptionalDouble.empty();
        }
        return unparsed(QuantityKind.CAPACITANCE, text);
    }

    /**
     * Parses an inductance in henries.
     */
    public OptionalDouble parseInductance(String text) {
        if (text == null || text.isBlank()) {
            return OptionalDouble.empty();
        }
        String t = clean(text);

        Matcher infix = IND_INFIX.matcher(t);
        if (infix.matches()) {
            return scaled(infix.group(1), infix.group(3), prefixExponent(infix.group(2)));
        }
        Matcher suffix = IND_SUFFIX.matcher(t);
        if (suffix.matches()) {
            String prefix = suffix.group(2);
            return scaled(suffix.group(1), prefix == null ? 0 : prefixExponent(prefix));
        }
        return unparsed(QuantityKind.INDUCTANCE, text);
    }

    /**
     * True when a digit follows the unit letter ({@code 10K0}, {@code 9K76}, {@code 4R7}),
     * which marks the designer's intent to keep that precision.
     */
    public static boolean hasPrecisionDigit(String text) {
        return text != null && PRECISION_DIGIT.matcher(text).find();
    }

    /**
     * Normalizes free text for string comparison: lower case, no whitespace, no ohm
     * symbols, micro signs as {@code u}.
     */
    public static String normalizeText(String text) {
        if (text == null) {
            return "";
        }
        String t = OHM_WORD.matcher(text.trim().toLowerCase(Locale.ROOT)).replaceAll("");
        t = t.replace('\u00B5', 'u').replace('\u03BC', 'u');
        return WHITESPACE.matcher(t).replaceAll("");
    }

    private static String clean(String text) {
        String t = text.trim().replace('\u00B5', 'u').replace('\u03BC', 'u');
        return WHITESPACE.matcher(t).replaceAll("").toLowerCase(Locale.ROOT);
    }

    private static OptionalDouble scaled(String integerPart, String fractionPart, int exponent) {
        String left = integerPart.isEmpty() ? "0" : integerPart;
        return scaled(left + "." + fractionPart, exponent);
    }

    private static OptionalDouble scaled(String decimal, int exponent) {
        try {
            double value = new BigDecimal(decimal).scaleByPowerOfTen(exponent).doubleValue();
            if (!Double.isFinite(value)) {
                log.debug("Value '{}' is out of range", decimal);
                return OptionalDouble.empty();
            }
            return OptionalDouble.of(value);
        } catch (NumberFormatException e) {
            log.debug("Cannot read '{}' as a decimal number", decimal);
            return OptionalDouble.empty();
        }
    }

    private static OptionalDouble unparsed(QuantityKind kind, String text) {
        log.debug("Unrecognized {} value '{}'", kind.unitName(), text);
        return OptionalDouble.empty();
    }

    private static int resistanceExponent(String letter) {
        return switch (letter) {
            case "K" -> 3;
            case "M" -> 6;
            case "G" -> 9;
            default -> 0;
        };
    }

    private static int prefixExponent(String letter) {
        return switch (letter) {
            case "p" -> -12;
            case "n" -> -9;
            case "u" -> -6;
            case "m" -> -3;
            default -> 0;
        };
    }
}
