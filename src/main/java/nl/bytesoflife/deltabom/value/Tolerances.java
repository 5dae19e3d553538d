package nl.bytesoflife.deltabom.value;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.OptionalDouble;

/**
 * Reads tolerance text such as "±5%", "5 %" or "+/-0.1%" as a percentage.
 */
public final class Tolerances {

    private static final Logger log = LoggerFactory.getLogger(Tolerances.class);

    private Tolerances() {
    }

    public static OptionalDouble parsePercent(String text) {
        if (text == null || text.isBlank()) {
            return OptionalDouble.empty();
        }
        String cleaned = text.trim()
                .replace("\u00B1", "")
                .replace("+/-", "")
                .replace("%", "")
                .trim();
        try {
            return OptionalDouble.of(Double.parseDouble(cleaned));
        } catch (NumberFormatException e) {
            log.debug("Ignoring malformed tolerance '{}'", text);
            return OptionalDouble.empty();
        }
    }

    /**
     * True when the text parses to a percentage at or below the threshold.
     */
    public static boolean isAtMost(String text, double thresholdPercent) {
        OptionalDouble percent = parsePercent(text);
        return percent.isPresent() && percent.getAsDouble() <= thresholdPercent;
    }
}
