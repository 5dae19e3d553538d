package nl.bytesoflife.deltabom.match;

import nl.bytesoflife.deltabom.model.Category;
import nl.bytesoflife.deltabom.model.Component;

import java.util.OptionalDouble;

/**
 * A component together with everything derived from it once per run.
 *
 * @param component         the source component
 * @param category          classified category
 * @param packageToken      recognized package token, empty when none was recognized
 * @param packageName       package token or cleaned footprint name, for display
 * @param normalizedValue   value text normalized for string comparison
 * @param numericValue      parsed value for resistors, capacitors and inductors
 * @param precisionDigit    the value notation carries a digit after the unit letter
 * @param requiredTolerance tolerance in percent the design asks for, explicit or implied
 */
public record AnnotatedComponent(
        Component component,
        Category category,
        String packageToken,
        String packageName,
        String normalizedValue,
        OptionalDouble numericValue,
        boolean precisionDigit,
        OptionalDouble requiredTolerance
) {
    public boolean hasValue() {
        return !normalizedValue.isEmpty();
    }

    public boolean hasPackageToken() {
        return !packageToken.isEmpty();
    }

    /**
     * True when this is a resistor whose notation or tolerance asks for precision-class parts.
     */
    public boolean requiresPrecision(double thresholdPercent) {
        if (category != Category.RESISTOR) {
            return false;
        }
        return precisionDigit
                || (requiredTolerance.isPresent() && requiredTolerance.getAsDouble() <= thresholdPercent);
    }

    public String reference() {
        return component.reference();
    }
}
