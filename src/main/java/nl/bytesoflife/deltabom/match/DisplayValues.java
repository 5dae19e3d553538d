package nl.bytesoflife.deltabom.match;

import nl.bytesoflife.deltabom.value.EiaFormatter;

/**
 * Renders component values for BOM output. Resistors, capacitors and inductors with a
 * parseable value are written in EIA notation; anything else is returned as entered.
 */
public class DisplayValues {

    private final double precisionThresholdPercent;

    public DisplayValues(double precisionThresholdPercent) {
        this.precisionThresholdPercent = precisionThresholdPercent;
    }

    public String format(AnnotatedComponent component) {
        String raw = component.component().rawValue();
        if (component.numericValue().isEmpty() || component.category().quantityKind() == null) {
            return raw;
        }
        double value = component.numericValue().getAsDouble();
        return switch (component.category()) {
            case RESISTOR -> EiaFormatter.formatResistance(value,
                    component.requiresPrecision(precisionThresholdPercent));
            case CAPACITOR -> EiaFormatter.formatCapacitance(value, false);
            case INDUCTOR -> EiaFormatter.formatInductance(value, false);
            default -> raw;
        };
    }
}
