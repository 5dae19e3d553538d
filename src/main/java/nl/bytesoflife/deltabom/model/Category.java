package nl.bytesoflife.deltabom.model;

import nl.bytesoflife.deltabom.value.QuantityKind;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Locale;

/**
 * Canonical component categories. The {@link #code()} is what inventory category
 * columns are expected to contain (e.g. "RES", "CAP").
 */
public enum Category {
    RESISTOR("RES", "Resistor", QuantityKind.RESISTANCE,
            List.of(Fields.VOLTAGE, Fields.WATTAGE, Fields.POWER, Fields.TOLERANCE)),
    CAPACITOR("CAP", "Capacitor", QuantityKind.CAPACITANCE,
            List.of(Fields.VOLTAGE, "Voltage", "Type", Fields.TOLERANCE)),
    INDUCTOR("IND", "Inductor", QuantityKind.INDUCTANCE,
            List.of(Fields.AMPERAGE, Fields.WATTAGE)),
    DIODE("DIO", "Diode", null,
            List.of(Fields.VOLTAGE, Fields.AMPERAGE)),
    LED("LED", "LED", null,
            List.of(Fields.VOLTAGE, Fields.AMPERAGE, "mcd", "Wavelength", "Angle")),
    TRANSISTOR("Q", "Transistor", null,
            List.of(Fields.VOLTAGE, Fields.AMPERAGE, Fields.WATTAGE)),
    INTEGRATED_CIRCUIT("IC", "IC", null,
            List.of(Fields.VOLTAGE, "Family")),
    MICROCONTROLLER("MCU", "Microcontroller", null,
            List.of("Family")),
    REGULATOR("REG", "Regulator", null,
            List.of(Fields.VOLTAGE, Fields.AMPERAGE, Fields.WATTAGE)),
    OSCILLATOR("OSC", "Oscillator", null,
            List.of("Frequency", "Stability", "Load")),
    CONNECTOR("CON", "Connector", null,
            List.of("Pitch")),
    SWITCH("SWI", "Switch", null,
            List.of("Form")),
    RELAY("RLY", "Relay", null,
            List.of("Form")),
    ANALOG("ANA", "Analog", null,
            List.of(Fields.VOLTAGE)),
    UNKNOWN("", "Unknown", null,
            List.of(Fields.VOLTAGE, Fields.AMPERAGE, Fields.WATTAGE, Fields.TOLERANCE,
                    "Temperature Coefficient"));

    /**
     * Property names shared by several categories.
     */
    public static final class Fields {
        public static final String VOLTAGE = "V";
        public static final String AMPERAGE = "A";
        public static final String WATTAGE = "W";
        public static final String POWER = "Power";
        public static final String TOLERANCE = "Tolerance";

        private Fields() {
        }
    }

    private final String code;
    private final String displayName;
    private final QuantityKind quantityKind;
    private final List<String> relevantFields;

    Category(String code, String displayName, QuantityKind quantityKind, List<String> relevantFields) {
        this.code = code;
        this.displayName = displayName;
        this.quantityKind = quantityKind;
        this.relevantFields = Collections.unmodifiableList(new ArrayList<>(relevantFields));
    }

    public String code() {
        return code;
    }

    public String displayName() {
        return displayName;
    }

    /**
     * The electrical quantity the component value expresses, or null when the value
     * is compared as text (part numbers, colors, ...).
     */
    public QuantityKind quantityKind() {
        return quantityKind;
    }

    /**
     * True when the property contributes to the suitability score for this category.
     */
    public boolean isRelevant(String field) {
        return relevantFields.contains(field);
    }

    public boolean isKnown() {
        return this != UNKNOWN;
    }

    /**
     * True when the inventory category text names this category (case-insensitive substring).
     */
    public boolean matchesInventoryCategory(String inventoryCategory) {
        if (!isKnown() || inventoryCategory == null) {
            return false;
        }
        return inventoryCategory.toUpperCase(Locale.ROOT).contains(code);
    }
}
