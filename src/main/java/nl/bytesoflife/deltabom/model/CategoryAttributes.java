package nl.bytesoflife.deltabom.model;

import java.util.Locale;
import java.util.Map;

/**
 * Category-specific inventory fields. Only the variant matching the item's category
 * carries data; everything else is {@link NoAttributes}.
 */
public sealed interface CategoryAttributes permits CategoryAttributes.LedAttributes,
        CategoryAttributes.OscillatorAttributes, CategoryAttributes.ConnectorAttributes,
        CategoryAttributes.IcAttributes, CategoryAttributes.NoAttributes {

    record LedAttributes(String wavelength, String intensity, String angle) implements CategoryAttributes {
    }

    record OscillatorAttributes(String frequency, String stability, String load) implements CategoryAttributes {
    }

    record ConnectorAttributes(String pitch) implements CategoryAttributes {
    }

    record IcAttributes(String family) implements CategoryAttributes {
    }

    record NoAttributes() implements CategoryAttributes {
    }

    NoAttributes NONE = new NoAttributes();

    /**
     * Picks the variant for an inventory category text and fills it from the raw columns.
     * Column names are matched case-insensitively.
     */
    static CategoryAttributes from(String inventoryCategory, Map<String, String> columns) {
        String category = inventoryCategory == null ? "" : inventoryCategory.toUpperCase(Locale.ROOT);
        if (category.contains(Category.LED.code())) {
            return new LedAttributes(
                    column(columns, "Wavelength"),
                    firstNonEmpty(column(columns, "mcd"), column(columns, "Intensity")),
                    column(columns, "Angle"));
        }
        if (category.contains(Category.OSCILLATOR.code())) {
            return new OscillatorAttributes(
                    firstNonEmpty(column(columns, "Frequency"), column(columns, "Freq")),
                    column(columns, "Stability"),
                    column(columns, "Load"));
        }
        if (category.contains(Category.CONNECTOR.code())) {
            return new ConnectorAttributes(column(columns, "Pitch"));
        }
        if (category.contains(Category.MICROCONTROLLER.code())
                || category.contains(Category.INTEGRATED_CIRCUIT.code())) {
            return new IcAttributes(column(columns, "Family"));
        }
        return NONE;
    }

    private static String column(Map<String, String> columns, String name) {
        if (columns == null) {
            return "";
        }
        for (Map.Entry<String, String> entry : columns.entrySet()) {
            if (entry.getKey() != null && entry.getKey().trim().equalsIgnoreCase(name)) {
                return entry.getValue() == null ? "" : entry.getValue().trim();
            }
        }
        return "";
    }

    private static String firstNonEmpty(String a, String b) {
        return a.isEmpty() ? b : a;
    }
}
