package nl.bytesoflife.deltabom.fabricator;

import nl.bytesoflife.deltabom.model.InventoryItem;

import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.function.Supplier;

/**
 * Registry of the built-in fabricators, looked up by case-insensitive name.
 */
public class Fabricators {

    private static final Map<String, Supplier<Fabricator>> REGISTRY = Map.of(
            "jlc", JlcFabricator::new,
            "seeed", SeeedFabricator::new,
            "pcbway", PcbWayFabricator::new,
            "generic", GenericFabricator::new);

    private Fabricators() {
    }

    /**
     * Returns the named fabricator; unknown or empty names give the generic one.
     */
    public static Fabricator get(String name) {
        String key = name == null ? "" : name.trim().toLowerCase(Locale.ROOT);
        Supplier<Fabricator> factory = REGISTRY.get(key);
        return factory != null ? factory.get() : new GenericFabricator();
    }

    public static List<String> names() {
        return List.of("jlc", "seeed", "pcbway", "generic");
    }

    /**
     * Lower case, with spaces and dashes as underscores ("LCSC Part #" gives "lcsc_part_#").
     */
    static String normalizeColumn(String name) {
        return name.trim().toLowerCase(Locale.ROOT).replace(' ', '_').replace('-', '_');
    }

    /**
     * First non-empty raw column whose normalized name is in the candidate list, tried in
     * candidate order.
     */
    static String firstColumn(InventoryItem item, List<String> candidates) {
        for (String candidate : candidates) {
            for (Map.Entry<String, String> column : item.getAttributes().entrySet()) {
                if (column.getValue() != null && !column.getValue().isEmpty()
                        && normalizeColumn(column.getKey()).equals(candidate)) {
                    return column.getValue();
                }
            }
        }
        return "";
    }
}
