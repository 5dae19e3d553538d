package nl.bytesoflife.deltabom.classify;

import nl.bytesoflife.deltabom.model.Category;
import nl.bytesoflife.deltabom.model.Component;

import java.util.List;
import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import static nl.bytesoflife.deltabom.classify.ClassificationRule.Target.*;

/**
 * Maps a library id and footprint to a {@link Category}.
 *
 * <p>Rules are evaluated top to bottom and the first match wins. Specific patterns precede
 * broad ones: LED rules come before the single-letter inductor and diode symbols, and
 * crystal rules before the capacitor prefixes. Footprint rules, including IC package shapes
 * such as SOIC or QFN, follow the library rules. When a component is classified, a reference
 * designator prefix ("R" of "R10") is tested against the symbol rules as a last resort.
 */
public class TypeClassifier {

    private static final Pattern REFERENCE_PREFIX = Pattern.compile("^([A-Za-z]+)");

    private static final List<ClassificationRule> DEFAULT_RULES = List.of(
            // IC families whose namespace mentions another category
            rule(NAMESPACE_PREFIX, "driver_", Category.INTEGRATED_CIRCUIT),
            rule(NAMESPACE_PREFIX, "display_", Category.INTEGRATED_CIRCUIT),

            rule(SYMBOL_CONTAINS, "led", Category.LED),
            rule(NAMESPACE_CONTAINS, "led", Category.LED),

            rule(LIBRARY_CONTAINS, "crystal", Category.OSCILLATOR),
            rule(LIBRARY_CONTAINS, "oscillator", Category.OSCILLATOR),
            rule(LIBRARY_CONTAINS, "resonator", Category.OSCILLATOR),

            rule(LIBRARY_CONTAINS, "resistor", Category.RESISTOR),
            rule(SYMBOL_EXACT, "r", Category.RESISTOR),
            rule(SYMBOL_EXACT, "rn", Category.RESISTOR),
            rule(SYMBOL_PREFIX, "r_", Category.RESISTOR),

            rule(LIBRARY_CONTAINS, "capacitor", Category.CAPACITOR),
            rule(SYMBOL_EXACT, "c", Category.CAPACITOR),
            rule(SYMBOL_EXACT, "cp", Category.CAPACITOR),
            rule(SYMBOL_PREFIX, "c_", Category.CAPACITOR),
            rule(SYMBOL_PREFIX, "cp_", Category.CAPACITOR),

            rule(LIBRARY_CONTAINS, "inductor", Category.INDUCTOR),
            rule(LIBRARY_CONTAINS, "ferrite", Category.INDUCTOR),
            rule(SYMBOL_EXACT, "l", Category.INDUCTOR),
            rule(SYMBOL_EXACT, "fb", Category.INDUCTOR),
            rule(SYMBOL_PREFIX, "l_", Category.INDUCTOR),

            rule(LIBRARY_CONTAINS, "diode", Category.DIODE),
            rule(SYMBOL_EXACT, "d", Category.DIODE),
            rule(SYMBOL_PREFIX, "d_", Category.DIODE),

            rule(LIBRARY_CONTAINS, "transistor", Category.TRANSISTOR),
            rule(SYMBOL_EXACT, "q", Category.TRANSISTOR),
            rule(SYMBOL_PREFIX, "q_", Category.TRANSISTOR),

            rule(LIBRARY_CONTAINS, "regulator", Category.REGULATOR),
            rule(SYMBOL_EXACT, "vr", Category.REGULATOR),

            rule(NAMESPACE_CONTAINS, "mcu", Category.MICROCONTROLLER),
            rule(LIBRARY_CONTAINS, "microcontroller", Category.MICROCONTROLLER),

            rule(LIBRARY_CONTAINS, "connector", Category.CONNECTOR),
            rule(NAMESPACE_PREFIX, "conn", Category.CONNECTOR),
            rule(SYMBOL_PREFIX, "conn_", Category.CONNECTOR),
            rule(SYMBOL_EXACT, "j", Category.CONNECTOR),
            rule(SYMBOL_EXACT, "p", Category.CONNECTOR),

            rule(LIBRARY_CONTAINS, "switch", Category.SWITCH),
            rule(SYMBOL_EXACT, "sw", Category.SWITCH),
            rule(SYMBOL_PREFIX, "sw_", Category.SWITCH),

            rule(LIBRARY_CONTAINS, "relay", Category.RELAY),
            rule(SYMBOL_EXACT, "k", Category.RELAY),

            rule(SYMBOL_EXACT, "y", Category.OSCILLATOR),

            rule(NAMESPACE_PREFIX, "amplifier", Category.ANALOG),

            rule(NAMESPACE_PREFIX, "timer", Category.INTEGRATED_CIRCUIT),
            rule(NAMESPACE_PREFIX, "analog", Category.INTEGRATED_CIRCUIT),
            rule(NAMESPACE_PREFIX, "interface", Category.INTEGRATED_CIRCUIT),
            rule(NAMESPACE_PREFIX, "logic", Category.INTEGRATED_CIRCUIT),
            rule(NAMESPACE_PREFIX, "memory", Category.INTEGRATED_CIRCUIT),
            rule(NAMESPACE_PREFIX, "sensor", Category.INTEGRATED_CIRCUIT),
            rule(SYMBOL_EXACT, "u", Category.INTEGRATED_CIRCUIT),
            rule(SYMBOL_EXACT, "ic", Category.INTEGRATED_CIRCUIT),

            rule(FOOTPRINT_CONTAINS, "led_", Category.LED),
            rule(FOOTPRINT_CONTAINS, "crystal", Category.OSCILLATOR),
            rule(FOOTPRINT_CONTAINS, "oscillator", Category.OSCILLATOR),
            rule(FOOTPRINT_CONTAINS, "resistor_", Category.RESISTOR),
            rule(FOOTPRINT_CONTAINS, "capacitor_", Category.CAPACITOR),
            rule(FOOTPRINT_CONTAINS, "inductor_", Category.INDUCTOR),
            rule(FOOTPRINT_CONTAINS, "diode_", Category.DIODE),
            rule(FOOTPRINT_CONTAINS, "connector", Category.CONNECTOR),
            rule(FOOTPRINT_CONTAINS, "button_switch", Category.SWITCH),
            rule(FOOTPRINT_CONTAINS, "relay_", Category.RELAY),

            // package shapes that only ICs come in
            rule(FOOTPRINT_CONTAINS, "soic", Category.INTEGRATED_CIRCUIT),
            rule(FOOTPRINT_CONTAINS, "ssop", Category.INTEGRATED_CIRCUIT),
            rule(FOOTPRINT_CONTAINS, "msop", Category.INTEGRATED_CIRCUIT),
            rule(FOOTPRINT_CONTAINS, "qfn", Category.INTEGRATED_CIRCUIT),
            rule(FOOTPRINT_CONTAINS, "dfn", Category.INTEGRATED_CIRCUIT),
            rule(FOOTPRINT_CONTAINS, "qfp", Category.INTEGRATED_CIRCUIT),
            rule(FOOTPRINT_CONTAINS, "bga", Category.INTEGRATED_CIRCUIT),
            rule(FOOTPRINT_CONTAINS, "wlcsp", Category.INTEGRATED_CIRCUIT),
            rule(FOOTPRINT_CONTAINS, "plcc", Category.INTEGRATED_CIRCUIT),
            rule(FOOTPRINT_CONTAINS, "dip-", Category.INTEGRATED_CIRCUIT)
    );

    private final List<ClassificationRule> rules;

    public TypeClassifier() {
        this(DEFAULT_RULES);
    }

    public TypeClassifier(List<ClassificationRule> rules) {
        if (rules == null) {
            throw new IllegalArgumentException("Rules must not be null");
        }
        this.rules = List.copyOf(rules);
    }

    /**
     * Classifies by library id and footprint only. Identical arguments always give the
     * identical category; unrecognized input gives {@link Category#UNKNOWN}.
     */
    public Category classify(String libraryId, String footprint) {
        String lib = lower(libraryId);
        String namespace = "";
        String symbol = lib;
        int colon = lib.indexOf(':');
        if (colon >= 0) {
            namespace = lib.substring(0, colon);
            symbol = lib.substring(colon + 1);
        }
        String fp = lower(footprint);

        for (ClassificationRule rule : rules) {
            if (rule.matches(namespace, symbol, fp)) {
                return rule.category();
            }
        }
        return Category.UNKNOWN;
    }

    /**
     * Classifies a component, falling back to its reference designator prefix when the
     * library id and footprint are not recognized.
     */
    public Category classify(Component component) {
        Category category = classify(component.libraryId(), component.footprint());
        if (category.isKnown()) {
            return category;
        }
        String prefix = referencePrefix(component.reference());
        if (prefix.isEmpty()) {
            return Category.UNKNOWN;
        }
        for (ClassificationRule rule : rules) {
            if (rule.appliesToSymbol() && rule.matches("", prefix, "")) {
                return rule.category();
            }
        }
        return Category.UNKNOWN;
    }

    /**
     * Leading alphabetic run of a reference designator, lower-cased ("R10" gives "r").
     */
    static String referencePrefix(String reference) {
        if (reference == null) {
            return "";
        }
        Matcher m = REFERENCE_PREFIX.matcher(reference.trim());
        return m.find() ? m.group(1).toLowerCase(Locale.ROOT) : "";
    }

    private static String lower(String text) {
        return text == null ? "" : text.trim().toLowerCase(Locale.ROOT);
    }

    private static ClassificationRule rule(ClassificationRule.Target target, String pattern, Category category) {
        return new ClassificationRule(target, pattern, category);
    }
}
