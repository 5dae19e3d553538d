package nl.bytesoflife.deltabom.match;

import nl.bytesoflife.deltabom.classify.PackageExtractor;
import nl.bytesoflife.deltabom.config.ScoreWeights;
import nl.bytesoflife.deltabom.model.Category;
import nl.bytesoflife.deltabom.model.CategoryAttributes;
import nl.bytesoflife.deltabom.model.CategoryAttributes.ConnectorAttributes;
import nl.bytesoflife.deltabom.model.CategoryAttributes.IcAttributes;
import nl.bytesoflife.deltabom.model.CategoryAttributes.LedAttributes;
import nl.bytesoflife.deltabom.model.CategoryAttributes.OscillatorAttributes;
import nl.bytesoflife.deltabom.model.Component;
import nl.bytesoflife.deltabom.model.InventoryItem;
import nl.bytesoflife.deltabom.value.QuantityKind;
import nl.bytesoflife.deltabom.value.Tolerances;
import nl.bytesoflife.deltabom.value.ValueParser;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.OptionalDouble;
import java.util.Set;

/**
 * Decides whether an inventory item can stand in for a component and, if so, how well.
 *
 * <p>Primary filters are hard: category, recognized package and value must all agree.
 * Only items passing them are scored; the score is a plain sum of {@link ScoreWeights}.
 */
public class MatchScorer {

    private static final List<String> VOLTAGE_PROPERTIES = List.of("Voltage", "V");
    private static final List<String> CURRENT_PROPERTIES = List.of("A", "Amperage", "Current");
    private static final List<String> POWER_PROPERTIES = List.of("W", "Power", "P", "Wattage");

    // fields with a dedicated weight; everything else falls under the generic bonus
    private static final Set<String> DEDICATED_FIELDS = Set.of(
            "tolerance", "voltage", "v", "a", "amperage", "current", "w", "power", "p", "wattage",
            "wavelength", "mcd", "intensity", "angle", "frequency", "stability", "load", "pitch", "family");

    private static final double TOLERANCE_EPSILON = 1e-9;

    private final ComponentAnnotator annotator;
    private final ScoreWeights weights;

    public MatchScorer(ComponentAnnotator annotator, ScoreWeights weights) {
        this.annotator = annotator;
        this.weights = weights;
    }

    public boolean passesPrimaryFilters(Component component, InventoryItem item) {
        return passesPrimaryFilters(annotator.annotate(component), item);
    }

    public int score(Component component, InventoryItem item) {
        return score(annotator.annotate(component), item);
    }

    public boolean passesPrimaryFilters(AnnotatedComponent component, InventoryItem item) {
        if (component.category().isKnown()
                && !component.category().matchesInventoryCategory(item.getCategory())) {
            return false;
        }
        if (component.hasPackageToken()
                && !PackageExtractor.packageMatches(component.packageToken(), item.getPackageName())) {
            return false;
        }
        if (component.hasValue()) {
            return valuesMatch(component, item.getValue());
        }
        return true;
    }

    public int score(AnnotatedComponent component, InventoryItem item) {
        return evaluate(component, item).total();
    }

    /**
     * Scores an item that passed the primary filters and records each contribution.
     */
    public ScoreCard evaluate(AnnotatedComponent component, InventoryItem item) {
        List<String> steps = new ArrayList<>();
        int score = 0;

        Category category = component.category();
        if (category.matchesInventoryCategory(item.getCategory())) {
            score += add(steps, "Type match", weights.typeMatch());
        }
        if (component.hasValue() && valuesMatch(component, item.getValue())) {
            score += add(steps, "Value match", weights.valueMatch());
        }
        String wantedPackage = component.hasPackageToken() ? component.packageToken() : component.packageName();
        if (PackageExtractor.packageMatches(wantedPackage, item.getPackageName())) {
            score += add(steps, "Package match", weights.packageMatch());
        }

        score += scoreTolerance(component, item, steps);
        score += scoreElectrical(component, item, steps);
        score += scoreCategoryDetails(component, item.getDetails(), steps);
        score += scoreGenericProperties(component, item, steps);

        return new ScoreCard(score, steps);
    }

    /**
     * Compares a component value with an inventory value: numerically for resistors,
     * capacitors and inductors, as normalized text otherwise. A value that cannot be
     * parsed never matches.
     */
    public boolean valuesMatch(AnnotatedComponent component, String inventoryValue) {
        if (!component.hasValue() || inventoryValue == null || inventoryValue.isBlank()) {
            return false;
        }
        QuantityKind kind = component.category().quantityKind();
        if (kind != null) {
            OptionalDouble wanted = component.numericValue();
            OptionalDouble offered = annotator.getValueParser().parse(kind, inventoryValue);
            return wanted.isPresent() && offered.isPresent()
                    && kind.sameValue(wanted.getAsDouble(), offered.getAsDouble());
        }
        return component.normalizedValue().equals(ValueParser.normalizeText(inventoryValue));
    }

    public ComponentAnnotator getAnnotator() {
        return annotator;
    }

    private int scoreTolerance(AnnotatedComponent component, InventoryItem item, List<String> steps) {
        if (!component.category().isRelevant(Category.Fields.TOLERANCE)) {
            return 0;
        }
        OptionalDouble required = component.requiredTolerance();
        OptionalDouble offered = Tolerances.parsePercent(item.getTolerance());
        if (required.isEmpty() || offered.isEmpty()) {
            return 0;
        }
        double wanted = required.getAsDouble();
        double actual = offered.getAsDouble();
        if (Math.abs(wanted - actual) < TOLERANCE_EPSILON) {
            return add(steps, "Tolerance exact", weights.toleranceExact());
        }
        if (actual < wanted) {
            return add(steps, "Tolerance tighter", weights.toleranceTighter());
        }
        return 0;
    }

    private int scoreElectrical(AnnotatedComponent component, InventoryItem item, List<String> steps) {
        Category category = component.category();
        Component source = component.component();
        int score = 0;
        if ((category.isRelevant(Category.Fields.VOLTAGE) || category.isRelevant("Voltage"))
                && firstContained(source, VOLTAGE_PROPERTIES, item.getVoltage())) {
            score += add(steps, "Voltage match", weights.voltageMatch());
        }
        if ((category.isRelevant(Category.Fields.AMPERAGE) || category.isRelevant("Amperage"))
                && firstContained(source, CURRENT_PROPERTIES, item.getAmperage())) {
            score += add(steps, "Current match", weights.currentMatch());
        }
        if ((category.isRelevant(Category.Fields.WATTAGE) || category.isRelevant(Category.Fields.POWER))
                && firstContained(source, POWER_PROPERTIES, item.getWattage())) {
            score += add(steps, "Power match", weights.powerMatch());
        }
        return score;
    }

    private int scoreCategoryDetails(AnnotatedComponent component, CategoryAttributes details, List<String> steps) {
        Category category = component.category();
        Component source = component.component();
        int score = 0;

        if (details instanceof LedAttributes led) {
            if (category == Category.LED) {
                if (contained(source.property("Wavelength"), led.wavelength())) {
                    score += add(steps, "Wavelength match", weights.ledWavelength());
                }
                if (contained(source.property("mcd").or(() -> source.property("Intensity")), led.intensity())) {
                    score += add(steps, "Intensity match", weights.ledIntensity());
                }
                if (contained(source.property("Angle"), led.angle())) {
                    score += add(steps, "Angle match", weights.ledAngle());
                }
            }
        } else if (details instanceof OscillatorAttributes osc) {
            if (category == Category.OSCILLATOR) {
                if (contained(source.property("Frequency"), osc.frequency())) {
                    score += add(steps, "Frequency match", weights.oscillatorFrequency());
                }
                if (contained(source.property("Stability"), osc.stability())) {
                    score += add(steps, "Stability match", weights.oscillatorStability());
                }
                if (contained(source.property("Load"), osc.load())) {
                    score += add(steps, "Load match", weights.oscillatorLoad());
                }
            }
        } else if (details instanceof ConnectorAttributes connector) {
            if (category == Category.CONNECTOR && contained(source.property("Pitch"), connector.pitch())) {
                score += add(steps, "Pitch match", weights.connectorPitch());
            }
        } else if (details instanceof IcAttributes ic) {
            if ((category == Category.MICROCONTROLLER || category == Category.INTEGRATED_CIRCUIT)
                    && contained(source.property("Family"), ic.family())) {
                score += add(steps, "Family match", weights.icFamily());
            }
        }
        return score;
    }

    private int scoreGenericProperties(AnnotatedComponent component, InventoryItem item, List<String> steps) {
        int score = 0;
        for (Map.Entry<String, String> property : component.component().properties().entrySet()) {
            String name = property.getKey();
            if (!component.category().isRelevant(name)
                    || DEDICATED_FIELDS.contains(name.toLowerCase(Locale.ROOT))) {
                continue;
            }
            if (contained(Optional.ofNullable(property.getValue()).map(String::trim), item.attribute(name))) {
                score += add(steps, name + " match", weights.genericProperty());
            }
        }
        return score;
    }

    private static boolean firstContained(Component component, List<String> propertyNames, String offered) {
        if (offered == null || offered.isEmpty()) {
            return false;
        }
        for (String name : propertyNames) {
            Optional<String> wanted = component.property(name);
            if (wanted.isPresent()) {
                return contained(wanted, offered);
            }
        }
        return false;
    }

    private static boolean contained(Optional<String> wanted, String offered) {
        if (wanted.isEmpty() || wanted.get().isEmpty() || offered == null || offered.isEmpty()) {
            return false;
        }
        return offered.toLowerCase(Locale.ROOT).contains(wanted.get().toLowerCase(Locale.ROOT));
    }

    private static int add(List<String> steps, String label, int weight) {
        steps.add(label + ": +" + weight);
        return weight;
    }
}
