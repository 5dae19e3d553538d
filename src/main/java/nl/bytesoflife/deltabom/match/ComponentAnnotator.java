package nl.bytesoflife.deltabom.match;

import nl.bytesoflife.deltabom.classify.PackageExtractor;
import nl.bytesoflife.deltabom.classify.TypeClassifier;
import nl.bytesoflife.deltabom.model.Category;
import nl.bytesoflife.deltabom.model.Component;
import nl.bytesoflife.deltabom.value.QuantityKind;
import nl.bytesoflife.deltabom.value.Tolerances;
import nl.bytesoflife.deltabom.value.ValueParser;

import java.util.OptionalDouble;

/**
 * Classifies a component and parses its value and package once, so the scorer can reuse
 * the results for every inventory item.
 */
public class ComponentAnnotator {

    private final TypeClassifier classifier;
    private final PackageExtractor packageExtractor;
    private final ValueParser valueParser;
    private final double precisionThresholdPercent;

    public ComponentAnnotator(TypeClassifier classifier, PackageExtractor packageExtractor,
                              ValueParser valueParser, double precisionThresholdPercent) {
        this.classifier = classifier;
        this.packageExtractor = packageExtractor;
        this.valueParser = valueParser;
        this.precisionThresholdPercent = precisionThresholdPercent;
    }

    public AnnotatedComponent annotate(Component component) {
        Category category = classifier.classify(component);
        String token = packageExtractor.recognize(component.footprint()).orElse("");
        String packageName = token.isEmpty() ? packageExtractor.extract(component.footprint()) : token;

        QuantityKind kind = category.quantityKind();
        OptionalDouble numeric = kind != null && component.hasValue()
                ? valueParser.parse(kind, component.rawValue())
                : OptionalDouble.empty();

        boolean precisionDigit = category == Category.RESISTOR
                && ValueParser.hasPrecisionDigit(component.rawValue());

        OptionalDouble tolerance = component.property(Category.Fields.TOLERANCE)
                .map(Tolerances::parsePercent)
                .orElse(OptionalDouble.empty());
        if (tolerance.isEmpty() && precisionDigit) {
            // precision notation without a tolerance field asks for the precision class
            tolerance = OptionalDouble.of(precisionThresholdPercent);
        }

        return new AnnotatedComponent(
                component,
                category,
                token,
                packageName,
                ValueParser.normalizeText(component.rawValue()),
                numeric,
                precisionDigit,
                tolerance);
    }

    public TypeClassifier getClassifier() {
        return classifier;
    }

    public PackageExtractor getPackageExtractor() {
        return packageExtractor;
    }

    public ValueParser getValueParser() {
        return valueParser;
    }
}
