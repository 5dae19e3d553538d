package nl.bytesoflife.deltabom.diagnostic;

import nl.bytesoflife.deltabom.classify.PackageExtractor;
import nl.bytesoflife.deltabom.match.AnnotatedComponent;
import nl.bytesoflife.deltabom.match.MatchScorer;
import nl.bytesoflife.deltabom.model.Category;
import nl.bytesoflife.deltabom.model.Component;
import nl.bytesoflife.deltabom.model.InventoryItem;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.TreeSet;

/**
 * Explains why a component has no inventory match.
 *
 * <p>The inventory is re-scanned without the package filter: items are counted by category,
 * then by value within the category, and value matches are split by whether they carry the
 * required package. The first condition that holds decides the {@link DiagnosticKind}.
 */
public class DiagnosticAnalyzer {

    private static final Logger log = LoggerFactory.getLogger(DiagnosticAnalyzer.class);

    private final MatchScorer scorer;

    public DiagnosticAnalyzer(MatchScorer scorer) {
        this.scorer = Objects.requireNonNull(scorer, "scorer");
    }

    public Diagnostic analyze(Component component, List<InventoryItem> inventory) {
        AnnotatedComponent annotated = scorer.getAnnotator().annotate(component);
        Category category = annotated.category();
        String packageName = annotated.packageName();

        if (!category.isKnown()) {
            return new Diagnostic(DiagnosticKind.TYPE_UNKNOWN, component, category, packageName);
        }

        int typeMatches = 0;
        int valueMatches = 0;
        boolean stockedInPackage = false;
        boolean stockedElsewhere = false;
        Set<String> otherPackages = new TreeSet<>();

        for (InventoryItem item : inventory) {
            if (!category.matchesInventoryCategory(item.getCategory())) {
                continue;
            }
            typeMatches++;

            if (!annotated.hasValue() || !scorer.valuesMatch(annotated, item.getValue())) {
                continue;
            }
            valueMatches++;

            if (annotated.hasPackageToken()) {
                if (PackageExtractor.packageMatches(annotated.packageToken(), item.getPackageName())) {
                    stockedInPackage = true;
                } else {
                    stockedElsewhere = true;
                    if (!item.getPackageName().isEmpty()) {
                        otherPackages.add(item.getPackageName());
                    }
                }
            }
        }

        log.debug("{}: {} items of type {}, {} with value '{}'",
                component.reference(), typeMatches, category.code(), valueMatches, component.rawValue());

        if (typeMatches == 0) {
            return new Diagnostic(DiagnosticKind.NO_TYPE_MATCH, component, category, packageName);
        }
        if (valueMatches == 0 && annotated.hasValue()) {
            return new Diagnostic(DiagnosticKind.NO_VALUE_MATCH, component, category, packageName);
        }
        if (stockedElsewhere && !stockedInPackage) {
            DiagnosticKind kind = otherPackages.isEmpty()
                    ? DiagnosticKind.PACKAGE_MISMATCH_GENERIC
                    : DiagnosticKind.PACKAGE_MISMATCH;
            return new Diagnostic(kind, component, category, packageName,
                    annotated.packageToken(), List.copyOf(otherPackages));
        }
        return new Diagnostic(DiagnosticKind.NO_MATCH, component, category, packageName);
    }
}
