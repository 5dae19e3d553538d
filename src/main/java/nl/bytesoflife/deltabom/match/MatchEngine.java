package nl.bytesoflife.deltabom.match;

import nl.bytesoflife.deltabom.classify.PackageExtractor;
import nl.bytesoflife.deltabom.classify.SmdClassifier;
import nl.bytesoflife.deltabom.classify.TypeClassifier;
import nl.bytesoflife.deltabom.config.MatcherConfig;
import nl.bytesoflife.deltabom.diagnostic.Diagnostic;
import nl.bytesoflife.deltabom.diagnostic.DiagnosticAnalyzer;
import nl.bytesoflife.deltabom.model.Component;
import nl.bytesoflife.deltabom.model.InventoryItem;
import nl.bytesoflife.deltabom.value.Tolerances;
import nl.bytesoflife.deltabom.value.ValueParser;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.TreeMap;
import java.util.stream.Collectors;

/**
 * Main entry point for matching components against an inventory.
 *
 * <pre>
 * GroupedResults results = new MatchEngine(inventory)
 *     .withConfig(ConfigLoader.load(Path.of("matcher.yaml")))
 *     .withVerbose(true)
 *     .groupAndMatch(components);
 * </pre>
 *
 * <p>The inventory is read-only for the lifetime of the engine, so components can be matched
 * concurrently ({@link #withParallel(boolean)}).
 */
public class MatchEngine {

    private static final Logger log = LoggerFactory.getLogger(MatchEngine.class);

    private final List<InventoryItem> inventory;
    private MatcherConfig config = MatcherConfig.defaults();
    private TypeClassifier classifier = new TypeClassifier();
    private final SmdClassifier smdClassifier = new SmdClassifier();
    private boolean parallel;

    public MatchEngine(List<InventoryItem> inventory) {
        Objects.requireNonNull(inventory, "inventory");
        this.inventory = List.copyOf(inventory);
    }

    public MatchEngine withConfig(MatcherConfig config) {
        this.config = Objects.requireNonNull(config, "config");
        return this;
    }

    public MatchEngine withVerbose(boolean enabled) {
        this.config = config.withVerbose(enabled);
        return this;
    }

    public MatchEngine withDebug(boolean enabled) {
        this.config = config.withDebug(enabled);
        return this;
    }

    public MatchEngine withParallel(boolean enabled) {
        this.parallel = enabled;
        return this;
    }

    public MatchEngine withClassifier(TypeClassifier classifier) {
        this.classifier = Objects.requireNonNull(classifier, "classifier");
        return this;
    }

    public MatcherConfig getConfig() {
        return config;
    }

    public List<InventoryItem> getInventory() {
        return inventory;
    }

    /**
     * Every candidate for the component, ordered by priority then score.
     */
    public List<MatchResult> findMatches(Component component) {
        return match(component).getCandidates();
    }

    /**
     * Matches one component, attaching alternates, warnings and a diagnostic as applicable.
     */
    public ComponentMatch match(Component component) {
        Objects.requireNonNull(component, "component");
        MatchScorer scorer = newScorer();
        return match(component, scorer, new DiagnosticAnalyzer(scorer));
    }

    public Diagnostic analyze(Component component) {
        Objects.requireNonNull(component, "component");
        return new DiagnosticAnalyzer(newScorer()).analyze(component, inventory);
    }

    /**
     * Matches a batch. Components that are identical apart from their reference are matched
     * once; each component is then grouped by its best match and footprint.
     */
    public GroupedResults groupAndMatch(List<Component> components) {
        Objects.requireNonNull(components, "components");
        MatchScorer scorer = newScorer();
        DiagnosticAnalyzer analyzer = new DiagnosticAnalyzer(scorer);
        DisplayValues displayValues = new DisplayValues(config.precisionThresholdPercent());

        Map<String, Component> distinct = new LinkedHashMap<>();
        for (Component component : components) {
            distinct.putIfAbsent(identity(component), component);
        }

        Map<String, ComponentMatch> matches;
        if (parallel) {
            matches = distinct.entrySet().parallelStream()
                    .collect(Collectors.toConcurrentMap(Map.Entry::getKey,
                            e -> match(e.getValue(), scorer, analyzer)));
        } else {
            matches = distinct.entrySet().stream()
                    .collect(Collectors.toMap(Map.Entry::getKey,
                            e -> match(e.getValue(), scorer, analyzer),
                            (a, b) -> a,
                            LinkedHashMap::new));
        }

        GroupedResults results = new GroupedResults();
        for (Component component : components) {
            ComponentMatch match = matches.get(identity(component));
            GroupKey key = match.getBest()
                    .map(best -> GroupKey.matched(best.internalPartNumber(), component.footprint()))
                    .orElseGet(() -> GroupKey.unmatched(component.rawValue(), component.footprint()));
            boolean smd = match.getBest()
                    .map(best -> smdClassifier.isSmd(best.item().getSmd(), component.footprint()))
                    .orElseGet(() -> smdClassifier.isSmdFootprint(component.footprint()));
            results.add(key, component, match, displayValues.format(match.getComponent()), smd);
        }

        log.debug("Matched {} components in {} groups ({} distinct)",
                components.size(), results.size(), distinct.size());
        return results;
    }

    private ComponentMatch match(Component component, MatchScorer scorer, DiagnosticAnalyzer analyzer) {
        AnnotatedComponent annotated = scorer.getAnnotator().annotate(component);

        List<InventoryItem> passing = new ArrayList<>();
        List<MatchResult> candidates = new ArrayList<>();
        for (InventoryItem item : inventory) {
            if (!scorer.passesPrimaryFilters(annotated, item)) {
                continue;
            }
            passing.add(item);
            ScoreCard card = scorer.evaluate(annotated, item);
            if (card.total() <= 0) {
                continue;
            }
            candidates.add(new MatchResult(item, card.total(), item.getPriority(),
                    config.debug() ? card.trace() : null));
        }
        candidates.sort(MatchResult.ORDER);

        log.debug("{}: checked {} items, {} passed filters, {} matched",
                component.reference(), inventory.size(), passing.size(), candidates.size());

        if (candidates.isEmpty()) {
            Diagnostic diagnostic = analyzer.analyze(component, inventory);
            log.debug("{}: {}", component.reference(), diagnostic.kind());
            return new ComponentMatch(annotated, candidates, List.of(), List.of(), "", diagnostic);
        }

        if (config.debug()) {
            candidates.set(0, candidates.get(0).withTrace(summary(annotated) + " | " + candidates.get(0).debugTrace()));
        }

        List<MatchResult> tied = tiedWithBest(candidates);
        List<MatchResult> alternates = List.of();
        String notes = "";
        if (config.verbose() && !tied.isEmpty()) {
            notes = "Tied priority " + candidates.get(0).priority() + ": " + (tied.size() + 1) + " options";
            alternates = tied.subList(0, Math.min(tied.size(), config.maxAlternates()));
        }

        List<MatchWarning> warnings = new ArrayList<>();
        if (annotated.requiresPrecision(config.precisionThresholdPercent())
                && passing.stream().noneMatch(i -> Tolerances.isAtMost(i.getTolerance(), config.precisionThresholdPercent()))) {
            String best = candidates.get(0).item().getTolerance();
            String threshold = percent(config.precisionThresholdPercent());
            warnings.add(new MatchWarning(MatchWarning.Kind.PRECISION_UNAVAILABLE,
                    "schematic implies " + threshold + " resistor but no " + threshold
                            + " inventory item found (best tolerance " + (best.isEmpty() ? "unknown" : best) + ")"));
        }

        return new ComponentMatch(annotated, candidates, alternates, warnings, notes, null);
    }

    private static List<MatchResult> tiedWithBest(List<MatchResult> candidates) {
        int bestPriority = candidates.get(0).priority();
        List<MatchResult> tied = new ArrayList<>();
        for (MatchResult candidate : candidates.subList(1, candidates.size())) {
            if (candidate.priority() == bestPriority) {
                tied.add(candidate);
            }
        }
        return tied;
    }

    private MatchScorer newScorer() {
        ComponentAnnotator annotator = new ComponentAnnotator(classifier, new PackageExtractor(),
                new ValueParser(config.legacyBareCapacitance()), config.precisionThresholdPercent());
        return new MatchScorer(annotator, config.weights());
    }

    private static String summary(AnnotatedComponent annotated) {
        Component c = annotated.component();
        return "Component: " + c.reference() + " (" + c.libraryId() + ") value=" + c.rawValue()
                + " type=" + annotated.category().code() + " package=" + annotated.packageName();
    }

    /**
     * Everything that decides a component's match. The classified category stands in for the
     * reference, whose prefix only matters when the library id and footprint are not recognized.
     */
    private String identity(Component component) {
        return classifier.classify(component).name() + "|" + component.libraryId() + "|"
                + ValueParser.normalizeText(component.rawValue()) + "|"
                + component.footprint() + "|" + new TreeMap<>(component.properties());
    }

    private static String percent(double value) {
        return BigDecimal.valueOf(value).stripTrailingZeros().toPlainString() + "%";
    }
}
