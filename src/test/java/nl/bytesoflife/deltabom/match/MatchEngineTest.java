package nl.bytesoflife.deltabom.match;

import nl.bytesoflife.deltabom.config.MatcherConfig;
import nl.bytesoflife.deltabom.config.ScoreWeights;
import nl.bytesoflife.deltabom.diagnostic.DiagnosticKind;
import nl.bytesoflife.deltabom.model.Component;
import nl.bytesoflife.deltabom.model.InventoryItem;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class MatchEngineTest {

    private static final String R_0603 = "Resistor_SMD:R_0603_1608Metric";
    private static final String C_0603 = "Capacitor_SMD:C_0603_1608Metric";

    private static InventoryItem resistor(String ipn, String value, String tolerance, int priority) {
        return InventoryItem.builder(ipn)
                .category("RES")
                .value(value)
                .packageName("0603")
                .tolerance(tolerance)
                .priority(priority)
                .build();
    }

    private static InventoryItem resistor(String ipn, String value, String tolerance) {
        return resistor(ipn, value, tolerance, InventoryItem.DEFAULT_PRIORITY);
    }

    @Test
    void precisionNotationPrefersOnePercentPart() {
        MatchEngine engine = new MatchEngine(List.of(
                resistor("RES-10K-5", "10K", "5%"),
                resistor("RES-10K-1", "10K", "1%")));

        ComponentMatch match = engine.match(new Component("R1", "Device:R", "10K0", ""));

        assertEquals("RES-10K-1", match.getBest().orElseThrow().internalPartNumber());
        assertFalse(match.hasWarnings());
    }

    @Test
    void missingPrecisionPartIsFlagged() {
        MatchEngine engine = new MatchEngine(List.of(resistor("RES-10K-5", "10K", "5%")));

        ComponentMatch match = engine.match(new Component("R1", "Device:R", "10K0", R_0603));

        assertTrue(match.isMatched());
        assertEquals("RES-10K-5", match.getBest().orElseThrow().internalPartNumber());
        assertEquals(1, match.getWarnings().size());
        MatchWarning warning = match.getWarnings().get(0);
        assertEquals(MatchWarning.Kind.PRECISION_UNAVAILABLE, warning.kind());
        assertEquals("schematic implies 1% resistor but no 1% inventory item found (best tolerance 5%)",
                warning.message());
    }

    @Test
    void explicitToleranceAlsoRequiresPrecision() {
        MatchEngine engine = new MatchEngine(List.of(resistor("RES-10K-5", "10K", "5%")));
        Component r = new Component("R1", "Device:R", "10K", R_0603, Map.of("Tolerance", "1%"));
        assertTrue(engine.match(r).hasWarnings());
    }

    @Test
    void plainValueDoesNotRequirePrecision() {
        MatchEngine engine = new MatchEngine(List.of(resistor("RES-10K-5", "10K", "5%")));
        assertFalse(engine.match(new Component("R1", "Device:R", "10K", R_0603)).hasWarnings());
    }

    @Test
    void lowerPriorityNumberAlwaysSortsFirst() {
        MatchEngine engine = new MatchEngine(List.of(
                resistor("RES-B", "10K", "1%", 5),
                resistor("RES-A", "10K", "5%", 1)));
        Component r = new Component("R1", "Device:R", "10K", R_0603, Map.of("Tolerance", "1%"));

        List<MatchResult> results = engine.findMatches(r);

        assertEquals(2, results.size());
        assertEquals("RES-A", results.get(0).internalPartNumber());
        assertTrue(results.get(0).score() < results.get(1).score());
        assertEquals(1, results.get(0).priority());
    }

    @Test
    void equalResultsKeepInventoryOrder() {
        MatchEngine engine = new MatchEngine(List.of(
                resistor("RES-1", "10K", "5%"),
                resistor("RES-2", "10K", "5%"),
                resistor("RES-3", "10K", "5%")));
        Component r = new Component("R1", "Device:R", "10K", R_0603);

        for (int i = 0; i < 3; i++) {
            List<MatchResult> results = engine.findMatches(r);
            assertEquals(List.of("RES-1", "RES-2", "RES-3"),
                    results.stream().map(MatchResult::internalPartNumber).toList());
        }
    }

    @Test
    void defaultModeHidesTiedAlternates() {
        MatchEngine engine = new MatchEngine(List.of(
                resistor("RES-1", "10K", "5%", 1),
                resistor("RES-2", "10K", "5%", 1)));

        ComponentMatch match = engine.match(new Component("R1", "Device:R", "10K", R_0603));

        assertEquals(1, match.getSelected().size());
        assertTrue(match.getAlternates().isEmpty());
        assertEquals("", match.getNotes());
        assertEquals(2, match.getCandidates().size());
    }

    @Test
    void verboseModeShowsUpToTwoTiedAlternates() {
        MatchEngine engine = new MatchEngine(List.of(
                resistor("RES-1", "10K", "5%", 1),
                resistor("RES-2", "10K", "5%", 1),
                resistor("RES-3", "10K", "5%", 1),
                resistor("RES-4", "10K", "5%", 1),
                resistor("RES-5", "10K", "5%", 2)))
                .withVerbose(true);

        ComponentMatch match = engine.match(new Component("R1", "Device:R", "10K", R_0603));

        assertEquals(List.of("RES-2", "RES-3"),
                match.getAlternates().stream().map(MatchResult::internalPartNumber).toList());
        assertEquals("Tied priority 1: 4 options", match.getNotes());
        assertEquals(3, match.getSelected().size());
    }

    @Test
    void verboseModeWithoutTiesHasNoAlternates() {
        MatchEngine engine = new MatchEngine(List.of(
                resistor("RES-1", "10K", "5%", 1),
                resistor("RES-2", "10K", "5%", 2)))
                .withVerbose(true);

        ComponentMatch match = engine.match(new Component("R1", "Device:R", "10K", R_0603));

        assertTrue(match.getAlternates().isEmpty());
        assertEquals("", match.getNotes());
    }

    @Test
    void alternateLimitIsConfigurable() {
        MatcherConfig config = new MatcherConfig(ScoreWeights.defaults(), 1.0, 1, true, true, false);
        MatchEngine engine = new MatchEngine(List.of(
                resistor("RES-1", "10K", "5%"),
                resistor("RES-2", "10K", "5%"),
                resistor("RES-3", "10K", "5%")))
                .withConfig(config);

        assertEquals(1, engine.match(new Component("R1", "Device:R", "10K", R_0603)).getAlternates().size());
    }

    @Test
    void zeroScoreItemsAreNotMatches() {
        MatchEngine engine = new MatchEngine(List.of(resistor("RES-1", "10K", "5%")));

        ComponentMatch match = engine.match(new Component("X1", "Foo:Bar123", "", ""));

        assertFalse(match.isMatched());
        assertEquals(DiagnosticKind.TYPE_UNKNOWN, match.getDiagnostic().orElseThrow().kind());
    }

    @Test
    void unmatchedComponentGetsDiagnostic() {
        MatchEngine engine = new MatchEngine(List.of(resistor("RES-10K", "10K", "5%")));

        ComponentMatch match = engine.match(new Component("R1", "Device:R", "47K", R_0603));

        assertTrue(match.getCandidates().isEmpty());
        assertEquals(DiagnosticKind.NO_VALUE_MATCH, match.getDiagnostic().orElseThrow().kind());
        assertEquals(DiagnosticKind.NO_VALUE_MATCH,
                engine.analyze(new Component("R1", "Device:R", "47K", R_0603)).kind());
    }

    @Test
    void matchedComponentHasNoDiagnostic() {
        MatchEngine engine = new MatchEngine(List.of(resistor("RES-10K", "10K", "5%")));
        assertTrue(engine.match(new Component("R1", "Device:R", "10K", R_0603)).getDiagnostic().isEmpty());
    }

    @Test
    void debugModeAttachesTraces() {
        MatchEngine engine = new MatchEngine(List.of(
                resistor("RES-1", "10K", "1%"),
                resistor("RES-2", "10K", "5%")))
                .withDebug(true);

        List<MatchResult> results = engine.findMatches(new Component("R1", "Device:R", "10K0", R_0603));

        String first = results.get(0).trace().orElseThrow();
        assertTrue(first.startsWith("Component: R1 (Device:R) value=10K0 type=RES package=0603"));
        assertTrue(first.contains("Tolerance exact: +15"));
        String second = results.get(1).trace().orElseThrow();
        assertTrue(second.startsWith("Type match: +50"));
    }

    @Test
    void tracesAreOffByDefault() {
        MatchEngine engine = new MatchEngine(List.of(resistor("RES-1", "10K", "1%")));
        assertTrue(engine.findMatches(new Component("R1", "Device:R", "10K", R_0603)).get(0).trace().isEmpty());
    }

    @Test
    void strictCapacitanceRejectsBareNumbers() {
        InventoryItem cap = InventoryItem.builder("CAP-10U").category("CAP").value("10uF").packageName("0603").build();
        Component c = new Component("C1", "Device:C", "10", C_0603);

        assertEquals(1, new MatchEngine(List.of(cap)).findMatches(c).size());

        MatcherConfig strict = new MatcherConfig(ScoreWeights.defaults(), 1.0, 2, false, false, false);
        assertTrue(new MatchEngine(List.of(cap)).withConfig(strict).findMatches(c).isEmpty());
    }

    @Test
    void groupsIdenticalComponentsByBestMatch() {
        MatchEngine engine = new MatchEngine(List.of(
                resistor("RES-10K", "10K", "5%"),
                InventoryItem.builder("CAP-100N").category("CAP").value("100nF").packageName("0603").smd("SMD").build()));
        List<Component> components = List.of(
                new Component("R2", "Device:R", "10k", R_0603),
                new Component("R1", "Device:R", "10K", R_0603),
                new Component("R3", "Device:R", "47K", R_0603),
                new Component("C1", "Device:C", "0.1uF", C_0603));

        GroupedResults results = engine.groupAndMatch(components);

        assertEquals(3, results.size());
        MatchGroup resistors = results.get(GroupKey.matched("RES-10K", R_0603));
        assertNotNull(resistors);
        assertEquals(List.of("R2", "R1"), resistors.getReferences());
        assertEquals(2, resistors.getQuantity());
        assertEquals("10K", resistors.getDisplayValue());
        assertTrue(resistors.isSmd());

        MatchGroup unmatched = results.get(GroupKey.unmatched("47K", R_0603));
        assertNotNull(unmatched);
        assertFalse(unmatched.isMatched());
        assertEquals(List.of(unmatched), results.getUnmatched());
        assertTrue(unmatched.getMatch().getDiagnostic().isPresent());

        MatchGroup capacitors = results.get(GroupKey.matched("CAP-100N", C_0603));
        assertEquals("100nF", capacitors.getDisplayValue());
    }

    @Test
    void bomOrderFollowsReferences() {
        MatchEngine engine = new MatchEngine(List.of(
                resistor("RES-10K", "10K", "5%"),
                InventoryItem.builder("CAP-100N").category("CAP").value("100nF").packageName("0603").build()));
        List<Component> components = List.of(
                new Component("R10", "Device:R", "10K", R_0603),
                new Component("R3", "Device:R", "47K", R_0603),
                new Component("C1", "Device:C", "100nF", C_0603));

        List<String> order = engine.groupAndMatch(components).inBomOrder().stream()
                .map(MatchGroup::getReferenceText)
                .toList();

        assertEquals(List.of("C1", "R3", "R10"), order);
    }

    @Test
    void resultMapHoldsSelectedResults() {
        MatchEngine engine = new MatchEngine(List.of(resistor("RES-10K", "10K", "5%")));
        List<Component> components = List.of(
                new Component("R1", "Device:R", "10K", R_0603),
                new Component("R2", "Device:R", "1M", R_0603));

        Map<GroupKey, List<MatchResult>> map = engine.groupAndMatch(components).asResultMap();

        assertEquals(1, map.get(GroupKey.matched("RES-10K", R_0603)).size());
        assertTrue(map.get(GroupKey.unmatched("1M", R_0603)).isEmpty());
    }

    @Test
    void parallelMatchingGivesSameGroups() {
        List<InventoryItem> inventory = List.of(
                resistor("RES-10K", "10K", "5%"),
                resistor("RES-4K7", "4K7", "5%"),
                InventoryItem.builder("CAP-100N").category("CAP").value("100nF").packageName("0603").build());
        List<Component> components = List.of(
                new Component("R1", "Device:R", "10K", R_0603),
                new Component("R2", "Device:R", "4.7k", R_0603),
                new Component("R3", "Device:R", "10K", R_0603),
                new Component("C1", "Device:C", "100nF", C_0603),
                new Component("C2", "Device:C", "1uF", C_0603));

        GroupedResults sequential = new MatchEngine(inventory).groupAndMatch(components);
        GroupedResults parallel = new MatchEngine(inventory).withParallel(true).groupAndMatch(components);

        assertEquals(
                sequential.getGroups().stream().map(g -> g.getKey() + "=" + g.getReferenceText()).toList(),
                parallel.getGroups().stream().map(g -> g.getKey() + "=" + g.getReferenceText()).toList());
    }

    @Test
    void referencePrefixKeepsOtherwiseIdenticalPartsApart() {
        MatchEngine engine = new MatchEngine(List.of(
                InventoryItem.builder("RES-100").category("RES").value("100").build(),
                InventoryItem.builder("CAP-100").category("CAP").value("100uF").build()));
        Component r = new Component("R1", "Custom:Part", "100", "");
        Component c = new Component("C1", "Custom:Part", "100", "");

        GroupedResults results = engine.groupAndMatch(List.of(r, c));

        assertEquals(2, results.size());
        assertEquals(List.of("R1"), results.get(GroupKey.matched("RES-100", "")).getReferences());
        assertEquals(List.of("C1"), results.get(GroupKey.matched("CAP-100", "")).getReferences());
    }

    @Test
    void overlongValueDoesNotBreakBatch() {
        MatchEngine engine = new MatchEngine(List.of(resistor("RES-10K", "10K", "5%")));
        String huge = "1" + "0".repeat(400);

        GroupedResults results = engine.groupAndMatch(List.of(
                new Component("R1", "Device:R", huge, R_0603),
                new Component("R2", "Device:R", "10K", R_0603)));

        MatchGroup unmatched = results.get(GroupKey.unmatched(huge, R_0603));
        assertFalse(unmatched.isMatched());
        assertEquals(huge, unmatched.getDisplayValue());
        assertEquals(DiagnosticKind.NO_VALUE_MATCH, unmatched.getMatch().getDiagnostic().orElseThrow().kind());
        assertTrue(results.get(GroupKey.matched("RES-10K", R_0603)).isMatched());
    }

    @Test
    void nullArgumentsAreRejected() {
        assertThrows(NullPointerException.class, () -> new MatchEngine(null));
        MatchEngine engine = new MatchEngine(List.of());
        assertThrows(NullPointerException.class, () -> engine.findMatches(null));
        assertThrows(NullPointerException.class, () -> engine.groupAndMatch(null));
    }

    @Test
    void groupKeyText() {
        assertEquals("RES-10K_" + R_0603, GroupKey.matched("RES-10K", R_0603).toString());
        assertEquals("NO_MATCH_47K_" + R_0603, GroupKey.unmatched("47K", R_0603).toString());
    }
}
