package nl.bytesoflife.deltabom.match;

import nl.bytesoflife.deltabom.model.InventoryItem;

import java.util.Comparator;
import java.util.Objects;
import java.util.Optional;

/**
 * One scored candidate for a component.
 *
 * @param item       the inventory item
 * @param score      additive suitability score, always positive
 * @param priority   the item's priority, lower is preferred
 * @param debugTrace scoring steps, or null when debug output is off
 */
public record MatchResult(InventoryItem item, int score, int priority, String debugTrace) {

    /**
     * Priority ascending, then score descending. Sorting with {@link java.util.List#sort} is
     * stable, so equal results keep their inventory order.
     */
    public static final Comparator<MatchResult> ORDER = Comparator
            .comparingInt(MatchResult::priority)
            .thenComparing(Comparator.comparingInt(MatchResult::score).reversed());

    public MatchResult {
        Objects.requireNonNull(item, "item");
    }

    public MatchResult(InventoryItem item, int score) {
        this(item, score, item.getPriority(), null);
    }

    public Optional<String> trace() {
        return Optional.ofNullable(debugTrace);
    }

    public String internalPartNumber() {
        return item.getInternalPartNumber();
    }

    MatchResult withTrace(String trace) {
        return new MatchResult(item, score, priority, trace);
    }
}
