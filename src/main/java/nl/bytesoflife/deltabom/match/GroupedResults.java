package nl.bytesoflife.deltabom.match;

import nl.bytesoflife.deltabom.model.Component;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Result of matching a batch of components, grouped by {@link GroupKey} in order of first
 * appearance.
 */
public class GroupedResults {

    private final Map<GroupKey, MatchGroup> groups = new LinkedHashMap<>();

    void add(GroupKey key, Component component, ComponentMatch match, String displayValue, boolean smd) {
        groups.computeIfAbsent(key, k -> new MatchGroup(k, match, displayValue, smd)).addComponent(component);
    }

    public List<MatchGroup> getGroups() {
        return Collections.unmodifiableList(new ArrayList<>(groups.values()));
    }

    public MatchGroup get(GroupKey key) {
        return groups.get(key);
    }

    public int size() {
        return groups.size();
    }

    /**
     * Selected results per group: the best match and, in verbose mode, its alternates.
     * Unmatched groups map to an empty list.
     */
    public Map<GroupKey, List<MatchResult>> asResultMap() {
        Map<GroupKey, List<MatchResult>> results = new LinkedHashMap<>();
        for (MatchGroup group : groups.values()) {
            results.put(group.getKey(), group.getMatch().getSelected());
        }
        return Collections.unmodifiableMap(results);
    }

    /**
     * Groups sorted by reference designator, the order a BOM lists them in.
     */
    public List<MatchGroup> inBomOrder() {
        List<MatchGroup> sorted = new ArrayList<>(groups.values());
        sorted.sort(ReferenceOrder.GROUPS);
        return sorted;
    }

    public List<MatchGroup> getUnmatched() {
        return groups.values().stream()
                .filter(g -> !g.isMatched())
                .toList();
    }

    public List<MatchGroup> getWithWarnings() {
        return groups.values().stream()
                .filter(g -> g.getMatch().hasWarnings())
                .toList();
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder("Match Results:\n");
        sb.append("  Groups: ").append(groups.size())
          .append(" (").append(groups.size() - getUnmatched().size()).append(" matched, ")
          .append(getUnmatched().size()).append(" unmatched)\n");
        for (MatchGroup group : inBomOrder()) {
            sb.append("  - ").append(group.getReferenceText())
              .append(" [").append(group.getQuantity()).append("] ")
              .append(group.getDisplayValue()).append(" -> ").append(group.getKey()).append("\n");
            for (MatchWarning warning : group.getMatch().getWarnings()) {
                sb.append("      ").append(warning).append("\n");
            }
            group.getMatch().getDiagnostic()
                    .ifPresent(d -> sb.append("      ").append(d.terse()).append("\n"));
        }
        return sb.toString();
    }
}
