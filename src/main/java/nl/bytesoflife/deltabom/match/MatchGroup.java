package nl.bytesoflife.deltabom.match;

import nl.bytesoflife.deltabom.model.Component;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Components that resolved to the same {@link GroupKey}, with the match of the first
 * component added.
 */
public class MatchGroup {

    private final GroupKey key;
    private final ComponentMatch match;
    private final String displayValue;
    private final boolean smd;
    private final List<Component> components = new ArrayList<>();

    MatchGroup(GroupKey key, ComponentMatch match, String displayValue, boolean smd) {
        this.key = key;
        this.match = match;
        this.displayValue = displayValue;
        this.smd = smd;
    }

    void addComponent(Component component) {
        components.add(component);
    }

    public GroupKey getKey() {
        return key;
    }

    public ComponentMatch getMatch() {
        return match;
    }

    /**
     * Value as it should appear in a BOM, e.g. "10K0" for a 1% 10k resistor.
     */
    public String getDisplayValue() {
        return displayValue;
    }

    public boolean isSmd() {
        return smd;
    }

    public List<Component> getComponents() {
        return Collections.unmodifiableList(components);
    }

    public List<String> getReferences() {
        return components.stream().map(Component::reference).toList();
    }

    public String getReferenceText() {
        return String.join(", ", getReferences());
    }

    public int getQuantity() {
        return components.size();
    }

    public boolean isMatched() {
        return key.matched();
    }
}
