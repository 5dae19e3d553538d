package nl.bytesoflife.deltabom.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * A placed design element as read from a schematic.
 *
 * @param reference  unique designator, e.g. "R10"
 * @param libraryId  namespaced symbol identifier, e.g. "Device:R"
 * @param rawValue   value text as entered by the designer
 * @param footprint  footprint name, e.g. "Resistor_SMD:R_0603_1608Metric"
 * @param properties remaining symbol fields such as "Tolerance" -> "1%"
 */
public record Component(
        String reference,
        String libraryId,
        String rawValue,
        String footprint,
        Map<String, String> properties
) {
    public Component {
        reference = Objects.requireNonNullElse(reference, "");
        libraryId = Objects.requireNonNullElse(libraryId, "");
        rawValue = Objects.requireNonNullElse(rawValue, "");
        footprint = Objects.requireNonNullElse(footprint, "");
        properties = properties == null
                ? Map.of()
                : Collections.unmodifiableMap(new LinkedHashMap<>(properties));
    }

    public Component(String reference, String libraryId, String rawValue, String footprint) {
        this(reference, libraryId, rawValue, footprint, Map.of());
    }

    /**
     * Returns a non-blank property value, trimmed.
     */
    public Optional<String> property(String name) {
        String value = properties.get(name);
        if (value == null || value.isBlank()) {
            return Optional.empty();
        }
        return Optional.of(value.trim());
    }

    public boolean hasValue() {
        return !rawValue.isBlank();
    }
}
