package nl.bytesoflife.deltabom.diagnostic;

import nl.bytesoflife.deltabom.model.Category;
import nl.bytesoflife.deltabom.model.Component;

import java.util.List;
import java.util.Locale;
import java.util.Objects;

/**
 * Structured explanation of a missing match, rendered either as a single line for a BOM
 * cell ({@link #terse()}) or as a two-line console message ({@link #verbose()}).
 *
 * @param kind              the assigned classification
 * @param component         the unmatched component
 * @param category          its classified category
 * @param packageName       package token or cleaned footprint name, empty when unknown
 * @param requiredPackage   the package the inventory was expected to carry
 * @param availablePackages packages in which the value is stocked, sorted
 */
public record Diagnostic(
        DiagnosticKind kind,
        Component component,
        Category category,
        String packageName,
        String requiredPackage,
        List<String> availablePackages
) {
    public Diagnostic {
        Objects.requireNonNull(kind, "kind");
        Objects.requireNonNull(component, "component");
        category = Objects.requireNonNullElse(category, Category.UNKNOWN);
        packageName = Objects.requireNonNullElse(packageName, "");
        requiredPackage = Objects.requireNonNullElse(requiredPackage, "");
        availablePackages = availablePackages == null ? List.of() : List.copyOf(availablePackages);
    }

    public Diagnostic(DiagnosticKind kind, Component component, Category category, String packageName) {
        this(kind, component, category, packageName, "", List.of());
    }

    /**
     * Single line, e.g. {@code Component: R1 (Device:R) is a 10K 0603 Resistor; Issue: ...}.
     */
    public String terse() {
        String description;
        if (category.isKnown()) {
            description = "Component: " + component.reference() + " (" + component.libraryId() + ") is a"
                    + typeDescription();
        } else {
            description = "Component: " + component.reference() + " (" + component.libraryId() + ") from "
                    + namespace() + " (part: " + symbol() + ")";
        }
        return description + "; Issue: " + issue(false);
    }

    /**
     * Component description followed by an indented issue line.
     */
    public String verbose() {
        String description;
        if (category.isKnown()) {
            description = "Component " + component.reference() + " from " + namespace() + " is a"
                    + typeDescription();
        } else {
            description = "Component " + component.reference() + " from " + namespace()
                    + " (part: " + symbol() + ")";
        }
        return description + "\n    Issue: " + issue(true);
    }

    @Override
    public String toString() {
        return kind + ": " + terse();
    }

    private String issue(boolean console) {
        String value = component.rawValue();
        return switch (kind) {
            case TYPE_UNKNOWN -> console
                    ? "Cannot determine component type - may be a non-electronic part (board outline, label, etc.)"
                    : "Component type could not be determined";
            case NO_TYPE_MATCH -> console
                    ? "No " + friendlyName() + "s in inventory"
                    : "No " + category.code() + " components found in inventory";
            case NO_VALUE_MATCH -> console
                    ? "No " + friendlyName() + "s with value '" + value + "' in inventory"
                    : "No " + category.code() + " components with value " + value + " found";
            case PACKAGE_MISMATCH -> "Value '" + value + "' available in " + String.join(", ", availablePackages)
                    + " packages, but not " + requiredPackage;
            case PACKAGE_MISMATCH_GENERIC -> console
                    ? "Package mismatch - needs " + requiredPackage
                    : "Package mismatch - required " + requiredPackage;
            case NO_MATCH -> "Component specification doesn't match any inventory items";
        };
    }

    private String typeDescription() {
        StringBuilder sb = new StringBuilder();
        if (!component.rawValue().isBlank()) {
            sb.append(' ').append(component.rawValue());
        }
        if (!packageName.isEmpty()) {
            sb.append(' ').append(packageName);
        }
        return sb.append(' ').append(category.displayName()).toString();
    }

    private String friendlyName() {
        return category.displayName().toLowerCase(Locale.ROOT);
    }

    private String namespace() {
        String lib = component.libraryId();
        int colon = lib.indexOf(':');
        return colon >= 0 ? lib.substring(0, colon) : "";
    }

    private String symbol() {
        String lib = component.libraryId();
        int colon = lib.indexOf(':');
        return colon >= 0 ? lib.substring(colon + 1) : lib;
    }
}
