package nl.bytesoflife.deltabom.classify;

import nl.bytesoflife.deltabom.model.Category;

import java.util.Locale;

/**
 * One entry of the ordered classification table.
 *
 * @param target   which part of the component identity the pattern is tested against
 * @param pattern  lower-case pattern text
 * @param category category assigned when the pattern matches
 */
public record ClassificationRule(Target target, String pattern, Category category) {

    public enum Target {
        /** Library namespace (text before ':') starts with the pattern. */
        NAMESPACE_PREFIX,
        /** Library namespace contains the pattern. */
        NAMESPACE_CONTAINS,
        /** Whole library id contains the pattern. */
        LIBRARY_CONTAINS,
        /** Symbol name (text after ':') equals the pattern. */
        SYMBOL_EXACT,
        /** Symbol name starts with the pattern. */
        SYMBOL_PREFIX,
        /** Symbol name contains the pattern. */
        SYMBOL_CONTAINS,
        /** Footprint name contains the pattern. */
        FOOTPRINT_CONTAINS
    }

    public ClassificationRule {
        if (target == null || category == null) {
            throw new IllegalArgumentException("Rule target and category must be set");
        }
        if (pattern == null || pattern.isEmpty()) {
            throw new IllegalArgumentException("Rule pattern must not be empty");
        }
        pattern = pattern.toLowerCase(Locale.ROOT);
    }

    /**
     * Tests the rule against lower-cased identity parts.
     */
    public boolean matches(String namespace, String symbol, String footprint) {
        return switch (target) {
            case NAMESPACE_PREFIX -> namespace.startsWith(pattern);
            case NAMESPACE_CONTAINS -> namespace.contains(pattern);
            case LIBRARY_CONTAINS -> namespace.contains(pattern) || symbol.contains(pattern);
            case SYMBOL_EXACT -> symbol.equals(pattern);
            case SYMBOL_PREFIX -> symbol.startsWith(pattern);
            case SYMBOL_CONTAINS -> symbol.contains(pattern);
            case FOOTPRINT_CONTAINS -> footprint.contains(pattern);
        };
    }

    /**
     * True for rules that can also be tested against a bare reference designator prefix.
     */
    public boolean appliesToSymbol() {
        return target == Target.SYMBOL_EXACT || target == Target.SYMBOL_PREFIX
                || target == Target.SYMBOL_CONTAINS;
    }
}
