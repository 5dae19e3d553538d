package nl.bytesoflife.deltabom.diagnostic;

/**
 * Why a component found no inventory match. Exactly one kind is assigned per unmatched
 * component; the analyzer checks them in declaration order.
 */
public enum DiagnosticKind {
    /** The category could not be determined at all. */
    TYPE_UNKNOWN,
    /** Category known, but the inventory has no items of that category. */
    NO_TYPE_MATCH,
    /** Items of the category exist, but none with the component's value. */
    NO_VALUE_MATCH,
    /** The value is stocked, but only in other packages. */
    PACKAGE_MISMATCH,
    /** The value is stocked outside the required package, and those items name no package. */
    PACKAGE_MISMATCH_GENERIC,
    /** None of the specific conditions apply. */
    NO_MATCH
}
