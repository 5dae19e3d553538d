package nl.bytesoflife.deltabom.match;

/**
 * Key under which identical components are aggregated: the matched part number and the
 * footprint, or the raw value and footprint when nothing matched.
 */
public record GroupKey(String partNumber, String value, String footprint, boolean matched) {

    public static GroupKey matched(String internalPartNumber, String footprint) {
        return new GroupKey(internalPartNumber, "", footprint, true);
    }

    public static GroupKey unmatched(String rawValue, String footprint) {
        return new GroupKey("", rawValue, footprint, false);
    }

    @Override
    public String toString() {
        return matched
                ? partNumber + "_" + footprint
                : "NO_MATCH_" + value + "_" + footprint;
    }
}
