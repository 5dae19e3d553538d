package nl.bytesoflife.deltabom.match;

import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.TreeSet;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * BOM line ordering by reference designator: prefix first ("C" before "R"), then the lowest
 * designator number in the group, then the joined reference text.
 */
public final class ReferenceOrder {

    private static final Pattern REFERENCE = Pattern.compile("^([A-Za-z]+)(\\d+)$");

    public static final Comparator<MatchGroup> GROUPS =
            Comparator.comparing(group -> sortKey(group.getReferences()));

    private ReferenceOrder() {
    }

    /**
     * @param prefix     alphabetically first designator prefix of the group, upper case
     * @param number     lowest designator number, {@link Long#MAX_VALUE} when none has one
     * @param references the references joined with ", "
     */
    public record SortKey(String prefix, long number, String references) implements Comparable<SortKey> {

        private static final Comparator<SortKey> ORDER = Comparator
                .comparing(SortKey::prefix)
                .thenComparingLong(SortKey::number)
                .thenComparing(SortKey::references);

        @Override
        public int compareTo(SortKey other) {
            return ORDER.compare(this, other);
        }
    }

    public static SortKey sortKey(List<String> references) {
        TreeSet<String> prefixes = new TreeSet<>();
        long lowest = Long.MAX_VALUE;

        for (String reference : references) {
            String ref = reference == null ? "" : reference.trim();
            if (ref.isEmpty()) {
                continue;
            }
            Matcher m = REFERENCE.matcher(ref);
            if (m.matches()) {
                prefixes.add(m.group(1).toUpperCase(Locale.ROOT));
                lowest = Math.min(lowest, parseNumber(m.group(2)));
            } else {
                prefixes.add(ref.substring(0, 1).toUpperCase(Locale.ROOT));
            }
        }

        String prefix = prefixes.isEmpty() ? "Z" : prefixes.first();
        return new SortKey(prefix, lowest, String.join(", ", references));
    }

    private static long parseNumber(String digits) {
        try {
            return Long.parseLong(digits);
        } catch (NumberFormatException e) {
            // more digits than a long holds
            return Long.MAX_VALUE - 1;
        }
    }
}
