package nl.bytesoflife.deltabom.classify;

import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Extracts a normalized package token ("0603", "SOT-23", "SOIC-8") from a footprint name.
 *
 * <p>Patterns are tried from most to least specific and the first match wins:
 * imperial chip codes, small-outline transistor and diode packages, pin-counted IC
 * families, TO/DPAK power packages, and finally metric chip codes.
 */
public class PackageExtractor {

    private static final List<Pattern> PATTERNS = List.of(
            Pattern.compile("(?<![0-9])(01005|0201|0402|0603|0805|1206|1210|1812|2010|2512)(?![0-9])"),
            Pattern.compile("(?i)(?<![A-Z0-9])(SOT-23-[568]|SOT-223|SOT-143|SOT-323|SOT-353|SOT-363|SOT-523"
                    + "|SOT-89|SOT-23|SC-70|SOD-123|SOD-323|SOD-523|SOD-923)(?![0-9])"),
            Pattern.compile("(?i)(?<![A-Z])[HVWU]?(TSSOP|SSOP|MSOP|SOIC|SOP|TQFP|LQFP|QFP|QFN|DFN|BGA|WLCSP|LGA"
                    + "|PLCC|DIP)-(\\d+)"),
            Pattern.compile("(?i)(?<![A-Z])(TO-220|TO-247|TO-252|TO-263|TO-39|TO-92|D2PAK|DPAK)(?![0-9])"),
            Pattern.compile("(?<![0-9])(1005|1608|2012|3216|3225|3528|5050)(?![0-9])")
    );

    private static final Pattern DIMENSIONS = Pattern.compile("_\\d+(\\.\\d+)?x\\d+(\\.\\d+)?(x\\d+(\\.\\d+)?)?mm.*$");
    private static final Pattern PITCH = Pattern.compile("_P\\d+(\\.\\d+)?mm.*$");
    private static final Pattern DIAMETER = Pattern.compile("_[DL]\\d+(\\.\\d+)?mm.*$");

    /**
     * Returns the package token, or a cleaned footprint name when no known package is found.
     * Returns an empty string for an empty footprint.
     */
    public String extract(String footprint) {
        Optional<String> token = recognize(footprint);
        if (token.isPresent()) {
            return token.get();
        }
        return clean(footprint);
    }

    /**
     * Returns the package token only when one of the known patterns matches.
     */
    public Optional<String> recognize(String footprint) {
        if (footprint == null || footprint.isBlank()) {
            return Optional.empty();
        }
        for (Pattern pattern : PATTERNS) {
            Matcher m = pattern.matcher(footprint);
            if (m.find()) {
                String token = m.groupCount() >= 2 && m.group(2) != null
                        ? m.group(1) + "-" + m.group(2)
                        : m.group(1);
                return Optional.of(token.toUpperCase(Locale.ROOT));
            }
        }
        return Optional.empty();
    }

    /**
     * True when an inventory package field contains the token, ignoring case and dashes
     * ("SOT23" satisfies "SOT-23").
     */
    public static boolean packageMatches(String token, String inventoryPackage) {
        if (token == null || token.isEmpty() || inventoryPackage == null || inventoryPackage.isEmpty()) {
            return false;
        }
        String pkg = inventoryPackage.toUpperCase(Locale.ROOT);
        String wanted = token.toUpperCase(Locale.ROOT);
        if (pkg.contains(wanted)) {
            return true;
        }
        return wanted.contains("-") && pkg.replace("-", "").contains(wanted.replace("-", ""));
    }

    /**
     * Strips the library prefix and dimension, pitch and diameter annotations.
     */
    static String clean(String footprint) {
        if (footprint == null) {
            return "";
        }
        String name = footprint.trim();
        int colon = name.lastIndexOf(':');
        if (colon >= 0) {
            name = name.substring(colon + 1);
        }
        name = DIMENSIONS.matcher(name).replaceFirst("");
        name = PITCH.matcher(name).replaceFirst("");
        name = DIAMETER.matcher(name).replaceFirst("");
        while (name.endsWith("_")) {
            name = name.substring(0, name.length() - 1);
        }
        return name;
    }
}
