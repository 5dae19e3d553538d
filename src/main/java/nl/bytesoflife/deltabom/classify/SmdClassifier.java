package nl.bytesoflife.deltabom.classify;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Decides whether a matched part is surface mount, from the inventory SMD flag and,
 * when the flag is empty or unknown, from the footprint.
 */
public class SmdClassifier {

    private static final Logger log = LoggerFactory.getLogger(SmdClassifier.class);

    private static final Set<String> SMD_FLAGS = Set.of("SMD", "Y", "YES", "TRUE", "1");
    private static final Set<String> THROUGH_HOLE_FLAGS =
            Set.of("PTH", "THT", "TH", "THROUGH-HOLE", "N", "NO", "FALSE", "0");
    private static final Set<String> UNKNOWN_FLAGS = Set.of("", "UNKNOWN", "N/A");

    private static final List<String> SMD_PACKAGES = List.of(
            "0402", "0603", "0805", "1206", "1210",
            "1005", "1608", "2012", "3216", "3225", "5050",
            "sot", "sc-70", "sc70",
            "soic", "ssop", "tssop", "qfp", "qfn", "dfn", "bga", "wlcsp", "lga", "plcc",
            "pqfp", "tqfp", "lqfp", "msop",
            "sod-123", "sod-323", "sod-523", "sod-923",
            "dpak", "d2pak", "_smd");

    private static final List<String> THROUGH_HOLE_PACKAGES = List.of(
            "dip", "through-hole", "tht", "axial", "radial",
            "to-220", "to-252", "to-263", "to-39", "to-92");

    /**
     * @param smdFlag   the inventory SMD column, may be empty
     * @param footprint the component footprint used when the flag is inconclusive
     */
    public boolean isSmd(String smdFlag, String footprint) {
        String flag = smdFlag == null ? "" : smdFlag.trim().toUpperCase(Locale.ROOT);

        if (SMD_FLAGS.contains(flag)) {
            return true;
        }
        if (THROUGH_HOLE_FLAGS.contains(flag)) {
            return false;
        }
        if (UNKNOWN_FLAGS.contains(flag)) {
            return isSmdFootprint(footprint);
        }
        log.warn("Unexpected SMD flag '{}' for footprint '{}', treating as not SMD", smdFlag, footprint);
        return false;
    }

    /**
     * Footprint-only decision. Through-hole markers win over SMD markers
     * ("Package_TO_SOT_THT:TO-92" is not SMD); unrecognized footprints count as not SMD.
     */
    public boolean isSmdFootprint(String footprint) {
        if (isThroughHoleFootprint(footprint)) {
            return false;
        }
        String fp = footprint == null ? "" : footprint.toLowerCase(Locale.ROOT);
        for (String indicator : SMD_PACKAGES) {
            if (fp.contains(indicator)) {
                return true;
            }
        }
        return false;
    }

    public boolean isThroughHoleFootprint(String footprint) {
        String fp = footprint == null ? "" : footprint.toLowerCase(Locale.ROOT);
        for (String indicator : THROUGH_HOLE_PACKAGES) {
            if (fp.contains(indicator)) {
                return true;
            }
        }
        return false;
    }
}
