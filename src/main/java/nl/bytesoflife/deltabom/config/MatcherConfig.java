package nl.bytesoflife.deltabom.config;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Settings for a matching run.
 *
 * <p><b>Example YAML:</b>
 * <pre>{@code
 * precisionThresholdPercent: 1.0
 * maxAlternates: 2
 * legacyBareCapacitance: true
 * verbose: false
 * debug: false
 * weights:
 *   typeMatch: 50
 *   toleranceTighter: 12
 * }</pre>
 *
 * @param weights                   score contributions
 * @param precisionThresholdPercent tolerance at or below which a resistor counts as precision
 * @param maxAlternates             tied alternates surfaced in verbose mode
 * @param legacyBareCapacitance     read unit-less capacitor values as microfarads
 * @param verbose                   surface tied alternates and tie notes
 * @param debug                     attach scoring traces to match results
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record MatcherConfig(
        ScoreWeights weights,
        double precisionThresholdPercent,
        int maxAlternates,
        boolean legacyBareCapacitance,
        boolean verbose,
        boolean debug
) {
    public static final double DEFAULT_PRECISION_THRESHOLD = 1.0;
    public static final int DEFAULT_MAX_ALTERNATES = 2;

    public MatcherConfig {
        if (weights == null) {
            weights = ScoreWeights.defaults();
        }
        if (maxAlternates < 0) {
            throw new IllegalArgumentException("maxAlternates must be >= 0");
        }
    }

    public static MatcherConfig defaults() {
        return new MatcherConfig(ScoreWeights.defaults(), DEFAULT_PRECISION_THRESHOLD,
                DEFAULT_MAX_ALTERNATES, true, false, false);
    }

    @JsonCreator
    public static MatcherConfig of(
            @JsonProperty("weights") ScoreWeights weights,
            @JsonProperty("precisionThresholdPercent") Double precisionThresholdPercent,
            @JsonProperty("maxAlternates") Integer maxAlternates,
            @JsonProperty("legacyBareCapacitance") Boolean legacyBareCapacitance,
            @JsonProperty("verbose") Boolean verbose,
            @JsonProperty("debug") Boolean debug) {
        return new MatcherConfig(
                weights,
                precisionThresholdPercent != null ? precisionThresholdPercent : DEFAULT_PRECISION_THRESHOLD,
                maxAlternates != null ? maxAlternates : DEFAULT_MAX_ALTERNATES,
                legacyBareCapacitance == null || legacyBareCapacitance,
                verbose != null && verbose,
                debug != null && debug);
    }

    public MatcherConfig withVerbose(boolean enabled) {
        return new MatcherConfig(weights, precisionThresholdPercent, maxAlternates,
                legacyBareCapacitance, enabled, debug);
    }

    public MatcherConfig withDebug(boolean enabled) {
        return new MatcherConfig(weights, precisionThresholdPercent, maxAlternates,
                legacyBareCapacitance, verbose, enabled);
    }

    public MatcherConfig withWeights(ScoreWeights newWeights) {
        return new MatcherConfig(newWeights, precisionThresholdPercent, maxAlternates,
                legacyBareCapacitance, verbose, debug);
    }
}
