package nl.bytesoflife.deltabom.config;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Additive score contributions for a candidate that passed the primary filters.
 *
 * <p>Any weight missing from a configuration file keeps its default.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record ScoreWeights(
        int typeMatch,
        int valueMatch,
        int packageMatch,
        int toleranceExact,
        int toleranceTighter,
        int voltageMatch,
        int currentMatch,
        int powerMatch,
        int ledWavelength,
        int ledIntensity,
        int ledAngle,
        int oscillatorFrequency,
        int oscillatorStability,
        int oscillatorLoad,
        int connectorPitch,
        int icFamily,
        int genericProperty
) {
    private static final ScoreWeights DEFAULTS = new ScoreWeights(
            50, 40, 30,
            15, 12,
            10, 10, 10,
            8, 8, 5,
            12, 8, 5,
            10, 8, 3);

    public static ScoreWeights defaults() {
        return DEFAULTS;
    }

    @JsonCreator
    public static ScoreWeights of(
            @JsonProperty("typeMatch") Integer typeMatch,
            @JsonProperty("valueMatch") Integer valueMatch,
            @JsonProperty("packageMatch") Integer packageMatch,
            @JsonProperty("toleranceExact") Integer toleranceExact,
            @JsonProperty("toleranceTighter") Integer toleranceTighter,
            @JsonProperty("voltageMatch") Integer voltageMatch,
            @JsonProperty("currentMatch") Integer currentMatch,
            @JsonProperty("powerMatch") Integer powerMatch,
            @JsonProperty("ledWavelength") Integer ledWavelength,
            @JsonProperty("ledIntensity") Integer ledIntensity,
            @JsonProperty("ledAngle") Integer ledAngle,
            @JsonProperty("oscillatorFrequency") Integer oscillatorFrequency,
            @JsonProperty("oscillatorStability") Integer oscillatorStability,
            @JsonProperty("oscillatorLoad") Integer oscillatorLoad,
            @JsonProperty("connectorPitch") Integer connectorPitch,
            @JsonProperty("icFamily") Integer icFamily,
            @JsonProperty("genericProperty") Integer genericProperty) {
        return new ScoreWeights(
                or(typeMatch, DEFAULTS.typeMatch),
                or(valueMatch, DEFAULTS.valueMatch),
                or(packageMatch, DEFAULTS.packageMatch),
                or(toleranceExact, DEFAULTS.toleranceExact),
                or(toleranceTighter, DEFAULTS.toleranceTighter),
                or(voltageMatch, DEFAULTS.voltageMatch),
                or(currentMatch, DEFAULTS.currentMatch),
                or(powerMatch, DEFAULTS.powerMatch),
                or(ledWavelength, DEFAULTS.ledWavelength),
                or(ledIntensity, DEFAULTS.ledIntensity),
                or(ledAngle, DEFAULTS.ledAngle),
                or(oscillatorFrequency, DEFAULTS.oscillatorFrequency),
                or(oscillatorStability, DEFAULTS.oscillatorStability),
                or(oscillatorLoad, DEFAULTS.oscillatorLoad),
                or(connectorPitch, DEFAULTS.connectorPitch),
                or(icFamily, DEFAULTS.icFamily),
                or(genericProperty, DEFAULTS.genericProperty));
    }

    private static int or(Integer value, int fallback) {
        return value != null ? value : fallback;
    }
}
