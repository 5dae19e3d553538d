package nl.bytesoflife.deltabom.value;

/**
 * Electrical quantities carried by passive component values, with the absolute
 * tolerance used when two parsed values are compared. The tolerance only absorbs
 * floating-point rounding; it is not a component tolerance.
 */
public enum QuantityKind {
    RESISTANCE("ohm", 1e-12),
    CAPACITANCE("farad", 1e-18),
    INDUCTANCE("henry", 1e-18);

    private final String unitName;
    private final double epsilon;

    QuantityKind(String unitName, double epsilon) {
        this.unitName = unitName;
        this.epsilon = epsilon;
    }

    public String unitName() {
        return unitName;
    }

    public boolean sameValue(double a, double b) {
        return Math.abs(a - b) <= epsilon;
    }
}
