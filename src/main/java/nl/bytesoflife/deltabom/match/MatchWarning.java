package nl.bytesoflife.deltabom.match;

/**
 * Annotation on a successful match that the caller should surface to the user.
 */
public record MatchWarning(Kind kind, String message) {

    public enum Kind {
        /** The design asks for a precision resistor but only looser parts are stocked. */
        PRECISION_UNAVAILABLE
    }

    @Override
    public String toString() {
        return "[" + kind + "] " + message;
    }
}
