package nl.bytesoflife.deltabom.match;

import java.util.List;

/**
 * Score of one candidate with the steps that produced it.
 *
 * @param total sum of all contributions
 * @param steps human-readable contributions, e.g. "Type match: +50"
 */
public record ScoreCard(int total, List<String> steps) {

    public ScoreCard {
        steps = List.copyOf(steps);
    }

    public String trace() {
        return String.join(", ", steps);
    }
}
