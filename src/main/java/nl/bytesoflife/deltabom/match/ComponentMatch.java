package nl.bytesoflife.deltabom.match;

import nl.bytesoflife.deltabom.diagnostic.Diagnostic;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Outcome of matching one component: every ranked candidate, the selection surfaced to the
 * caller (best plus verbose-mode alternates), warnings and, when nothing matched, a diagnostic.
 */
public class ComponentMatch {

    private final AnnotatedComponent component;
    private final List<MatchResult> candidates;
    private final List<MatchResult> alternates;
    private final List<MatchWarning> warnings;
    private final String notes;
    private final Diagnostic diagnostic;

    public ComponentMatch(AnnotatedComponent component,
                          List<MatchResult> candidates,
                          List<MatchResult> alternates,
                          List<MatchWarning> warnings,
                          String notes,
                          Diagnostic diagnostic) {
        this.component = component;
        this.candidates = List.copyOf(candidates);
        this.alternates = List.copyOf(alternates);
        this.warnings = List.copyOf(warnings);
        this.notes = notes == null ? "" : notes;
        this.diagnostic = diagnostic;
    }

    public AnnotatedComponent getComponent() {
        return component;
    }

    /**
     * All candidates in result order; empty when nothing matched.
     */
    public List<MatchResult> getCandidates() {
        return candidates;
    }

    public Optional<MatchResult> getBest() {
        return candidates.isEmpty() ? Optional.empty() : Optional.of(candidates.get(0));
    }

    public List<MatchResult> getAlternates() {
        return alternates;
    }

    /**
     * The best result followed by any alternates.
     */
    public List<MatchResult> getSelected() {
        List<MatchResult> selected = new ArrayList<>();
        getBest().ifPresent(selected::add);
        selected.addAll(alternates);
        return List.copyOf(selected);
    }

    public List<MatchWarning> getWarnings() {
        return warnings;
    }

    public String getNotes() {
        return notes;
    }

    public Optional<Diagnostic> getDiagnostic() {
        return Optional.ofNullable(diagnostic);
    }

    public boolean isMatched() {
        return !candidates.isEmpty();
    }

    public boolean hasWarnings() {
        return !warnings.isEmpty();
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder(component.reference()).append(": ");
        if (isMatched()) {
            MatchResult best = candidates.get(0);
            sb.append(best.internalPartNumber())
              .append(" (score=").append(best.score())
              .append(", priority=").append(best.priority()).append(")");
            if (!alternates.isEmpty()) {
                sb.append(", ").append(alternates.size()).append(" alternate(s)");
            }
        } else {
            sb.append("no match");
            if (diagnostic != null) {
                sb.append(" (").append(diagnostic.kind()).append(")");
            }
        }
        return sb.toString();
    }
}
