package pl.marcinmilkowski.deriv_lexicon.forest;

import pl.marcinmilkowski.deriv_lexicon.model.IntegrityWarning;

import java.util.List;

/**
 * A built forest together with the non-fatal problems found in its input.
 */
public record BuildResult(DerivationForest forest, List<IntegrityWarning> warnings) {

    public BuildResult {
        warnings = warnings == null ? List.of() : List.copyOf(warnings);
    }

    public boolean hasWarnings() {
        return !warnings.isEmpty();
    }
}
