package pl.marcinmilkowski.deriv_lexicon.model;

/**
 * Non-fatal inconsistency found while building a forest.
 */
public record IntegrityWarning(Kind kind, String message) {

    public enum Kind {
        /** Stated ids do not match line positions 0..N-1. */
        NON_CONTIGUOUS_IDS,
        /** A (lemma, derivation pattern) pair occurs more than once. */
        DUPLICATE_LEMMA_KEY
    }

    @Override
    public String toString() {
        return kind + ": " + message;
    }
}
