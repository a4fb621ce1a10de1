package pl.marcinmilkowski.deriv_lexicon.index;

import java.util.List;

/**
 * Outcome of a {@link LemmaIndex} lookup.
 *
 * Callers must treat {@link Status#AMBIGUOUS} differently from
 * {@link Status#NOT_FOUND}: the lemma exists, but the derivation pattern
 * was missing or did not pick out a single lexeme.
 */
public record LemmaLookup(Status status, int id, List<Integer> candidates) {

    public enum Status {
        FOUND,
        AMBIGUOUS,
        NOT_FOUND
    }

    private static final LemmaLookup NOT_FOUND = new LemmaLookup(Status.NOT_FOUND, -1, List.of());

    public LemmaLookup {
        candidates = candidates == null ? List.of() : List.copyOf(candidates);
    }

    public static LemmaLookup found(int id) {
        return new LemmaLookup(Status.FOUND, id, List.of(id));
    }

    public static LemmaLookup ambiguous(List<Integer> candidates) {
        return new LemmaLookup(Status.AMBIGUOUS, -1, candidates);
    }

    public static LemmaLookup notFound() {
        return NOT_FOUND;
    }

    public boolean isFound() {
        return status == Status.FOUND;
    }
}
