package pl.marcinmilkowski.deriv_lexicon.model;

import java.util.Objects;

/**
 * A single lexeme of the derivational forest.
 *
 * The children of a lexeme are not part of the record: they are derived from
 * the parent references and owned by {@link pl.marcinmilkowski.deriv_lexicon.store.LexemeStore}.
 */
public record Lexeme(
    int id,
    String lemma,
    String derivationPattern,
    String partOfSpeech,
    int parentId
) {
    /** Marker for forest roots. */
    public static final int NO_PARENT = -1;

    public Lexeme {
        Objects.requireNonNull(lemma, "lemma");
        if (lemma.isEmpty()) {
            throw new IllegalArgumentException("Empty lemma");
        }
        derivationPattern = derivationPattern == null ? "" : derivationPattern;
        partOfSpeech = partOfSpeech == null ? "" : partOfSpeech;
        requireSingleField(lemma, "lemma");
        requireSingleField(derivationPattern, "derivation pattern");
        requireSingleField(partOfSpeech, "part of speech");
        if (parentId < NO_PARENT) {
            throw new IllegalArgumentException("Invalid parent id " + parentId + " for lemma: " + lemma);
        }
    }

    public boolean hasParent() {
        return parentId != NO_PARENT;
    }

    public Lexeme withId(int newId) {
        return new Lexeme(newId, lemma, derivationPattern, partOfSpeech, parentId);
    }

    public Lexeme relabel(int newId, int newParentId) {
        return new Lexeme(newId, lemma, derivationPattern, partOfSpeech, newParentId);
    }

    // the record must survive one tab-separated line
    private static void requireSingleField(String value, String name) {
        for (int i = 0; i < value.length(); i++) {
            char c = value.charAt(i);
            if (c == '\t' || c == '\n' || c == '\r') {
                throw new IllegalArgumentException("Tab or line break in " + name + " at index " + i);
            }
        }
    }

    @Override
    public String toString() {
        return id + ":" + lemma + "#" + derivationPattern;
    }
}
