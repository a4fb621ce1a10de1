package pl.marcinmilkowski.deriv_lexicon.index;

import pl.marcinmilkowski.deriv_lexicon.model.Lexeme;
import pl.marcinmilkowski.deriv_lexicon.store.LexemeView;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Maps lemmas to the ids of the lexemes sharing them, keyed secondarily by
 * derivation pattern.
 *
 * Lemmas are matched exactly (case-sensitive).
 */
public class LemmaIndex {

    private final Map<String, Map<String, Integer>> idsByLemma;

    public LemmaIndex() {
        this.idsByLemma = new HashMap<>();
    }

    public LemmaIndex(int expectedLemmas) {
        this.idsByLemma = new HashMap<>(Math.max(16, (int) (expectedLemmas / 0.75f) + 1));
    }

    /**
     * Builds a fresh index over every lexeme of the store.
     * The first lexeme wins when a (lemma, pattern) pair repeats.
     */
    public static LemmaIndex rebuild(LexemeView store) {
        LemmaIndex index = new LemmaIndex(store.size());
        for (Lexeme lexeme : store) {
            index.insert(lexeme.lemma(), lexeme.derivationPattern(), lexeme.id());
        }
        return index;
    }

    /**
     * @return false if the (lemma, pattern) pair was already present; the existing id is kept
     */
    public boolean insert(String lemma, String derivationPattern, int id) {
        String pattern = derivationPattern == null ? "" : derivationPattern;
        return idsByLemma.computeIfAbsent(lemma, k -> new LinkedHashMap<>(2))
            .putIfAbsent(pattern, id) == null;
    }

    public LemmaLookup lookup(String lemma) {
        return lookup(lemma, null);
    }

    /**
     * Resolves a lemma to a single id.
     *
     * @param derivationPattern used only when the lemma has several lexemes; may be null
     */
    public LemmaLookup lookup(String lemma, String derivationPattern) {
        Map<String, Integer> byPattern = idsByLemma.get(lemma);
        if (byPattern == null) {
            return LemmaLookup.notFound();
        }
        if (byPattern.size() == 1) {
            return LemmaLookup.found(byPattern.values().iterator().next());
        }
        if (derivationPattern != null) {
            Integer id = byPattern.get(derivationPattern);
            if (id != null) {
                return LemmaLookup.found(id);
            }
        }
        return LemmaLookup.ambiguous(new ArrayList<>(byPattern.values()));
    }

    /**
     * @return ids of all lexemes with this lemma, in insertion order
     */
    public List<Integer> ids(String lemma) {
        Map<String, Integer> byPattern = idsByLemma.get(lemma);
        if (byPattern == null) {
            return Collections.emptyList();
        }
        return List.copyOf(byPattern.values());
    }

    public boolean contains(String lemma) {
        return idsByLemma.containsKey(lemma);
    }

    public int lemmaCount() {
        return idsByLemma.size();
    }
}
