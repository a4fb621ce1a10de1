package pl.marcinmilkowski.deriv_lexicon.forest;

import pl.marcinmilkowski.deriv_lexicon.index.LemmaIndex;
import pl.marcinmilkowski.deriv_lexicon.index.LemmaLookup;
import pl.marcinmilkowski.deriv_lexicon.model.ForestIntegrityException;
import pl.marcinmilkowski.deriv_lexicon.model.Lexeme;
import pl.marcinmilkowski.deriv_lexicon.store.ChildList;
import pl.marcinmilkowski.deriv_lexicon.store.LexemeStore;
import pl.marcinmilkowski.deriv_lexicon.store.LexemeView;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * A loaded derivational forest: the lexeme store with linked children and
 * the lemma index over the same ids.
 *
 * Instances are not modified after construction: the store is only handed
 * out as a {@link LexemeView} and the index only through lookups. Sorting
 * produces a new forest, so readers holding this one keep a consistent id
 * space.
 */
public final class DerivationForest {

    private final LexemeView store;
    private final LemmaIndex index;

    /**
     * Takes ownership of both arguments; the caller must not touch them afterwards.
     *
     * @param store a store whose children are already linked
     * @param index an index built over the same ids
     */
    public DerivationForest(LexemeStore store, LemmaIndex index) {
        this.store = Objects.requireNonNull(store, "store").readOnly();
        this.index = Objects.requireNonNull(index, "index");
    }

    public static DerivationForest empty() {
        return new DerivationForest(new LexemeStore(0), new LemmaIndex());
    }

    public LexemeView store() {
        return store;
    }

    public int size() {
        return store.size();
    }

    public Lexeme get(int id) {
        return store.get(id);
    }

    public Optional<Lexeme> parent(int id) {
        return store.parent(id);
    }

    public List<Lexeme> children(int id) {
        ChildList ids = store.children(id);
        List<Lexeme> result = new ArrayList<>(ids.size());
        for (int i = 0; i < ids.size(); i++) {
            result.add(store.get(ids.get(i)));
        }
        return result;
    }

    /**
     * @return ids of all lexemes with this lemma, in insertion order
     */
    public List<Integer> ids(String lemma) {
        return index.ids(lemma);
    }

    public int lemmaCount() {
        return index.lemmaCount();
    }

    public LemmaLookup lookup(String lemma) {
        return index.lookup(lemma);
    }

    public LemmaLookup lookup(String lemma, String derivationPattern) {
        return index.lookup(lemma, derivationPattern);
    }

    /**
     * @return the root of the tree containing the lexeme
     */
    public Lexeme root(int id) {
        Lexeme cur = store.get(id);
        int steps = 0;
        while (cur.hasParent()) {
            if (++steps > store.size()) {
                throw ForestIntegrityException.cycle(id);
            }
            cur = store.get(cur.parentId());
        }
        return cur;
    }
}
