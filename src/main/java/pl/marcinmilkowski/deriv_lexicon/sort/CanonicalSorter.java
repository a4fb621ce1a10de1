package pl.marcinmilkowski.deriv_lexicon.sort;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import pl.marcinmilkowski.deriv_lexicon.forest.DerivationForest;
import pl.marcinmilkowski.deriv_lexicon.index.LemmaIndex;
import pl.marcinmilkowski.deriv_lexicon.model.Lexeme;
import pl.marcinmilkowski.deriv_lexicon.store.LexemeStore;
import pl.marcinmilkowski.deriv_lexicon.store.LexemeView;

import java.util.Arrays;
import java.util.Comparator;
import java.util.Locale;

/**
 * Reorders a forest by (lowercased lemma, derivation pattern) and relabels
 * every id accordingly.
 *
 * The input forest is left untouched; the result is a new forest with
 * rewritten parent references, freshly linked children and a rebuilt
 * lemma index.
 */
public final class CanonicalSorter {

    private static final Logger log = LoggerFactory.getLogger(CanonicalSorter.class);

    public static final Comparator<Lexeme> CANONICAL_ORDER = Comparator
        .comparing((Lexeme l) -> l.lemma().toLowerCase(Locale.ROOT))
        .thenComparing(Lexeme::derivationPattern);

    private CanonicalSorter() {
    }

    public static DerivationForest sort(DerivationForest forest) {
        LexemeView old = forest.store();
        int n = old.size();

        // newToOld[newId] = oldId; Arrays.sort on objects is stable
        Integer[] order = new Integer[n];
        for (int i = 0; i < n; i++) {
            order[i] = i;
        }
        Arrays.sort(order, Comparator.comparing(old::get, CANONICAL_ORDER));

        int[] oldToNew = new int[n];
        for (int newId = 0; newId < n; newId++) {
            oldToNew[order[newId]] = newId;
        }

        LexemeStore sorted = new LexemeStore(n);
        for (int newId = 0; newId < n; newId++) {
            Lexeme node = old.get(order[newId]);
            int parent = node.hasParent() ? oldToNew[node.parentId()] : Lexeme.NO_PARENT;
            sorted.append(node.relabel(newId, parent));
        }
        sorted.linkChildren();

        log.debug("Sorted {} lexemes", n);
        return new DerivationForest(sorted, LemmaIndex.rebuild(sorted));
    }

    /**
     * @return true if the lexemes are already in canonical order
     */
    public static boolean isSorted(DerivationForest forest) {
        LexemeView store = forest.store();
        for (int i = 1; i < store.size(); i++) {
            if (CANONICAL_ORDER.compare(store.get(i - 1), store.get(i)) > 0) {
                return false;
            }
        }
        return true;
    }
}
