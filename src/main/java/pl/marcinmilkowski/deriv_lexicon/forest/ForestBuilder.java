package pl.marcinmilkowski.deriv_lexicon.forest;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import pl.marcinmilkowski.deriv_lexicon.index.LemmaIndex;
import pl.marcinmilkowski.deriv_lexicon.model.ForestIntegrityException;
import pl.marcinmilkowski.deriv_lexicon.model.IntegrityWarning;
import pl.marcinmilkowski.deriv_lexicon.model.Lexeme;
import pl.marcinmilkowski.deriv_lexicon.store.LexemeStore;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.OptionalInt;

/**
 * Builds a {@link DerivationForest} from decoded records.
 *
 * Line order is authoritative: the n-th record gets id n whatever id it
 * states. Parent fields refer to stated ids and are resolved to positions.
 * Children are linked once, after every record has been appended.
 *
 * Usage:
 * <pre>
 *   BuildResult result = new ForestBuilder().build(records);
 *   result.warnings().forEach(w -&gt; log.warn("{}", w));
 *   DerivationForest forest = result.forest();
 * </pre>
 */
public class ForestBuilder {

    private static final Logger log = LoggerFactory.getLogger(ForestBuilder.class);

    /**
     * Builds the forest. Nothing is exposed if the input is rejected.
     *
     * @throws ForestIntegrityException if a parent reference dangles or parents form a cycle
     */
    public BuildResult build(Iterable<Lexeme> records) {
        List<Lexeme> input = new ArrayList<>(records instanceof Collection<?> c ? c.size() : 1024);
        for (Lexeme record : records) {
            input.add(record);
        }
        int n = input.size();
        List<IntegrityWarning> warnings = new ArrayList<>();

        // stated id -> position; the first line carrying an id wins
        IntIntHashMap positionByStatedId = new IntIntHashMap(n);
        int maxStatedId = -1;
        int firstMismatch = -1;
        int duplicates = 0;
        for (int pos = 0; pos < n; pos++) {
            int stated = input.get(pos).id();
            if (!positionByStatedId.putIfAbsent(stated, pos)) {
                duplicates++;
            }
            if (stated != pos && firstMismatch < 0) {
                firstMismatch = pos;
            }
            maxStatedId = Math.max(maxStatedId, stated);
        }

        LexemeStore store = new LexemeStore(n);
        for (Lexeme record : input) {
            int parentPos = Lexeme.NO_PARENT;
            if (record.hasParent()) {
                parentPos = positionByStatedId.get(record.parentId(), Lexeme.NO_PARENT);
                if (parentPos == Lexeme.NO_PARENT) {
                    throw ForestIntegrityException.danglingParent(record.id(), record.parentId());
                }
            }
            store.append(record.relabel(store.size(), parentPos));
        }

        if (firstMismatch >= 0 || duplicates > 0) {
            int mismatchAt = firstMismatch;
            int dupCount = duplicates;
            warnings.add(store.validateContiguity(maxStatedId).orElseGet(() -> new IntegrityWarning(
                IntegrityWarning.Kind.NON_CONTIGUOUS_IDS,
                "Stated ids diverge from line order"
                    + (mismatchAt >= 0 ? " (first at position " + mismatchAt + ")" : "")
                    + (dupCount > 0 ? ", " + dupCount + " duplicate id(s)" : ""))));
        }

        LemmaIndex index = new LemmaIndex(n);
        for (Lexeme lexeme : store) {
            if (!index.insert(lexeme.lemma(), lexeme.derivationPattern(), lexeme.id())) {
                warnings.add(new IntegrityWarning(IntegrityWarning.Kind.DUPLICATE_LEMMA_KEY,
                    "Duplicate lemma/pattern '" + lexeme.lemma() + "'/'" + lexeme.derivationPattern()
                        + "' at id " + lexeme.id()));
            }
        }

        store.linkChildren();
        OptionalInt onCycle = store.findCycle();
        if (onCycle.isPresent()) {
            throw ForestIntegrityException.cycle(onCycle.getAsInt());
        }

        log.debug("Built forest: {} lexemes, {} lemmas, {} warnings", n, index.lemmaCount(), warnings.size());
        return new BuildResult(new DerivationForest(store, index), warnings);
    }

    /**
     * Merging new records into an existing forest is not supported.
     *
     * @throws UnsupportedOperationException always
     */
    public DerivationForest merge(DerivationForest forest, Iterable<Lexeme> newRecords) {
        throw new UnsupportedOperationException("Merging records into an existing forest is not implemented");
    }
}
