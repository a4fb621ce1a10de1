package pl.marcinmilkowski.deriv_lexicon.forest;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import pl.marcinmilkowski.deriv_lexicon.codec.LexemeRecordCodec;
import pl.marcinmilkowski.deriv_lexicon.index.LemmaLookup;
import pl.marcinmilkowski.deriv_lexicon.model.ForestIntegrityException;
import pl.marcinmilkowski.deriv_lexicon.model.IntegrityWarning;
import pl.marcinmilkowski.deriv_lexicon.model.Lexeme;
import pl.marcinmilkowski.deriv_lexicon.store.LexemeView;
import pl.marcinmilkowski.deriv_lexicon.traversal.Subtree;

import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;
import java.util.stream.Stream;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for ForestBuilder.
 */
class ForestBuilderTest {

    static List<Lexeme> records(String... lines) {
        return Stream.of(lines).map(LexemeRecordCodec::decode).collect(Collectors.toList());
    }

    /** Asserts that every child list is exactly the set of lexemes naming that parent. */
    static void assertChildrenInverseOfParents(LexemeView store) {
        for (int id = 0; id < store.size(); id++) {
            List<Integer> expected = new ArrayList<>();
            for (Lexeme l : store) {
                if (l.parentId() == id) expected.add(l.id());
            }
            List<Integer> actual = new ArrayList<>();
            for (int c : store.children(id).toArray()) actual.add(c);
            assertEquals(expected, actual, "children of " + id);
        }
    }

    @Test
    @DisplayName("Three-line forest links children to the root")
    void buildScenario() {
        BuildResult result = new ForestBuilder().build(records(
            "0\tdo\tbase\tV\t",
            "1\tdoer\tagent\tN\t0",
            "2\tdoing\tgerund\tN\t0"));

        DerivationForest forest = result.forest();
        assertFalse(result.hasWarnings());
        assertEquals(3, forest.size());
        assertArrayEquals(new int[] {1, 2}, forest.store().children(0).toArray());
        assertChildrenInverseOfParents(forest.store());

        Subtree tree = Subtree.of(forest, 0);
        assertEquals("do", tree.lexeme().lemma());
        assertEquals(2, tree.children().size());
        assertEquals(1, tree.children().get(0).lexeme().id());
        assertEquals(2, tree.children().get(1).lexeme().id());
        assertTrue(tree.children().get(0).isLeaf());
        assertTrue(tree.children().get(1).isLeaf());
    }

    @Test
    @DisplayName("Index is populated during the build")
    void indexPopulated() {
        DerivationForest forest = new ForestBuilder().build(records(
            "0\tcan\tnoun\tN\t",
            "1\tcan\tverb\tV\t",
            "2\tcanned\tpart\tA\t1")).forest();

        assertEquals(LemmaLookup.Status.AMBIGUOUS, forest.lookup("can").status());
        assertEquals(1, forest.lookup("can", "verb").id());
        assertEquals(2, forest.lookup("canned").id());
        assertEquals("can", forest.parent(2).orElseThrow().lemma());
        assertEquals(List.of(forest.get(2)), forest.children(1));
    }

    @Test
    @DisplayName("Forward parent references are resolved")
    void forwardReference() {
        DerivationForest forest = new ForestBuilder().build(records(
            "0\tdoer\tagent\tN\t1",
            "1\tdo\tbase\tV\t")).forest();

        assertArrayEquals(new int[] {0}, forest.store().children(1).toArray());
        assertEquals("do", forest.root(0).lemma());
    }

    @Test
    @DisplayName("Dangling parent fails the whole build")
    void danglingParent() {
        ForestIntegrityException e = assertThrows(ForestIntegrityException.class,
            () -> new ForestBuilder().build(records("0\tfoo\tx\tN\t5")));
        assertEquals(ForestIntegrityException.Kind.DANGLING_PARENT, e.getKind());
    }

    @Test
    @DisplayName("Self parent and longer cycles fail the build")
    void cycles() {
        ForestIntegrityException self = assertThrows(ForestIntegrityException.class,
            () -> new ForestBuilder().build(records("0\tfoo\tx\tN\t0")));
        assertEquals(ForestIntegrityException.Kind.CYCLE_DETECTED, self.getKind());

        ForestIntegrityException loop = assertThrows(ForestIntegrityException.class,
            () -> new ForestBuilder().build(records(
                "0\ta\tx\tN\t2",
                "1\tb\tx\tN\t0",
                "2\tc\tx\tN\t1")));
        assertEquals(ForestIntegrityException.Kind.CYCLE_DETECTED, loop.getKind());
    }

    @Test
    @DisplayName("Line order assigns ids; parents follow stated ids")
    void statedIdsRemapped() {
        BuildResult result = new ForestBuilder().build(records(
            "10\tdo\tbase\tV\t",
            "20\tdoer\tagent\tN\t10",
            "30\tdoing\tgerund\tN\t10"));

        DerivationForest forest = result.forest();
        assertEquals(0, forest.get(0).id());
        assertEquals(0, forest.get(1).parentId());
        assertEquals(0, forest.get(2).parentId());
        assertArrayEquals(new int[] {1, 2}, forest.store().children(0).toArray());

        assertEquals(1, result.warnings().size());
        assertEquals(IntegrityWarning.Kind.NON_CONTIGUOUS_IDS, result.warnings().get(0).kind());
    }

    @Test
    @DisplayName("Permuted stated ids warn even when the range is contiguous")
    void permutedIdsWarn() {
        BuildResult result = new ForestBuilder().build(records(
            "1\tdoer\tagent\tN\t0",
            "0\tdo\tbase\tV\t"));

        assertEquals(1, result.forest().get(0).parentId());
        assertEquals(IntegrityWarning.Kind.NON_CONTIGUOUS_IDS, result.warnings().get(0).kind());
    }

    @Test
    @DisplayName("Duplicate stated ids warn and resolve to the first line")
    void duplicateStatedIds() {
        BuildResult result = new ForestBuilder().build(records(
            "0\tdo\tbase\tV\t",
            "0\tmake\tbase\tV\t",
            "1\tdoer\tagent\tN\t0"));

        assertTrue(result.hasWarnings());
        assertEquals(0, result.forest().get(2).parentId());
    }

    @Test
    @DisplayName("A single record with a stated id other than 0 is reported")
    void singleRecordGap() {
        BuildResult result = new ForestBuilder().build(records(
            "5\tdo\tbase\tV\t"));
        assertEquals(1, result.warnings().size());
        assertEquals(IntegrityWarning.Kind.NON_CONTIGUOUS_IDS, result.warnings().get(0).kind());
    }

    @Test
    @DisplayName("Duplicate lemma/pattern pairs are reported")
    void duplicateLemmaKey() {
        BuildResult result = new ForestBuilder().build(records(
            "0\tcan\tverb\tV\t",
            "1\tcan\tverb\tV\t"));

        assertEquals(1, result.warnings().size());
        assertEquals(IntegrityWarning.Kind.DUPLICATE_LEMMA_KEY, result.warnings().get(0).kind());
        assertEquals(0, result.forest().lookup("can", "verb").id());
    }

    @Test
    @DisplayName("Empty input builds an empty forest")
    void emptyInput() {
        BuildResult result = new ForestBuilder().build(List.of());
        assertEquals(0, result.forest().size());
        assertFalse(result.hasWarnings());
    }

    @Test
    @DisplayName("Merge always fails")
    void mergeNotImplemented() {
        ForestBuilder builder = new ForestBuilder();
        DerivationForest forest = builder.build(records("0\tdo\tbase\tV\t")).forest();
        assertThrows(UnsupportedOperationException.class,
            () -> builder.merge(forest, records("0\tundo\tprefix\tV\t")));
        assertEquals(1, forest.size());
    }
}
