package pl.marcinmilkowski.deriv_lexicon.tools;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import pl.marcinmilkowski.deriv_lexicon.codec.LexemeRecordCodec;
import pl.marcinmilkowski.deriv_lexicon.forest.DerivationForest;
import pl.marcinmilkowski.deriv_lexicon.forest.ForestBuilder;

import java.util.stream.Collectors;
import java.util.stream.Stream;

import static org.junit.jupiter.api.Assertions.*;

class LexiconDebugTest {

    @Test
    @DisplayName("Stats summarize trees, depth and POS")
    void stats() {
        DerivationForest forest = new ForestBuilder().build(Stream.of(
                "0\tdo\tbase\tV\t",
                "1\tdoer\tagent\tN\t0",
                "2\tdoers\tplural\tN\t1",
                "3\tcan\tverb\tV\t",
                "4\tx\t\t\t")
            .map(LexemeRecordCodec::decode)
            .collect(Collectors.toList())).forest();

        LexiconDebug.Stats stats = LexiconDebug.Stats.of(forest);

        assertEquals(3, stats.trees());
        assertEquals(2, stats.singletons());
        assertEquals(2, stats.maxDepth());
        assertEquals(0, stats.largestRoot());
        assertEquals(3, stats.largestSize());
        assertEquals(2, stats.posCounts().get("N"));
        assertEquals(1, stats.posCounts().get("(empty)"));
    }
}
