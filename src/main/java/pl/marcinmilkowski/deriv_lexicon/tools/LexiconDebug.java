package pl.marcinmilkowski.deriv_lexicon.tools;

import pl.marcinmilkowski.deriv_lexicon.forest.DerivationForest;
import pl.marcinmilkowski.deriv_lexicon.forest.ForestLoader;
import pl.marcinmilkowski.deriv_lexicon.index.LemmaLookup;
import pl.marcinmilkowski.deriv_lexicon.model.Lexeme;
import pl.marcinmilkowski.deriv_lexicon.traversal.Subtree;

import java.nio.file.Paths;
import java.util.Map;
import java.util.TreeMap;

public class LexiconDebug {
    public static void main(String[] args) throws Exception {
        if (args.length < 1) {
            System.out.println("Usage: LexiconDebug <lexicon.tsv> [lemma1] [lemma2] ...");
            return;
        }

        DerivationForest forest = new ForestLoader().load(Paths.get(args[0])).forest();
        Stats stats = Stats.of(forest);

        System.out.println("=== Lexicon Debug ===");
        System.out.println("File: " + args[0]);
        System.out.println("Lexemes: " + forest.size());
        System.out.println("Lemmas: " + forest.lemmaCount());
        System.out.println("Trees: " + stats.trees());
        System.out.println("Singletons: " + stats.singletons());
        System.out.println("Max depth: " + stats.maxDepth());
        if (stats.largestRoot() >= 0) {
            System.out.println("Largest tree: " + forest.get(stats.largestRoot()).lemma() + " (" + stats.largestSize() + " lexemes)");
        }
        System.out.println("POS distribution: " + stats.posCounts());
        System.out.println();

        for (int i = 1; i < args.length; i++) {
            String lemma = args[i];
            LemmaLookup found = forest.lookup(lemma);

            System.out.println("--- " + lemma + " ---");
            switch (found.status()) {
                case NOT_FOUND:
                    System.out.println("  NOT FOUND in lexicon");
                    break;
                case AMBIGUOUS:
                    System.out.println("  Ambiguous, candidates:");
                    for (int id : found.candidates()) {
                        Lexeme l = forest.get(id);
                        System.out.printf("    %-8d %-12s %s%n", l.id(), l.derivationPattern(), l.partOfSpeech());
                    }
                    break;
                default:
                    Lexeme l = forest.get(found.id());
                    Lexeme root = forest.root(l.id());
                    System.out.println("  Id: " + l.id());
                    System.out.println("  Parent: " + forest.parent(l.id()).map(Lexeme::lemma).orElse("(root)"));
                    System.out.println("  Children: " + forest.children(l.id()).size());
                    System.out.println("  Tree root: " + root.lemma() + " (" + Subtree.of(forest, root.id()).size() + " lexemes)");
            }
            System.out.println();
        }
    }

    /**
     * Summary statistics over all trees of a forest.
     */
    record Stats(int trees, int singletons, int maxDepth, int largestRoot, int largestSize,
                 Map<String, Integer> posCounts) {

        static Stats of(DerivationForest forest) {
            int trees = 0;
            int singletons = 0;
            int maxDepth = 0;
            int largestRoot = -1;
            int largestSize = 0;
            Map<String, Integer> posCounts = new TreeMap<>();
            for (Lexeme lexeme : forest.store()) {
                posCounts.merge(lexeme.partOfSpeech().isEmpty() ? "(empty)" : lexeme.partOfSpeech(), 1, Integer::sum);
                if (lexeme.hasParent()) {
                    continue;
                }
                trees++;
                Subtree tree = Subtree.of(forest, lexeme.id());
                int size = tree.size();
                if (size == 1) singletons++;
                maxDepth = Math.max(maxDepth, tree.depth());
                if (size > largestSize) {
                    largestSize = size;
                    largestRoot = lexeme.id();
                }
            }
            return new Stats(trees, singletons, maxDepth, largestRoot, largestSize, posCounts);
        }
    }
}
