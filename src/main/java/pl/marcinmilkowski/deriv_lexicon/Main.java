package pl.marcinmilkowski.deriv_lexicon;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import pl.marcinmilkowski.deriv_lexicon.config.LexiconConfigLoader;
import pl.marcinmilkowski.deriv_lexicon.forest.BuildResult;
import pl.marcinmilkowski.deriv_lexicon.forest.DerivationForest;
import pl.marcinmilkowski.deriv_lexicon.forest.ForestWriter;
import pl.marcinmilkowski.deriv_lexicon.index.LemmaLookup;
import pl.marcinmilkowski.deriv_lexicon.model.Lexeme;
import pl.marcinmilkowski.deriv_lexicon.sort.CanonicalSorter;
import pl.marcinmilkowski.deriv_lexicon.traversal.RenderStyle;
import pl.marcinmilkowski.deriv_lexicon.traversal.Subtree;
import pl.marcinmilkowski.deriv_lexicon.traversal.SubtreePrinter;

import java.io.IOException;
import java.nio.file.Path;
import java.nio.file.Paths;

/**
 * Command-line entry point for the derivational lexicon tools.
 *
 * Commands:
 *   sort   --input lexicon.tsv [--output sorted.tsv]
 *   show   --input lexicon.tsv (--id 42 | --lemma drive [--pattern V]) [--json]
 *   lookup --input lexicon.tsv --lemma drive [--pattern V]
 *   check  --input lexicon.tsv
 */
public class Main {

    private static final Logger logger = LoggerFactory.getLogger(Main.class);

    public static void main(String[] args) {
        System.exit(run(args));
    }

    /**
     * @return process exit code
     */
    static int run(String[] args) {
        if (args.length == 0) {
            showUsage();
            return 1;
        }

        try {
            String command = args[0].toLowerCase();
            Options options = Options.parse(args);

            switch (command) {
                case "sort":
                    return handleSortCommand(options);
                case "show":
                    return handleShowCommand(options);
                case "lookup":
                    return handleLookupCommand(options);
                case "check":
                    return handleCheckCommand(options);
                case "help":
                    showUsage();
                    return 0;
                default:
                    logger.error("Unknown command: {}", command);
                    showUsage();
                    return 1;
            }
        } catch (Exception e) {
            logger.error("Application error", e);
            System.err.println("Error: " + e.getMessage());
            System.err.println("Use 'help' command for usage information.");
            return 2;
        }
    }

    private static void showUsage() {
        System.out.println("Usage: java -jar deriv-lexicon.jar <command> [options]");
        System.out.println();
        System.out.println("Commands:");
        System.out.println("  sort --input <file.tsv> [--output <file.tsv>]");
        System.out.println("      Sort the lexicon by lemma and derivation pattern and renumber it");
        System.out.println("      (overwrites the input file when --output is omitted)");
        System.out.println();
        System.out.println("  show --input <file.tsv> (--id <n> | --lemma <word> [--pattern <p>]) [--json]");
        System.out.println("      Print the derivation tree containing a lexeme");
        System.out.println();
        System.out.println("  lookup --input <file.tsv> --lemma <word> [--pattern <p>]");
        System.out.println("      Resolve a lemma to a lexeme id");
        System.out.println();
        System.out.println("  check --input <file.tsv>");
        System.out.println("      Load the lexicon and report integrity warnings");
        System.out.println();
        System.out.println("Common options:");
        System.out.println("  --config <lexicon.json>   Settings file (encoding, render_style, ...)");
        System.out.println("  --style <unicode|ascii>   Tree connector glyphs");
    }

    private static int handleSortCommand(Options options) throws IOException {
        LexiconConfigLoader config = options.config();
        Path input = options.requireInput();
        Path output = options.output != null ? Paths.get(options.output) : input;

        DerivationForest forest = config.createLoader().load(input).forest();

        logger.info("Sorting {} lexemes...", forest.size());
        long start = System.currentTimeMillis();
        DerivationForest sorted = CanonicalSorter.sort(forest);
        logger.info("Sorted in {} ms", System.currentTimeMillis() - start);

        ForestWriter.save(sorted, output, config.getEncoding());
        return 0;
    }

    private static int handleShowCommand(Options options) throws IOException {
        LexiconConfigLoader config = options.config();
        DerivationForest forest = config.createLoader().load(options.requireInput()).forest();

        int id;
        if (options.id != null) {
            id = Integer.parseInt(options.id);
            if (id < 0 || id >= forest.size()) {
                System.err.println("Error: id " + id + " out of range [0, " + forest.size() + ")");
                return 1;
            }
        } else if (options.lemma != null) {
            LemmaLookup found = forest.lookup(options.lemma, options.pattern);
            if (!found.isFound()) {
                printLookupFailure(forest, options.lemma, found);
                return 1;
            }
            id = found.id();
        } else {
            System.err.println("Error: --id or --lemma is required");
            return 1;
        }

        Lexeme root = forest.root(id);
        if (options.json) {
            System.out.println(Subtree.of(forest, root.id()).toJson().toJSONString());
        } else {
            SubtreePrinter printer = options.style != null
                ? new SubtreePrinter(RenderStyle.parse(options.style))
                : config.createPrinter();
            printer.render(forest, root.id()).forEach(System.out::println);
        }
        return 0;
    }

    private static int handleLookupCommand(Options options) throws IOException {
        if (options.lemma == null) {
            System.err.println("Error: --lemma is required");
            return 1;
        }
        DerivationForest forest = options.config().createLoader().load(options.requireInput()).forest();
        LemmaLookup found = forest.lookup(options.lemma, options.pattern);
        if (!found.isFound()) {
            printLookupFailure(forest, options.lemma, found);
            return 1;
        }
        Lexeme lexeme = forest.get(found.id());
        System.out.printf("%d\t%s\t%s\t%s%n", lexeme.id(), lexeme.lemma(), lexeme.derivationPattern(), lexeme.partOfSpeech());
        return 0;
    }

    private static int handleCheckCommand(Options options) throws IOException {
        BuildResult result = options.config().createLoader().load(options.requireInput());
        DerivationForest forest = result.forest();
        long roots = forest.store().roots().count();
        System.out.println("Lexemes: " + forest.size());
        System.out.println("Lemmas: " + forest.lemmaCount());
        System.out.println("Trees: " + roots);
        System.out.println("Canonically sorted: " + CanonicalSorter.isSorted(forest));
        System.out.println("Warnings: " + result.warnings().size());
        result.warnings().forEach(w -> System.out.println("  " + w));
        return result.hasWarnings() ? 3 : 0;
    }

    private static void printLookupFailure(DerivationForest forest, String lemma, LemmaLookup found) {
        if (found.status() == LemmaLookup.Status.NOT_FOUND) {
            System.err.println("Lemma not found: " + lemma);
            return;
        }
        System.err.println("Lemma '" + lemma + "' is ambiguous; specify --pattern. Candidates:");
        for (int candidate : found.candidates()) {
            Lexeme l = forest.get(candidate);
            System.err.println("  " + l.id() + "\t" + l.derivationPattern() + "\t" + l.partOfSpeech());
        }
    }

    /**
     * Parsed command-line options.
     */
    static final class Options {
        String input;
        String output;
        String config;
        String id;
        String lemma;
        String pattern;
        String style;
        boolean json;

        static Options parse(String[] args) {
            Options o = new Options();
            for (int i = 1; i < args.length; i++) {
                switch (args[i]) {
                    case "--input":
                    case "-i":
                        o.input = value(args, ++i);
                        break;
                    case "--output":
                    case "-o":
                        o.output = value(args, ++i);
                        break;
                    case "--config":
                    case "-c":
                        o.config = value(args, ++i);
                        break;
                    case "--id":
                        o.id = value(args, ++i);
                        break;
                    case "--lemma":
                    case "-w":
                        o.lemma = value(args, ++i);
                        break;
                    case "--pattern":
                    case "-p":
                        o.pattern = value(args, ++i);
                        break;
                    case "--style":
                        o.style = value(args, ++i);
                        break;
                    case "--json":
                        o.json = true;
                        break;
                    default:
                        System.err.println("Unknown option: " + args[i]);
                }
            }
            return o;
        }

        private static String value(String[] args, int i) {
            if (i >= args.length) {
                throw new IllegalArgumentException("Missing value for " + args[i - 1]);
            }
            return args[i];
        }

        Path requireInput() {
            if (input == null) {
                throw new IllegalArgumentException("--input is required");
            }
            return Paths.get(input);
        }

        LexiconConfigLoader config() throws IOException {
            return config != null ? new LexiconConfigLoader(Paths.get(config)) : LexiconConfigLoader.defaults();
        }
    }
}
