package pl.marcinmilkowski.deriv_lexicon.forest;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import pl.marcinmilkowski.deriv_lexicon.codec.LexemeRecordCodec;
import pl.marcinmilkowski.deriv_lexicon.codec.RecordDecodeException;
import pl.marcinmilkowski.deriv_lexicon.model.IntegrityWarning;
import pl.marcinmilkowski.deriv_lexicon.model.Lexeme;

import java.io.BufferedReader;
import java.io.FileNotFoundException;
import java.io.IOException;
import java.nio.charset.Charset;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Loads a lexicon file into a {@link DerivationForest}.
 *
 * The whole file is decoded before anything is built; the first bad line
 * aborts the load.
 */
public class ForestLoader {

    private static final Logger logger = LoggerFactory.getLogger(ForestLoader.class);

    private final Charset charset;
    private final ForestBuilder builder;
    private final boolean logNonContiguous;

    public ForestLoader() {
        this(StandardCharsets.UTF_8, true);
    }

    /**
     * @param logNonContiguous whether {@code NON_CONTIGUOUS_IDS} warnings are logged;
     *                         they are returned in the {@link BuildResult} either way
     */
    public ForestLoader(Charset charset, boolean logNonContiguous) {
        this.charset = charset;
        this.builder = new ForestBuilder();
        this.logNonContiguous = logNonContiguous;
    }

    /**
     * @throws FileNotFoundException if the file does not exist
     * @throws RecordDecodeException if a line cannot be decoded (carries the line number)
     * @throws pl.marcinmilkowski.deriv_lexicon.model.ForestIntegrityException if parents dangle or form a cycle
     */
    public BuildResult load(Path path) throws IOException {
        if (!Files.exists(path)) {
            throw new FileNotFoundException("Lexicon file not found: " + path);
        }

        logger.info("Loading lexicon from {}", path);
        long start = System.currentTimeMillis();

        List<Lexeme> records = readRecords(path);
        BuildResult result = builder.build(records);

        for (IntegrityWarning warning : result.warnings()) {
            if (logNonContiguous || warning.kind() != IntegrityWarning.Kind.NON_CONTIGUOUS_IDS) {
                logger.warn("{}: {}", path, warning);
            }
        }
        logger.info("Loaded {} lexemes in {} ms", result.forest().size(), System.currentTimeMillis() - start);
        return result;
    }

    private List<Lexeme> readRecords(Path path) throws IOException {
        List<Lexeme> records = new ArrayList<>();
        try (BufferedReader reader = Files.newBufferedReader(path, charset)) {
            String line;
            int lineNumber = 0;
            int blankLine = 0;
            while ((line = reader.readLine()) != null) {
                lineNumber++;
                if (line.isEmpty()) {
                    // tolerated only at the end of the file
                    if (blankLine == 0) blankLine = lineNumber;
                    continue;
                }
                if (blankLine > 0) {
                    throw new RecordDecodeException(RecordDecodeException.Kind.MALFORMED_RECORD,
                        "Empty line", blankLine, null);
                }
                records.add(LexemeRecordCodec.decode(line, lineNumber));
            }
        }
        return records;
    }
}
