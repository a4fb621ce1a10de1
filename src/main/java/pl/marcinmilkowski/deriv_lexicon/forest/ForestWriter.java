package pl.marcinmilkowski.deriv_lexicon.forest;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import pl.marcinmilkowski.deriv_lexicon.codec.LexemeRecordCodec;
import pl.marcinmilkowski.deriv_lexicon.model.Lexeme;

import java.io.BufferedWriter;
import java.io.IOException;
import java.nio.charset.Charset;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Writes a forest as a lexicon file, one record per line in id order.
 */
public final class ForestWriter {

    private static final Logger logger = LoggerFactory.getLogger(ForestWriter.class);

    private ForestWriter() {
    }

    public static void save(DerivationForest forest, Path path) throws IOException {
        save(forest, path, StandardCharsets.UTF_8);
    }

    public static void save(DerivationForest forest, Path path, Charset charset) throws IOException {
        if (path.getParent() != null) {
            Files.createDirectories(path.getParent());
        }

        logger.info("Saving snapshot to {}", path);
        long start = System.currentTimeMillis();

        try (BufferedWriter writer = Files.newBufferedWriter(path, charset)) {
            for (Lexeme lexeme : forest.store()) {
                writer.write(LexemeRecordCodec.encode(lexeme));
                writer.write('\n');
            }
        }
        logger.info("Saved {} lexemes in {} ms", forest.size(), System.currentTimeMillis() - start);
    }
}
