package pl.marcinmilkowski.deriv_lexicon.codec;

import pl.marcinmilkowski.deriv_lexicon.model.Lexeme;

/**
 * Encodes/decodes a lexeme as one line of the lexicon file.
 *
 * Format (tab-separated, exactly five fields):
 * - id: non-negative integer
 * - lemma: non-empty
 * - derivation pattern
 * - part of speech
 * - parent id: empty for roots, otherwise a non-negative integer
 *
 * Children are derived from the parent references and never written.
 */
public final class LexemeRecordCodec {

    public static final char FIELD_SEPARATOR = '\t';
    private static final int FIELD_COUNT = 5;

    private LexemeRecordCodec() {
    }

    public static Lexeme decode(String line) {
        return decode(line, 0);
    }

    /**
     * Decodes a line, tagging any failure with its 1-based line number.
     */
    public static Lexeme decode(String line, int lineNumber) {
        if (line == null) {
            throw new RecordDecodeException(RecordDecodeException.Kind.MALFORMED_RECORD,
                "Null record", lineNumber, null);
        }
        String stripped = stripLineTerminator(line);
        String[] fields = stripped.split(String.valueOf(FIELD_SEPARATOR), -1);
        if (fields.length != FIELD_COUNT) {
            throw new RecordDecodeException(RecordDecodeException.Kind.MALFORMED_RECORD,
                "Expected " + FIELD_COUNT + " fields but found " + fields.length + ": " + stripped,
                lineNumber, null);
        }
        if (stripped.indexOf('\n') >= 0 || stripped.indexOf('\r') >= 0) {
            throw new RecordDecodeException(RecordDecodeException.Kind.MALFORMED_RECORD,
                "Line break inside record", lineNumber, null);
        }
        if (fields[1].isEmpty()) {
            throw new RecordDecodeException(RecordDecodeException.Kind.MALFORMED_RECORD,
                "Empty lemma: " + stripped, lineNumber, null);
        }

        int id = parseNonNegative(fields[0], "id", lineNumber);
        int parentId = fields[4].isEmpty() ? Lexeme.NO_PARENT : parseNonNegative(fields[4], "parent id", lineNumber);
        return new Lexeme(id, fields[1], fields[2], fields[3], parentId);
    }

    public static String encode(Lexeme lexeme) {
        StringBuilder sb = new StringBuilder(32);
        sb.append(lexeme.id()).append(FIELD_SEPARATOR)
            .append(lexeme.lemma()).append(FIELD_SEPARATOR)
            .append(lexeme.derivationPattern()).append(FIELD_SEPARATOR)
            .append(lexeme.partOfSpeech()).append(FIELD_SEPARATOR);
        if (lexeme.hasParent()) {
            sb.append(lexeme.parentId());
        }
        return sb.toString();
    }

    private static String stripLineTerminator(String line) {
        int end = line.length();
        while (end > 0 && (line.charAt(end - 1) == '\n' || line.charAt(end - 1) == '\r')) {
            end--;
        }
        return end == line.length() ? line : line.substring(0, end);
    }

    // Integer.parseInt alone would accept a leading sign
    private static int parseNonNegative(String field, String name, int lineNumber) {
        if (field.isEmpty()) {
            throw new RecordDecodeException(RecordDecodeException.Kind.INVALID_INTEGER,
                "Empty " + name, lineNumber, null);
        }
        for (int i = 0; i < field.length(); i++) {
            char c = field.charAt(i);
            if (c < '0' || c > '9') {
                throw new RecordDecodeException(RecordDecodeException.Kind.INVALID_INTEGER,
                    "Invalid " + name + ": '" + field + "'", lineNumber, null);
            }
        }
        try {
            return Integer.parseInt(field);
        } catch (NumberFormatException e) {
            throw new RecordDecodeException(RecordDecodeException.Kind.INVALID_INTEGER,
                name + " out of range: '" + field + "'", lineNumber, e);
        }
    }
}
