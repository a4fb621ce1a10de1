package pl.marcinmilkowski.deriv_lexicon.codec;

/**
 * Exception thrown when a lexicon line cannot be decoded.
 */
public class RecordDecodeException extends RuntimeException {

    public enum Kind {
        /** Wrong number of fields or an empty lemma. */
        MALFORMED_RECORD,
        /** Id or parent field is not a non-negative integer. */
        INVALID_INTEGER
    }

    private final Kind kind;
    private final int lineNumber;

    public RecordDecodeException(Kind kind, String message) {
        this(kind, message, 0, null);
    }

    public RecordDecodeException(Kind kind, String message, int lineNumber, Throwable cause) {
        super(lineNumber > 0 ? "Line " + lineNumber + ": " + message : message, cause);
        this.kind = kind;
        this.lineNumber = lineNumber;
    }

    public Kind getKind() {
        return kind;
    }

    /**
     * @return 1-based line number, or 0 when the record was decoded outside a file
     */
    public int getLineNumber() {
        return lineNumber;
    }
}
