package pl.marcinmilkowski.deriv_lexicon.model;

/**
 * Exception thrown when parent references cannot form a valid forest.
 */
public class ForestIntegrityException extends RuntimeException {

    public enum Kind {
        /** A parent reference points outside the forest. */
        DANGLING_PARENT,
        /** Following parent references never reaches a root. */
        CYCLE_DETECTED
    }

    private final Kind kind;
    private final int lexemeId;

    public ForestIntegrityException(Kind kind, int lexemeId, String message) {
        super(message);
        this.kind = kind;
        this.lexemeId = lexemeId;
    }

    public Kind getKind() {
        return kind;
    }

    /**
     * @return id (or stated id, during a build) of the offending lexeme
     */
    public int getLexemeId() {
        return lexemeId;
    }

    public static ForestIntegrityException danglingParent(int lexemeId, int parentId) {
        return new ForestIntegrityException(Kind.DANGLING_PARENT, lexemeId,
            "Lexeme " + lexemeId + " refers to non-existent parent " + parentId);
    }

    public static ForestIntegrityException cycle(int lexemeId) {
        return new ForestIntegrityException(Kind.CYCLE_DETECTED, lexemeId,
            "Derivation cycle through lexeme " + lexemeId);
    }
}
