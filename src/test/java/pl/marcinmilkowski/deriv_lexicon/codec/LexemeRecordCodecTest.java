package pl.marcinmilkowski.deriv_lexicon.codec;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import pl.marcinmilkowski.deriv_lexicon.model.Lexeme;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for LexemeRecordCodec.
 */
class LexemeRecordCodecTest {

    @Test
    @DisplayName("Decode root record with empty parent field")
    void decodeRoot() {
        Lexeme l = LexemeRecordCodec.decode("0\tdo\tbase\tV\t");

        assertEquals(0, l.id());
        assertEquals("do", l.lemma());
        assertEquals("base", l.derivationPattern());
        assertEquals("V", l.partOfSpeech());
        assertFalse(l.hasParent());
        assertEquals(Lexeme.NO_PARENT, l.parentId());
    }

    @Test
    @DisplayName("Decode record with parent")
    void decodeChild() {
        Lexeme l = LexemeRecordCodec.decode("1\tdoer\tagent\tN\t0");

        assertEquals(1, l.id());
        assertTrue(l.hasParent());
        assertEquals(0, l.parentId());
    }

    @Test
    @DisplayName("Line terminators are stripped")
    void stripsLineTerminators() {
        assertEquals(7, LexemeRecordCodec.decode("2\tdoing\tgerund\tN\t7\r\n").parentId());
        assertFalse(LexemeRecordCodec.decode("0\tdo\tbase\tV\t\n").hasParent());
    }

    @Test
    @DisplayName("Empty derivation pattern and POS are allowed")
    void emptyOptionalFields() {
        Lexeme l = LexemeRecordCodec.decode("3\tx\t\t\t");
        assertEquals("", l.derivationPattern());
        assertEquals("", l.partOfSpeech());
    }

    @Test
    @DisplayName("Wrong field count is a malformed record")
    void wrongFieldCount() {
        RecordDecodeException tooFew = assertThrows(RecordDecodeException.class,
            () -> LexemeRecordCodec.decode("0\tdo\tbase\tV"));
        assertEquals(RecordDecodeException.Kind.MALFORMED_RECORD, tooFew.getKind());

        RecordDecodeException tooMany = assertThrows(RecordDecodeException.class,
            () -> LexemeRecordCodec.decode("0\tdo\tbase\tV\t\textra"));
        assertEquals(RecordDecodeException.Kind.MALFORMED_RECORD, tooMany.getKind());

        RecordDecodeException blank = assertThrows(RecordDecodeException.class,
            () -> LexemeRecordCodec.decode(""));
        assertEquals(RecordDecodeException.Kind.MALFORMED_RECORD, blank.getKind());
    }

    @Test
    @DisplayName("Empty lemma is a malformed record")
    void emptyLemma() {
        RecordDecodeException e = assertThrows(RecordDecodeException.class,
            () -> LexemeRecordCodec.decode("0\t\tbase\tV\t"));
        assertEquals(RecordDecodeException.Kind.MALFORMED_RECORD, e.getKind());
    }

    @Test
    @DisplayName("Line break inside a field is a malformed record")
    void embeddedLineBreak() {
        RecordDecodeException e = assertThrows(RecordDecodeException.class,
            () -> LexemeRecordCodec.decode("0\tdo\rit\tbase\tV\t", 4));
        assertEquals(RecordDecodeException.Kind.MALFORMED_RECORD, e.getKind());
        assertEquals(4, e.getLineNumber());
    }

    @Test
    @DisplayName("Non-numeric, signed or overflowing integers are rejected")
    void invalidIntegers() {
        for (String line : List.of(
                "x\tdo\tbase\tV\t",
                "-1\tdo\tbase\tV\t",
                "+1\tdo\tbase\tV\t",
                "\tdo\tbase\tV\t",
                "1\tdoer\tagent\tN\tzero",
                "1\tdoer\tagent\tN\t-3",
                "1\tdoer\tagent\tN\t 0",
                "99999999999\tdo\tbase\tV\t")) {
            RecordDecodeException e = assertThrows(RecordDecodeException.class,
                () -> LexemeRecordCodec.decode(line), line);
            assertEquals(RecordDecodeException.Kind.INVALID_INTEGER, e.getKind(), line);
        }
    }

    @Test
    @DisplayName("Line number is reported in the exception")
    void lineNumberReported() {
        RecordDecodeException e = assertThrows(RecordDecodeException.class,
            () -> LexemeRecordCodec.decode("0\tdo", 42));
        assertEquals(42, e.getLineNumber());
        assertTrue(e.getMessage().startsWith("Line 42:"), e.getMessage());
    }

    @Test
    @DisplayName("Encode omits the parent for roots and never writes children")
    void encode() {
        assertEquals("0\tdo\tbase\tV\t", LexemeRecordCodec.encode(new Lexeme(0, "do", "base", "V", Lexeme.NO_PARENT)));
        assertEquals("1\tdoer\tagent\tN\t0", LexemeRecordCodec.encode(new Lexeme(1, "doer", "agent", "N", 0)));
    }

    @Test
    @DisplayName("Encoded lexemes decode to the same fields")
    void encodeDecode() {
        List<Lexeme> lexemes = List.of(
            new Lexeme(0, "učit", "učit#V", "V", Lexeme.NO_PARENT),
            new Lexeme(12, "učitel", "učitel#N", "N", 0),
            new Lexeme(3, "a b", "", "", 12)
        );
        for (Lexeme l : lexemes) {
            assertEquals(l, LexemeRecordCodec.decode(LexemeRecordCodec.encode(l)));
        }
    }
}
