package pl.marcinmilkowski.deriv_lexicon.store;

import pl.marcinmilkowski.deriv_lexicon.model.Lexeme;

import java.util.List;
import java.util.Optional;
import java.util.stream.Stream;

/**
 * Read-only access to a linked lexeme store.
 */
public interface LexemeView extends Iterable<Lexeme> {

    int size();

    boolean isEmpty();

    /**
     * @throws IndexOutOfBoundsException if the id is not in the store
     */
    Lexeme get(int id);

    /**
     * @return the child ids of the lexeme, in id order
     */
    ChildList children(int id);

    Optional<Lexeme> parent(int id);

    List<Lexeme> lexemes();

    Stream<Lexeme> stream();

    Stream<Lexeme> roots();
}
