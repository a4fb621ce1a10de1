package pl.marcinmilkowski.deriv_lexicon.store;

import pl.marcinmilkowski.deriv_lexicon.model.ForestIntegrityException;
import pl.marcinmilkowski.deriv_lexicon.model.IntegrityWarning;
import pl.marcinmilkowski.deriv_lexicon.model.Lexeme;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Iterator;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.OptionalInt;
import java.util.stream.Stream;

/**
 * Owns all lexemes of a forest, addressed by dense id (position).
 *
 * Children are kept in one {@link ChildList} per lexeme and are only ever
 * filled by {@link #linkChildren()}. Calling it twice without
 * {@link #resetChildren()} in between duplicates every edge.
 * Readers of a finished forest get a {@link #readOnly()} view instead.
 */
public class LexemeStore implements LexemeView {

    private final List<Lexeme> nodes;
    private final List<ChildList> children;
    private final LexemeView readOnly = new ReadOnlyView(this);

    public LexemeStore() {
        this(16);
    }

    public LexemeStore(int expectedSize) {
        this.nodes = new ArrayList<>(Math.max(0, expectedSize));
        this.children = new ArrayList<>(Math.max(0, expectedSize));
    }

    /**
     * Appends a lexeme, replacing its id with the next position.
     *
     * @return the assigned id
     */
    public int append(Lexeme lexeme) {
        Objects.requireNonNull(lexeme, "lexeme");
        int id = nodes.size();
        nodes.add(lexeme.id() == id ? lexeme : lexeme.withId(id));
        children.add(new ChildList());
        return id;
    }

    @Override
    public Lexeme get(int id) {
        return nodes.get(Objects.checkIndex(id, nodes.size()));
    }

    @Override
    public int size() {
        return nodes.size();
    }

    @Override
    public boolean isEmpty() {
        return nodes.isEmpty();
    }

    @Override
    public ChildList children(int id) {
        return children.get(Objects.checkIndex(id, nodes.size()));
    }

    @Override
    public Optional<Lexeme> parent(int id) {
        Lexeme lexeme = get(id);
        return lexeme.hasParent() ? Optional.of(get(lexeme.parentId())) : Optional.empty();
    }

    /**
     * Adds every lexeme to its parent's child list, in id order.
     *
     * @throws ForestIntegrityException if a parent is out of range or a lexeme is its own parent
     */
    public void linkChildren() {
        int n = nodes.size();
        for (int id = 0; id < n; id++) {
            Lexeme node = nodes.get(id);
            if (!node.hasParent()) {
                continue;
            }
            int parentId = node.parentId();
            if (parentId >= n) {
                throw ForestIntegrityException.danglingParent(id, parentId);
            }
            if (parentId == id) {
                throw ForestIntegrityException.cycle(id);
            }
            children.get(parentId).add(id);
        }
    }

    public void resetChildren() {
        for (ChildList list : children) {
            list.clear();
        }
    }

    /**
     * Checks that the highest id seen in the input equals N-1.
     */
    public Optional<IntegrityWarning> validateContiguity(int maxStatedId) {
        int expected = nodes.size() - 1;
        if (maxStatedId == expected) {
            return Optional.empty();
        }
        return Optional.of(new IntegrityWarning(IntegrityWarning.Kind.NON_CONTIGUOUS_IDS,
            "Lexeme numeration inconsistent: discovered " + nodes.size()
                + " lexemes total but the highest id was " + maxStatedId));
    }

    /**
     * Finds a lexeme lying on a parent cycle.
     *
     * Each lexeme is visited once: a walk up the parent chain stops at a root,
     * at an already finished lexeme, or at a lexeme on the current walk (cycle).
     */
    public OptionalInt findCycle() {
        int n = nodes.size();
        byte[] state = new byte[n]; // 0 = new, 1 = on current walk, 2 = done
        int[] path = new int[n];
        for (int start = 0; start < n; start++) {
            if (state[start] != 0) {
                continue;
            }
            int len = 0;
            int cur = start;
            while (cur != Lexeme.NO_PARENT && cur < n && state[cur] == 0) {
                state[cur] = 1;
                path[len++] = cur;
                cur = nodes.get(cur).parentId();
            }
            if (cur != Lexeme.NO_PARENT && cur < n && state[cur] == 1) {
                return OptionalInt.of(cur);
            }
            for (int i = 0; i < len; i++) {
                state[path[i]] = 2;
            }
        }
        return OptionalInt.empty();
    }

    @Override
    public List<Lexeme> lexemes() {
        return Collections.unmodifiableList(nodes);
    }

    @Override
    public Stream<Lexeme> stream() {
        return nodes.stream();
    }

    @Override
    public Stream<Lexeme> roots() {
        return nodes.stream().filter(l -> !l.hasParent());
    }

    @Override
    public Iterator<Lexeme> iterator() {
        return lexemes().iterator();
    }

    /**
     * @return a view of this store without the mutating operations
     */
    public LexemeView readOnly() {
        return readOnly;
    }

    private static final class ReadOnlyView implements LexemeView {

        private final LexemeStore store;

        ReadOnlyView(LexemeStore store) {
            this.store = store;
        }

        @Override
        public int size() {
            return store.size();
        }

        @Override
        public boolean isEmpty() {
            return store.isEmpty();
        }

        @Override
        public Lexeme get(int id) {
            return store.get(id);
        }

        @Override
        public ChildList children(int id) {
            return store.children(id);
        }

        @Override
        public Optional<Lexeme> parent(int id) {
            return store.parent(id);
        }

        @Override
        public List<Lexeme> lexemes() {
            return store.lexemes();
        }

        @Override
        public Stream<Lexeme> stream() {
            return store.stream();
        }

        @Override
        public Stream<Lexeme> roots() {
            return store.roots();
        }

        @Override
        public Iterator<Lexeme> iterator() {
            return store.iterator();
        }
    }
}
