package pl.marcinmilkowski.deriv_lexicon.store;

import java.util.Arrays;

/**
 * Growable list of child ids for one lexeme.
 *
 * Most lexemes have no children, so the backing array starts empty.
 */
public final class ChildList {

    private static final int[] EMPTY = new int[0];

    private int[] array = EMPTY;
    private int size;

    public int size() {
        return size;
    }

    public boolean isEmpty() {
        return size == 0;
    }

    public int get(int index) {
        if (index < 0 || index >= size) {
            throw new IndexOutOfBoundsException("Child index " + index + " out of range [0, " + size + ")");
        }
        return array[index];
    }

    void add(int childId) {
        ensureCapacity(size + 1);
        array[size++] = childId;
    }

    void clear() {
        size = 0;
    }

    public int[] toArray() {
        return size == 0 ? EMPTY : Arrays.copyOf(array, size);
    }

    private void ensureCapacity(int capacity) {
        if (array.length >= capacity) {
            return;
        }
        int newCap = Math.max(capacity, array.length * 2 + 1);
        array = Arrays.copyOf(array, newCap);
    }

    @Override
    public String toString() {
        return Arrays.toString(toArray());
    }
}
