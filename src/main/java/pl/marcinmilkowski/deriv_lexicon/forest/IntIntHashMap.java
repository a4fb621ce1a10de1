package pl.marcinmilkowski.deriv_lexicon.forest;

import java.util.Arrays;

/**
 * Primitive hash map from non-negative int -> int using open addressing.
 *
 * Used to resolve stated lexeme ids to line positions while building.
 */
final class IntIntHashMap {

    private static final int EMPTY = -1;

    private int[] keys;
    private int[] values;
    private int size;
    private int mask;
    private int resizeAt;

    IntIntHashMap(int expectedSize) {
        int cap = 1;
        int need = Math.max(4, (int) (expectedSize / 0.65) + 1);
        while (cap < need) cap <<= 1;
        init(cap);
    }

    private void init(int capacity) {
        keys = new int[capacity];
        values = new int[capacity];
        Arrays.fill(keys, EMPTY);
        size = 0;
        mask = capacity - 1;
        resizeAt = (int) (capacity * 0.65);
    }

    int size() {
        return size;
    }

    /**
     * @return true if the key was absent and the value stored
     */
    boolean putIfAbsent(int key, int value) {
        if (key < 0) {
            throw new IllegalArgumentException("Key must be non-negative: " + key);
        }
        if (size >= resizeAt) {
            rehash(keys.length * 2);
        }

        int slot = mix32(key) & mask;
        while (true) {
            int k = keys[slot];
            if (k == EMPTY) {
                keys[slot] = key;
                values[slot] = value;
                size++;
                return true;
            }
            if (k == key) {
                return false;
            }
            slot = (slot + 1) & mask;
        }
    }

    int get(int key, int missingValue) {
        if (key < 0) {
            return missingValue;
        }
        int slot = mix32(key) & mask;
        while (true) {
            int k = keys[slot];
            if (k == EMPTY) {
                return missingValue;
            }
            if (k == key) {
                return values[slot];
            }
            slot = (slot + 1) & mask;
        }
    }

    private void rehash(int newCapacity) {
        int[] oldKeys = keys;
        int[] oldValues = values;

        init(newCapacity);

        for (int i = 0; i < oldKeys.length; i++) {
            int k = oldKeys[i];
            if (k == EMPTY) continue;

            int slot = mix32(k) & mask;
            while (keys[slot] != EMPTY) {
                slot = (slot + 1) & mask;
            }
            keys[slot] = k;
            values[slot] = oldValues[i];
            size++;
        }
    }

    // Murmur3 fmix32
    private static int mix32(int h) {
        h ^= h >>> 16;
        h *= 0x85ebca6b;
        h ^= h >>> 13;
        h *= 0xc2b2ae35;
        h ^= h >>> 16;
        return h;
    }
}
