package software.amazon.keyword.matcher;

import java.util.Arrays;
import java.util.Iterator;
import java.util.NoSuchElementException;

/**
 * The outgoing transitions of a single state: a primitive map from Unicode code point to the id of the child state.
 * Code points and state ids are both non-negative, which lets a key-value pair share one long cell. There is no
 * removal, since a trie only ever grows until it is linked.
 */
class CodePointMap {

    // taken from FastUtil
    private static final int INT_PHI = 0x9E3779B9;

    private static final long KEY_MASK = 0xFFFFFFFFL;
    private static final long EMPTY_CELL = -1 & KEY_MASK;

    static final int NO_STATE = -1;
    private static final float LOAD_FACTOR = 0.75f;

    /**
     * Most trie states have one or two children, so start small. Must be a power of two.
     */
    private static final int INITIAL_CAPACITY = 2;

    /**
     * The highest 32 bits of a cell hold the state id, the lowest 32 bits hold the code point. Length is always a power
     * of two so that {@link #mask} works.
     */
    private long[] table;

    private int threshold;
    private int size;
    private int mask;

    CodePointMap() {
        this.mask = INITIAL_CAPACITY - 1;
        this.table = makeTable(INITIAL_CAPACITY);
        this.threshold = (int) (INITIAL_CAPACITY * LOAD_FACTOR);
    }

    /**
     * Gets the child state for {@code codePoint}.
     *
     * @param codePoint the code point of the transition
     * @return the id of the child state, or {@link #NO_STATE} if there is no transition on {@code codePoint}
     */
    int get(final int codePoint) {
        int idx = getStartIndex(codePoint);
        do {
            long cell = table[idx];
            if (cell == EMPTY_CELL) {
                return NO_STATE;
            }
            if (((int) (cell & KEY_MASK)) == codePoint) {
                return (int) (cell >> 32);
            }
            idx = getNextIndex(idx);
        } while (true);
    }

    boolean containsKey(final int codePoint) {
        return get(codePoint) != NO_STATE;
    }

    /**
     * Maps {@code codePoint} to {@code stateId}.
     *
     * @param codePoint a valid Unicode code point
     * @param stateId the non-negative id of the child state
     * @return the state previously mapped to {@code codePoint}, or {@link #NO_STATE}
     * @throws IllegalArgumentException if either argument is out of range
     */
    int put(final int codePoint, final int stateId) {
        if (!Character.isValidCodePoint(codePoint)) {
            throw new IllegalArgumentException("Not a valid code point: " + codePoint);
        }
        if (stateId < 0) {
            throw new IllegalArgumentException("State id cannot be negative");
        }
        long cellToPut = (((long) codePoint) & KEY_MASK) | (((long) stateId) << 32);
        int idx = getStartIndex(codePoint);
        do {
            long cell = table[idx];
            if (cell == EMPTY_CELL) {
                table[idx] = cellToPut;
                if (size >= threshold) {
                    rehash(table.length * 2);
                    // 'size' is recounted inside rehash()
                } else {
                    size++;
                }
                return NO_STATE;
            }
            if (((int) (cell & KEY_MASK)) == codePoint) {
                table[idx] = cellToPut;
                return (int) (cell >> 32);
            }
            idx = getNextIndex(idx);
        } while (true);
    }

    int size() {
        return size;
    }

    /**
     * Iteration order follows the hash table layout. It is stable for a given set of puts, but callers that need a
     * canonical order must sort.
     */
    Iterable<Transition> transitions() {
        return TransitionIterator::new;
    }

    private void rehash(final int newCapacity) {
        threshold = (int) (newCapacity * LOAD_FACTOR);
        mask = newCapacity - 1;

        final long[] oldTable = table;
        table = makeTable(newCapacity);
        size = 0;

        for (int i = oldTable.length - 1; i >= 0; i--) {
            if (oldTable[i] != EMPTY_CELL) {
                put((int) (oldTable[i] & KEY_MASK), (int) (oldTable[i] >> 32));
            }
        }
    }

    private static long[] makeTable(final int capacity) {
        long[] result = new long[capacity];
        Arrays.fill(result, EMPTY_CELL);
        return result;
    }

    private int getStartIndex(final int codePoint) {
        return phiMix(codePoint) & mask;
    }

    private int getNextIndex(final int currentIndex) {
        return (currentIndex + 1) & mask;
    }

    private static int phiMix(final int val) {
        final int h = val * INT_PHI;
        return h ^ (h >> 16);
    }

    /**
     * One labeled edge of the trie.
     */
    static final class Transition {
        private final int codePoint;
        private final int target;

        private Transition(int codePoint, int target) {
            this.codePoint = codePoint;
            this.target = target;
        }

        int getCodePoint() {
            return codePoint;
        }

        int getTarget() {
            return target;
        }

        @Override
        public String toString() {
            return new String(Character.toChars(codePoint)) + "->" + target;
        }
    }

    private class TransitionIterator implements Iterator<Transition> {
        private int remaining = size;
        private int idx = 0;

        @Override
        public boolean hasNext() {
            return remaining > 0;
        }

        @Override
        public Transition next() {
            if (remaining <= 0) {
                throw new NoSuchElementException();
            }
            while (table[idx] == EMPTY_CELL) {
                idx++;
            }
            long cell = table[idx++];
            remaining--;
            return new Transition((int) (cell & KEY_MASK), (int) (cell >> 32));
        }
    }
}
