package io.sentex.index;

import java.util.AbstractList;
import java.util.Arrays;
import java.util.List;
import java.util.RandomAccess;

/**
 * Growable list of sentence positions for one token, in insertion order.
 * <p>
 * Unlike a row id set this is a <b>list</b>: a position is appended once per
 * occurrence, so a sentence containing a token twice appears twice.
 */
public final class PostingList {
    private static final int DEFAULT_CAPACITY = 4;

    private int[] positions;
    private int size;
    private final List<Integer> view = new View();

    public PostingList() {
        this.positions = new int[DEFAULT_CAPACITY];
    }

    public void add(int position) {
        if (position < 0) {
            throw new IllegalArgumentException("position must be non-negative: " + position);
        }
        if (size == positions.length) {
            positions = Arrays.copyOf(positions, positions.length * 2);
        }
        positions[size++] = position;
    }

    public int get(int index) {
        if (index < 0 || index >= size) {
            throw new IndexOutOfBoundsException("index " + index + " out of bounds for size " + size);
        }
        return positions[index];
    }

    public int size() {
        return size;
    }

    public int[] toArray() {
        return Arrays.copyOf(positions, size);
    }

    /**
     * Read-only view that tracks later additions.
     */
    public List<Integer> asList() {
        return view;
    }

    private final class View extends AbstractList<Integer> implements RandomAccess {
        @Override
        public Integer get(int index) {
            return PostingList.this.get(index);
        }

        @Override
        public int size() {
            return size;
        }
    }
}
