// file: core/src/main/java/io/structlang/core/linear/ArrayBackedStructure.java
package io.structlang.core.linear;

import io.structlang.core.ErrorKind;
import io.structlang.core.StructureException;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * Contiguous int storage shared by {@link ArrayListStructure} and
 * {@link StackStructure}.
 * <p>
 * Subclasses decide what happens when the backing array is full through
 * {@link #ensureRoomForOne()}: grow, or refuse with CAPACITY.
 */
abstract class ArrayBackedStructure implements LinearStructure {

    static final int DEFAULT_CAPACITY = 10;

    protected int[] data;
    protected int size;

    ArrayBackedStructure(int initialCapacity) {
        this.data = new int[Math.max(1, initialCapacity)];
    }

    /** Make sure one more element fits, or throw without mutating. */
    protected abstract void ensureRoomForOne();

    @Override
    public void insert(int value, int position) {
        if (position < 0 || position > size) {
            throw StructureException.indexOutOfRange(position, size);
        }
        ensureRoomForOne();
        System.arraycopy(data, position, data, position + 1, size - position);
        data[position] = value;
        size++;
    }

    @Override
    public int delete(int value) {
        int idx = find(value);
        if (idx < 0) {
            throw new StructureException(ErrorKind.DELETE, "value %d not present".formatted(value));
        }
        removeAt(idx);
        return idx;
    }

    @Override
    public int deleteAt(int position) {
        checkElementIndex(position);
        return removeAt(position);
    }

    @Override
    public int indexOf(int value) {
        int idx = find(value);
        if (idx < 0) {
            throw new StructureException(ErrorKind.NOT_FOUND, "value %d not found".formatted(value));
        }
        return idx;
    }

    @Override
    public int get(int position) {
        checkElementIndex(position);
        return data[position];
    }

    @Override
    public int size() {
        return size;
    }

    @Override
    public List<Integer> toList() {
        List<Integer> out = new ArrayList<>(size);
        for (int i = 0; i < size; i++) {
            out.add(data[i]);
        }
        return List.copyOf(out);
    }

    // ---------- helpers ----------

    protected int removeAt(int position) {
        int removed = data[position];
        System.arraycopy(data, position + 1, data, position, size - position - 1);
        size--;
        return removed;
    }

    protected void grow() {
        data = Arrays.copyOf(data, data.length * 2);
    }

    protected void checkElementIndex(int position) {
        if (position < 0 || position >= size) {
            throw StructureException.indexOutOfRange(position, size - 1);
        }
    }

    private int find(int value) {
        for (int i = 0; i < size; i++) {
            if (data[i] == value) return i;
        }
        return -1;
    }
}
