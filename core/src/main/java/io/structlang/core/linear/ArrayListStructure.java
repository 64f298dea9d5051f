// file: core/src/main/java/io/structlang/core/linear/ArrayListStructure.java
package io.structlang.core.linear;

import io.structlang.core.ErrorKind;
import io.structlang.core.StructureException;
import io.structlang.core.StructureKind;

import java.util.List;
import java.util.OptionalInt;

/**
 * Dynamic array list.
 * <p>
 * Without an explicit capacity the backing array doubles when full. With a
 * capacity (the {@code size N} clause) size() is bounded and an insert past
 * the bound fails with CAPACITY.
 */
public final class ArrayListStructure extends ArrayBackedStructure {

    private final OptionalInt capacity;

    public ArrayListStructure(List<Integer> initial, OptionalInt capacity) {
        super(capacity.isPresent() ? capacity.getAsInt() : Math.max(DEFAULT_CAPACITY, initial.size()));
        if (capacity.isPresent() && capacity.getAsInt() <= 0) {
            throw StructureException.invalidCapacity(capacity.getAsInt());
        }
        if (capacity.isPresent() && initial.size() > capacity.getAsInt()) {
            throw new StructureException(
                    ErrorKind.CAPACITY,
                    "%d initial values exceed capacity %d".formatted(initial.size(), capacity.getAsInt())
            );
        }
        this.capacity = capacity;
        for (int v : initial) {
            data[size++] = v;
        }
    }

    public static ArrayListStructure empty() {
        return new ArrayListStructure(List.of(), OptionalInt.empty());
    }

    @Override
    public StructureKind kind() {
        return StructureKind.ARRAYLIST;
    }

    public OptionalInt capacity() {
        return capacity;
    }

    @Override
    protected void ensureRoomForOne() {
        if (capacity.isPresent() && size >= capacity.getAsInt()) {
            throw new StructureException(
                    ErrorKind.CAPACITY,
                    "arraylist is full (capacity %d)".formatted(capacity.getAsInt())
            );
        }
        if (size == data.length) {
            grow();
        }
    }
}
