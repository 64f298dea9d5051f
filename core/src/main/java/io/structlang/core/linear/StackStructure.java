// file: core/src/main/java/io/structlang/core/linear/StackStructure.java
package io.structlang.core.linear;

import io.structlang.core.ErrorKind;
import io.structlang.core.StructureException;
import io.structlang.core.StructureKind;

import java.util.Arrays;
import java.util.List;
import java.util.OptionalInt;

/**
 * Array-backed LIFO stack. The top is the last element of {@link #toList()}.
 * <p>
 * A requested capacity must be positive and only sizes the initial array;
 * the stack grows past it and shrinks back to half when it drops below a
 * quarter full.
 */
public final class StackStructure extends ArrayBackedStructure {

    public StackStructure(List<Integer> initial, OptionalInt capacity) {
        super(Math.max(capacity.orElse(DEFAULT_CAPACITY), initial.size()));
        if (capacity.isPresent() && capacity.getAsInt() <= 0) {
            throw StructureException.invalidCapacity(capacity.getAsInt());
        }
        for (int v : initial) {
            data[size++] = v;
        }
    }

    @Override
    public StructureKind kind() {
        return StructureKind.STACK;
    }

    /** Append {@code value} on top. */
    public void push(int value) {
        insert(value, size);
    }

    /** Remove and return the top element; EMPTY when there is none. */
    public int pop() {
        requireNotEmpty("pop");
        int top = removeAt(size - 1);
        if (size > 0 && size < data.length / 4) {
            data = Arrays.copyOf(data, Math.max(DEFAULT_CAPACITY, data.length / 2));
        }
        return top;
    }

    /** Return the top element without removing it; EMPTY when there is none. */
    public int peek() {
        requireNotEmpty("peek");
        return data[size - 1];
    }

    @Override
    protected void ensureRoomForOne() {
        if (size == data.length) {
            grow();
        }
    }

    private void requireNotEmpty(String op) {
        if (size == 0) {
            throw new StructureException(ErrorKind.EMPTY, "cannot " + op + ": stack is empty");
        }
    }
}
