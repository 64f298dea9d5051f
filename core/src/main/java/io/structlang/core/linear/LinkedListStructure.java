// file: core/src/main/java/io/structlang/core/linear/LinkedListStructure.java
package io.structlang.core.linear;

import io.structlang.core.ErrorKind;
import io.structlang.core.StructureException;
import io.structlang.core.StructureKind;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.OptionalInt;

/**
 * Singly linked list stored as a node arena.
 * <p>
 * Layout:
 *  - values[i] / next[i] describe node i,
 *  - head is the index of the first node, NIL when empty,
 *  - released slots are chained through next[] starting at freeHead.
 * <p>
 * Invariant: following next from head reaches NIL in exactly size() steps.
 */
public final class LinkedListStructure implements LinearStructure {

    private static final int NIL = -1;

    private int[] values;
    private int[] next;
    private int head = NIL;
    private int freeHead = NIL;
    private int used;   // slots ever handed out (high-water mark)
    private int size;

    public LinkedListStructure(List<Integer> initial) {
        this(initial, OptionalInt.empty());
    }

    /** {@code capacity}, when given, must be positive; it only sizes the initial node arena. */
    public LinkedListStructure(List<Integer> initial, OptionalInt capacity) {
        if (capacity.isPresent() && capacity.getAsInt() <= 0) {
            throw StructureException.invalidCapacity(capacity.getAsInt());
        }
        int cap = Math.max(capacity.orElse(8), initial.size());
        this.values = new int[cap];
        this.next = new int[cap];
        int tail = NIL;
        for (int v : initial) {
            int n = allocate(v);
            if (tail == NIL) {
                head = n;
            } else {
                next[tail] = n;
            }
            tail = n;
            size++;
        }
    }

    @Override
    public StructureKind kind() {
        return StructureKind.LINKEDLIST;
    }

    @Override
    public void insert(int value, int position) {
        if (position < 0 || position > size) {
            throw StructureException.indexOutOfRange(position, size);
        }
        int n = allocate(value);
        if (position == 0) {
            next[n] = head;
            head = n;
        } else {
            int prev = nodeAt(position - 1);
            next[n] = next[prev];
            next[prev] = n;
        }
        size++;
    }

    @Override
    public int delete(int value) {
        int prev = NIL;
        int cur = head;
        int idx = 0;
        while (cur != NIL) {
            if (values[cur] == value) {
                unlink(prev, cur);
                return idx;
            }
            prev = cur;
            cur = next[cur];
            idx++;
        }
        throw new StructureException(ErrorKind.DELETE, "value %d not present".formatted(value));
    }

    @Override
    public int deleteAt(int position) {
        if (position < 0 || position >= size) {
            throw StructureException.indexOutOfRange(position, size - 1);
        }
        int prev = position == 0 ? NIL : nodeAt(position - 1);
        int victim = prev == NIL ? head : next[prev];
        int removed = values[victim];
        unlink(prev, victim);
        return removed;
    }

    @Override
    public int indexOf(int value) {
        int idx = 0;
        for (int cur = head; cur != NIL; cur = next[cur]) {
            if (values[cur] == value) return idx;
            idx++;
        }
        throw new StructureException(ErrorKind.NOT_FOUND, "value %d not found".formatted(value));
    }

    @Override
    public int get(int position) {
        if (position < 0 || position >= size) {
            throw StructureException.indexOutOfRange(position, size - 1);
        }
        return values[nodeAt(position)];
    }

    @Override
    public int size() {
        return size;
    }

    @Override
    public List<Integer> toList() {
        List<Integer> out = new ArrayList<>(size);
        for (int cur = head; cur != NIL; cur = next[cur]) {
            out.add(values[cur]);
        }
        return List.copyOf(out);
    }

    // ---------- arena ----------

    private int nodeAt(int position) {
        int cur = head;
        for (int i = 0; i < position; i++) {
            cur = next[cur];
        }
        return cur;
    }

    private void unlink(int prev, int victim) {
        if (prev == NIL) {
            head = next[victim];
        } else {
            next[prev] = next[victim];
        }
        next[victim] = freeHead;
        freeHead = victim;
        size--;
    }

    private int allocate(int value) {
        int n;
        if (freeHead != NIL) {
            n = freeHead;
            freeHead = next[n];
        } else {
            if (used == values.length) {
                values = Arrays.copyOf(values, values.length * 2);
                next = Arrays.copyOf(next, next.length * 2);
            }
            n = used++;
        }
        values[n] = value;
        next[n] = NIL;
        return n;
    }
}
