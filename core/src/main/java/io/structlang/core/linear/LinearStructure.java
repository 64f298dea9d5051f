// file: core/src/main/java/io/structlang/core/linear/LinearStructure.java
package io.structlang.core.linear;

import io.structlang.core.Structure;

import java.util.List;

/**
 * Operations shared by every linear structure.
 * <p>
 * Positions are 0-based. Every operation is atomic: it either applies fully
 * or throws a {@link io.structlang.core.StructureException} and leaves the
 * structure untouched.
 */
public interface LinearStructure extends Structure {

    /**
     * Insert {@code value} so that it ends up at {@code position}.
     * Valid positions are [0, size()]; size() appends.
     */
    void insert(int value, int position);

    /**
     * Remove the first element equal to {@code value}.
     *
     * @return the position the element was removed from
     */
    int delete(int value);

    /**
     * Remove the element at {@code position}.
     *
     * @return the removed value
     */
    int deleteAt(int position);

    /** Position of the first element equal to {@code value}; NOT_FOUND when absent. */
    int indexOf(int value);

    /** Element at {@code position}. */
    int get(int position);

    /** Elements in order (for a stack: bottom to top). */
    List<Integer> toList();
}
