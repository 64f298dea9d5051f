// file: core/src/main/java/io/structlang/core/StructureException.java
package io.structlang.core;

import java.util.Objects;

/**
 * Thrown by structure engines when an operation cannot be applied.
 * <p>
 * Contract: engines validate every precondition before touching state, so
 * a thrown StructureException always means the structure is unchanged.
 */
public class StructureException extends RuntimeException {

    private final ErrorKind kind;

    public StructureException(ErrorKind kind, String message) {
        super(message);
        this.kind = Objects.requireNonNull(kind, "kind");
    }

    public ErrorKind kind() {
        return kind;
    }

    /** For a {@code size N} clause with N <= 0; every linear kind rejects it. */
    public static StructureException invalidCapacity(int capacity) {
        return new StructureException(ErrorKind.INVALID_ARGUMENT, "capacity must be > 0, got " + capacity);
    }

    public static StructureException indexOutOfRange(int position, int lastValid) {
        return new StructureException(
                ErrorKind.INDEX,
                "position %d out of range [0, %d]".formatted(position, lastValid)
        );
    }
}
