// file: core/src/main/java/io/structlang/core/ErrorKind.java
package io.structlang.core;

import java.util.Locale;

/**
 * Failure categories shared by the parser, the validator and the engines.
 * <p>
 * Every failure in the interpreter is recoverable: it is reported to the
 * caller as a typed outcome and never terminates the process.
 */
public enum ErrorKind {
    /** Malformed statement: missing keyword, bad literal, unbalanced quotes. */
    PARSE,
    /** Operating on a structure that has not been created. */
    PRECONDITION,
    /** Command domain does not match the active context. */
    CONTEXT,
    /** Verb is not legal for the target structure kind. */
    UNSUPPORTED_OPERATION,
    /** Position outside the valid range of a linear structure. */
    INDEX,
    /** Tree path does not resolve to the required node or slot. */
    INVALID_PATH,
    /** Bounded array list is full. */
    CAPACITY,
    /** Value already present in a search tree. */
    DUPLICATE,
    /** Looked-up value is absent. */
    NOT_FOUND,
    /** Value to delete is absent. */
    DELETE,
    /** pop/peek on an empty stack. */
    EMPTY,
    /** Argument rejected by an engine (for example a non-positive frequency). */
    INVALID_ARGUMENT,
    /** Huffman encode of a character that has no leaf. */
    UNKNOWN_CHARACTER,
    /** Huffman decode of a bit string that does not map to leaves. */
    DECODE,
    /** Unexpected engine failure; indicates a bug, still reported as a result. */
    INTERNAL;

    /** Lowercase wire name, e.g. {@code "invalid_path"}. */
    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }
}
