// file: server/src/main/java/io/structlang/server/interpreter/Outcome.java
package io.structlang.server.interpreter;

import io.structlang.core.ErrorKind;

import java.util.Objects;

/**
 * Result of one statement: either {@code ok} with optional data, or a
 * failure with an {@link ErrorKind}. Never both.
 *
 * @param data JSON-serializable payload (element, list, map, record) or null
 */
public record Outcome(boolean ok, ErrorKind errorKind, String message, Object data) {

    public Outcome {
        Objects.requireNonNull(message, "message");
        if (ok == (errorKind != null)) {
            throw new IllegalArgumentException("ok outcomes carry no error kind; failures must");
        }
        if (!ok && data != null) {
            throw new IllegalArgumentException("failures carry no data");
        }
    }

    public static Outcome success(String message, Object data) {
        return new Outcome(true, null, message, data);
    }

    public static Outcome success(String message) {
        return new Outcome(true, null, message, null);
    }

    public static Outcome failure(ErrorKind kind, String message) {
        return new Outcome(false, Objects.requireNonNull(kind, "kind"), message, null);
    }
}
