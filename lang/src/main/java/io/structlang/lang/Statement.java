// file: lang/src/main/java/io/structlang/lang/Statement.java
package io.structlang.lang;

import java.util.Objects;

/**
 * One statement of a script.
 *
 * @param line 1-based source line the statement came from
 * @param text statement text, trimmed
 */
public record Statement(int line, String text) {
    public Statement {
        Objects.requireNonNull(text, "text");
        if (line < 1) {
            throw new IllegalArgumentException("line must be >= 1");
        }
    }
}
