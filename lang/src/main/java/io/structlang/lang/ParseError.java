// file: lang/src/main/java/io/structlang/lang/ParseError.java
package io.structlang.lang;

import java.util.Objects;

/**
 * Why a statement could not be parsed.
 *
 * @param statement the offending statement text
 * @param reason    human-readable explanation
 */
public record ParseError(String statement, String reason) {
    public ParseError {
        Objects.requireNonNull(statement, "statement");
        Objects.requireNonNull(reason, "reason");
    }

    public String message() {
        return "cannot parse '" + statement + "': " + reason;
    }
}
