// file: lang/src/main/java/io/structlang/lang/SyntaxException.java
package io.structlang.lang;

/**
 * Raised inside the parser on malformed input. Never leaves
 * {@link CommandParser#parse(String)}; it is turned into a {@link ParseError}.
 */
final class SyntaxException extends RuntimeException {
    SyntaxException(String message) {
        super(message);
    }
}
