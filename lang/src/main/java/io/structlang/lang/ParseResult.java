// file: lang/src/main/java/io/structlang/lang/ParseResult.java
package io.structlang.lang;

/**
 * Either a parsed {@link Command} or a {@link ParseError}; exactly one is non-null.
 */
public record ParseResult(Command command, ParseError error) {

    public ParseResult {
        if ((command == null) == (error == null)) {
            throw new IllegalArgumentException("exactly one of command/error must be set");
        }
    }

    public static ParseResult ok(Command command) {
        return new ParseResult(command, null);
    }

    public static ParseResult failed(ParseError error) {
        return new ParseResult(null, error);
    }

    public boolean isOk() {
        return command != null;
    }
}
