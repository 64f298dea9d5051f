// file: lang/src/main/java/io/structlang/lang/Token.java
package io.structlang.lang;

/**
 * Lexical token of a statement.
 *
 * @param type   token class
 * @param text   raw text (for STRING: the unescaped contents, without quotes)
 * @param column 1-based column of the first character
 */
record Token(Type type, String text, int column) {

    enum Type { WORD, INT, COMMA, COLON, DOT, STRING }

    boolean isWord(String word) {
        return type == Type.WORD && text.equals(word);
    }

    String describe() {
        return type == Type.STRING ? "string \"" + text + "\"" : "'" + text + "'";
    }
}
