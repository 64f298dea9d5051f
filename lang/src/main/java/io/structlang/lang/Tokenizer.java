// file: lang/src/main/java/io/structlang/lang/Tokenizer.java
package io.structlang.lang;

import java.util.ArrayList;
import java.util.List;

/**
 * Statement tokenizer.
 * <p>
 * Token classes:
 *  - WORD:   [A-Za-z_][A-Za-z0-9_]*  (keywords are matched case-sensitively later)
 *  - INT:    optional sign followed by decimal digits; leading zeros are kept
 *            verbatim so bit strings survive
 *  - COMMA, COLON, DOT
 *  - STRING: double-quoted text; backslash escapes '"' and '\'
 * Whitespace separates tokens and is otherwise ignored.
 */
final class Tokenizer {

    private Tokenizer() {
    }

    static List<Token> tokenize(String in) {
        List<Token> out = new ArrayList<>();
        int i = 0;
        int n = in.length();
        while (i < n) {
            char c = in.charAt(i);
            int start = i;
            if (Character.isWhitespace(c)) {
                i++;
            } else if (isWordStart(c)) {
                while (i < n && isWordPart(in.charAt(i))) i++;
                out.add(new Token(Token.Type.WORD, in.substring(start, i), start + 1));
            } else if (isDigit(c) || ((c == '-' || c == '+') && i + 1 < n && isDigit(in.charAt(i + 1)))) {
                i++;
                while (i < n && isDigit(in.charAt(i))) i++;
                if (i < n && isWordStart(in.charAt(i))) {
                    throw new SyntaxException("malformed number at column %d".formatted(start + 1));
                }
                out.add(new Token(Token.Type.INT, in.substring(start, i), start + 1));
            } else if (c == ',') {
                out.add(new Token(Token.Type.COMMA, ",", ++i));
            } else if (c == ':') {
                out.add(new Token(Token.Type.COLON, ":", ++i));
            } else if (c == '.') {
                out.add(new Token(Token.Type.DOT, ".", ++i));
            } else if (c == '"') {
                i = readString(in, i, out);
            } else {
                throw new SyntaxException("unexpected character '%c' at column %d".formatted(c, i + 1));
            }
        }
        return out;
    }

    /** Reads the string starting at the opening quote; returns the index after the closing quote. */
    private static int readString(String in, int open, List<Token> out) {
        StringBuilder sb = new StringBuilder();
        int i = open + 1;
        while (i < in.length()) {
            char c = in.charAt(i);
            if (c == '\\' && i + 1 < in.length()) {
                char e = in.charAt(i + 1);
                if (e == '"' || e == '\\') {
                    sb.append(e);
                } else {
                    sb.append(c).append(e);
                }
                i += 2;
            } else if (c == '"') {
                out.add(new Token(Token.Type.STRING, sb.toString(), open + 1));
                return i + 1;
            } else {
                sb.append(c);
                i++;
            }
        }
        throw new SyntaxException("unbalanced quote starting at column %d".formatted(open + 1));
    }

    private static boolean isWordStart(char c) {
        return (c >= 'a' && c <= 'z') || (c >= 'A' && c <= 'Z') || c == '_';
    }

    private static boolean isWordPart(char c) {
        return isWordStart(c) || isDigit(c);
    }

    private static boolean isDigit(char c) {
        return c >= '0' && c <= '9';
    }
}
