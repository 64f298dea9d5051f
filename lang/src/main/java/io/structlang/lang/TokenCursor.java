// file: lang/src/main/java/io/structlang/lang/TokenCursor.java
package io.structlang.lang;

import io.structlang.core.StructureKind;
import io.structlang.core.tree.SymbolFrequency;
import io.structlang.core.tree.Traversal;

import java.util.ArrayList;
import java.util.List;

/**
 * Forward-only reader over one statement's tokens.
 * Every {@code expect*} / typed read throws {@link SyntaxException} on mismatch.
 */
final class TokenCursor {

    private final List<Token> tokens;
    private int pos;

    TokenCursor(List<Token> tokens) {
        this.tokens = tokens;
    }

    boolean atEnd() {
        return pos >= tokens.size();
    }

    Token peek() {
        return atEnd() ? null : tokens.get(pos);
    }

    Token peek(int ahead) {
        int i = pos + ahead;
        return i < tokens.size() ? tokens.get(i) : null;
    }

    boolean peekWord(String word) {
        Token t = peek();
        return t != null && t.isWord(word);
    }

    boolean acceptWord(String word) {
        if (peekWord(word)) {
            pos++;
            return true;
        }
        return false;
    }

    void expectWord(String word) {
        if (!acceptWord(word)) {
            throw unexpected("'" + word + "'");
        }
    }

    Token expect(Token.Type type, String what) {
        Token t = peek();
        if (t == null || t.type() != type) {
            throw unexpected(what);
        }
        pos++;
        return t;
    }

    String word(String what) {
        return expect(Token.Type.WORD, what).text();
    }

    int integer(String what) {
        return toInt(expect(Token.Type.INT, what));
    }

    /** INT (',' INT)* */
    List<Integer> intList(String what) {
        List<Integer> out = new ArrayList<>();
        out.add(integer(what));
        while (accept(Token.Type.COMMA)) {
            out.add(integer(what));
        }
        return out;
    }

    /** 0/1 (',' 0/1)* */
    List<Integer> path() {
        List<Integer> steps = intList("path step");
        for (int step : steps) {
            if (step != 0 && step != 1) {
                throw new SyntaxException("path steps must be 0 or 1, got " + step);
            }
        }
        return steps;
    }

    /** CHAR ':' INT (',' CHAR ':' INT)* where CHAR is one letter or digit. */
    List<SymbolFrequency> frequencyList() {
        List<SymbolFrequency> out = new ArrayList<>();
        do {
            Token sym = peek();
            if (sym == null || (sym.type() != Token.Type.WORD && sym.type() != Token.Type.INT)) {
                throw unexpected("character:frequency pair");
            }
            if (sym.text().length() != 1) {
                throw new SyntaxException("frequency key must be a single character, got " + sym.describe());
            }
            pos++;
            expect(Token.Type.COLON, "':'");
            out.add(new SymbolFrequency(sym.text().charAt(0), integer("frequency")));
        } while (accept(Token.Type.COMMA));
        return out;
    }

    /** Unsigned run of digits, kept verbatim. Accepts a quoted form too. */
    String bits() {
        Token t = peek();
        if (t != null && t.type() == Token.Type.STRING) {
            pos++;
            return t.text();
        }
        Token digits = expect(Token.Type.INT, "bit string");
        char first = digits.text().charAt(0);
        if (first == '-' || first == '+') {
            throw new SyntaxException("bit string cannot be signed");
        }
        return digits.text();
    }

    StructureKind structureName() {
        Token t = peek();
        if (t == null || t.type() != Token.Type.WORD) {
            throw unexpected("structure name");
        }
        pos++;
        return StructureKind.fromKeyword(t.text())
                .orElseThrow(() -> new SyntaxException(
                        "unknown structure " + t.describe()
                                + " (expected arraylist, linkedlist, stack, binarytree, bst, avl or huffman)"));
    }

    Traversal traversal() {
        Token t = peek();
        if (t == null || t.type() != Token.Type.WORD) {
            throw unexpected("traversal order");
        }
        pos++;
        return Traversal.fromKeyword(t.text())
                .orElseThrow(() -> new SyntaxException(
                        "unknown traversal " + t.describe() + " (expected preorder, inorder, postorder or levelorder)"));
    }

    void expectEnd() {
        if (!atEnd()) {
            throw new SyntaxException("unexpected " + peek().describe() + " at column " + peek().column());
        }
    }

    SyntaxException unexpected(String expected) {
        Token t = peek();
        String found = t == null ? "end of statement" : t.describe() + " at column " + t.column();
        return new SyntaxException("expected " + expected + " but found " + found);
    }

    // ---------- helpers ----------

    private boolean accept(Token.Type type) {
        Token t = peek();
        if (t != null && t.type() == type) {
            pos++;
            return true;
        }
        return false;
    }

    private static int toInt(Token t) {
        try {
            return Integer.parseInt(t.text());
        } catch (NumberFormatException e) {
            throw new SyntaxException("integer out of range: " + t.text());
        }
    }
}
