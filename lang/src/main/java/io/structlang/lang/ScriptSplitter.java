// file: lang/src/main/java/io/structlang/lang/ScriptSplitter.java
package io.structlang.lang;

import java.util.ArrayList;
import java.util.List;

/**
 * Cuts a multi-line script into statements.
 * <p>
 * Rules:
 *  - every line is split on ';', except where the ';' sits inside a
 *    double-quoted string (a backslash escapes the next character there),
 *  - a statement never spans lines,
 *  - statements that are blank or start with '#' or '//' are dropped,
 *  - script order is kept.
 * An unterminated quote simply runs to the end of its line; the parser
 * reports it when that statement is parsed.
 */
public final class ScriptSplitter {

    private ScriptSplitter() {
    }

    public static List<Statement> split(String script) {
        List<Statement> out = new ArrayList<>();
        if (script == null || script.isEmpty()) {
            return out;
        }
        String[] lines = script.split("\r\n|\r|\n", -1);
        for (int i = 0; i < lines.length; i++) {
            for (String piece : splitLine(lines[i])) {
                String text = piece.strip();
                if (text.isEmpty() || text.startsWith("#") || text.startsWith("//")) {
                    continue;
                }
                out.add(new Statement(i + 1, text));
            }
        }
        return out;
    }

    private static List<String> splitLine(String line) {
        List<String> pieces = new ArrayList<>();
        StringBuilder cur = new StringBuilder();
        boolean quoted = false;
        for (int i = 0; i < line.length(); i++) {
            char c = line.charAt(i);
            if (quoted && c == '\\' && i + 1 < line.length()) {
                cur.append(c).append(line.charAt(++i));
                continue;
            }
            if (c == '"') {
                quoted = !quoted;
            } else if (c == ';' && !quoted) {
                pieces.add(cur.toString());
                cur.setLength(0);
                continue;
            }
            cur.append(c);
        }
        pieces.add(cur.toString());
        return pieces;
    }
}
