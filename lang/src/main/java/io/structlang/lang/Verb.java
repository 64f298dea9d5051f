// file: lang/src/main/java/io/structlang/lang/Verb.java
package io.structlang.lang;

import java.util.Locale;
import java.util.Optional;

/** Command verbs, by their statement keyword. */
public enum Verb {
    CREATE, INSERT, DELETE, GET, PUSH, POP, PEEK, SEARCH, TRAVERSE, BUILD, ENCODE, DECODE, CLEAR;

    public String keyword() {
        return name().toLowerCase(Locale.ROOT);
    }

    public static Optional<Verb> fromKeyword(String word) {
        for (Verb v : values()) {
            if (v.keyword().equals(word)) {
                return Optional.of(v);
            }
        }
        return Optional.empty();
    }
}
