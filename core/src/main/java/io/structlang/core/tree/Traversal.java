// file: core/src/main/java/io/structlang/core/tree/Traversal.java
package io.structlang.core.tree;

import java.util.Locale;
import java.util.Optional;

/** Traversal orders accepted by {@code traverse}. */
public enum Traversal {
    PREORDER, INORDER, POSTORDER, LEVELORDER;

    public String keyword() {
        return name().toLowerCase(Locale.ROOT);
    }

    public static Optional<Traversal> fromKeyword(String word) {
        for (Traversal t : values()) {
            if (t.keyword().equals(word)) {
                return Optional.of(t);
            }
        }
        return Optional.empty();
    }
}
