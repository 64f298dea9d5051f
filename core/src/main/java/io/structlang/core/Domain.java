// file: core/src/main/java/io/structlang/core/Domain.java
package io.structlang.core;

import java.util.Locale;
import java.util.Optional;

/**
 * The two command categories. Each structure kind belongs to exactly one,
 * and the workspace has exactly one active domain at a time.
 */
public enum Domain {
    LINEAR("linear"),
    TREE("tree");

    private final String wireName;

    Domain(String wireName) {
        this.wireName = wireName;
    }

    public String wireName() {
        return wireName;
    }

    public static Optional<Domain> fromWireName(String name) {
        if (name == null) return Optional.empty();
        for (Domain d : values()) {
            if (d.wireName.equals(name.trim().toLowerCase(Locale.ROOT))) {
                return Optional.of(d);
            }
        }
        return Optional.empty();
    }
}
